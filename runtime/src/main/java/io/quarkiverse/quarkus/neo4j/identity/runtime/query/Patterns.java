package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import java.util.Map;
import java.util.regex.Pattern;

import io.quarkiverse.quarkus.neo4j.identity.runtime.enums.Direction;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.TypeDescriptor;

/**
 * Renders node and relationship pattern fragments for embedding into Cypher statements.
 * <p>
 * Labels and relationship types only ever come from {@link TypeDescriptor}s, so no user supplied
 * text ends up in a pattern. Variables and filter keys are checked to be plain identifiers, filter
 * keys must also be mapped by the descriptor.
 */
public final class Patterns {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * @return {@code :Label1:Label2}, or an empty string for a descriptor without labels
     */
    public static String labels(TypeDescriptor<?> descriptor) {
        StringBuilder sb = new StringBuilder();
        for (String label : descriptor.getLabels()) {
            sb.append(':').append(label);
        }
        return sb.toString();
    }

    public static String node(TypeDescriptor<?> descriptor) {
        return node(descriptor, null, null);
    }

    public static String node(TypeDescriptor<?> descriptor, String variable) {
        return node(descriptor, variable, null);
    }

    /**
     * Renders {@code (variable:Label1:Label2 {key:$param, ...})}.
     */
    public static String node(TypeDescriptor<?> descriptor, String variable, InlineFilter filter) {
        requireDescriptor(descriptor);
        StringBuilder sb = new StringBuilder("(");
        appendVariable(sb, variable);
        sb.append(labels(descriptor));
        if (filter != null && !filter.entries().isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (Map.Entry<String, String> entry : filter.entries().entrySet()) {
                if (!descriptor.isMapped(entry.getKey())) {
                    throw new IllegalArgumentException("'" + entry.getKey() + "' is not a property of "
                            + descriptor.getTypeName());
                }
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append(':').append(entry.getValue());
                first = false;
            }
            sb.append('}');
        }
        return sb.append(')').toString();
    }

    public static String relationship(TypeDescriptor<?> descriptor, Direction direction) {
        return relationship(descriptor, null, direction);
    }

    /**
     * Renders {@code -[variable:TYPE]->}, {@code <-[variable:TYPE]-} or {@code -[variable:TYPE]-}.
     * A relationship always carries a single type.
     */
    public static String relationship(TypeDescriptor<?> descriptor, String variable, Direction direction) {
        requireDescriptor(descriptor);
        if (direction == null) {
            throw new IllegalArgumentException("Direction cannot be null");
        }
        StringBuilder body = new StringBuilder("[");
        appendVariable(body, variable);
        descriptor.getRelationshipType().ifPresent(type -> body.append(':').append(type));
        body.append(']');

        return switch (direction) {
            case OUTGOING -> "-" + body + "->";
            case INCOMING -> "<-" + body + "-";
            case UNDIRECTED -> "-" + body + "-";
        };
    }

    static boolean isIdentifier(String token) {
        return token != null && IDENTIFIER.matcher(token).matches();
    }

    private static void appendVariable(StringBuilder sb, String variable) {
        if (variable == null || variable.isEmpty()) {
            return;
        }
        if (!isIdentifier(variable)) {
            throw new IllegalArgumentException("Invalid variable name '" + variable + "'");
        }
        sb.append(variable);
    }

    private static void requireDescriptor(TypeDescriptor<?> descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("Type descriptor cannot be null");
        }
    }

    private Patterns() {
    }
}
