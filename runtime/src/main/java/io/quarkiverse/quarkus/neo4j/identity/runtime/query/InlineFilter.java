package io.quarkiverse.quarkus.neo4j.identity.runtime.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered property filter rendered inside a node pattern as {@code {k1:$p1, k2:row.k2}}.
 * <p>
 * Keeping parameter names unique within one statement is up to the caller.
 */
public final class InlineFilter {

    private final Map<String, String> entries = new LinkedHashMap<>();

    private InlineFilter() {
    }

    /**
     * Starts a filter matching {@code property} against the query parameter {@code parameter}.
     */
    public static InlineFilter where(String property, String parameter) {
        return new InlineFilter().and(property, parameter);
    }

    /**
     * Starts a filter matching {@code property} against an expression such as {@code row.value}.
     */
    public static InlineFilter whereExpression(String property, String expression) {
        return new InlineFilter().andExpression(property, expression);
    }

    public InlineFilter and(String property, String parameter) {
        requireToken(parameter, "parameter");
        return put(property, "$" + parameter);
    }

    public InlineFilter andExpression(String property, String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Filter expression cannot be empty");
        }
        return put(property, expression);
    }

    Map<String, String> entries() {
        return Collections.unmodifiableMap(entries);
    }

    private InlineFilter put(String property, String reference) {
        requireToken(property, "property");
        if (entries.containsKey(property)) {
            throw new IllegalArgumentException("Property '" + property + "' is already filtered");
        }
        entries.put(property, reference);
        return this;
    }

    private static void requireToken(String token, String what) {
        if (!Patterns.isIdentifier(token)) {
            throw new IllegalArgumentException("Invalid " + what + " name '" + token + "'");
        }
    }
}
