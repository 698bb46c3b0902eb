package io.quarkiverse.quarkus.neo4j.identity.runtime.mapping;

import java.lang.reflect.Constructor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping metadata of one entity or relationship type: its labels in
 * most-derived-first order, its mapped properties and its identifier.
 * Instances are obtained through {@link TypeDescriptors#describe(Class)}.
 *
 * @param <T> the described type
 */
public final class TypeDescriptor<T> {

    private final Class<T> type;
    private final List<String> labels;
    private final List<PropertyDescriptor> properties;
    private final Map<String, PropertyDescriptor> propertiesByName;
    private final PropertyDescriptor identifier;
    private final String relationshipType;
    private final Constructor<T> constructor;

    TypeDescriptor(Class<T> type, List<String> labels, List<PropertyDescriptor> properties,
            PropertyDescriptor identifier, String relationshipType, Constructor<T> constructor) {
        this.type = type;
        this.labels = List.copyOf(labels);
        this.properties = List.copyOf(properties);
        this.identifier = identifier;
        this.relationshipType = relationshipType;
        this.constructor = constructor;

        Map<String, PropertyDescriptor> byName = new LinkedHashMap<>();
        for (PropertyDescriptor property : this.properties) {
            byName.put(property.getName(), property);
        }
        this.propertiesByName = byName;
    }

    static <T> TypeDescriptor<T> empty(Class<T> type) {
        return new TypeDescriptor<>(type, List.of(), List.of(), null, null, null);
    }

    public Class<T> getType() {
        return type;
    }

    public String getTypeName() {
        return type == null ? "" : type.getSimpleName();
    }

    public List<String> getLabels() {
        return labels;
    }

    /**
     * @return the mapped properties, identifier excluded
     */
    public List<PropertyDescriptor> getProperties() {
        return properties;
    }

    public List<String> getPropertyNames() {
        return List.copyOf(propertiesByName.keySet());
    }

    public Optional<PropertyDescriptor> getProperty(String name) {
        return Optional.ofNullable(propertiesByName.get(name));
    }

    public Optional<PropertyDescriptor> getIdentifier() {
        return Optional.ofNullable(identifier);
    }

    /**
     * @return whether {@code name} is a mapped property or the identifier
     */
    public boolean isMapped(String name) {
        return propertiesByName.containsKey(name) || (identifier != null && identifier.getName().equals(name));
    }

    /**
     * The single type token used when this type is rendered as a relationship.
     */
    public Optional<String> getRelationshipType() {
        if (relationshipType != null) {
            return Optional.of(relationshipType);
        }
        return labels.isEmpty() ? Optional.empty() : Optional.of(labels.get(0));
    }

    public boolean isEmpty() {
        return labels.isEmpty() && properties.isEmpty();
    }

    Optional<Constructor<T>> getConstructor() {
        return Optional.ofNullable(constructor);
    }

    @Override
    public String toString() {
        return "TypeDescriptor{" + getTypeName() + ", labels=" + labels + ", properties=" + properties + "}";
    }
}
