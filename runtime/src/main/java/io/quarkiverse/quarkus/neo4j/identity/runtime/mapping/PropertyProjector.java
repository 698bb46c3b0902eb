package io.quarkiverse.quarkus.neo4j.identity.runtime.mapping;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.quarkiverse.quarkus.neo4j.identity.runtime.enums.ProjectionMode;

/**
 * Projects the current state of an entity into an ordered parameter payload.
 * <p>
 * Only properties known to the entity's {@link TypeDescriptor} are projected, in descriptor order.
 * The identifier is never part of a projection. Values are taken as they are; conversion to
 * driver values happens when the query is dispatched.
 */
public final class PropertyProjector {

    public static Map<String, Object> project(Object instance, ProjectionMode mode, Collection<String> names) {
        if (instance == null) {
            throw new IllegalArgumentException("Instance to project cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("Projection mode cannot be null");
        }
        Set<String> selected = names == null ? Set.of() : Set.copyOf(names);

        TypeDescriptor<?> descriptor = TypeDescriptors.describe(instance.getClass());
        Map<String, Object> projection = new LinkedHashMap<>();
        for (PropertyDescriptor property : descriptor.getProperties()) {
            if (!property.isWritable()) {
                continue;
            }
            boolean listed = selected.contains(property.getName());
            if (mode == ProjectionMode.INCLUDE ? listed : !listed) {
                projection.put(property.getName(), property.read(instance));
            }
        }
        return Collections.unmodifiableMap(projection);
    }

    public static Map<String, Object> include(Object instance, String... names) {
        return project(instance, ProjectionMode.INCLUDE, List.of(names));
    }

    public static Map<String, Object> exclude(Object instance, String... names) {
        return project(instance, ProjectionMode.EXCLUDE, List.of(names));
    }

    /**
     * Projects every writable property.
     */
    public static Map<String, Object> all(Object instance) {
        return project(instance, ProjectionMode.EXCLUDE, List.of());
    }

    private PropertyProjector() {
    }
}
