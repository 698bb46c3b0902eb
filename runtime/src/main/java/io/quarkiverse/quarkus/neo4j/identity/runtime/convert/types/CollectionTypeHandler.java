package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.neo4j.driver.Value;

import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandler;
import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.TypeHandlerRegistry;

/**
 * Lists, sets and other collections. Elements are read with the driver's natural types into an
 * instance of the declared collection type. On the way out any collection is sent as a list with
 * each element converted.
 */
public class CollectionTypeHandler implements TypeHandler {

    @Override
    public boolean supports(Class<?> type) {
        return Collection.class.isAssignableFrom(type);
    }

    @Override
    public Object fromGraph(Value value, Class<?> type) {
        List<Object> elements = value.asList();
        Collection<Object> target = newCollection(type);
        target.addAll(elements);
        return target;
    }

    @Override
    public Object toGraph(Object value) {
        Collection<?> source = (Collection<?>) value;
        List<Object> converted = new ArrayList<>(source.size());
        for (Object element : source) {
            converted.add(TypeHandlerRegistry.toGraph(element));
        }
        return converted;
    }

    @SuppressWarnings("unchecked")
    private static Collection<Object> newCollection(Class<?> type) {
        if (!type.isInterface() && !Modifier.isAbstract(type.getModifiers())) {
            try {
                return (Collection<Object>) type.getDeclaredConstructor().newInstance();
            } catch (ReflectiveOperationException e) {
                throw new IllegalArgumentException("Cannot instantiate collection type " + type.getName(), e);
            }
        }
        Collection<Object> collection;
        if (SortedSet.class.isAssignableFrom(type)) {
            collection = new TreeSet<>();
        } else if (Set.class.isAssignableFrom(type)) {
            collection = new LinkedHashSet<>();
        } else if (Queue.class.isAssignableFrom(type)) {
            collection = new ArrayDeque<>();
        } else {
            collection = new ArrayList<>();
        }
        if (!type.isInstance(collection)) {
            throw new IllegalArgumentException("No collection implementation for " + type.getName());
        }
        return collection;
    }
}
