package io.quarkiverse.quarkus.neo4j.identity.runtime.convert;

import java.util.List;
import java.util.Optional;

import io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types.*;

public class TypeHandlerRegistry {

    private static final List<TypeHandler> handlers = List.of(
            new StringTypeHandler(),
            new IntegerTypeHandler(),
            new LongTypeHandler(),
            new ShortTypeHandler(),
            new ByteTypeHandler(),
            new BooleanTypeHandler(),
            new DoubleTypeHandler(),
            new FloatTypeHandler(),
            new CharTypeHandler(),
            new EnumTypeHandler(),
            new UUIDTypeHandler(),
            new InstantTypeHandler(),
            new LocalDateTypeHandler(),
            new LocalDateTimeTypeHandler(),
            new OffsetDateTimeTypeHandler(),
            new ZonedDateTimeTypeHandler(),
            new LocalTimeTypeHandler(),
            new DurationTypeHandler(),
            new IsoDurationTypeHandler(),
            new ByteArrayTypeHandler(),
            new CollectionTypeHandler(),
            new MapTypeHandler());

    private static final TypeHandler PASS_THROUGH = new PassThroughTypeHandler();

    public static Optional<TypeHandler> findHandler(Class<?> type) {
        if (type == null) {
            return Optional.empty();
        }
        return handlers.stream().filter(h -> h.supports(type)).findFirst();
    }

    /**
     * Returns the handler for {@code type}, or a pass-through handler when no specific one exists.
     */
    public static TypeHandler handlerFor(Class<?> type) {
        return findHandler(type).orElse(PASS_THROUGH);
    }

    /**
     * Converts a parameter value for the driver. Values without a handler are passed through.
     */
    public static Object toGraph(Object value) {
        if (value == null) {
            return null;
        }
        return findHandler(value.getClass())
                .map(handler -> handler.toGraph(value))
                .orElse(value);
    }

    private TypeHandlerRegistry() {
    }
}
