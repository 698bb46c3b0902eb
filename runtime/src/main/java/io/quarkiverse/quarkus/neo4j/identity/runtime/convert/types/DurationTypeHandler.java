package io.quarkiverse.quarkus.neo4j.identity.runtime.convert.types;

import java.time.Duration;

import org.neo4j.driver.Value;
import org.neo4j.driver.types.IsoDuration;

/**
 * Durations are stored as graph durations. Only the day, second and nanosecond parts can be read
 * back; a duration with months has no fixed length.
 */
public class DurationTypeHandler extends AbstractSimpleTypeHandler {

    @Override
    protected Class<?> getSupportedType() {
        return Duration.class;
    }

    @Override
    protected Object read(Value value) {
        IsoDuration duration = value.asIsoDuration();
        if (duration.months() != 0) {
            throw new IllegalArgumentException("Duration " + duration + " has a month component");
        }
        return Duration.ofDays(duration.days())
                .plusSeconds(duration.seconds())
                .plusNanos(duration.nanoseconds());
    }
}
