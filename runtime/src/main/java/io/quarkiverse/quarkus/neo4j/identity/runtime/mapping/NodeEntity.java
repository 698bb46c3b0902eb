package io.quarkiverse.quarkus.neo4j.identity.runtime.mapping;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the label a class contributes to the label set of itself and its subclasses.
 * Without it the simple class name is used.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface NodeEntity {
    String label() default "";
}
