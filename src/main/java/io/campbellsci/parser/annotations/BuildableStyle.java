package io.campbellsci.parser.annotations;

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The style shared by the specs objects of this library: package-private generated implementations, reached through
 * the {@code builder()} of the abstract type, with defaults allowed and no copy ("withX") methods.
 */
@Target({ElementType.TYPE, ElementType.PACKAGE})
@Retention(RetentionPolicy.CLASS)
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE,
        defaults = @Value.Immutable(copy = false), strictBuilder = false, weakInterning = true,
        jdkOnly = true)
public @interface BuildableStyle {
    // Generates ImmutableX.builder() for each annotated specs class
}
