package com.bookindexer.common.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

/**
 * The annotated {@link java.time.Instant} must fall inside a plausible window:
 * not before {@link #notBefore()} and not later than "now" plus {@link #maxAhead()}.
 * "Now" comes from the validator's {@link jakarta.validation.ClockProvider}.
 * <p>
 * {@code null} is considered valid; combine with {@code @NotNull} where required.
 */
@Documented
@Constraint(validatedBy = PlausibleInstantValidator.class)
@Target({ FIELD, METHOD, PARAMETER })
@Retention(RUNTIME)
public @interface PlausibleInstant {

    String message() default "must be between {notBefore} and now plus {maxAhead}";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};

    /** Earliest accepted UTC date, ISO-8601 ({@code yyyy-MM-dd}). */
    String notBefore() default "1900-01-01";

    /** How far past the current time a value may lie, ISO-8601 duration. */
    String maxAhead() default "P1D";
}
