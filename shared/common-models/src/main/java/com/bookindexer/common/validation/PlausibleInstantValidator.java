package com.bookindexer.common.validation;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class PlausibleInstantValidator implements ConstraintValidator<PlausibleInstant, Instant> {

    private Instant notBefore;
    private Duration maxAhead;

    @Override
    public void initialize(PlausibleInstant annotation) {
        this.notBefore = LocalDate.parse(annotation.notBefore()).atStartOfDay(ZoneOffset.UTC).toInstant();
        this.maxAhead = Duration.parse(annotation.maxAhead());
    }

    @Override
    public boolean isValid(Instant value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        Instant latest = context.getClockProvider().getClock().instant().plus(maxAhead);
        return !value.isBefore(notBefore) && !value.isAfter(latest);
    }
}
