package com.bookindexer.common.model;

import java.time.Duration;
import java.time.Instant;

import com.bookindexer.common.validation.PlausibleInstant;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.annotation.JsonDeserialize;
import tools.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One reader's interaction with one book, keyed by {@code (ownerId, entityId)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActivityRecordDTO {

    private static final Duration CLOCK_SKEW = Duration.ofDays(1);

    @NotNull(message = "Owner ID is required")
    @Positive(message = "Owner ID must be positive")
    private Long ownerId;

    @NotNull(message = "Entity ID is required")
    @Positive(message = "Entity ID must be positive")
    private Long entityId;

    // 0 means read but not rated
    @NotNull(message = "Rating is required")
    @Min(value = 0, message = "Rating must be between 0 and 5")
    @Max(value = 5, message = "Rating must be between 0 and 5")
    private Integer rating;

    @NotNull(message = "Occurred-at is required")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    @PlausibleInstant(notBefore = "1900-01-01")
    private Instant occurredAt;

    @NotNull(message = "Observed-at is required")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    @PlausibleInstant(notBefore = "2000-01-01")
    private Instant observedAt;

    @JsonIgnore
    @AssertTrue(message = "Occurred-at cannot be after observed-at")
    public boolean isOccurredBeforeObserved() {
        if (occurredAt == null || observedAt == null) {
            return true;
        }
        return !occurredAt.isAfter(observedAt.plus(CLOCK_SKEW));
    }
}
