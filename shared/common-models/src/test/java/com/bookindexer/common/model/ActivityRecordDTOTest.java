package com.bookindexer.common.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.stream.Collectors;

import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

class ActivityRecordDTOTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private ValidatorFactory validatorFactory;
    private Validator validator;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .clockProvider(() -> Clock.fixed(NOW, ZoneOffset.UTC))
                .buildValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void parsesSnakeCaseWireFormatWithMixedTimestampShapes() throws Exception {
        String json = """
                {"owner_id": 1, "entity_id": 13501, "rating": 4,
                 "occurred_at": "2023-11-04", "observed_at": "2024-02-29 08:15:00",
                 "unexpected": "ignored"}
                """;

        ActivityRecordDTO record = objectMapper.readValue(json, ActivityRecordDTO.class);

        assertThat(record.getOwnerId()).isEqualTo(1L);
        assertThat(record.getEntityId()).isEqualTo(13501L);
        assertThat(record.getOccurredAt()).isEqualTo(Instant.parse("2023-11-04T00:00:00Z"));
        assertThat(record.getObservedAt()).isEqualTo(Instant.parse("2024-02-29T08:15:00Z"));
        assertThat(validator.validate(record)).isEmpty();
    }

    @Test
    void rejectsOutOfRangeRatingAndNonPositiveIds() {
        ActivityRecordDTO record = valid().ownerId(0L).rating(6).build();

        assertThat(messages(validator.validate(record)))
                .containsExactlyInAnyOrder("Owner ID must be positive", "Rating must be between 0 and 5");
    }

    @Test
    void rejectsObservationInTheFuture() {
        ActivityRecordDTO record = valid().observedAt(NOW.plusSeconds(3 * 24 * 3600)).build();

        assertThat(validator.validate(record)).hasSize(1);
    }

    @Test
    void rejectsActivityThatOccurredAfterItWasObserved() {
        ActivityRecordDTO record = valid()
                .occurredAt(Instant.parse("2024-02-28T00:00:00Z"))
                .observedAt(Instant.parse("2024-02-20T00:00:00Z"))
                .build();

        assertThat(messages(validator.validate(record)))
                .containsExactly("Occurred-at cannot be after observed-at");
    }

    @Test
    void rejectsImplausiblyOldActivity() {
        ActivityRecordDTO record = valid().occurredAt(Instant.parse("1850-06-01T00:00:00Z")).build();

        assertThat(validator.validate(record)).hasSize(1);
    }

    private static ActivityRecordDTO.ActivityRecordDTOBuilder valid() {
        return ActivityRecordDTO.builder()
                .ownerId(1L)
                .entityId(2L)
                .rating(5)
                .occurredAt(Instant.parse("2024-01-10T00:00:00Z"))
                .observedAt(Instant.parse("2024-02-01T00:00:00Z"));
    }

    private static Set<String> messages(Set<? extends ConstraintViolation<?>> violations) {
        return violations.stream().map(ConstraintViolation::getMessage).collect(Collectors.toSet());
    }
}
