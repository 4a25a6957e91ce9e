package com.bookindexer.common.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.hibernate.validator.constraints.ISBN;

import com.bookindexer.common.validation.PlausibleInstant;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.annotation.JsonDeserialize;
import tools.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A catalog entity (a book) as scraped and pushed to the indexer.
 * Written downstream once; the indexer never updates it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CatalogRecordDTO {

    @NotNull(message = "Entity ID is required")
    @Positive(message = "Entity ID must be positive")
    private Long entityId;

    // Work details
    private String workInternalId;

    @Positive(message = "Work ID must be positive")
    private Long workId;

    @JsonDeserialize(using = LenientInstantDeserializer.class)
    @PlausibleInstant(notBefore = "0001-01-01", maxAhead = "P1826D")
    private Instant publishDate;

    private String originalTitle;

    @NotBlank(message = "Author is required")
    private String author;

    private String authorUrl;

    // Work statistics
    @PositiveOrZero(message = "Rating count cannot be negative")
    private Integer numRatings;

    @PositiveOrZero(message = "Review count cannot be negative")
    private Integer numReviews;

    @DecimalMin(value = "0.0", message = "Average rating must be between 0 and 5")
    @DecimalMax(value = "5.0", message = "Average rating must be between 0 and 5")
    private Double avgRating;

    @NotNull(message = "Rating histogram is required")
    @Size(max = 5, message = "Rating histogram has at most 5 buckets")
    private List<@NotNull @PositiveOrZero Integer> ratingHistogram;

    // Entity information
    private String entityUrl;

    @NotBlank(message = "Title is required")
    private String title;

    private String description;

    @Positive(message = "Page count must be positive")
    private Integer numPages;

    private String language;

    @ISBN(type = ISBN.Type.ISBN_10, message = "Invalid ISBN-10")
    private String isbn;

    @ISBN(type = ISBN.Type.ISBN_13, message = "Invalid ISBN-13")
    private String isbn13;

    @Pattern(regexp = "[A-Z0-9]{10}", message = "ASIN must be 10 upper-case alphanumerics")
    private String asin;

    private String series;

    @Builder.Default
    private List<String> genres = new ArrayList<>();

    @NotNull(message = "Scrape time is required")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    @PlausibleInstant(notBefore = "2000-01-01")
    private Instant scrapeTime;
}
