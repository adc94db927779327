package com.eainde.productresearch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Page-validation answer for one batch of URLs, as returned by the scrape tool or the model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationReport(
        @JsonProperty("product") JsonNode product,
        @JsonProperty("search_type") String searchType,
        @JsonProperty("total_checked") Integer totalChecked,
        @JsonProperty("total_validated_images") Integer totalValidatedImages,
        @JsonProperty("validated_pages") List<ValidatedPage> validatedPages,
        @JsonProperty("invalid_urls") List<InvalidUrlRecord> invalidUrls
) {

    public ValidationReport {
        validatedPages = validatedPages == null ? List.of() : validatedPages.stream().filter(Objects::nonNull).toList();
        invalidUrls = invalidUrls == null ? List.of() : invalidUrls.stream().filter(Objects::nonNull).toList();
    }

    public static ValidationReport empty() {
        return new ValidationReport(null, "", 0, 0, List.of(), List.of());
    }
}
