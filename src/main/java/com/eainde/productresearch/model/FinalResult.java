package com.eainde.productresearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * Public outcome of one research run.
 */
@JsonPropertyOrder({"product", "search_type", "total_checked", "total_validated_images",
        "validated_pages", "invalid_urls"})
public record FinalResult(
        @JsonProperty("product") ProductSummary product,
        @JsonProperty("search_type") String searchType,
        @JsonProperty("total_checked") int totalChecked,
        @JsonProperty("total_validated_images") int totalValidatedImages,
        @JsonProperty("validated_pages") List<ValidatedPage> validatedPages,
        @JsonProperty("invalid_urls") List<InvalidUrlRecord> invalidUrls
) implements Serializable {

    public FinalResult {
        validatedPages = validatedPages == null ? List.of() : List.copyOf(validatedPages);
        invalidUrls = invalidUrls == null ? List.of() : List.copyOf(invalidUrls);
    }

    @JsonPropertyOrder({"barcode", "title", "sku"})
    public record ProductSummary(
            @JsonProperty("barcode") String barcode,
            @JsonProperty("title") String title,
            @JsonProperty("sku") String sku
    ) implements Serializable {

        public static ProductSummary of(ProductQuery query) {
            return new ProductSummary(query.barcode(), query.title(), query.sku());
        }
    }
}
