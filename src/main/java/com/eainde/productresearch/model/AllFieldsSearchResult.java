package com.eainde.productresearch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Structured answer of the all-fields search: source pages and the images found on them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AllFieldsSearchResult(@JsonProperty("items") List<Item> items) {

    public AllFieldsSearchResult {
        items = items == null ? List.of() : items.stream().filter(Objects::nonNull).toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            @JsonProperty("source_url") String sourceUrl,
            @JsonProperty("image_urls") List<String> imageUrls
    ) {
        public Item {
            imageUrls = imageUrls == null ? List.of() : imageUrls.stream().filter(Objects::nonNull).toList();
        }
    }
}
