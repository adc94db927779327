package com.eainde.productresearch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * A page confirmed to describe the researched product, with its extracted images and attributes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidatedPage(
        @JsonProperty("url") String url,
        @JsonProperty("validation_method") String validationMethod,
        @JsonProperty("image_urls") List<String> imageUrls,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("product_description") String productDescription,
        @JsonProperty("brand") String brand,
        @JsonProperty("weight") Weight weight,
        @JsonProperty("product_dimensions") ProductDimensions dimensions
) implements Serializable {

    public static final String METHOD_ALL_FIELDS = "all_fields_search";
    static final String ALL_FIELDS_REASONING = "Found by the structured all-fields web search";

    public ValidatedPage {
        url = url == null ? "" : url;
        validationMethod = validationMethod == null ? "" : validationMethod;
        imageUrls = imageUrls == null ? List.of() : imageUrls.stream().filter(Objects::nonNull).toList();
        reasoning = reasoning == null ? "" : reasoning;
        productDescription = productDescription == null ? "" : productDescription;
        brand = brand == null ? "" : brand;
        weight = weight == null ? Weight.UNKNOWN : weight;
        dimensions = dimensions == null ? ProductDimensions.UNKNOWN : dimensions;
    }

    /** Page produced by the structured all-fields search, which carries no attributes. */
    public static ValidatedPage fromAllFieldsSearch(String url, List<String> imageUrls) {
        return new ValidatedPage(url, METHOD_ALL_FIELDS, imageUrls, ALL_FIELDS_REASONING, "", "", null, null);
    }

    public ValidatedPage withUrl(String pageUrl) {
        return new ValidatedPage(pageUrl, validationMethod, imageUrls, reasoning, productDescription,
                brand, weight, dimensions);
    }

    public ValidatedPage withImageUrls(List<String> cleaned) {
        return new ValidatedPage(url, validationMethod, cleaned, reasoning, productDescription,
                brand, weight, dimensions);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Weight(
            @JsonProperty("unit_of_measure") String unitOfMeasure,
            @JsonProperty("value") Double value
    ) implements Serializable {
        public static final Weight UNKNOWN = new Weight("", null);

        public Weight {
            unitOfMeasure = unitOfMeasure == null ? "" : unitOfMeasure;
        }
    }

    /** Dimensions in inches; any side may be unknown. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProductDimensions(
            @JsonProperty("length") Double length,
            @JsonProperty("width") Double width,
            @JsonProperty("height") Double height
    ) implements Serializable {
        public static final ProductDimensions UNKNOWN = new ProductDimensions(null, null, null);
    }
}
