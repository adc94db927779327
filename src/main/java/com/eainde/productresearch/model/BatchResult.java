package com.eainde.productresearch.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of a batch run. {@code result} is the JSON of a {@link FinalResult}, or an
 * error object {@code {"error": ..., "status": "failed"}}.
 */
@JsonPropertyOrder({"barcode", "sku", "title", "result"})
public record BatchResult(String barcode, String sku, String title, String result) {

    public static BatchResult of(ProductQuery query, String resultJson) {
        return new BatchResult(query.barcode(), query.sku(), query.title(), resultJson);
    }
}
