package com.eainde.productresearch.query;

import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.model.SearchAttempt;

import java.io.Serializable;
import java.util.List;

/**
 * Ordered attempts for one run together with the normalized query they apply to.
 */
public record SearchPlan(ProductQuery query, List<SearchAttempt> attempts, String searchTypeLabel)
        implements Serializable {

    public static final String LABEL_BARCODE = "barcode";
    public static final String LABEL_SKU = "sku";

    public SearchPlan {
        if (attempts == null || attempts.isEmpty()) {
            throw new IllegalArgumentException("A search plan needs at least one attempt");
        }
        attempts = List.copyOf(attempts);
    }

    public int size() {
        return attempts.size();
    }
}
