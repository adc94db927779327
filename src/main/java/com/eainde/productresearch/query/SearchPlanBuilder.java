package com.eainde.productresearch.query;

import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.model.SearchAttempt;
import com.eainde.productresearch.model.SearchAttempt.IdentifierFamily;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw query into the ordered list of attempts worth trying.
 * Barcode attempts come first, then SKU attempts, then the title+SKU attempts which are always present.
 */
@Log4j2
public class SearchPlanBuilder {

    public static final int DEFAULT_MIN_SKU_LENGTH = 5;

    private final int minSkuLength;

    public SearchPlanBuilder() {
        this(DEFAULT_MIN_SKU_LENGTH);
    }

    public SearchPlanBuilder(int minSkuLength) {
        this.minSkuLength = minSkuLength;
    }

    public SearchPlan build(ProductQuery raw) {
        ProductQuery query = new ProductQuery(BarcodeNormalizer.normalize(raw.barcode()), raw.sku(), raw.title());

        boolean useBarcode = !query.barcode().isEmpty();
        boolean useSku = isUsableSku(query.sku());

        List<SearchAttempt> attempts = new ArrayList<>();
        if (useBarcode) {
            attempts.addAll(SearchAttempt.forFamily(IdentifierFamily.BARCODE));
        }
        if (useSku) {
            attempts.addAll(SearchAttempt.forFamily(IdentifierFamily.SKU));
        }
        attempts.addAll(SearchAttempt.forFamily(IdentifierFamily.TITLE_SKU));

        String label = useBarcode ? SearchPlan.LABEL_BARCODE : SearchPlan.LABEL_SKU;
        log.info("Search plan for [{}]: barcode={}, sku={}, {} attempts",
                query.key(), useBarcode, useSku, attempts.size());
        return new SearchPlan(query, attempts, label);
    }

    boolean isUsableSku(String sku) {
        return sku != null && sku.trim().length() >= minSkuLength;
    }
}
