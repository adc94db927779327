package com.eainde.productresearch.query;

import com.eainde.productresearch.model.ProductQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.eainde.productresearch.model.SearchAttempt.ALL_FIELDS_WEB;
import static com.eainde.productresearch.model.SearchAttempt.BARCODE_GOOGLE;
import static com.eainde.productresearch.model.SearchAttempt.BARCODE_WEB;
import static com.eainde.productresearch.model.SearchAttempt.BARCODE_YAHOO;
import static com.eainde.productresearch.model.SearchAttempt.SKU_GOOGLE;
import static com.eainde.productresearch.model.SearchAttempt.SKU_WEB;
import static com.eainde.productresearch.model.SearchAttempt.SKU_YAHOO;
import static com.eainde.productresearch.model.SearchAttempt.TITLE_SKU_GOOGLE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchPlanBuilderTest {

    private final SearchPlanBuilder builder = new SearchPlanBuilder();

    // =========================================================================
    //  Attempt ordering
    // =========================================================================

    @Nested
    @DisplayName("build()")
    class Build {

        @Test
        @DisplayName("barcode and usable SKU give all eight attempts in order")
        void allFamilies() {
            SearchPlan plan = builder.build(new ProductQuery("12345678905", "AB-12345", "Blue Kettle"));

            assertThat(plan.attempts()).containsExactly(
                    BARCODE_GOOGLE, BARCODE_YAHOO, BARCODE_WEB,
                    SKU_GOOGLE, SKU_YAHOO, SKU_WEB,
                    TITLE_SKU_GOOGLE, ALL_FIELDS_WEB);
            assertThat(plan.searchTypeLabel()).isEqualTo("barcode");
            assertThat(plan.query().barcode()).isEqualTo("012345678905");
        }

        @Test
        @DisplayName("a short SKU is not searched on its own")
        void shortSkuSkipped() {
            SearchPlan plan = builder.build(new ProductQuery("", "AB12", "Blue Kettle"));

            assertThat(plan.attempts()).containsExactly(TITLE_SKU_GOOGLE, ALL_FIELDS_WEB);
            assertThat(plan.searchTypeLabel()).isEqualTo("sku");
        }

        @Test
        @DisplayName("SKU only gives SKU and title+SKU attempts")
        void skuOnly() {
            SearchPlan plan = builder.build(new ProductQuery(null, "  AB-12345  ", null));

            assertThat(plan.attempts()).containsExactly(
                    SKU_GOOGLE, SKU_YAHOO, SKU_WEB, TITLE_SKU_GOOGLE, ALL_FIELDS_WEB);
            assertThat(plan.searchTypeLabel()).isEqualTo("sku");
        }

        @Test
        @DisplayName("an empty query still yields a non-empty plan")
        void neverEmpty() {
            SearchPlan plan = builder.build(new ProductQuery(null, null, null));

            assertThat(plan.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("minimum SKU length is configurable")
        void configurableSkuLength() {
            SearchPlan plan = new SearchPlanBuilder(3).build(new ProductQuery("", "AB12", ""));

            assertThat(plan.attempts()).startsWith(SKU_GOOGLE);
        }
    }

    @Test
    @DisplayName("a plan without attempts is rejected")
    void emptyPlanRejected() {
        assertThatThrownBy(() -> new SearchPlan(new ProductQuery("", "", ""), java.util.List.of(), "sku"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
