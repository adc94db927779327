package com.eainde.productresearch.nodes;

import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.query.SearchPlan;
import com.eainde.productresearch.query.SearchPlanBuilder;
import com.eainde.productresearch.state.ProductResearchState;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Normalizes the identifiers and writes the search plan.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class InitializeNode implements AsyncNodeAction<ProductResearchState> {

    public static final String NAME = "initialize";

    private final SearchPlanBuilder planBuilder;

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProductResearchState state) {
        ProductQuery raw = state.rawQuery();
        SearchPlan plan = planBuilder.build(raw);
        log.info("[initialize] {} -> {} attempts, search type {}",
                raw.key(), plan.size(), plan.searchTypeLabel());
        return CompletableFuture.completedFuture(Map.of(
                ProductResearchState.PLAN, plan,
                ProductResearchState.SEARCH_TYPE_LABEL, plan.searchTypeLabel(),
                ProductResearchState.BARCODE, plan.query().barcode(),
                ProductResearchState.SEARCH_INDEX, 0));
    }
}
