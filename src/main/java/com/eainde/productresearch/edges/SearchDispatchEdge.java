package com.eainde.productresearch.edges;

import com.eainde.productresearch.model.SearchAttempt;
import com.eainde.productresearch.state.ProductResearchState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Picks the search node for the current attempt's variant, or {@link #DONE} once the plan is used up.
 */
@Log4j2
@Component
public class SearchDispatchEdge implements AsyncEdgeAction<ProductResearchState> {

    public static final String FREE_TEXT = "free_text";
    public static final String ALL_FIELDS = "all_fields";
    public static final String DONE = "done";

    @Override
    public CompletableFuture<String> apply(ProductResearchState state) {
        return CompletableFuture.completedFuture(route(state));
    }

    static String route(ProductResearchState state) {
        Optional<SearchAttempt> attempt = state.currentAttempt();
        if (attempt.isEmpty()) {
            log.info("[dispatch] plan exhausted at index {}", state.searchIndex());
            return DONE;
        }
        return switch (attempt.get().variant()) {
            case FREE_TEXT -> FREE_TEXT;
            case STRUCTURED_ALL_FIELDS -> ALL_FIELDS;
        };
    }
}
