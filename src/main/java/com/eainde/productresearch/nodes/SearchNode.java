package com.eainde.productresearch.nodes;

import com.eainde.productresearch.model.SearchAttempt;
import com.eainde.productresearch.model.SearchOutcome;
import com.eainde.productresearch.search.SearchExecutor;
import com.eainde.productresearch.search.SearchExecutor.SearchExecution;
import com.eainde.productresearch.state.ProductResearchState;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the free-text attempt the index points at and always advances the index.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class SearchNode implements AsyncNodeAction<ProductResearchState> {

    public static final String NAME = "search";

    private final SearchExecutor searchExecutor;

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProductResearchState state) {
        int index = state.searchIndex();
        Optional<SearchAttempt> attempt = state.currentAttempt();
        if (attempt.isEmpty()) {
            log.warn("[search] no attempt at index {}", index);
            return CompletableFuture.completedFuture(outcome(index, new SearchExecution(SearchOutcome.EXHAUSTED, "", 0)));
        }

        log.info("[search] attempt {}/{}: {}", index + 1, state.plan().map(p -> p.size()).orElse(0), attempt.get());
        SearchExecution execution;
        try {
            execution = searchExecutor.execute(attempt.get(), state.query());
        } catch (Exception e) {
            log.error("[search] attempt {} failed unexpectedly", attempt.get(), e);
            execution = new SearchExecution(SearchOutcome.EXHAUSTED, "", 0);
        }
        return CompletableFuture.completedFuture(outcome(index, execution));
    }

    private static Map<String, Object> outcome(int index, SearchExecution execution) {
        Map<String, Object> update = new HashMap<>();
        update.put(ProductResearchState.SEARCH_INDEX, index + 1);
        update.put(ProductResearchState.CURRENT_SEARCH_RESULTS, execution.resultsJson());
        update.put(ProductResearchState.SEARCH_SUCCESSFUL, execution.successful());
        update.put(ProductResearchState.SEARCH_OUTCOME, execution.outcome());
        update.put(ProductResearchState.RETRY_COUNT, execution.failedTries());
        return update;
    }
}
