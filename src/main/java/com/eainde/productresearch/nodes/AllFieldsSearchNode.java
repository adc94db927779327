package com.eainde.productresearch.nodes;

import com.eainde.productresearch.model.SearchAttempt;
import com.eainde.productresearch.model.SearchOutcome;
import com.eainde.productresearch.model.ValidatedPage;
import com.eainde.productresearch.search.AllFieldsSearchExecutor;
import com.eainde.productresearch.state.ProductResearchState;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Structured all-fields attempt. Its pages go straight into the accumulated results,
 * skipping filter and validate.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class AllFieldsSearchNode implements AsyncNodeAction<ProductResearchState> {

    public static final String NAME = "search_all_fields";

    private final AllFieldsSearchExecutor executor;

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProductResearchState state) {
        int index = state.searchIndex();
        Map<String, Object> update = new HashMap<>();
        update.put(ProductResearchState.SEARCH_INDEX, index + 1);
        update.put(ProductResearchState.CURRENT_SEARCH_RESULTS, "");
        update.put(ProductResearchState.RETRY_COUNT, 0);

        Optional<List<ValidatedPage>> pages = Optional.empty();
        Optional<SearchAttempt> attempt = state.currentAttempt();
        if (attempt.isPresent()) {
            try {
                pages = executor.execute(attempt.get(), state.query());
            } catch (Exception e) {
                log.error("[search_all_fields] unexpected failure", e);
            }
        }

        if (pages.isEmpty()) {
            update.put(ProductResearchState.SEARCH_SUCCESSFUL, false);
            update.put(ProductResearchState.SEARCH_OUTCOME, SearchOutcome.EXHAUSTED);
            return CompletableFuture.completedFuture(update);
        }

        List<ValidatedPage> found = pages.get();
        int images = found.stream().mapToInt(p -> p.imageUrls().size()).sum();
        log.info("[search_all_fields] {} pages with {} images", found.size(), images);

        update.put(ProductResearchState.SEARCH_SUCCESSFUL, true);
        update.put(ProductResearchState.SEARCH_OUTCOME, SearchOutcome.SUCCESS);
        update.put(ProductResearchState.VALIDATED_PAGES, found);
        update.put(ProductResearchState.TOTAL_CHECKED, found.size());
        update.put(ProductResearchState.TOTAL_VALIDATED_IMAGES, images);
        return CompletableFuture.completedFuture(update);
    }
}
