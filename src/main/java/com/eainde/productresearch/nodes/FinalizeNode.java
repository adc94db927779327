package com.eainde.productresearch.nodes;

import com.eainde.productresearch.model.FinalResult;
import com.eainde.productresearch.model.FinalResult.ProductSummary;
import com.eainde.productresearch.model.InvalidUrlRecord;
import com.eainde.productresearch.model.ValidatedPage;
import com.eainde.productresearch.state.ProductResearchState;
import com.eainde.productresearch.state.StateReducers;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Folds the accumulated state into the public {@link FinalResult}.
 */
@Log4j2
@Component
public class FinalizeNode implements AsyncNodeAction<ProductResearchState> {

    public static final String NAME = "finalize";

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProductResearchState state) {
        FinalResult result = assemble(state);
        log.info("[finalize] {} pages, {} images, {} invalid, {} checked",
                result.validatedPages().size(), result.totalValidatedImages(),
                result.invalidUrls().size(), result.totalChecked());
        return CompletableFuture.completedFuture(Map.of(ProductResearchState.FINAL_RESULT, result));
    }

    public static FinalResult assemble(ProductResearchState state) {
        List<ValidatedPage> pages;
        int images;
        if (state.cleanedValidatedPages().isPresent()) {
            pages = state.cleanedValidatedPages().get();
            images = state.cleanedTotalValidatedImages().orElse(0);
        } else {
            pages = state.validatedPages();
            images = state.totalValidatedImages();
        }

        int counted = pages.stream().mapToInt(p -> p.imageUrls().size()).sum();
        if (images == 0 && counted > 0) {
            images = counted;
        }

        List<InvalidUrlRecord> invalid = StateReducers.mergeInvalidUrls(state.invalidUrlEntries(), List.of());

        return new FinalResult(
                ProductSummary.of(state.query()),
                state.searchTypeLabel(),
                state.totalChecked(),
                images,
                pages,
                invalid);
    }
}
