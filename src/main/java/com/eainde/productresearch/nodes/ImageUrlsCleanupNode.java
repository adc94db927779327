package com.eainde.productresearch.nodes;

import com.eainde.productresearch.image.ImageAuthenticityChecker;
import com.eainde.productresearch.image.ImageAuthenticityChecker.CleanupResult;
import com.eainde.productresearch.model.ValidatedPage;
import com.eainde.productresearch.state.ProductResearchState;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Checks every collected image URL once and writes the cleaned pages. On failure nothing is
 * written and the finalizer falls back to the raw pages.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class ImageUrlsCleanupNode implements AsyncNodeAction<ProductResearchState> {

    public static final String NAME = "image_cleanup";

    private final ImageAuthenticityChecker checker;

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProductResearchState state) {
        List<ValidatedPage> pages = state.validatedPages();
        if (pages.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of(
                    ProductResearchState.CLEANED_VALIDATED_PAGES, new ArrayList<ValidatedPage>(),
                    ProductResearchState.CLEANED_TOTAL_VALIDATED_IMAGES, 0));
        }

        try {
            CleanupResult result = checker.clean(pages);
            return CompletableFuture.completedFuture(Map.of(
                    ProductResearchState.CLEANED_VALIDATED_PAGES, new ArrayList<>(result.pages()),
                    ProductResearchState.CLEANED_TOTAL_VALIDATED_IMAGES, result.totalImages()));
        } catch (Exception e) {
            log.error("[image_cleanup] check failed, keeping unchecked images", e);
            return CompletableFuture.completedFuture(Map.of());
        }
    }
}
