package com.eainde.productresearch.nodes;

import com.eainde.productresearch.state.ProductResearchState;
import com.eainde.productresearch.validation.PageValidationService;
import com.eainde.productresearch.validation.ValidationDelta;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Log4j2
@Component
@RequiredArgsConstructor
public class ValidateNode implements AsyncNodeAction<ProductResearchState> {

    public static final String NAME = "validate";

    private final PageValidationService validationService;

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProductResearchState state) {
        List<String> urls = state.filteredUrls();
        ValidationDelta delta;
        try {
            delta = validationService.validate(urls, state.query(), state.searchTypeLabel());
        } catch (Exception e) {
            log.error("[validate] unexpected failure, no results recorded for {} urls", urls.size(), e);
            delta = ValidationDelta.empty();
        }

        log.info("[validate] +{} pages, +{} invalid, +{} checked, +{} images",
                delta.validatedPages().size(), delta.invalidUrls().size(), delta.checked(), delta.images());
        return CompletableFuture.completedFuture(Map.of(
                ProductResearchState.VALIDATED_PAGES, new ArrayList<>(delta.validatedPages()),
                ProductResearchState.INVALID_URLS, new ArrayList<>(delta.invalidUrls()),
                ProductResearchState.TOTAL_CHECKED, delta.checked(),
                ProductResearchState.TOTAL_VALIDATED_IMAGES, delta.images()));
    }
}
