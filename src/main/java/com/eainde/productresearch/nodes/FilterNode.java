package com.eainde.productresearch.nodes;

import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.parsing.JsonResponseParser;
import com.eainde.productresearch.prompt.PromptService;
import com.eainde.productresearch.state.ProductResearchState;
import com.eainde.productresearch.tools.LanguageModelClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Narrows raw search hits to candidate product pages. Any failure yields an empty set.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class FilterNode implements AsyncNodeAction<ProductResearchState> {

    public static final String NAME = "filter";

    private final LanguageModelClient languageModel;
    private final JsonResponseParser parser;
    private final PromptService promptService;

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProductResearchState state) {
        if (!state.searchSuccessful() || state.currentSearchResults().isBlank()) {
            log.debug("[filter] search unsuccessful, nothing to filter");
            return CompletableFuture.completedFuture(filtered(List.of()));
        }

        List<String> urls;
        try {
            urls = filter(state.query(), state.currentSearchResults());
        } catch (Exception e) {
            log.error("[filter] relevance call failed, continuing with no urls", e);
            urls = List.of();
        }
        log.info("[filter] {} candidate urls", urls.size());
        return CompletableFuture.completedFuture(filtered(urls));
    }

    List<String> filter(ProductQuery query, String searchResults) {
        String prompt = promptService.render(PromptService.FILTER, Map.of(
                "barcode", query.barcode(),
                "sku", query.sku(),
                "title", query.title(),
                "search_results", searchResults));
        String answer = languageModel.complete(prompt, "Filter the search results above.");

        Optional<ObjectNode> parsed = parser.parse(answer);
        if (parsed.isEmpty() || !parsed.get().has("urls") || !parsed.get().get("urls").isArray()) {
            log.warn("[filter] answer has no urls array");
            return List.of();
        }

        Set<String> unique = new LinkedHashSet<>();
        for (JsonNode url : parsed.get().get("urls")) {
            String text = url.asText("").trim();
            if (!text.isEmpty()) {
                unique.add(text);
            }
        }
        return new ArrayList<>(unique);
    }

    private static Map<String, Object> filtered(List<String> urls) {
        return Map.of(
                ProductResearchState.FILTERED_URLS, new ArrayList<>(urls),
                ProductResearchState.TOTAL_FILTERED_URLS, urls.size());
    }
}
