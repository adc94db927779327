package com.eainde.productresearch.search;

import com.eainde.productresearch.model.AllFieldsSearchResult;
import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.model.SearchAttempt;
import com.eainde.productresearch.model.ValidatedPage;
import com.eainde.productresearch.prompt.PromptService;
import com.eainde.productresearch.schema.ResearchSchemas;
import com.eainde.productresearch.thread.TimedCalls;
import com.eainde.productresearch.tools.LanguageModelClient;
import com.eainde.productresearch.tools.ToolErrors;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Structured "search everything at once" attempt. One schema-constrained call returns source
 * pages with their images, which are taken as validated pages directly.
 */
@Log4j2
public class AllFieldsSearchExecutor {

    private final LanguageModelClient webSearchModel;
    private final PromptService promptService;
    private final Executor executor;
    private final Duration timeout;

    public AllFieldsSearchExecutor(LanguageModelClient webSearchModel, PromptService promptService,
                                   Executor executor, Duration timeout) {
        this.webSearchModel = webSearchModel;
        this.promptService = promptService;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * @return the pages found, or empty when the call failed, timed out or found nothing
     */
    public Optional<List<ValidatedPage>> execute(SearchAttempt attempt, ProductQuery query) {
        String system = promptService.render(attempt.promptKey(), Map.of(
                "barcode", query.barcode(),
                "sku", query.sku(),
                "title", query.title(),
                "tool_name", "web search tool"));
        String input = attempt.formatInput(query);

        AllFieldsSearchResult result;
        try {
            result = TimedCalls.call(
                    () -> webSearchModel.completeStructured(system, input,
                            ResearchSchemas.ALL_FIELDS_SEARCH, AllFieldsSearchResult.class),
                    timeout, executor);
        } catch (TimeoutException e) {
            log.warn("[search_all_fields] timed out after {}", TimedCalls.describe(timeout));
            return Optional.empty();
        } catch (Exception e) {
            log.warn("[search_all_fields] structured search failed: {}", ToolErrors.describe(e));
            return Optional.empty();
        }

        if (result == null || result.items().isEmpty()) {
            log.info("[search_all_fields] no items returned");
            return Optional.empty();
        }

        List<ValidatedPage> pages = result.items().stream()
                .filter(item -> item.sourceUrl() != null && !item.sourceUrl().isBlank())
                .map(item -> ValidatedPage.fromAllFieldsSearch(item.sourceUrl(), item.imageUrls()))
                .toList();
        return pages.isEmpty() ? Optional.empty() : Optional.of(pages);
    }
}
