package com.eainde.productresearch.search;

import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.model.SearchAttempt;
import com.eainde.productresearch.model.SearchOutcome;
import com.eainde.productresearch.model.SearchProvider;
import com.eainde.productresearch.parsing.JsonResponseParser;
import com.eainde.productresearch.prompt.PromptService;
import com.eainde.productresearch.thread.TimedCalls;
import com.eainde.productresearch.tools.SearchRequest;
import com.eainde.productresearch.tools.SearchTool;
import com.eainde.productresearch.tools.ToolErrors;
import com.eainde.productresearch.tools.ToolException;
import com.eainde.productresearch.tools.ToolSession;
import com.eainde.productresearch.tools.ToolSessionPool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Runs one free-text search attempt with retries and classifies the outcome.
 *
 * <p>A zero-results answer is final for the attempt. Unparseable answers, tool errors and
 * timeouts are retried up to {@code maxTries} times, each try acquiring the tool afresh
 * from the pool. A dropped connection invalidates the pooled session first.</p>
 */
@Log4j2
public class SearchExecutor {

    private final ToolSessionPool sessionPool;
    private final JsonResponseParser parser;
    private final PromptService promptService;
    private final Executor executor;
    private final int maxTries;
    private final Duration timeout;

    public SearchExecutor(ToolSessionPool sessionPool, JsonResponseParser parser, PromptService promptService,
                          Executor executor, int maxTries, Duration timeout) {
        this.sessionPool = sessionPool;
        this.parser = parser;
        this.promptService = promptService;
        this.executor = executor;
        this.maxTries = Math.max(1, maxTries);
        this.timeout = timeout;
    }

    public record SearchExecution(SearchOutcome outcome, String resultsJson, int failedTries) {

        static SearchExecution empty() {
            return new SearchExecution(SearchOutcome.EMPTY_RESULT, "", 0);
        }

        public boolean successful() {
            return outcome == SearchOutcome.SUCCESS;
        }
    }

    public SearchExecution execute(SearchAttempt attempt, ProductQuery query) {
        SearchRequest request = new SearchRequest(
                attempt.provider(),
                promptService.render(attempt.promptKey(), Map.of(
                        "barcode", query.barcode(),
                        "sku", query.sku(),
                        "title", query.title(),
                        "tool_name", toolName(attempt.provider()))),
                attempt.formatInput(query),
                attempt.searchTerms(query));

        for (int tryNumber = 1; tryNumber <= maxTries; tryNumber++) {
            ToolSession session = null;
            try {
                session = sessionPool.acquire();
                SearchTool tool = session.searchTool(attempt.provider())
                        .orElseThrow(() -> new ToolException("No search tool available for " + attempt.provider()));

                String raw = TimedCalls.call(() -> tool.search(request), timeout, executor);

                if (NoResultsDetector.isNoResults(raw)) {
                    log.info("[{}] Search returned zero results, moving to the next attempt", attempt);
                    return SearchExecution.empty();
                }

                Optional<ObjectNode> parsed = parser.parse(raw).filter(SearchExecutor::hasResults);
                if (parsed.isPresent()) {
                    log.info("[{}] Search successful on try {}", attempt, tryNumber);
                    return new SearchExecution(SearchOutcome.SUCCESS, parsed.get().toString(), 0);
                }
                log.warn("[{}] Search returned unparseable results (try {}/{})", attempt, tryNumber, maxTries);
            } catch (TimeoutException e) {
                log.warn("[{}] Search timed out after {} (try {}/{})", attempt, TimedCalls.describe(timeout), tryNumber, maxTries);
            } catch (Exception e) {
                if (NoResultsDetector.isNoResults(e.getMessage())) {
                    log.info("[{}] Search error reports zero results, moving to the next attempt", attempt);
                    return SearchExecution.empty();
                }
                if (session != null && ToolErrors.isConnectionDropped(e)) {
                    sessionPool.invalidate(session);
                }
                log.warn("[{}] Search try {}/{} failed: {}", attempt, tryNumber, maxTries, ToolErrors.describe(e));
            }
        }

        log.warn("[{}] All {} tries exhausted", attempt, maxTries);
        return new SearchExecution(SearchOutcome.EXHAUSTED, "", maxTries);
    }

    static boolean hasResults(JsonNode root) {
        JsonNode results = root.has("results") ? root.get("results") : root.get("items");
        return results != null && results.isArray() && !results.isEmpty();
    }

    static String toolName(SearchProvider provider) {
        return switch (provider) {
            case GOOGLE -> "Google Search tool";
            case YAHOO -> "Yahoo Search tool";
            case LLM_WEB_SEARCH -> "web search tool";
        };
    }
}
