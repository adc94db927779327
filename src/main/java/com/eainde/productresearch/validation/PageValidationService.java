package com.eainde.productresearch.validation;

import com.eainde.productresearch.model.InvalidUrlRecord;
import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.model.ValidatedPage;
import com.eainde.productresearch.model.ValidationReport;
import com.eainde.productresearch.parsing.JsonResponseParser;
import com.eainde.productresearch.prompt.PromptService;
import com.eainde.productresearch.thread.TimedCalls;
import com.eainde.productresearch.tools.LanguageModelClient;
import com.eainde.productresearch.tools.PageScrapeTool;
import com.eainde.productresearch.tools.ScrapeVariant;
import com.eainde.productresearch.tools.ToolErrors;
import com.eainde.productresearch.tools.ToolException;
import com.eainde.productresearch.tools.ToolSession;
import com.eainde.productresearch.tools.ToolSessionPool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Confirms candidate pages in bounded batches and extracts their images and attributes.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>Marketplace URLs are separated from the rest and validated first.</li>
 *   <li>Each group is cut into batches of {@code batchSize}.</li>
 *   <li>A batch gets {@code baseTimeout + perUrlTimeout * batchSize}. A timeout or tool error
 *       turns every URL of the batch into an invalid record.</li>
 *   <li>A dropped connection invalidates the pooled session and the batch is retried.</li>
 *   <li>With early exit on, once images were found the remaining URLs are skipped.</li>
 * </ol>
 */
@Log4j2
public class PageValidationService {

    static final String SKIPPED_REASON = "Skipped - sufficient images already found";
    static final String MISSING_REASON = "No validation result returned";

    private final ToolSessionPool sessionPool;
    private final LanguageModelClient languageModel;
    private final JsonResponseParser parser;
    private final PromptService promptService;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Settings settings;

    public record Settings(int batchSize, Duration baseTimeout, Duration perUrlTimeout,
                           boolean earlyExit, int connectionRetries) {

        public Settings {
            if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        }

        Duration batchTimeout(int urls) {
            return baseTimeout.plus(perUrlTimeout.multipliedBy(urls));
        }
    }

    record Batch(ScrapeVariant variant, List<String> urls) {
    }

    public PageValidationService(ToolSessionPool sessionPool, LanguageModelClient languageModel,
                                 JsonResponseParser parser, PromptService promptService,
                                 ObjectMapper objectMapper, Executor executor, Settings settings) {
        this.sessionPool = sessionPool;
        this.languageModel = languageModel;
        this.parser = parser;
        this.promptService = promptService;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.settings = settings;
    }

    public ValidationDelta validate(List<String> urls, ProductQuery query, String searchType) {
        if (urls == null || urls.isEmpty()) {
            return ValidationDelta.empty();
        }

        List<Batch> batches = plan(urls);
        log.info("[validate] {} urls in {} batches", urls.size(), batches.size());

        List<ValidatedPage> pages = new ArrayList<>();
        List<InvalidUrlRecord> invalid = new ArrayList<>();
        int images = 0;

        for (int i = 0; i < batches.size(); i++) {
            if (settings.earlyExit() && images > 0) {
                int skipped = 0;
                for (Batch remaining : batches.subList(i, batches.size())) {
                    for (String url : remaining.urls()) {
                        invalid.add(new InvalidUrlRecord(url, SKIPPED_REASON));
                        skipped++;
                    }
                }
                log.info("[validate] {} images found, skipping {} remaining urls", images, skipped);
                break;
            }

            Batch batch = batches.get(i);
            ValidationDelta result = validateBatch(batch, query, searchType);
            pages.addAll(result.validatedPages());
            invalid.addAll(result.invalidUrls());
            images += result.images();
            log.info("[validate] batch {}/{} ({}): {} valid pages, {} images",
                    i + 1, batches.size(), batch.variant(), result.validatedPages().size(), result.images());
        }

        return new ValidationDelta(pages, invalid, urls.size(), images);
    }

    // =========================================================================
    //  Batching
    // =========================================================================

    List<Batch> plan(List<String> urls) {
        List<String> marketplace = new ArrayList<>();
        List<String> generic = new ArrayList<>();
        for (String url : urls) {
            (MarketplaceUrlClassifier.isMarketplace(url) ? marketplace : generic).add(url);
        }
        List<Batch> batches = new ArrayList<>();
        split(marketplace, ScrapeVariant.MARKETPLACE, batches);
        split(generic, ScrapeVariant.GENERIC, batches);
        return batches;
    }

    private void split(List<String> urls, ScrapeVariant variant, List<Batch> into) {
        for (int start = 0; start < urls.size(); start += settings.batchSize()) {
            int end = Math.min(start + settings.batchSize(), urls.size());
            into.add(new Batch(variant, List.copyOf(urls.subList(start, end))));
        }
    }

    // =========================================================================
    //  One batch
    // =========================================================================

    ValidationDelta validateBatch(Batch batch, ProductQuery query, String searchType) {
        String instructions = instructions(batch.urls(), query, searchType);
        Duration timeout = settings.batchTimeout(batch.urls().size());
        int maxTries = 1 + Math.max(0, settings.connectionRetries());

        for (int tryNumber = 1; tryNumber <= maxTries; tryNumber++) {
            ToolSession session = null;
            try {
                session = sessionPool.acquire();
                Optional<PageScrapeTool> tool = session.scrapeTool(batch.variant());
                ValidationReport report = TimedCalls.call(
                        () -> tool.map(t -> t.validate(batch.urls(), instructions))
                                .orElseGet(() -> validateWithModel(instructions)),
                        timeout, executor);
                return reconcile(batch.urls(), report);
            } catch (TimeoutException e) {
                log.warn("[validate] batch timed out after {}: {}", TimedCalls.describe(timeout), batch.urls());
                return allInvalid(batch.urls(), "Validation timed out after " + TimedCalls.describe(timeout));
            } catch (Exception e) {
                if (ToolErrors.isConnectionDropped(e) && tryNumber < maxTries) {
                    if (session != null) {
                        sessionPool.invalidate(session);
                    }
                    log.warn("[validate] connection dropped, retrying batch (try {}/{})", tryNumber + 1, maxTries);
                    continue;
                }
                log.error("[validate] batch failed: {}", batch.urls(), e);
                return allInvalid(batch.urls(), "Validation error: " + ToolErrors.describe(e));
            }
        }
        return allInvalid(batch.urls(), "Validation error: connection dropped");
    }

    private ValidationReport validateWithModel(String instructions) {
        log.debug("No scrape tool available, validating with the model only");
        String answer = languageModel.complete(instructions, "Validate every URL listed above and answer in JSON.");
        return parser.parse(answer, ValidationReport.class)
                .orElseThrow(() -> new ToolException("Model validation returned no JSON"));
    }

    /**
     * Maps every answered page and invalid record back to the batch URL it was asked about, so a
     * URL is reported either valid or invalid, never both. Answers for URLs outside the batch
     * are dropped. Images are summed from the kept pages and unanswered URLs become invalid.
     */
    static ValidationDelta reconcile(List<String> urls, ValidationReport report) {
        Map<String, String> batchUrls = new LinkedHashMap<>();
        urls.forEach(url -> batchUrls.putIfAbsent(matchKey(url), url));

        Set<String> answered = new HashSet<>();
        List<ValidatedPage> pages = new ArrayList<>();
        for (ValidatedPage page : report.validatedPages()) {
            String url = batchUrls.get(matchKey(page.url()));
            if (url == null) {
                log.warn("[validate] dropping validated page outside the batch: {}", page.url());
            } else if (answered.add(url)) {
                pages.add(url.equals(page.url()) ? page : page.withUrl(url));
            }
        }

        List<InvalidUrlRecord> invalid = new ArrayList<>();
        for (InvalidUrlRecord record : report.invalidUrls()) {
            String url = batchUrls.get(matchKey(record.url()));
            if (url != null && answered.add(url)) {
                invalid.add(new InvalidUrlRecord(url, record.reasoning()));
            }
        }
        for (String url : urls) {
            if (answered.add(url)) {
                invalid.add(new InvalidUrlRecord(url, MISSING_REASON));
            }
        }

        int images = pages.stream().mapToInt(p -> p.imageUrls().size()).sum();
        return new ValidationDelta(pages, invalid, urls.size(), images);
    }

    /** Ignores scheme, a leading {@code www.}, host case, the fragment and trailing slashes. */
    static String matchKey(String url) {
        if (url == null) {
            return "";
        }
        String key = url.trim();
        int fragment = key.indexOf('#');
        if (fragment >= 0) {
            key = key.substring(0, fragment);
        }
        key = key.replaceFirst("(?i)^https?://", "").replaceFirst("(?i)^www\\.", "");
        while (key.endsWith("/")) {
            key = key.substring(0, key.length() - 1);
        }
        int slash = key.indexOf('/');
        return slash < 0
                ? key.toLowerCase(Locale.ROOT)
                : key.substring(0, slash).toLowerCase(Locale.ROOT) + key.substring(slash);
    }

    private static ValidationDelta allInvalid(List<String> urls, String reasoning) {
        List<InvalidUrlRecord> invalid = urls.stream().map(u -> new InvalidUrlRecord(u, reasoning)).toList();
        return new ValidationDelta(List.of(), invalid, urls.size(), 0);
    }

    private String instructions(List<String> urls, ProductQuery query, String searchType) {
        String urlsJson;
        try {
            urlsJson = objectMapper.writeValueAsString(urls);
        } catch (JsonProcessingException e) {
            urlsJson = String.join("\n", urls);
        }
        return promptService.render(PromptService.VALIDATION, Map.of(
                "barcode", query.barcode(),
                "sku", query.sku(),
                "title", query.title(),
                "urls", urlsJson,
                "search_type", searchType));
    }
}
