package com.eainde.productresearch.validation;

import com.eainde.productresearch.model.InvalidUrlRecord;
import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.model.ValidatedPage;
import com.eainde.productresearch.model.ValidationReport;
import com.eainde.productresearch.parsing.JsonResponseParser;
import com.eainde.productresearch.prompt.PromptService;
import com.eainde.productresearch.tools.ConnectionDroppedException;
import com.eainde.productresearch.tools.DefaultToolSession;
import com.eainde.productresearch.tools.LanguageModelClient;
import com.eainde.productresearch.tools.PageScrapeTool;
import com.eainde.productresearch.tools.ScrapeVariant;
import com.eainde.productresearch.tools.ToolException;
import com.eainde.productresearch.tools.ToolSessionPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageValidationServiceTest {

    private static final ProductQuery QUERY = new ProductQuery("012345678905", "AB-12345", "Blue Kettle");
    private static final PageValidationService.Settings SETTINGS = new PageValidationService.Settings(
            3, Duration.ofSeconds(5), Duration.ofSeconds(1), true, 2);

    @Mock private LanguageModelClient languageModel;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private PageValidationService service(ToolSessionPool pool, PageValidationService.Settings settings) {
        return new PageValidationService(pool, languageModel, new JsonResponseParser(objectMapper),
                new PromptService(), objectMapper, executor, settings);
    }

    private static ToolSessionPool poolWith(PageScrapeTool marketplace, PageScrapeTool generic) {
        return new ToolSessionPool(() -> new DefaultToolSession(Map.of(),
                Map.of(ScrapeVariant.MARKETPLACE, marketplace, ScrapeVariant.GENERIC, generic)));
    }

    private static ValidatedPage page(String url, int images) {
        List<String> imageUrls = new ArrayList<>();
        for (int i = 0; i < images; i++) {
            imageUrls.add(url + "/img" + i + ".jpg");
        }
        return new ValidatedPage(url, "scrape", imageUrls, "matches barcode", "", "", null, null);
    }

    /** Rejects every URL of the batch. */
    private static PageScrapeTool rejectAll(List<List<String>> seen) {
        return (urls, instructions) -> {
            seen.add(urls);
            List<InvalidUrlRecord> invalid = urls.stream().map(u -> new InvalidUrlRecord(u, "different product")).toList();
            return new ValidationReport(null, "barcode", urls.size(), 0, List.of(), invalid);
        };
    }

    // =========================================================================
    //  Batching
    // =========================================================================

    @Nested
    @DisplayName("plan()")
    class Plan {

        @Test
        @DisplayName("marketplace batches come first, each at most batchSize long")
        void marketplaceFirst() {
            PageValidationService service = service(poolWith(rejectAll(new ArrayList<>()), rejectAll(new ArrayList<>())), SETTINGS);

            List<PageValidationService.Batch> batches = service.plan(List.of(
                    "https://a.example/1", "https://www.amazon.com/dp/1", "https://b.example/2",
                    "https://c.example/3", "https://d.example/4", "https://www.amazon.de/dp/2"));

            assertThat(batches).extracting(PageValidationService.Batch::variant)
                    .containsExactly(ScrapeVariant.MARKETPLACE, ScrapeVariant.GENERIC, ScrapeVariant.GENERIC);
            assertThat(batches.get(0).urls()).containsExactly("https://www.amazon.com/dp/1", "https://www.amazon.de/dp/2");
            assertThat(batches.get(1).urls()).hasSize(3);
            assertThat(batches.get(2).urls()).containsExactly("https://d.example/4");
        }
    }

    // =========================================================================
    //  validate()
    // =========================================================================

    @Nested
    @DisplayName("validate()")
    class Validate {

        @Test
        @DisplayName("an empty url list yields zero deltas")
        void emptyInput() {
            ValidationDelta delta = service(poolWith(rejectAll(new ArrayList<>()), rejectAll(new ArrayList<>())), SETTINGS)
                    .validate(List.of(), QUERY, "barcode");

            assertThat(delta).isEqualTo(ValidationDelta.empty());
        }

        @Test
        @DisplayName("early exit skips remaining batches once an image was found")
        void earlyExit() {
            List<List<String>> genericCalls = new ArrayList<>();
            PageScrapeTool marketplace = (urls, instructions) ->
                    new ValidationReport(null, "barcode", 1, 2, List.of(page(urls.get(0), 2)), List.of());
            PageValidationService service = service(poolWith(marketplace, rejectAll(genericCalls)), SETTINGS);

            ValidationDelta delta = service.validate(List.of(
                    "https://www.amazon.com/dp/1", "https://a.example/1", "https://b.example/2"), QUERY, "barcode");

            assertThat(genericCalls).isEmpty();
            assertThat(delta.images()).isEqualTo(2);
            assertThat(delta.checked()).isEqualTo(3);
            assertThat(delta.validatedPages()).extracting(ValidatedPage::url).containsExactly("https://www.amazon.com/dp/1");
            assertThat(delta.invalidUrls()).extracting(InvalidUrlRecord::reasoning)
                    .containsOnly(PageValidationService.SKIPPED_REASON).hasSize(2);
        }

        @Test
        @DisplayName("with early exit disabled every batch is validated")
        void earlyExitDisabled() {
            List<List<String>> genericCalls = new ArrayList<>();
            PageScrapeTool marketplace = (urls, instructions) ->
                    new ValidationReport(null, "barcode", 1, 1, List.of(page(urls.get(0), 1)), List.of());
            PageValidationService service = service(poolWith(marketplace, rejectAll(genericCalls)),
                    new PageValidationService.Settings(3, Duration.ofSeconds(5), Duration.ofSeconds(1), false, 2));

            ValidationDelta delta = service.validate(List.of(
                    "https://www.amazon.com/dp/1", "https://a.example/1"), QUERY, "barcode");

            assertThat(genericCalls).containsExactly(List.of("https://a.example/1"));
            assertThat(delta.invalidUrls()).extracting(InvalidUrlRecord::reasoning).containsExactly("different product");
        }

        @Test
        @DisplayName("URLs the answer leaves out are recorded as invalid")
        void missingUrls() {
            PageScrapeTool generic = (urls, instructions) ->
                    new ValidationReport(null, "barcode", 2, 0, List.of(), List.of(new InvalidUrlRecord(urls.get(0), "404")));
            PageValidationService service = service(poolWith(rejectAll(new ArrayList<>()), generic), SETTINGS);

            ValidationDelta delta = service.validate(List.of("https://a.example/1", "https://b.example/2"), QUERY, "sku");

            assertThat(delta.invalidUrls()).containsExactly(
                    new InvalidUrlRecord("https://a.example/1", "404"),
                    new InvalidUrlRecord("https://b.example/2", PageValidationService.MISSING_REASON));
        }

        @Test
        @DisplayName("a page answered under a rewritten URL counts once, as valid, under the batch URL")
        void rewrittenUrl() {
            PageScrapeTool generic = (urls, instructions) -> new ValidationReport(null, "barcode", 2, 2,
                    List.of(page("https://A.example/1/", 2), page("https://elsewhere.example/x", 3)),
                    List.of(new InvalidUrlRecord("https://a.example/1", "contradicting verdict")));
            PageValidationService service = service(poolWith(rejectAll(new ArrayList<>()), generic), SETTINGS);

            ValidationDelta delta = service.validate(List.of("https://a.example/1", "https://b.example/2"), QUERY, "barcode");

            assertThat(delta.validatedPages()).extracting(ValidatedPage::url).containsExactly("https://a.example/1");
            assertThat(delta.images()).isEqualTo(2);
            assertThat(delta.invalidUrls()).containsExactly(
                    new InvalidUrlRecord("https://b.example/2", PageValidationService.MISSING_REASON));
        }

        @Test
        @DisplayName("URL matching ignores scheme, www, host case, fragment and trailing slash only")
        void matchKey() {
            assertThat(PageValidationService.matchKey("http://WWW.Shop.example/Item/42/#top"))
                    .isEqualTo(PageValidationService.matchKey("https://shop.example/Item/42"));
            assertThat(PageValidationService.matchKey("https://shop.example/item/42"))
                    .isNotEqualTo(PageValidationService.matchKey("https://shop.example/Item/42"));
        }

        @Test
        @DisplayName("image count is summed from the pages, not from the reported total")
        void imagesFromPages() {
            PageScrapeTool generic = (urls, instructions) ->
                    new ValidationReport(null, "barcode", 2, 99, List.of(page(urls.get(0), 2), page(urls.get(1), 1)), List.of());
            PageValidationService service = service(poolWith(rejectAll(new ArrayList<>()), generic), SETTINGS);

            ValidationDelta delta = service.validate(List.of("https://a.example/1", "https://b.example/2"), QUERY, "barcode");

            assertThat(delta.images()).isEqualTo(3);
        }
    }

    // =========================================================================
    //  Failures
    // =========================================================================

    @Nested
    @DisplayName("batch failures")
    class Failures {

        @Test
        @DisplayName("a timed out batch marks every URL invalid")
        void timeout() {
            PageScrapeTool slow = (urls, instructions) -> {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ValidationReport.empty();
            };
            PageValidationService service = service(poolWith(rejectAll(new ArrayList<>()), slow),
                    new PageValidationService.Settings(3, Duration.ofMillis(50), Duration.ofMillis(10), true, 2));

            ValidationDelta delta = service.validate(List.of("https://a.example/1", "https://b.example/2"), QUERY, "barcode");

            assertThat(delta.checked()).isEqualTo(2);
            assertThat(delta.validatedPages()).isEmpty();
            assertThat(delta.invalidUrls()).hasSize(2)
                    .allSatisfy(record -> assertThat(record.reasoning()).contains("timed out"));
        }

        @Test
        @DisplayName("a tool error marks the batch invalid with a diagnostic")
        void toolError() {
            PageScrapeTool broken = (urls, instructions) -> {
                throw new ToolException("scraper returned HTTP 500");
            };
            PageValidationService service = service(poolWith(rejectAll(new ArrayList<>()), broken), SETTINGS);

            ValidationDelta delta = service.validate(List.of("https://a.example/1"), QUERY, "barcode");

            assertThat(delta.invalidUrls()).singleElement()
                    .satisfies(record -> assertThat(record.reasoning()).startsWith("Validation error").contains("HTTP 500"));
        }

        @Test
        @DisplayName("a dropped connection re-opens the session and retries the batch")
        void droppedConnectionRetried() {
            AtomicInteger opened = new AtomicInteger();
            ToolSessionPool pool = new ToolSessionPool(() -> {
                int generation = opened.incrementAndGet();
                PageScrapeTool generic = (urls, instructions) -> {
                    if (generation == 1) {
                        throw new ConnectionDroppedException("ClosedResourceError");
                    }
                    return new ValidationReport(null, "barcode", 1, 1, List.of(page(urls.get(0), 1)), List.of());
                };
                return new DefaultToolSession(Map.of(), Map.of(ScrapeVariant.GENERIC, generic));
            });

            ValidationDelta delta = service(pool, SETTINGS).validate(List.of("https://a.example/1"), QUERY, "barcode");

            assertThat(opened).hasValue(2);
            assertThat(delta.images()).isEqualTo(1);
            assertThat(delta.invalidUrls()).isEmpty();
        }

        @Test
        @DisplayName("without a scrape tool the model validates the batch")
        void modelFallback() {
            when(languageModel.complete(anyString(), anyString())).thenReturn("""
                    ```json
                    {"validated_pages": [{"url": "https://a.example/1", "image_urls": ["https://a.example/1.jpg"]}],
                     "invalid_urls": []}
                    ```""");
            ToolSessionPool pool = new ToolSessionPool(() -> new DefaultToolSession(Map.of(), Collections.emptyMap()));

            ValidationDelta delta = service(pool, SETTINGS).validate(List.of("https://a.example/1"), QUERY, "barcode");

            assertThat(delta.validatedPages()).singleElement()
                    .satisfies(page -> assertThat(page.imageUrls()).containsExactly("https://a.example/1.jpg"));
            assertThat(delta.images()).isEqualTo(1);
        }
    }
}
