package com.eainde.productresearch.batch;

import com.eainde.productresearch.model.BatchResult;
import com.eainde.productresearch.model.FinalResult;
import com.eainde.productresearch.model.FinalResult.ProductSummary;
import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.workflow.ProductResearchService;
import com.eainde.productresearch.workflow.ResearchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchCoordinatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    @Mock private ProductResearchService researchService;

    @TempDir Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private BatchCoordinator coordinator() {
        return new BatchCoordinator(researchService, objectMapper, new BatchResultCsvWriter(),
                1, Duration.ofMillis(10), tempDir, CLOCK);
    }

    private static FinalResult resultFor(ProductQuery query, int images) {
        return new FinalResult(ProductSummary.of(query), "barcode", 3, images, List.of(), List.of());
    }

    // =========================================================================
    //  Results
    // =========================================================================

    @Nested
    @DisplayName("runBatch()")
    class RunBatch {

        @Test
        @DisplayName("keeps input order and writes the CSV")
        void orderAndCsv() throws Exception {
            ProductQuery first = new ProductQuery("012345678905", "AB-1", "Kettle");
            ProductQuery second = new ProductQuery("", "CD-22222", "Toaster, 2 slice");
            when(researchService.runSingle(first)).thenAnswer(inv -> {
                Thread.sleep(100);
                return resultFor(first, 2);
            });
            when(researchService.runSingle(second)).thenReturn(resultFor(second, 0));

            Path target = tempDir.resolve("out/results.csv");
            BatchRun run = coordinator().runBatch(List.of(first, second), 2, target);

            assertThat(run.outputFile()).isEqualTo(target.toAbsolutePath());
            assertThat(run.results()).extracting(BatchResult::sku).containsExactly("AB-1", "CD-22222");
            JsonNode firstJson = objectMapper.readTree(run.results().get(0).result());
            assertThat(firstJson.get("total_validated_images").asInt()).isEqualTo(2);

            List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
            assertThat(lines.get(0)).isEqualTo("barcode,sku,title,result");
            assertThat(lines.get(2)).contains("\"Toaster, 2 slice\"");
        }

        @Test
        @DisplayName("a failed run is retried once")
        void retriedOnce() {
            ProductQuery query = new ProductQuery("012345678905", "", "");
            when(researchService.runSingle(query))
                    .thenThrow(new ResearchException("graph failed"))
                    .thenReturn(resultFor(query, 1));

            BatchRun run = coordinator().runBatch(List.of(query), 3, tempDir.resolve("r.csv"));

            verify(researchService, times(2)).runSingle(query);
            assertThat(run.results().get(0).result()).doesNotContain("\"error\"");
        }

        @Test
        @DisplayName("a second failure becomes an error result")
        void errorResult() throws Exception {
            ProductQuery query = new ProductQuery("012345678905", "", "");
            when(researchService.runSingle(query)).thenThrow(new ResearchException("graph failed"));

            BatchRun run = coordinator().runBatch(List.of(query), 3, tempDir.resolve("r.csv"));

            JsonNode json = objectMapper.readTree(run.results().get(0).result());
            assertThat(json.get("error").asText()).isEqualTo("graph failed");
            assertThat(json.get("status").asText()).isEqualTo("failed");
            assertThat(BatchSummary.of(run.results(), objectMapper)).isEqualTo(new BatchSummary(1, 0, 1));
        }

        @Test
        @DisplayName("no more than concurrency products run at once")
        void boundedConcurrency() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            when(researchService.runSingle(any())).thenAnswer(inv -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(50);
                running.decrementAndGet();
                return resultFor(inv.getArgument(0), 0);
            });
            List<ProductQuery> queries = java.util.stream.IntStream.range(0, 8)
                    .mapToObj(i -> new ProductQuery("", "SKU-0000" + i, ""))
                    .toList();

            BatchRun run = coordinator().runBatch(queries, 2, tempDir.resolve("r.csv"));

            assertThat(run.results()).hasSize(8);
            assertThat(peak.get()).isLessThanOrEqualTo(2);
        }

        @Test
        @DisplayName("a batch uses no more worker threads than its concurrency")
        void boundedThreads() {
            Set<String> workers = ConcurrentHashMap.newKeySet();
            when(researchService.runSingle(any())).thenAnswer(inv -> {
                workers.add(Thread.currentThread().getName());
                Thread.sleep(20);
                return resultFor(inv.getArgument(0), 0);
            });
            List<ProductQuery> queries = java.util.stream.IntStream.range(0, 12)
                    .mapToObj(i -> new ProductQuery("", "SKU-0000" + i, ""))
                    .toList();

            BatchRun run = coordinator().runBatch(queries, 3, tempDir.resolve("r.csv"));

            assertThat(run.results()).hasSize(12);
            assertThat(workers).hasSizeLessThanOrEqualTo(3).allMatch(name -> name.startsWith("batch-"));
        }

        @Test
        @DisplayName("without an output path a timestamped file is created")
        void defaultOutputPath() {
            ProductQuery query = new ProductQuery("012345678905", "", "");
            when(researchService.runSingle(eq(query))).thenReturn(resultFor(query, 0));

            BatchRun run = coordinator().runBatch(List.of(query), 1, null);

            assertThat(run.outputFile().getFileName().toString()).isEqualTo("batch_results_20240305_140709.csv");
            assertThat(run.outputFile()).exists();
        }
    }

    @Test
    @DisplayName("an empty product list is rejected")
    void emptyRejected() {
        assertThatThrownBy(() -> coordinator().runBatch(List.of(), 3, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator().runBatch(List.of(new ProductQuery("1", "", "")), 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
