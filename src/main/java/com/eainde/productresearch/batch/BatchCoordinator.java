package com.eainde.productresearch.batch;

import com.eainde.productresearch.model.BatchResult;
import com.eainde.productresearch.model.FinalResult;
import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.thread.MdcAwareExecutor;
import com.eainde.productresearch.workflow.ProductResearchService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Researches many products concurrently.
 *
 * <h3>Per product:</h3>
 * <ul>
 *   <li>runs on a pool of {@code concurrency} threads created for the batch</li>
 *   <li>a failed run is retried after {@code retryDelay}, up to {@code maxRetries} times</li>
 *   <li>a run that still fails becomes {@code {"error": ..., "status": "failed"}}</li>
 * </ul>
 * Results keep input order and are written to CSV.
 */
@Log4j2
public class BatchCoordinator {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ProductResearchService researchService;
    private final ObjectMapper objectMapper;
    private final BatchResultCsvWriter csvWriter;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Path outputDirectory;
    private final Clock clock;

    public BatchCoordinator(ProductResearchService researchService, ObjectMapper objectMapper,
                            BatchResultCsvWriter csvWriter, int maxRetries,
                            Duration retryDelay, Path outputDirectory, Clock clock) {
        this.researchService = researchService;
        this.objectMapper = objectMapper;
        this.csvWriter = csvWriter;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryDelay = retryDelay;
        this.outputDirectory = outputDirectory;
        this.clock = clock;
    }

    /**
     * @param outputPath CSV target; when null a timestamped file is created in the output directory
     * @throws IllegalArgumentException if {@code queries} is empty or {@code concurrency < 1}
     */
    public BatchRun runBatch(List<ProductQuery> queries, int concurrency, Path outputPath) {
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("No products to research");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }

        log.info("Batch started: {} products, concurrency {}", queries.size(), concurrency);
        MdcAwareExecutor workers = MdcAwareExecutor.fixed("batch", concurrency);
        List<BatchResult> results;
        try {
            List<CompletableFuture<BatchResult>> futures = new ArrayList<>(queries.size());
            for (int i = 0; i < queries.size(); i++) {
                ProductQuery query = queries.get(i);
                int position = i + 1;
                futures.add(CompletableFuture.supplyAsync(() -> runOne(query, position, queries.size()), workers));
            }
            results = futures.stream().map(CompletableFuture::join).toList();
        } finally {
            workers.shutdown();
        }

        Path target = outputPath != null ? outputPath : defaultOutputPath();
        Path written;
        try {
            written = csvWriter.write(results, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write batch results to " + target, e);
        }

        BatchSummary summary = BatchSummary.of(results, objectMapper);
        log.info("Batch finished: {} total, {} successful, {} failed", summary.total(), summary.successful(), summary.failed());
        return new BatchRun(results, written);
    }

    Path defaultOutputPath() {
        return outputDirectory.resolve("batch_results_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".csv");
    }

    private BatchResult runOne(ProductQuery query, int position, int total) {
        MDC.put(ProductResearchService.MDC_PRODUCT_KEY, query.key());
        try {
            log.info("Processing product {}/{}", position, total);
            return BatchResult.of(query, runWithRetry(query));
        } finally {
            MDC.remove(ProductResearchService.MDC_PRODUCT_KEY);
        }
    }

    private String runWithRetry(ProductQuery query) {
        Exception last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                FinalResult result = researchService.runSingle(query);
                return objectMapper.writeValueAsString(result);
            } catch (Exception e) {
                last = e;
                if (attempt < maxRetries) {
                    log.warn("Research failed, retrying in {} ms: {}", retryDelay.toMillis(), e.getMessage());
                    if (!sleep(retryDelay)) {
                        break;
                    }
                }
            }
        }
        log.error("Research failed after {} attempts", maxRetries + 1, last);
        return errorJson(last == null ? "unknown error" : String.valueOf(last.getMessage()));
    }

    private String errorJson(String message) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("error", message);
        error.put("status", "failed");
        return error.toString();
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
