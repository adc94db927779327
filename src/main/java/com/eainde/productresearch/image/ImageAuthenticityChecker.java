package com.eainde.productresearch.image;

import com.eainde.productresearch.model.ValidatedPage;
import lombok.extern.log4j.Log4j2;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Verifies that extracted image URLs point at real, fetchable images.
 *
 * <p>Each unique URL is fetched once with a streaming GET; only the first bytes are read and
 * compared against known image signatures. A 200 response is accepted on a signature match
 * or on an image content type. Pages are kept even when all their images are rejected.</p>
 *
 * <p>Every {@link #clean} call has its own limit of {@code concurrency} fetches in flight.</p>
 */
@Log4j2
public class ImageAuthenticityChecker {

    static final Set<String> IMAGE_CONTENT_TYPES = Set.of(
            "image/jpeg", "image/png", "image/gif", "image/webp",
            "image/svg+xml", "image/bmp", "image/tiff", "image/x-icon");

    private static final byte[][] SIGNATURES = {
            {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF},                 // JPEG
            {(byte) 0x89, 'P', 'N', 'G'},                            // PNG
            {'G', 'I', 'F', '8', '7', 'a'},
            {'G', 'I', 'F', '8', '9', 'a'},
            {'R', 'I', 'F', 'F'}                                     // WEBP container
    };

    private final OkHttpClient httpClient;
    private final Executor executor;
    private final int concurrency;
    private final int sniffBytes;
    private final String userAgent;

    public ImageAuthenticityChecker(OkHttpClient baseClient, Executor executor, int concurrency,
                                    Duration timeout, int sniffBytes, String userAgent) {
        this.httpClient = baseClient.newBuilder()
                .followRedirects(true)
                .followSslRedirects(true)
                .callTimeout(timeout)
                .build();
        this.executor = executor;
        this.concurrency = Math.max(1, concurrency);
        this.sniffBytes = sniffBytes;
        this.userAgent = userAgent;
    }

    public record CleanupResult(List<ValidatedPage> pages, int totalImages) {
    }

    /**
     * Dedupes each page's image list in first-seen order and keeps only authentic images.
     */
    public CleanupResult clean(List<ValidatedPage> pages) {
        Semaphore permits = new Semaphore(concurrency);
        Map<String, CompletableFuture<Boolean>> checks = new LinkedHashMap<>();
        for (ValidatedPage page : pages) {
            for (String url : page.imageUrls()) {
                if (!checks.containsKey(url)) {
                    checks.put(url, submit(url, permits));
                }
            }
        }
        CompletableFuture.allOf(checks.values().toArray(new CompletableFuture[0])).join();

        List<ValidatedPage> cleaned = new ArrayList<>(pages.size());
        int total = 0;
        int rejected = 0;
        for (ValidatedPage page : pages) {
            List<String> kept = new ArrayList<>();
            for (String url : new LinkedHashSet<>(page.imageUrls())) {
                if (checks.get(url).join()) {
                    kept.add(url);
                } else {
                    rejected++;
                }
            }
            total += kept.size();
            cleaned.add(page.withImageUrls(kept));
        }
        log.info("[image_cleanup] {} unique urls checked, {} kept, {} rejected", checks.size(), total, rejected);
        return new CleanupResult(cleaned, total);
    }

    /** Waits for a free slot before handing the fetch to the executor. */
    private CompletableFuture<Boolean> submit(String url, Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.completedFuture(false);
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return isAuthentic(url);
                } finally {
                    permits.release();
                }
            }, executor);
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    public boolean isAuthentic(String url) {
        Request request;
        try {
            request = new Request.Builder().url(url).get().header("User-Agent", userAgent).build();
        } catch (IllegalArgumentException e) {
            log.debug("Rejecting malformed image url {}", url);
            return false;
        }

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() != 200) {
                log.debug("Rejecting {}: HTTP {}", url, response.code());
                return false;
            }
            ResponseBody body = response.body();
            if (body == null) {
                return false;
            }
            byte[] head = new byte[sniffBytes];
            int read;
            try (InputStream in = body.byteStream()) {
                read = in.readNBytes(head, 0, sniffBytes);
            }
            if (read == 0) {
                log.debug("Rejecting {}: empty body", url);
                return false;
            }
            return matchesSignature(head, read) || isImageContentType(response.header("Content-Type"));
        } catch (Exception e) {
            log.debug("Rejecting {}: {}", url, e.toString());
            return false;
        }
    }

    static boolean matchesSignature(byte[] head, int length) {
        for (byte[] signature : SIGNATURES) {
            if (length < signature.length) continue;
            boolean match = true;
            for (int i = 0; i < signature.length; i++) {
                if (head[i] != signature[i]) {
                    match = false;
                    break;
                }
            }
            if (match) return true;
        }
        return false;
    }

    static boolean isImageContentType(String contentType) {
        if (contentType == null) return false;
        String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return IMAGE_CONTENT_TYPES.contains(mediaType);
    }
}
