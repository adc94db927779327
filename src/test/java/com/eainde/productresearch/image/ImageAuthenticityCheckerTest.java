package com.eainde.productresearch.image;

import com.eainde.productresearch.model.ValidatedPage;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ImageAuthenticityCheckerTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D};
    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10};

    private MockWebServer server;
    private ExecutorService executor;
    private ImageAuthenticityChecker checker;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath() == null ? "" : request.getPath();
                if (path.startsWith("/slow/")) {
                    return slow();
                }
                return switch (path) {
                    case "/kettle.png" -> binary(PNG, "application/octet-stream");
                    case "/kettle.jpg" -> binary(JPEG, "image/jpeg");
                    case "/typed" -> new MockResponse().setBody("not really bytes")
                            .setHeader("Content-Type", "image/webp; charset=binary");
                    case "/page.html" -> new MockResponse().setBody("<html>login</html>")
                            .setHeader("Content-Type", "text/html");
                    case "/empty.png" -> new MockResponse().setHeader("Content-Type", "image/png");
                    case "/moved" -> new MockResponse().setResponseCode(302).setHeader("Location", "/kettle.png");
                    case "/gone.png" -> binary(PNG, "image/png").setResponseCode(404);
                    default -> new MockResponse().setResponseCode(404);
                };
            }
        });
        server.start();
        executor = Executors.newCachedThreadPool();
        checker = new ImageAuthenticityChecker(new OkHttpClient(), executor, 2,
                Duration.ofSeconds(5), 16, "test-agent");
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdownNow();
        server.shutdown();
    }

    private MockResponse slow() {
        peakInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            Thread.sleep(300);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            inFlight.decrementAndGet();
        }
        return binary(PNG, "image/png");
    }

    private ValidatedPage pageWithSlowImages(String prefix, int count) {
        List<String> images = IntStream.range(0, count).mapToObj(i -> url("/slow/" + prefix + i + ".png")).toList();
        return new ValidatedPage("https://shop.example/" + prefix, "scrape", images, "", "", "", null, null);
    }

    private static MockResponse binary(byte[] bytes, String contentType) {
        return new MockResponse().setBody(new Buffer().write(bytes)).setHeader("Content-Type", contentType);
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    // =========================================================================
    //  isAuthentic()
    // =========================================================================

    @Nested
    @DisplayName("isAuthentic()")
    class IsAuthentic {

        @Test
        @DisplayName("accepts a PNG signature regardless of content type")
        void pngSignature() {
            assertThat(checker.isAuthentic(url("/kettle.png"))).isTrue();
        }

        @Test
        @DisplayName("accepts an image content type without a known signature")
        void imageContentType() {
            assertThat(checker.isAuthentic(url("/typed"))).isTrue();
        }

        @Test
        @DisplayName("follows redirects")
        void redirect() {
            assertThat(checker.isAuthentic(url("/moved"))).isTrue();
        }

        @Test
        @DisplayName("rejects HTML pages, missing images and empty bodies")
        void rejects() {
            assertThat(checker.isAuthentic(url("/page.html"))).isFalse();
            assertThat(checker.isAuthentic(url("/missing.jpg"))).isFalse();
            assertThat(checker.isAuthentic(url("/empty.png"))).isFalse();
        }

        @Test
        @DisplayName("rejects a 404 even when the body is a valid PNG with an image content type")
        void notFoundWithImageBytes() {
            assertThat(checker.isAuthentic(url("/gone.png"))).isFalse();
        }

        @Test
        @DisplayName("rejects malformed urls without a request")
        void malformed() {
            assertThat(checker.isAuthentic("not a url")).isFalse();
        }
    }

    // =========================================================================
    //  clean()
    // =========================================================================

    @Test
    @DisplayName("clean() dedupes per page, keeps pages and recomputes the total")
    void clean() {
        ValidatedPage first = new ValidatedPage("https://shop.example/a", "scrape",
                List.of(url("/kettle.png"), url("/kettle.png"), url("/missing.jpg"), url("/kettle.jpg")),
                "", "", "", null, null);
        ValidatedPage second = new ValidatedPage("https://shop.example/b", "scrape",
                List.of(url("/page.html")), "", "", "", null, null);

        ImageAuthenticityChecker.CleanupResult result = checker.clean(List.of(first, second));

        assertThat(result.pages()).hasSize(2);
        assertThat(result.pages().get(0).imageUrls()).containsExactly(url("/kettle.png"), url("/kettle.jpg"));
        assertThat(result.pages().get(1).imageUrls()).isEmpty();
        assertThat(result.totalImages()).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("clean() keeps at most concurrency fetches in flight")
    void boundedWithinOneRun() {
        ImageAuthenticityChecker.CleanupResult result = checker.clean(List.of(pageWithSlowImages("a", 6)));

        assertThat(result.totalImages()).isEqualTo(6);
        assertThat(peakInFlight.get()).isLessThanOrEqualTo(2);
    }

    @Test
    @DisplayName("concurrent clean() calls each get their own fetch limit")
    void limitIsPerRun() {
        ExecutorService runs = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<ImageAuthenticityChecker.CleanupResult> first = CompletableFuture.supplyAsync(
                    () -> checker.clean(List.of(pageWithSlowImages("first", 4))), runs);
            CompletableFuture<ImageAuthenticityChecker.CleanupResult> second = CompletableFuture.supplyAsync(
                    () -> checker.clean(List.of(pageWithSlowImages("second", 4))), runs);

            assertThat(first.join().totalImages()).isEqualTo(4);
            assertThat(second.join().totalImages()).isEqualTo(4);
        } finally {
            runs.shutdownNow();
        }

        assertThat(peakInFlight.get()).isGreaterThan(2).isLessThanOrEqualTo(4);
    }

    @Test
    @DisplayName("content type parameters and case are ignored")
    void contentTypeParsing() {
        assertThat(ImageAuthenticityChecker.isImageContentType("IMAGE/PNG; q=1")).isTrue();
        assertThat(ImageAuthenticityChecker.isImageContentType("text/html")).isFalse();
        assertThat(ImageAuthenticityChecker.isImageContentType(null)).isFalse();
    }

    @Test
    @DisplayName("signatures need enough leading bytes")
    void signatures() {
        assertThat(ImageAuthenticityChecker.matchesSignature("GIF89a....".getBytes(), 10)).isTrue();
        assertThat(ImageAuthenticityChecker.matchesSignature("GIF8".getBytes(), 4)).isFalse();
    }
}
