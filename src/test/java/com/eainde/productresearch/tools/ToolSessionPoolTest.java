package com.eainde.productresearch.tools;

import com.eainde.productresearch.model.SearchProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ToolSessionPoolTest {

    /** Session that counts how often it was closed. */
    private static final class CountingSession implements ToolSession {
        final AtomicInteger closed = new AtomicInteger();

        @Override
        public Optional<SearchTool> searchTool(SearchProvider provider) {
            return Optional.empty();
        }

        @Override
        public Optional<PageScrapeTool> scrapeTool(ScrapeVariant variant) {
            return Optional.empty();
        }

        @Override
        public void close() {
            closed.incrementAndGet();
        }
    }

    @Test
    @DisplayName("concurrent acquirers share one opened session")
    void sharedSession() {
        AtomicInteger opened = new AtomicInteger();
        ToolSessionPool pool = new ToolSessionPool(() -> {
            opened.incrementAndGet();
            return new CountingSession();
        });
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<ToolSession> sessions = IntStream.range(0, 32)
                    .mapToObj(i -> CompletableFuture.supplyAsync(pool::acquire, executor))
                    .toList()
                    .stream()
                    .map(CompletableFuture::join)
                    .toList();

            assertThat(opened).hasValue(1);
            assertThat(sessions).allSatisfy(session -> assertThat(session).isSameAs(sessions.get(0)));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("only the first invalidation of a broken session clears the cache")
    void invalidateOnce() {
        ToolSessionPool pool = new ToolSessionPool(CountingSession::new);
        CountingSession broken = (CountingSession) pool.acquire();

        assertThat(pool.invalidate(broken)).isTrue();
        ToolSession fresh = pool.acquire();
        assertThat(pool.invalidate(broken)).isFalse();

        assertThat(fresh).isNotSameAs(broken);
        assertThat(pool.acquire()).isSameAs(fresh);
        assertThat(broken.closed).hasValue(1);
    }

    @Test
    @DisplayName("replace swaps the session and closes the previous one")
    void replace() {
        ToolSessionPool pool = new ToolSessionPool(CountingSession::new);
        CountingSession previous = (CountingSession) pool.acquire();
        CountingSession next = new CountingSession();

        pool.replace(next);

        assertThat(pool.acquire()).isSameAs(next);
        assertThat(previous.closed).hasValue(1);
    }
}
