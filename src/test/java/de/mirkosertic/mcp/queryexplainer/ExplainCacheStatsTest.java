package de.mirkosertic.mcp.queryexplainer;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ExplainCacheStatsTest {

    @Test
    void testMetricsTracking() {
        final ExplainCacheStats stats = new ExplainCacheStats();

        assertThat(stats.getTotalRequests()).isEqualTo(0);
        assertThat(stats.getHitRate()).isEqualTo(0.0);

        stats.recordHit();
        stats.recordHit();
        stats.recordHit();
        stats.recordMiss();

        assertThat(stats.getTotalRequests()).isEqualTo(4);
        assertThat(stats.getCacheHits()).isEqualTo(3);
        assertThat(stats.getCacheMisses()).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(75.0);

        stats.recordEviction();
        stats.setCurrentSize(42);

        assertThat(stats.getEvictions()).isEqualTo(1);
        assertThat(stats.getCurrentSize()).isEqualTo(42);
        assertThat(stats.toString()).contains("hits=3").contains("size=42");
    }

    @Test
    void testConcurrentRecording() throws InterruptedException {
        final ExplainCacheStats stats = new ExplainCacheStats();
        final int threads = 8;
        final int perThread = 1000;
        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        final CountDownLatch latch = new CountDownLatch(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                for (int j = 0; j < perThread; j++) {
                    if (j % 2 == 0) {
                        stats.recordHit();
                    } else {
                        stats.recordMiss();
                    }
                }
                latch.countDown();
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(stats.getTotalRequests()).isEqualTo(threads * perThread);
        assertThat(stats.getCacheHits()).isEqualTo(threads * perThread / 2);
        assertThat(stats.getHitRate()).isEqualTo(50.0);
    }
}
