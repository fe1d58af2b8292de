package de.bsommerfeld.upvision.engine.enhance;

import de.bsommerfeld.upvision.core.domain.CheckpointInfo;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EnhancerTest {

    /** Records how many callers are inside {@link #enhance} at the same time. */
    private static final class RecordingHandle implements EnhancementHandle {

        private final AtomicInteger inside = new AtomicInteger();
        private final AtomicInteger maxInside = new AtomicInteger();
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public BufferedImage enhance(BufferedImage image, int scale) {
            int now = inside.incrementAndGet();
            maxInside.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inside.decrementAndGet();
            }
            calls.incrementAndGet();
            return image;
        }

        @Override
        public void close() {
        }
    }

    private static Enhancer enhancer(EnhancementHandle handle) {
        var checkpoint = new CheckpointInfo("model_x2", Path.of("model_x2.pth"), 2);
        return new Enhancer(checkpoint, "cpu", false, handle);
    }

    @Test
    void enhance_shouldNeverOverlapCallsOnHandle() throws Exception {
        var handle = new RecordingHandle();
        Enhancer enhancer = enhancer(handle);
        var image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
        var ready = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 2; t++) {
                futures.add(pool.submit(() -> {
                    ready.await();
                    for (int i = 0; i < 10; i++) {
                        enhancer.enhance(image);
                    }
                    return null;
                }));
            }
            ready.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(20, handle.calls.get());
        assertEquals(1, handle.maxInside.get());
    }

    @Test
    void scale_shouldFollowCheckpoint() {
        Enhancer enhancer = enhancer(new RecordingHandle());

        assertEquals(2, enhancer.scale());
        assertTrue(enhancer.matches("model_x2", "cpu"));
        assertFalse(enhancer.matches("model_x2", "cuda"));
    }
}
