package de.bsommerfeld.upvision.app;

import com.google.inject.Singleton;
import de.bsommerfeld.upvision.app.selfcheck.ShutdownHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Holds the main thread until something requests shutdown.
 */
@Singleton
public class ApplicationLifecycle implements ShutdownHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationLifecycle.class);

    private final CountDownLatch latch = new CountDownLatch(1);

    @Override
    public void requestShutdown() {
        LOG.info("Shutdown requested");
        latch.countDown();
    }

    public boolean isShutdownRequested() {
        return latch.getCount() == 0;
    }

    public void awaitShutdown() throws InterruptedException {
        latch.await();
    }

    public boolean awaitShutdown(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }
}
