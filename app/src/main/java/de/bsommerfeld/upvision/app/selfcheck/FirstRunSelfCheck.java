package de.bsommerfeld.upvision.app.selfcheck;

import com.google.inject.Singleton;
import de.bsommerfeld.upvision.app.controller.BatchController;
import de.bsommerfeld.upvision.app.controller.BatchRequest;
import de.bsommerfeld.upvision.core.config.FirstRunConfig;
import de.bsommerfeld.upvision.core.domain.BatchResult;
import de.bsommerfeld.upvision.core.domain.CheckpointInfo;
import de.bsommerfeld.upvision.engine.checkpoint.CheckpointRegistry;
import de.bsommerfeld.upvision.engine.device.DeviceProbe;
import de.bsommerfeld.upvision.engine.image.OutputNaming;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Verifies a fresh installation by enhancing a bundled sample image once.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>{@link #maybeStart()} does nothing if the sentinel exists. Otherwise it
 * runs a one-item batch over the sample with the first checkpoint, alerts
 * suppressed.</li>
 * <li>When that batch completes, a clean success writes the sentinel and
 * deletes the generated output. A failure leaves the sentinel absent so the
 * next start tries again.</li>
 * <li>Either way the application is shut down after a short delay.</li>
 * </ol>
 * Missing sample or missing checkpoints end in {@link SelfCheckState#SKIPPED}
 * without shutdown.
 */
@Singleton
public class FirstRunSelfCheck {

    private static final Logger LOG = LoggerFactory.getLogger(FirstRunSelfCheck.class);

    private final FirstRunConfig config;
    private final BatchController controller;
    private final CheckpointRegistry registry;
    private final DeviceProbe deviceProbe;
    private final SentinelStore sentinel;
    private final ShutdownHandler shutdownHandler;

    private volatile SelfCheckState state = SelfCheckState.IDLE;
    private volatile Path expectedOutput;
    private volatile boolean passed;

    @Inject
    public FirstRunSelfCheck(FirstRunConfig config, BatchController controller, CheckpointRegistry registry,
            DeviceProbe deviceProbe, SentinelStore sentinel, ShutdownHandler shutdownHandler) {
        this.config = config;
        this.controller = controller;
        this.registry = registry;
        this.deviceProbe = deviceProbe;
        this.sentinel = sentinel;
        this.shutdownHandler = shutdownHandler;

        controller.addCompletionListener(this::onBatchFinished);
    }

    /**
     * Starts the self-check if this installation has not passed it yet.
     *
     * @return {@code true} if the sample batch was started
     */
    public synchronized boolean maybeStart() {
        if (!config.isEnabled()) {
            LOG.debug("First-run self-check disabled");
            return false;
        }
        if (sentinel.exists()) {
            return false;
        }
        state = SelfCheckState.CHECKING;

        Path sample = config.sampleImagePath().toAbsolutePath();
        if (!Files.isRegularFile(sample)) {
            LOG.info("First-run self-check skipped: sample image {} not found", sample);
            state = SelfCheckState.SKIPPED;
            return false;
        }
        List<CheckpointInfo> checkpoints = registry.discover();
        if (checkpoints.isEmpty()) {
            LOG.info("First-run self-check skipped: no checkpoint in {}", registry.directory());
            state = SelfCheckState.SKIPPED;
            return false;
        }

        CheckpointInfo checkpoint = checkpoints.get(0);
        Path destination = sample.getParent();
        expectedOutput = OutputNaming.outputPath(sample, destination, checkpoint.scaleFactor());
        String device = deviceProbe.probe().preferredDevice();

        LOG.info("First-run self-check: enhancing {} with '{}' on {}", sample.getFileName(), checkpoint.name(),
                device);
        state = SelfCheckState.AUTO_RUNNING;
        boolean started = controller.start(new BatchRequest(List.of(sample), destination, checkpoint.name(), device),
                true);
        if (!started) {
            LOG.warn("First-run self-check could not start its batch");
            state = SelfCheckState.SKIPPED;
            expectedOutput = null;
        }
        return started;
    }

    /**
     * Evaluates the self-check batch. Completions of other batches are
     * ignored.
     *
     * @return outcome per generated file; empty if nothing was cleaned up
     */
    public synchronized List<CleanupOutcome> onBatchFinished(BatchResult result) {
        if (state != SelfCheckState.AUTO_RUNNING) {
            return List.of();
        }
        List<CleanupOutcome> outcomes = List.of();
        if (result.isCleanSuccess()) {
            state = SelfCheckState.SUCCESS;
            try {
                sentinel.write();
                state = SelfCheckState.SENTINEL_WRITTEN;
                passed = true;
                outcomes = cleanup();
                LOG.info("First-run self-check passed. Application ready to use.");
            } catch (IOException e) {
                LOG.error("First-run self-check passed but sentinel {} could not be written: {}",
                        sentinel.location(), e.getMessage());
                state = SelfCheckState.FAILURE;
            }
        } else {
            state = SelfCheckState.FAILURE;
            LOG.warn("First-run self-check failed ({}). Fix the environment and restart to try again.",
                    result.summaryLine());
        }
        expectedOutput = null;
        scheduleShutdown();
        return outcomes;
    }

    private List<CleanupOutcome> cleanup() {
        List<CleanupOutcome> outcomes = new ArrayList<>();
        Path output = expectedOutput;
        if (output == null) {
            return outcomes;
        }
        try {
            if (Files.deleteIfExists(output)) {
                outcomes.add(CleanupOutcome.removed(output));
                LOG.info("Removed self-check output {}", output.getFileName());
            }
        } catch (IOException e) {
            LOG.warn("Could not remove self-check output {}: {}", output.getFileName(), e.getMessage());
            outcomes.add(CleanupOutcome.failed(output, e.getMessage()));
        }
        return outcomes;
    }

    private void scheduleShutdown() {
        long delay = Math.max(0, config.getShutdownDelayMillis());
        state = SelfCheckState.SHUTDOWN_SCHEDULED;
        LOG.info("Shutting down in {} ms", delay);
        CompletableFuture.runAsync(shutdownHandler::requestShutdown,
                CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS));
    }

    public SelfCheckState state() {
        return state;
    }

    /** Whether the self-check passed during this session. */
    public boolean hasPassed() {
        return passed;
    }

    /** Output the running self-check will produce, or {@code null}. */
    public Path expectedOutput() {
        return expectedOutput;
    }
}
