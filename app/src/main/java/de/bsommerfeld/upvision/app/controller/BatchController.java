package de.bsommerfeld.upvision.app.controller;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.upvision.core.config.EngineConfig;
import de.bsommerfeld.upvision.core.domain.BatchResult;
import de.bsommerfeld.upvision.core.domain.CheckpointInfo;
import de.bsommerfeld.upvision.core.event.ApplicationEventBus;
import de.bsommerfeld.upvision.core.event.BatchEvent;
import de.bsommerfeld.upvision.core.event.BatchEventChannel;
import de.bsommerfeld.upvision.engine.batch.BatchRunner;
import de.bsommerfeld.upvision.engine.checkpoint.CheckpointRegistry;
import de.bsommerfeld.upvision.engine.device.DeviceProbe;
import de.bsommerfeld.upvision.engine.enhance.EnhancerCache;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Control surface of a batch run.
 *
 * <h3>Threads</h3>
 * The batch itself runs on a single background worker. Its events travel
 * through the {@link BatchEventChannel} and are picked up by
 * {@link #pollOnce()}, either on the caller's thread or on the poller started
 * by {@link #startPolling()}. All state that a view reads ({@code processing},
 * progress, log buffer) is updated from the polling side only.
 *
 * <h3>One batch at a time</h3>
 * {@link #start} flips {@code processing} with a compare-and-set; the flag is
 * cleared when the run's {@link BatchEvent.Done} is drained, not when the
 * worker returns.
 */
@Singleton
public class BatchController {

    private static final Logger LOG = LoggerFactory.getLogger(BatchController.class);

    static final int MAX_LOG_LINES = 1000;
    static final String ALERT_TITLE = "UpVision";
    public static final String CANCEL_NOTICE =
            "Immediate cancellation is not available. Wait for the current image to finish.";

    private final BatchRunner runner;
    private final CheckpointRegistry registry;
    private final DeviceProbe deviceProbe;
    private final EnhancerCache enhancerCache;
    private final BatchEventChannel channel;
    private final ApplicationEventBus eventBus;
    private final AlertSink alerts;
    private final EngineConfig config;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("batch-worker-%d").setDaemon(true).build());
    private final ScheduledExecutorService poller = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("batch-poller-%d").setDaemon(true).build());

    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final Deque<String> logLines = new ArrayDeque<>();
    private final List<Consumer<BatchResult>> completionListeners = new CopyOnWriteArrayList<>();

    private volatile boolean quiet;
    private volatile double progressPercent;
    private volatile String progressLabel = "";

    @Inject
    public BatchController(BatchRunner runner, CheckpointRegistry registry, DeviceProbe deviceProbe,
            EnhancerCache enhancerCache, BatchEventChannel channel, ApplicationEventBus eventBus,
            AlertSink alerts, EngineConfig config) {
        this.runner = runner;
        this.registry = registry;
        this.deviceProbe = deviceProbe;
        this.enhancerCache = enhancerCache;
        this.channel = channel;
        this.eventBus = eventBus;
        this.alerts = alerts;
        this.config = config;
    }

    public boolean start(BatchRequest request) {
        return start(request, false);
    }

    /**
     * Starts a batch in the background.
     *
     * @param quiet suppresses alerts for this run; log lines are still kept
     * @return {@code false} if the request was refused
     */
    public boolean start(BatchRequest request, boolean quiet) {
        if (processing.get()) {
            return refuse("A batch is already running.", quiet);
        }
        if (request.items().isEmpty()) {
            return refuse("Select at least one image.", quiet);
        }
        if (request.destination() == null) {
            return refuse("Choose an output directory.", quiet);
        }
        List<CheckpointInfo> checkpoints = registry.list();
        if (checkpoints.isEmpty()) {
            return refuse("No checkpoint found in " + registry.directory(), quiet);
        }
        String checkpointName = request.checkpointName();
        if (checkpointName == null || checkpointName.isBlank()) {
            checkpointName = checkpoints.get(0).name();
        } else if (checkpoints.stream().noneMatch(c -> c.name().equals(request.checkpointName()))) {
            return refuse("Choose a valid checkpoint.", quiet);
        }
        String device = request.device() == null ? config.getDefaultDevice() : request.device();
        String normalized = deviceProbe.normalize(device);
        if (deviceProbe.isAccelerated(normalized) && !deviceProbe.probe().acceleratorAvailable()) {
            return refuse("Accelerator '" + normalized + "' is not available in this environment.", quiet);
        }

        if (!processing.compareAndSet(false, true)) {
            return refuse("A batch is already running.", quiet);
        }
        this.quiet = quiet;
        this.progressPercent = 0.0;
        this.progressLabel = String.format(Locale.ROOT, "0 / %d", request.items().size());
        appendLog("Starting processing...");

        BatchRequest resolved = new BatchRequest(request.items(), request.destination(), checkpointName, normalized);
        worker.execute(() -> runSafely(resolved));
        return true;
    }

    private void runSafely(BatchRequest request) {
        long start = System.nanoTime();
        try {
            runner.run(request.items(), request.destination(), request.checkpointName(), request.device(), channel);
        } catch (Throwable t) {
            LOG.error("Batch worker failed unexpectedly", t);
            String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
            channel.push(new BatchEvent.Error("Unexpected failure: " + message));
            channel.push(new BatchEvent.Done(BatchResult.empty((System.nanoTime() - start) / 1_000_000_000.0)));
        }
    }

    private boolean refuse(String reason, boolean quiet) {
        LOG.warn("Batch refused: {}", reason);
        if (!quiet) {
            alerts.warning(ALERT_TITLE, reason);
        }
        return false;
    }

    /**
     * Drains all pending events without blocking.
     *
     * @return number of events handled
     */
    public int pollOnce() {
        return channel.drain(this::handle);
    }

    private void handle(BatchEvent event) {
        if (event instanceof BatchEvent.Log log) {
            appendLog(log.text());
        } else if (event instanceof BatchEvent.Progress p) {
            progressPercent = p.percent();
            progressLabel = String.format(Locale.ROOT, "Processing: %s (%d / %d)", p.itemLabel(), p.current(),
                    p.total());
        } else if (event instanceof BatchEvent.Error error) {
            appendLog("ERROR " + error.message());
            if (!quiet) {
                alerts.error(ALERT_TITLE, error.message());
            }
        } else if (event instanceof BatchEvent.Done done) {
            finish(done.result());
        }
        eventBus.post(event);
    }

    private void finish(BatchResult result) {
        processing.set(false);
        String summary = result.summaryLine();
        appendLog(summary);
        if (!quiet) {
            progressLabel = "Done";
            alerts.info(ALERT_TITLE, summary);
        }
        for (Consumer<BatchResult> listener : completionListeners) {
            try {
                listener.accept(result);
            } catch (RuntimeException e) {
                LOG.error("Completion listener failed", e);
            }
        }
    }

    /**
     * Schedules {@link #pollOnce()} at the configured interval. Calling it
     * again has no effect.
     */
    public void startPolling() {
        if (!polling.compareAndSet(false, true)) {
            return;
        }
        long interval = Math.max(1, config.getPollIntervalMillis());
        poller.scheduleWithFixedDelay(() -> {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                // an escaping exception would cancel the schedule
                LOG.error("Polling batch events failed", e);
            }
        }, 0, interval, TimeUnit.MILLISECONDS);
        LOG.debug("Polling batch events every {} ms", interval);
    }

    /**
     * Answers a cancel request. Items are never interrupted mid-way, so this
     * only tells the user to wait.
     */
    public String requestCancel() {
        LOG.info(CANCEL_NOTICE);
        if (processing.get() && !quiet) {
            alerts.info("Cancel", CANCEL_NOTICE);
        }
        return CANCEL_NOTICE;
    }

    /**
     * Stops polling, waits briefly for a running item and releases the
     * enhancer. Remaining events are drained once more.
     */
    public void shutdown() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Batch worker still busy at shutdown");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
        poller.shutdownNow();
        pollOnce();
        enhancerCache.invalidate();
    }

    public void addCompletionListener(Consumer<BatchResult> listener) {
        completionListeners.add(listener);
    }

    public boolean isProcessing() {
        return processing.get();
    }

    public double progressPercent() {
        return progressPercent;
    }

    public String progressLabel() {
        return progressLabel;
    }

    public List<String> logLines() {
        synchronized (logLines) {
            return new ArrayList<>(logLines);
        }
    }

    private void appendLog(String line) {
        LOG.info(line);
        synchronized (logLines) {
            logLines.addLast(line);
            while (logLines.size() > MAX_LOG_LINES) {
                logLines.removeFirst();
            }
        }
    }
}
