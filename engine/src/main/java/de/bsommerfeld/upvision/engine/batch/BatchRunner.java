package de.bsommerfeld.upvision.engine.batch;

import com.google.inject.Singleton;
import de.bsommerfeld.upvision.core.domain.BatchResult;
import de.bsommerfeld.upvision.core.domain.CheckpointInfo;
import de.bsommerfeld.upvision.core.event.BatchEvent;
import de.bsommerfeld.upvision.core.event.BatchEventSink;
import de.bsommerfeld.upvision.engine.DirectoryCreationException;
import de.bsommerfeld.upvision.engine.EngineException;
import de.bsommerfeld.upvision.engine.ItemProcessingException;
import de.bsommerfeld.upvision.engine.ItemProcessingException.Stage;
import de.bsommerfeld.upvision.engine.checkpoint.CheckpointRegistry;
import de.bsommerfeld.upvision.engine.enhance.Enhancer;
import de.bsommerfeld.upvision.engine.enhance.EnhancerCache;
import de.bsommerfeld.upvision.engine.image.ImageCodec;
import de.bsommerfeld.upvision.engine.image.OutputNaming;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Processes a batch of images under one checkpoint/device pair.
 *
 * <p>
 * Every item ends in exactly one outcome ({@code OK} or {@code ERROR}) and one
 * {@link BatchEvent.Progress}; a failing item never stops the rest. Errors a
 * native backend typically raises count as item failures too. The last
 * event of every run is a single {@link BatchEvent.Done} carrying the same
 * {@link BatchResult} that {@link #run} returns.
 *
 * <p>
 * Not reentrant. The caller guarantees one run at a time.
 */
@Singleton
public class BatchRunner {

    private static final Logger LOG = LoggerFactory.getLogger(BatchRunner.class);

    private final CheckpointRegistry registry;
    private final EnhancerCache enhancerCache;
    private final ImageCodec codec;

    @Inject
    public BatchRunner(CheckpointRegistry registry, EnhancerCache enhancerCache, ImageCodec codec) {
        this.registry = registry;
        this.enhancerCache = enhancerCache;
        this.codec = codec;
    }

    public BatchResult run(List<Path> items, Path destination, String checkpointName, String device,
            BatchEventSink sink) {
        long start = System.nanoTime();

        Enhancer enhancer;
        try {
            enhancer = prepare(destination, checkpointName, device);
        } catch (EngineException e) {
            LOG.error("Batch aborted before first item: {}", e.getMessage());
            BatchResult result = BatchResult.empty(elapsedSeconds(start));
            sink.push(new BatchEvent.Error(e.getMessage()));
            sink.push(new BatchEvent.Done(result));
            return result;
        }

        int total = items.size();
        int succeeded = 0;
        int failed = 0;
        LOG.info("Starting batch of {} item(s) with {} into {}", total, enhancer, destination);

        for (int i = 0; i < total; i++) {
            Path item = items.get(i);
            String label = labelOf(item);
            sink.push(new BatchEvent.Log("processing " + label));
            try {
                Path output = processItem(item, destination, enhancer);
                succeeded++;
                sink.push(new BatchEvent.Log("OK " + label + " -> " + output.getFileName()));
            } catch (ItemProcessingException e) {
                failed++;
                LOG.warn("{} failed at {}: {}", label, e.getStage(), e.getMessage());
                sink.push(new BatchEvent.Log("ERROR " + label + ": " + e.getMessage()));
            } catch (Exception | LinkageError | StackOverflowError | OutOfMemoryError | AssertionError e) {
                failed++;
                LOG.warn("{} failed unexpectedly", label, e);
                sink.push(new BatchEvent.Log("ERROR " + label + ": " + describe(e)));
            }
            sink.push(new BatchEvent.Progress(i + 1, total, label));
        }

        BatchResult result = new BatchResult(total, succeeded, failed, elapsedSeconds(start));
        LOG.info(result.summaryLine());
        sink.push(new BatchEvent.Done(result));
        return result;
    }

    private Enhancer prepare(Path destination, String checkpointName, String device) throws EngineException {
        try {
            Files.createDirectories(destination);
        } catch (IOException e) {
            throw new DirectoryCreationException(destination, e);
        }
        CheckpointInfo checkpoint = registry.resolve(checkpointName);
        return enhancerCache.ensure(checkpoint, device);
    }

    private Path processItem(Path item, Path destination, Enhancer enhancer) throws ItemProcessingException {
        BufferedImage input = codec.decode(item);
        BufferedImage enhanced;
        try {
            enhanced = enhancer.enhance(input);
        } catch (RuntimeException | LinkageError | StackOverflowError | OutOfMemoryError | AssertionError e) {
            throw new ItemProcessingException(Stage.ENHANCE, item, describe(e), e);
        }
        Path output = OutputNaming.outputPath(item, destination, enhancer.scale());
        codec.encode(enhanced, output);
        return output;
    }

    private static String labelOf(Path item) {
        Path name = item.getFileName();
        return name == null ? item.toString() : name.toString();
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
