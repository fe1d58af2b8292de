package de.bsommerfeld.upvision.engine.enhance;

import de.bsommerfeld.upvision.core.domain.CheckpointInfo;

import java.awt.image.BufferedImage;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An {@link EnhancementHandle} bound to the checkpoint and device it was built
 * for. Calls to {@link #enhance(BufferedImage)} are serialized; the handle
 * underneath never sees two images at once.
 */
public final class Enhancer implements AutoCloseable {

    private final CheckpointInfo checkpoint;
    private final String device;
    private final boolean reducedPrecision;
    private final EnhancementHandle handle;
    private final ReentrantLock lock = new ReentrantLock();

    Enhancer(CheckpointInfo checkpoint, String device, boolean reducedPrecision, EnhancementHandle handle) {
        this.checkpoint = checkpoint;
        this.device = device;
        this.reducedPrecision = reducedPrecision;
        this.handle = handle;
    }

    public CheckpointInfo checkpoint() {
        return checkpoint;
    }

    /** Normalized device this enhancer runs on. */
    public String device() {
        return device;
    }

    public boolean isReducedPrecision() {
        return reducedPrecision;
    }

    public int scale() {
        return checkpoint.scaleFactor();
    }

    boolean matches(String checkpointName, String normalizedDevice) {
        return checkpoint.name().equals(checkpointName) && device.equals(normalizedDevice);
    }

    public BufferedImage enhance(BufferedImage image) {
        lock.lock();
        try {
            return handle.enhance(image, checkpoint.scaleFactor());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            handle.close();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Enhancer[" + checkpoint.name() + " x" + checkpoint.scaleFactor() + " on " + device
                + (reducedPrecision ? ", reduced" : "") + "]";
    }
}
