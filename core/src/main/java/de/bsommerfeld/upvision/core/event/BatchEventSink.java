package de.bsommerfeld.upvision.core.event;

/**
 * Producer side of the batch event stream. Implementations must never block
 * the caller.
 */
@FunctionalInterface
public interface BatchEventSink {

    void push(BatchEvent event);
}
