/**
 * Orchestration core of UpVision.
 *
 * <h2>Components</h2>
 *
 * <pre>
 * checkpoint.CheckpointRegistry  discovers *.pth files, infers scale, caches by name
 * device.DeviceProbe             normalized runtime summary + device-string normalization
 * enhance.EnhancerCache          single-slot cache of the expensive enhancer
 * batch.BatchRunner              per-item loop with failure isolation and events
 * image.ImageCodec               decode/encode boundary (ImageIO by default)
 * </pre>
 *
 * <h2>Threading</h2>
 * {@code BatchRunner.run} executes on one background thread at a time and
 * only talks to the observer through a
 * {@link de.bsommerfeld.upvision.core.event.BatchEventSink}. Enhancement
 * calls on a shared enhancer are serialized by the enhancer itself.
 *
 * <h2>Errors</h2>
 * All recoverable failures extend {@link de.bsommerfeld.upvision.engine.EngineException}.
 * Item failures ({@link de.bsommerfeld.upvision.engine.ItemProcessingException})
 * are recorded per item; everything else aborts a run before its first item.
 */
package de.bsommerfeld.upvision.engine;
