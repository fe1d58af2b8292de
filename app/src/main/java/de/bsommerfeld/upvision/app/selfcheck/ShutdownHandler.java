package de.bsommerfeld.upvision.app.selfcheck;

/**
 * Callback that ends the application.
 */
@FunctionalInterface
public interface ShutdownHandler {

    void requestShutdown();
}
