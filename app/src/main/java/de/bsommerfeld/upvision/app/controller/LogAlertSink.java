package de.bsommerfeld.upvision.app.controller;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AlertSink} for headless runs: every alert becomes a log line.
 */
@Singleton
public class LogAlertSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(LogAlertSink.class);

    @Override
    public void info(String title, String message) {
        LOG.info("[{}] {}", title, message);
    }

    @Override
    public void warning(String title, String message) {
        LOG.warn("[{}] {}", title, message);
    }

    @Override
    public void error(String title, String message) {
        LOG.error("[{}] {}", title, message);
    }
}
