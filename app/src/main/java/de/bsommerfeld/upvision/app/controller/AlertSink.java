package de.bsommerfeld.upvision.app.controller;

/**
 * User-facing notifications raised by the controller. A desktop front end
 * would show dialogs; the console front end logs.
 */
public interface AlertSink {

    void info(String title, String message);

    void warning(String title, String message);

    void error(String title, String message);
}
