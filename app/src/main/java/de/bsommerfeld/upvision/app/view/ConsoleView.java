package de.bsommerfeld.upvision.app.view;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.upvision.core.event.ApplicationEventBus;
import de.bsommerfeld.upvision.core.event.BatchEvent;
import jakarta.inject.Inject;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Prints batch events to a terminal. Subscribes itself on the application
 * event bus.
 */
@Singleton
public class ConsoleView {

    private final PrintStream out;

    @Inject
    public ConsoleView(ApplicationEventBus eventBus) {
        this(eventBus, System.out);
    }

    ConsoleView(ApplicationEventBus eventBus, PrintStream out) {
        this.out = out;
        eventBus.register(this);
    }

    @Subscribe
    public void onLog(BatchEvent.Log event) {
        out.println(event.text());
    }

    @Subscribe
    public void onProgress(BatchEvent.Progress event) {
        out.printf(Locale.ROOT, "[%5.1f%%] %d / %d  %s%n", event.percent(), event.current(), event.total(),
                event.itemLabel());
    }

    @Subscribe
    public void onError(BatchEvent.Error event) {
        out.println("ERROR " + event.message());
    }

    @Subscribe
    public void onDone(BatchEvent.Done event) {
        out.println(event.result().summaryLine());
    }
}
