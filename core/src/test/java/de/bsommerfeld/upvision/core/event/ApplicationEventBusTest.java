package de.bsommerfeld.upvision.core.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverBatchEventToTypedListener() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<BatchEvent.Log>();

        Object listener = new Object() {
            @Subscribe
            public void onLog(BatchEvent.Log event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new BatchEvent.Log("OK a.png -> a_x4.png"));

        assertEquals("OK a.png -> a_x4.png", received.get().text());
    }

    @Test
    void post_shouldRouteByEventType() {
        var eventBus = new ApplicationEventBus();
        List<Object> logs = new ArrayList<>();
        List<Object> progress = new ArrayList<>();

        Object listener = new Object() {
            @Subscribe
            public void onLog(BatchEvent.Log event) {
                logs.add(event);
            }

            @Subscribe
            public void onProgress(BatchEvent.Progress event) {
                progress.add(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new BatchEvent.Log("processing a.png"));
        eventBus.post(new BatchEvent.Progress(1, 1, "a.png"));

        assertEquals(1, logs.size());
        assertEquals(1, progress.size());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("first");
        eventBus.unregister(listener);
        eventBus.post("second");

        assertEquals("first", received.get());
    }

    @Test
    void post_shouldNotThrowForUnhandledEvents() {
        var eventBus = new ApplicationEventBus();
        assertDoesNotThrow(() -> eventBus.post(new BatchEvent.Error("nobody-listens")));
    }
}
