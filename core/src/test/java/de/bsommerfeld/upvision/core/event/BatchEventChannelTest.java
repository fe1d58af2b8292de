package de.bsommerfeld.upvision.core.event;

import de.bsommerfeld.upvision.core.domain.BatchResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BatchEventChannelTest {

    @Test
    void drain_shouldDeliverEventsInProductionOrder() {
        var channel = new BatchEventChannel();
        channel.push(new BatchEvent.Log("processing a.png"));
        channel.push(new BatchEvent.Progress(1, 1, "a.png"));
        channel.push(new BatchEvent.Done(BatchResult.empty(0)));

        List<BatchEvent> received = new ArrayList<>();
        int count = channel.drain(received::add);

        assertEquals(3, count);
        assertInstanceOf(BatchEvent.Log.class, received.get(0));
        assertInstanceOf(BatchEvent.Progress.class, received.get(1));
        assertInstanceOf(BatchEvent.Done.class, received.get(2));
        assertTrue(channel.isEmpty());
    }

    @Test
    void drain_shouldReturnImmediatelyWhenEmpty() {
        var channel = new BatchEventChannel();
        assertEquals(0, channel.drain(e -> fail("No event expected")));
    }

    @Test
    void poll_shouldReturnEmptyWhenNothingQueued() {
        var channel = new BatchEventChannel();
        assertTrue(channel.poll().isEmpty());

        channel.push(new BatchEvent.Error("boom"));
        assertEquals(new BatchEvent.Error("boom"), channel.poll().orElseThrow());
    }

    @Test
    void push_shouldRejectNull() {
        var channel = new BatchEventChannel();
        assertThrows(NullPointerException.class, () -> channel.push(null));
    }

    @Test
    void push_shouldPreserveOrderAcrossThreads() throws Exception {
        var channel = new BatchEventChannel();
        int total = 500;
        CountDownLatch finished = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            for (int i = 1; i <= total; i++) {
                channel.push(new BatchEvent.Progress(i, total, "item-" + i));
            }
            finished.countDown();
        });
        producer.start();

        List<BatchEvent> received = new ArrayList<>();
        while (received.size() < total) {
            channel.drain(received::add);
            if (finished.getCount() == 0 && channel.isEmpty() && received.size() < total) {
                break;
            }
        }
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        channel.drain(received::add);

        assertEquals(total, received.size());
        for (int i = 0; i < total; i++) {
            assertEquals(i + 1, ((BatchEvent.Progress) received.get(i)).current());
        }
    }

    @Test
    void progress_percent_shouldHandleEmptyTotal() {
        assertEquals(0.0, new BatchEvent.Progress(0, 0, "").percent());
        assertEquals(50.0, new BatchEvent.Progress(1, 2, "a").percent(), 0.0001);
    }
}
