package com.company.obscalc.service;

import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.event.CalcStateChangedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChangeNotifierTest {

    private SimpleMeterRegistry meterRegistry;
    private ChangeNotifier notifier;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        notifier = new ChangeNotifier(meterRegistry, Runnable::run);
    }

    private static CalcStateChangedEvent event(String programId) {
        return new CalcStateChangedEvent(CalcKind.OBSCALC, "o-1", programId,
                CalcState.CALCULATING, CalcState.READY, Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void deliversOnlyToSubscribersOfTheProgram() {
        List<CalcStateChangedEvent> received = new ArrayList<>();
        notifier.subscribe("p-1", received::add);

        notifier.onStateChanged(event("p-1"));
        notifier.onStateChanged(event("p-2"));

        assertEquals(1, received.size());
        assertEquals("p-1", received.get(0).getProgramId());
    }

    @Test
    void closedSubscriptionReceivesNothing() {
        List<CalcStateChangedEvent> received = new ArrayList<>();
        ChangeNotifier.Subscription subscription = notifier.subscribe("p-1", received::add);
        assertEquals(1, notifier.subscriberCount("p-1"));

        subscription.close();
        subscription.close();
        notifier.onStateChanged(event("p-1"));

        assertTrue(received.isEmpty());
        assertEquals(0, notifier.subscriberCount("p-1"));
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        List<CalcStateChangedEvent> received = new ArrayList<>();
        notifier.subscribe("p-1", e -> {
            throw new IllegalStateException("client gone");
        });
        notifier.subscribe("p-1", received::add);

        notifier.onStateChanged(event("p-1"));

        assertEquals(1, received.size());
        assertEquals(1.0, meterRegistry.counter("obscalc.notifier.listener_failures").count());
    }

    @Test
    @DisplayName("Listeners run on the delivery executor, not on the writing thread")
    void deliveryIsHandedToTheExecutor() {
        List<Runnable> queued = new ArrayList<>();
        ChangeNotifier deferred = new ChangeNotifier(meterRegistry, queued::add);
        List<CalcStateChangedEvent> received = new ArrayList<>();
        deferred.subscribe("p-1", received::add);

        deferred.onStateChanged(event("p-1"));
        assertTrue(received.isEmpty());
        assertEquals(1, queued.size());

        queued.get(0).run();
        assertEquals(1, received.size());
    }

    @Test
    void fullDeliveryQueueIsCounted() {
        ChangeNotifier saturated = new ChangeNotifier(meterRegistry, task -> {
            throw new TaskRejectedException("queue full");
        });
        saturated.subscribe("p-1", e -> fail("must not be delivered"));

        saturated.onStateChanged(event("p-1"));

        assertEquals(1.0, meterRegistry.counter("obscalc.notifier.dropped").count());
    }

    @Test
    @DisplayName("Subscribing while the last subscriber leaves never loses the new subscriber")
    void concurrentSubscribeAndClose() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 500; round++) {
                String programId = "p-" + round;
                ChangeNotifier.Subscription leaving = notifier.subscribe(programId, e -> { });
                List<CalcStateChangedEvent> received = new CopyOnWriteArrayList<>();
                CountDownLatch start = new CountDownLatch(1);

                Future<?> close = pool.submit(() -> {
                    start.await();
                    leaving.close();
                    return null;
                });
                Future<?> join = pool.submit(() -> {
                    start.await();
                    notifier.subscribe(programId, received::add);
                    return null;
                });
                start.countDown();
                close.get(5, TimeUnit.SECONDS);
                join.get(5, TimeUnit.SECONDS);

                notifier.onStateChanged(event(programId));
                assertEquals(1, received.size(), "subscriber lost in round " + round);
                assertEquals(1, notifier.subscriberCount(programId));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
