package com.company.obscalc.service;

import com.company.obscalc.event.CalcStateChangedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Per-program subscription to calculation state changes.
 * <p>
 * Listeners run on the notifier executor, never on the thread that wrote the
 * record, so a slow subscriber cannot hold up workers or request threads.
 * The executor is single-threaded and keeps events in commit order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChangeNotifier {

    private final MeterRegistry meterRegistry;

    @Qualifier("changeNotifierExecutor")
    private final Executor deliveryExecutor;

    private final Map<String, List<Consumer<CalcStateChangedEvent>>> listeners = new ConcurrentHashMap<>();

    /**
     * Handle to cancel a subscription. Closing twice is harmless.
     */
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    public Subscription subscribe(String programId, Consumer<CalcStateChangedEvent> listener) {
        // Add inside compute so a concurrent close cannot drop the list we add to
        listeners.compute(programId, (k, current) -> {
            List<Consumer<CalcStateChangedEvent>> target = current != null ? current : new CopyOnWriteArrayList<>();
            target.add(listener);
            return target;
        });
        log.debug("Subscribed to calculation changes of program {}", programId);

        return () -> listeners.computeIfPresent(programId, (k, current) -> {
            current.remove(listener);
            return current.isEmpty() ? null : current;
        });
    }

    public int subscriberCount(String programId) {
        List<Consumer<CalcStateChangedEvent>> current = listeners.get(programId);
        return current != null ? current.size() : 0;
    }

    @EventListener
    public void onStateChanged(CalcStateChangedEvent event) {
        if (event.getProgramId() == null) {
            return;
        }

        List<Consumer<CalcStateChangedEvent>> current = listeners.get(event.getProgramId());
        if (current == null) {
            return;
        }

        try {
            deliveryExecutor.execute(() -> deliver(event, current));
        } catch (TaskRejectedException e) {
            log.warn("Change notification for program {} dropped, delivery queue full", event.getProgramId());
            meterRegistry.counter("obscalc.notifier.dropped").increment();
        }
    }

    private void deliver(CalcStateChangedEvent event, List<Consumer<CalcStateChangedEvent>> current) {
        for (Consumer<CalcStateChangedEvent> listener : current) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Change listener for program {} failed on {}", event.getProgramId(), event, e);
                meterRegistry.counter("obscalc.notifier.listener_failures").increment();
            }
        }
    }
}
