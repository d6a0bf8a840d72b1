package com.tickline.engine.journal;

import com.tickline.core.journal.ExecutionEvent;
import com.tickline.core.journal.OrderEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only log of order and position events for one run.
 * Listeners see each event as it is recorded.
 */
public class ExecutionJournal {

    private static final Logger log = LoggerFactory.getLogger(ExecutionJournal.class);

    private final List<ExecutionEvent> events = new ArrayList<>();
    private final List<Consumer<ExecutionEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Record an execution event.
     */
    public void log(ExecutionEvent event) {
        events.add(event);
        if (log.isTraceEnabled()) {
            log.trace("{} {}", event.getTimestamp(), event.getSummary());
        }

        // Notify listeners
        listeners.forEach(l -> {
            try { l.accept(event); } catch (RuntimeException e) { log.warn("Journal listener error", e); }
        });
    }

    /**
     * Subscribe to journal events.
     */
    public void subscribe(Consumer<ExecutionEvent> listener) {
        listeners.add(listener);
    }

    /**
     * Read-only view of all events so far, in recording order.
     */
    public List<ExecutionEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Order events of one type.
     */
    public List<OrderEvent> getOrderEvents(OrderEvent.Type type) {
        List<OrderEvent> matching = new ArrayList<>();
        for (ExecutionEvent event : events) {
            if (event instanceof OrderEvent oe && oe.getType() == type) {
                matching.add(oe);
            }
        }
        return matching;
    }

    public int size() {
        return events.size();
    }
}
