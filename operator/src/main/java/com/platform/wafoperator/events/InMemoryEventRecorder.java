package com.platform.wafoperator.events;

import com.platform.wafoperator.model.Resource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps a bounded history of events in memory and logs each one.
 */
@Slf4j
public class InMemoryEventRecorder implements EventRecorder {
    
    public static final int DEFAULT_CAPACITY = 500;
    
    private final Clock clock;
    private final int capacity;
    private final Deque<RecordedEvent> history = new ArrayDeque<>();
    
    public InMemoryEventRecorder(Clock clock) {
        this(clock, DEFAULT_CAPACITY);
    }
    
    public InMemoryEventRecorder(Clock clock, int capacity) {
        this.clock = clock;
        this.capacity = capacity;
    }
    
    @Override
    public void event(Resource<?> object, EventType type, String reason, String message) {
        RecordedEvent event = new RecordedEvent(
            clock.instant(),
            object.kind().getKindName(),
            object.key(),
            type,
            reason,
            message
        );
        
        synchronized (history) {
            history.addFirst(event);
            while (history.size() > capacity) {
                history.removeLast();
            }
        }
        
        if (type == EventType.WARNING) {
            log.warn("Event {} {} {}: {}", event.kind(), event.involvedObject(), reason, message);
        } else {
            log.info("Event {} {} {}: {}", event.kind(), event.involvedObject(), reason, message);
        }
    }
    
    @Override
    public List<RecordedEvent> recentEvents() {
        synchronized (history) {
            return List.copyOf(new ArrayList<>(history));
        }
    }
}
