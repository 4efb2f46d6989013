package com.platform.wafoperator.events;

import com.platform.wafoperator.TestResources;
import com.platform.wafoperator.model.ObjectKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventRecorderTest {
    
    @Test
    @DisplayName("records kind, object, type, reason and message")
    void recordsEvent() {
        InMemoryEventRecorder recorder = new InMemoryEventRecorder(TestResources.CLOCK);
        
        recorder.event(TestResources.gatewayPolicy("p", "gw"), EventType.WARNING, "TargetNotFound", "gone");
        
        RecordedEvent event = recorder.recentEvents().get(0);
        assertEquals("WAFPolicy", event.kind());
        assertEquals(ObjectKey.of(TestResources.NAMESPACE, "p"), event.involvedObject());
        assertEquals(EventType.WARNING, event.type());
        assertEquals("TargetNotFound", event.reason());
        assertEquals("gone", event.message());
        assertEquals(TestResources.CLOCK.instant(), event.timestamp());
    }
    
    @Test
    @DisplayName("keeps the most recent events first up to capacity")
    void boundedNewestFirst() {
        InMemoryEventRecorder recorder = new InMemoryEventRecorder(TestResources.CLOCK, 2);
        
        recorder.event(TestResources.gateway("a"), EventType.NORMAL, "R", "1");
        recorder.event(TestResources.gateway("a"), EventType.NORMAL, "R", "2");
        recorder.event(TestResources.gateway("a"), EventType.NORMAL, "R", "3");
        
        assertEquals(List.of("3", "2"), recorder.recentEvents().stream().map(RecordedEvent::message).toList());
    }
}
