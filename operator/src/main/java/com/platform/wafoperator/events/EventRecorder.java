package com.platform.wafoperator.events;

import com.platform.wafoperator.model.Resource;

import java.util.List;

/**
 * Emits user-visible events about objects the operator acts on.
 * 
 * Recording is best-effort: implementations never throw.
 */
public interface EventRecorder {
    
    void event(Resource<?> object, EventType type, String reason, String message);
    
    /**
     * Most recent events first.
     */
    List<RecordedEvent> recentEvents();
}
