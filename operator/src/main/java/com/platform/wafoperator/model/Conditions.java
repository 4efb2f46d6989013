package com.platform.wafoperator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for condition lists keyed by condition type.
 * 
 * Lists are treated as values: every mutator returns a new list.
 * Setting a condition keeps the existing transition time unless the status changes.
 */
public final class Conditions {
    
    public static final String ACCEPTED = "Accepted";
    public static final String PROGRAMMED = "Programmed";
    
    public static final String READY = "Ready";
    public static final String DEGRADED = "Degraded";
    public static final String PROGRESSING = "Progressing";
    
    private Conditions() {
    }
    
    public static Optional<Condition> find(List<Condition> conditions, String type) {
        return conditions.stream()
            .filter(c -> c.type().equals(type))
            .findFirst();
    }
    
    public static boolean isTrue(List<Condition> conditions, String type) {
        return find(conditions, type).map(Condition::isTrue).orElse(false);
    }
    
    /**
     * Adds or replaces the condition with the same type.
     */
    public static List<Condition> set(List<Condition> conditions, Condition condition) {
        List<Condition> updated = new ArrayList<>(conditions.size() + 1);
        boolean replaced = false;
        for (Condition existing : conditions) {
            if (!existing.type().equals(condition.type())) {
                updated.add(existing);
                continue;
            }
            Instant transitionTime = existing.status() == condition.status()
                ? existing.lastTransitionTime()
                : condition.lastTransitionTime();
            updated.add(condition.withLastTransitionTime(transitionTime));
            replaced = true;
        }
        if (!replaced) {
            updated.add(condition);
        }
        return List.copyOf(updated);
    }
    
    public static List<Condition> remove(List<Condition> conditions, String type) {
        return conditions.stream()
            .filter(c -> !c.type().equals(type))
            .toList();
    }
    
    public static List<Condition> setTrue(List<Condition> conditions, long generation, String type,
            String reason, String message, Instant now) {
        return set(conditions, new Condition(type, ConditionStatus.TRUE, reason, message, generation, now));
    }
    
    public static List<Condition> setFalse(List<Condition> conditions, long generation, String type,
            String reason, String message, Instant now) {
        return set(conditions, new Condition(type, ConditionStatus.FALSE, reason, message, generation, now));
    }
    
    // ==================== Ready / Degraded / Progressing ====================
    
    /**
     * Marks a resource as degraded: Ready=False, Degraded=True, Progressing removed.
     */
    public static List<Condition> setDegraded(List<Condition> conditions, long generation,
            String reason, String message, Instant now) {
        List<Condition> updated = setFalse(conditions, generation, READY, reason, message, now);
        updated = setTrue(updated, generation, DEGRADED, reason, message, now);
        return remove(updated, PROGRESSING);
    }
    
    /**
     * Marks a resource as progressing: Ready=False, Progressing=True, Degraded removed.
     */
    public static List<Condition> setProgressing(List<Condition> conditions, long generation,
            String reason, String message, Instant now) {
        List<Condition> updated = setFalse(conditions, generation, READY, reason, message, now);
        updated = setTrue(updated, generation, PROGRESSING, reason, message, now);
        return remove(updated, DEGRADED);
    }
    
    /**
     * Marks a resource as fully reconciled: Ready=True, Degraded and Progressing removed.
     */
    public static List<Condition> setReady(List<Condition> conditions, long generation,
            String reason, String message, Instant now) {
        List<Condition> updated = setTrue(conditions, generation, READY, reason, message, now);
        updated = remove(updated, DEGRADED);
        return remove(updated, PROGRESSING);
    }
}
