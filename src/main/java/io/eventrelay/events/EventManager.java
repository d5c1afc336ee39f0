package io.eventrelay.events;

/**
 * Registration point for in-process listeners of a namespace's system events.
 */
public interface EventManager {

    /**
     * Registers {@code listener} for every system event of {@code namespace}.
     * Registering the same listener twice for a namespace has no further effect.
     */
    void addSystemEventListener(String namespace, SystemEventListener listener);
}
