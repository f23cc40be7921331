package dev.taskgate.domain.enums;

/**
 * Queue priority, most urgent first. Declaration order is the queue order:
 * CRITICAL &lt; HIGH &lt; NORMAL &lt; LOW.
 */
public enum TaskPriority {
    CRITICAL, HIGH, NORMAL, LOW
}
