package com.creditengine.overdue;

/**
 * Lifecycle of the overdue payment processor.
 */
public enum ProcessorState {
    /** Created, no sweeps scheduled yet. */
    IDLE,
    /** Sweeps run immediately on start and then at a fixed interval. */
    RUNNING,
    /** Future sweeps cancelled; a sweep already in progress is allowed to finish. */
    STOPPED
}
