package com.pricestream.scheduler;

/** Point-in-time counters for the update scheduler. {@code lastCycle} is null before the first cycle. */
public record SchedulerStats(
        boolean running,
        boolean paused,
        boolean cycleInFlight,
        long intervalMs,
        long cyclesCompleted,
        long cyclesSkipped,
        long cyclesFailed,
        UpdateCycleStats lastCycle) {}
