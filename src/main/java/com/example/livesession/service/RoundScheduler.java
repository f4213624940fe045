package com.example.livesession.service;

import java.time.Duration;

/**
 * One-shot timers for round deadlines and auto-advance.
 * Tasks run off the caller's thread and must take the session lock themselves.
 */
public interface RoundScheduler {

    Cancellable schedule(Duration delay, Runnable task);

    @FunctionalInterface
    interface Cancellable {
        /** Returns false when the task already ran or was cancelled before. */
        boolean cancel();
    }
}
