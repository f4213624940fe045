package com.example.livesession.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link RoundScheduler} on a small pool of daemon threads. */
public class ExecutorRoundScheduler implements RoundScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRoundScheduler.class);

    private final ScheduledExecutorService scheduler;

    public ExecutorRoundScheduler(int poolSize) {
        int size = Math.max(1, poolSize);
        this.scheduler = Executors.newScheduledThreadPool(size, new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "round-timer-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
        log.info("ExecutorRoundScheduler initialized (poolSize={})", size);
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        long ms = Math.max(0L, delay.toMillis());
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (Throwable t) {
                log.error("Scheduled round task failed", t);
            }
        };
        ScheduledFuture<?> fut = scheduler.schedule(guarded, ms, TimeUnit.MILLISECONDS);
        return () -> fut.cancel(false);
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }
}
