package com.example.livesession.sessions.service;

import com.example.livesession.model.Session;
import com.example.livesession.sessions.codec.SessionCodec;
import com.example.livesession.sessions.model.StoredSession;
import com.example.livesession.sessions.store.SessionStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Debounces rapid live mutations and writes the latest snapshot to the SessionStore.
 */
public class SessionSnapshotter {

    private static final Logger log = LoggerFactory.getLogger(SessionSnapshotter.class);

    private final SessionStore store;
    private final Clock clock;
    private final long debounceMs;

    private final ScheduledExecutorService scheduler;
    private final ConcurrentMap<String, ScheduledFuture<?>> inflight = new ConcurrentHashMap<>();

    public SessionSnapshotter(SessionStore store, Clock clock, long debounceMs) {
        this.store = store;
        this.clock = clock;
        this.debounceMs = Math.max(0, debounceMs);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "session-snapshotter-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
        log.info("SessionSnapshotter initialized (debounceMs={})", this.debounceMs);
    }

    /**
     * Signal that a live session has changed. After the debounce window the latest state is stored.
     */
    public void onChange(Session session, String actor) {
        if (session == null) return;
        String id = session.getId();

        Runnable task = () -> {
            try {
                StoredSession snapshot;
                synchronized (session) {
                    snapshot = SessionCodec.toStored(session, clock.instant());
                }
                store.save(snapshot);
                log.debug("Snapshot persisted (session={}, actor={})", id, actor);
            } catch (Throwable t) {
                log.warn("Snapshot failed (session={}, actor={}): {}", id, actor, t.toString());
            } finally {
                inflight.remove(id);
            }
        };

        ScheduledFuture<?> prev = inflight.get(id);
        if (prev != null && !prev.isDone()) {
            prev.cancel(false);
        }
        ScheduledFuture<?> fut = scheduler.schedule(task, debounceMs, TimeUnit.MILLISECONDS);
        inflight.put(id, fut);
    }

    /** Drops a pending write, e.g. when the session is removed. */
    public void discard(String sessionId) {
        ScheduledFuture<?> prev = inflight.remove(sessionId);
        if (prev != null) prev.cancel(false);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
