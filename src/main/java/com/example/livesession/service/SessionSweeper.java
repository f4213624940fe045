package com.example.livesession.service;

import com.example.livesession.config.SessionProperties;
import com.example.livesession.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic cleanup: idle sessions with nobody connected are ended, ended sessions are
 * forgotten after the retention window. Their results stay readable from the store until the
 * stored retention runs out, and from the archive when it is enabled.
 */
@Component
public class SessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(SessionSweeper.class);

    private final SessionRegistry registry;
    private final LiveSessionService service;
    private final SessionProperties props;
    private final Clock clock;

    public SessionSweeper(SessionRegistry registry, LiveSessionService service,
                          SessionProperties props, Clock clock) {
        this.registry = registry;
        this.service = service;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.session.sweep-interval-ms:60000}",
            initialDelayString = "${app.session.sweep-interval-ms:60000}")
    public void scheduledSweep() {
        int removed = sweep(clock.instant());
        if (removed > 0) log.info("Session sweep removed {} session(s), {} remaining", removed, registry.size());
    }

    /** Returns the number of sessions removed. */
    public int sweep(Instant now) {
        Duration idle = Duration.ofMillis(props.getIdleTimeoutMs());
        Duration retention = Duration.ofMillis(props.getEndedRetentionMs());
        int removed = 0;
        for (Session s : registry.all()) {
            String reason = null;
            synchronized (s) {
                if (s.isEnded()) {
                    Instant endedAt = s.getEndedAt() != null ? s.getEndedAt() : s.getLastActivityAt();
                    if (endedAt.plus(retention).isBefore(now)) reason = "retention";
                } else if (s.participants().connectedCount() == 0
                        && s.getLastActivityAt().plus(idle).isBefore(now)) {
                    reason = "idle";
                }
            }
            if (reason != null && service.terminate(s.getId(), reason)) removed++;
        }
        service.purgeStored(now.minusMillis(props.getStoredRetentionMs()));
        return removed;
    }
}
