package com.example.livesession.sessions.service;

import com.example.livesession.model.Session;
import com.example.livesession.model.SessionSettings;
import com.example.livesession.sessions.model.StoredSession;
import com.example.livesession.sessions.store.SessionStore;
import com.example.livesession.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SessionSnapshotterTest {

    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    private final SessionStore store = mock(SessionStore.class);
    private SessionSnapshotter snapshotter;

    @AfterEach
    void tearDown() {
        if (snapshotter != null) snapshotter.shutdown();
    }

    private static Session session(String id) {
        return new Session(id, "ABC234", "Quiz", "boss", null, SessionSettings.defaults(), List.of(), T0);
    }

    @Test
    void writesSnapshotAfterDebounce() {
        snapshotter = new SessionSnapshotter(store, new MutableClock(T0), 0);

        snapshotter.onChange(session("s1"), "test");

        ArgumentCaptor<StoredSession> captor = ArgumentCaptor.forClass(StoredSession.class);
        verify(store, timeout(2000)).save(captor.capture());
        assertEquals("s1", captor.getValue().getId());
    }

    @Test
    void burstOfChangesCollapsesToOneWrite() {
        snapshotter = new SessionSnapshotter(store, new MutableClock(T0), 300);
        Session s = session("s1");

        for (int i = 0; i < 5; i++) snapshotter.onChange(s, "burst");

        verify(store, timeout(2000).times(1)).save(any());
        verify(store, after(500).times(1)).save(any());
    }

    @Test
    void discardDropsPendingWrite() {
        snapshotter = new SessionSnapshotter(store, new MutableClock(T0), 300);

        snapshotter.onChange(session("s1"), "test");
        snapshotter.discard("s1");

        verify(store, after(600).never()).save(any());
    }

    @Test
    void nullSessionIsIgnored() {
        snapshotter = new SessionSnapshotter(store, new MutableClock(T0), 0);
        snapshotter.onChange(null, "test");
        verify(store, after(200).never()).save(any());
    }
}
