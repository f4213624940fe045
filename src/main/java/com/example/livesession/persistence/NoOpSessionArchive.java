package com.example.livesession.persistence;

import com.example.livesession.dto.SessionResults;

import java.util.Optional;

/** Active while features.session-archive.enabled is false. */
public class NoOpSessionArchive implements SessionArchive {

    @Override
    public void archive(SessionResults results) {
        // archive disabled
    }

    @Override
    public Optional<SessionResults> find(String sessionId) {
        return Optional.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
