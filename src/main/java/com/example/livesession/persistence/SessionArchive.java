package com.example.livesession.persistence;

import com.example.livesession.dto.SessionResults;

import java.util.Optional;

/** Long-term store of the results of ended sessions. */
public interface SessionArchive {

    void archive(SessionResults results);

    Optional<SessionResults> find(String sessionId);

    boolean isEnabled();
}
