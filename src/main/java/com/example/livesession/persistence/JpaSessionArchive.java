package com.example.livesession.persistence;

import com.example.livesession.dto.SessionResults;
import com.example.livesession.model.SessionResultRecord;
import com.example.livesession.repository.SessionResultRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Adapter on the JPA repository. Only active when features.session-archive.enabled=true.
 */
public class JpaSessionArchive implements SessionArchive {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionArchive.class);

    private final SessionResultRepository repo;
    private final ObjectMapper objectMapper;

    public JpaSessionArchive(SessionResultRepository repo, ObjectMapper objectMapper) {
        this.repo = repo;
        this.objectMapper = objectMapper;
    }

    @Override
    public void archive(SessionResults results) {
        SessionResultRecord rec = repo.findById(results.sessionId())
                .orElseGet(() -> new SessionResultRecord(results.sessionId(), results.code()));
        rec.setName(results.name());
        rec.setStartedAt(results.startedAt());
        rec.setEndedAt(results.endedAt());
        rec.setDurationSeconds(results.durationSeconds());
        rec.setTotalParticipants(results.totalParticipants());
        rec.setQuestionsAsked(results.questionsAsked());
        rec.setAverageScore(results.averageScore());
        rec.setCompletionRate(results.completionRate());
        try {
            rec.setResultsJson(objectMapper.writeValueAsString(results));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize results of session " + results.sessionId(), e);
        }
        repo.save(rec);
        log.info("Archived results session={} participants={} rounds={}",
                results.sessionId(), results.totalParticipants(), results.questionsAsked());
    }

    @Override
    public Optional<SessionResults> find(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) return Optional.empty();
        return repo.findById(sessionId).map(this::read);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    private SessionResults read(SessionResultRecord rec) {
        try {
            return objectMapper.readValue(rec.getResultsJson(), SessionResults.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt archived results for session " + rec.getSessionId(), e);
        }
    }
}
