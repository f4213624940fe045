package com.example.livesession.sessions.store;

import com.example.livesession.model.ParticipantResponse;
import com.example.livesession.model.Question;
import com.example.livesession.sessions.model.StoredSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Default {@link SessionStore}: process memory, lost on restart. */
@Component
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final Map<String, StoredSession> sessions = new ConcurrentHashMap<>();
  private final Map<String, List<Question>> questions = new ConcurrentHashMap<>();
  private final Map<String, List<ParticipantResponse>> responses = new ConcurrentHashMap<>();

  @Override
  public void save(StoredSession session) {
    Objects.requireNonNull(session, "session");
    sessions.put(session.getId(), session);
    log.debug("Stored session snapshot session={} seq={}", session.getId(), session.getSeq());
  }

  @Override
  public Optional<StoredSession> load(String sessionId) {
    if (sessionId == null) return Optional.empty();
    return Optional.ofNullable(sessions.get(sessionId));
  }

  @Override
  public void saveQuestions(String sessionId, List<Question> list) {
    questions.put(sessionId, List.copyOf(list));
  }

  @Override
  public List<Question> loadQuestions(String sessionId) {
    return questions.getOrDefault(sessionId, List.of());
  }

  @Override
  public void appendResponse(ParticipantResponse response) {
    responses.computeIfAbsent(response.sessionId(), k -> new CopyOnWriteArrayList<>()).add(response);
  }

  @Override
  public List<ParticipantResponse> loadResponses(String sessionId) {
    List<ParticipantResponse> list = responses.get(sessionId);
    return list == null ? List.of() : List.copyOf(list);
  }

  @Override
  public void delete(String sessionId) {
    sessions.remove(sessionId);
    questions.remove(sessionId);
    responses.remove(sessionId);
  }

  @Override
  public int deleteOlderThan(Instant cutoff) {
    int removed = 0;
    for (StoredSession s : sessions.values()) {
      Instant written = s.getUpdatedAt() != null ? s.getUpdatedAt() : s.getCreatedAt();
      if (written != null && written.isBefore(cutoff)) {
        delete(s.getId());
        removed++;
      }
    }
    if (removed > 0) log.debug("Purged {} stored session(s) written before {}", removed, cutoff);
    return removed;
  }
}
