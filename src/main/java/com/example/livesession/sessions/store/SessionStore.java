package com.example.livesession.sessions.store;

import com.example.livesession.model.ParticipantResponse;
import com.example.livesession.model.Question;
import com.example.livesession.sessions.model.StoredSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Repository port for session state. Implementations must be thread-safe. */
public interface SessionStore {

  /** Saves or overwrites the snapshot. */
  void save(StoredSession session);

  /** Empty when no snapshot exists (yet). */
  Optional<StoredSession> load(String sessionId);

  void saveQuestions(String sessionId, List<Question> questions);

  /** Empty list when nothing was stored. */
  List<Question> loadQuestions(String sessionId);

  /** Append-only; responses are never overwritten. */
  void appendResponse(ParticipantResponse response);

  List<ParticipantResponse> loadResponses(String sessionId);

  /** Removes snapshot, questions and responses of the session, if present. */
  void delete(String sessionId);

  /** Deletes every session whose snapshot was last written before {@code cutoff}; returns how many. */
  int deleteOlderThan(Instant cutoff);
}
