package com.example.livesession.sessions.codec;

import com.example.livesession.model.Participant;
import com.example.livesession.model.ParticipantResponse;
import com.example.livesession.model.Question;
import com.example.livesession.model.QuestionRound;
import com.example.livesession.model.Session;
import com.example.livesession.model.SessionStatus;
import com.example.livesession.sessions.model.StoredParticipant;
import com.example.livesession.sessions.model.StoredRound;
import com.example.livesession.sessions.model.StoredSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class SessionCodec {
  private SessionCodec() {}

  /** Live -> stored snapshot. Caller holds the session lock. */
  public static StoredSession toStored(Session session, Instant now) {
    if (session == null) return null;

    StoredSession s = new StoredSession();
    s.setId(session.getId());
    s.setCode(session.getCode());
    s.setName(session.getName());
    s.setPresenterId(session.getPresenterId());
    s.setPresenterKeyHash(session.getPresenterKeyHash());

    // State
    s.setStatus(session.getStatus());
    s.setSettings(session.getSettings().copy());
    s.setQuestionIds(session.getQuestionIds());
    s.setCurrentIndex(session.getCurrentIndex());
    QuestionRound current = session.getCurrentRound();
    s.setCurrentRoundId(current == null ? null : current.getId());
    s.setSeq(session.getSeq());

    s.setCreatedAt(session.getCreatedAt());
    s.setStartedAt(session.getStartedAt());
    s.setEndedAt(session.getEndedAt());
    s.setUpdatedAt(now);

    // Participants
    List<StoredParticipant> list = new ArrayList<>();
    for (Participant p : session.participants().all()) {
      list.add(toStored(p));
    }
    s.setParticipants(list);

    List<StoredRound> rounds = new ArrayList<>();
    for (QuestionRound r : session.getRounds()) {
      rounds.add(toStored(r));
    }
    s.setRounds(rounds);
    s.setFinalLeaderboard(session.getFinalLeaderboard());
    return s;
  }

  public static StoredRound toStored(QuestionRound r) {
    StoredRound sr = new StoredRound();
    sr.setId(r.getId());
    sr.setQuestionId(r.getQuestionId());
    sr.setIndex(r.getIndex());
    sr.setActivatedAt(r.getActivatedAt());
    sr.setExtensionMillis(r.getExtensionMillis());
    sr.setClosed(r.isClosed());
    sr.setCloseReason(r.getCloseReason());
    sr.setClosedAt(r.getClosedAt());
    return sr;
  }

  /**
   * Stored -> read-only session for result queries after the live one is gone.
   * Nobody is connected to the result; rounds whose question is missing are skipped.
   */
  public static Session restore(StoredSession stored, List<Question> questions,
                                List<ParticipantResponse> responses) {
    Session session = new Session(stored.getId(), stored.getCode(), stored.getName(), stored.getPresenterId(),
        stored.getPresenterKeyHash(), stored.getSettings(), questions, stored.getCreatedAt());
    session.setStatus(stored.getStatus() == null ? SessionStatus.ENDED : stored.getStatus());
    session.setStartedAt(stored.getStartedAt());
    session.setEndedAt(stored.getEndedAt());
    session.setFinalLeaderboard(stored.getFinalLeaderboard());
    session.restoreSeq(stored.getSeq());
    if (stored.getUpdatedAt() != null) session.touch(stored.getUpdatedAt());

    Map<String, List<ParticipantResponse>> byRound = new HashMap<>();
    for (ParticipantResponse r : responses) {
      byRound.computeIfAbsent(r.roundId(), k -> new ArrayList<>()).add(r);
    }

    List<StoredRound> rounds = new ArrayList<>(stored.getRounds());
    rounds.sort(Comparator.comparing(StoredRound::getActivatedAt));
    for (StoredRound sr : rounds) {
      Question q = session.findQuestion(sr.getQuestionId()).orElse(null);
      if (q == null) continue;
      QuestionRound round = new QuestionRound(sr.getId(), session.getId(), q, sr.getIndex(), sr.getActivatedAt());
      round.extend(sr.getExtensionMillis());
      for (ParticipantResponse r : byRound.getOrDefault(sr.getId(), List.of())) {
        round.addResponse(r);
      }
      if (sr.isClosed()) round.close(sr.getCloseReason(), sr.getClosedAt());
      session.addRound(round);
    }
    return session;
  }

  public static StoredParticipant toStored(Participant p) {
    StoredParticipant sp = new StoredParticipant();
    sp.setId(p.getId());
    sp.setDisplayName(p.getDisplayName());
    sp.setScore(p.getScore());
    sp.setConnected(p.isConnected());
    sp.setJoinedAt(p.getJoinedAt());
    sp.setFirstCorrectAt(p.getFirstCorrectAt());
    sp.setAnsweredCount(p.getAnsweredCount());
    sp.setCorrectCount(p.getCorrectCount());
    return sp;
  }
}
