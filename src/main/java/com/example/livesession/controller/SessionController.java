package com.example.livesession.controller;

import com.example.livesession.dto.CreateSessionRequest;
import com.example.livesession.dto.CreatedSession;
import com.example.livesession.dto.JoinResult;
import com.example.livesession.dto.JoinSessionRequest;
import com.example.livesession.dto.MapLayerRequest;
import com.example.livesession.dto.MapLockRequest;
import com.example.livesession.dto.MapPinsData;
import com.example.livesession.dto.RoundResults;
import com.example.livesession.dto.RoundView;
import com.example.livesession.dto.SegmentSyncRequest;
import com.example.livesession.dto.SessionResults;
import com.example.livesession.dto.SessionSnapshot;
import com.example.livesession.dto.SessionView;
import com.example.livesession.dto.SubmitResponseRequest;
import com.example.livesession.dto.TeacherFocusRequest;
import com.example.livesession.dto.WordCloudData;
import com.example.livesession.exception.NotFoundException;
import com.example.livesession.model.AnswerFeedback;
import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.MapFocus;
import com.example.livesession.model.SegmentState;
import com.example.livesession.service.LiveSessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface of the session engine. Presenter-only endpoints take the presenter key in
 * {@value #PRESENTER_KEY}; errors are mapped by the global advice.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

  public static final String PRESENTER_KEY = "X-Presenter-Key";

  private final LiveSessionService service;

  public SessionController(LiveSessionService service) {
    this.service = service;
  }

  // --- Create / lookup -----------------------------------------------------

  @PostMapping
  public ResponseEntity<CreatedSession> create(@Valid @RequestBody CreateSessionRequest body) {
    return ResponseEntity.status(HttpStatus.CREATED).body(service.createSession(body));
  }

  @GetMapping("/{id}")
  public SessionView get(@PathVariable String id) {
    return service.getSession(id);
  }

  @GetMapping("/code/{code}")
  public SessionView getByCode(@PathVariable String code) {
    return service.getSessionByCode(code);
  }

  // --- Roster --------------------------------------------------------------

  @PostMapping("/join")
  public JoinResult join(@Valid @RequestBody JoinSessionRequest body) {
    return service.joinSession(body.code(), body.displayName(), null);
  }

  @PostMapping("/participants/{participantId}/leave")
  public ResponseEntity<Void> leave(@PathVariable String participantId) {
    service.leaveSession(participantId);
    return ResponseEntity.noContent().build();
  }

  // --- Lifecycle (presenter) -----------------------------------------------

  @PostMapping("/{id}/start")
  public SessionView start(@PathVariable String id, @RequestHeader(PRESENTER_KEY) String key) {
    return service.startSession(id, service.requesterFor(id, key));
  }

  @PostMapping("/{id}/pause")
  public SessionView pause(@PathVariable String id, @RequestHeader(PRESENTER_KEY) String key) {
    return service.pauseSession(id, service.requesterFor(id, key));
  }

  @PostMapping("/{id}/resume")
  public SessionView resume(@PathVariable String id, @RequestHeader(PRESENTER_KEY) String key) {
    return service.resumeSession(id, service.requesterFor(id, key));
  }

  @PostMapping("/{id}/end")
  public SessionView end(@PathVariable String id, @RequestHeader(PRESENTER_KEY) String key) {
    return service.endSession(id, service.requesterFor(id, key));
  }

  // --- Rounds (presenter) --------------------------------------------------

  @PostMapping("/{id}/questions/next")
  public RoundView next(@PathVariable String id, @RequestHeader(PRESENTER_KEY) String key) {
    return service.activateQuestion(id, service.requesterFor(id, key), null);
  }

  @PostMapping("/{id}/questions/skip")
  public RoundView skip(@PathVariable String id, @RequestHeader(PRESENTER_KEY) String key) {
    return service.skipQuestion(id, service.requesterFor(id, key));
  }

  @PostMapping("/{id}/questions/{questionId}/activate")
  public RoundView activate(@PathVariable String id, @PathVariable String questionId,
                            @RequestHeader(PRESENTER_KEY) String key) {
    return service.activateQuestion(id, service.requesterFor(id, key), questionId);
  }

  @PostMapping("/{id}/rounds/{roundId}/extend")
  public RoundView extend(@PathVariable String id, @PathVariable String roundId,
                          @RequestParam int additionalSeconds,
                          @RequestHeader(PRESENTER_KEY) String key) {
    return service.extendTime(id, service.requesterFor(id, key), roundId, additionalSeconds);
  }

  @PostMapping("/{id}/focus")
  public MapFocus focus(@PathVariable String id, @Valid @RequestBody TeacherFocusRequest body,
                        @RequestHeader(PRESENTER_KEY) String key) {
    return service.updateTeacherFocus(id, service.requesterFor(id, key),
        body.latitude(), body.longitude(), body.zoom(), body.bearing(), body.pitch());
  }

  @PostMapping("/{id}/map/lock")
  public Map<String, Boolean> mapLock(@PathVariable String id, @Valid @RequestBody MapLockRequest body,
                                      @RequestHeader(PRESENTER_KEY) String key) {
    return Map.of("isLocked", service.syncMapLock(id, service.requesterFor(id, key), body.isLocked()));
  }

  @PostMapping("/{id}/map/layer")
  public Map<String, String> mapLayer(@PathVariable String id, @Valid @RequestBody MapLayerRequest body,
                                      @RequestHeader(PRESENTER_KEY) String key) {
    return Map.of("layerKey", service.syncMapLayer(id, service.requesterFor(id, key), body.layerKey()));
  }

  @PostMapping("/{id}/segment")
  public SegmentState segment(@PathVariable String id, @Valid @RequestBody SegmentSyncRequest body,
                              @RequestHeader(PRESENTER_KEY) String key) {
    return service.syncSegment(id, service.requesterFor(id, key), body.segmentIndex(),
        body.segmentId(), body.segmentName(), body.isPlaying());
  }

  @PostMapping("/{id}/rounds/{roundId}/show-results")
  public RoundResults showResults(@PathVariable String id, @PathVariable String roundId,
                                  @RequestHeader(PRESENTER_KEY) String key) {
    return service.showQuestionResults(id, service.requesterFor(id, key), roundId);
  }

  // --- Responses -----------------------------------------------------------

  @PostMapping("/{id}/participants/{participantId}/responses")
  public AnswerFeedback submit(@PathVariable String id, @PathVariable String participantId,
                               @Valid @RequestBody SubmitResponseRequest body) {
    // participant must belong to this session
    if (!service.sessionIdOf(participantId).equals(id)) {
      throw NotFoundException.participant(participantId);
    }
    return service.submitResponse(participantId, body.roundId(), body.toPayload(), body.clientTimestamp());
  }

  // --- Queries -------------------------------------------------------------

  @GetMapping("/{id}/leaderboard")
  public List<LeaderboardEntry> leaderboard(@PathVariable String id,
                                            @RequestParam(defaultValue = "0") int limit,
                                            @RequestHeader(value = PRESENTER_KEY, required = false) String key) {
    return service.leaderboard(id, key == null ? null : service.requesterFor(id, key), limit);
  }

  @GetMapping("/{id}/state")
  public SessionSnapshot state(@PathVariable String id,
                               @RequestParam(required = false) String participantId,
                               @RequestHeader(value = PRESENTER_KEY, required = false) String key) {
    String requester = participantId;
    if (key != null) {
      String presenter = service.requesterFor(id, key);
      if (presenter != null) requester = presenter;
    }
    return service.snapshot(id, requester);
  }

  @GetMapping("/{id}/results")
  public SessionResults results(@PathVariable String id) {
    return service.results(id);
  }

  @GetMapping("/{id}/rounds/{roundId}/results")
  public RoundResults roundResults(@PathVariable String id, @PathVariable String roundId) {
    return service.roundResults(id, roundId);
  }

  @GetMapping("/{id}/rounds/{roundId}/word-cloud")
  public WordCloudData wordCloud(@PathVariable String id, @PathVariable String roundId) {
    return service.wordCloud(id, roundId);
  }

  @GetMapping("/{id}/rounds/{roundId}/map-pins")
  public MapPinsData mapPins(@PathVariable String id, @PathVariable String roundId) {
    return service.mapPins(id, roundId);
  }
}
