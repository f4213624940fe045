package com.example.livesession.handler;

import com.example.livesession.dto.CreateSessionRequest;
import com.example.livesession.dto.CreatedSession;
import com.example.livesession.dto.JoinResult;
import com.example.livesession.dto.SessionSnapshot;
import com.example.livesession.exception.ErrorCode;
import com.example.livesession.exception.InvalidCommandException;
import com.example.livesession.exception.SessionException;
import com.example.livesession.exception.TransportUnavailableException;
import com.example.livesession.model.ResponsePayload;
import com.example.livesession.service.BroadcastCoordinator;
import com.example.livesession.service.LiveSessionService;
import com.example.livesession.transport.WebSocketSessionTransport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket hub for live sessions.
 * - Handshake query: code, optional presenterKey (presenter connection) or participantId (reconnect)
 * - Frames are JSON {id, method, args}; every frame is answered with an ack
 * - Heartbeat: replies "pong" to a plain "ping"
 * - On close: the participant is marked disconnected, nothing else is cancelled
 */
@Component
public class SessionWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionWebSocketHandler.class);

    static final CloseStatus FORBIDDEN = new CloseStatus(4003, "Presenter key rejected");
    static final CloseStatus UNKNOWN = new CloseStatus(4004, "Unknown session or participant");

    private final LiveSessionService service;
    private final WebSocketSessionTransport transport;
    private final BroadcastCoordinator broadcaster;
    private final ObjectMapper objectMapper;

    /** Per WebSocket session → role and identity */
    private final Map<String, Conn> bySession = new ConcurrentHashMap<>();

    public SessionWebSocketHandler(LiveSessionService service,
                                   WebSocketSessionTransport transport,
                                   BroadcastCoordinator broadcaster,
                                   ObjectMapper objectMapper) {
        this.service = service;
        this.transport = transport;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        transport.register(session);
        final String connId = session.getId();
        Map<String, String> q = parseQuery(session.getUri());
        final String code = q.getOrDefault("code", "").trim();
        final String presenterKey = q.get("presenterKey");
        final String participantId = q.get("participantId");

        try {
            if (presenterKey != null && !presenterKey.isBlank()) {
                LiveSessionService.PresenterIdentity who = service.authenticatePresenter(code, presenterKey);
                service.attachConnection(who.sessionId(), connId, true);
                bySession.put(connId, Conn.presenter(who.sessionId(), who.presenterId()));
                log.info("WS OPEN presenter session={} conn={}", who.sessionId(), connId);
                push(connId, "state", service.snapshot(who.sessionId(), who.presenterId()));
            } else if (participantId != null && !participantId.isBlank()) {
                SessionSnapshot state = service.reconnect(participantId, connId);
                String sessionId = service.sessionIdOf(participantId);
                bySession.put(connId, Conn.participant(sessionId, participantId));
                log.info("WS OPEN participant session={} participant={} conn={}", sessionId, participantId, connId);
                push(connId, "state", state);
            } else {
                bySession.put(connId, Conn.anonymous());
                log.info("WS OPEN anonymous code={} conn={}", code.isEmpty() ? "-" : code, connId);
            }
        } catch (SessionException e) {
            log.warn("WS REJECT conn={} code={} reason={}", connId, code, e.getMessage());
            transport.unregister(connId);
            session.close(e.getCode() == ErrorCode.FORBIDDEN ? FORBIDDEN : UNKNOWN);
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        final String connId = session.getId();
        final String payload = message.getPayload();

        // Heartbeat
        if ("ping".equals(payload)) {
            try {
                transport.send(connId, "pong");
            } catch (TransportUnavailableException e) {
                log.debug("WS pong failed conn={}", connId);
            }
            return;
        }

        String frameId = null;
        Ack ack;
        try {
            JsonNode frame = objectMapper.readTree(payload);
            if (frame == null || !frame.isObject() || !frame.hasNonNull("method")) {
                throw new InvalidCommandException("Frame must be a JSON object with a method");
            }
            frameId = frame.path("id").isMissingNode() ? null : frame.path("id").asText(null);
            String method = frame.get("method").asText();
            JsonNode args = frame.hasNonNull("args") ? frame.get("args") : NullNode.getInstance();
            ack = Ack.ok(frameId, dispatch(connId, method, args));
        } catch (JsonProcessingException e) {
            log.warn("WS malformed frame conn={}: {}", connId, e.getOriginalMessage());
            ack = Ack.failed(frameId, ErrorCode.INVALID_COMMAND.name(), "Malformed JSON frame");
        } catch (SessionException e) {
            Conn c = bySession.get(connId);
            log.warn("WS command rejected conn={} session={} code={} msg={}",
                    connId, c == null ? "-" : c.sessionId(), e.getCode(), e.getMessage());
            ack = Ack.failed(frameId, e.getCode().name(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("WS command failed conn={}", connId, e);
            ack = Ack.failed(frameId, "INTERNAL_ERROR", "Unexpected server error");
        }

        try {
            broadcaster.sendTo(connId, ack);
        } catch (TransportUnavailableException e) {
            log.warn("WS ack undeliverable conn={} id={}", connId, frameId);
        }
    }

    /** Runs one command and returns its ack result. */
    Object dispatch(String connId, String method, JsonNode args) {
        Conn c = bySession.getOrDefault(connId, Conn.anonymous());
        switch (method) {
            case "Ping":
                return Map.of("serverTime", Instant.now().toString());

            case "CreateSession": {
                CreateSessionRequest req = convert(args, CreateSessionRequest.class);
                CreatedSession created = service.createSession(req);
                String sessionId = created.session().id();
                leaveCurrent(connId, c);
                service.attachConnection(sessionId, connId, true);
                bySession.put(connId, Conn.presenter(sessionId, created.presenterId()));
                return created;
            }

            case "JoinSession": {
                if (c.role() == Role.PARTICIPANT) {
                    throw new InvalidCommandException("Connection already joined as a participant; send LeaveSession first");
                }
                JoinResult joined = service.joinSession(requiredText(args, "code"), text(args, "displayName"), connId);
                leaveCurrent(connId, c);
                bySession.put(connId, Conn.participant(joined.session().id(), joined.participant().id()));
                return joined;
            }

            case "LeaveSession": {
                String pid = requireParticipant(c);
                service.leaveSession(pid);
                service.detachConnection(c.sessionId(), connId);
                bySession.put(connId, Conn.anonymous());
                return Map.of("left", true);
            }

            case "StartSession":
                return service.startSession(requireSession(c), c.requesterId());
            case "PauseSession":
                return service.pauseSession(requireSession(c), c.requesterId());
            case "ResumeSession":
                return service.resumeSession(requireSession(c), c.requesterId());
            case "EndSession":
                return service.endSession(requireSession(c), c.requesterId());

            case "ActivateQuestion":
                return service.activateQuestion(requireSession(c), c.requesterId(), text(args, "questionId"));
            case "SkipQuestion":
                return service.skipQuestion(requireSession(c), c.requesterId());
            case "ExtendTime":
                return service.extendTime(requireSession(c), c.requesterId(), text(args, "roundId"),
                        requiredInt(args, "seconds"));

            case "SubmitResponse": {
                String pid = requireParticipant(c);
                JsonNode p = args.path("payload");
                ResponsePayload payload = new ResponsePayload(
                        text(p, "optionId"),
                        text(p, "text"),
                        number(p, "latitude"),
                        number(p, "longitude"));
                return service.submitResponse(pid, requiredText(args, "roundId"), payload,
                        instant(args, "clientTimestamp"));
            }

            case "UpdateTeacherFocus": {
                Double lat = number(args, "lat");
                Double lng = number(args, "lng");
                Double zoom = number(args, "zoom");
                if (lat == null || lng == null || zoom == null) {
                    throw new InvalidCommandException("lat, lng and zoom are required");
                }
                return service.updateTeacherFocus(requireSession(c), c.requesterId(), lat, lng, zoom,
                        number(args, "bearing"), number(args, "pitch"));
            }

            case "SyncMapLockState":
                return Map.of("isLocked", service.syncMapLock(requireSession(c), c.requesterId(),
                        requiredBoolean(args, "isLocked")));
            case "SyncSegment":
                return service.syncSegment(requireSession(c), c.requesterId(), requiredInt(args, "segmentIndex"),
                        text(args, "segmentId"), text(args, "segmentName"), requiredBoolean(args, "isPlaying"));
            case "SyncMapLayer":
                return Map.of("layerKey", service.syncMapLayer(requireSession(c), c.requesterId(),
                        requiredText(args, "layerKey")));
            case "ShowQuestionResults":
                return service.showQuestionResults(requireSession(c), c.requesterId(), text(args, "roundId"));

            case "RequestState":
                return service.snapshot(requireSession(c), c.requesterId());

            default:
                throw new InvalidCommandException("Unknown method: " + method);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("WS ERROR conn={} uri={}: {}", session.getId(), safeUri(session), exception.toString());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        final String connId = session.getId();
        Conn c = bySession.remove(connId);
        transport.unregister(connId);
        if (c == null || c.role() == Role.ANONYMOUS) {
            log.info("WS CLOSE conn={} code={} reason={}", connId, status.getCode(), status.getReason());
            return;
        }
        log.info("WS CLOSE session={} role={} id={} code={} reason={}",
                c.sessionId(), c.role(), c.requesterId(), status.getCode(), status.getReason());
        if (c.role() == Role.PARTICIPANT) {
            service.disconnect(c.requesterId(), connId);
        }
    }

    int connectionCount() {
        return bySession.size();
    }

    /* ---------------- helpers ---------------- */

    private void leaveCurrent(String connId, Conn c) {
        if (c.sessionId() != null) service.detachConnection(c.sessionId(), connId);
    }

    private void push(String connId, String type, Object payload) {
        try {
            broadcaster.sendTo(connId, Map.of("type", type, "payload", payload));
        } catch (TransportUnavailableException e) {
            log.warn("WS push {} failed conn={}", type, connId);
        }
    }

    private static String requireSession(Conn c) {
        if (c.sessionId() == null) throw new InvalidCommandException("Connection is not attached to a session");
        return c.sessionId();
    }

    private static String requireParticipant(Conn c) {
        if (c.role() != Role.PARTICIPANT) throw new InvalidCommandException("Connection has not joined as a participant");
        return c.requesterId();
    }

    private <T> T convert(JsonNode args, Class<T> type) {
        try {
            return objectMapper.treeToValue(args, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidCommandException("Invalid arguments: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode args, String field) {
        JsonNode n = args.get(field);
        return (n == null || n.isNull()) ? null : n.asText();
    }

    private static String requiredText(JsonNode args, String field) {
        String v = text(args, field);
        if (v == null || v.isBlank()) throw new InvalidCommandException(field + " is required");
        return v;
    }

    private static Double number(JsonNode args, String field) {
        JsonNode n = args.get(field);
        if (n == null || n.isNull()) return null;
        if (!n.isNumber()) throw new InvalidCommandException(field + " must be a number");
        return n.asDouble();
    }

    private static int requiredInt(JsonNode args, String field) {
        JsonNode n = args.get(field);
        if (n == null || !n.canConvertToInt()) throw new InvalidCommandException(field + " must be an integer");
        return n.asInt();
    }

    private static boolean requiredBoolean(JsonNode args, String field) {
        JsonNode n = args.get(field);
        if (n == null || !n.isBoolean()) throw new InvalidCommandException(field + " must be true or false");
        return n.asBoolean();
    }

    private static Instant instant(JsonNode args, String field) {
        String v = text(args, field);
        if (v == null || v.isBlank()) return null;
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException e) {
            throw new InvalidCommandException(field + " must be an ISO-8601 instant", e);
        }
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new ConcurrentHashMap<>();
        if (uri == null || uri.getQuery() == null) return map;
        for (String kv : uri.getQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    private String safeUri(WebSocketSession session) {
        try { return String.valueOf(session.getUri()); } catch (Exception e) { return "n/a"; }
    }

    enum Role { ANONYMOUS, PRESENTER, PARTICIPANT }

    /** requesterId is the presenter id or the participant id, depending on the role. */
    private record Conn(Role role, String sessionId, String requesterId) {
        static Conn anonymous() { return new Conn(Role.ANONYMOUS, null, null); }
        static Conn presenter(String sessionId, String presenterId) { return new Conn(Role.PRESENTER, sessionId, presenterId); }
        static Conn participant(String sessionId, String participantId) { return new Conn(Role.PARTICIPANT, sessionId, participantId); }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Ack(String type, String id, boolean ok, Object result, AckError error) {
        static Ack ok(String id, Object result) { return new Ack("ack", id, true, result, null); }
        static Ack failed(String id, String code, String message) {
            return new Ack("ack", id, false, null, new AckError(code, message));
        }
    }

    record AckError(String code, String message) { }
}
