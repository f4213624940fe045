package com.example.livesession.handler;

import com.example.livesession.dto.CreatedSession;
import com.example.livesession.service.BroadcastCoordinator;
import com.example.livesession.testsupport.TestEngine;
import com.example.livesession.transport.WebSocketSessionTransport;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.List;

import static com.example.livesession.testsupport.TestEngine.multipleChoice;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Drives the hub with mocked sockets against a real engine. Acks and pushes land in the
 * recording transport, keyed by connection id.
 */
class SessionWebSocketHandlerTest {

    private TestEngine engine;
    private WebSocketSessionTransport sockets;
    private SessionWebSocketHandler handler;
    private CreatedSession created;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        sockets = new WebSocketSessionTransport();
        handler = new SessionWebSocketHandler(engine.service, sockets,
                new BroadcastCoordinator(engine.transport, engine.mapper), engine.mapper);
        created = engine.create(multipleChoice("q1", 1000, 20, 0, "Vienna", "Graz"));
    }

    private WebSocketSession open(String connId, String query) throws Exception {
        WebSocketSession ws = mock(WebSocketSession.class);
        when(ws.getId()).thenReturn(connId);
        when(ws.isOpen()).thenReturn(true);
        when(ws.getUri()).thenReturn(URI.create("ws://localhost/hubs/sessions" + (query == null ? "" : "?" + query)));
        handler.afterConnectionEstablished(ws);
        return ws;
    }

    private WebSocketSession presenter() throws Exception {
        return open("host", "code=" + created.session().code() + "&presenterKey=" + created.presenterKey());
    }

    private void send(WebSocketSession ws, String json) throws Exception {
        handler.handleTextMessage(ws, new TextMessage(json));
    }

    private JsonNode lastAck(String connId) {
        List<String> inbox = engine.transport.inbox(connId);
        for (int i = inbox.size() - 1; i >= 0; i--) {
            JsonNode node = engine.parse(inbox.get(i));
            if ("ack".equals(node.path("type").asText())) return node;
        }
        return fail("no ack for " + connId);
    }

    private String join(WebSocketSession ws, String name) throws Exception {
        send(ws, "{\"id\":\"j\",\"method\":\"JoinSession\",\"args\":{\"code\":\"" + created.session().code()
                + "\",\"displayName\":\"" + name + "\"}}");
        JsonNode ack = lastAck(ws.getId());
        assertTrue(ack.get("ok").asBoolean(), ack.toString());
        return ack.at("/result/participant/id").asText();
    }

    @Nested
    @DisplayName("Handshake")
    class Handshake {

        @Test
        @DisplayName("presenter key attaches the connection and pushes state")
        void presenterConnects() throws Exception {
            presenter();

            JsonNode state = engine.parse(engine.transport.inbox("host").get(0));
            assertEquals("state", state.get("type").asText());
            assertEquals(created.session().id(), state.at("/payload/session/id").asText());
            assertEquals(1, handler.connectionCount());
        }

        @Test
        @DisplayName("wrong presenter key closes with 4003")
        void wrongKey() throws Exception {
            WebSocketSession ws = open("host", "code=" + created.session().code() + "&presenterKey=nope");

            verify(ws).close(SessionWebSocketHandler.FORBIDDEN);
            assertEquals(0, sockets.connectionCount());
        }

        @Test
        @DisplayName("unknown participant closes with 4004")
        void unknownParticipant() throws Exception {
            WebSocketSession ws = open("ghost", "participantId=missing");

            verify(ws).close(SessionWebSocketHandler.UNKNOWN);
        }

        @Test
        @DisplayName("plain ping is answered with pong")
        void heartbeat() throws Exception {
            WebSocketSession ws = open("anon", null);

            send(ws, "ping");

            verify(ws).sendMessage(new TextMessage("pong"));
        }
    }

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        @DisplayName("join, activate and submit over the socket")
        void roundTrip() throws Exception {
            WebSocketSession host = presenter();
            WebSocketSession alice = open("alice", null);
            join(alice, "Alice");

            send(host, "{\"id\":\"1\",\"method\":\"StartSession\"}");
            assertEquals("Running", lastAck("host").at("/result/status").asText());

            send(host, "{\"id\":\"2\",\"method\":\"ActivateQuestion\",\"args\":{\"questionId\":\"q1\"}}");
            String roundId = lastAck("host").at("/result/roundId").asText();
            assertFalse(roundId.isEmpty());

            engine.clock.advance(java.time.Duration.ofSeconds(5));
            send(alice, "{\"id\":\"3\",\"method\":\"SubmitResponse\",\"args\":{\"roundId\":\"" + roundId
                    + "\",\"payload\":{\"optionId\":\"o1\"}}}");

            JsonNode ack = lastAck("alice");
            assertEquals("3", ack.get("id").asText());
            assertTrue(ack.get("ok").asBoolean());
            assertTrue(ack.at("/result/isCorrect").asBoolean());
            assertTrue(ack.at("/result/pointsAwarded").asInt() > 1000);
            assertTrue(engine.transport.inbox("alice").stream()
                    .anyMatch(f -> f.contains("\"QuestionClosed\"")), "participant saw the close event");
        }

        @Test
        @DisplayName("participant cannot run presenter commands")
        void presenterOnly() throws Exception {
            WebSocketSession alice = open("alice", null);
            join(alice, "Alice");

            send(alice, "{\"id\":\"x\",\"method\":\"StartSession\"}");

            JsonNode ack = lastAck("alice");
            assertFalse(ack.get("ok").asBoolean());
            assertEquals("FORBIDDEN", ack.at("/error/code").asText());
        }

        @Test
        @DisplayName("malformed frames and unknown methods are INVALID_COMMAND")
        void invalidFrames() throws Exception {
            WebSocketSession ws = open("anon", null);

            send(ws, "{not json");
            assertEquals("INVALID_COMMAND", lastAck("anon").at("/error/code").asText());

            send(ws, "{\"id\":\"7\",\"method\":\"Teleport\"}");
            JsonNode ack = lastAck("anon");
            assertEquals("7", ack.get("id").asText());
            assertEquals("INVALID_COMMAND", ack.at("/error/code").asText());

            send(ws, "{\"id\":\"8\",\"method\":\"StartSession\"}");
            assertEquals("INVALID_COMMAND", lastAck("anon").at("/error/code").asText(),
                    "not attached to a session");
        }

        @Test
        @DisplayName("follow-along commands reach participants and need well-typed args")
        void followAlong() throws Exception {
            WebSocketSession host = presenter();
            WebSocketSession alice = open("alice", null);
            join(alice, "Alice");
            send(host, "{\"id\":\"1\",\"method\":\"StartSession\"}");

            send(host, "{\"id\":\"2\",\"method\":\"SyncMapLockState\",\"args\":{\"isLocked\":true}}");
            assertTrue(lastAck("host").at("/result/isLocked").asBoolean());
            send(host, "{\"id\":\"3\",\"method\":\"SyncMapLayer\",\"args\":{\"layerKey\":\"terrain\"}}");
            assertEquals("terrain", lastAck("host").at("/result/layerKey").asText());
            send(host, "{\"id\":\"4\",\"method\":\"SyncSegment\",\"args\":{\"segmentIndex\":1,"
                    + "\"segmentName\":\"Alps\",\"isPlaying\":false}}");
            assertEquals(1, lastAck("host").at("/result/segmentIndex").asInt());

            send(host, "{\"id\":\"5\",\"method\":\"ActivateQuestion\",\"args\":{\"questionId\":\"q1\"}}");
            send(host, "{\"id\":\"6\",\"method\":\"SkipQuestion\"}");
            send(host, "{\"id\":\"7\",\"method\":\"ShowQuestionResults\"}");
            JsonNode ack = lastAck("host");
            assertTrue(ack.get("ok").asBoolean(), ack.toString());
            assertEquals("Vienna", ack.at("/result/correctAnswer").asText());

            List<String> seen = engine.transport.inbox("alice");
            for (String type : List.of("MapLockStateSync", "MapLayerSync", "SegmentSync", "QuestionResults")) {
                assertTrue(seen.stream().anyMatch(f -> f.contains("\"" + type + "\"")), type);
            }

            send(host, "{\"id\":\"8\",\"method\":\"SyncMapLockState\",\"args\":{\"isLocked\":\"yes\"}}");
            assertEquals("INVALID_COMMAND", lastAck("host").at("/error/code").asText());
            send(alice, "{\"id\":\"9\",\"method\":\"SyncMapLayer\",\"args\":{\"layerKey\":\"streets\"}}");
            assertEquals("FORBIDDEN", lastAck("alice").at("/error/code").asText());
        }

        @Test
        @DisplayName("a second JoinSession on a participant connection is rejected")
        void rejoinRejected() throws Exception {
            WebSocketSession alice = open("a", null);
            join(alice, "Alice");

            send(alice, "{\"id\":\"j2\",\"method\":\"JoinSession\",\"args\":{\"code\":\""
                    + created.session().code() + "\",\"displayName\":\"Alice again\"}}");
            JsonNode ack = lastAck("a");
            assertFalse(ack.get("ok").asBoolean());
            assertEquals("INVALID_COMMAND", ack.at("/error/code").asText());

            handler.afterConnectionClosed(alice, CloseStatus.NORMAL);
            var view = engine.service.getSession(created.session().id());
            assertEquals(1, view.participantCount(), "no second participant was created");
            assertEquals(0, view.connectedCount());
        }

        @Test
        @DisplayName("CreateSession makes the connection the presenter")
        void createOverSocket() throws Exception {
            WebSocketSession ws = open("new-host", null);

            send(ws, "{\"id\":\"c\",\"method\":\"CreateSession\",\"args\":{\"name\":\"Quiz\",\"questions\":["
                    + "{\"type\":\"TrueFalse\",\"text\":\"Vienna is in Austria\",\"options\":["
                    + "{\"text\":\"True\",\"correct\":true},{\"text\":\"False\"}]}]}}");
            JsonNode ack = lastAck("new-host");
            assertTrue(ack.get("ok").asBoolean(), ack.toString());
            assertFalse(ack.at("/result/presenterKey").asText().isEmpty());

            send(ws, "{\"id\":\"s\",\"method\":\"StartSession\"}");
            assertTrue(lastAck("new-host").get("ok").asBoolean());
        }
    }

    @Test
    @DisplayName("closing a participant socket marks the participant disconnected")
    void closeDisconnects() throws Exception {
        WebSocketSession alice = open("alice", null);
        String pid = join(alice, "Alice");

        handler.afterConnectionClosed(alice, CloseStatus.NORMAL);

        assertEquals(0, handler.connectionCount());
        assertEquals(0, engine.service.getSession(created.session().id()).connectedCount());
        assertEquals(created.session().id(), engine.service.sessionIdOf(pid), "still on the roster");
    }

    @Test
    @DisplayName("closing the socket a participant reconnected away from keeps them connected")
    void staleCloseAfterReconnect() throws Exception {
        WebSocketSession first = open("a", null);
        String pid = join(first, "Alice");
        WebSocketSession second = open("b", "participantId=" + pid);

        handler.afterConnectionClosed(first, CloseStatus.GOING_AWAY);

        assertEquals(1, engine.service.getSession(created.session().id()).connectedCount());

        handler.afterConnectionClosed(second, CloseStatus.NORMAL);
        assertEquals(0, engine.service.getSession(created.session().id()).connectedCount());
    }
}
