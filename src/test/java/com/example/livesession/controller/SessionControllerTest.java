package com.example.livesession.controller;

import com.example.livesession.controller.advice.GlobalExceptionHandler;
import com.example.livesession.dto.CreateSessionRequest;
import com.example.livesession.dto.CreatedSession;
import com.example.livesession.dto.SessionView;
import com.example.livesession.exception.AlreadySubmittedException;
import com.example.livesession.exception.InvalidTransitionException;
import com.example.livesession.exception.NotFoundException;
import com.example.livesession.exception.PresenterOnlyException;
import com.example.livesession.model.AnswerFeedback;
import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.ResponsePayload;
import com.example.livesession.model.SegmentState;
import com.example.livesession.model.SessionSettings;
import com.example.livesession.model.SessionStatus;
import com.example.livesession.service.LiveSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * SessionControllerTest (standalone MockMvc)
 *
 * Scope: routing, presenter key header, body validation and the error mapping
 * of the global advice. The service is mocked.
 */
class SessionControllerTest {

    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    private LiveSessionService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = mock(LiveSessionService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new SessionController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
    }

    private static SessionView view(SessionStatus status) {
        return new SessionView("s1", "ABC234", "Quiz", status, SessionSettings.defaults(), 2, -1, 0, 0,
                T0, null, null, 0);
    }

    @Nested
    @DisplayName("POST /api/sessions")
    class Create {

        @Test
        @DisplayName("creates and returns the presenter key once")
        void create() throws Exception {
            when(service.createSession(any())).thenReturn(
                    new CreatedSession(view(SessionStatus.PENDING), "boss", "secret-key"));

            mockMvc.perform(post("/api/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"name":"Quiz","questions":[
                                      {"type":"MultipleChoice","text":"Capital of Austria?",
                                       "options":[{"text":"Vienna","correct":true},{"text":"Graz"}]}]}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.presenterKey", is("secret-key")))
                    .andExpect(jsonPath("$.session.code", is("ABC234")))
                    .andExpect(jsonPath("$.session.status", is("Pending")));

            ArgumentCaptor<CreateSessionRequest> captor = ArgumentCaptor.forClass(CreateSessionRequest.class);
            verify(service).createSession(captor.capture());
            assertEquals(1, captor.getValue().questions().size());
            assertEquals("Vienna", captor.getValue().questions().get(0).options().get(0).text());
        }

        @Test
        @DisplayName("an empty question list is a 400 problem")
        void invalidBody() throws Exception {
            mockMvc.perform(post("/api/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Quiz\",\"questions\":[]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code", is("INVALID_COMMAND")));

            verifyNoInteractions(service);
        }
    }

    @Nested
    @DisplayName("Presenter endpoints")
    class Presenter {

        @Test
        @DisplayName("start resolves the presenter key")
        void start() throws Exception {
            when(service.requesterFor("s1", "k")).thenReturn("boss");
            when(service.startSession("s1", "boss")).thenReturn(view(SessionStatus.RUNNING));

            mockMvc.perform(post("/api/sessions/{id}/start", "s1").header(SessionController.PRESENTER_KEY, "k"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status", is("Running")));
        }

        @Test
        @DisplayName("missing presenter key is 403")
        void missingKey() throws Exception {
            mockMvc.perform(post("/api/sessions/{id}/start", "s1"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code", is("FORBIDDEN")));

            verifyNoInteractions(service);
        }

        @Test
        @DisplayName("wrong key surfaces the service's FORBIDDEN")
        void wrongKey() throws Exception {
            when(service.requesterFor("s1", "bad")).thenReturn(null);
            when(service.pauseSession("s1", null)).thenThrow(new PresenterOnlyException("pause the session"));

            mockMvc.perform(post("/api/sessions/{id}/pause", "s1").header(SessionController.PRESENTER_KEY, "bad"))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("invalid transition is 409 with the current status")
        void invalidTransition() throws Exception {
            when(service.requesterFor("s1", "k")).thenReturn("boss");
            when(service.resumeSession("s1", "boss"))
                    .thenThrow(new InvalidTransitionException(SessionStatus.ENDED, SessionStatus.RUNNING));

            mockMvc.perform(post("/api/sessions/{id}/resume", "s1").header(SessionController.PRESENTER_KEY, "k"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code", is("INVALID_TRANSITION")))
                    .andExpect(jsonPath("$.currentStatus", is("Ended")));
        }

        @Test
        @DisplayName("next question and extend map to the service")
        void rounds() throws Exception {
            when(service.requesterFor("s1", "k")).thenReturn("boss");

            mockMvc.perform(post("/api/sessions/{id}/questions/next", "s1").header(SessionController.PRESENTER_KEY, "k"))
                    .andExpect(status().isOk());
            mockMvc.perform(post("/api/sessions/{id}/rounds/{rid}/extend", "s1", "r1")
                            .param("additionalSeconds", "15")
                            .header(SessionController.PRESENTER_KEY, "k"))
                    .andExpect(status().isOk());

            verify(service).activateQuestion("s1", "boss", null);
            verify(service).extendTime("s1", "boss", "r1", 15);
        }

        @Test
        @DisplayName("follow-along endpoints pass the synced state through")
        void followAlong() throws Exception {
            when(service.requesterFor("s1", "k")).thenReturn("boss");
            when(service.syncMapLock("s1", "boss", true)).thenReturn(true);
            when(service.syncSegment("s1", "boss", 3, "seg-4", null, true))
                    .thenReturn(new SegmentState(3, "seg-4", null, true, T0));

            mockMvc.perform(post("/api/sessions/{id}/map/lock", "s1")
                            .header(SessionController.PRESENTER_KEY, "k")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"isLocked\":true}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.isLocked", is(true)));
            mockMvc.perform(post("/api/sessions/{id}/segment", "s1")
                            .header(SessionController.PRESENTER_KEY, "k")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"segmentIndex\":3,\"segmentId\":\"seg-4\",\"isPlaying\":true}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.isPlaying", is(true)));
            mockMvc.perform(post("/api/sessions/{id}/rounds/{rid}/show-results", "s1", "r1")
                            .header(SessionController.PRESENTER_KEY, "k"))
                    .andExpect(status().isOk());

            verify(service).showQuestionResults("s1", "boss", "r1");
        }

        @Test
        @DisplayName("a blank map layer is rejected before reaching the service")
        void blankLayer() throws Exception {
            mockMvc.perform(post("/api/sessions/{id}/map/layer", "s1")
                            .header(SessionController.PRESENTER_KEY, "k")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"layerKey\":\"\"}"))
                    .andExpect(status().isBadRequest());

            verify(service, never()).syncMapLayer(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Participant endpoints")
    class Participants {

        @Test
        @DisplayName("submit returns private feedback")
        void submit() throws Exception {
            when(service.sessionIdOf("p1")).thenReturn("s1");
            when(service.submitResponse(eq("p1"), eq("r1"), any(ResponsePayload.class), isNull()))
                    .thenReturn(new AnswerFeedback(true, 1375, 375, "Vienna", null, null));

            mockMvc.perform(post("/api/sessions/{id}/participants/{pid}/responses", "s1", "p1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"roundId\":\"r1\",\"optionId\":\"o1\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.isCorrect", is(true)))
                    .andExpect(jsonPath("$.pointsAwarded", is(1375)));
        }

        @Test
        @DisplayName("second submit is 409 ALREADY_SUBMITTED")
        void duplicate() throws Exception {
            when(service.sessionIdOf("p1")).thenReturn("s1");
            when(service.submitResponse(eq("p1"), eq("r1"), any(), any()))
                    .thenThrow(new AlreadySubmittedException("p1", "r1"));

            mockMvc.perform(post("/api/sessions/{id}/participants/{pid}/responses", "s1", "p1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"roundId\":\"r1\",\"optionId\":\"o1\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code", is("ALREADY_SUBMITTED")));
        }

        @Test
        @DisplayName("participant of another session is 404")
        void foreignParticipant() throws Exception {
            when(service.sessionIdOf("p1")).thenReturn("other");

            mockMvc.perform(post("/api/sessions/{id}/participants/{pid}/responses", "s1", "p1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"roundId\":\"r1\",\"optionId\":\"o1\"}"))
                    .andExpect(status().isNotFound());

            verify(service, never()).submitResponse(any(), any(), any(), any());
        }

        @Test
        @DisplayName("leaderboard passes the limit; unknown session is 404")
        void leaderboard() throws Exception {
            when(service.leaderboard("s1", null, 3)).thenReturn(List.of(
                    new LeaderboardEntry("p1", "Alice", 1375, 1, 100.0, 5.0, true)));
            when(service.leaderboard("nope", null, 0)).thenThrow(NotFoundException.session("nope"));

            mockMvc.perform(get("/api/sessions/{id}/leaderboard", "s1").param("limit", "3"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].displayName", is("Alice")))
                    .andExpect(jsonPath("$[0].rank", is(1)));
            mockMvc.perform(get("/api/sessions/{id}/leaderboard", "nope"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code", is("NOT_FOUND")));
        }
    }
}
