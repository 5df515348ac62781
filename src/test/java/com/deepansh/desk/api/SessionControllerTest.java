package com.deepansh.desk.api;

import com.deepansh.desk.approval.ApprovalDecision;
import com.deepansh.desk.context.ContextBag;
import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.dispatch.DeskResponse;
import com.deepansh.desk.dispatch.Dispatcher;
import com.deepansh.desk.exception.GateProtocolViolationException;
import com.deepansh.desk.exception.GlobalExceptionHandler;
import com.deepansh.desk.exception.SessionNotFoundException;
import com.deepansh.desk.session.Session;
import com.deepansh.desk.session.SessionRegistry;
import com.deepansh.desk.session.SessionRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.function.Function;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock
    private SessionRegistry registry;

    @Mock
    private Dispatcher dispatcher;

    private MockMvc mockMvc;
    private SessionRuntime runtime;

    @BeforeEach
    void setUp() {
        Session session = Session.create("s1", 30, Instant.parse("2026-10-19T01:00:00Z"));
        session.setRequesterId("Sato");
        runtime = new SessionRuntime(session, dispatcher, null);
        mockMvc = MockMvcBuilders.standaloneSetup(new SessionController(registry))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        lenient().when(registry.execute(eq("s1"), any())).thenAnswer(inv -> {
            Function<SessionRuntime, Object> work = inv.getArgument(1);
            return work.apply(runtime);
        });
    }

    @Test
    void createSession_returnsCreatedView() throws Exception {
        when(registry.create("Sato", null)).thenReturn(runtime);

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"requesterId\":\"Sato\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.identified").value(true));
    }

    @Test
    void createSession_blankRequester_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"requesterId\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("requesterId: requesterId must not be blank"));
    }

    @Test
    void message_isHandledByDispatcher() throws Exception {
        when(dispatcher.handle(eq("Receipt from Maruzen"), any(ContextBag.class)))
                .thenReturn(DeskResponse.of(DeskResponse.Type.REPLY, "s1", "How much was it?"));

        mockMvc.perform(post("/api/v1/sessions/s1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"Receipt from Maruzen\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("REPLY"))
                .andExpect(jsonPath("$.message").value("How much was it?"));
    }

    @Test
    void decision_revise_isForwardedWithFeedback() throws Exception {
        when(dispatcher.decide(eq("a1"), eq(ApprovalDecision.revise("Route 2 date")), any(ContextBag.class)))
                .thenReturn(DeskResponse.of(DeskResponse.Type.REPLY, "s1", "Updated."));

        mockMvc.perform(post("/api/v1/sessions/s1/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actionId\":\"a1\",\"kind\":\"REVISE\",\"feedback\":\"Route 2 date\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Updated."));
    }

    @Test
    void decision_alreadyResolved_isConflict() throws Exception {
        when(dispatcher.decide(anyString(), any(ApprovalDecision.class), any(ContextBag.class)))
                .thenThrow(new GateProtocolViolationException("Action a1 has already been resolved"));

        mockMvc.perform(post("/api/v1/sessions/s1/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actionId\":\"a1\",\"kind\":\"APPROVE\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Action a1 has already been resolved"));
    }

    @Test
    void getSession_unknown_isNotFound() throws Exception {
        when(registry.execute(eq("missing"), any())).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/sessions/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getSession_showsState() throws Exception {
        mockMvc.perform(get("/api/v1/sessions/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.identified").value(true));
    }

    @Test
    void identity_blankRequester_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/s1/identity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"requesterId\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("requesterId: requesterId must not be blank"));
    }

    @Test
    void message_explicitRequester_reachesDispatcherContext() throws Exception {
        when(dispatcher.handle(eq("Receipt please"),
                argThat(bag -> bag.get(ContextKeys.REQUESTER_ID).filter("Tanaka"::equals).isPresent())))
                .thenReturn(DeskResponse.of(DeskResponse.Type.REPLY, "s1", "Which store?"));

        mockMvc.perform(post("/api/v1/sessions/s1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"Receipt please\",\"requesterId\":\"Tanaka\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Which store?"));
    }

    @Test
    void health_isUp() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
