package club.ppmc.inspector.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.inspector.exception.PathViolationException;
import club.ppmc.inspector.exception.TargetNotFoundException;
import club.ppmc.inspector.model.DebugSession;
import club.ppmc.inspector.model.SessionStatus;
import club.ppmc.inspector.model.StartOptions;
import club.ppmc.inspector.service.DebugSessionService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DebugSessionControllerTest {

    private DebugSessionService sessionService;
    private MockMvc mvc;

    private final DebugSession session = new DebugSession(
            "session-1",
            "src/app.js",
            "/work/src/app.js",
            9229,
            8888,
            "ws://localhost:8888/",
            "ws://127.0.0.1:9229/5e1d",
            4242L,
            SessionStatus.PAUSED,
            Instant.parse("2026-10-18T08:00:00Z"));

    @BeforeEach
    void setUp() {
        sessionService = mock(DebugSessionService.class);
        mvc = MockMvcBuilders.standaloneSetup(new DebugSessionController(sessionService)).build();
    }

    private ResultActions performAsync(MockHttpServletRequestBuilder builder) throws Exception {
        MvcResult pending = mvc.perform(builder).andExpect(request().asyncStarted()).andReturn();
        return mvc.perform(asyncDispatch(pending));
    }

    private static MockHttpServletRequestBuilder startRequest(String json) {
        return post("/debug/session").contentType(MediaType.APPLICATION_JSON).content(json);
    }

    @Test
    void startReturnsCreatedSession() throws Exception {
        when(sessionService.start(eq("src/app.js"), any(StartOptions.class)))
                .thenReturn(CompletableFuture.completedFuture(session));

        performAsync(startRequest("{\"file\":\"src/app.js\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.session.sessionId").value("session-1"))
                .andExpect(jsonPath("$.session.wsUrl").value("ws://localhost:8888/"))
                .andExpect(jsonPath("$.session.status").value("paused"))
                .andExpect(jsonPath("$.session.pid").value(4242));
    }

    @Test
    void startPassesOptionsThrough() throws Exception {
        when(sessionService.start(eq("src/app.js"), eq(new StartOptions(false, 9300))))
                .thenReturn(CompletableFuture.completedFuture(session));

        performAsync(startRequest("{\"file\":\"src/app.js\",\"breakOnStart\":false,\"inspectPort\":9300}"))
                .andExpect(status().isCreated());
    }

    @Test
    void missingFileFieldIsBadRequest() throws Exception {
        performAsync(startRequest("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required field: file"));

        verify(sessionService, never()).start(any(), any());
    }

    @Test
    void traversalIsForbidden() throws Exception {
        when(sessionService.start(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new PathViolationException("../../etc/passwd")));

        performAsync(startRequest("{\"file\":\"../../etc/passwd\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.type").value("PATH_VIOLATION"));
    }

    @Test
    void missingTargetIsBadRequest() throws Exception {
        when(sessionService.start(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new TargetNotFoundException("nope.js")));

        performAsync(startRequest("{\"file\":\"nope.js\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Target file not found: nope.js"));
    }

    @Test
    void currentWithoutSessionIsNotFound() throws Exception {
        when(sessionService.current()).thenReturn(Optional.empty());

        mvc.perform(get("/debug/session"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No active session"));
    }

    @Test
    void currentReturnsTheSession() throws Exception {
        when(sessionService.current()).thenReturn(Optional.of(session));

        mvc.perform(get("/debug/session"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targetFile").value("src/app.js"));
    }

    @Test
    void listAndFind() throws Exception {
        when(sessionService.list()).thenReturn(List.of(session));
        when(sessionService.find("session-1")).thenReturn(Optional.of(session));
        when(sessionService.find("session-9")).thenReturn(Optional.empty());

        mvc.perform(get("/debug/sessions")).andExpect(jsonPath("$.sessions[0].sessionId").value("session-1"));
        mvc.perform(get("/debug/session/session-1")).andExpect(status().isOk());
        mvc.perform(get("/debug/session/session-9")).andExpect(status().isNotFound());
    }

    @Test
    void deleteStopsTheSession() throws Exception {
        DebugSession stopped = session.withoutProcess().withStatus(SessionStatus.STOPPED);
        when(sessionService.stop("session-1")).thenReturn(CompletableFuture.completedFuture(Optional.of(stopped)));

        performAsync(delete("/debug/session/session-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.sessionId").value("session-1"))
                .andExpect(jsonPath("$.status").value("stopped"));
    }

    @Test
    void deleteUnknownSessionIsNotFound() throws Exception {
        when(sessionService.stop("session-9")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        when(sessionService.stop(isNull())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        performAsync(delete("/debug/session/session-9")).andExpect(status().isNotFound());
        performAsync(delete("/debug/session")).andExpect(status().isNotFound());
    }
}
