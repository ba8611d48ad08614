package com.streamgate.test;

import com.streamgate.trigger.application.sse.SseEmitterTransport;
import com.streamgate.trigger.application.stream.ConnectionDispatcher;
import com.streamgate.trigger.application.stream.EventStreamTransport;
import com.streamgate.trigger.http.ClientIdentityResolver;
import com.streamgate.trigger.http.StreamController;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class StreamControllerTest {

    private MockMvc mockMvc;
    private ConnectionDispatcher connectionDispatcher;

    @BeforeEach
    public void setUp() {
        this.connectionDispatcher = mock(ConnectionDispatcher.class);
        when(connectionDispatcher.open(anyString(), anyString(), anyString(), any(EventStreamTransport.class)))
                .thenAnswer(invocation -> invocation.getArgument(1));
        StreamController controller = new StreamController(connectionDispatcher, new ClientIdentityResolver(),
                "default_user", 0L);
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    public void shouldOpenStreamForRequestedSession() throws Exception {
        mockMvc.perform(get("/api/stream")
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .param("user_id", "user-1")
                        .param("session_id", "s1")
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1"))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted())
                .andExpect(header().string("X-Session-Id", "s1"))
                .andExpect(header().string("X-Accel-Buffering", "no"))
                .andExpect(header().string("Cache-Control", "no-cache, no-transform"));

        ArgumentCaptor<EventStreamTransport> transportCaptor = ArgumentCaptor.forClass(EventStreamTransport.class);
        verify(connectionDispatcher).open(eq("user-1"), eq("s1"), eq("203.0.113.9"), transportCaptor.capture());
        Assertions.assertTrue(transportCaptor.getValue() instanceof SseEmitterTransport);
        Assertions.assertTrue(transportCaptor.getValue().isOpen());
    }

    @Test
    public void shouldGenerateSessionIdAndDefaultUser() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/stream").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted())
                .andReturn();

        String sessionId = result.getResponse().getHeader("X-Session-Id");
        Assertions.assertNotNull(sessionId);
        Assertions.assertEquals(sessionId, UUID.fromString(sessionId).toString());
        verify(connectionDispatcher).open(eq("default_user"), eq(sessionId), eq("127.0.0.1"), any(EventStreamTransport.class));
    }

    @Test
    public void shouldTreatBlankParametersAsAbsent() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/stream")
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .param("user_id", "  ")
                        .param("session_id", ""))
                .andExpect(request().asyncStarted())
                .andReturn();

        String sessionId = result.getResponse().getHeader("X-Session-Id");
        Assertions.assertFalse(sessionId == null || sessionId.isBlank());
        verify(connectionDispatcher).open(eq("default_user"), eq(sessionId), anyString(), any(EventStreamTransport.class));
    }
}
