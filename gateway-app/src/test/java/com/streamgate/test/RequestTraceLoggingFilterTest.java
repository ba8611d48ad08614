package com.streamgate.test;

import com.streamgate.api.response.Response;
import com.streamgate.config.RequestTraceLoggingFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TestController())
                .addFilters(new RequestTraceLoggingFilter())
                .build();
    }

    @Test
    public void shouldInjectTraceHeadersForApiRequests() throws Exception {
        mockMvc.perform(post("/api/test/echo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.traceId").isNotEmpty());
    }

    @Test
    public void shouldPropagateIncomingTraceId() throws Exception {
        mockMvc.perform(get("/api/test/trace").header("X-Trace-Id", "trace-abc"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "trace-abc"))
                .andExpect(jsonPath("$.data.traceId").value("trace-abc"));
    }

    @Test
    public void shouldSkipActuatorPath() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"))
                .andExpect(header().doesNotExist("X-Request-Id"));
    }

    @RestController
    private static class TestController {

        @PostMapping("/api/test/echo")
        public Response<Map<String, Object>> echo(@RequestBody(required = false) Map<String, Object> request) {
            return Response.<Map<String, Object>>builder()
                    .code("0000")
                    .info("成功")
                    .data(Map.of("traceId", MDC.get("traceId")))
                    .build();
        }

        @GetMapping("/api/test/trace")
        public Response<Map<String, Object>> trace() {
            return Response.<Map<String, Object>>builder()
                    .code("0000")
                    .info("成功")
                    .data(Map.of("traceId", MDC.get("traceId")))
                    .build();
        }

        @GetMapping("/actuator/health")
        public Map<String, Object> health() {
            return Map.of("status", "UP");
        }
    }
}
