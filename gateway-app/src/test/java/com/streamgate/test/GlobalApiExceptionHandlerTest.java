package com.streamgate.test;

import com.streamgate.api.response.Response;
import com.streamgate.trigger.http.GlobalApiExceptionHandler;
import com.streamgate.types.enums.ResponseCode;
import com.streamgate.types.exception.AppException;
import com.streamgate.types.exception.RateLimitedException;
import com.streamgate.types.exception.SessionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class GlobalApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ErrorController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldHandleAppException() throws Exception {
        mockMvc.perform(get("/api/test/app-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.info").value("参数错误"));
    }

    @Test
    public void shouldHandleRateLimitedWithRetryAfterHeader() throws Exception {
        mockMvc.perform(get("/api/test/rate-limited"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "3"))
                .andExpect(jsonPath("$.code").value(ResponseCode.RATE_LIMITED.getCode()));
    }

    @Test
    public void shouldRoundSubSecondRetryAfterUpToOne() throws Exception {
        mockMvc.perform(get("/api/test/rate-limited-short"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "1"));
    }

    @Test
    public void shouldHandleSessionNotFoundAs404() throws Exception {
        mockMvc.perform(get("/api/test/session-missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ResponseCode.SESSION_NOT_FOUND.getCode()));
    }

    @Test
    public void shouldHandleUnknownException() throws Exception {
        mockMvc.perform(get("/api/test/runtime-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }

    @Test
    public void shouldHandleTypeMismatchExceptionAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/type-error/not-number"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldHandleMissingParameterAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/required-param"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @RestController
    private static class ErrorController {

        @GetMapping("/api/test/app-error")
        public Response<Void> appError() {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "参数错误");
        }

        @GetMapping("/api/test/rate-limited")
        public Response<Void> rateLimited() {
            throw new RateLimitedException("10.0.0.7", 2.4D);
        }

        @GetMapping("/api/test/rate-limited-short")
        public Response<Void> rateLimitedShort() {
            throw new RateLimitedException("10.0.0.7", 0.2D);
        }

        @GetMapping("/api/test/session-missing")
        public Response<Void> sessionMissing() {
            throw new SessionNotFoundException("missing");
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new RuntimeException("boom");
        }

        @GetMapping("/api/test/type-error/{id}")
        public Response<String> typeError(@PathVariable("id") Long id) {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(String.valueOf(id))
                    .build();
        }

        @GetMapping("/api/test/required-param")
        public Response<String> requiredParam(@RequestParam("name") String name) {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .data(name)
                    .build();
        }
    }
}
