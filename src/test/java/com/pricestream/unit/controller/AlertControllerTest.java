package com.pricestream.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.pricestream.alert.AlertService;
import com.pricestream.api.controller.AlertController;
import com.pricestream.config.ApiResponseAdvice;
import com.pricestream.domain.enums.AlertCondition;
import com.pricestream.domain.enums.SubscriptionTier;
import com.pricestream.domain.model.Alert;
import com.pricestream.exception.BusinessException;
import com.pricestream.exception.ErrorCode;
import com.pricestream.exception.GlobalExceptionHandler;
import com.pricestream.exception.ResourceNotFoundException;
import com.pricestream.observability.PriceStreamMetrics;
import com.pricestream.ratelimit.InMemoryRateLimitStore;
import com.pricestream.ratelimit.RateLimitConfig;
import com.pricestream.ratelimit.RateLimitInterceptor;
import com.pricestream.ratelimit.RateLimiter;
import com.pricestream.subscription.SubscriptionRegistry;
import com.pricestream.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the AlertController, with the rate-limit interceptor
 * resolving the caller from headers.
 */
@ExtendWith(MockitoExtension.class)
class AlertControllerTest {

    private static final String CREATE_BODY = """
            {
                "symbol": "BTC",
                "condition": "above",
                "targetPrice": 60000
            }
            """;

    private MockMvc mockMvc;

    @Mock
    private AlertService alertService;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atEpochMillis(1_700_000_000_000L);
        PriceStreamMetrics metrics = new PriceStreamMetrics(new SimpleMeterRegistry(), mock(SubscriptionRegistry.class));
        RateLimiter rateLimiter =
                new RateLimiter(new InMemoryRateLimitStore(clock), new RateLimitConfig(), clock, metrics);

        mockMvc = MockMvcBuilders.standaloneSetup(new AlertController(alertService))
                .addInterceptors(new RateLimitInterceptor(rateLimiter, clock))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private Alert buildAlert(String id) {
        return Alert.builder()
                .id(id)
                .userId("alice")
                .symbol("BTC")
                .condition(AlertCondition.ABOVE)
                .targetPrice(new BigDecimal("60000"))
                .basePrice(new BigDecimal("55000"))
                .active(true)
                .createdAt(Instant.parse("2026-01-15T09:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("POST /api/alerts creates an alert for the caller's tier and returns 201")
    void createAlert() throws Exception {
        when(alertService.createAlert(
                        eq("alice"), eq(SubscriptionTier.PRO), eq("BTC"), eq(AlertCondition.ABOVE), any(), isNull()))
                .thenReturn(buildAlert("a1"));

        mockMvc.perform(post("/api/alerts")
                        .header("X-User-Id", "alice")
                        .header("X-User-Tier", "pro")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isCreated())
                .andExpect(header().string("X-RateLimit-Limit", "1000"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value("a1"))
                .andExpect(jsonPath("$.data.condition").value("above"))
                .andExpect(jsonPath("$.data.isActive").value(true))
                .andExpect(jsonPath("$.data.isTriggered").value(false));
    }

    @Test
    @DisplayName("POST /api/alerts without a user returns 401")
    void createRequiresUser() throws Exception {
        mockMvc.perform(post("/api/alerts").contentType(MediaType.APPLICATION_JSON).content(CREATE_BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));

        verify(alertService, never()).createAlert(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("POST /api/alerts with a missing symbol fails validation")
    void createValidatesBody() throws Exception {
        mockMvc.perform(post("/api/alerts")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"condition\": \"below\", \"targetPrice\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.symbol").exists())
                .andExpect(jsonPath("$.error.details.targetPrice").exists());
    }

    @Test
    @DisplayName("POST /api/alerts with an unknown condition is a bad request")
    void createRejectsUnknownCondition() throws Exception {
        mockMvc.perform(post("/api/alerts")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\": \"BTC\", \"condition\": \"sideways\", \"targetPrice\": 5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("POST /api/alerts at the tier cap returns 403 with the cap details")
    void createAtCap() throws Exception {
        when(alertService.createAlert(any(), any(), any(), any(), any(), any()))
                .thenThrow(new BusinessException(
                        ErrorCode.ALERT_LIMIT_REACHED,
                        "Alert limit reached. Your free tier allows 5 active alerts.",
                        Map.of("currentCount", 5, "maxAlerts", 5, "tier", "free")));

        mockMvc.perform(post("/api/alerts")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("ALERT_LIMIT_REACHED"))
                .andExpect(jsonPath("$.error.details.maxAlerts").value(5));
    }

    @Test
    @DisplayName("alert creation is held to the strict limit and rejected with Retry-After")
    void createIsStrictlyLimited() throws Exception {
        when(alertService.createAlert(any(), any(), any(), any(), any(), any())).thenReturn(buildAlert("a1"));

        for (int i = 0; i < 10; i++) {
            mockMvc.perform(post("/api/alerts")
                            .header("X-User-Id", "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(CREATE_BODY))
                    .andExpect(status().isCreated());
        }

        mockMvc.perform(post("/api/alerts")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "60"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(jsonPath("$.error.code").value("RATE_LIMIT_EXCEEDED"))
                .andExpect(jsonPath("$.error.details.limit").value(10));
    }

    @Test
    @DisplayName("GET /api/alerts lists the caller's alerts, optionally pending only")
    void listAlerts() throws Exception {
        when(alertService.listAlerts("alice", true)).thenReturn(List.of(buildAlert("a1"), buildAlert("a2")));

        mockMvc.perform(get("/api/alerts").param("active", "true").header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[1].id").value("a2"));
    }

    @Test
    @DisplayName("GET /api/alerts/{id} for someone else's alert returns 404")
    void getAlertNotFound() throws Exception {
        when(alertService.getAlert("a1", "bob")).thenThrow(new ResourceNotFoundException("Alert", "a1"));

        mockMvc.perform(get("/api/alerts/a1").header("X-User-Id", "bob"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("PATCH /api/alerts/{id}/deactivate returns the inactive alert")
    void deactivateAlert() throws Exception {
        Alert inactive = buildAlert("a1").toBuilder().active(false).build();
        when(alertService.deactivateAlert("a1", "alice")).thenReturn(inactive);

        mockMvc.perform(patch("/api/alerts/a1/deactivate").header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isActive").value(false));
    }

    @Test
    @DisplayName("DELETE /api/alerts/{id} returns 204, or 404 when the caller does not own it")
    void deleteAlert() throws Exception {
        mockMvc.perform(delete("/api/alerts/a1").header("X-User-Id", "alice"))
                .andExpect(status().isNoContent());
        verify(alertService).deleteAlert("a1", "alice");

        doThrow(new ResourceNotFoundException("Alert", "a2")).when(alertService).deleteAlert("a2", "alice");
        mockMvc.perform(delete("/api/alerts/a2").header("X-User-Id", "alice"))
                .andExpect(status().isNotFound());
    }
}
