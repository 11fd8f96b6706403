package com.pricestream.api.controller;

import com.pricestream.alert.AlertService;
import com.pricestream.api.dto.request.CreateAlertRequest;
import com.pricestream.api.dto.response.AlertResponse;
import com.pricestream.domain.model.Alert;
import com.pricestream.domain.model.CallerIdentity;
import com.pricestream.exception.UnauthorizedException;
import com.pricestream.mapper.AlertDtoMapper;
import com.pricestream.ratelimit.StrictRateLimit;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the caller's price alerts. Every endpoint requires an identified user.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/alerts} -- create an alert (strict rate limit)</li>
 *   <li>{@code GET /api/alerts?active=true} -- list alerts, optionally pending only</li>
 *   <li>{@code GET /api/alerts/{id}} -- get one alert</li>
 *   <li>{@code PATCH /api/alerts/{id}/deactivate} -- deactivate an alert</li>
 *   <li>{@code DELETE /api/alerts/{id}} -- delete an alert</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final AlertService alertService;

    private final AlertDtoMapper alertDtoMapper = Mappers.getMapper(AlertDtoMapper.class);

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @StrictRateLimit
    public AlertResponse createAlert(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @Valid @RequestBody CreateAlertRequest request) {
        String userId = requireUser(caller);
        Alert alert = alertService.createAlert(
                userId,
                caller.tier(),
                request.getSymbol(),
                request.getCondition(),
                request.getTargetPrice(),
                request.getPercentChange());
        return alertDtoMapper.toResponse(alert);
    }

    @GetMapping
    public List<AlertResponse> listAlerts(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @RequestParam(name = "active", defaultValue = "false") boolean activeOnly) {
        return alertDtoMapper.toResponseList(alertService.listAlerts(requireUser(caller), activeOnly));
    }

    @GetMapping("/{id}")
    public AlertResponse getAlert(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller, @PathVariable String id) {
        return alertDtoMapper.toResponse(alertService.getAlert(id, requireUser(caller)));
    }

    @PatchMapping("/{id}/deactivate")
    public AlertResponse deactivateAlert(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller, @PathVariable String id) {
        return alertDtoMapper.toResponse(alertService.deactivateAlert(id, requireUser(caller)));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAlert(@RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller, @PathVariable String id) {
        alertService.deleteAlert(id, requireUser(caller));
    }

    private static String requireUser(CallerIdentity caller) {
        if (caller == null || !caller.isAuthenticated()) {
            throw new UnauthorizedException("Authentication required");
        }
        return caller.userId();
    }
}
