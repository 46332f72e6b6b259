package com.safeher.sosdispatch.controller;

import com.safeher.sosdispatch.dto.*;
import com.safeher.sosdispatch.entity.AlertStatus;
import com.safeher.sosdispatch.service.AlertLifecycleService;
import com.safeher.sosdispatch.service.AlertQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * SOS alert endpoints. The caller is always the session user set by AuthController.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final AlertLifecycleService alertLifecycleService;
    private final AlertQueryService alertQueryService;

    /**
     * POST /api/alerts - raise an SOS. Responds 201 with the id and notification counts.
     */
    @PostMapping
    public ResponseEntity<ApiResponse> createAlert(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @Valid @RequestBody CreateAlertRequest request) {
        AlertCreationResult result = alertLifecycleService.createAlert(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(result, "Emergency alert created successfully"));
    }

    @GetMapping("/my")
    public ResponseEntity<ApiResponse> getMyAlerts(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @RequestParam(required = false) AlertStatus status) {
        List<AlertResponse> alerts = alertQueryService.getMyAlerts(userId, status);
        return ResponseEntity.ok(ApiResponse.success(alerts, alerts.size() + " alert(s)"));
    }

    @GetMapping("/active")
    public ResponseEntity<ApiResponse> getActiveAlert(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId) {
        return alertQueryService.getActiveAlert(userId)
                .map(a -> ResponseEntity.ok(ApiResponse.success(a, "Active alert")))
                .orElseGet(() -> ResponseEntity.ok(ApiResponse.success(null, "No active alert")));
    }

    /**
     * GET /api/alerts/pending-feedback - resolved alerts with a responder that are still unrated.
     */
    @GetMapping("/pending-feedback")
    public ResponseEntity<ApiResponse> getPendingFeedback(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId) {
        List<AlertResponse> alerts = alertQueryService.getPendingFeedback(userId);
        return ResponseEntity.ok(ApiResponse.success(alerts, alerts.size() + " alert(s) awaiting feedback"));
    }

    @GetMapping("/nearby")
    public ResponseEntity<ApiResponse> getNearbyAlerts(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @RequestParam Double latitude,
            @RequestParam Double longitude) {
        List<NearbyAlertResponse> alerts = alertQueryService.getNearbyAlerts(userId, latitude, longitude);
        return ResponseEntity.ok(ApiResponse.success(alerts, alerts.size() + " nearby alert(s)"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> getAlert(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(alertQueryService.getAlert(id, userId), "Alert details"));
    }

    @PutMapping("/{id}/accept")
    public ResponseEntity<ApiResponse> acceptAlert(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @PathVariable Long id) {
        AlertResponse alert = AlertResponse.from(alertLifecycleService.acceptAlert(id, userId));
        return ResponseEntity.ok(ApiResponse.success(alert, "Alert accepted successfully"));
    }

    @PutMapping("/{id}/decline")
    public ResponseEntity<ApiResponse> declineAlert(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @PathVariable Long id) {
        alertLifecycleService.declineAlert(id, userId);
        return ResponseEntity.ok(ApiResponse.success("Alert declined"));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse> cancelAlert(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @PathVariable Long id) {
        AlertResponse alert = AlertResponse.from(alertLifecycleService.cancelAlert(id, userId));
        return ResponseEntity.ok(ApiResponse.success(alert, "Alert cancelled successfully"));
    }

    @PutMapping("/{id}/resolve")
    public ResponseEntity<ApiResponse> resolveAlert(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody(required = false) ResolveAlertRequest request) {
        AlertResponse alert = AlertResponse.from(alertLifecycleService.resolveAlert(id, userId, request));
        return ResponseEntity.ok(ApiResponse.success(alert, "Alert resolved successfully"));
    }

    @PutMapping("/{id}/feedback")
    public ResponseEntity<ApiResponse> submitFeedback(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody FeedbackRequest request) {
        AlertResponse alert = AlertResponse.from(alertLifecycleService.submitFeedback(id, userId, request));
        return ResponseEntity.ok(ApiResponse.success(alert, "Feedback submitted"));
    }

    @PutMapping("/{id}/location")
    public ResponseEntity<ApiResponse> updateLocation(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody LocationUpdateRequest request) {
        alertLifecycleService.updateLiveLocation(id, userId, request.getLatitude(), request.getLongitude());
        return ResponseEntity.ok(ApiResponse.success("Location updated"));
    }
}
