package com.safeher.sosdispatch.controller;

import com.safeher.sosdispatch.dto.ApiResponse;
import com.safeher.sosdispatch.dto.LocationUpdateRequest;
import com.safeher.sosdispatch.dto.NearbyVolunteerResponse;
import com.safeher.sosdispatch.dto.ResponseHistoryItem;
import com.safeher.sosdispatch.dto.VolunteerProfileResponse;
import com.safeher.sosdispatch.entity.Volunteer;
import com.safeher.sosdispatch.entity.VolunteerBadge;
import com.safeher.sosdispatch.service.AlertQueryService;
import com.safeher.sosdispatch.service.BadgeRule;
import com.safeher.sosdispatch.service.VolunteerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Volunteer endpoints: duty toggle, location reports, profile, badges, response history
 * and the nearby-volunteers view.
 */
@RestController
@RequestMapping("/api/volunteers")
@RequiredArgsConstructor
@Slf4j
public class VolunteerController {

    private final VolunteerService volunteerService;
    private final AlertQueryService alertQueryService;

    @PutMapping("/duty")
    public ResponseEntity<ApiResponse> toggleDuty(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId) {
        Volunteer volunteer = volunteerService.toggleDuty(userId);
        return ResponseEntity.ok(ApiResponse.success(
                Map.of("onDuty", volunteer.isOnDuty()),
                volunteer.isOnDuty() ? "You are now on duty" : "You are now off duty"));
    }

    @PutMapping("/location")
    public ResponseEntity<ApiResponse> updateLocation(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @Valid @RequestBody LocationUpdateRequest request) {
        volunteerService.updateLocation(userId, request.getLatitude(), request.getLongitude());
        return ResponseEntity.ok(ApiResponse.success("Location updated"));
    }

    @GetMapping("/profile")
    public ResponseEntity<ApiResponse> getProfile(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(
                VolunteerProfileResponse.from(volunteerService.getProfile(userId)), "Volunteer profile"));
    }

    /**
     * GET /api/volunteers/history?page=1&limit=10 - alerts this volunteer was notified about.
     */
    @GetMapping("/history")
    public ResponseEntity<ApiResponse> getResponseHistory(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit) {
        Page<ResponseHistoryItem> history = alertQueryService.getResponseHistory(userId, page, limit);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("items", history.getContent());
        data.put("count", history.getNumberOfElements());
        data.put("total", history.getTotalElements());
        data.put("pages", history.getTotalPages());
        data.put("currentPage", page);
        return ResponseEntity.ok(ApiResponse.success(data, "Response history"));
    }

    /**
     * GET /api/volunteers/nearby?latitude=..&longitude=..&radius=5000 - on-duty volunteers
     * around a point, nearest first. Radius is in meters.
     */
    @GetMapping("/nearby")
    public ResponseEntity<ApiResponse> getNearbyVolunteers(
            @RequestParam Double latitude,
            @RequestParam Double longitude,
            @RequestParam(required = false) Double radius) {
        List<NearbyVolunteerResponse> volunteers = volunteerService.findNearbyVolunteers(latitude, longitude, radius);
        return ResponseEntity.ok(ApiResponse.success(volunteers, volunteers.size() + " volunteer(s) nearby"));
    }

    /**
     * GET /api/volunteers/badges - every badge, split into earned and locked with progress (0–100).
     */
    @GetMapping("/badges")
    public ResponseEntity<ApiResponse> getBadges(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId) {
        Volunteer volunteer = volunteerService.getProfile(userId);

        List<Map<String, Object>> earned = new ArrayList<>();
        List<Map<String, Object>> locked = new ArrayList<>();
        for (BadgeRule rule : BadgeRule.values()) {
            Optional<VolunteerBadge> held = volunteer.getBadges().stream()
                    .filter(b -> b.getName().equals(rule.getBadgeName()))
                    .findFirst();

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", rule.getBadgeName());
            item.put("requirement", rule.getRequirement());
            item.put("progress", rule.progress(volunteer));
            held.ifPresent(b -> item.put("earnedAt", b.getEarnedAt()));
            (held.isPresent() ? earned : locked).add(item);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("earned", earned);
        data.put("locked", locked);
        return ResponseEntity.ok(ApiResponse.success(data, "Volunteer badges"));
    }
}
