package com.safeher.sosdispatch.controller;

import com.safeher.sosdispatch.dto.ApiResponse;
import com.safeher.sosdispatch.dto.EmergencyContactRequest;
import com.safeher.sosdispatch.dto.EmergencyContactResponse;
import com.safeher.sosdispatch.service.EmergencyContactService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/contacts")
@RequiredArgsConstructor
@Slf4j
public class EmergencyContactController {

    private final EmergencyContactService emergencyContactService;

    @GetMapping
    public ResponseEntity<ApiResponse> listContacts(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId) {
        List<EmergencyContactResponse> contacts = emergencyContactService.findActiveContacts(userId).stream()
                .map(EmergencyContactResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(contacts, contacts.size() + " contact(s)"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse> addContact(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @Valid @RequestBody EmergencyContactRequest request) {
        EmergencyContactResponse contact = EmergencyContactResponse.from(
                emergencyContactService.addContact(userId, request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(contact, "Contact added"));
    }

    @PutMapping("/{id}/primary")
    public ResponseEntity<ApiResponse> setPrimary(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @PathVariable Long id) {
        EmergencyContactResponse contact = EmergencyContactResponse.from(
                emergencyContactService.setPrimary(userId, id));
        return ResponseEntity.ok(ApiResponse.success(contact, "Primary contact updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse> deleteContact(
            @SessionAttribute(AuthController.SESSION_USER_ID) Long userId,
            @PathVariable Long id) {
        emergencyContactService.deleteContact(userId, id);
        return ResponseEntity.ok(ApiResponse.success("Contact removed"));
    }
}
