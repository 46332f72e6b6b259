package com.safeher.sosdispatch.controller;

import com.safeher.sosdispatch.entity.AppUser;
import com.safeher.sosdispatch.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpSession;
import java.util.LinkedHashMap;
import java.util.Map;


//  AuthController: Simulated Authentication for Demonstration Purposes

//  THIS IS A SIMULATED AUTHENTICATION MECHANISM FOR DEMONSTRATION PURPOSES ONLY.

//       A user "logs in" by email alone; the matching account id is stored in the session
//       and every /api controller reads it back as the caller identity.
//       Token issuance belongs to the identity service in a real deployment.

//  Endpoints:
//    POST /auth/login   - looks up the account by email, stores its id in the session
//    POST /auth/logout  - invalidates the session
//    GET  /auth/status  - returns current authentication state


@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    public static final String SESSION_USER_ID = "userId";

    private final AppUserRepository appUserRepository;

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(
            @RequestBody Map<String, String> body,
            HttpSession session) {

        String email = body.getOrDefault("email", "").trim();
        log.info("Auth: login attempt for email='{}'", email);

        AppUser user = appUserRepository.findByEmailIgnoreCase(email).orElse(null);
        if (user == null) {
            log.warn("Auth: login FAILED for email='{}'", email);
            Map<String, Object> resp = new LinkedHashMap<>();
            resp.put("success", false);
            resp.put("message", "Invalid credentials");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(resp);
        }

        session.setAttribute(SESSION_USER_ID, user.getId());
        session.setMaxInactiveInterval(3600); // 1 hour simulated session
        log.info("Auth: login SUCCESS for user #{} ({}) — session id={}", user.getId(), user.getRole(), session.getId());

        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("message", "Login successful");
        resp.put("userId", user.getId());
        resp.put("name", user.getName());
        resp.put("role", user.getRole());
        return ResponseEntity.ok(resp);
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout(HttpSession session) {
        Object userId = session.getAttribute(SESSION_USER_ID);
        session.invalidate();
        log.info("Auth: user #{} logged out — session cleared", userId != null ? userId : "unknown");

        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("message", "Logged out");
        return ResponseEntity.ok(resp);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(HttpSession session) {
        Object userId = session.getAttribute(SESSION_USER_ID);

        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("authenticated", userId != null);
        resp.put("userId", userId);
        return ResponseEntity.ok(resp);
    }
}
