package com.safeher.sosdispatch.config;

import com.safeher.sosdispatch.controller.AuthController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;

/**
 * AuthInterceptor: Simulated Session-Based Authentication Guard
 *
 * ⚠️  THIS IS A SIMULATED AUTHENTICATION MECHANISM FOR DEMONSTRATION PURPOSES ONLY.
 *      It checks that AuthController stored a user id in the HTTP session.
 *      A real deployment would validate a signed token issued by the identity service.
 *
 * Behaviour:
 *  - session carries a user id → request proceeds; controllers read it via @SessionAttribute
 *  - otherwise                 → HTTP 401 with a JSON ApiResponse body
 */
@Component
@Slf4j
public class AuthInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request,
                             HttpServletResponse response,
                             Object handler) throws Exception {

        HttpSession session = request.getSession(false); // false = don't create new session
        boolean authenticated = session != null
                && session.getAttribute(AuthController.SESSION_USER_ID) != null;

        if (authenticated) {
            log.debug("Auth: access granted — {} {}", request.getMethod(), request.getRequestURI());
            return true;
        }

        log.warn("Auth: UNAUTHORIZED access attempt — {} {} (no valid session)",
                request.getMethod(), request.getRequestURI());

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write(
            "{\"success\":false,\"message\":\"Unauthorized — please log in via POST /auth/login\"}"
        );
        return false;
    }
}
