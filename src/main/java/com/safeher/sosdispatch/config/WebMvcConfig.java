package com.safeher.sosdispatch.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the AuthInterceptor on every /api route.
 *
 * Excluded (always public):
 *   /auth/**  - login / logout / status
 *   /ws/**    - WebSocket handshake (SockJS)
 *   /error    - Spring error page
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private AuthInterceptor authInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns(
                        "/auth/**",
                        "/ws/**",
                        "/error"
                );
    }
}
