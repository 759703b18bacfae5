package com.lifelink.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Role mismatches on the {@code /donor}, {@code /hospital} and {@code /admin} trees end here.
 */
@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private static final Logger log = LoggerFactory.getLogger(RestAccessDeniedHandler.class);

    private final ProblemResponseWriter problemResponseWriter;

    public RestAccessDeniedHandler(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        log.info("Access denied path={} userId={}", request.getRequestURI(), currentUserIdOrNull());
        problemResponseWriter.write(request, response, HttpStatus.FORBIDDEN, "forbidden", "Access denied for this role");
    }

    private static Object currentUserIdOrNull() {
        return SecurityUtils.findCurrentPrincipal().map(JwtAuthenticationPrincipal::userId).orElse(null);
    }
}
