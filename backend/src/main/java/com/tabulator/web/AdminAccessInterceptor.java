package com.tabulator.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabulator.config.TabulatorProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards administrator routes (lock removal, roster changes, audit trail) with a shared token.
 */
public class AdminAccessInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdminAccessInterceptor.class);

    private final TabulatorProperties tabulatorProperties;
    private final ObjectMapper objectMapper;

    public AdminAccessInterceptor(TabulatorProperties tabulatorProperties, ObjectMapper objectMapper) {
        this.tabulatorProperties = tabulatorProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        TabulatorProperties.Admin admin = tabulatorProperties.getAdmin();
        String presented = request.getHeader(admin.getHeaderName());
        if (StringUtils.hasText(admin.getToken()) && tokensMatch(admin.getToken(), presented)) {
            return true;
        }

        log.warn("Rejected admin request without a valid token: {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(
                response.getOutputStream(),
                new ScoringExceptionHandler.ScoringErrorResponse("admin_required", "Administrator token required")
        );
        return false;
    }

    private static boolean tokensMatch(String expected, String presented) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.trim().getBytes(StandardCharsets.UTF_8)
        );
    }
}
