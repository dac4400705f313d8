package com.yerin.openshow.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.openshow.global.dto.ErrorResponse;
import com.yerin.openshow.global.exception.code.CommonErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards replay, queue inspection and metrics. A blank server token rejects every request.
 */
@Slf4j
@Component
public class AdminTokenInterceptor implements HandlerInterceptor {

    static final String HEADER = "X-Admin-Token";

    private final byte[] adminToken;
    private final ObjectMapper objectMapper;

    public AdminTokenInterceptor(@Value("${jobq.admin.token:}") String adminToken, ObjectMapper objectMapper) {
        this.adminToken = adminToken == null || adminToken.isBlank()
                ? null
                : adminToken.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        String token = request.getHeader(HEADER);
        if (adminToken != null && token != null
                && MessageDigest.isEqual(adminToken, token.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        log.warn("[Admin] rejected {} {} (tokenPresent={})",
                request.getMethod(), request.getRequestURI(), token != null);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(),
                ErrorResponse.of(CommonErrorCode.ADMIN_TOKEN_REJECTED, request));
        return false;
    }
}
