package com.jz.honeypot.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.honeypot.common.Result;
import com.jz.honeypot.config.AuthProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 校验 /api/ 下请求的 x-api-key。未配置 key 时全部放行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {

    private final AuthProperties props;
    private final ObjectMapper mapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) return true;
        if (HttpMethod.OPTIONS.matches(req.getMethod())) return true;
        return !req.getRequestURI().startsWith(props.getProtectedPath());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse resp, FilterChain chain)
            throws ServletException, IOException {
        String supplied = req.getHeader(props.getHeader());
        if (supplied == null || !matches(supplied, props.getApiKey())) {
            log.warn("Rejected request without valid api key, path={} remote={}", req.getRequestURI(), req.getRemoteAddr());
            resp.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            resp.setContentType(MediaType.APPLICATION_JSON_VALUE);
            resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
            resp.getWriter().write(mapper.writeValueAsString(Result.of(401, "Invalid or missing API key", null)));
            return;
        }
        chain.doFilter(req, resp);
    }

    // 定长比较
    private static boolean matches(String supplied, String expected) {
        return MessageDigest.isEqual(supplied.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
