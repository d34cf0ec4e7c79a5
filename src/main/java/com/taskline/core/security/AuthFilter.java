package com.taskline.core.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskline.core.error.AuthRequiredException;
import com.taskline.core.error.ErrorResponse;
import com.taskline.core.logging.MdcContext;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.Set;

/**
 * Resolves the calling user for every {@code /api/} request and stores it in
 * the {@link #USER_ATTRIBUTE} request attribute.
 * <p>
 * The user comes from an {@code Authorization: Bearer} token or, failing
 * that, from the login session. With authentication disabled every caller
 * is {@link AuthProperties#ANONYMOUS_USER}.
 */
@Component
@Order(1)
public class AuthFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    public static final String USER_ATTRIBUTE = "taskline.userId";
    public static final String SESSION_USER_KEY = "taskline_user";

    private static final String BEARER_PREFIX = "Bearer ";

    private static final Set<String> PUBLIC_PATHS = Set.of(
            "/api/v1/auth/login",
            "/api/v1/auth/status",
            "/api/v1/health",
            "/actuator/health",
            "/actuator/prometheus"
    );

    private final AuthProperties authProperties;
    private final JwtTokenService jwtTokenService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuthFilter(AuthProperties authProperties,
                      JwtTokenService jwtTokenService,
                      ObjectMapper objectMapper,
                      Clock clock) {
        this.authProperties = authProperties;
        this.jwtTokenService = jwtTokenService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String path = httpRequest.getRequestURI();

        if (!authProperties.isEnabled()) {
            proceedAs(AuthProperties.ANONYMOUS_USER, httpRequest, response, chain);
            return;
        }

        String user = resolveUser(httpRequest);
        if (user != null) {
            proceedAs(user, httpRequest, response, chain);
            return;
        }

        if (isPublicPath(path) || !path.startsWith("/api/")) {
            chain.doFilter(request, response);
            return;
        }

        log.debug("Rejecting unauthenticated {} {}", httpRequest.getMethod(), path);
        httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(httpResponse.getWriter(),
                ErrorResponse.of(new AuthRequiredException(), clock.instant()));
    }

    private String resolveUser(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            try {
                return jwtTokenService.validateToken(header.substring(BEARER_PREFIX.length())).getSubject();
            } catch (JwtException | IllegalArgumentException e) {
                log.debug("Ignoring invalid bearer token: {}", e.getMessage());
                return null;
            }
        }
        HttpSession session = request.getSession(false);
        return session != null ? (String) session.getAttribute(SESSION_USER_KEY) : null;
    }

    private void proceedAs(String user, HttpServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        request.setAttribute(USER_ATTRIBUTE, user);
        MdcContext.setUser(user);
        try {
            chain.doFilter(request, response);
        } finally {
            MdcContext.clear();
        }
    }

    private boolean isPublicPath(String path) {
        return PUBLIC_PATHS.contains(path);
    }
}
