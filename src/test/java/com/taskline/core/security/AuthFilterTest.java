package com.taskline.core.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AuthFilterTest {

    private static final String SECRET = "taskline-test-secret-must-be-at-least-32-bytes-long";

    private final ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();

    private AuthProperties properties;
    private JwtTokenService tokens;
    private AuthFilter filter;

    @BeforeEach
    void setUp() {
        properties = new AuthProperties();
        tokens = new JwtTokenService(SECRET, 600);
        filter = new AuthFilter(properties, tokens, mapper,
                Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private static MockHttpServletRequest get(String path) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
        request.setRequestURI(path);
        return request;
    }

    @Test
    @DisplayName("valid bearer token sets the user attribute")
    void bearerToken() throws Exception {
        MockHttpServletRequest request = get("/api/v1/tasks");
        request.addHeader("Authorization", "Bearer " + tokens.generateToken("alice"));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertEquals("alice", request.getAttribute(AuthFilter.USER_ATTRIBUTE));
        assertNotNull(chain.getRequest());
        assertNull(MDC.get("userId"));
    }

    @Test
    @DisplayName("session user is used when there is no token")
    void sessionUser() throws Exception {
        MockHttpServletRequest request = get("/api/v1/tasks");
        request.getSession(true).setAttribute(AuthFilter.SESSION_USER_KEY, "bob");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertEquals("bob", request.getAttribute(AuthFilter.USER_ATTRIBUTE));
    }

    @Test
    @DisplayName("missing credentials on an API path give 401 with the error body")
    void unauthenticated() throws Exception {
        MockHttpServletRequest request = get("/api/v1/tasks");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(401, response.getStatus());
        assertNull(chain.getRequest());
        JsonNode body = mapper.readTree(response.getContentAsString());
        assertEquals("AUTH_REQUIRED", body.get("code").asText());
        assertEquals("Authentication required", body.get("error").asText());
        assertTrue(body.has("timestamp"));
    }

    @Test
    @DisplayName("an invalid token is treated as no credentials")
    void invalidToken() throws Exception {
        MockHttpServletRequest request = get("/api/v1/tasks/events");
        request.addHeader("Authorization", "Bearer garbage");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertEquals(401, response.getStatus());
    }

    @Test
    @DisplayName("public and non-API paths pass without credentials")
    void publicPaths() throws Exception {
        for (String path : new String[] {"/api/v1/auth/login", "/api/v1/health", "/index.html"}) {
            MockFilterChain chain = new MockFilterChain();
            MockHttpServletResponse response = new MockHttpServletResponse();

            filter.doFilter(get(path), response, chain);

            assertEquals(200, response.getStatus(), path);
            assertNotNull(chain.getRequest(), path);
        }
    }

    @Test
    @DisplayName("with auth disabled every caller is anonymous")
    void disabled() throws Exception {
        properties.setEnabled(false);
        MockHttpServletRequest request = get("/api/v1/tasks");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertEquals(AuthProperties.ANONYMOUS_USER, request.getAttribute(AuthFilter.USER_ATTRIBUTE));
    }

    @Test
    @DisplayName("configured credentials match exactly")
    void credentials() {
        assertTrue(properties.matches("admin", "taskline"));
        assertFalse(properties.matches("admin", "wrong"));
        assertFalse(properties.matches("nobody", "taskline"));
        assertFalse(properties.matches(null, null));
    }
}
