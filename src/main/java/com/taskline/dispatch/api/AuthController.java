package com.taskline.dispatch.api;

import com.taskline.core.security.AuthFilter;
import com.taskline.core.security.AuthProperties;
import com.taskline.core.security.JwtTokenService;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Login endpoints. A successful login both starts a session (for browsers)
 * and returns a bearer token (for API clients and stream consumers).
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final AuthProperties authProperties;
    private final JwtTokenService jwtTokenService;

    public AuthController(AuthProperties authProperties, JwtTokenService jwtTokenService) {
        this.authProperties = authProperties;
        this.jwtTokenService = jwtTokenService;
    }

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(
            @RequestBody LoginRequest request,
            HttpSession session) {

        if (!authProperties.isEnabled()) {
            session.setAttribute(AuthFilter.SESSION_USER_KEY, AuthProperties.ANONYMOUS_USER);
            return ResponseEntity.ok(loggedIn(AuthProperties.ANONYMOUS_USER));
        }

        if (authProperties.matches(request.username(), request.password())) {
            session.setAttribute(AuthFilter.SESSION_USER_KEY, request.username());
            log.info("User {} logged in", request.username());
            return ResponseEntity.ok(loggedIn(request.username()));
        }

        log.warn("Failed login for user {}", request.username());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of(
                        "authenticated", false,
                        "error", "Invalid username or password",
                        "code", "AUTH_REQUIRED"
                ));
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout(HttpSession session) {
        session.invalidate();
        return ResponseEntity.ok(Map.of("message", "Logged out"));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(
            @RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId) {

        if (!authProperties.isEnabled()) {
            return ResponseEntity.ok(Map.of(
                    "authenticated", true,
                    "username", AuthProperties.ANONYMOUS_USER,
                    "authEnabled", false
            ));
        }

        if (userId != null) {
            return ResponseEntity.ok(Map.of(
                    "authenticated", true,
                    "username", userId,
                    "authEnabled", true
            ));
        }

        return ResponseEntity.ok(Map.of(
                "authenticated", false,
                "authEnabled", true
        ));
    }

    private Map<String, Object> loggedIn(String username) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("authenticated", true);
        body.put("username", username);
        body.put("token", jwtTokenService.generateToken(username));
        body.put("expiresIn", jwtTokenService.getExpirationSeconds());
        return body;
    }

    public record LoginRequest(String username, String password) {}
}
