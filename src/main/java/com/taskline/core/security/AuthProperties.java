package com.taskline.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "taskline.auth")
public class AuthProperties {

    /** User id used for every request when authentication is disabled. */
    public static final String ANONYMOUS_USER = "anonymous";

    private boolean enabled = true;

    /** Login credentials, user id to password. */
    private Map<String, String> users = new LinkedHashMap<>(Map.of("admin", "taskline"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, String> getUsers() {
        return users;
    }

    public void setUsers(Map<String, String> users) {
        this.users = users;
    }

    public boolean matches(String username, String password) {
        if (username == null || password == null) {
            return false;
        }
        return password.equals(users.get(username));
    }
}
