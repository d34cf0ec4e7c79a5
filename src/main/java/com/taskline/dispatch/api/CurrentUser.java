package com.taskline.dispatch.api;

import com.taskline.core.error.AuthRequiredException;

/**
 * Access to the user id the auth filter attached to the request.
 */
final class CurrentUser {

    private CurrentUser() {}

    static String require(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new AuthRequiredException();
        }
        return userId;
    }
}
