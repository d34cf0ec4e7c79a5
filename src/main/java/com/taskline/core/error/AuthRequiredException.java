package com.taskline.core.error;

public class AuthRequiredException extends TasklineException {

    public AuthRequiredException() {
        super(ErrorCode.AUTH_REQUIRED, "Authentication required");
    }
}
