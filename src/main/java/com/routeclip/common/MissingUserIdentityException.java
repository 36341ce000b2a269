package com.routeclip.common;

public class MissingUserIdentityException extends BusinessException {

    public MissingUserIdentityException(String message) {
        super("UNAUTHORIZED", message);
    }
}
