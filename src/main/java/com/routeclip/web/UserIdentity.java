package com.routeclip.web;

import com.routeclip.common.MissingUserIdentityException;

import java.util.Optional;

/**
 * The numeric id of an already authenticated user, as forwarded by the upstream gateway.
 */
public final class UserIdentity {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ID_PARAM = "userId";

    private UserIdentity() {
    }

    public static Optional<Long> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            long id = Long.parseLong(raw.trim());
            return id > 0 ? Optional.of(id) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Long require(String raw) {
        return parse(raw).orElseThrow(() -> new MissingUserIdentityException("Missing or invalid " + USER_ID_HEADER));
    }
}
