package com.dealengine.security;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of permissions checked by the deal engine.
 */
public enum Permission {
    READ_PROMOTIONS("promotions:read"),
    WRITE_PROMOTIONS("promotions:write"),
    APPROVE_PROMOTIONS("promotions:approve"),

    READ_EVIDENCE("evidence:read"),
    WRITE_EVIDENCE("evidence:write"),
    DELETE_EVIDENCE("evidence:delete"),

    VALIDATE_PROMOTION("validation:execute"),
    REVIEW_VALIDATION("validation:review"),
    OVERRIDE_VALIDATION("validation:override"),

    MANAGE_USERS("users:manage"),
    VIEW_LOGS("logs:view"),
    MANAGE_SYSTEM("system:manage"),

    VIEW_ADMIN("admin:view"),
    MANAGE_ADMIN("admin:manage");

    private final String code;

    Permission(String code) {
        this.code = code;
    }

    /**
     * Wire form, e.g. {@code evidence:read}.
     */
    public String getCode() {
        return code;
    }

    public static Optional<Permission> fromCode(String code) {
        return Arrays.stream(values())
            .filter(permission -> permission.code.equals(code) || permission.name().equals(code))
            .findFirst();
    }
}
