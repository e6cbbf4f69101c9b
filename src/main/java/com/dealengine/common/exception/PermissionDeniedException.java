package com.dealengine.common.exception;

/**
 * Thrown when a principal lacks the permission required for an operation.
 */
public class PermissionDeniedException extends DealEngineException {

    private final String principalId;
    private final String permission;

    public PermissionDeniedException(String principalId, String permission) {
        super(String.format("Principal %s lacks permission '%s'", principalId, permission));
        this.principalId = principalId;
        this.permission = permission;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getPermission() {
        return permission;
    }
}
