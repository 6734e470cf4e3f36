package com.permissionbroker.exceptions;

import com.permissionbroker.types.permissions.PermissionType;

/**
 * Raised when a registered handler (or a context's default device handler) throws.
 */
public class PermissionHandlerException extends PermissionBrokerException {

    private final PermissionType permission;

    public PermissionHandlerException(String handlerName, PermissionType permission, Throwable cause) {
        super(handlerName + " failed for permission " + permission.getValue(), cause);
        this.permission = permission;
    }

    public PermissionType getPermission() {
        return permission;
    }
}
