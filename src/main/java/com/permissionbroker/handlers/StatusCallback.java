package com.permissionbroker.handlers;

import com.permissionbroker.types.permissions.PermissionStatus;

/**
 * Completion callback for a single-permission request.
 */
@FunctionalInterface
public interface StatusCallback {

    void onStatus(PermissionStatus status);
}
