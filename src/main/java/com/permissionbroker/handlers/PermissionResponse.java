package com.permissionbroker.handlers;

import com.permissionbroker.types.permissions.PermissionStatus;

/**
 * Answer channel handed to a {@link RequestHandler} for one permission of a request.
 * Only the first call is honoured.
 */
@FunctionalInterface
public interface PermissionResponse {

    void respond(PermissionStatus status);
}
