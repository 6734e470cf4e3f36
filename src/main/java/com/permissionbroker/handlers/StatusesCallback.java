package com.permissionbroker.handlers;

import com.permissionbroker.types.permissions.PermissionStatus;

import java.util.List;

/**
 * Completion callback for a batch request. Statuses are in request order.
 */
@FunctionalInterface
public interface StatusesCallback {

    void onStatuses(List<PermissionStatus> statuses);
}
