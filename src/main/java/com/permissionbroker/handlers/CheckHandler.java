package com.permissionbroker.handlers;

import com.permissionbroker.types.context.ExecutionContext;
import com.permissionbroker.types.permissions.PermissionType;

import javax.annotation.Nullable;
import java.net.URI;
import java.util.Map;

/**
 * Synchronous policy authority for permission checks.
 */
@FunctionalInterface
public interface CheckHandler {

    /**
     * @param context          the checking context, absent for origin-only checks
     * @param permission       the permission being checked
     * @param requestingOrigin origin asking for the permission
     * @param details          caller details plus the keys from {@code PermissionDetails}
     * @return whether the permission is granted
     */
    boolean check(
            @Nullable ExecutionContext context,
            PermissionType permission,
            URI requestingOrigin,
            Map<String, Object> details
    );
}
