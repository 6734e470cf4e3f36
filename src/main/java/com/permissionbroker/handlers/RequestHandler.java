package com.permissionbroker.handlers;

import com.permissionbroker.types.context.ExecutionContext;
import com.permissionbroker.types.permissions.PermissionType;

import java.util.Map;

/**
 * Policy authority for permission requests.
 * <p>
 * Invoked once per requested permission. The handler may answer through {@code response}
 * immediately, later, or never.
 *
 * <pre>{@code
 * broker.setPermissionRequestHandler((context, permission, response, details) -> {
 *     if (permission == PermissionType.GEOLOCATION) {
 *         response.respond(PermissionStatus.DENIED);
 *     } else {
 *         prompts.ask(context, permission).thenAccept(response::respond);
 *     }
 * });
 * }</pre>
 */
@FunctionalInterface
public interface RequestHandler {

    /**
     * @param context    the requesting context
     * @param permission the permission being asked for
     * @param response   answer channel for this permission
     * @param details    caller details plus {@code requestingUrl} and {@code isMainFrame}
     */
    void onRequest(
            ExecutionContext context,
            PermissionType permission,
            PermissionResponse response,
            Map<String, Object> details
    );
}
