package com.permissionbroker.types.context;

import java.util.Map;

/**
 * The execution context (frame) on whose behalf permissions are requested.
 * Implemented by the embedding platform.
 */
public interface ExecutionContext {

    ContextId getId();

    /**
     * URL of the last committed navigation, reported to handlers as {@code requestingUrl}.
     */
    String getLastCommittedUrl();

    /**
     * Whether this context is nested inside another one. Top-level contexts return false.
     */
    boolean hasParent();

    /**
     * Whether the context is being torn down. Callbacks are never run against such a context.
     */
    boolean isBeingDestroyed();

    /**
     * Fallback used by the device check path when no device permission handler is registered.
     *
     * @param details device details built by the broker
     * @return whether the device may be used
     */
    boolean defaultDevicePermissionHandler(Map<String, Object> details);

    /**
     * Fallback used by the device grant path when no grant handler is registered.
     *
     * @param details device details built by the broker
     */
    void defaultGrantDevicePermissionHandler(Map<String, Object> details);
}
