package com.permissionbroker.hooks;

import com.permissionbroker.types.permissions.PermissionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable table of grant hooks keyed by permission type.
 */
public final class GrantHookRegistry {

    private static final Logger logger = LoggerFactory.getLogger(GrantHookRegistry.class);
    private static final GrantHookRegistry EMPTY = new GrantHookRegistry(Collections.emptyMap());

    private final Map<PermissionType, GrantHook> hooks;

    private GrantHookRegistry(Map<PermissionType, GrantHook> hooks) {
        this.hooks = hooks;
    }

    public static GrantHookRegistry of(Map<PermissionType, GrantHook> hooks) {
        Objects.requireNonNull(hooks, "hooks");
        if (hooks.isEmpty()) {
            return EMPTY;
        }
        return new GrantHookRegistry(Collections.unmodifiableMap(new EnumMap<>(hooks)));
    }

    boolean hasHook(PermissionType permission) {
        return hooks.containsKey(permission);
    }

    /**
     * Runs the hook registered for {@code permission}, if any. A failing hook is logged; the grant
     * itself still stands.
     */
    public void onGranted(PermissionType permission, int ownerId) {
        GrantHook hook = hooks.get(permission);
        if (hook == null) {
            return;
        }
        logger.debug("Running grant hook for {} (owner {})", permission.getValue(), ownerId);
        try {
            hook.onGranted(ownerId);
        } catch (RuntimeException e) {
            logger.warn("Grant hook for {} failed (owner {})", permission.getValue(), ownerId, e);
        }
    }
}
