package com.permissionbroker.types.options;

import com.permissionbroker.handlers.CheckHandler;
import com.permissionbroker.handlers.DeviceCheckHandler;
import com.permissionbroker.handlers.DeviceGrantHandler;
import com.permissionbroker.handlers.RequestHandler;
import com.permissionbroker.hooks.GrantHook;
import com.permissionbroker.hooks.GrantHookRegistry;
import com.permissionbroker.types.context.ContextResolver;
import com.permissionbroker.types.permissions.PermissionType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * Configuration for a {@code PermissionBroker}.
 * Use {@link #builder()} to create instances.
 *
 * <pre>{@code
 * PermissionBrokerOptions options = PermissionBrokerOptions.builder()
 *     .contextResolver(frames::fromId)
 *     .grantHook(PermissionType.MIDI_SYSEX, securityPolicy::grantSendMidiSysExMessage)
 *     .grantHook(PermissionType.GEOLOCATION, ownerId -> geolocation.userDidOptIntoLocationServices())
 *     .build();
 * }</pre>
 */
@Getter
@Builder(toBuilder = true)
public class PermissionBrokerOptions {

    /**
     * Resolves the contexts of pending requests when they are flushed. Optional; without it the
     * requesting context is reached through a weak reference.
     */
    private final ContextResolver contextResolver;

    @Singular("grantHook")
    private final Map<PermissionType, GrantHook> grantHooks;

    private final RequestHandler requestHandler;
    private final CheckHandler checkHandler;
    private final DeviceCheckHandler devicePermissionHandler;
    private final DeviceGrantHandler grantDevicePermissionHandler;

    public GrantHookRegistry grantHookRegistry() {
        return GrantHookRegistry.of(grantHooks);
    }
}
