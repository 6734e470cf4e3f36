package com.permissionbroker.handlers;

import java.util.Map;

/**
 * Notified when a context has been granted a specific device.
 */
@FunctionalInterface
public interface DeviceGrantHandler {

    void grant(Map<String, Object> details);
}
