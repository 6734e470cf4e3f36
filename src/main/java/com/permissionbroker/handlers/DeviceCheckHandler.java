package com.permissionbroker.handlers;

import java.util.Map;

/**
 * Decides whether a context may use a specific device.
 */
@FunctionalInterface
public interface DeviceCheckHandler {

    boolean check(Map<String, Object> details);
}
