package com.permissionbroker.exceptions;

/**
 * Base exception for permission broker errors.
 */
public class PermissionBrokerException extends RuntimeException {

    public PermissionBrokerException(String message) {
        super(message);
    }

    public PermissionBrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
