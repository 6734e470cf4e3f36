package com.permissionbroker.types.permissions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a single permission decision.
 */
public enum PermissionStatus {
    GRANTED("granted"),
    DENIED("denied"),
    ASK("ask");

    private final String value;

    PermissionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isGranted() {
        return this == GRANTED;
    }

    /**
     * Maps a check result onto a status.
     */
    public static PermissionStatus fromGranted(boolean granted) {
        return granted ? GRANTED : DENIED;
    }

    @JsonCreator
    public static PermissionStatus fromValue(String value) {
        for (PermissionStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown permission status: " + value);
    }
}
