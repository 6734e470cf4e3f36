package com.permissionbroker.types.permissions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Capability kinds a context can ask for.
 */
public enum PermissionType {
    MIDI_SYSEX("midiSysex"),
    NOTIFICATIONS("notifications"),
    GEOLOCATION("geolocation"),
    PROTECTED_MEDIA_IDENTIFIER("mediaKeySystem"),
    MIDI("midi"),
    DURABLE_STORAGE("persistent-storage"),
    AUDIO_CAPTURE("audioCapture"),
    VIDEO_CAPTURE("videoCapture"),
    BACKGROUND_SYNC("background-sync"),
    SENSORS("sensors"),
    CLIPBOARD_READ_WRITE("clipboard-read"),
    CLIPBOARD_SANITIZED_WRITE("clipboard-sanitized-write"),
    PAYMENT_HANDLER("payment-handler"),
    IDLE_DETECTION("idle-detection"),
    WAKE_LOCK_SCREEN("screen-wake-lock"),
    POINTER_LOCK("pointerLock"),
    FULLSCREEN("fullscreen"),
    OPEN_EXTERNAL("openExternal"),
    HID("hid"),
    SERIAL("serial"),
    USB("usb");

    private final String value;

    PermissionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PermissionType fromValue(String value) {
        for (PermissionType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown permission type: " + value);
    }
}
