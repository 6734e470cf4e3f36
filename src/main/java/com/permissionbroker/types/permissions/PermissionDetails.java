package com.permissionbroker.types.permissions;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * Keys the broker adds to the details map handed to handlers, plus copy helpers.
 * <p>
 * Caller-supplied keys are always preserved; the broker only ever adds the keys below.
 */
public final class PermissionDetails {

    public static final String REQUESTING_URL = "requestingUrl";
    public static final String IS_MAIN_FRAME = "isMainFrame";
    public static final String MEDIA_TYPE = "mediaType";
    public static final String EMBEDDING_ORIGIN = "embeddingOrigin";

    public static final String DEVICE_TYPE = "deviceType";
    public static final String ORIGIN = "origin";
    public static final String DEVICE = "device";
    public static final String CONTEXT = "context";

    public static final String MEDIA_TYPE_AUDIO = "audio";
    public static final String MEDIA_TYPE_VIDEO = "video";

    private PermissionDetails() {
    }

    /**
     * Returns a mutable copy of the given details, or an empty map for {@code null}.
     */
    public static Map<String, Object> copyOf(@Nullable Map<String, Object> details) {
        return details == null ? new HashMap<>() : new HashMap<>(details);
    }

    /**
     * Media hint for capture kinds, {@code null} for everything else.
     */
    @Nullable
    public static String mediaTypeOf(PermissionType type) {
        switch (type) {
            case AUDIO_CAPTURE:
                return MEDIA_TYPE_AUDIO;
            case VIDEO_CAPTURE:
                return MEDIA_TYPE_VIDEO;
            default:
                return null;
        }
    }
}
