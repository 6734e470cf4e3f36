package com.permissionbroker.internal;

import com.permissionbroker.handlers.PermissionResponse;
import com.permissionbroker.types.permissions.PermissionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The answer channel for one slot of one pending request.
 */
public final class SlotResponse implements PermissionResponse {

    private static final Logger logger = LoggerFactory.getLogger(SlotResponse.class);

    /**
     * Receives the answers routed through slot responses.
     */
    @FunctionalInterface
    public interface Collector {
        void onPermissionResponse(int requestId, int slotIndex, PermissionStatus status);
    }

    private final Collector collector;
    private final int requestId;
    private final int slotIndex;
    private final AtomicBoolean responded = new AtomicBoolean(false);

    public SlotResponse(Collector collector, int requestId, int slotIndex) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.requestId = requestId;
        this.slotIndex = slotIndex;
    }

    @Override
    public void respond(PermissionStatus status) {
        Objects.requireNonNull(status, "status");
        if (!responded.compareAndSet(false, true)) {
            logger.warn("Ignoring repeated response {} for permission {} of request {}",
                    status.getValue(), slotIndex, requestId);
            return;
        }
        collector.onPermissionResponse(requestId, slotIndex, status);
    }

    boolean hasResponded() {
        return responded.get();
    }
}
