package com.permissionbroker.exceptions;

/**
 * Thrown when a permission within a pending request is resolved a second time.
 */
public class SlotAlreadyResolvedException extends PermissionBrokerException {

    private final int requestId;
    private final int slotIndex;

    public SlotAlreadyResolvedException(int requestId, int slotIndex) {
        super("Permission " + slotIndex + " of request " + requestId + " is already resolved");
        this.requestId = requestId;
        this.slotIndex = slotIndex;
    }

    public int getRequestId() {
        return requestId;
    }

    public int getSlotIndex() {
        return slotIndex;
    }
}
