package com.permissionbroker.types.context;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Globally unique identifier of an execution context: the owning process plus the frame within it.
 */
@Data
@AllArgsConstructor
public final class ContextId {
    private final int processId;
    private final int frameId;
}
