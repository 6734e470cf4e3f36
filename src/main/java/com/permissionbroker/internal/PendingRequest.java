package com.permissionbroker.internal;

import com.permissionbroker.exceptions.SlotAlreadyResolvedException;
import com.permissionbroker.handlers.StatusesCallback;
import com.permissionbroker.hooks.GrantHookRegistry;
import com.permissionbroker.types.context.ContextId;
import com.permissionbroker.types.context.ContextResolver;
import com.permissionbroker.types.context.ExecutionContext;
import com.permissionbroker.types.permissions.PermissionStatus;
import com.permissionbroker.types.permissions.PermissionType;

import javax.annotation.Nullable;
import java.lang.ref.WeakReference;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregates the per-permission answers of one batch request.
 * <p>
 * Every slot starts out {@link PermissionStatus#DENIED}. The request is complete once each slot
 * has been resolved exactly once; the completion callback runs at most once.
 */
public final class PendingRequest {

    private final int requestId;
    private final ContextId contextId;
    private final WeakReference<ExecutionContext> contextRef;
    private final List<PermissionType> permissions;
    private final GrantHookRegistry grantHooks;
    private final PermissionStatus[] results;
    private final boolean[] resolved;
    private int remaining;
    private StatusesCallback callback;

    public PendingRequest(
            int requestId,
            ExecutionContext context,
            List<PermissionType> permissions,
            GrantHookRegistry grantHooks,
            StatusesCallback callback
    ) {
        this.requestId = requestId;
        Objects.requireNonNull(context, "context");
        this.contextId = context.getId();
        this.contextRef = new WeakReference<>(context);
        this.permissions = List.copyOf(permissions);
        this.grantHooks = Objects.requireNonNull(grantHooks, "grantHooks");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.results = new PermissionStatus[this.permissions.size()];
        Arrays.fill(this.results, PermissionStatus.DENIED);
        this.resolved = new boolean[this.permissions.size()];
        this.remaining = this.permissions.size();
    }

    /**
     * Records the answer for one slot, running the grant hook of its permission type on
     * {@link PermissionStatus#GRANTED}.
     *
     * @throws SlotAlreadyResolvedException if the slot (or the whole request) is already resolved
     * @throws IndexOutOfBoundsException    if {@code slotIndex} is not a slot of this request
     */
    public void setPermissionStatus(int slotIndex, PermissionStatus status) {
        Objects.requireNonNull(status, "status");
        Objects.checkIndex(slotIndex, results.length);
        if (isComplete() || resolved[slotIndex]) {
            throw new SlotAlreadyResolvedException(requestId, slotIndex);
        }

        if (status.isGranted()) {
            grantHooks.onGranted(permissions.get(slotIndex), contextId.getProcessId());
        }

        results[slotIndex] = status;
        resolved[slotIndex] = true;
        --remaining;
    }

    public boolean isComplete() {
        return remaining == 0;
    }

    /**
     * Hands the current results to the completion callback. Only the first call has any effect.
     */
    public void runCallback() {
        StatusesCallback pending = callback;
        if (pending == null) {
            return;
        }
        callback = null;
        pending.onStatuses(Collections.unmodifiableList(Arrays.asList(results.clone())));
    }

    public int getRequestId() {
        return requestId;
    }

    public ContextId getContextId() {
        return contextId;
    }

    /**
     * Finds the requesting context, or {@code null} if it is gone.
     *
     * @param resolver looks the context up by id when present; otherwise the weak reference taken at
     *                 creation is used
     */
    @Nullable
    public ExecutionContext resolveContext(@Nullable ContextResolver resolver) {
        if (resolver != null) {
            return resolver.resolve(contextId);
        }
        return contextRef.get();
    }

    int getRemaining() {
        return remaining;
    }
}
