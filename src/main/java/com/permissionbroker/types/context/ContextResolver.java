package com.permissionbroker.types.context;

import javax.annotation.Nullable;

/**
 * Resolves a {@link ContextId} back to its live context.
 */
@FunctionalInterface
public interface ContextResolver {

    /**
     * @param id the context identifier captured when a request was issued
     * @return the live context, or {@code null} if it has gone away
     */
    @Nullable
    ExecutionContext resolve(ContextId id);
}
