package com.permissionbroker.util;

import com.permissionbroker.types.context.ContextId;
import com.permissionbroker.types.context.ContextResolver;
import com.permissionbroker.types.context.ExecutionContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolver backed by a map of attached contexts.
 */
public class FakeContextResolver implements ContextResolver {

    private final Map<ContextId, ExecutionContext> contexts = new HashMap<>();

    public <T extends ExecutionContext> T attach(T context) {
        contexts.put(context.getId(), context);
        return context;
    }

    public void detach(ExecutionContext context) {
        contexts.remove(context.getId());
    }

    @Override
    public ExecutionContext resolve(ContextId id) {
        return contexts.get(id);
    }
}
