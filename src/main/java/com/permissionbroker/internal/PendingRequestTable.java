package com.permissionbroker.internal;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Id-keyed owner of the live {@link PendingRequest}s.
 * <p>
 * Ids are positive and issued in increasing order; after wrap-around, ids still in use are skipped,
 * so an id never refers to two live requests.
 */
public final class PendingRequestTable {

    private final Map<Integer, PendingRequest> requests = new ConcurrentHashMap<>();
    private final AtomicInteger nextRequestId;

    public PendingRequestTable() {
        this(new AtomicInteger(1));
    }

    PendingRequestTable(AtomicInteger nextRequestId) {
        this.nextRequestId = nextRequestId;
    }

    /**
     * Creates a request under a fresh id and stores it.
     *
     * @param factory builds the request for the issued id
     * @return the stored request
     */
    public PendingRequest add(IntFunction<PendingRequest> factory) {
        while (true) {
            int id = issueId();
            if (requests.containsKey(id)) {
                continue;
            }
            PendingRequest request = factory.apply(id);
            if (requests.putIfAbsent(id, request) == null) {
                return request;
            }
        }
    }

    @Nullable
    public PendingRequest lookup(int requestId) {
        return requests.get(requestId);
    }

    @Nullable
    public PendingRequest remove(int requestId) {
        return requests.remove(requestId);
    }

    /**
     * Removes every live request and returns them in id order.
     */
    public List<PendingRequest> drain() {
        List<PendingRequest> drained = new ArrayList<>(requests.size());
        for (Integer id : new ArrayList<>(requests.keySet())) {
            PendingRequest request = requests.remove(id);
            if (request != null) {
                drained.add(request);
            }
        }
        drained.sort((a, b) -> Integer.compare(a.getRequestId(), b.getRequestId()));
        return drained;
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }

    public int size() {
        return requests.size();
    }

    private int issueId() {
        return nextRequestId.getAndUpdate(id -> id == Integer.MAX_VALUE ? 1 : id + 1);
    }
}
