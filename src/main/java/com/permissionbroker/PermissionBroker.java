package com.permissionbroker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.permissionbroker.exceptions.PermissionHandlerException;
import com.permissionbroker.handlers.CheckHandler;
import com.permissionbroker.handlers.DeviceCheckHandler;
import com.permissionbroker.handlers.DeviceGrantHandler;
import com.permissionbroker.handlers.RequestHandler;
import com.permissionbroker.handlers.StatusCallback;
import com.permissionbroker.handlers.StatusesCallback;
import com.permissionbroker.hooks.GrantHookRegistry;
import com.permissionbroker.internal.PendingRequest;
import com.permissionbroker.internal.PendingRequestTable;
import com.permissionbroker.internal.SlotResponse;
import com.permissionbroker.types.context.ContextResolver;
import com.permissionbroker.types.context.ExecutionContext;
import com.permissionbroker.types.context.Origin;
import com.permissionbroker.types.options.PermissionBrokerOptions;
import com.permissionbroker.types.permissions.PermissionDetails;
import com.permissionbroker.types.permissions.PermissionStatus;
import com.permissionbroker.types.permissions.PermissionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Routes permission requests and checks to the registered policy handlers.
 * <p>
 * A batch request is split into one handler call per permission; the answers are collected and the
 * caller's callback runs once every permission is answered. When no handler is registered the broker
 * fails open: requests are granted and checks pass.
 * <p>
 * Example:
 * <pre>{@code
 * PermissionBroker broker = new PermissionBroker(PermissionBrokerOptions.builder()
 *     .contextResolver(frames::fromId)
 *     .build());
 *
 * broker.setPermissionRequestHandler((context, permission, response, details) ->
 *     response.respond(permission == PermissionType.NOTIFICATIONS
 *         ? PermissionStatus.DENIED
 *         : PermissionStatus.GRANTED));
 *
 * broker.requestPermissions(
 *     List.of(PermissionType.AUDIO_CAPTURE, PermissionType.VIDEO_CAPTURE),
 *     frame, URI.create("https://example.com"), true,
 *     statuses -> log.info("Media permissions: {}", statuses));
 * }</pre>
 * <p>
 * Instances are meant to be driven from a single thread; handlers may answer from any call stack.
 */
public final class PermissionBroker {

    /**
     * Returned by {@link #subscribePermissionStatusChange}; status changes are never reported.
     */
    public static final long INVALID_SUBSCRIPTION_ID = -1L;

    private static final Logger logger = LoggerFactory.getLogger(PermissionBroker.class);

    private final PendingRequestTable pendingRequests = new PendingRequestTable();
    @Nullable
    private final ContextResolver contextResolver;
    private final GrantHookRegistry grantHooks;
    private final ObjectMapper mapper;

    private volatile RequestHandler requestHandler;
    private volatile CheckHandler checkHandler;
    private volatile DeviceCheckHandler devicePermissionHandler;
    private volatile DeviceGrantHandler grantDevicePermissionHandler;

    public PermissionBroker(PermissionBrokerOptions options) {
        Objects.requireNonNull(options, "options");
        this.contextResolver = options.getContextResolver();
        this.grantHooks = options.grantHookRegistry();
        this.mapper = new ObjectMapper();
        this.requestHandler = options.getRequestHandler();
        this.checkHandler = options.getCheckHandler();
        this.devicePermissionHandler = options.getDevicePermissionHandler();
        this.grantDevicePermissionHandler = options.getGrantDevicePermissionHandler();
    }

    /**
     * Creates a broker with no hooks and no handlers. Pending requests find their contexts through
     * the weak references they hold.
     */
    public static PermissionBroker create() {
        return new PermissionBroker(PermissionBrokerOptions.builder().build());
    }

    // ---------------------------------------------------------------------
    // Handler registration
    // ---------------------------------------------------------------------

    /**
     * Replaces the request handler.
     * <p>
     * Requests already dispatched keep answering through the handler they were dispatched to.
     * Passing {@code null} while requests are pending completes each of them right away with the
     * answers received so far (unanswered permissions stay {@link PermissionStatus#DENIED}); callbacks
     * of requests whose context is gone or being destroyed are dropped.
     */
    public void setPermissionRequestHandler(@Nullable RequestHandler handler) {
        this.requestHandler = handler;
        if (handler == null && !pendingRequests.isEmpty()) {
            flushPendingRequests();
        }
    }

    public void setPermissionCheckHandler(@Nullable CheckHandler handler) {
        this.checkHandler = handler;
    }

    public void setDevicePermissionHandler(@Nullable DeviceCheckHandler handler) {
        this.devicePermissionHandler = handler;
    }

    public void setGrantDevicePermissionHandler(@Nullable DeviceGrantHandler handler) {
        this.grantDevicePermissionHandler = handler;
    }

    private void flushPendingRequests() {
        List<PendingRequest> flushed = pendingRequests.drain();
        logger.info("Request handler cleared, flushing {} pending permission request(s)", flushed.size());
        for (PendingRequest request : flushed) {
            ExecutionContext context = request.resolveContext(contextResolver);
            if (context == null || context.isBeingDestroyed()) {
                logger.debug("Dropping callback of request {}: context {} is gone",
                        request.getRequestId(), request.getContextId());
                continue;
            }
            request.runCallback();
        }
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    public void requestPermission(
            PermissionType permission,
            ExecutionContext context,
            URI requestingOrigin,
            boolean userGesture,
            StatusCallback callback
    ) {
        requestPermissionWithDetails(permission, context, requestingOrigin, userGesture, null, callback);
    }

    public void requestPermissionWithDetails(
            PermissionType permission,
            ExecutionContext context,
            URI requestingOrigin,
            boolean userGesture,
            @Nullable Map<String, Object> details,
            StatusCallback callback
    ) {
        Objects.requireNonNull(permission, "permission");
        Objects.requireNonNull(callback, "callback");
        requestPermissionsWithDetails(
                Collections.singletonList(permission),
                context,
                requestingOrigin,
                userGesture,
                details,
                statuses -> callback.onStatus(statuses.get(0))
        );
    }

    public void requestPermissions(
            List<PermissionType> permissions,
            ExecutionContext context,
            URI requestingOrigin,
            boolean userGesture,
            StatusesCallback callback
    ) {
        requestPermissionsWithDetails(permissions, context, requestingOrigin, userGesture, null, callback);
    }

    /**
     * Asks the request handler about each of {@code permissions} and reports the answers, in request
     * order, through {@code callback}.
     *
     * @param permissions      permissions to request; an empty list is answered immediately
     * @param context          the requesting context
     * @param requestingOrigin origin asking for the permissions
     * @param userGesture      whether the request was triggered by a user gesture
     * @param details          extra details for the handler, never modified
     * @param callback         receives one status per permission
     */
    public void requestPermissionsWithDetails(
            List<PermissionType> permissions,
            ExecutionContext context,
            URI requestingOrigin,
            boolean userGesture,
            @Nullable Map<String, Object> details,
            StatusesCallback callback
    ) {
        Objects.requireNonNull(permissions, "permissions");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(requestingOrigin, "requestingOrigin");
        Objects.requireNonNull(callback, "callback");

        if (permissions.isEmpty()) {
            callback.onStatuses(Collections.emptyList());
            return;
        }

        RequestHandler handler = requestHandler;
        if (handler == null) {
            logger.debug("No request handler registered, granting {} for {}", permissions, requestingOrigin);
            List<PermissionStatus> statuses = new ArrayList<>(permissions.size());
            for (PermissionType permission : permissions) {
                grantHooks.onGranted(permission, context.getId().getProcessId());
                statuses.add(PermissionStatus.GRANTED);
            }
            callback.onStatuses(Collections.unmodifiableList(statuses));
            return;
        }

        PendingRequest request = pendingRequests.add(id ->
                new PendingRequest(id, context, permissions, grantHooks, callback));
        int requestId = request.getRequestId();
        logger.debug("Dispatching request {} for {} from {} (user gesture: {})",
                requestId, permissions, requestingOrigin, userGesture);

        for (int i = 0; i < permissions.size(); i++) {
            PermissionType permission = permissions.get(i);
            SlotResponse response = new SlotResponse(this::onPermissionResponse, requestId, i);
            Map<String, Object> handlerDetails = PermissionDetails.copyOf(details);
            handlerDetails.put(PermissionDetails.REQUESTING_URL, context.getLastCommittedUrl());
            handlerDetails.put(PermissionDetails.IS_MAIN_FRAME, !context.hasParent());
            try {
                handler.onRequest(context, permission, response, handlerDetails);
            } catch (RuntimeException e) {
                logger.warn("Request handler failed for {} of request {}, denying it",
                        permission.getValue(), requestId, e);
                response.respond(PermissionStatus.DENIED);
            }
        }
    }

    /**
     * Records the answer for one permission of a pending request. Answers for requests that have
     * already completed or been flushed are ignored.
     */
    public void onPermissionResponse(int requestId, int slotIndex, PermissionStatus status) {
        PendingRequest request = pendingRequests.lookup(requestId);
        if (request == null) {
            logger.debug("Ignoring response for unknown permission request {}", requestId);
            return;
        }

        request.setPermissionStatus(slotIndex, status);
        if (request.isComplete() && pendingRequests.remove(requestId) == request) {
            logger.debug("Permission request {} complete", requestId);
            request.runCallback();
        }
    }

    /**
     * Number of requests still waiting for answers.
     */
    public int getPendingRequestCount() {
        return pendingRequests.size();
    }

    // ---------------------------------------------------------------------
    // Checks
    // ---------------------------------------------------------------------

    /**
     * Synchronously checks a permission with the check handler; passes when none is registered.
     *
     * @param context          the checking context, if any
     * @param requestingOrigin origin asking for the permission
     * @param details          extra details for the handler, never modified
     */
    public boolean checkPermissionWithDetails(
            PermissionType permission,
            @Nullable ExecutionContext context,
            URI requestingOrigin,
            @Nullable Map<String, Object> details
    ) {
        Objects.requireNonNull(permission, "permission");
        Objects.requireNonNull(requestingOrigin, "requestingOrigin");

        CheckHandler handler = checkHandler;
        if (handler == null) {
            return true;
        }

        Map<String, Object> handlerDetails = PermissionDetails.copyOf(details);
        if (context != null) {
            handlerDetails.put(PermissionDetails.REQUESTING_URL, context.getLastCommittedUrl());
        }
        handlerDetails.put(PermissionDetails.IS_MAIN_FRAME, context != null && !context.hasParent());
        String mediaType = PermissionDetails.mediaTypeOf(permission);
        if (mediaType != null) {
            handlerDetails.put(PermissionDetails.MEDIA_TYPE, mediaType);
        }

        try {
            return handler.check(context, permission, requestingOrigin, handlerDetails);
        } catch (RuntimeException e) {
            throw new PermissionHandlerException("Permission check handler", permission, e);
        }
    }

    public PermissionStatus getPermissionStatus(
            PermissionType permission,
            URI requestingOrigin,
            URI embeddingOrigin
    ) {
        Objects.requireNonNull(embeddingOrigin, "embeddingOrigin");
        Map<String, Object> details = new HashMap<>();
        details.put(PermissionDetails.EMBEDDING_ORIGIN, embeddingOrigin.toString());
        return PermissionStatus.fromGranted(
                checkPermissionWithDetails(permission, null, requestingOrigin, details));
    }

    public PermissionStatus getPermissionStatusForFrame(
            PermissionType permission,
            ExecutionContext context,
            URI requestingOrigin
    ) {
        return PermissionStatus.fromGranted(
                checkPermissionWithDetails(permission, context, requestingOrigin, new HashMap<>()));
    }

    // ---------------------------------------------------------------------
    // Devices
    // ---------------------------------------------------------------------

    /**
     * Asks whether {@code context} may use {@code device}. Falls back to the context's default device
     * handler when no device permission handler is registered.
     *
     * @param device JSON descriptor of the device, copied into the details
     */
    public boolean checkDevicePermission(
            PermissionType permission,
            ExecutionContext context,
            Origin origin,
            JsonNode device
    ) {
        Map<String, Object> details = buildDeviceDetails(permission, context, origin, device);
        DeviceCheckHandler handler = devicePermissionHandler;
        try {
            if (handler == null) {
                return context.defaultDevicePermissionHandler(details);
            }
            return handler.check(details);
        } catch (RuntimeException e) {
            throw new PermissionHandlerException("Device permission handler", permission, e);
        }
    }

    /**
     * Reports that {@code context} was granted {@code device}. Falls back to the context's default
     * grant handler when no grant handler is registered.
     */
    public void grantDevicePermission(
            PermissionType permission,
            ExecutionContext context,
            Origin origin,
            JsonNode device
    ) {
        Map<String, Object> details = buildDeviceDetails(permission, context, origin, device);
        DeviceGrantHandler handler = grantDevicePermissionHandler;
        try {
            if (handler == null) {
                context.defaultGrantDevicePermissionHandler(details);
            } else {
                handler.grant(details);
            }
        } catch (RuntimeException e) {
            throw new PermissionHandlerException("Grant device permission handler", permission, e);
        }
    }

    private Map<String, Object> buildDeviceDetails(
            PermissionType permission,
            ExecutionContext context,
            Origin origin,
            JsonNode device
    ) {
        Objects.requireNonNull(permission, "permission");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(device, "device");
        if (!device.isObject()) {
            throw new IllegalArgumentException("Device descriptor must be a JSON object: " + device);
        }

        Map<String, Object> details = new HashMap<>();
        details.put(PermissionDetails.DEVICE_TYPE, permission.getValue());
        details.put(PermissionDetails.ORIGIN, origin.serialize());
        details.put(PermissionDetails.DEVICE, mapper.convertValue(
                device,
                mapper.getTypeFactory().constructMapType(Map.class, String.class, Object.class)
        ));
        details.put(PermissionDetails.CONTEXT, context);
        return details;
    }

    // ---------------------------------------------------------------------
    // Unsupported surface
    // ---------------------------------------------------------------------

    /**
     * Does nothing; grants are not remembered, so there is nothing to reset.
     */
    public void resetPermission(PermissionType permission, URI requestingOrigin, URI embeddingOrigin) {
    }

    /**
     * Status changes are not tracked.
     *
     * @return always {@link #INVALID_SUBSCRIPTION_ID}
     */
    public long subscribePermissionStatusChange(
            PermissionType permission,
            @Nullable ExecutionContext context,
            URI requestingOrigin,
            StatusCallback callback
    ) {
        return INVALID_SUBSCRIPTION_ID;
    }

    public void unsubscribePermissionStatusChange(long subscriptionId) {
    }
}
