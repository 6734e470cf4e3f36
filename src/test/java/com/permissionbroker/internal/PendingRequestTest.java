package com.permissionbroker.internal;

import com.permissionbroker.exceptions.SlotAlreadyResolvedException;
import com.permissionbroker.hooks.GrantHook;
import com.permissionbroker.hooks.GrantHookRegistry;
import com.permissionbroker.types.permissions.PermissionStatus;
import com.permissionbroker.types.permissions.PermissionType;
import com.permissionbroker.util.FakeContextResolver;
import com.permissionbroker.util.FakeExecutionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("PendingRequest")
class PendingRequestTest {

    private final FakeExecutionContext context = FakeExecutionContext.aFrame().withProcessId(42).build();

    @Mock
    private GrantHook geolocationHook;

    private final List<List<PermissionStatus>> completions = new ArrayList<>();
    private PendingRequest request;

    @BeforeEach
    void setUp() {
        request = new PendingRequest(
                5,
                context,
                List.of(PermissionType.GEOLOCATION, PermissionType.NOTIFICATIONS),
                GrantHookRegistry.of(Map.of(PermissionType.GEOLOCATION, geolocationHook)),
                completions::add
        );
    }

    @Test
    @DisplayName("should start incomplete with every slot denied")
    void shouldStartIncompleteWithEverySlotDenied() {
        assertThat(request.isComplete()).isFalse();
        assertThat(request.getRemaining()).isEqualTo(2);

        request.runCallback();

        assertThat(completions).containsExactly(List.of(PermissionStatus.DENIED, PermissionStatus.DENIED));
        verifyNoInteractions(geolocationHook);
    }

    @Test
    @DisplayName("should complete once every slot is resolved, in any order")
    void shouldCompleteOnceEverySlotIsResolved() {
        request.setPermissionStatus(1, PermissionStatus.GRANTED);
        assertThat(request.isComplete()).isFalse();

        request.setPermissionStatus(0, PermissionStatus.ASK);
        assertThat(request.isComplete()).isTrue();
        assertThat(request.getRemaining()).isZero();

        request.runCallback();
        assertThat(completions).containsExactly(List.of(PermissionStatus.ASK, PermissionStatus.GRANTED));
    }

    @Test
    @DisplayName("should run the grant hook with the owner id only when granted")
    void shouldRunGrantHookOnlyWhenGranted() {
        request.setPermissionStatus(0, PermissionStatus.GRANTED);

        verify(geolocationHook, times(1)).onGranted(42);
    }

    @Test
    @DisplayName("should not run the grant hook on denial")
    void shouldNotRunGrantHookOnDenial() {
        request.setPermissionStatus(0, PermissionStatus.DENIED);

        verify(geolocationHook, never()).onGranted(42);
    }

    @Test
    @DisplayName("should reject a second resolution of the same slot")
    void shouldRejectSecondResolutionOfSameSlot() {
        request.setPermissionStatus(0, PermissionStatus.GRANTED);

        assertThatThrownBy(() -> request.setPermissionStatus(0, PermissionStatus.GRANTED))
                .isInstanceOf(SlotAlreadyResolvedException.class)
                .satisfies(e -> {
                    SlotAlreadyResolvedException ex = (SlotAlreadyResolvedException) e;
                    assertThat(ex.getRequestId()).isEqualTo(5);
                    assertThat(ex.getSlotIndex()).isZero();
                });
        assertThat(request.getRemaining()).isEqualTo(1);
        verify(geolocationHook, times(1)).onGranted(42);
    }

    @Test
    @DisplayName("should reject slots outside the request")
    void shouldRejectSlotsOutsideRequest() {
        assertThatThrownBy(() -> request.setPermissionStatus(2, PermissionStatus.GRANTED))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(request.getRemaining()).isEqualTo(2);
    }

    @Test
    @DisplayName("should run the callback at most once")
    void shouldRunCallbackAtMostOnce() {
        request.setPermissionStatus(0, PermissionStatus.GRANTED);
        request.setPermissionStatus(1, PermissionStatus.GRANTED);

        request.runCallback();
        request.runCallback();

        assertThat(completions).hasSize(1);
    }

    @Test
    @DisplayName("should hand out results the caller cannot modify")
    void shouldHandOutUnmodifiableResults() {
        request.runCallback();

        assertThatThrownBy(() -> completions.get(0).set(0, PermissionStatus.GRANTED))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should reach a live context through its weak reference")
    void shouldResolveContextThroughWeakReference() {
        assertThat(request.resolveContext(null)).isSameAs(context);
    }

    @Test
    @DisplayName("should prefer the resolver when one is configured")
    void shouldPreferResolver() {
        FakeContextResolver resolver = new FakeContextResolver();

        assertThat(request.resolveContext(resolver)).isNull();

        resolver.attach(context);
        assertThat(request.resolveContext(resolver)).isSameAs(context);
    }
}
