package com.permissionbroker.types.permissions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionType")
class PermissionTypeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("should serialize to wire names")
    void shouldSerializeToWireNames() throws JsonProcessingException {
        String json = mapper.writeValueAsString(List.of(PermissionType.MIDI_SYSEX, PermissionType.CLIPBOARD_READ_WRITE));

        assertThat(json).isEqualTo("[\"midiSysex\",\"clipboard-read\"]");
    }

    @Test
    @DisplayName("should read handler answers from wire names")
    void shouldReadStatusesFromWireNames() throws JsonProcessingException {
        PermissionStatus status = mapper.readValue("\"granted\"", PermissionStatus.class);

        assertThat(status).isEqualTo(PermissionStatus.GRANTED);
        assertThat(PermissionStatus.fromGranted(false)).isEqualTo(PermissionStatus.DENIED);
    }

    @Test
    @DisplayName("should reject unknown wire names")
    void shouldRejectUnknownWireNames() {
        assertThatThrownBy(() -> PermissionType.fromValue("teleport"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("teleport");
    }

    @Test
    @DisplayName("should only hint media type for capture kinds")
    void shouldHintMediaTypeForCaptureKinds() {
        assertThat(PermissionDetails.mediaTypeOf(PermissionType.AUDIO_CAPTURE)).isEqualTo("audio");
        assertThat(PermissionDetails.mediaTypeOf(PermissionType.VIDEO_CAPTURE)).isEqualTo("video");
        assertThat(PermissionDetails.mediaTypeOf(PermissionType.SENSORS)).isNull();
    }
}
