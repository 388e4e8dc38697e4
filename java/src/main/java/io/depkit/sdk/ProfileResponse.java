package io.depkit.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Result of assigning a profile. {@code devices} maps each serial number to its per-device status
 * ({@code SUCCESS}, {@code NOT_ACCESSIBLE}, {@code FAILED}); individual failures do not fail the call.
 */
public record ProfileResponse(
    @JsonProperty("profile_uuid") String profileUuid,
    @JsonProperty("devices") Map<String, String> devices
) {
}
