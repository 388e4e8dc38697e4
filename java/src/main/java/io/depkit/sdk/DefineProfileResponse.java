package io.depkit.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of defining a profile: the new profile UUID and the serial numbers it was applied to.
 */
public record DefineProfileResponse(
    @JsonProperty("profile_uuid") String profileUuid,
    @JsonProperty("devices") List<String> devices
) {
}
