package io.depkit.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Result of removing profiles from devices, keyed by serial number.
 */
public record ClearProfileResponse(@JsonProperty("devices") Map<String, String> devices) {
}
