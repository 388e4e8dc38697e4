package io.depkit.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Device details keyed by serial number. Unknown serials come back with {@code response_status} {@code NOT_FOUND}.
 */
public record DeviceDetailsResponse(@JsonProperty("devices") Map<String, Device> devices) {
}
