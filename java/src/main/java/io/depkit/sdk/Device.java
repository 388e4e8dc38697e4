package io.depkit.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Device record as listed by fetch/sync and device details. {@code opType}/{@code opDate} are only set by sync.
 */
public record Device(
    @JsonProperty("serial_number") String serialNumber,
    @JsonProperty("model") String model,
    @JsonProperty("description") String description,
    @JsonProperty("color") String color,
    @JsonProperty("asset_tag") String assetTag,
    @JsonProperty("profile_status") String profileStatus,
    @JsonProperty("profile_uuid") String profileUuid,
    @JsonProperty("profile_assign_time") Instant profileAssignTime,
    @JsonProperty("profile_push_time") Instant profilePushTime,
    @JsonProperty("device_assigned_date") Instant deviceAssignedDate,
    @JsonProperty("device_assigned_by") String deviceAssignedBy,
    @JsonProperty("os") String os,
    @JsonProperty("device_family") String deviceFamily,
    @JsonProperty("op_type") String opType,
    @JsonProperty("op_date") Instant opDate,
    @JsonProperty("response_status") String responseStatus
) {
}
