package io.depkit.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One page of devices from fetch or sync. Pass {@link #cursor()} to the next call while {@link #moreToFollow()} is set.
 */
public record DeviceListResponse(
    @JsonProperty("devices") List<Device> devices,
    @JsonProperty("cursor") String cursor,
    @JsonProperty("fetched_until") Instant fetchedUntil,
    @JsonProperty("more_to_follow") boolean moreToFollow
) {
}
