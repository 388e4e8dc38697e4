package io.depkit.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Organisation and MDM server details returned by {@code GET /account}.
 */
public record AccountDetail(
    @JsonProperty("server_name") String serverName,
    @JsonProperty("server_uuid") String serverUuid,
    @JsonProperty("admin_id") String adminId,
    @JsonProperty("facilitator_id") String facilitatorId,
    @JsonProperty("org_name") String orgName,
    @JsonProperty("org_email") String orgEmail,
    @JsonProperty("org_phone") String orgPhone,
    @JsonProperty("org_address") String orgAddress,
    @JsonProperty("org_type") String orgType,
    @JsonProperty("org_version") String orgVersion,
    @JsonProperty("org_id") String orgId,
    @JsonProperty("org_id_hash") String orgIdHash,
    @JsonProperty("urls") List<Url> urls
) {

    /**
     * Endpoint usage limits advertised by the server.
     */
    public record Url(
        @JsonProperty("uri") String uri,
        @JsonProperty("http_method") List<String> httpMethod,
        @JsonProperty("limit") Limit limit
    ) {
    }

    public record Limit(
        @JsonProperty("default") Integer defaultValue,
        @JsonProperty("maximum") Integer maximum
    ) {
    }
}
