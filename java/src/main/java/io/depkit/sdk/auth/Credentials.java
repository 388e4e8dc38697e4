package io.depkit.sdk.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Long-lived OAuth 1.0a material issued with a DEP server token. Field names follow the server token file format.
 */
public record Credentials(
    @JsonProperty("consumer_key") String consumerKey,
    @JsonProperty("consumer_secret") String consumerSecret,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("access_secret") String accessSecret,
    @JsonProperty("access_token_expiry") Instant accessTokenExpiry
) {

    public Credentials(String consumerKey, String consumerSecret, String accessToken, String accessSecret) {
        this(consumerKey, consumerSecret, accessToken, accessSecret, null);
    }

    /**
     * @return {@code true} when all four secrets needed to sign a session request are present.
     */
    @JsonIgnore
    public boolean isComplete() {
        return notBlank(consumerKey) && notBlank(consumerSecret) && notBlank(accessToken) && notBlank(accessSecret);
    }

    @Override
    public String toString() {
        return "Credentials[consumerKey=" + consumerKey + ", accessTokenExpiry=" + accessTokenExpiry + "]";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
