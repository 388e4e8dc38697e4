package io.depkit.sdk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * DEP enrollment profile as defined with {@code POST /profile} and returned by {@code GET /profile}.
 *
 * <p>
 * {@code profile_uuid} is only populated on fetched profiles. {@code is_mdm_removable} and {@code org_magic} are always
 * written; other optional keys are omitted when unset.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Profile(
    @JsonProperty("profile_name") @JsonInclude(JsonInclude.Include.ALWAYS) String profileName,
    @JsonProperty("url") @JsonInclude(JsonInclude.Include.ALWAYS) String url,
    @JsonProperty("allow_pairing") Boolean allowPairing,
    @JsonProperty("is_supervised") Boolean supervised,
    @JsonProperty("is_multi_user") Boolean multiUser,
    @JsonProperty("is_mandatory") Boolean mandatory,
    @JsonProperty("await_device_configured") Boolean awaitDeviceConfigured,
    @JsonProperty("is_mdm_removable") @JsonInclude(JsonInclude.Include.ALWAYS) boolean mdmRemovable,
    @JsonProperty("support_phone_number") String supportPhoneNumber,
    @JsonProperty("auto_advance_setup") Boolean autoAdvanceSetup,
    @JsonProperty("support_email_address") String supportEmailAddress,
    @JsonProperty("org_magic") @JsonInclude(JsonInclude.Include.ALWAYS) String orgMagic,
    @JsonProperty("anchor_certs") List<String> anchorCerts,
    @JsonProperty("supervising_host_certs") List<String> supervisingHostCerts,
    @JsonProperty("department") String department,
    @JsonProperty("devices") List<String> devices,
    @JsonProperty("language") String language,
    @JsonProperty("region") String region,
    @JsonProperty("configuration_web_url") String configurationWebUrl,
    @JsonProperty("skip_setup_items") List<String> skipSetupItems,
    @JsonProperty("profile_uuid") String profileUuid
) {

    public Profile {
        anchorCerts = anchorCerts == null ? null : List.copyOf(anchorCerts);
        supervisingHostCerts = supervisingHostCerts == null ? null : List.copyOf(supervisingHostCerts);
        devices = devices == null ? null : List.copyOf(devices);
        skipSetupItems = skipSetupItems == null ? null : List.copyOf(skipSetupItems);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String profileName;
        private String url;
        private Boolean allowPairing;
        private Boolean supervised;
        private Boolean multiUser;
        private Boolean mandatory;
        private Boolean awaitDeviceConfigured;
        private boolean mdmRemovable = true;
        private String supportPhoneNumber;
        private Boolean autoAdvanceSetup;
        private String supportEmailAddress;
        private String orgMagic = "";
        private List<String> anchorCerts;
        private List<String> supervisingHostCerts;
        private String department;
        private List<String> devices;
        private String language;
        private String region;
        private String configurationWebUrl;
        private List<String> skipSetupItems;
        private String profileUuid;

        public Builder profileName(String profileName) {
            this.profileName = profileName;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder allowPairing(Boolean allowPairing) {
            this.allowPairing = allowPairing;
            return this;
        }

        public Builder supervised(Boolean supervised) {
            this.supervised = supervised;
            return this;
        }

        public Builder multiUser(Boolean multiUser) {
            this.multiUser = multiUser;
            return this;
        }

        public Builder mandatory(Boolean mandatory) {
            this.mandatory = mandatory;
            return this;
        }

        public Builder awaitDeviceConfigured(Boolean awaitDeviceConfigured) {
            this.awaitDeviceConfigured = awaitDeviceConfigured;
            return this;
        }

        public Builder mdmRemovable(boolean mdmRemovable) {
            this.mdmRemovable = mdmRemovable;
            return this;
        }

        public Builder supportPhoneNumber(String supportPhoneNumber) {
            this.supportPhoneNumber = supportPhoneNumber;
            return this;
        }

        public Builder autoAdvanceSetup(Boolean autoAdvanceSetup) {
            this.autoAdvanceSetup = autoAdvanceSetup;
            return this;
        }

        public Builder supportEmailAddress(String supportEmailAddress) {
            this.supportEmailAddress = supportEmailAddress;
            return this;
        }

        public Builder orgMagic(String orgMagic) {
            this.orgMagic = orgMagic;
            return this;
        }

        public Builder anchorCerts(List<String> anchorCerts) {
            this.anchorCerts = anchorCerts == null ? null : new ArrayList<>(anchorCerts);
            return this;
        }

        public Builder supervisingHostCerts(List<String> supervisingHostCerts) {
            this.supervisingHostCerts = supervisingHostCerts == null ? null : new ArrayList<>(supervisingHostCerts);
            return this;
        }

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder devices(List<String> devices) {
            this.devices = devices == null ? null : new ArrayList<>(devices);
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder configurationWebUrl(String configurationWebUrl) {
            this.configurationWebUrl = configurationWebUrl;
            return this;
        }

        public Builder skipSetupItems(List<String> skipSetupItems) {
            this.skipSetupItems = skipSetupItems == null ? null : new ArrayList<>(skipSetupItems);
            return this;
        }

        public Builder profileUuid(String profileUuid) {
            this.profileUuid = profileUuid;
            return this;
        }

        public Profile build() {
            if (profileName == null || profileName.isBlank()) {
                throw new IllegalArgumentException("profile_name is required");
            }
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url is required");
            }
            return new Profile(
                profileName,
                url,
                allowPairing,
                supervised,
                multiUser,
                mandatory,
                awaitDeviceConfigured,
                mdmRemovable,
                supportPhoneNumber,
                autoAdvanceSetup,
                supportEmailAddress,
                orgMagic,
                anchorCerts,
                supervisingHostCerts,
                department,
                devices,
                language,
                region,
                configurationWebUrl,
                skipSetupItems,
                profileUuid
            );
        }
    }
}
