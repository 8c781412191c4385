package com.keyco.assist.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Read-only view of the shared credential store. Usually supplied via
 * {@code ASSIST_CREDENTIALS_API_TOKEN}.
 */
@ConfigurationProperties(prefix = "assist.credentials")
public class CredentialsProperties {

    /** Optional bearer token. Never logged. */
    private String apiToken;

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    @Override
    public String toString() {
        return "CredentialsProperties{apiToken=" + (apiToken == null || apiToken.isBlank() ? "<unset>" : "<redacted>") + "}";
    }
}
