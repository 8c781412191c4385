package com.keyco.assist.service.credential;

import java.util.Optional;

/**
 * Read-only access to the shared credential store. The orchestration core never persists secrets.
 */
public interface CredentialProvider {

    /**
     * @return the backend API token, empty when none is configured
     */
    Optional<String> apiToken();
}
