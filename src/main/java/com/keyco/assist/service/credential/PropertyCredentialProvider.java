package com.keyco.assist.service.credential;

import com.keyco.assist.config.properties.CredentialsProperties;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link CredentialProvider} backed by {@code assist.credentials.*}, typically fed from the
 * environment by the host.
 */
public class PropertyCredentialProvider implements CredentialProvider {

    private final CredentialsProperties props;

    public PropertyCredentialProvider(CredentialsProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public Optional<String> apiToken() {
        String token = props.getApiToken();
        return (token == null || token.isBlank()) ? Optional.empty() : Optional.of(token.trim());
    }
}
