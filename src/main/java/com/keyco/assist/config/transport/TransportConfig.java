package com.keyco.assist.config.transport;

import com.keyco.assist.config.properties.BackendProperties;
import com.keyco.assist.config.properties.CredentialsProperties;
import com.keyco.assist.config.properties.SnippetsProperties;
import com.keyco.assist.service.credential.CredentialProvider;
import com.keyco.assist.service.credential.PropertyCredentialProvider;
import com.keyco.assist.service.snippet.JsonFileSnippetSource;
import com.keyco.assist.service.snippet.SnippetSource;
import com.keyco.assist.service.transport.BackendHealthClient;
import com.keyco.assist.service.transport.BackendTransport;
import com.keyco.assist.service.transport.HttpBackendTransport;
import com.keyco.assist.service.transport.RoutingBackendTransport;
import com.keyco.assist.service.transport.SnippetTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the backend transports, the credential provider and the snippet container.
 */
@Configuration
public class TransportConfig {

    private static final Logger LOG = LogManager.getLogger(TransportConfig.class);

    private final BackendProperties backendProperties;

    public TransportConfig(BackendProperties backendProperties) {
        this.backendProperties = backendProperties;
    }

    @Bean
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(backendProperties.connectTimeout())
                .setReadTimeout(backendProperties.requestTimeout())
                .build();
    }

    @Bean
    public RestTemplate healthRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(backendProperties.healthTimeout())
                .setReadTimeout(backendProperties.healthTimeout())
                .build();
    }

    @Bean
    public CredentialProvider credentialProvider(CredentialsProperties credentialsProperties) {
        CredentialProvider provider = new PropertyCredentialProvider(credentialsProperties);
        LOG.info("Backend credentials: {}", provider.apiToken().isPresent() ? "configured" : "none");
        return provider;
    }

    @Bean
    public SnippetSource snippetSource(SnippetsProperties snippetsProperties, ResourceLoader resourceLoader) {
        return new JsonFileSnippetSource(resourceLoader.getResource(snippetsProperties.getLocation()));
    }

    @Bean
    public HttpBackendTransport httpBackendTransport(@Qualifier("backendRestTemplate") RestTemplate restTemplate,
                                                     CredentialProvider credentialProvider,
                                                     @Qualifier("transportExecutor") Executor transportExecutor,
                                                     Clock clock) {
        LOG.info("Backend transport targeting {}", backendProperties.getBaseUrl());
        return new HttpBackendTransport(restTemplate, backendProperties, credentialProvider, transportExecutor, clock);
    }

    @Bean
    public SnippetTransport snippetTransport(SnippetSource snippetSource) {
        return new SnippetTransport(snippetSource);
    }

    /**
     * Transport used by the coordinator: remote modes over HTTP, snippet mode locally.
     */
    @Bean
    @Primary
    public BackendTransport backendTransport(HttpBackendTransport httpBackendTransport,
                                             SnippetTransport snippetTransport) {
        return new RoutingBackendTransport(httpBackendTransport, snippetTransport);
    }

    @Bean
    public BackendHealthClient backendHealthClient(@Qualifier("healthRestTemplate") RestTemplate restTemplate) {
        return new BackendHealthClient(restTemplate, backendProperties);
    }
}
