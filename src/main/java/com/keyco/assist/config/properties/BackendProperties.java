package com.keyco.assist.config.properties;

import com.keyco.assist.domain.Mode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the remote AI backend.
 *
 * <p>Paths are keyed by mode wire name:
 * <pre>
 * assist.backend.paths.compose=/api/rewrite
 * assist.backend.paths.search-query=/api/chat
 * assist.backend.paths.conversational=/api/chat
 * </pre>
 */
@ConfigurationProperties(prefix = "assist.backend")
@Validated
public class BackendProperties {

    @NotBlank(message = "Backend base URL must not be blank")
    private String baseUrl = "http://localhost:8787";

    /** Read timeout for one transport attempt, in milliseconds. */
    @Positive(message = "Request timeout must be positive")
    private long requestTimeoutMs = 15_000;

    @Positive(message = "Connect timeout must be positive")
    private long connectTimeoutMs = 5_000;

    /** Timeout for the health endpoint, in milliseconds. */
    @Positive(message = "Health timeout must be positive")
    private long healthTimeoutMs = 2_000;

    @NotBlank(message = "Health path must not be blank")
    private String healthPath = "/api/health";

    private Map<String, String> paths = defaultPaths();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getHealthTimeoutMs() {
        return healthTimeoutMs;
    }

    public void setHealthTimeoutMs(long healthTimeoutMs) {
        this.healthTimeoutMs = healthTimeoutMs;
    }

    public String getHealthPath() {
        return healthPath;
    }

    public void setHealthPath(String healthPath) {
        this.healthPath = healthPath;
    }

    public Map<String, String> getPaths() {
        return paths;
    }

    public void setPaths(Map<String, String> paths) {
        this.paths = paths;
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration healthTimeout() {
        return Duration.ofMillis(healthTimeoutMs);
    }

    /**
     * Resolves the backend path for a remote mode.
     *
     * @throws IllegalStateException if no path is configured for the mode
     */
    public String pathFor(Mode mode) {
        String path = paths.get(mode.wireName());
        if (path == null || path.isBlank()) {
            throw new IllegalStateException("No backend path configured for mode: " + mode.wireName());
        }
        return path;
    }

    private static Map<String, String> defaultPaths() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(Mode.COMPOSE.wireName(), "/api/rewrite");
        defaults.put(Mode.SEARCH_QUERY.wireName(), "/api/chat");
        defaults.put(Mode.CONVERSATIONAL.wireName(), "/api/chat");
        return defaults;
    }
}
