package com.keyco.assist.service.transport;

import com.keyco.assist.config.properties.BackendProperties;
import com.keyco.assist.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * Probes {@code GET {base}/api/health}. Informational only: the result feeds the actuator health
 * endpoint, never the circuit breakers.
 */
public class BackendHealthClient {

    private static final Logger LOG = LogManager.getLogger(BackendHealthClient.class);

    /**
     * @param up whether the backend reported healthy
     * @param statusCode HTTP status, 0 when unreachable
     * @param latencyMs round trip time
     * @param detail backend status string or failure reason
     */
    public record BackendHealth(boolean up, int statusCode, long latencyMs, String detail) {
    }

    private final RestTemplate restTemplate;
    private final BackendProperties props;

    public BackendHealthClient(RestTemplate restTemplate, BackendProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.props = Objects.requireNonNull(props, "props");
    }

    public BackendHealth check() {
        String url = props.getBaseUrl() + props.getHealthPath();
        long start = System.nanoTime();
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            return new BackendHealth(true, response.getStatusCode().value(),
                    TimeUtils.elapsedMillis(start), statusField(response.getBody(), "healthy"));
        } catch (HttpStatusCodeException ex) {
            return new BackendHealth(false, ex.getStatusCode().value(),
                    TimeUtils.elapsedMillis(start), statusField(ex.getResponseBodyAsString(), "unhealthy"));
        } catch (RestClientException ex) {
            LOG.debug("Backend health probe failed: {}", ex.toString());
            return new BackendHealth(false, 0, TimeUtils.elapsedMillis(start), "unreachable");
        }
    }

    private static String statusField(String body, String fallback) {
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            return new JSONObject(body).optString("status", fallback);
        } catch (JSONException e) {
            return fallback;
        }
    }
}
