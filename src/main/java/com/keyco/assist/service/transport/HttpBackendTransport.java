package com.keyco.assist.service.transport;

import com.keyco.assist.config.properties.BackendProperties;
import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.RewriteOptions;
import com.keyco.assist.domain.Usage;
import com.keyco.assist.exception.TransportException;
import com.keyco.assist.exception.TransportExceptionBuilder;
import com.keyco.assist.service.credential.CredentialProvider;
import com.keyco.assist.util.LogSanitizer;
import com.keyco.assist.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * {@link BackendTransport} for the remote AI backend.
 *
 * <p>Blocking {@link RestTemplate} calls run on the {@code transportExecutor}, so {@link #send}
 * returns immediately. Wire format:
 * <ul>
 *   <li>compose: {@code POST /api/rewrite {text, tone, length, locale, preset?}}</li>
 *   <li>search-query / conversational: {@code POST /api/chat {query, mode, contextLength}}</li>
 *   <li>success: {@code {text, usage?}}; failure: {@code {error, details?}}</li>
 * </ul>
 *
 * <p>Classification: 429 → rate limited (with {@code Retry-After} or body {@code resetAt} hint),
 * 5xx → server error, other 4xx → client error, read timeout → timeout, any other I/O failure →
 * network. A 2xx body without text, or carrying an {@code error}, is a server error.
 */
public class HttpBackendTransport implements BackendTransport {

    private static final Logger LOG = LogManager.getLogger(HttpBackendTransport.class);

    private final RestTemplate restTemplate;
    private final BackendProperties props;
    private final CredentialProvider credentials;
    private final Executor executor;
    private final Clock clock;

    public HttpBackendTransport(RestTemplate restTemplate,
                                BackendProperties props,
                                CredentialProvider credentials,
                                Executor executor,
                                Clock clock) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.props = Objects.requireNonNull(props, "props");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CompletableFuture<BackendResponse> send(BackendRequest request) {
        Objects.requireNonNull(request, "request");
        if (!request.mode().remote()) {
            return CompletableFuture.failedFuture(TransportExceptionBuilder
                    .create(FailureKind.CLIENT_ERROR, "Mode is not served by the remote backend")
                    .endpoint(request.mode().wireName())
                    .build());
        }
        try {
            return CompletableFuture.supplyAsync(() -> execute(request), executor);
        } catch (RejectedExecutionException ex) {
            String path = props.pathFor(request.mode());
            LOG.warn("Transport pool saturated; failing call to {}", path);
            return CompletableFuture.failedFuture(TransportExceptionBuilder
                    .create(FailureKind.NETWORK, "Transport pool saturated")
                    .endpoint(path)
                    .cause(ex)
                    .build());
        }
    }

    @Override
    public String endpointFor(Mode mode) {
        return props.pathFor(mode);
    }

    /** Performs one blocking call. Visible for tests. */
    BackendResponse execute(BackendRequest request) {
        String path = props.pathFor(request.mode());
        String url = props.getBaseUrl() + path;
        HttpEntity<String> entity = new HttpEntity<>(buildBody(request).toString(), headers());

        long start = System.nanoTime();
        LOG.debug("POST {} mode={} {}", path, request.mode().wireName(), LogSanitizer.describe(request.text()));
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
            BackendResponse parsed = parseSuccess(response.getBody(), path, response.getStatusCode().value());
            LOG.debug("Backend {} answered in {}ms", path, TimeUtils.elapsedMillis(start));
            return parsed;
        } catch (HttpStatusCodeException ex) {
            throw classifyStatus(ex, path, TimeUtils.elapsedMillis(start));
        } catch (ResourceAccessException ex) {
            FailureKind kind = isTimeout(ex) ? FailureKind.TIMEOUT : FailureKind.NETWORK;
            throw TransportExceptionBuilder.create(kind, "Backend unreachable")
                    .endpoint(path)
                    .cause(ex)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        } catch (RestClientException ex) {
            throw TransportExceptionBuilder.create(FailureKind.SERVER_ERROR, "Unexpected backend response")
                    .endpoint(path)
                    .cause(ex)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        }
    }

    JSONObject buildBody(BackendRequest request) {
        JSONObject body = new JSONObject();
        if (request.mode() == Mode.COMPOSE) {
            RewriteOptions options = request.options();
            body.put("text", request.text());
            body.put("tone", options.tone());
            body.put("length", options.length());
            body.put("locale", options.locale());
            if (options.preset() != null) {
                body.put("preset", options.preset());
            }
        } else {
            body.put("query", request.text());
            body.put("mode", request.mode().wireName());
            body.put("contextLength", request.contextLength());
        }
        return body;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        credentials.apiToken().ifPresent(headers::setBearerAuth);
        return headers;
    }

    private BackendResponse parseSuccess(String body, String path, int status) {
        JSONObject json;
        try {
            json = new JSONObject(body == null ? "" : body);
        } catch (JSONException e) {
            throw TransportExceptionBuilder.create(FailureKind.SERVER_ERROR, "Invalid response from backend")
                    .endpoint(path)
                    .statusCode(status)
                    .cause(e)
                    .build();
        }
        if (json.has("error")) {
            throw TransportExceptionBuilder.create(FailureKind.SERVER_ERROR, "Backend reported an error")
                    .endpoint(path)
                    .statusCode(status)
                    .metadata("error", LogSanitizer.truncate(json.optString("error"), 120))
                    .build();
        }
        String text = json.optString("text", "").trim();
        if (text.isEmpty()) {
            throw TransportExceptionBuilder.create(FailureKind.SERVER_ERROR, "Backend response had no text")
                    .endpoint(path)
                    .statusCode(status)
                    .build();
        }
        return new BackendResponse(text, parseUsage(json.optJSONObject("usage")));
    }

    private static Usage parseUsage(JSONObject usage) {
        if (usage == null) {
            return Usage.NONE;
        }
        return new Usage(
                usage.optInt("prompt_tokens", usage.optInt("promptTokens", 0)),
                usage.optInt("completion_tokens", usage.optInt("completionTokens", 0)),
                usage.optInt("total_tokens", usage.optInt("totalTokens", 0)));
    }

    private TransportException classifyStatus(HttpStatusCodeException ex, String path, long durationMs) {
        int status = ex.getStatusCode().value();
        String errorText = errorText(ex.getResponseBodyAsString());
        TransportExceptionBuilder builder;
        if (status == 429) {
            Duration hint = RetryAfterParser.fromHeader(
                    ex.getResponseHeaders() == null ? null : ex.getResponseHeaders().getFirst(HttpHeaders.RETRY_AFTER),
                    clock.instant());
            if (hint == null) {
                hint = resetAtHint(ex.getResponseBodyAsString());
            }
            builder = TransportExceptionBuilder.create(FailureKind.RATE_LIMITED, "Backend throttled request")
                    .retryAfter(hint);
        } else if (status >= 500) {
            builder = TransportExceptionBuilder.create(FailureKind.SERVER_ERROR, "Backend server error");
        } else {
            builder = TransportExceptionBuilder.create(FailureKind.CLIENT_ERROR, "Backend rejected request");
        }
        return builder.endpoint(path)
                .statusCode(status)
                .durationMs(durationMs)
                .metadata("error", errorText)
                .build();
    }

    private Duration resetAtHint(String body) {
        try {
            return RetryAfterParser.fromResetAt(new JSONObject(body).optString("resetAt", null), clock.instant());
        } catch (JSONException e) {
            return null;
        }
    }

    private static String errorText(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JSONObject json = new JSONObject(body);
            String error = json.optString("error", null);
            String details = json.optString("details", json.optString("message", null));
            String combined = error == null ? details : (details == null ? error : error + ": " + details);
            return combined == null ? null : LogSanitizer.truncate(combined, 160);
        } catch (JSONException e) {
            return null;
        }
    }

    private static boolean isTimeout(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
