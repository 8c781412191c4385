package com.keyco.assist.service.transport;

import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.Usage;
import com.keyco.assist.exception.SnippetSourceException;
import com.keyco.assist.exception.TransportExceptionBuilder;
import com.keyco.assist.service.snippet.Snippet;
import com.keyco.assist.service.snippet.SnippetSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Answers snippet-mode requests from the shared snippet container without leaving the process.
 *
 * <p>The best match (pinned first, then stored order) is returned. No match is a client error;
 * an unreadable container is a server error so the breaker can trip on a broken container.
 */
public class SnippetTransport implements BackendTransport {

    public static final String ENDPOINT = "snippets";

    private static final Logger LOG = LogManager.getLogger(SnippetTransport.class);

    private final SnippetSource source;

    public SnippetTransport(SnippetSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public CompletableFuture<BackendResponse> send(BackendRequest request) {
        try {
            List<Snippet> matches = source.search(request.text());
            if (matches.isEmpty()) {
                return CompletableFuture.failedFuture(TransportExceptionBuilder
                        .create(FailureKind.CLIENT_ERROR, "No snippet matches")
                        .endpoint(ENDPOINT)
                        .build());
            }
            Snippet best = matches.get(0);
            LOG.debug("Snippet match id={} ({} candidates)", best.id(), matches.size());
            return CompletableFuture.completedFuture(new BackendResponse(best.text().trim(), Usage.NONE));
        } catch (SnippetSourceException e) {
            return CompletableFuture.failedFuture(TransportExceptionBuilder
                    .create(FailureKind.SERVER_ERROR, "Snippet container unreadable")
                    .endpoint(ENDPOINT)
                    .cause(e)
                    .build());
        }
    }

    @Override
    public String endpointFor(Mode mode) {
        return ENDPOINT;
    }
}
