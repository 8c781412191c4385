package com.keyco.assist.service.orchestration;

import com.keyco.assist.domain.Mode;
import com.keyco.assist.exception.SessionNotFoundException;
import com.keyco.assist.service.sink.SessionOutcomeStore;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Creates, looks up and tears down {@link AssistSession}s.
 *
 * <p>Every lookup marks the session as used. Sessions unused for longer than the idle timeout are
 * closed by {@link #expireIdle()}, together with their stored outcome, so clients that vanish
 * without closing do not pin memory. {@link #closeAll()} runs at application shutdown so no timer
 * or call outlives the host.
 */
public class AssistSessionRegistry {

    private static final Logger LOG = LogManager.getLogger(AssistSessionRegistry.class);

    private final SessionDependencies deps;
    private final SessionOutcomeStore outcomes;
    private final Duration idleTimeout;
    private final ConcurrentMap<String, AssistSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> lastUsed = new ConcurrentHashMap<>();

    /**
     * @param outcomes outcome store to clean up on close, may be {@code null}
     */
    public AssistSessionRegistry(SessionDependencies deps, SessionOutcomeStore outcomes) {
        this(deps, outcomes, Duration.ZERO);
    }

    /**
     * @param outcomes outcome store to clean up on close, may be {@code null}
     * @param idleTimeout unused sessions older than this are expired; zero or {@code null} never expires
     */
    public AssistSessionRegistry(SessionDependencies deps, SessionOutcomeStore outcomes, Duration idleTimeout) {
        this.deps = Objects.requireNonNull(deps, "deps");
        this.outcomes = outcomes;
        this.idleTimeout = idleTimeout == null ? Duration.ZERO : idleTimeout;
    }

    public AssistSession create(Mode initialMode) {
        Mode mode = initialMode == null ? Mode.COMPOSE : initialMode;
        String id = UUID.randomUUID().toString();
        AssistSession session = new AssistSession(id, mode, deps);
        sessions.put(id, session);
        lastUsed.put(id, deps.getClock().instant());
        LOG.info("Session {} created (mode={}, active={})", id, mode.wireName(), sessions.size());
        return session;
    }

    /**
     * @throws SessionNotFoundException if no open session has this id
     */
    public AssistSession get(String id) {
        AssistSession session = id == null ? null : sessions.get(id);
        if (session == null) {
            throw new SessionNotFoundException(id);
        }
        lastUsed.put(id, deps.getClock().instant());
        return session;
    }

    /**
     * @throws SessionNotFoundException if no open session has this id
     */
    public void close(String id) {
        AssistSession session = id == null ? null : sessions.remove(id);
        if (session == null) {
            throw new SessionNotFoundException(id);
        }
        lastUsed.remove(id);
        session.close();
        if (outcomes != null) {
            outcomes.forget(id);
        }
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${assist.session.sweep-interval-ms:60000}")
    public void sweepIdleSessions() {
        expireIdle();
    }

    /**
     * Closes every session that has not been created or looked up within the idle timeout.
     *
     * @return number of sessions closed
     */
    public int expireIdle() {
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            return 0;
        }
        Instant cutoff = deps.getClock().instant().minus(idleTimeout);
        int expired = 0;
        for (Map.Entry<String, Instant> entry : lastUsed.entrySet()) {
            String id = entry.getKey();
            if (entry.getValue().isAfter(cutoff) || !lastUsed.remove(id, entry.getValue())) {
                continue;
            }
            AssistSession session = sessions.remove(id);
            if (session == null) {
                continue;
            }
            try {
                session.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing idle session {}: {}", id, e.toString());
            }
            if (outcomes != null) {
                outcomes.forget(id);
            }
            expired++;
        }
        if (expired > 0) {
            LOG.info("Expired {} idle session(s) (idle > {}, active={})", expired, idleTimeout, sessions.size());
        }
        return expired;
    }

    @PreDestroy
    public void closeAll() {
        List<AssistSession> open = new ArrayList<>(sessions.values());
        sessions.clear();
        lastUsed.clear();
        for (AssistSession session : open) {
            try {
                session.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing session {}: {}", session.id(), e.toString());
            }
        }
        if (!open.isEmpty()) {
            LOG.info("Closed {} session(s) at shutdown", open.size());
        }
    }
}
