package com.shipdata.service;

import com.shipdata.error.SessionExpiredException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class SessionManager {
    private final Map<String, IngestSession> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final Duration idleTimeout;
    private final Duration maxLifetime;

    public SessionManager(
            @Value("${shipdata.session.idle-timeout-minutes:30}") long idleTimeoutMinutes,
            @Value("${shipdata.session.max-lifetime-hours:24}") long maxLifetimeHours
    ) {
        this.idleTimeout = Duration.ofMinutes(idleTimeoutMinutes);
        this.maxLifetime = Duration.ofHours(maxLifetimeHours);
        // Run cleanup task every 5 minutes
        scheduler.scheduleAtFixedRate(this::cleanupExpiredSessions, 5, 5, TimeUnit.MINUTES);
    }

    public IngestSession createSession() {
        String sessionId = UUID.randomUUID().toString();
        IngestSession session = IngestSession.open(sessionId, maxLifetime);
        sessions.put(sessionId, session);
        log.info("Session opened: session_id={}, expires_at={}", sessionId, session.getExpiresAt());
        return session;
    }

    public Optional<IngestSession> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        IngestSession session = sessions.get(sessionId);
        if (session != null) {
            if (isSessionExpired(session)) {
                terminateSession(sessionId);
                return Optional.empty();
            }
            session.touch();
            return Optional.of(session);
        }
        return Optional.empty();
    }

    /**
     * Look up a live session.
     *
     * @param sessionId session id
     * @return session
     * @throws SessionExpiredException when the session is missing or expired
     */
    public IngestSession requireSession(String sessionId) {
        return getSession(sessionId).orElseThrow(() -> new SessionExpiredException(sessionId));
    }

    public void terminateSession(String sessionId) {
        IngestSession session = sessions.remove(sessionId);
        if (session != null) {
            session.close();
            log.info("Session closed: session_id={}", sessionId);
        }
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    boolean isSessionExpired(IngestSession session) {
        OffsetDateTime now = OffsetDateTime.now();
        boolean idleExpired = session.getLastAccessedAt().plus(idleTimeout).isBefore(now);
        boolean lifeExpired = session.getExpiresAt().isBefore(now);
        return idleExpired || lifeExpired;
    }

    void cleanupExpiredSessions() {
        sessions.forEach((id, session) -> {
            if (isSessionExpired(session)) {
                terminateSession(id);
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        sessions.keySet().forEach(this::terminateSession);
    }
}
