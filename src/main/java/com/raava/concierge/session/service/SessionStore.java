package com.raava.concierge.session.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.raava.concierge.exception.PersistenceException;
import com.raava.concierge.repository.RecordStore;
import com.raava.concierge.session.model.SessionState;
import com.raava.concierge.util.SessionIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Session store - owns the lifecycle of {@link SessionState} using a Caffeine cache.
 *
 * Responsibilities:
 * - Fetch or create the session for a caller-supplied session ID
 * - Replace sessions idle for longer than the timeout with a fresh one under the same ID
 * - Write sessions through to the record store so they survive a restart
 * - Clear a funnel for reuse, or drop a session entirely
 * - Serialise work per session ID, with no global lock
 *
 * The cache is authoritative. The record store copy is best-effort: a failed write is logged
 * and the conversation carries on.
 */
@Slf4j
@Service
public class SessionStore {

    static final String COLLECTION = "sessions";

    private final RecordStore recordStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration timeout;
    private final int historyWindow;

    private final Cache<String, SessionState> sessionCache;

    /**
     * One lock per session ID; entries disappear once no thread holds a reference.
     */
    private final Cache<String, ReentrantLock> sessionLocks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public SessionStore(RecordStore recordStore,
                        ObjectMapper objectMapper,
                        Clock clock,
                        @Value("${raava.session.timeout:60m}") Duration timeout,
                        @Value("${raava.session.max-sessions:10000}") long maxSessions,
                        @Value("${raava.session.history-window:20}") int historyWindow) {
        this.recordStore = recordStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.timeout = timeout;
        this.historyWindow = historyWindow;
        this.sessionCache = Caffeine.newBuilder()
                .expireAfterAccess(timeout)
                .maximumSize(maxSessions)
                .removalListener((String key, SessionState value, RemovalCause cause) ->
                        log.debug("Session evicted from cache - sessionId: {}, cause: {}", SessionIdMasker.mask(key), cause))
                .build();
    }

    /**
     * Returns the live session for {@code sessionId}, creating one when none exists or the
     * existing one has been idle past the timeout.
     */
    public SessionState fetchOrCreate(String sessionId) {
        Instant now = clock.instant();
        SessionState session = sessionCache.getIfPresent(sessionId);
        if (session == null) {
            session = loadFromStore(sessionId);
        }

        if (session != null && session.isExpired(now, timeout)) {
            log.info("Session expired, starting fresh - sessionId: {}, lastActiveAt: {}",
                    SessionIdMasker.mask(sessionId), session.getLastActiveAt());
            session = null;
        }

        if (session == null) {
            session = SessionState.builder()
                    .sessionId(sessionId)
                    .createdAt(now)
                    .lastActiveAt(now)
                    .build();
            sessionCache.put(sessionId, session);
            log.info("Created new session - sessionId: {}", SessionIdMasker.mask(sessionId));
        } else {
            sessionCache.put(sessionId, session);
            log.debug("Retrieved existing session - sessionId: {}, domain: {}",
                    SessionIdMasker.mask(sessionId), session.getActiveDomain());
        }
        return session;
    }

    /**
     * Stores {@code session} as the current state, touching its activity time.
     */
    public void save(SessionState session) {
        if (session == null || session.getSessionId() == null) {
            log.warn("Attempted to save null session or session without sessionId");
            return;
        }
        session.setLastActiveAt(clock.instant());
        sessionCache.put(session.getSessionId(), session);
        writeThrough(session);
    }

    /**
     * Resets the funnel of a session, keeping its ID, history and completed records.
     */
    public SessionState clearForReuse(String sessionId) {
        SessionState session = fetchOrCreate(sessionId);
        session.clearForReuse();
        save(session);
        log.info("Session cleared for reuse - sessionId: {}", SessionIdMasker.mask(sessionId));
        return session;
    }

    /**
     * Drops the session entirely.
     */
    public void invalidate(String sessionId) {
        sessionCache.invalidate(sessionId);
        try {
            recordStore.delete(COLLECTION, sessionId);
        } catch (PersistenceException e) {
            log.warn("Failed to delete stored session - sessionId: {}, error: {}",
                    SessionIdMasker.mask(sessionId), e.getMessage());
        }
        log.info("Invalidated session - sessionId: {}", SessionIdMasker.mask(sessionId));
    }

    /**
     * Runs {@code work} while holding the lock for {@code sessionId}. Turns for the same
     * session run one at a time; turns for different sessions run in parallel.
     */
    public <T> T executeSerialized(String sessionId, Supplier<T> work) {
        ReentrantLock lock = sessionLocks.get(sessionId, key -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deep copy of {@code session} that can be changed freely and committed with {@link #save}
     * or thrown away.
     */
    public SessionState workingCopy(SessionState session) {
        return objectMapper.convertValue(session, SessionState.class);
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public long getActiveSessionCount() {
        return sessionCache.estimatedSize();
    }

    private SessionState loadFromStore(String sessionId) {
        try {
            return recordStore.get(COLLECTION, sessionId)
                    .map(this::fromDocument)
                    .orElse(null);
        } catch (PersistenceException | IllegalArgumentException e) {
            log.warn("Failed to load stored session, starting fresh - sessionId: {}, error: {}",
                    SessionIdMasker.mask(sessionId), e.getMessage());
            return null;
        }
    }

    private void writeThrough(SessionState session) {
        try {
            recordStore.put(COLLECTION, session.getSessionId(), toDocument(session));
        } catch (PersistenceException | IllegalArgumentException e) {
            log.warn("Failed to write session through to store - sessionId: {}, error: {}",
                    SessionIdMasker.mask(session.getSessionId()), e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private Document toDocument(SessionState session) {
        Map<String, Object> fields = objectMapper.convertValue(session, Map.class);
        return new Document(fields);
    }

    private SessionState fromDocument(Document document) {
        Document copy = new Document(document);
        copy.remove(RecordStore.ID_FIELD);
        return objectMapper.convertValue(copy, SessionState.class);
    }
}
