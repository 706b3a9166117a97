package com.raava.concierge.gateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.raava.concierge.util.SessionIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * In-memory sliding-window rate limiter, keyed by session ID.
 *
 * Rate limit: {@code raava.rate-limit.requests-per-minute} (default 15) per session.
 * Idle windows expire from the cache after two minutes.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final Duration WINDOW_SIZE = Duration.ofMinutes(1);

    private final Clock clock;
    private final int maxRequestsPerMinute;

    private final Cache<String, RequestWindow> sessionWindows = Caffeine.newBuilder()
            .expireAfterAccess(WINDOW_SIZE.multipliedBy(2))
            .build();

    public RateLimiter(Clock clock, @Value("${raava.rate-limit.requests-per-minute:15}") int maxRequestsPerMinute) {
        this.clock = clock;
        this.maxRequestsPerMinute = maxRequestsPerMinute;
    }

    /**
     * Records the request when it is within the limit.
     *
     * @param sessionId The session ID to check rate limit for
     * @return true if request is allowed, false if rate limit exceeded
     */
    public boolean isAllowed(String sessionId) {
        RequestWindow window = sessionWindows.get(sessionId, k -> new RequestWindow());
        Instant now = clock.instant();
        if (!window.tryAdd(now, maxRequestsPerMinute)) {
            log.warn("Rate limit exceeded for sessionId: {}", SessionIdMasker.mask(sessionId));
            return false;
        }
        return true;
    }

    /**
     * Request timestamps of one session within the last window.
     */
    private static class RequestWindow {
        private final Deque<Instant> requests = new ArrayDeque<>();

        synchronized boolean tryAdd(Instant now, int limit) {
            Instant cutoff = now.minus(WINDOW_SIZE);
            while (!requests.isEmpty() && requests.peekFirst().isBefore(cutoff)) {
                requests.pollFirst();
            }
            if (requests.size() >= limit) {
                return false;
            }
            requests.addLast(now);
            return true;
        }
    }
}
