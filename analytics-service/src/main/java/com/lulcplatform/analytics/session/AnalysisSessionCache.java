package com.lulcplatform.analytics.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of {@link AnalysisSnapshot}s, one per session id.
 *
 * <p><strong>Load once, serve many:</strong> a session's source files are read and
 * analysed on first use, then every endpoint reads the same snapshot until it
 * is older than the configured TTL or the session is refreshed explicitly.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}; all methods are plain lookups
 * suitable for composition inside {@code Mono} chains.
 */
@Component
public class AnalysisSessionCache {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSessionCache.class);

    private final ConcurrentHashMap<String, AnalysisSnapshot> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public AnalysisSessionCache(Duration sessionTtl) {
        this(sessionTtl, Clock.systemUTC());
    }

    AnalysisSessionCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the snapshot for the session, or {@code null} if absent or expired.
     * An expired snapshot is evicted on the way out.
     */
    public AnalysisSnapshot get(String sessionId) {
        AnalysisSnapshot snapshot = store.get(sessionId);
        if (snapshot == null) {
            return null;
        }
        if (isExpired(snapshot)) {
            store.remove(sessionId, snapshot);
            log.info("[SessionCache] SESSION_EXPIRED session={} ageSeconds={}",
                sessionId, Duration.between(snapshot.createdAt(), clock.instant()).toSeconds());
            return null;
        }
        return snapshot;
    }

    public void put(AnalysisSnapshot snapshot) {
        store.put(snapshot.sessionId(), snapshot);
        log.info("[SessionCache] SESSION_STORED session={} initiatives={} ttlSeconds={}",
            snapshot.sessionId(), snapshot.sources().initiatives().size(), ttl.toSeconds());
    }

    public void evict(String sessionId) {
        if (store.remove(sessionId) != null) {
            log.info("[SessionCache] SESSION_EVICTED session={}", sessionId);
        }
    }

    public boolean isExpired(AnalysisSnapshot snapshot) {
        return clock.instant().isAfter(snapshot.createdAt().plus(ttl));
    }

    public Instant now() {
        return clock.instant();
    }

    public int size() {
        return store.size();
    }
}
