package com.ai.salon.component;

import com.ai.salon.config.SalonProperties;
import com.ai.salon.conversation.BookingSession;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Live booking sessions keyed by the runtime's opaque session handle. A session nobody
 * has touched for the idle timeout counts as abandoned and is dropped.
 */
@Component
public class BookingSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(BookingSessionRegistry.class);

    private final Cache<String, BookingSession> sessions;

    @Autowired
    public BookingSessionRegistry(SalonProperties properties) {
        this(properties.getSessionIdleTimeout(), Ticker.systemTicker());
    }

    BookingSessionRegistry(Duration idleTimeout, Ticker ticker) {
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(idleTimeout)
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String id, BookingSession session, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED && session != null) {
                        log.info("[{}] Booking session abandoned after {} idle, state={}",
                                id, idleTimeout, session.getConversationState());
                    }
                })
                .build();
    }

    public BookingSession getOrCreate(String sessionId) {
        return sessions.get(sessionId, id -> {
            log.info("[{}] Booking session started", id);
            return new BookingSession(id);
        });
    }

    public Optional<BookingSession> find(String sessionId) {
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    public boolean end(String sessionId) {
        BookingSession removed = sessions.asMap().remove(sessionId);
        if (removed != null) {
            log.info("[{}] Booking session ended, state={}", sessionId, removed.getConversationState());
        }
        return removed != null;
    }

    public int size() {
        sessions.cleanUp();
        return (int) sessions.estimatedSize();
    }

    /**
     * Drops expired sessions even when no conversation is active.
     */
    @Scheduled(fixedDelayString = "${salon.session-sweep-interval:PT1M}")
    public void evictIdle() {
        sessions.cleanUp();
    }
}
