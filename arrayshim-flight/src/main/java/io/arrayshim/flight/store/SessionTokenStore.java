package io.arrayshim.flight.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Sessions opened by a successful handshake, keyed by their bearer token.
 * <p>
 * Expired sessions are refused by {@link #validate(String)} but stay in the store until
 * {@link #prune(Duration)} removes them.
 */
public class SessionTokenStore {

    private final Map<String, SessionRecord> sessions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final Duration expirationAge;

    public SessionTokenStore(Clock clock, Duration expirationAge) {
        this.clock = clock;
        this.expirationAge = expirationAge;
    }

    /**
     * Opens a session for {@code identity} and returns its fresh token.
     */
    public String issue(String identity, Role role) {
        var token = RandomTokens.next();
        var record = new SessionRecord(token, identity, clock.instant(), role);
        lock.writeLock().lock();
        try {
            sessions.put(token, record);
        } finally {
            lock.writeLock().unlock();
        }
        return token;
    }

    /**
     * @throws UnauthorizedException with {@link UnauthorizedException.Reason#INVALID_TOKEN}
     *         for an unknown token and {@link UnauthorizedException.Reason#EXPIRED} for a
     *         session older than the expiration age
     */
    public SessionRecord validate(String token) throws UnauthorizedException {
        SessionRecord record;
        lock.readLock().lock();
        try {
            record = sessions.get(token);
        } finally {
            lock.readLock().unlock();
        }
        if (record == null) {
            throw new UnauthorizedException(UnauthorizedException.Reason.INVALID_TOKEN);
        }
        if (Duration.between(record.issuedAt(), clock.instant()).compareTo(expirationAge) > 0) {
            throw new UnauthorizedException(UnauthorizedException.Reason.EXPIRED);
        }
        return record;
    }

    /**
     * Removes every session issued more than {@code maxAge} ago.
     *
     * @return the number of sessions removed
     */
    public int prune(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        lock.writeLock().lock();
        try {
            int before = sessions.size();
            sessions.values().removeIf(r -> r.issuedAt().isBefore(cutoff));
            return before - sessions.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int prune() {
        return prune(expirationAge);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Duration expirationAge() {
        return expirationAge;
    }
}
