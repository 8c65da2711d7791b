package com.matcast.server.service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.matcast.server.exception.MatchBusyException;

/**
 * Serializes mutations of the same match.
 *
 * In-process: a fixed array of striped {@link ReentrantLock}s indexed by the
 * match id hash. Two matches may share a stripe; that only costs contention.
 *
 * Cross-process (optional, {@code matcast.match.distributed-lock.enabled}):
 * a Redisson {@link RLock} per match taken inside the local lock, with the
 * same tryLock(wait, lease) shape used for matchmaking pairs. Without it the
 * {@code @Version} column on the match row is the only cross-process guard.
 */
@Component
public class MatchLockManager {

    private static final Logger log = LoggerFactory.getLogger(MatchLockManager.class);
    private static final int STRIPES = 64;
    private static final String LOCK_PREFIX = "matcast:lock:match:";

    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];
    private final RedissonClient redisson;  // null when the distributed lock is off
    private final long waitMs;
    private final long leaseMs;

    @Autowired
    public MatchLockManager(ObjectProvider<RedissonClient> redissonProvider,
                            @Value("${matcast.match.distributed-lock.enabled:false}") boolean distributed,
                            @Value("${matcast.match.distributed-lock.wait-ms:500}") long waitMs,
                            @Value("${matcast.match.distributed-lock.lease-ms:3000}") long leaseMs) {
        this(distributed ? redissonProvider.getIfAvailable() : null, waitMs, leaseMs);
        if (distributed && this.redisson == null) {
            log.warn("[Lock] Distributed match lock enabled but no RedissonClient bean; using local locks only");
        }
    }

    MatchLockManager(RedissonClient redisson, long waitMs, long leaseMs) {
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.redisson = redisson;
        this.waitMs = waitMs;
        this.leaseMs = leaseMs;
    }

    /** Lock manager without a distributed lock, for single-process use. */
    public static MatchLockManager localOnly() {
        return new MatchLockManager(null, 0, 0);
    }

    public <T> T withMatchLock(String matchId, Supplier<T> action) {
        ReentrantLock local = stripeFor(matchId);
        local.lock();
        try {
            if (redisson == null) {
                return action.get();
            }
            return withDistributedLock(matchId, action);
        } finally {
            local.unlock();
        }
    }

    private <T> T withDistributedLock(String matchId, Supplier<T> action) {
        RLock lock = redisson.getLock(LOCK_PREFIX + matchId);
        try {
            if (!lock.tryLock(waitMs, leaseMs, TimeUnit.MILLISECONDS)) {
                log.warn("[Lock] Timeout acquiring distributed lock for match {}", matchId);
                throw new MatchBusyException(matchId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MatchBusyException(matchId);
        }
        try {
            return action.get();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    private ReentrantLock stripeFor(String matchId) {
        return stripes[Math.floorMod(matchId.hashCode(), STRIPES)];
    }
}
