package com.lastchair.service;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes mutating operations per match. The lock is held across the whole transaction,
 * commit included, so two operations on one match never interleave their writes.
 * Locks are striped: distinct matches may share a stripe, one match always maps to the same one.
 */
@Component
public class MatchLockManager {

    private static final int STRIPES = 256;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];
    private final TransactionTemplate transactionTemplate;

    public MatchLockManager(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public <T> T withMatchLock(Long matchId, Supplier<T> work) {
        ReentrantLock lock = lockFor(matchId);
        lock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(Long matchId) {
        int hash = Long.hashCode(matchId);
        return locks[Math.floorMod(hash ^ (hash >>> 16), STRIPES)];
    }
}
