package com.marketplace.shared.locking;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per entity id.
 *
 * Transitions on the same entity run one at a time; different entities never contend.
 * Locks are reference counted and dropped from the map once the last holder or waiter leaves,
 * so the map only contains ids with work in flight. Across instances the version check on the
 * durable write is what prevents lost updates.
 */
@Component
public class EntityLocks {

    private final ConcurrentHashMap<String, LockRef> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        LockRef ref = locks.compute(key, (k, existing) -> {
            LockRef r = existing != null ? existing : new LockRef();
            r.users++;
            return r;
        });
        ref.lock.lock();
        try {
            return action.get();
        } finally {
            ref.lock.unlock();
            locks.computeIfPresent(key, (k, r) -> --r.users == 0 ? null : r);
        }
    }

    /** Number of ids currently held or awaited. */
    public int activeKeys() {
        return locks.size();
    }

    private static final class LockRef {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
