package dev.pagegraph.support;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped mutual exclusion by key. Equal keys always map to the same lock; distinct keys
 * usually do not, so unrelated work proceeds in parallel.
 *
 * <p>This serializes writers inside one JVM. Across processes the unique constraints on
 * the underlying tables are the guard, and callers retry on a constraint violation.
 */
public final class KeyedLocks {

    private final ReentrantLock[] stripes;

    public KeyedLocks(int stripeCount) {
        if (stripeCount < 1) throw new IllegalArgumentException("stripeCount must be positive");
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = stripeFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(String key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return stripes[Math.floorMod(h, stripes.length)];
    }
}
