package com.demo.multisig.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutex per key, created on demand and dropped once no thread holds or waits
 * for it. Every check-then-mutate-then-persist sequence on a proposal or an
 * account runs inside {@link #withLock}; different keys never contend.
 */
@Component
public class KeyedLocks {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, e) -> {
            Entry held = e == null ? new Entry() : e;
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.compute(key, (k, e) -> {
                if (e == null) return null;
                e.users--;
                return e.users == 0 ? null : e;
            });
        }
    }

    public void run(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    int size() {
        return locks.size();
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-bin lock inside compute()
        int users;
    }
}
