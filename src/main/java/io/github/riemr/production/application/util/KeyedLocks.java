package io.github.riemr.production.application.util;

import io.github.riemr.production.domain.exception.ConcurrencyConflictException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * キー単位の排他。異なるキーの処理は並行に走る。
 * 保持・待機しているスレッドがいなくなったキーはマップから外す。
 */
public class KeyedLocks<K> {
    private final String name;
    private final Map<K, Holder> locks = new ConcurrentHashMap<>();

    /** users は compute の中でのみ更新する。 */
    private static final class Holder {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    public KeyedLocks(String name) {
        this.name = name;
    }

    /** 既に他スレッドが保持していれば待たずに {@link ConcurrencyConflictException}。 */
    public <T> T tryWithLock(K key, Supplier<T> action) {
        Holder holder = acquire(key);
        if (!holder.lock.tryLock()) {
            release(key);
            throw new ConcurrencyConflictException(name + " " + key + " is already being processed");
        }
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            release(key);
        }
    }

    /** 取得できるまで待つ。 */
    public <T> T withLock(K key, Supplier<T> action) {
        Holder holder = acquire(key);
        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            release(key);
        }
    }

    public boolean isLocked(K key) {
        Holder holder = locks.get(key);
        return holder != null && holder.lock.isLocked();
    }

    /** 現在追跡しているキーの数。 */
    int size() {
        return locks.size();
    }

    private Holder acquire(K key) {
        return locks.compute(key, (k, h) -> {
            Holder holder = h != null ? h : new Holder();
            holder.users++;
            return holder;
        });
    }

    private void release(K key) {
        locks.computeIfPresent(key, (k, h) -> --h.users == 0 ? null : h);
    }
}
