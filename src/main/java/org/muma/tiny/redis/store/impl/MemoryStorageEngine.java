package org.muma.tiny.redis.store.impl;

import org.muma.tiny.redis.store.StorageEngine;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存存储引擎
 * 一个 HashMap 加一把读写锁：GET 共享读锁，SET / DEL 独占写锁。
 * 一次 DEL 的多个 key 在同一次加锁内删除，其他连接看不到删了一半的状态。
 */
public class MemoryStorageEngine implements StorageEngine {

    private final Map<String, String> memoryDb = new HashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    @Override
    public String get(String key) {
        readLock.lock();
        try {
            return memoryDb.get(key);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void set(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        writeLock.lock();
        try {
            memoryDb.put(key, value);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public long del(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        writeLock.lock();
        try {
            long deleted = 0;
            for (String key : keys) {
                if (memoryDb.remove(key) != null) {
                    deleted++;
                }
            }
            return deleted;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int size() {
        readLock.lock();
        try {
            return memoryDb.size();
        } finally {
            readLock.unlock();
        }
    }
}
