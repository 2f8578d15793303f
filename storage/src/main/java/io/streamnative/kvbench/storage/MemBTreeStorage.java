/*
 * Copyright © 2022-2024 StreamNative Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.streamnative.kvbench.storage;

import java.util.Arrays;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.NonNull;

/** An in-memory ordered map guarded by a single read-write lock. */
public final class MemBTreeStorage implements Storage {
    private final TreeMap<byte[], byte[]> data = new TreeMap<>(Arrays::compareUnsigned);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void init() {
        // nothing to prepare
    }

    @Override
    public void get(@NonNull byte[] key) {
        lock.readLock().lock();
        try {
            data.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(@NonNull byte[] key, @NonNull byte[] value) {
        final byte[] k = key.clone();
        final byte[] v = value.clone();
        lock.writeLock().lock();
        try {
            data.put(k, v);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Number of distinct keys currently stored. */
    public int size() {
        lock.readLock().lock();
        try {
            return data.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Whether the key is present. */
    public boolean contains(@NonNull byte[] key) {
        lock.readLock().lock();
        try {
            return data.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            data.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
