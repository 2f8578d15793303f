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

import java.io.Closeable;

/**
 * The minimal capability a key-value engine exposes to the benchmark.
 *
 * <p>Implementations must accept concurrent {@link #get(byte[])} and {@link #set(byte[], byte[])}
 * calls from multiple threads. The benchmark does not coordinate access to the storage.
 */
public interface Storage extends Closeable {

    /**
     * Prepares the storage before the first write, e.g. by creating the namespace that holds the
     * records. Calling it more than once has no further effect.
     *
     * @throws StorageException if the storage could not be prepared.
     */
    void init() throws StorageException;

    /**
     * Looks up a key. The value, if any, is discarded: only the latency and the outcome of the call
     * are of interest.
     *
     * @param key the key to look up.
     * @throws StorageException if the lookup failed.
     */
    void get(byte[] key) throws StorageException;

    /**
     * Inserts or replaces the value associated with a key.
     *
     * @param key the key.
     * @param value the value.
     * @throws StorageException if the write failed.
     */
    void set(byte[] key, byte[] value) throws StorageException;
}
