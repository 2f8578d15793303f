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

import java.nio.file.Path;
import lombok.NonNull;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;

/** An embedded log-structured merge tree: a plain RocksDB instance in the default column family. */
public final class RocksDbStorage extends AbstractRocksDbStorage {
    private final RocksDB db;

    public RocksDbStorage() throws StorageException {
        super("kvbench-rocksdb-");
        this.db = open();
    }

    public RocksDbStorage(@NonNull Path dataPath) throws StorageException {
        super(dataPath, false);
        this.db = open();
    }

    private RocksDB open() throws StorageException {
        try {
            return RocksDB.open(options, absolutePath());
        } catch (RocksDBException e) {
            options.close();
            throw new StorageException("Failed to open RocksDB at " + getDataPath(), e);
        }
    }

    @Override
    public void init() {
        // the default column family always exists
    }

    @Override
    public void get(@NonNull byte[] key) throws StorageException {
        try {
            db.get(key);
        } catch (RocksDBException e) {
            throw new StorageException("get failed", e);
        }
    }

    @Override
    public void set(@NonNull byte[] key, @NonNull byte[] value) throws StorageException {
        try {
            db.put(key, value);
        } catch (RocksDBException e) {
            throw new StorageException("set failed", e);
        }
    }

    @Override
    protected void closeDatabase() {
        db.close();
    }
}
