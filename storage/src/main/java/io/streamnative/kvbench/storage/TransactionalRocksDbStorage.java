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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.nio.file.Path;
import lombok.NonNull;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.Transaction;
import org.rocksdb.TransactionDB;
import org.rocksdb.TransactionDBOptions;
import org.rocksdb.WriteOptions;

/**
 * An embedded transactional store. Every write runs in its own committed transaction against the
 * {@value #TABLE} column family, every read opens a transaction and discards it.
 *
 * <p>Pessimistic locking is used so that concurrent writers of the same hot key wait for each other
 * instead of failing on commit.
 */
public final class TransactionalRocksDbStorage extends AbstractRocksDbStorage {
    static final String TABLE = "data";

    private final TransactionDBOptions txnDbOptions;
    private final WriteOptions writeOptions;
    private final ReadOptions readOptions;
    private final TransactionDB db;
    private volatile ColumnFamilyHandle table;

    public TransactionalRocksDbStorage() throws StorageException {
        super("kvbench-rocksdb-txn-");
        this.txnDbOptions = new TransactionDBOptions();
        this.writeOptions = new WriteOptions();
        this.readOptions = new ReadOptions();
        this.db = open();
    }

    public TransactionalRocksDbStorage(@NonNull Path dataPath) throws StorageException {
        super(dataPath, false);
        this.txnDbOptions = new TransactionDBOptions();
        this.writeOptions = new WriteOptions();
        this.readOptions = new ReadOptions();
        this.db = open();
    }

    private TransactionDB open() throws StorageException {
        try {
            return TransactionDB.open(options, txnDbOptions, absolutePath());
        } catch (RocksDBException e) {
            closeOptions();
            options.close();
            throw new StorageException("Failed to open transactional RocksDB at " + getDataPath(), e);
        }
    }

    @Override
    public synchronized void init() throws StorageException {
        if (table != null) {
            return;
        }
        try {
            table = db.createColumnFamily(new ColumnFamilyDescriptor(TABLE.getBytes(UTF_8)));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to create table " + TABLE, e);
        }
    }

    @Override
    public void get(@NonNull byte[] key) throws StorageException {
        final ColumnFamilyHandle t = requireTable();
        try (Transaction txn = db.beginTransaction(writeOptions)) {
            txn.get(t, readOptions, key);
            txn.rollback();
        } catch (RocksDBException e) {
            throw new StorageException("get failed", e);
        }
    }

    @Override
    public void set(@NonNull byte[] key, @NonNull byte[] value) throws StorageException {
        final ColumnFamilyHandle t = requireTable();
        try (Transaction txn = db.beginTransaction(writeOptions)) {
            txn.put(t, key, value);
            txn.commit();
        } catch (RocksDBException e) {
            throw new StorageException("set failed", e);
        }
    }

    private ColumnFamilyHandle requireTable() throws StorageException {
        final ColumnFamilyHandle t = table;
        if (t == null) {
            throw new StorageException("Table " + TABLE + " does not exist, init() was not called");
        }
        return t;
    }

    private void closeOptions() {
        readOptions.close();
        writeOptions.close();
        txnDbOptions.close();
    }

    @Override
    protected void closeDatabase() {
        try {
            if (table != null) {
                table.close();
            }
            db.close();
        } finally {
            closeOptions();
        }
    }
}
