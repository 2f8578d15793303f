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

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;

/**
 * Shared lifecycle of the RocksDB backed storages: the database lives in a directory owned by the
 * storage, which is removed again on {@link #close()}.
 */
@Slf4j
abstract class AbstractRocksDbStorage implements Storage {

    static {
        RocksDB.loadLibrary();
    }

    @Getter private final Path dataPath;
    protected final Options options;
    private final boolean ownsDirectory;

    protected AbstractRocksDbStorage(@NonNull String prefix) throws StorageException {
        this(createTempDirectory(prefix), true);
    }

    protected AbstractRocksDbStorage(@NonNull Path dataPath, boolean ownsDirectory) {
        this.dataPath = dataPath;
        this.ownsDirectory = ownsDirectory;
        this.options = new Options().setCreateIfMissing(true);
    }

    /** Releases the engine specific handles. Called once, before the directory is removed. */
    protected abstract void closeDatabase();

    @Override
    public final void close() throws IOException {
        try {
            closeDatabase();
        } finally {
            options.close();
            if (ownsDirectory) {
                log.debug("Removing storage directory {}", dataPath);
                MoreFiles.deleteRecursively(dataPath, RecursiveDeleteOption.ALLOW_INSECURE);
            }
        }
    }

    protected final String absolutePath() {
        return dataPath.toAbsolutePath().toString();
    }

    private static Path createTempDirectory(String prefix) throws StorageException {
        try {
            return Files.createTempDirectory(prefix);
        } catch (IOException e) {
            throw new StorageException("Failed to create a storage directory", e);
        }
    }
}
