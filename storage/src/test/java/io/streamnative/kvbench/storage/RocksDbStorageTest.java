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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RocksDbStorageTest {

    @TempDir Path dir;

    @Test
    void logStructuredSetAndGet() throws Exception {
        try (RocksDbStorage storage = new RocksDbStorage(dir.resolve("lsm"))) {
            storage.init();
            storage.set("key".getBytes(UTF_8), "value".getBytes(UTF_8));
            assertThatNoException().isThrownBy(() -> storage.get("key".getBytes(UTF_8)));
            assertThatNoException().isThrownBy(() -> storage.get("missing".getBytes(UTF_8)));
        }
        assertThat(dir.resolve("lsm")).exists();
    }

    @Test
    void transactionalRequiresInit() throws Exception {
        try (TransactionalRocksDbStorage storage =
                new TransactionalRocksDbStorage(dir.resolve("txn"))) {
            assertThatThrownBy(() -> storage.set("k".getBytes(UTF_8), "v".getBytes(UTF_8)))
                    .isInstanceOf(StorageException.class)
                    .hasMessageContaining("init()");
            storage.init();
            storage.init();
            storage.set("k".getBytes(UTF_8), "v".getBytes(UTF_8));
            assertThatNoException().isThrownBy(() -> storage.get("k".getBytes(UTF_8)));
        }
    }

    @Test
    void temporaryDirectoryIsRemovedOnClose() throws Exception {
        Path dataPath;
        try (RocksDbStorage storage = new RocksDbStorage()) {
            dataPath = storage.getDataPath();
            storage.set(new byte[] {1}, new byte[] {2});
            assertThat(Files.isDirectory(dataPath)).isTrue();
        }
        assertThat(dataPath).doesNotExist();
    }
}
