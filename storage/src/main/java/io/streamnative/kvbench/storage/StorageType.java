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

import static java.util.Objects.requireNonNull;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum StorageType {
    MEM_BTREE("mem-btree"),
    ROCKSDB_TXN("rocksdb-txn"),
    ROCKSDB("rocksdb");

    @Getter private final String displayName;

    public static StorageType fromString(String type) {
        requireNonNull(type);
        final String normalized = type.toLowerCase(Locale.ROOT);
        for (StorageType sType : StorageType.values()) {
            if (sType.displayName.equals(normalized)
                    || sType.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return sType;
            }
        }
        throw new IllegalArgumentException("unknown storage type:" + type);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
