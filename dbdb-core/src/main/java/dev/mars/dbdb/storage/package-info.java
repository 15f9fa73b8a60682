/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
/**
 * DBDB Storage Layer - single-file record store.
 * <p>
 * This package provides the persistence layer underneath the tree:
 * <ul>
 *   <li>{@link dev.mars.dbdb.storage.Storage} - The storage interface</li>
 *   <li>{@link dev.mars.dbdb.storage.StorageFile} - File-based implementation</li>
 *   <li>{@link dev.mars.dbdb.storage.StorageConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Write-once records:</b> Records are appended and never overwritten</li>
 *   <li><b>Single mutable cell:</b> Only the root address in the superblock changes</li>
 *   <li><b>Commit barrier:</b> Records are forced to disk before the root that reaches them</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * store.dbdb
 *  ├─ [0, 4096)     superblock: root address (u64) + zero padding
 *  └─ [4096, EOF)   records: LENGTH(8) + PAYLOAD(LENGTH)
 * </pre>
 *
 * @see dev.mars.dbdb.storage.Storage
 */
package dev.mars.dbdb.storage;
