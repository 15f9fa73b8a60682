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
package dev.mars.dbdb;

import dev.mars.dbdb.storage.StorageConfig;
import dev.mars.dbdb.storage.StorageFile;
import dev.mars.dbdb.tree.BinaryTree;
import dev.mars.dbdb.tree.Entry;
import dev.mars.dbdb.tree.KeyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.List;

/**
 * A single-file key/value database.
 * <p>
 * Reads see the latest committed state immediately. Writes become durable
 * only on {@link #commit()}; a handle closed without committing loses them.
 * <pre>{@code
 * try (Database<String> db = Database.connect(Path.of("example.dbdb"), KeyType.STRING)) {
 *     db.set("answer", "42");
 *     db.commit();
 *     db.get("answer"); // "42"
 * }
 * }</pre>
 * Once closed, every operation except {@link #close()} throws
 * {@link DatabaseClosedException}.
 *
 * @param <K> the key type
 */
public final class Database<K> implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Database.class);

    private final StorageFile storage;
    private final BinaryTree<K> tree;

    private Database(StorageFile storage, KeyType<K> keyType) {
        this.storage = storage;
        this.tree = new BinaryTree<>(storage, keyType);
    }

    /**
     * Opens a database with numeric keys, creating the file if absent.
     *
     * @see KeyType#NUMBER
     */
    public static Database<Number> connect(Path path) {
        return connect(path, KeyType.NUMBER);
    }

    /**
     * Opens a database, creating the file if absent, with configuration
     * resolved by {@link StorageConfig#load()}.
     */
    public static <K> Database<K> connect(Path path, KeyType<K> keyType) {
        return connect(path, keyType, StorageConfig.load());
    }

    /**
     * Opens a database, creating the file if absent.
     *
     * @param path    the database file
     * @param keyType key ordering and encoding; must match the one the file was written with
     * @param config  storage configuration
     */
    public static <K> Database<K> connect(Path path, KeyType<K> keyType, StorageConfig config) {
        StorageFile storage = new StorageFile(path, config);
        try {
            Database<K> db = new Database<>(storage, keyType);
            LOG.info("Connected to {} with {}", path, keyType);
            return db;
        } catch (RuntimeException e) {
            storage.close();
            throw e;
        }
    }

    public Path path() {
        return storage.path();
    }

    public boolean isClosed() {
        return storage.isClosed();
    }

    /**
     * Releases the writer lock, discarding uncommitted changes, and closes the file. Idempotent.
     */
    @Override
    public void close() {
        storage.close();
    }

    public void commit() {
        assertNotClosed();
        tree.commit();
    }

    /**
     * @throws dev.mars.dbdb.tree.KeyNotFoundException if the key is not present
     */
    public String get(K key) {
        assertNotClosed();
        return tree.get(key);
    }

    public void set(K key, String value) {
        assertNotClosed();
        tree.set(key, value);
    }

    /**
     * @throws UnsupportedOperationException always
     */
    public void delete(K key) {
        assertNotClosed();
        tree.delete(key);
    }

    public String getMin() {
        assertNotClosed();
        return tree.getMin();
    }

    public String getMax() {
        assertNotClosed();
        return tree.getMax();
    }

    public Entry<K> getLeft(K key) {
        assertNotClosed();
        return tree.getLeft(key);
    }

    public Entry<K> getRight(K key) {
        assertNotClosed();
        return tree.getRight(key);
    }

    public List<Entry<K>> chop(K threshold) {
        assertNotClosed();
        return tree.chop(threshold);
    }

    /**
     * Walks the whole tree. Meant for inspection of small databases.
     */
    public List<Entry<K>> entries() {
        assertNotClosed();
        return tree.entries();
    }

    private void assertNotClosed() {
        if (storage.isClosed()) {
            throw new DatabaseClosedException();
        }
    }
}
