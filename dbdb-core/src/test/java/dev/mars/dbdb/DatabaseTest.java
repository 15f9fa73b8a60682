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
import dev.mars.dbdb.storage.StorageFile.MalformedRecordException;
import dev.mars.dbdb.tree.Entry;
import dev.mars.dbdb.tree.KeyNotFoundException;
import dev.mars.dbdb.tree.KeyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link Database}.
 */
class DatabaseTest {

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("test.dbdb");
    }

    private Database<Number> connect() {
        return Database.connect(file, KeyType.NUMBER, StorageConfig.builder().build());
    }

    // ========================================================================
    // Basic Scenario
    // ========================================================================

    @Nested
    @DisplayName("Three Keys")
    class ThreeKeyTests {

        @Test
        @DisplayName("Committed keys are readable after reopening")
        void committedKeysPersist() {
            try (Database<Number> db = connect()) {
                db.set(16, "big");
                db.set(15, "med");
                db.set(14, "sml");
                db.commit();
            }

            try (Database<Number> db = connect()) {
                assertEquals("big", db.get(16));
                assertEquals("sml", db.getMin());
                assertEquals("big", db.getMax());
                assertEquals(new Entry<Number>(15L, "med"), db.getLeft(16));
                assertEquals(new Entry<Number>(14L, "sml"), db.getLeft(15));
                assertEquals(List.of(new Entry<Number>(15L, "med"), new Entry<Number>(14L, "sml")),
                        db.chop(15.5));
            }
        }

        @Test
        @DisplayName("Uncommitted change is visible locally and lost on close")
        void uncommittedChangeIsLost() {
            try (Database<Number> db = connect()) {
                db.set(16, "big");
                db.set(15, "med");
                db.commit();

                db.set(16, "really big");
                assertEquals("really big", db.get(16));
            }

            try (Database<Number> db = connect()) {
                assertEquals("big", db.get(16));
            }
        }

        @Test
        @DisplayName("Each commit appends to the file and uncommitted keys never reach it")
        void commitsAppend() throws Exception {
            try (Database<Number> db = connect()) {
                db.set(1, "one");
                db.commit();
            }
            long committedSize = Files.size(file);

            try (Database<Number> db = connect()) {
                db.set(2, "two");
                db.commit();
                db.set(3, "three");
            }

            assertTrue(Files.size(file) > committedSize);
            try (Database<Number> db = connect()) {
                assertEquals(2, db.entries().size());
                assertThrows(KeyNotFoundException.class, () -> db.get(3));
            }
        }
    }

    // ========================================================================
    // Textbook Tree
    // ========================================================================

    @Nested
    @DisplayName("Nine Keys")
    class NineKeyTests {

        private void build(Database<Number> db) {
            db.set(8, "eight");
            db.set(3, "three");
            db.set(10, "ten");
            db.set(1, "one");
            db.set(6, "six");
            db.set(14, "fourteen");
            db.set(4, "four");
            db.set(7, "seven");
            db.set(13, "thirteen");
        }

        @Test
        @DisplayName("Children match the textbook tree")
        void children() {
            try (Database<Number> db = connect()) {
                build(db);
                db.commit();
            }

            try (Database<Number> db = connect()) {
                assertEquals(new Entry<Number>(3L, "three"), db.getLeft(8));
                assertEquals(new Entry<Number>(10L, "ten"), db.getRight(8));
                assertEquals(new Entry<Number>(1L, "one"), db.getLeft(3));
                assertEquals(new Entry<Number>(6L, "six"), db.getRight(3));
                assertEquals(new Entry<Number>(4L, "four"), db.getLeft(6));
                assertEquals(new Entry<Number>(7L, "seven"), db.getRight(6));
                assertEquals(new Entry<Number>(14L, "fourteen"), db.getRight(10));
                assertEquals(new Entry<Number>(13L, "thirteen"), db.getLeft(14));

                assertThrows(KeyNotFoundException.class, () -> db.getLeft(10));
                assertThrows(KeyNotFoundException.class, () -> db.getRight(14));
                assertThrows(KeyNotFoundException.class, () -> db.getLeft(1));
            }
        }

        @Test
        @DisplayName("Chop at an existing key and between keys gives the same entries")
        void chop() {
            try (Database<Number> db = connect()) {
                build(db);
                db.commit();
            }

            try (Database<Number> db = connect()) {
                List<Entry<Number>> expected = List.of(
                        new Entry<>(3L, "three"), new Entry<>(1L, "one"),
                        new Entry<>(6L, "six"), new Entry<>(4L, "four"));
                assertEquals(expected, db.chop(6));
                assertEquals(expected, db.chop(6.1));
                assertTrue(db.chop(0).isEmpty());
            }
        }

        @Test
        @DisplayName("Entries are in ascending order")
        void entries() {
            try (Database<Number> db = connect()) {
                build(db);
                assertEquals(List.of(1L, 3L, 4L, 6L, 7L, 8L, 10L, 13L, 14L),
                        db.entries().stream().map(Entry::key).toList());
            }
        }
    }

    // ========================================================================
    // Handles
    // ========================================================================

    @Nested
    @DisplayName("Handles")
    class HandleTests {

        @Test
        @DisplayName("Reader handle sees only committed state")
        void readerSeesCommitted() {
            try (Database<Number> writer = connect(); Database<Number> reader = connect()) {
                writer.set(1, "one");
                writer.commit();
                assertEquals("one", reader.get(1));

                writer.set(1, "uno");
                assertEquals("one", reader.get(1));
                assertEquals("uno", writer.get(1));

                writer.commit();
                assertEquals("uno", reader.get(1));
            }
        }

        @Test
        @DisplayName("Operations on a closed database throw DatabaseClosedException")
        void closedHandle() {
            Database<Number> db = connect();
            db.set(1, "one");
            db.close();

            assertTrue(db.isClosed());
            DatabaseClosedException e = assertThrows(DatabaseClosedException.class, () -> db.get(1));
            assertEquals("Database closed.", e.getMessage());
            assertThrows(DatabaseClosedException.class, () -> db.set(2, "two"));
            assertThrows(DatabaseClosedException.class, db::commit);
            assertThrows(DatabaseClosedException.class, db::getMin);
            assertThrows(DatabaseClosedException.class, () -> db.chop(1));
            assertThrows(DatabaseClosedException.class, () -> db.delete(1));
        }

        @Test
        @DisplayName("close() is idempotent")
        void closeTwice() {
            Database<Number> db = connect();
            db.close();
            assertDoesNotThrow(db::close);
        }

        @Test
        @DisplayName("Closing releases the writer lock for the next handle")
        void closeReleasesLock() {
            try (Database<Number> db = connect()) {
                db.set(1, "one");
            }

            try (Database<Number> db = connect()) {
                db.set(2, "two");
                db.commit();
                assertEquals(List.of(new Entry<Number>(2L, "two")), db.entries());
            }
        }

        @Test
        @DisplayName("Delete is not supported")
        void deleteUnsupported() {
            try (Database<Number> db = connect()) {
                assertThrows(UnsupportedOperationException.class, () -> db.delete(1));
            }
        }

        @Test
        @DisplayName("Default connect uses numeric keys")
        void defaultConnect() {
            try (Database<Number> db = Database.connect(file)) {
                db.set(2, "two");
                db.set(1.5, "one and a half");
                db.commit();
                assertEquals(file, db.path());
                assertEquals("one and a half", db.getMin());
            }
        }
    }

    // ========================================================================
    // Key Types
    // ========================================================================

    @Nested
    @DisplayName("Key Types")
    class KeyTypeTests {

        @Test
        @DisplayName("String keys persist and order lexicographically")
        void stringKeys() {
            try (Database<String> db = Database.connect(file, KeyType.STRING, StorageConfig.builder().build())) {
                db.set("m", "middle");
                db.set("a", "first");
                db.set("z", "last");
                db.commit();
            }

            try (Database<String> db = Database.connect(file, KeyType.STRING, StorageConfig.builder().build())) {
                assertEquals("first", db.getMin());
                assertEquals("last", db.getMax());
                assertEquals(new Entry<>("a", "first"), db.getLeft("m"));
            }
        }

        @Test
        @DisplayName("String key that UTF-8 cannot hold is rejected before anything is written")
        void unencodableStringKey() {
            try (Database<String> db = Database.connect(file, KeyType.STRING, StorageConfig.builder().build())) {
                db.set("ok", "fine");
                db.commit();

                assertThrows(IllegalArgumentException.class, () -> db.set("\uD800", "broken"));
                assertThrows(IllegalArgumentException.class, () -> db.get("\uD800"));
                assertEquals(List.of(new Entry<>("ok", "fine")), db.entries());
            }
        }

        @Test
        @DisplayName("Reopening with a different key type fails on first read")
        void keyTypeMismatch() {
            try (Database<String> db = Database.connect(file, KeyType.STRING, StorageConfig.builder().build())) {
                db.set("a", "first");
                db.commit();
            }

            try (Database<Long> db = Database.connect(file, KeyType.LONG, StorageConfig.builder().build())) {
                assertThrows(MalformedRecordException.class, () -> db.get(1L));
            }
        }
    }
}
