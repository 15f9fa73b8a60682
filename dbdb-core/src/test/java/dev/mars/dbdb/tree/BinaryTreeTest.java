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
package dev.mars.dbdb.tree;

import dev.mars.dbdb.storage.Storage;
import dev.mars.dbdb.storage.StorageConfig;
import dev.mars.dbdb.storage.StorageFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link BinaryTree}: insertion, copy-on-write sharing,
 * commit visibility and the read operations.
 */
class BinaryTreeTest {

    private static final Comparator<Entry<Number>> BY_KEY =
            Comparator.<Entry<Number>, Number>comparing(Entry::key, KeyType.NUMBER);

    @TempDir
    Path tempDir;

    private Path file;
    private final List<StorageFile> opened = new ArrayList<>();

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("tree.dbdb");
    }

    @AfterEach
    void tearDown() {
        for (StorageFile storage : opened) {
            storage.close();
        }
    }

    private StorageFile open() {
        StorageFile storage = new StorageFile(file, StorageConfig.builder().build());
        opened.add(storage);
        return storage;
    }

    private BinaryTree<Number> numberTree() {
        return new BinaryTree<>(open(), KeyType.NUMBER);
    }

    private static void setAll(BinaryTree<Number> tree, long... keys) {
        for (long key : keys) {
            tree.set(key, "v" + key);
        }
    }

    // ========================================================================
    // Insertion
    // ========================================================================

    @Nested
    @DisplayName("Insertion")
    class InsertionTests {

        @Test
        @DisplayName("First key becomes the root")
        void firstKeyIsRoot() {
            BinaryTree<Number> tree = numberTree();
            tree.set(5, "five");

            assertEquals(5L, tree.root().key());
            assertEquals("five", tree.get(5));
        }

        @Test
        @DisplayName("Smaller keys go left and larger keys go right")
        void placement() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 16, 15, 17);

            assertEquals(new Entry<Number>(15L, "v15"), tree.getLeft(16));
            assertEquals(new Entry<Number>(17L, "v17"), tree.getRight(16));
        }

        @Test
        @DisplayName("Setting an existing key replaces its value without adding a node")
        void duplicateReplaces() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 2, 1, 3);
            tree.set(1, "uno");

            assertEquals("uno", tree.get(1));
            assertEquals(3, tree.entries().size());
        }

        @Test
        @DisplayName("Integer, Long and Short keys address the same entry")
        void widenedKeys() {
            BinaryTree<Number> tree = numberTree();
            tree.set(7, "int");
            tree.set((short) 7, "short");

            assertEquals("short", tree.get(7L));
            assertEquals(1, tree.entries().size());
        }

        @Test
        @DisplayName("Sorted inserts build a right-leaning chain")
        void sortedInsertsChain() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 1, 2, 3, 4);

            for (long key = 1; key <= 4; key++) {
                long k = key;
                assertThrows(KeyNotFoundException.class, () -> tree.getLeft(k));
            }
            assertEquals(new Entry<Number>(4L, "v4"), tree.getRight(3));
        }

        @Test
        @DisplayName("Null keys and values are rejected")
        void nullsRejected() {
            BinaryTree<Number> tree = numberTree();

            assertThrows(NullPointerException.class, () -> tree.set(null, "x"));
            assertThrows(NullPointerException.class, () -> tree.set(1, null));
        }

        @Test
        @DisplayName("Delete is not supported")
        void deleteUnsupported() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 1);

            assertThrows(UnsupportedOperationException.class, () -> tree.delete(1));
            assertEquals("v1", tree.get(1));
        }
    }

    // ========================================================================
    // Copy-on-Write
    // ========================================================================

    @Nested
    @DisplayName("Copy-on-Write")
    class CopyOnWriteTests {

        @Test
        @DisplayName("Insert on the right shares the untouched left subtree")
        void sharesLeftSubtree() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 8, 3, 10, 1, 6);
            Node<Number> before = tree.root();

            tree.set(14, "fourteen");
            Node<Number> after = tree.root();

            assertNotSame(before, after);
            assertSame(before.left(), after.left());
            assertSame(before.value(), after.value());
            assertNotSame(before.right(), after.right());
        }

        @Test
        @DisplayName("Old root still describes the tree before the insert")
        void oldRootUnchanged() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 8, 3);
            Node<Number> before = tree.root();

            tree.set(10, "ten");

            assertEquals(Storage.NULL_ADDRESS, before.right().address());
            assertFalse(before.right().isDirty());
            assertEquals(2, tree.traverseInOrder(before).size());
            assertEquals(3, tree.entries().size());
        }

        @Test
        @DisplayName("Commit after a second insert writes only the new path")
        void commitWritesOnlyNewPath() {
            StorageFile storage = open();
            BinaryTree<Number> tree = new BinaryTree<>(storage, KeyType.NUMBER);
            setAll(tree, 8, 3, 10, 1, 6);
            tree.commit();
            long sizeAfterFirstCommit = storage.size();
            NodeRef<Number> committedLeft = tree.root().left();

            tree.set(14, "fourteen");
            tree.commit();

            // new root node, new node 10, new node 14 and one value
            assertEquals(4, countRecords(storage, sizeAfterFirstCommit));
            assertSame(committedLeft, tree.root().left());
            assertFalse(tree.root().left().isDirty());
        }

        private int countRecords(StorageFile storage, long from) {
            int count = 0;
            long address = from;
            while (address < storage.size()) {
                address += StorageFile.INTEGER_LENGTH + storage.read(address).length;
                count++;
            }
            return count;
        }
    }

    // ========================================================================
    // Commit and Visibility
    // ========================================================================

    @Nested
    @DisplayName("Commit and Visibility")
    class CommitTests {

        @Test
        @DisplayName("Commit without pending writes does nothing")
        void commitWithoutLock() {
            StorageFile storage = open();
            BinaryTree<Number> tree = new BinaryTree<>(storage, KeyType.NUMBER);
            long size = storage.size();

            tree.commit();

            assertEquals(size, storage.size());
            assertEquals(Storage.NULL_ADDRESS, storage.getRootAddress());
        }

        @Test
        @DisplayName("Commit publishes the root and releases the writer lock")
        void commitPublishes() {
            StorageFile storage = open();
            BinaryTree<Number> tree = new BinaryTree<>(storage, KeyType.NUMBER);
            setAll(tree, 1);
            assertTrue(storage.isLocked());

            tree.commit();

            assertFalse(storage.isLocked());
            assertEquals(tree.rootRef().address(), storage.getRootAddress());
        }

        @Test
        @DisplayName("Second handle sees only committed entries")
        void readerSeesCommitted() {
            BinaryTree<Number> writer = numberTree();
            BinaryTree<Number> reader = numberTree();

            setAll(writer, 1);
            assertThrows(KeyNotFoundException.class, () -> reader.get(1));
            assertEquals("v1", writer.get(1));

            writer.commit();
            assertEquals("v1", reader.get(1));
        }

        @Test
        @DisplayName("Writer starts from the latest committed root")
        void writersDoNotLoseCommits() {
            BinaryTree<Number> first = numberTree();
            BinaryTree<Number> second = numberTree();

            setAll(first, 5);
            first.commit();
            setAll(second, 7);
            second.commit();

            assertEquals(List.of(new Entry<Number>(5L, "v5"), new Entry<Number>(7L, "v7")),
                    numberTree().entries());
        }

        @Test
        @DisplayName("Committed root keeps its decoded nodes across reads")
        void refreshKeepsCurrentRoot() {
            BinaryTree<Number> writer = numberTree();
            setAll(writer, 1, 2);
            writer.commit();

            BinaryTree<Number> reader = numberTree();
            reader.get(2);
            NodeRef<Number> root = reader.rootRef();
            reader.get(1);

            assertSame(root, reader.rootRef());
        }
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        @DisplayName("Missing key throws KeyNotFoundException carrying the key")
        void missingKey() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 1);

            KeyNotFoundException e = assertThrows(KeyNotFoundException.class, () -> tree.get(2));
            assertEquals(2L, e.getKey());
        }

        @Test
        @DisplayName("Empty tree has no min or max and chops to nothing")
        void emptyTree() {
            BinaryTree<Number> tree = numberTree();

            assertThrows(KeyNotFoundException.class, tree::getMin);
            assertThrows(KeyNotFoundException.class, tree::getMax);
            assertTrue(tree.chop(100).isEmpty());
            assertTrue(tree.entries().isEmpty());
            assertTrue(tree.traverseInOrder(null).isEmpty());
        }

        @Test
        @DisplayName("Min and max follow the leftmost and rightmost paths")
        void minAndMax() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 8, 3, 10, 1, 6, 14, 4, 7, 13);

            assertEquals("v1", tree.getMin());
            assertEquals("v14", tree.getMax());
        }

        @Test
        @DisplayName("getLeft returns the literal left child, not the predecessor")
        void literalLeftChild() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 8, 3, 10, 1, 6);

            // the in-order predecessor of 8 is 6
            assertEquals(new Entry<Number>(3L, "v3"), tree.getLeft(8));
            assertThrows(KeyNotFoundException.class, () -> tree.getLeft(10));
            assertThrows(KeyNotFoundException.class, () -> tree.getRight(99));
        }

        @Test
        @DisplayName("Entries come out in ascending key order")
        void entriesAscending() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 50, 20, 80, 10, 30, 70, 90, 25);

            List<Long> keys = tree.entries().stream()
                    .map(e -> e.key().longValue())
                    .collect(Collectors.toList());
            assertEquals(List.of(10L, 20L, 25L, 30L, 50L, 70L, 80L, 90L), keys);
        }
    }

    // ========================================================================
    // Chop
    // ========================================================================

    @Nested
    @DisplayName("Chop")
    class ChopTests {

        @Test
        @DisplayName("Chop lists nodes before their left subtrees")
        void chopOrder() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 8, 3, 10, 1, 6, 14, 4, 7, 13);

            List<Entry<Number>> expected = List.of(
                    new Entry<>(3L, "v3"), new Entry<>(1L, "v1"),
                    new Entry<>(6L, "v6"), new Entry<>(4L, "v4"));
            assertEquals(expected, tree.chop(6));
            assertEquals(expected, tree.chop(6.1));
        }

        @Test
        @DisplayName("Threshold below every key chops to nothing")
        void belowMin() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 8, 3, 10);

            assertTrue(tree.chop(0).isEmpty());
            assertTrue(tree.chop(-0.5).isEmpty());
        }

        @Test
        @DisplayName("Threshold above every key returns the whole tree")
        void aboveMax() {
            BinaryTree<Number> tree = numberTree();
            setAll(tree, 8, 3, 10, 1, 6, 14, 4, 7, 13);

            List<Entry<Number>> chopped = new ArrayList<>(tree.chop(1000));
            chopped.sort(BY_KEY);
            assertEquals(tree.entries(), chopped);
        }

        @Test
        @DisplayName("Chop matches a filtered full scan for every kind of threshold")
        void chopMatchesScan() {
            BinaryTree<Number> tree = numberTree();
            Random random = new Random(42);
            TreeSet<Long> keys = new TreeSet<>();
            while (keys.size() < 60) {
                long key = random.nextInt(500);
                if (keys.add(key)) {
                    tree.set(key, "v" + key);
                }
            }
            tree.commit();

            List<Number> thresholds = new ArrayList<>();
            thresholds.add(-1L);
            thresholds.add(keys.first() - 0.5);
            thresholds.add(keys.last() + 0.5);
            for (long key : keys) {
                thresholds.add(key);
                thresholds.add(key + 0.5);
            }

            List<Entry<Number>> all = tree.entries();
            for (Number threshold : thresholds) {
                List<Entry<Number>> expected = all.stream()
                        .filter(e -> KeyType.NUMBER.compare(e.key(), threshold) <= 0)
                        .collect(Collectors.toList());
                List<Entry<Number>> actual = new ArrayList<>(tree.chop(threshold));
                actual.sort(BY_KEY);

                assertEquals(expected, actual, "chop(" + threshold + ")");
            }
        }
    }

    // ========================================================================
    // Concurrent Access
    // ========================================================================

    @Nested
    @DisplayName("Concurrent Access")
    class ConcurrencyTests {

        @Test
        @DisplayName("set() on one thread survives a root refresh by a read on another")
        void setSurvivesConcurrentRefresh() throws Exception {
            StorageFile shared = open();
            BinaryTree<Number> setup = new BinaryTree<>(shared, KeyType.NUMBER);
            setAll(setup, 1);
            setup.commit();

            PausingStorage pausing = new PausingStorage(shared);
            BinaryTree<Number> tree = new BinaryTree<>(pausing, KeyType.NUMBER);
            pausing.pauseNextRootRead();

            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<String> read = executor.submit(() -> tree.get(1));
                assertTrue(pausing.awaitPaused(), "read must reach the root refresh");

                AtomicReference<Thread> writerThread = new AtomicReference<>();
                Future<?> write = executor.submit(() -> {
                    writerThread.set(Thread.currentThread());
                    tree.set(2, "two");
                });
                awaitBlockedOrDone(writerThread, write);

                pausing.resume();
                assertEquals("one", read.get(5, TimeUnit.SECONDS));
                write.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            assertEquals("two", tree.get(2));
            tree.commit();
            assertEquals(List.of(new Entry<Number>(1L, "v1"), new Entry<Number>(2L, "two")),
                    numberTree().entries());
        }

        @Test
        @DisplayName("Writers and readers sharing one tree lose no keys")
        void sharedTreeLosesNoKeys() throws Exception {
            BinaryTree<Number> tree = numberTree();
            int writers = 4;
            int keysPerWriter = 25;
            AtomicBoolean writing = new AtomicBoolean(true);

            ExecutorService executor = Executors.newFixedThreadPool(writers + 2);
            try {
                List<Future<?>> readers = new ArrayList<>();
                for (int r = 0; r < 2; r++) {
                    readers.add(executor.submit(() -> {
                        while (writing.get()) {
                            tree.entries();
                        }
                    }));
                }
                List<Future<?>> writes = new ArrayList<>();
                for (int w = 0; w < writers; w++) {
                    long base = w * 1000L;
                    writes.add(executor.submit(() -> {
                        for (long k = base; k < base + keysPerWriter; k++) {
                            tree.set(k, "v" + k);
                        }
                    }));
                }
                for (Future<?> f : writes) {
                    f.get(10, TimeUnit.SECONDS);
                }
                writing.set(false);
                for (Future<?> f : readers) {
                    f.get(10, TimeUnit.SECONDS);
                }
            } finally {
                writing.set(false);
                executor.shutdownNow();
            }

            tree.commit();
            assertEquals(writers * keysPerWriter, numberTree().entries().size());
        }

        /** Waits until the writer is parked on a monitor or has already finished. */
        private void awaitBlockedOrDone(AtomicReference<Thread> thread, Future<?> task) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline && !task.isDone()) {
                Thread t = thread.get();
                if (t != null && t.getState() == Thread.State.BLOCKED) {
                    return;
                }
                Thread.sleep(10);
            }
        }
    }

    /**
     * Delegating storage that can hold one caller inside {@link #getRootAddress()}.
     */
    private static final class PausingStorage implements Storage {

        private final Storage delegate;
        private final AtomicBoolean armed = new AtomicBoolean(false);
        private final CountDownLatch paused = new CountDownLatch(1);
        private final CountDownLatch resumed = new CountDownLatch(1);

        PausingStorage(Storage delegate) {
            this.delegate = delegate;
        }

        void pauseNextRootRead() {
            armed.set(true);
        }

        boolean awaitPaused() throws InterruptedException {
            return paused.await(5, TimeUnit.SECONDS);
        }

        void resume() {
            resumed.countDown();
        }

        @Override
        public long getRootAddress() {
            if (armed.compareAndSet(true, false)) {
                paused.countDown();
                try {
                    if (!resumed.await(10, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("Paused root read was never resumed");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while paused", e);
                }
            }
            return delegate.getRootAddress();
        }

        @Override
        public boolean lock() {
            return delegate.lock();
        }

        @Override
        public void unlock() {
            delegate.unlock();
        }

        @Override
        public boolean isLocked() {
            return delegate.isLocked();
        }

        @Override
        public long write(byte[] data) {
            return delegate.write(data);
        }

        @Override
        public byte[] read(long address) {
            return delegate.read(address);
        }

        @Override
        public void commitRootAddress(long address) {
            delegate.commitRootAddress(address);
        }

        @Override
        public boolean isClosed() {
            return delegate.isClosed();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
