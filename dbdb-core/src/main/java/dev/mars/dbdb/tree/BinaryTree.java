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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Copy-on-write binary search tree over a {@link Storage}.
 * <p>
 * Every {@link #set} builds a new path from the root down to the changed node
 * and reuses every other subtree by reference. The new root lives only in
 * memory until {@link #commit()} stores the dirty path and publishes its
 * address.
 * <p>
 * <b>Visibility:</b> read operations re-read the committed root address first,
 * unless this handle holds the writer lock, in which case they see its own
 * uncommitted changes. A reader therefore always sees the latest committed
 * tree and never a half-written one.
 * <p>
 * The tree is not rebalanced. Inserting keys in sorted order produces a chain.
 *
 * @param <K> the key type
 */
public final class BinaryTree<K> {

    private static final Logger LOG = LoggerFactory.getLogger(BinaryTree.class);

    private final Storage storage;
    private final KeyType<K> keyType;
    private volatile NodeRef<K> rootRef;

    public BinaryTree(Storage storage, KeyType<K> keyType) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        refreshTreeRef();
    }

    public KeyType<K> keyType() {
        return keyType;
    }

    // ========================================================================
    // Writes
    // ========================================================================

    /**
     * Sets the value of a key, replacing the in-memory root.
     * <p>
     * Takes the writer lock; if the lock was not already held the root is
     * re-read first so committed changes of other writers are not lost.
     */
    public synchronized void set(K key, String value) {
        K k = keyType.canonical(key);
        Objects.requireNonNull(value, "value");
        if (storage.lock()) {
            refreshTreeRef();
        }
        Node<K> node = follow(rootRef);
        rootRef = insert(node, k, new ValueRef(value));
    }

    /**
     * Stores the dirty path and publishes the new root. Releases the writer lock.
     * <p>
     * A handle that does not hold the writer lock has nothing to publish and
     * returns without touching the file.
     */
    public synchronized void commit() {
        if (!storage.isLocked()) {
            LOG.debug("Nothing to commit: writer lock not held");
            return;
        }
        NodeRef<K> root = rootRef;
        root.store(storage);
        storage.commitRootAddress(root.address());
        LOG.debug("Committed tree root at address {}", root.address());
    }

    /**
     * Not supported: a cheap delete cannot be offered by balanced variants of
     * this tree, so the unbalanced tree does not offer one either.
     *
     * @throws UnsupportedOperationException always
     */
    public void delete(K key) {
        throw new UnsupportedOperationException("delete is not supported (key: " + key + ")");
    }

    private NodeRef<K> insert(Node<K> node, K key, ValueRef value) {
        Node<K> newNode;
        if (node == null) {
            newNode = Node.leaf(keyType, key, value);
        } else {
            int cmp = keyType.compare(key, node.key());
            if (cmp < 0) {
                newNode = node.withLeft(insert(follow(node.left()), key, value));
            } else if (cmp > 0) {
                newNode = node.withRight(insert(follow(node.right()), key, value));
            } else {
                newNode = node.withValue(value);
            }
        }
        return new NodeRef<>(keyType, newNode);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    /**
     * @throws KeyNotFoundException if the key is not in the tree
     */
    public String get(K key) {
        K k = keyType.canonical(key);
        return follow(find(readRoot(), k).value());
    }

    /**
     * @return the value of the smallest key
     * @throws KeyNotFoundException if the tree is empty
     */
    public String getMin() {
        Node<K> node = nonEmpty(readRoot());
        Node<K> next;
        while ((next = follow(node.left())) != null) {
            node = next;
        }
        return follow(node.value());
    }

    /**
     * @return the value of the largest key
     * @throws KeyNotFoundException if the tree is empty
     */
    public String getMax() {
        Node<K> node = nonEmpty(readRoot());
        Node<K> next;
        while ((next = follow(node.right())) != null) {
            node = next;
        }
        return follow(node.value());
    }

    /**
     * Returns the immediate left child of the node holding {@code key}.
     * This is the in-order predecessor only when that child has no right subtree.
     *
     * @throws KeyNotFoundException if the key is missing or has no left child
     */
    public Entry<K> getLeft(K key) {
        return child(key, true);
    }

    /**
     * Returns the immediate right child of the node holding {@code key}.
     *
     * @throws KeyNotFoundException if the key is missing or has no right child
     */
    public Entry<K> getRight(K key) {
        return child(key, false);
    }

    /**
     * Returns every entry with a key less than or equal to {@code threshold}.
     * <p>
     * Descends towards the threshold, remembering each node where the descent
     * turned right onto a non-null child, then the last node visited. For each
     * remembered node in descent order the result gets the node itself, if it
     * qualifies, followed by its whole left subtree in order. Cost is the tree
     * height plus the size of the result. The result is not sorted.
     *
     * @return the qualifying entries; empty for an empty tree
     */
    public List<Entry<K>> chop(K threshold) {
        K t = keyType.canonical(threshold);

        List<Node<K>> expandPoints = new ArrayList<>();
        Node<K> node = readRoot();
        Node<K> last = null;
        while (node != null) {
            last = node;
            int cmp = keyType.compare(t, node.key());
            if (cmp < 0) {
                node = follow(node.left());
            } else if (cmp > 0) {
                Node<K> right = follow(node.right());
                if (right != null) {
                    expandPoints.add(node);
                }
                node = right;
            } else {
                node = null;
            }
        }
        if (last == null) {
            return new ArrayList<>();
        }
        expandPoints.add(last);

        List<Entry<K>> out = new ArrayList<>();
        for (Node<K> point : expandPoints) {
            if (keyType.compare(point.key(), t) <= 0) {
                out.add(entry(point));
            }
            out.addAll(traverseInOrder(follow(point.left())));
        }
        LOG.trace("chop({}) expanded {} nodes into {} entries", t, expandPoints.size(), out.size());
        return out;
    }

    /**
     * In-order walk of the subtree rooted at {@code node}.
     *
     * @param node the subtree root, may be null
     * @return entries in ascending key order; empty for a null node
     */
    public List<Entry<K>> traverseInOrder(Node<K> node) {
        List<Entry<K>> out = new ArrayList<>();
        Deque<Node<K>> stack = new ArrayDeque<>();
        Node<K> current = node;
        while (current != null || !stack.isEmpty()) {
            while (current != null) {
                stack.push(current);
                current = follow(current.left());
            }
            current = stack.pop();
            out.add(entry(current));
            current = follow(current.right());
        }
        return out;
    }

    /**
     * @return every entry of the current tree in ascending key order
     */
    public List<Entry<K>> entries() {
        return traverseInOrder(readRoot());
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /** The current root node, or null for an empty tree. */
    Node<K> root() {
        return follow(rootRef);
    }

    /** The current root reference. */
    NodeRef<K> rootRef() {
        return rootRef;
    }

    private Entry<K> child(K key, boolean leftSide) {
        K k = keyType.canonical(key);
        Node<K> node = find(readRoot(), k);
        Node<K> child = follow(leftSide ? node.left() : node.right());
        if (child == null) {
            throw new KeyNotFoundException(key, "Key " + key + " has no " + (leftSide ? "left" : "right") + " child");
        }
        return entry(child);
    }

    private Node<K> find(Node<K> root, K key) {
        Node<K> node = root;
        while (node != null) {
            int cmp = keyType.compare(key, node.key());
            if (cmp < 0) {
                node = follow(node.left());
            } else if (cmp > 0) {
                node = follow(node.right());
            } else {
                return node;
            }
        }
        throw new KeyNotFoundException(key);
    }

    private Node<K> nonEmpty(Node<K> root) {
        if (root == null) {
            throw new KeyNotFoundException(null, "Tree is empty");
        }
        return root;
    }

    private Entry<K> entry(Node<K> node) {
        return new Entry<>(node.key(), follow(node.value()));
    }

    /**
     * Root node a read operation works on. Without the writer lock this is the
     * committed root; with it, this handle's own uncommitted root.
     * <p>
     * The lock check and the root swap run under the same monitor as
     * {@link #set} and {@link #commit()}, so a refresh never replaces a dirty
     * root installed by a concurrent writer on this handle.
     */
    private Node<K> readRoot() {
        NodeRef<K> root;
        synchronized (this) {
            if (!storage.isLocked()) {
                refreshTreeRef();
            }
            root = rootRef;
        }
        return follow(root);
    }

    /**
     * Points the tree at the committed root. A root that is already the
     * committed one is kept, together with the nodes it has decoded.
     */
    private void refreshTreeRef() {
        long address = storage.getRootAddress();
        NodeRef<K> current = rootRef;
        if (current != null && !current.isDirty() && current.address() == address) {
            return;
        }
        LOG.debug("Refreshing tree root: address={}", address);
        rootRef = new NodeRef<>(keyType, address);
    }

    private <T> T follow(Reference<T> ref) {
        return ref.get(storage);
    }
}
