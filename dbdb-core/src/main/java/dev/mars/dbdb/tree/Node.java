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

import java.util.Objects;

/**
 * An immutable binary tree node.
 * <p>
 * Nodes are never changed in place. The {@code with*} methods build a new node
 * that shares every other reference with this one.
 *
 * @param left  reference to the subtree of smaller keys
 * @param key   the node key
 * @param value reference to the value
 * @param right reference to the subtree of larger keys
 * @param <K>   the key type
 */
public record Node<K>(NodeRef<K> left, K key, ValueRef value, NodeRef<K> right) {

    public Node {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(right, "right");
    }

    /**
     * Creates a leaf with two null children.
     */
    public static <K> Node<K> leaf(KeyType<K> keyType, K key, ValueRef value) {
        return new Node<>(new NodeRef<>(keyType), key, value, new NodeRef<>(keyType));
    }

    public Node<K> withLeft(NodeRef<K> newLeft) {
        return new Node<>(newLeft, key, value, right);
    }

    public Node<K> withRight(NodeRef<K> newRight) {
        return new Node<>(left, key, value, newRight);
    }

    public Node<K> withValue(ValueRef newValue) {
        return new Node<>(left, key, newValue, right);
    }

    /**
     * Stores the value and both children, so their addresses are known
     * before this node is encoded.
     */
    void storeRefs(Storage storage) {
        value.store(storage);
        left.store(storage);
        right.store(storage);
    }
}
