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
import dev.mars.dbdb.storage.StorageFile.MalformedRecordException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Reference to a tree node.
 * <p>
 * <b>Record Format:</b>
 * <pre>
 * VERSION(1) + LEFT(8) + KEY_TAG(1) + KEY_LEN(4) + KEY(var) + VALUE(8) + RIGHT(8)
 * </pre>
 * Child and value fields are record addresses; 0 marks a null child.
 * Decoding a node leaves its children unresolved.
 *
 * @param <K> the key type
 */
public final class NodeRef<K> extends Reference<Node<K>> {

    /** Node record format version */
    static final byte FORMAT_VERSION = 1;

    /** VERSION(1) + LEFT(8) + KEY_TAG(1) + KEY_LEN(4) + VALUE(8) + RIGHT(8) */
    static final int FIXED_SIZE = 1 + 8 + 1 + 4 + 8 + 8;

    private final KeyType<K> keyType;

    /** The null reference. */
    public NodeRef(KeyType<K> keyType) {
        this(keyType, null, Storage.NULL_ADDRESS);
    }

    /** Unresolved reference to a stored node. */
    public NodeRef(KeyType<K> keyType, long address) {
        this(keyType, null, address);
    }

    /** Dirty reference to a node not yet written. */
    public NodeRef(KeyType<K> keyType, Node<K> node) {
        this(keyType, Objects.requireNonNull(node, "node"), Storage.NULL_ADDRESS);
    }

    private NodeRef(KeyType<K> keyType, Node<K> node, long address) {
        super(node, address);
        this.keyType = Objects.requireNonNull(keyType, "keyType");
    }

    @Override
    protected void prepareToStore(Storage storage) {
        Node<K> node = get(storage);
        if (node != null) {
            node.storeRefs(storage);
        }
    }

    @Override
    protected byte[] toBytes(Node<K> node) {
        byte[] key = keyType.encode(node.key());
        ByteBuffer buf = ByteBuffer.allocate(1 + 8 + key.length + 8 + 8);
        buf.put(FORMAT_VERSION);
        buf.putLong(node.left().address());
        buf.put(key);
        buf.putLong(node.value().address());
        buf.putLong(node.right().address());
        return buf.array();
    }

    @Override
    protected Node<K> fromBytes(byte[] bytes) {
        if (bytes.length < FIXED_SIZE) {
            throw new MalformedRecordException("Node record too short: " + bytes.length + " bytes");
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            byte version = buf.get();
            if (version != FORMAT_VERSION) {
                throw new MalformedRecordException("Unsupported node record version: " + version);
            }
            long left = buf.getLong();
            byte tag = buf.get();
            int keyLen = buf.getInt();
            if (keyLen < 0 || keyLen != bytes.length - FIXED_SIZE) {
                throw new MalformedRecordException("Invalid key length " + keyLen +
                        " in node record of " + bytes.length + " bytes");
            }
            byte[] keyBytes = new byte[keyLen];
            buf.get(keyBytes);
            long value = buf.getLong();
            long right = buf.getLong();
            if (value == Storage.NULL_ADDRESS) {
                throw new MalformedRecordException("Node record has no value address");
            }

            return new Node<>(
                    new NodeRef<>(keyType, left),
                    keyType.decode(tag, keyBytes),
                    new ValueRef(value),
                    new NodeRef<>(keyType, right));
        } catch (BufferUnderflowException e) {
            throw new MalformedRecordException("Truncated node record of " + bytes.length + " bytes");
        }
    }
}
