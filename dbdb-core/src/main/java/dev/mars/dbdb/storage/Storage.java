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
package dev.mars.dbdb.storage;

import java.io.Closeable;

/**
 * Record storage underneath the tree.
 * <p>
 * A store is a single addressable space of write-once, length-prefixed
 * records plus one mutable cell: the root address. Everything reachable from
 * the tree is found by following record addresses from the root.
 * <p>
 * <b>Critical Contract:</b> the root address is the only state that is ever
 * overwritten. A record address handed out by {@link #write(byte[])} stays
 * valid for the lifetime of the store, and the root only ever points at
 * records that were fully written before {@link #commitRootAddress(long)}
 * was called.
 *
 * @see StorageFile
 */
public interface Storage extends Closeable {

    /** Address value meaning "no record". */
    long NULL_ADDRESS = 0L;

    // ========================================================================
    // Writer Lock
    // ========================================================================

    /**
     * Takes the exclusive writer lock if this handle does not already hold it.
     * Blocks until the lock is available.
     *
     * @return true if the lock was newly acquired, false if already held
     */
    boolean lock();

    /**
     * Releases the writer lock if held. Idempotent.
     */
    void unlock();

    /**
     * @return true while this handle holds the writer lock
     */
    boolean isLocked();

    // ========================================================================
    // Records
    // ========================================================================

    /**
     * Appends a record. Takes the writer lock and keeps it.
     *
     * @param data the record payload
     * @return the address of the new record
     */
    long write(byte[] data);

    /**
     * Reads the record at the given address. Takes no lock.
     *
     * @param address an address returned by {@link #write(byte[])} or found in a record
     * @return the record payload
     */
    byte[] read(long address);

    // ========================================================================
    // Root Address
    // ========================================================================

    /**
     * Publishes a new root address and releases the writer lock.
     * <p>
     * This is the durability barrier: records written before this call become
     * reachable only once it completes.
     *
     * @param address the address of the new root record
     */
    void commitRootAddress(long address);

    /**
     * @return the last committed root address, or {@link #NULL_ADDRESS} for an empty store
     */
    long getRootAddress();

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * @return true once {@link #close()} has been called
     */
    boolean isClosed();

    /**
     * Releases the writer lock and closes the store. Idempotent.
     */
    @Override
    void close();
}
