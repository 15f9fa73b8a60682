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

/**
 * A lazily resolved, write-once pointer to a record.
 * <p>
 * A reference is in one of three states:
 * <ul>
 *   <li><b>unresolved</b>: only a record address; the referent is read on first {@link #get}</li>
 *   <li><b>dirty</b>: only an in-memory referent; {@link #store} gives it an address</li>
 *   <li><b>clean</b>: both, after either of the above</li>
 * </ul>
 * A reference with neither is the null reference and resolves to {@code null}.
 * <p>
 * <b>INVARIANT:</b> the address and the referent are each assigned at most once.
 *
 * @param <T> the referent type
 */
public abstract class Reference<T> {

    private T referent;
    private long address;

    protected Reference(T referent, long address) {
        this.referent = referent;
        this.address = address;
    }

    /**
     * @return the record address, or {@link Storage#NULL_ADDRESS} while dirty or null
     */
    public synchronized long address() {
        return address;
    }

    /**
     * @return true if this reference holds an in-memory referent that has no address yet
     */
    public synchronized boolean isDirty() {
        return referent != null && address == Storage.NULL_ADDRESS;
    }

    /**
     * Resolves the referent, reading and decoding its record on first access.
     * The decoded value is cached for the lifetime of this reference.
     *
     * @return the referent, or null for the null reference
     */
    public synchronized T get(Storage storage) {
        if (referent == null && address != Storage.NULL_ADDRESS) {
            referent = fromBytes(storage.read(address));
        }
        return referent;
    }

    /**
     * Writes the referent if it has not been written yet. Idempotent.
     */
    public synchronized void store(Storage storage) {
        if (referent != null && address == Storage.NULL_ADDRESS) {
            prepareToStore(storage);
            address = storage.write(toBytes(referent));
        }
    }

    /**
     * Hook run before the referent is encoded, used to store what it points at.
     */
    protected void prepareToStore(Storage storage) {
    }

    protected abstract byte[] toBytes(T referent);

    protected abstract T fromBytes(byte[] bytes);
}
