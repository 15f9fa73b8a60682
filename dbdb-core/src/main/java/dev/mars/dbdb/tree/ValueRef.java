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

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Reference to a string value. The record payload is the UTF-8 text.
 */
public final class ValueRef extends Reference<String> {

    /** Unresolved reference to a stored value. */
    public ValueRef(long address) {
        super(null, address);
    }

    /** Dirty reference to a value not yet written. */
    public ValueRef(String value) {
        super(Objects.requireNonNull(value, "value"), 0L);
    }

    @Override
    protected byte[] toBytes(String referent) {
        return referent.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected String fromBytes(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
