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

import java.util.NoSuchElementException;

/**
 * Thrown when a lookup reaches a null reference before finding its key,
 * or when the requested child of a found key is null.
 */
public class KeyNotFoundException extends NoSuchElementException {

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("Key not found: " + key);
        this.key = key;
    }

    public KeyNotFoundException(Object key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * @return the key that was looked up, or null when the lookup had none
     */
    public Object getKey() {
        return key;
    }
}
