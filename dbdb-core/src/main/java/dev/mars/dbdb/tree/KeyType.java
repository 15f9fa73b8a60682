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

import dev.mars.dbdb.storage.StorageFile.MalformedRecordException;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.Objects;

/**
 * Ordering and type-tagged binary encoding of tree keys.
 * <p>
 * Every encoded key starts with a one-byte tag so a store written with one key
 * type is rejected, rather than misread, when opened with another:
 * <pre>
 * TAG(1) + LEN(4) + KEY_BYTES(LEN)
 *
 * 1 = signed 64-bit integer   (8 bytes, big-endian)
 * 2 = unsigned 64-bit integer (8 bytes, big-endian)
 * 3 = UTF-8 string            (LEN bytes)
 * 4 = IEEE-754 double         (8 bytes, big-endian)
 * </pre>
 *
 * @param <K> the key type
 */
public abstract class KeyType<K> implements Comparator<K> {

    static final byte TAG_SIGNED = 1;
    static final byte TAG_UNSIGNED = 2;
    static final byte TAG_STRING = 3;
    static final byte TAG_DOUBLE = 4;

    private static final int NUMERIC_LENGTH = 8;

    /** Signed {@code long} keys in natural order. */
    public static final KeyType<Long> LONG = new KeyType<>("LONG") {
        @Override
        public int compare(Long a, Long b) {
            return Long.compare(a, b);
        }

        @Override
        byte[] encode(Long key) {
            return tagged(TAG_SIGNED, longBytes(key));
        }

        @Override
        Long decode(byte tag, byte[] bytes) {
            expectTag(tag, TAG_SIGNED);
            return readLong(bytes);
        }
    };

    /** {@code long} keys compared as unsigned 64-bit integers. */
    public static final KeyType<Long> UNSIGNED_LONG = new KeyType<>("UNSIGNED_LONG") {
        @Override
        public int compare(Long a, Long b) {
            return Long.compareUnsigned(a, b);
        }

        @Override
        byte[] encode(Long key) {
            return tagged(TAG_UNSIGNED, longBytes(key));
        }

        @Override
        Long decode(byte tag, byte[] bytes) {
            expectTag(tag, TAG_UNSIGNED);
            return readLong(bytes);
        }
    };

    /**
     * String keys in {@link String#compareTo(String)} order, stored as UTF-8.
     * Strings with unpaired surrogates are rejected.
     */
    public static final KeyType<String> STRING = new KeyType<>("STRING") {
        @Override
        public int compare(String a, String b) {
            return a.compareTo(b);
        }

        /**
         * Rejects strings UTF-8 cannot represent, such as unpaired surrogates,
         * which would otherwise be stored as a different key.
         */
        @Override
        String canonical(String key) {
            Objects.requireNonNull(key, "key");
            CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            try {
                encoder.encode(CharBuffer.wrap(key));
            } catch (CharacterCodingException e) {
                throw new IllegalArgumentException("Key cannot be encoded as UTF-8: " + e.getMessage(), e);
            }
            return key;
        }

        @Override
        byte[] encode(String key) {
            return tagged(TAG_STRING, key.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        String decode(byte tag, byte[] bytes) {
            expectTag(tag, TAG_STRING);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    };

    /**
     * Mixed integral and floating point keys in exact numeric order.
     * <p>
     * Integral values are held as {@link Long}, fractional ones as {@link Double};
     * {@code 16} and {@code 16.0} are the same key and {@code 15.5} sorts
     * between {@code 15} and {@code 16}. NaN is rejected.
     */
    public static final KeyType<Number> NUMBER = new KeyType<>("NUMBER") {
        @Override
        public int compare(Number a, Number b) {
            if (a instanceof Long && b instanceof Long) {
                return Long.compare(a.longValue(), b.longValue());
            }
            double da = a.doubleValue();
            double db = b.doubleValue();
            if (Double.isInfinite(da) || Double.isInfinite(db)) {
                return Double.compare(da, db);
            }
            return toBigDecimal(a).compareTo(toBigDecimal(b));
        }

        @Override
        Number canonical(Number key) {
            Objects.requireNonNull(key, "key");
            if (key instanceof Long) {
                return key;
            }
            if (key instanceof Integer || key instanceof Short || key instanceof Byte) {
                return key.longValue();
            }
            if (key instanceof Double || key instanceof Float) {
                double d = key.doubleValue();
                if (Double.isNaN(d)) {
                    throw new IllegalArgumentException("NaN is not a valid key");
                }
                return d;
            }
            throw new IllegalArgumentException("Unsupported numeric key type: " + key.getClass().getName());
        }

        @Override
        byte[] encode(Number key) {
            if (key instanceof Long) {
                return tagged(TAG_SIGNED, longBytes(key.longValue()));
            }
            return tagged(TAG_DOUBLE, longBytes(Double.doubleToLongBits(key.doubleValue())));
        }

        @Override
        Number decode(byte tag, byte[] bytes) {
            if (tag == TAG_SIGNED) {
                return readLong(bytes);
            }
            expectTag(tag, TAG_DOUBLE);
            return Double.longBitsToDouble(readLong(bytes));
        }
    };

    private final String name;

    private KeyType(String name) {
        this.name = name;
    }

    /**
     * Normalizes a key before it is compared or stored.
     *
     * @throws IllegalArgumentException if the key cannot be represented
     */
    K canonical(K key) {
        return Objects.requireNonNull(key, "key");
    }

    /**
     * @return the tag byte followed by the length-prefixed key bytes
     */
    abstract byte[] encode(K key);

    /**
     * @param tag   the tag byte read from the record
     * @param bytes the key bytes read from the record
     * @throws MalformedRecordException if the tag or the bytes do not fit this key type
     */
    abstract K decode(byte tag, byte[] bytes);

    @Override
    public String toString() {
        return "KeyType." + name;
    }

    // ========================================================================
    // Encoding Helpers
    // ========================================================================

    private static byte[] tagged(byte tag, byte[] keyBytes) {
        ByteBuffer buf = ByteBuffer.allocate(1 + 4 + keyBytes.length);
        buf.put(tag);
        buf.putInt(keyBytes.length);
        buf.put(keyBytes);
        return buf.array();
    }

    private static byte[] longBytes(long value) {
        return ByteBuffer.allocate(NUMERIC_LENGTH).putLong(value).array();
    }

    private static long readLong(byte[] bytes) {
        if (bytes.length != NUMERIC_LENGTH) {
            throw new MalformedRecordException("Numeric key must be " + NUMERIC_LENGTH +
                    " bytes, got " + bytes.length);
        }
        return ByteBuffer.wrap(bytes).getLong();
    }

    final void expectTag(byte actual, byte expected) {
        if (actual != expected) {
            throw new MalformedRecordException("Unexpected key tag " + actual + " for " + this +
                    " (expected " + expected + ")");
        }
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof Long) {
            return BigDecimal.valueOf(n.longValue());
        }
        return new BigDecimal(n.doubleValue());
    }
}
