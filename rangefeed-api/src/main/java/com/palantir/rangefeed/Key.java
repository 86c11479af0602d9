/*
 * (c) Copyright 2024 Palantir Technologies Inc. All rights reserved.
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

package com.palantir.rangefeed;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.UnsignedBytes;
import com.palantir.logsafe.Unsafe;
import java.nio.charset.StandardCharsets;
import org.immutables.value.Value;

/**
 * A row key, ordered by unsigned lexicographic comparison of its bytes. The empty key sorts first.
 */
@Unsafe
@Value.Immutable
public abstract class Key implements Comparable<Key> {
    public static final Key MIN = of(new byte[0]);

    @Value.Parameter
    public abstract byte[] bytes();

    public static Key of(byte[] bytes) {
        return ImmutableKey.of(bytes);
    }

    public static Key of(String key) {
        return of(key.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isEmpty() {
        return bytes().length == 0;
    }

    /**
     * The smallest key sorting strictly after this one.
     */
    public Key next() {
        byte[] current = bytes();
        byte[] next = new byte[current.length + 1];
        System.arraycopy(current, 0, next, 0, current.length);
        return of(next);
    }

    @Override
    public int compareTo(Key other) {
        return UnsignedBytes.lexicographicalComparator().compare(bytes(), other.bytes());
    }

    @Override
    public String toString() {
        byte[] bytes = bytes();
        for (byte b : bytes) {
            if (b < 0x20 || b > 0x7e) {
                return "0x" + BaseEncoding.base16().lowerCase().encode(bytes);
            }
        }
        return new String(bytes, StandardCharsets.US_ASCII);
    }
}
