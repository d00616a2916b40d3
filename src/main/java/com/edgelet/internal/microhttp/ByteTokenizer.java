/**
 * MIT License
 *
 * Copyright (c) 2022 Elliot Barlas
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.edgelet.internal.microhttp;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Expandable first-in first-out byte array. Bytes read off a socket are appended at the tail and
 * the request parser consumes delimited or fixed-length tokens from the head.
 * <p>
 * A delimiter search that fails remembers how far it got, so a request head arriving in many
 * small reads is scanned once rather than once per read.
 */
class ByteTokenizer {

    private static final int INITIAL_CAPACITY = 1_024;

    private byte[] array = new byte[0];
    private int position;
    private int size;
    // First index not yet ruled out as the start of the last delimiter searched for
    private int scanFrom;
    private byte[] scanDelimiter;

    int size() {
        return size;
    }

    int remaining() {
        return size - position;
    }

    /**
     * Drops consumed bytes so the next request starts at index 0.
     */
    void compact() {
        if (position == 0) {
            return;
        }
        System.arraycopy(array, position, array, 0, size - position);
        size -= position;
        scanFrom = Math.max(0, scanFrom - position);
        position = 0;
    }

    void add(ByteBuffer buffer) {
        int length = buffer.remaining();
        ensureCapacity(size + length);
        buffer.get(array, size, length);
        size += length;
    }

    void add(byte[] bytes) {
        ensureCapacity(size + bytes.length);
        System.arraycopy(bytes, 0, array, size, bytes.length);
        size += bytes.length;
    }

    /**
     * Takes exactly {@code length} bytes, or returns {@code null} without consuming anything.
     */
    byte[] next(int length) {
        if (remaining() < length) {
            return null;
        }
        byte[] token = Arrays.copyOfRange(array, position, position + length);
        consume(length);
        return token;
    }

    /**
     * Takes the bytes before the next {@code delimiter} and skips the delimiter, or returns
     * {@code null} without consuming anything if the delimiter has not arrived yet.
     */
    byte[] next(byte[] delimiter) {
        int index = indexOf(delimiter);
        if (index < 0) {
            return null;
        }
        byte[] token = Arrays.copyOfRange(array, position, index);
        consume(index + delimiter.length - position);
        return token;
    }

    private void consume(int length) {
        position += length;
        scanDelimiter = null;
    }

    private int indexOf(byte[] delimiter) {
        int start = delimiter == scanDelimiter ? Math.max(scanFrom, position) : position;
        int last = size - delimiter.length;
        for (int i = start; i <= last; i++) {
            if (Arrays.equals(delimiter, 0, delimiter.length, array, i, i + delimiter.length)) {
                return i;
            }
        }
        scanDelimiter = delimiter;
        scanFrom = Math.max(position, last + 1);
        return -1;
    }

    private void ensureCapacity(int capacity) {
        if (array.length < capacity) {
            array = Arrays.copyOf(array, Math.max(capacity, Math.max(INITIAL_CAPACITY, array.length * 2)));
        }
    }

}
