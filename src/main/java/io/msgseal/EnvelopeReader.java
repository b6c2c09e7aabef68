/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.msgseal;

import static java.util.Objects.checkFromIndexSize;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;

/**
 * A forward-only cursor over the bytes of an envelope. Each read consumes bytes and advances the cursor; all bounds
 * checks happen here and fail with {@link FormatException}. The underlying array is never modified.
 */
final class EnvelopeReader {
    private final byte[] data;
    private int position;

    EnvelopeReader(byte[] data) {
        this.data = requireNonNull(data, "data");
        this.position = 0;
    }

    int position() {
        return position;
    }

    int remaining() {
        return data.length - position;
    }

    /**
     * Consumes the given literal if the remaining data starts with it.
     *
     * @param expected the expected bytes.
     * @throws FormatException if fewer bytes remain or they do not equal {@code expected}. The cursor does not move.
     */
    void expect(byte[] expected, String fieldName) {
        if (remaining() < expected.length
                || !Utils.startsWith(Arrays.copyOfRange(data, position, position + expected.length), expected)) {
            throw new FormatException("Missing " + fieldName);
        }
        position += expected.length;
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @throws FormatException if fewer than {@code length} bytes remain. The cursor does not move.
     */
    byte[] readFixedLengthBytes(int length, String fieldName) {
        Utils.require(length >= 0, "Length must not be negative");
        if (remaining() < length) {
            throw new FormatException("Truncated " + fieldName);
        }
        checkFromIndexSize(position, length, data.length);
        var bytes = Arrays.copyOfRange(data, position, position + length);
        position += length;
        return bytes;
    }

    /**
     * Reads up to {@code maxLength} bytes, or fewer if the data ends first.
     */
    byte[] readAtMost(int maxLength) {
        Utils.require(maxLength >= 0, "Length must not be negative");
        var bytes = Arrays.copyOfRange(data, position, position + Math.min(maxLength, remaining()));
        position += bytes.length;
        return bytes;
    }

    /**
     * Reads everything from the cursor to the end of the data. Returns an empty array if nothing remains.
     */
    byte[] readRemaining() {
        var bytes = Arrays.copyOfRange(data, position, data.length);
        position = data.length;
        return bytes;
    }
}
