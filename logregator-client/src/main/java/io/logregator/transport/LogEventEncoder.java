/*
 * Copyright 2014-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.logregator.transport;

import io.logregator.LogEvent;
import org.agrona.MutableDirectBuffer;

import java.time.Instant;

import static java.nio.ByteOrder.LITTLE_ENDIAN;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.agrona.BitUtil.SIZE_OF_INT;
import static org.agrona.BitUtil.SIZE_OF_LONG;

/**
 * Encodes a {@link LogEvent} into a buffer for the log transport.
 * <p>
 * Stream of values:
 * <ul>
 * <li>timestamp epoch seconds (long)</li>
 * <li>timestamp nanosecond adjustment (int)</li>
 * <li>level value (int)</li>
 * <li>process id (long)</li>
 * <li>thread id (long)</li>
 * <li>level name, logger name, thread name, source class, source method, message, exception text
 * (each a length-prefixed UTF-8 string, length {@code -1} for null)</li>
 * </ul>
 * Strings which do not fit in the remaining capacity are truncated and end with {@link #TRUNCATION_SUFFIX}.
 */
public final class LogEventEncoder
{
    /**
     * Length of the fixed-size part of an encoded event.
     */
    public static final int FIXED_HEADER_LENGTH = SIZE_OF_LONG + SIZE_OF_INT + SIZE_OF_INT + SIZE_OF_LONG * 2;

    /**
     * Number of string fields that follow the fixed header.
     */
    public static final int STRING_FIELD_COUNT = 7;

    /**
     * Smallest capacity which can hold an event where every string is empty.
     */
    public static final int MIN_ENCODED_LENGTH = FIXED_HEADER_LENGTH + STRING_FIELD_COUNT * SIZE_OF_INT;

    /**
     * Length value written for a null string.
     */
    public static final int NULL_LENGTH = -1;

    static final String TRUNCATION_SUFFIX = "...";

    private LogEventEncoder()
    {
    }

    /**
     * Encode an event.
     *
     * @param buffer   to encode into.
     * @param offset   in the buffer at which to begin.
     * @param capacity available from offset.
     * @param event    to be encoded.
     * @return the number of bytes encoded.
     */
    public static int encode(
        final MutableDirectBuffer buffer, final int offset, final int capacity, final LogEvent event)
    {
        if (capacity < MIN_ENCODED_LENGTH)
        {
            throw new IllegalArgumentException("capacity=" + capacity + " < minimum=" + MIN_ENCODED_LENGTH);
        }

        final Instant timestamp = event.timestamp();
        int encodedLength = 0;

        buffer.putLong(offset + encodedLength, timestamp.getEpochSecond(), LITTLE_ENDIAN);
        encodedLength += SIZE_OF_LONG;

        buffer.putInt(offset + encodedLength, timestamp.getNano(), LITTLE_ENDIAN);
        encodedLength += SIZE_OF_INT;

        buffer.putInt(offset + encodedLength, event.level().intValue(), LITTLE_ENDIAN);
        encodedLength += SIZE_OF_INT;

        buffer.putLong(offset + encodedLength, event.processId(), LITTLE_ENDIAN);
        encodedLength += SIZE_OF_LONG;

        buffer.putLong(offset + encodedLength, event.threadId(), LITTLE_ENDIAN);
        encodedLength += SIZE_OF_LONG;

        int stringsRemaining = STRING_FIELD_COUNT;
        encodedLength += encodeString(
            buffer, offset + encodedLength, capacity - encodedLength, --stringsRemaining, event.level().getName());
        encodedLength += encodeString(
            buffer, offset + encodedLength, capacity - encodedLength, --stringsRemaining, event.loggerName());
        encodedLength += encodeString(
            buffer, offset + encodedLength, capacity - encodedLength, --stringsRemaining, event.threadName());
        encodedLength += encodeString(
            buffer, offset + encodedLength, capacity - encodedLength, --stringsRemaining, event.sourceClassName());
        encodedLength += encodeString(
            buffer, offset + encodedLength, capacity - encodedLength, --stringsRemaining, event.sourceMethodName());
        encodedLength += encodeString(
            buffer, offset + encodedLength, capacity - encodedLength, --stringsRemaining, event.message());
        encodedLength += encodeString(
            buffer, offset + encodedLength, capacity - encodedLength, --stringsRemaining, event.exceptionText());

        return encodedLength;
    }

    static int encodeString(
        final MutableDirectBuffer buffer,
        final int offset,
        final int remainingCapacity,
        final int fieldsAfter,
        final String value)
    {
        if (null == value)
        {
            buffer.putInt(offset, NULL_LENGTH, LITTLE_ENDIAN);
            return SIZE_OF_INT;
        }

        final int maxLength = remainingCapacity - SIZE_OF_INT - (fieldsAfter * SIZE_OF_INT);
        final byte[] bytes = value.getBytes(UTF_8);

        if (bytes.length <= maxLength)
        {
            buffer.putInt(offset, bytes.length, LITTLE_ENDIAN);
            buffer.putBytes(offset + SIZE_OF_INT, bytes);
            return SIZE_OF_INT + bytes.length;
        }

        final byte[] suffix = TRUNCATION_SUFFIX.getBytes(UTF_8);
        if (maxLength < suffix.length)
        {
            final int length = utf8Boundary(bytes, Math.max(maxLength, 0));
            buffer.putInt(offset, length, LITTLE_ENDIAN);
            buffer.putBytes(offset + SIZE_OF_INT, bytes, 0, length);
            return SIZE_OF_INT + length;
        }

        final int length = utf8Boundary(bytes, maxLength - suffix.length);
        buffer.putInt(offset, length + suffix.length, LITTLE_ENDIAN);
        buffer.putBytes(offset + SIZE_OF_INT, bytes, 0, length);
        buffer.putBytes(offset + SIZE_OF_INT + length, suffix);

        return SIZE_OF_INT + length + suffix.length;
    }

    private static int utf8Boundary(final byte[] bytes, final int limit)
    {
        int length = limit;
        while (length > 0 && (bytes[length] & 0xC0) == 0x80)
        {
            length--;
        }

        return length;
    }
}
