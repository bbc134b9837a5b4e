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

import org.agrona.DirectBuffer;
import org.agrona.SemanticVersion;
import org.agrona.concurrent.UnsafeBuffer;

import java.nio.ByteBuffer;

import static org.agrona.BitUtil.*;
import static org.agrona.concurrent.ringbuffer.RingBufferDescriptor.TRAILER_LENGTH;

/**
 * Description of the memory-mapped file shared between the aggregating process and its children.
 * <p>
 * File Layout
 * <pre>
 *  +-----------------------------+
 *  |          Meta Data          |
 *  +-----------------------------+
 *  |       Log Ring Buffer       |
 *  +-----------------------------+
 * </pre>
 * <p>
 * Metadata Layout {@link #TRANSPORT_VERSION}
 * <pre>
 *   0                   1                   2                   3
 *   0 1 2 3 4 5 6 7 8 9 0 1 2 3 4 5 6 7 8 9 0 1 2 3 4 5 6 7 8 9 0 1
 *  +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 *  |                   Transport Version                           |
 *  +---------------------------------------------------------------+
 *  |                         Status                                |
 *  +---------------------------------------------------------------+
 *  |                   Ring Buffer Length                          |
 *  +---------------------------------------------------------------+
 *  |                   Max Record Length                           |
 *  +---------------------------------------------------------------+
 *  |                   Minimum Level Value                         |
 *  +---------------------------------------------------------------+
 *  |                   Reserved                                    |
 *  +---------------------------------------------------------------+
 *  |                         Owner PID                             |
 *  |                                                               |
 *  +---------------------------------------------------------------+
 *  |                   Start Timestamp                             |
 *  |                                                               |
 *  +---------------------------------------------------------------+
 *  |                   Dropped Records Count                       |
 *  |                                                               |
 *  +---------------------------------------------------------------+
 * </pre>
 */
public final class TransportDescriptor
{
    /**
     * Version of the transport file stored as a {@link SemanticVersion}. Written last to signal readiness.
     */
    public static final int TRANSPORT_VERSION = SemanticVersion.compose(0, 1, 0);

    /**
     * Status value while the transport accepts records.
     */
    public static final int STATUS_OPEN = 1;

    /**
     * Status value once the transport has been closed and will not be read again.
     */
    public static final int STATUS_CLOSED = 2;

    public static final int VERSION_FIELD_OFFSET;
    public static final int STATUS_FIELD_OFFSET;
    public static final int RING_BUFFER_LENGTH_FIELD_OFFSET;
    public static final int MAX_RECORD_LENGTH_FIELD_OFFSET;
    public static final int MIN_LEVEL_FIELD_OFFSET;
    public static final int OWNER_PID_FIELD_OFFSET;
    public static final int START_TIMESTAMP_FIELD_OFFSET;
    public static final int DROPPED_COUNT_FIELD_OFFSET;

    static
    {
        VERSION_FIELD_OFFSET = 0;
        STATUS_FIELD_OFFSET = VERSION_FIELD_OFFSET + SIZE_OF_INT;
        RING_BUFFER_LENGTH_FIELD_OFFSET = STATUS_FIELD_OFFSET + SIZE_OF_INT;
        MAX_RECORD_LENGTH_FIELD_OFFSET = RING_BUFFER_LENGTH_FIELD_OFFSET + SIZE_OF_INT;
        MIN_LEVEL_FIELD_OFFSET = MAX_RECORD_LENGTH_FIELD_OFFSET + SIZE_OF_INT;
        OWNER_PID_FIELD_OFFSET = MIN_LEVEL_FIELD_OFFSET + SIZE_OF_INT * 2;
        START_TIMESTAMP_FIELD_OFFSET = OWNER_PID_FIELD_OFFSET + SIZE_OF_LONG;
        DROPPED_COUNT_FIELD_OFFSET = START_TIMESTAMP_FIELD_OFFSET + SIZE_OF_LONG;
    }

    /**
     * Length of the metadata header.
     */
    public static final int META_DATA_LENGTH = DROPPED_COUNT_FIELD_OFFSET + SIZE_OF_LONG;

    /**
     * Offset of the ring buffer which is aligned on a cache-line boundary.
     */
    public static final int END_OF_METADATA_OFFSET = align(META_DATA_LENGTH, CACHE_LINE_LENGTH * 2);

    private TransportDescriptor()
    {
    }

    /**
     * Compute the length of the transport file.
     *
     * @param ringBufferCapacity capacity of the ring buffer, excluding its trailer.
     * @return file length in bytes.
     */
    public static int computeFileLength(final int ringBufferCapacity)
    {
        return END_OF_METADATA_OFFSET + ringBufferCapacity + TRAILER_LENGTH;
    }

    /**
     * Fill the metadata of a new transport file. The version is not written, see {@link #signalReady(UnsafeBuffer)}.
     *
     * @param metaDataBuffer   that wraps the metadata section.
     * @param ringBufferLength total length of the ring buffer including its trailer.
     * @param maxRecordLength  maximum encoded length of a single record.
     * @param minLevelValue    int value of the lowest level producers should send.
     * @param ownerPid         of the aggregating process.
     * @param startTimestampMs at which the transport was created.
     */
    public static void fillMetaData(
        final UnsafeBuffer metaDataBuffer,
        final int ringBufferLength,
        final int maxRecordLength,
        final int minLevelValue,
        final long ownerPid,
        final long startTimestampMs)
    {
        metaDataBuffer.putInt(STATUS_FIELD_OFFSET, STATUS_OPEN);
        metaDataBuffer.putInt(RING_BUFFER_LENGTH_FIELD_OFFSET, ringBufferLength);
        metaDataBuffer.putInt(MAX_RECORD_LENGTH_FIELD_OFFSET, maxRecordLength);
        metaDataBuffer.putInt(MIN_LEVEL_FIELD_OFFSET, minLevelValue);
        metaDataBuffer.putLong(OWNER_PID_FIELD_OFFSET, ownerPid);
        metaDataBuffer.putLong(START_TIMESTAMP_FIELD_OFFSET, startTimestampMs);
        metaDataBuffer.putLong(DROPPED_COUNT_FIELD_OFFSET, 0);
    }

    /**
     * Signal that the transport is ready for producers by writing the version.
     *
     * @param metaDataBuffer for the transport file.
     */
    public static void signalReady(final UnsafeBuffer metaDataBuffer)
    {
        metaDataBuffer.putIntVolatile(VERSION_FIELD_OFFSET, TRANSPORT_VERSION);
    }

    /**
     * Create the buffer which wraps the metadata section.
     *
     * @param buffer for the transport file.
     * @return the buffer which wraps the metadata section.
     */
    public static UnsafeBuffer createMetaDataBuffer(final ByteBuffer buffer)
    {
        return new UnsafeBuffer(buffer, 0, META_DATA_LENGTH);
    }

    /**
     * Create the buffer which wraps the ring buffer section.
     *
     * @param buffer         for the transport file.
     * @param metaDataBuffer within the transport file.
     * @return the buffer which wraps the ring buffer section.
     */
    public static UnsafeBuffer createRingBuffer(final ByteBuffer buffer, final DirectBuffer metaDataBuffer)
    {
        final int ringBufferLength = metaDataBuffer.getInt(RING_BUFFER_LENGTH_FIELD_OFFSET);

        return new UnsafeBuffer(buffer, END_OF_METADATA_OFFSET, ringBufferLength);
    }

    /**
     * Check the version of a mapped transport file is compatible.
     *
     * @param version read from the file.
     * @return true if the major version matches.
     */
    public static boolean isCompatible(final int version)
    {
        return SemanticVersion.major(version) == SemanticVersion.major(TRANSPORT_VERSION);
    }
}
