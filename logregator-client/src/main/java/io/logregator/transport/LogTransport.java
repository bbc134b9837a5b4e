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
import io.logregator.exceptions.LogregatorException;
import org.agrona.IoUtil;
import org.agrona.SemanticVersion;
import org.agrona.concurrent.MessageHandler;
import org.agrona.concurrent.UnsafeBuffer;
import org.agrona.concurrent.ringbuffer.ManyToOneRingBuffer;

import java.io.File;
import java.nio.MappedByteBuffer;
import java.util.logging.Level;

import static io.logregator.transport.TransportDescriptor.*;
import static org.agrona.BitUtil.CACHE_LINE_LENGTH;
import static org.agrona.BufferUtil.allocateDirectAligned;
import static org.agrona.concurrent.ringbuffer.RingBufferDescriptor.TRAILER_LENGTH;

/**
 * Many-to-one channel of {@link LogEvent}s backed by a {@link ManyToOneRingBuffer} in a memory-mapped file.
 * <p>
 * Any number of threads in any number of processes which have mapped the same file can {@link #send(LogEvent)}.
 * Exactly one thread in the owning process may {@link #receive(MessageHandler, int)}. The absolute path of the
 * file is the {@link #handle()} by which other processes {@link #connect(String)} to the same instance.
 * <p>
 * Sending never blocks. When the buffer is full, or the transport has been closed, the record is dropped and
 * the shared dropped records count is incremented.
 * <p>
 * Mappings are never unmapped explicitly as a racing producer could otherwise touch unmapped memory. They are
 * released when the transport is garbage collected.
 */
public final class LogTransport implements AutoCloseable
{
    /**
     * Message type id used for log records in the ring buffer.
     */
    public static final int LOG_EVENT_MSG_TYPE_ID = 1;

    private static final String FILE_PREFIX = "logregator-";
    private static final String FILE_SUFFIX = ".dat";

    private final boolean isOwner;
    private final File file;
    private final UnsafeBuffer metaDataBuffer;
    private final ManyToOneRingBuffer ringBuffer;
    private final int maxRecordLength;
    private final ThreadLocal<UnsafeBuffer> encodingBuffer;
    private volatile boolean isClosed;

    private LogTransport(final boolean isOwner, final File file, final MappedByteBuffer mappedBuffer)
    {
        this.isOwner = isOwner;
        this.file = file;
        metaDataBuffer = createMetaDataBuffer(mappedBuffer);
        ringBuffer = new ManyToOneRingBuffer(createRingBuffer(mappedBuffer, metaDataBuffer));
        maxRecordLength = Math.min(metaDataBuffer.getInt(MAX_RECORD_LENGTH_FIELD_OFFSET), ringBuffer.maxMsgLength());
        encodingBuffer = ThreadLocal.withInitial(
            () -> new UnsafeBuffer(allocateDirectAligned(maxRecordLength, CACHE_LINE_LENGTH)));
    }

    /**
     * Create a new transport file in a directory and take ownership of it.
     *
     * @param directory          in which to create the file.
     * @param ringBufferCapacity capacity of the ring buffer which must be a power of 2.
     * @param maxRecordLength    maximum encoded length of a single record.
     * @param minLevel           lowest level producers should send.
     * @return the new owned transport.
     */
    public static LogTransport create(
        final File directory, final int ringBufferCapacity, final int maxRecordLength, final Level minLevel)
    {
        IoUtil.ensureDirectoryExists(directory, "logregator directory");

        final long pid = ProcessHandle.current().pid();
        final File file = new File(
            directory, FILE_PREFIX + pid + "-" + Long.toHexString(System.nanoTime()) + FILE_SUFFIX);

        final MappedByteBuffer mappedBuffer = IoUtil.mapNewFile(file, computeFileLength(ringBufferCapacity));
        final UnsafeBuffer metaDataBuffer = createMetaDataBuffer(mappedBuffer);
        fillMetaData(
            metaDataBuffer,
            ringBufferCapacity + TRAILER_LENGTH,
            Math.max(maxRecordLength, LogEventEncoder.MIN_ENCODED_LENGTH),
            minLevel.intValue(),
            pid,
            System.currentTimeMillis());

        final LogTransport transport = new LogTransport(true, file, mappedBuffer);
        signalReady(metaDataBuffer);

        return transport;
    }

    /**
     * Connect to an existing transport by its handle.
     *
     * @param handle of the transport as returned from {@link #handle()}.
     * @return the connected transport which this process may only send to.
     * @throws LogregatorException if the file does not exist or is not a compatible transport.
     */
    public static LogTransport connect(final String handle)
    {
        final File file = new File(handle);
        if (!file.exists())
        {
            throw new LogregatorException("transport does not exist: " + handle, LogregatorException.Category.WARN);
        }

        final MappedByteBuffer mappedBuffer = IoUtil.mapExistingFile(file, "logregator transport");
        final UnsafeBuffer metaDataBuffer = createMetaDataBuffer(mappedBuffer);
        final int version = metaDataBuffer.getIntVolatile(VERSION_FIELD_OFFSET);

        if (0 == version)
        {
            throw new LogregatorException("transport is not ready: " + handle, LogregatorException.Category.WARN);
        }

        if (!isCompatible(version))
        {
            throw new LogregatorException(
                "transport version not compatible: app=" + SemanticVersion.toString(TRANSPORT_VERSION) +
                " file=" + SemanticVersion.toString(version));
        }

        return new LogTransport(false, file, mappedBuffer);
    }

    /**
     * Handle by which another process can {@link #connect(String)} to this transport.
     *
     * @return the absolute path of the transport file.
     */
    public String handle()
    {
        return file.getAbsolutePath();
    }

    /**
     * Is this the process which created the transport and may receive from it.
     *
     * @return true if this is the owning process.
     */
    public boolean isOwner()
    {
        return isOwner;
    }

    /**
     * Process id of the process which created the transport.
     *
     * @return process id of the owner.
     */
    public long ownerPid()
    {
        return metaDataBuffer.getLong(OWNER_PID_FIELD_OFFSET);
    }

    /**
     * Maximum encoded length of a single record. Longer messages are truncated.
     *
     * @return maximum encoded length of a single record.
     */
    public int maxRecordLength()
    {
        return maxRecordLength;
    }

    /**
     * Lowest level the owner will deliver, records below this need not be sent.
     *
     * @return lowest level the owner will deliver.
     */
    public Level minLevel()
    {
        return levelForValue(metaDataBuffer.getInt(MIN_LEVEL_FIELD_OFFSET));
    }

    /**
     * Send an event without blocking.
     *
     * @param event to be sent.
     * @return true if the event was accepted, false if it was dropped.
     */
    public boolean send(final LogEvent event)
    {
        if (!isClosed())
        {
            try
            {
                final UnsafeBuffer buffer = encodingBuffer.get();
                final int length = LogEventEncoder.encode(buffer, 0, buffer.capacity(), event);

                if (ringBuffer.write(LOG_EVENT_MSG_TYPE_ID, buffer, 0, length))
                {
                    return true;
                }
            }
            catch (final RuntimeException ex)
            {
                // emitting code must never see transport failures
                recordDropped();
                return false;
            }
        }

        recordDropped();

        return false;
    }

    /**
     * Receive up to a limit of available records without blocking. Only the owner may receive.
     *
     * @param handler    to be called for each record, see {@link LogEventDecoder}.
     * @param limit      maximum number of records to receive.
     * @return the number of records received.
     */
    public int receive(final MessageHandler handler, final int limit)
    {
        if (!isOwner)
        {
            throw new IllegalStateException("only the owner may receive: " + handle());
        }

        return ringBuffer.read(handler, limit);
    }

    /**
     * Count a record as dropped without sending it, e.g. when it could not be captured.
     */
    public void recordDropped()
    {
        metaDataBuffer.getAndAddLong(DROPPED_COUNT_FIELD_OFFSET, 1);
    }

    /**
     * Number of records dropped by all producers of this transport.
     *
     * @return number of records dropped.
     */
    public long droppedRecords()
    {
        return metaDataBuffer.getLongVolatile(DROPPED_COUNT_FIELD_OFFSET);
    }

    /**
     * Has the transport been closed by the owner or locally by this process.
     *
     * @return true if sending will fail fast.
     */
    public boolean isClosed()
    {
        return isClosed || STATUS_CLOSED == metaDataBuffer.getIntVolatile(STATUS_FIELD_OFFSET);
    }

    /**
     * Close the transport so that all subsequent sends fail fast. Closing by the owner is visible to every process.
     * Records already in the buffer can still be received by the owner. Idempotent.
     */
    public void close()
    {
        if (!isClosed)
        {
            isClosed = true;
            if (isOwner)
            {
                metaDataBuffer.putIntVolatile(STATUS_FIELD_OFFSET, STATUS_CLOSED);
            }
        }
    }

    /**
     * Delete the backing file. Processes which have it mapped keep their mapping.
     */
    public void delete()
    {
        if (!isOwner)
        {
            throw new IllegalStateException("only the owner may delete: " + handle());
        }

        IoUtil.delete(file, true);
    }

    public String toString()
    {
        return "LogTransport{" +
            "handle=" + handle() +
            ", isOwner=" + isOwner +
            ", isClosed=" + isClosed() +
            ", maxRecordLength=" + maxRecordLength +
            ", droppedRecords=" + droppedRecords() +
            '}';
    }

    static Level levelForValue(final int value)
    {
        for (final Level level : new Level[]{
            Level.ALL, Level.FINEST, Level.FINER, Level.FINE, Level.CONFIG, Level.INFO, Level.WARNING, Level.SEVERE })
        {
            if (level.intValue() == value)
            {
                return level;
            }
        }

        return LogEventDecoder.resolveLevel(null, value);
    }
}
