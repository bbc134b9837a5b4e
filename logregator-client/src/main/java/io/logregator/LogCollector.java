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
package io.logregator;

import io.logregator.exceptions.LogregatorException;
import io.logregator.transport.LogEventDecoder;
import io.logregator.transport.LogTransport;
import org.agrona.ErrorHandler;
import org.agrona.MutableDirectBuffer;
import org.agrona.concurrent.Agent;
import org.agrona.concurrent.AgentTerminationException;
import org.agrona.concurrent.MessageHandler;
import org.agrona.concurrent.NanoClock;

import java.util.concurrent.atomic.AtomicLong;

import static io.logregator.transport.LogTransport.LOG_EVENT_MSG_TYPE_ID;

/**
 * Agent which reads records from a {@link LogTransport} and delivers them to a {@link LogSink}.
 * <p>
 * Once the transport is closed the collector drains what remains, bounded by a timeout, and then terminates.
 */
final class LogCollector implements Agent, MessageHandler
{
    /**
     * Maximum number of records delivered per duty cycle.
     */
    static final int FRAME_LIMIT = 20;

    private final long pid = ProcessHandle.current().pid();
    private final LogTransport transport;
    private final LogSink sink;
    private final ErrorHandler errorHandler;
    private final NanoClock nanoClock;
    private final long drainTimeoutNs;
    private final AtomicLong deliveredRecords = new AtomicLong();
    private boolean isDraining;
    private long drainDeadlineNs;

    LogCollector(
        final LogTransport transport,
        final LogSink sink,
        final ErrorHandler errorHandler,
        final NanoClock nanoClock,
        final long drainTimeoutNs)
    {
        this.transport = transport;
        this.sink = sink;
        this.errorHandler = errorHandler;
        this.nanoClock = nanoClock;
        this.drainTimeoutNs = drainTimeoutNs;
    }

    public String roleName()
    {
        return "logregator-collector";
    }

    public int doWork()
    {
        if (isDraining && nanoClock.nanoTime() - drainDeadlineNs >= 0)
        {
            errorHandler.onError(new LogregatorException(
                "drain timeout expired, undelivered records discarded: " + transport.handle(),
                LogregatorException.Category.WARN));

            throw new AgentTerminationException("drain timeout expired");
        }

        // status is read before the buffer so records sent before close are always seen
        final boolean isClosed = transport.isClosed();
        final int workCount = transport.receive(this, FRAME_LIMIT);

        if (isClosed)
        {
            if (!isDraining)
            {
                isDraining = true;
                drainDeadlineNs = nanoClock.nanoTime() + drainTimeoutNs;
            }

            if (0 == workCount)
            {
                throw new AgentTerminationException("transport closed and drained");
            }
        }

        return workCount;
    }

    public void onMessage(
        final int msgTypeId, final MutableDirectBuffer buffer, final int index, final int length)
    {
        if (LOG_EVENT_MSG_TYPE_ID != msgTypeId)
        {
            errorHandler.onError(new LogregatorException(
                "unknown message type: " + msgTypeId, LogregatorException.Category.WARN));
            return;
        }

        try
        {
            final LogEvent event = LogEventDecoder.decode(buffer, index, length);

            if (sink.isLoggable(event.level()) &&
                (pid != event.processId() || !sink.receivesDirectly(event.loggerName())))
            {
                sink.handle(event);
                deliveredRecords.lazySet(deliveredRecords.get() + 1);
            }
        }
        catch (final Exception ex)
        {
            errorHandler.onError(new LogregatorException(
                "failed to deliver record to sink: " + sink.name(), ex, LogregatorException.Category.WARN));
        }
    }

    /**
     * Number of records delivered to the sink.
     *
     * @return number of records delivered to the sink.
     */
    long deliveredRecords()
    {
        return deliveredRecords.get();
    }
}
