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

import io.logregator.transport.LogTransport;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * {@link Handler} installed on the root logger which captures every record into a {@link LogTransport}.
 * <p>
 * Publishing never throws: records which cannot be captured or sent are counted as dropped by the transport.
 * Records being redelivered by a collector are ignored.
 */
public final class TransportHandler extends Handler
{
    private final LogTransport transport;

    public TransportHandler(final LogTransport transport, final Level level)
    {
        this.transport = transport;
        setLevel(level);
    }

    public LogTransport transport()
    {
        return transport;
    }

    public void publish(final LogRecord record)
    {
        if (record instanceof AggregatedLogRecord || !isLoggable(record))
        {
            return;
        }

        try
        {
            transport.send(LogEvent.capture(record));
        }
        catch (final RuntimeException ex)
        {
            transport.recordDropped();
        }
    }

    public void flush()
    {
    }

    public void close()
    {
    }

    public String toString()
    {
        return "TransportHandler{" +
            "level=" + getLevel() +
            ", transport=" + transport.handle() +
            '}';
    }
}
