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

import java.util.logging.LogRecord;

/**
 * A {@link LogRecord} redelivered to a sink from the aggregation transport.
 * <p>
 * The record keeps the original logger name, level, timestamp, thread and source. Handlers installed for
 * aggregation ignore records of this type so redelivery never feeds back into the transport.
 */
public class AggregatedLogRecord extends LogRecord
{
    private static final long serialVersionUID = 2977512035458107125L;

    private final transient LogEvent event;
    private final String sinkName;

    /**
     * Construct a record reproducing a captured event.
     *
     * @param event    as captured in the emitting process.
     * @param sinkName of the sink the record is redelivered to.
     */
    public AggregatedLogRecord(final LogEvent event, final String sinkName)
    {
        super(event.level(), event.message());
        this.event = event;
        this.sinkName = sinkName;

        setLoggerName(event.loggerName());
        setInstant(event.timestamp());
        setLongThreadID(event.threadId());
        setSourceClassName(event.sourceClassName());
        setSourceMethodName(event.sourceMethodName());

        if (null != event.exceptionText())
        {
            setThrown(new CapturedThrowable(event.exceptionText()));
        }
    }

    /**
     * The event this record was built from.
     *
     * @return the event this record was built from.
     */
    public LogEvent event()
    {
        return event;
    }

    public String sinkName()
    {
        return sinkName;
    }

    public long processId()
    {
        return event.processId();
    }

    public String threadName()
    {
        return event.threadName();
    }

    /**
     * Did the event originate in this process.
     *
     * @return true if the event originated in this process.
     */
    public boolean isLocal()
    {
        return event.isLocal();
    }
}
