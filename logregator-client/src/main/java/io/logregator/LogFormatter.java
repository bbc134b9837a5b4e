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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Formats records as {@code yyyy-MM-dd HH:mm:ss name LEVEL message}.
 * <p>
 * Collected records have the sink they were redelivered to prepended to the message as {@code [SINK] - }, or
 * {@code [SINK PID n] - } when they were emitted by another process.
 */
public class LogFormatter extends Formatter
{
    /**
     * Pattern of the timestamp at the start of each line.
     */
    public static final String DATE_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern(DATE_PATTERN);

    private final ZoneId zoneId;

    public LogFormatter()
    {
        this(ZoneId.systemDefault());
    }

    public LogFormatter(final ZoneId zoneId)
    {
        this.zoneId = zoneId;
    }

    public String format(final LogRecord record)
    {
        final StringBuilder builder = new StringBuilder(128)
            .append(DATE_FORMATTER.format(record.getInstant().atZone(zoneId)))
            .append(' ')
            .append(record.getLoggerName())
            .append(' ')
            .append(record.getLevel().getName())
            .append(' ');

        if (record instanceof AggregatedLogRecord)
        {
            final AggregatedLogRecord aggregatedRecord = (AggregatedLogRecord)record;
            builder.append('[').append(aggregatedRecord.sinkName());
            if (!aggregatedRecord.isLocal())
            {
                builder.append(" PID ").append(aggregatedRecord.processId());
            }
            builder.append("] - ");
        }

        builder.append(formatMessage(record)).append(System.lineSeparator());

        if (null != record.getThrown())
        {
            final StringWriter writer = new StringWriter();
            try (PrintWriter printWriter = new PrintWriter(writer))
            {
                record.getThrown().printStackTrace(printWriter);
            }
            builder.append(writer);
        }

        return builder.toString();
    }
}
