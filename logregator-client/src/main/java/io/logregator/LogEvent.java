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
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * A captured log event carrying everything needed to reproduce the original emission in another process.
 * <p>
 * The message is rendered in the emitting process, so parameters and resource bundles are already resolved.
 * Exception information is carried as the rendered stack trace text.
 */
public final class LogEvent
{
    private static final Formatter MESSAGE_FORMATTER = new SimpleFormatter();

    private final String loggerName;
    private final Level level;
    private final String message;
    private final Instant timestamp;
    private final long processId;
    private final long threadId;
    private final String threadName;
    private final String sourceClassName;
    private final String sourceMethodName;
    private final String exceptionText;

    /**
     * Construct an event from all of its fields.
     *
     * @param loggerName       name of the logger which emitted the event, {@code ""} for the root logger.
     * @param level            of the event.
     * @param message          rendered message text.
     * @param timestamp        at which the event was emitted.
     * @param processId        of the emitting process.
     * @param threadId         of the emitting thread.
     * @param threadName       of the emitting thread.
     * @param sourceClassName  of the caller or null if unknown.
     * @param sourceMethodName of the caller or null if unknown.
     * @param exceptionText    rendered stack trace or null if none.
     */
    public LogEvent(
        final String loggerName,
        final Level level,
        final String message,
        final Instant timestamp,
        final long processId,
        final long threadId,
        final String threadName,
        final String sourceClassName,
        final String sourceMethodName,
        final String exceptionText)
    {
        this.loggerName = null == loggerName ? "" : loggerName;
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.message = null == message ? "" : message;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.processId = processId;
        this.threadId = threadId;
        this.threadName = null == threadName ? "" : threadName;
        this.sourceClassName = sourceClassName;
        this.sourceMethodName = sourceMethodName;
        this.exceptionText = exceptionText;
    }

    /**
     * Capture a {@link LogRecord} emitted on the current thread of the current process.
     *
     * @param record to capture.
     * @return the captured event.
     */
    public static LogEvent capture(final LogRecord record)
    {
        final Thread thread = Thread.currentThread();

        return new LogEvent(
            record.getLoggerName(),
            record.getLevel(),
            renderMessage(record),
            record.getInstant(),
            ProcessHandle.current().pid(),
            record.getLongThreadID(),
            record.getLongThreadID() == thread.getId() ? thread.getName() : "",
            record.getSourceClassName(),
            record.getSourceMethodName(),
            renderThrown(record.getThrown()));
    }

    static String renderMessage(final LogRecord record)
    {
        if (null == record.getMessage())
        {
            return "";
        }

        return MESSAGE_FORMATTER.formatMessage(record);
    }

    static String renderThrown(final Throwable thrown)
    {
        if (null == thrown)
        {
            return null;
        }

        final StringWriter writer = new StringWriter();
        try (PrintWriter printWriter = new PrintWriter(writer))
        {
            thrown.printStackTrace(printWriter);
        }

        return writer.toString();
    }

    public String loggerName()
    {
        return loggerName;
    }

    public Level level()
    {
        return level;
    }

    public String message()
    {
        return message;
    }

    public Instant timestamp()
    {
        return timestamp;
    }

    public long processId()
    {
        return processId;
    }

    public long threadId()
    {
        return threadId;
    }

    public String threadName()
    {
        return threadName;
    }

    public String sourceClassName()
    {
        return sourceClassName;
    }

    public String sourceMethodName()
    {
        return sourceMethodName;
    }

    /**
     * Rendered stack trace of the exception attached to the event.
     *
     * @return rendered stack trace or null if the event had no exception.
     */
    public String exceptionText()
    {
        return exceptionText;
    }

    /**
     * Was the event emitted by the current process.
     *
     * @return true if the event originated in this process.
     */
    public boolean isLocal()
    {
        return ProcessHandle.current().pid() == processId;
    }

    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof LogEvent))
        {
            return false;
        }

        final LogEvent that = (LogEvent)o;

        return processId == that.processId &&
            threadId == that.threadId &&
            loggerName.equals(that.loggerName) &&
            level.intValue() == that.level.intValue() &&
            level.getName().equals(that.level.getName()) &&
            message.equals(that.message) &&
            timestamp.equals(that.timestamp) &&
            threadName.equals(that.threadName) &&
            Objects.equals(sourceClassName, that.sourceClassName) &&
            Objects.equals(sourceMethodName, that.sourceMethodName) &&
            Objects.equals(exceptionText, that.exceptionText);
    }

    public int hashCode()
    {
        return Objects.hash(loggerName, level.intValue(), message, timestamp, processId, threadId);
    }

    public String toString()
    {
        return "LogEvent{" +
            "loggerName='" + loggerName + '\'' +
            ", level=" + level +
            ", message='" + message + '\'' +
            ", timestamp=" + timestamp +
            ", processId=" + processId +
            ", threadId=" + threadId +
            ", threadName='" + threadName + '\'' +
            ", sourceClassName='" + sourceClassName + '\'' +
            ", sourceMethodName='" + sourceMethodName + '\'' +
            ", exceptionText=" + (null == exceptionText ? "null" : "'" + exceptionText + "'") +
            '}';
    }
}
