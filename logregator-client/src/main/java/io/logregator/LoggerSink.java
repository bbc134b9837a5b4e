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

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * {@link LogSink} which delivers to a {@link Logger} so that its level, filter and handlers all apply.
 */
public final class LoggerSink implements LogSink
{
    private final Logger logger;

    public LoggerSink(final Logger logger)
    {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
        if (logger.getName().isEmpty())
        {
            throw new IllegalArgumentException("the root logger cannot be the sink of its own interception");
        }
    }

    public Logger logger()
    {
        return logger;
    }

    public String name()
    {
        return logger.getName();
    }

    public Level effectiveLevel()
    {
        return Loggers.effectiveLevel(logger);
    }

    public boolean isLoggable(final Level level)
    {
        return logger.isLoggable(level);
    }

    public void handle(final LogEvent event)
    {
        logger.log(new AggregatedLogRecord(event, logger.getName()));
    }

    public boolean receivesDirectly(final String loggerName)
    {
        if (logger.getName().equals(loggerName))
        {
            return true;
        }

        Logger current = LogManager.getLogManager().getLogger(loggerName);
        while (null != current)
        {
            if (current == logger)
            {
                return true;
            }

            if (!current.getUseParentHandlers())
            {
                return false;
            }

            current = current.getParent();
        }

        return false;
    }

    public String toString()
    {
        return "LoggerSink{" +
            "name=" + logger.getName() +
            ", level=" + effectiveLevel() +
            '}';
    }
}
