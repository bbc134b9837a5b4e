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

import java.util.logging.Level;

/**
 * Destination of the records collected by a {@link Logregator}.
 */
public interface LogSink
{
    /**
     * Name of the sink, usually the name of the logger it delivers to.
     *
     * @return name of the sink.
     */
    String name();

    /**
     * Level below which the sink discards records.
     *
     * @return level below which the sink discards records.
     */
    Level effectiveLevel();

    /**
     * Would the sink accept a record at the given level.
     *
     * @param level of the record.
     * @return true if a record at this level would be accepted.
     */
    default boolean isLoggable(final Level level)
    {
        final int levelValue = effectiveLevel().intValue();

        return level.intValue() >= levelValue && levelValue != Level.OFF.intValue();
    }

    /**
     * Deliver a collected event. Called only from the collector thread.
     *
     * @param event to deliver.
     */
    void handle(LogEvent event);

    /**
     * Does a record emitted in this process on the named logger already reach the sink without aggregation,
     * e.g. because the logger is the sink or propagates to it.
     *
     * @param loggerName of the emitting logger.
     * @return true if redelivery would duplicate the record.
     */
    default boolean receivesDirectly(final String loggerName)
    {
        return false;
    }
}
