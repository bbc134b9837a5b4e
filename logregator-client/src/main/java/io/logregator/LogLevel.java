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
 * Ordered level vocabulary used by log aggregation, mapped onto {@link java.util.logging.Level} values.
 * <p>
 * {@code java.util.logging} has no level above {@link Level#SEVERE} so {@link #CRITICAL} is backed by a custom
 * level with value {@code 1100}.
 */
public enum LogLevel
{
    TRACE(Level.FINEST),
    DEBUG(Level.FINE),
    INFO(Level.INFO),
    WARNING(Level.WARNING),
    ERROR(Level.SEVERE),
    CRITICAL(CriticalLevel.CRITICAL);

    private final Level level;

    LogLevel(final Level level)
    {
        this.level = level;
    }

    /**
     * The {@code java.util.logging} level to pass to a {@link java.util.logging.Logger}.
     *
     * @return the mapped level.
     */
    public Level level()
    {
        return level;
    }

    /**
     * Is a {@code java.util.logging} level at or above this level.
     *
     * @param other level to compare.
     * @return true if {@code other} is at least as severe as this level.
     */
    public boolean isEnabledFor(final Level other)
    {
        return other.intValue() >= level.intValue();
    }

    /**
     * Classify any {@code java.util.logging} level into this vocabulary by its int value.
     *
     * @param level to classify.
     * @return the highest {@link LogLevel} whose value is not above {@code level}, or {@link #TRACE}.
     */
    public static LogLevel of(final Level level)
    {
        final int value = level.intValue();
        final LogLevel[] values = values();
        for (int i = values.length - 1; i >= 0; i--)
        {
            if (value >= values[i].level.intValue())
            {
                return values[i];
            }
        }

        return TRACE;
    }

    /**
     * Resolve a level by a vocabulary name, a {@code java.util.logging} name, or an int value.
     *
     * @param name of the level, e.g. {@code "WARNING"}, {@code "FINE"} or {@code "900"}.
     * @return the matching {@code java.util.logging} level.
     * @throws IllegalArgumentException if the name is not a known level.
     */
    public static Level parse(final String name)
    {
        for (final LogLevel logLevel : values())
        {
            if (logLevel.name().equalsIgnoreCase(name))
            {
                return logLevel.level;
            }
        }

        return Level.parse(name);
    }

    static final class CriticalLevel extends Level
    {
        private static final long serialVersionUID = -2043260935493014237L;

        static final Level CRITICAL = new CriticalLevel();

        private CriticalLevel()
        {
            super("CRITICAL", 1100);
        }
    }
}
