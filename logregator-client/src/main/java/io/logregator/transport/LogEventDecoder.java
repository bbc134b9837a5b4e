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
import io.logregator.LogLevel;
import org.agrona.DirectBuffer;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;

import static io.logregator.transport.LogEventEncoder.NULL_LENGTH;
import static java.nio.ByteOrder.LITTLE_ENDIAN;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.agrona.BitUtil.SIZE_OF_INT;
import static org.agrona.BitUtil.SIZE_OF_LONG;

/**
 * Decodes events written by {@link LogEventEncoder}.
 */
public final class LogEventDecoder
{
    private static final Map<String, Level> LEVELS = new ConcurrentHashMap<>();

    static
    {
        for (final LogLevel logLevel : LogLevel.values())
        {
            LEVELS.put(levelKey(logLevel.level().getName(), logLevel.level().intValue()), logLevel.level());
        }
    }

    private LogEventDecoder()
    {
    }

    /**
     * Decode an event.
     *
     * @param buffer containing the encoded event.
     * @param offset at which the event begins.
     * @param length of the encoded event.
     * @return the decoded event.
     * @throws IndexOutOfBoundsException if the encoded lengths run past {@code length}.
     */
    public static LogEvent decode(final DirectBuffer buffer, final int offset, final int length)
    {
        final int limit = offset + length;
        int position = offset;

        final long epochSecond = buffer.getLong(position, LITTLE_ENDIAN);
        position += SIZE_OF_LONG;

        final int nanoAdjustment = buffer.getInt(position, LITTLE_ENDIAN);
        position += SIZE_OF_INT;

        final int levelValue = buffer.getInt(position, LITTLE_ENDIAN);
        position += SIZE_OF_INT;

        final long processId = buffer.getLong(position, LITTLE_ENDIAN);
        position += SIZE_OF_LONG;

        final long threadId = buffer.getLong(position, LITTLE_ENDIAN);
        position += SIZE_OF_LONG;

        final String[] strings = new String[LogEventEncoder.STRING_FIELD_COUNT];
        for (int i = 0; i < strings.length; i++)
        {
            if (position + SIZE_OF_INT > limit)
            {
                throw new IndexOutOfBoundsException(
                    "field " + i + " at position=" + position + " exceeds limit=" + limit);
            }

            final int stringLength = buffer.getInt(position, LITTLE_ENDIAN);
            position += SIZE_OF_INT;

            if (NULL_LENGTH == stringLength)
            {
                continue;
            }

            if (stringLength < 0 || position + stringLength > limit)
            {
                throw new IndexOutOfBoundsException(
                    "string length=" + stringLength + " at position=" + position + " exceeds limit=" + limit);
            }

            final byte[] bytes = new byte[stringLength];
            buffer.getBytes(position, bytes);
            strings[i] = new String(bytes, UTF_8);
            position += stringLength;
        }

        return new LogEvent(
            strings[1],
            resolveLevel(strings[0], levelValue),
            strings[5],
            Instant.ofEpochSecond(epochSecond, nanoAdjustment),
            processId,
            threadId,
            strings[2],
            strings[3],
            strings[4],
            strings[6]);
    }

    /**
     * Resolve the level for a name and value pair, creating a level if neither process knows the name.
     *
     * @param name  of the level as emitted.
     * @param value of the level as emitted.
     * @return a level with the same name and value.
     */
    static Level resolveLevel(final String name, final int value)
    {
        final String levelName = null == name ? Integer.toString(value) : name;

        return LEVELS.computeIfAbsent(levelKey(levelName, value), (key) -> lookupLevel(levelName, value));
    }

    private static Level lookupLevel(final String name, final int value)
    {
        try
        {
            final Level level = Level.parse(name);
            if (level.intValue() == value)
            {
                return level;
            }
        }
        catch (final IllegalArgumentException ignore)
        {
            // unknown to this process
        }

        return new TransportLevel(name, value);
    }

    private static String levelKey(final String name, final int value)
    {
        return name + ':' + value;
    }

    static final class TransportLevel extends Level
    {
        private static final long serialVersionUID = 8526389283413436707L;

        TransportLevel(final String name, final int value)
        {
            super(name, value);
        }
    }
}
