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

import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * {@link Logregator} which builds its own sink logger writing to the console, a file, or both.
 * <pre>{@code
 * try (Logtor ignore = new Logtor(Path.of("build.log")).start())
 * {
 *     ...
 * }
 * }</pre>
 */
public class Logtor extends Logregator
{
    /**
     * Default name of the sink logger.
     */
    public static final String DEFAULT_NAME = "LOGTOR";

    /**
     * Default level of the sink logger.
     */
    public static final LogLevel DEFAULT_LEVEL = LogLevel.INFO;

    private final Logger logger;

    /**
     * Collect to the console at {@link #DEFAULT_LEVEL}.
     */
    public Logtor()
    {
        this((Path)null);
    }

    /**
     * Collect to a file, appending to it, at {@link #DEFAULT_LEVEL}. A null file collects to the console.
     *
     * @param file to append to, or null.
     */
    public Logtor(final Path file)
    {
        this(file, true, DEFAULT_LEVEL, null, DEFAULT_NAME);
    }

    /**
     * Collect to a file, the console, or both.
     *
     * @param file    to write to, or null for none.
     * @param append  to the file rather than truncate it.
     * @param level   of the sink logger, null for {@link #DEFAULT_LEVEL}.
     * @param console also write to the console, null to write to the console only when there is no file.
     * @param name    of the sink logger, null for {@link #DEFAULT_NAME}.
     * @throws IllegalArgumentException if there is neither a file nor the console to write to.
     */
    public Logtor(final Path file, final boolean append, final LogLevel level, final Boolean console, final String name)
    {
        this(buildLogger(file, append, level, console, name));
    }

    private Logtor(final Logger logger)
    {
        super(logger);
        this.logger = logger;
    }

    /**
     * The sink logger records are collected into.
     *
     * @return the sink logger.
     */
    public Logger logger()
    {
        return logger;
    }

    static Logger buildLogger(
        final Path file, final boolean append, final LogLevel level, final Boolean console, final String name)
    {
        final boolean toConsole = null == console ? null == file : console;
        final String loggerName = null == name ? DEFAULT_NAME : name;
        final LogLevel loggerLevel = null == level ? DEFAULT_LEVEL : level;

        if (null == file)
        {
            if (!toConsole)
            {
                throw new IllegalArgumentException("a file or the console must be given to write to");
            }

            return Loggers.getConsoleLogger(loggerName, loggerLevel);
        }

        if (toConsole)
        {
            return Loggers.getFileAndConsoleLogger(loggerName, file, append, loggerLevel);
        }

        return Loggers.getFileLogger(loggerName, file, append, loggerLevel);
    }
}
