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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.UnsupportedEncodingException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Helpers for naming and configuring {@link Logger}s.
 * <p>
 * Loggers configured here are strongly referenced so their configuration is not lost when the
 * {@link java.util.logging.LogManager} drops its weak reference.
 */
public final class Loggers
{
    private static final StackWalker STACK_WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
    private static final Map<String, Logger> CONFIGURED_LOGGERS = new ConcurrentHashMap<>();

    private Loggers()
    {
    }

    /**
     * Get a logger named after the caller: {@code package.Class} from a static initialiser, otherwise
     * {@code package.Class.method}.
     *
     * @return the logger for the calling code.
     */
    public static Logger getLogger()
    {
        final StackWalker.StackFrame caller = STACK_WALKER.walk(
            (frames) -> frames.filter((frame) -> frame.getDeclaringClass() != Loggers.class).findFirst())
            .orElseThrow(() -> new IllegalStateException("no caller"));

        return Logger.getLogger(callerName(caller.getClassName(), caller.getMethodName()));
    }

    /**
     * Get a logger by name, {@code ""} being the root logger.
     *
     * @param name of the logger.
     * @return the logger.
     */
    public static Logger getLogger(final String name)
    {
        return Logger.getLogger(name);
    }

    /**
     * Get and configure a logger. When any handlers are given they replace the existing handlers.
     *
     * @param name     of the logger.
     * @param level    of the logger, null to inherit from the parent.
     * @param handlers to attach, none to leave the existing handlers in place.
     * @return the configured logger.
     */
    public static Logger getLogger(final String name, final LogLevel level, final Handler... handlers)
    {
        final Logger logger = Logger.getLogger(name);
        logger.setLevel(null == level ? null : level.level());

        if (handlers.length > 0)
        {
            for (final Handler handler : logger.getHandlers())
            {
                logger.removeHandler(handler);
            }

            for (final Handler handler : handlers)
            {
                logger.addHandler(handler);
            }
        }

        CONFIGURED_LOGGERS.put(name, logger);

        return logger;
    }

    /**
     * The level a logger filters at, taken from the nearest ancestor with a level set.
     *
     * @param logger to inspect.
     * @return the effective level.
     */
    public static Level effectiveLevel(final Logger logger)
    {
        Logger current = logger;
        while (null != current)
        {
            final Level level = current.getLevel();
            if (null != level)
            {
                return level;
            }

            current = current.getParent();
        }

        return Level.INFO;
    }

    /**
     * Get a logger which prints to {@link System#err} in the {@link LogFormatter} format.
     *
     * @param name  of the logger.
     * @param level of the logger and its handler.
     * @return the configured logger.
     */
    public static Logger getConsoleLogger(final String name, final LogLevel level)
    {
        return getPreconfiguredLogger(name, level, consoleHandler(level));
    }

    /**
     * Get a logger which writes to a file in the {@link LogFormatter} format.
     *
     * @param name   of the logger.
     * @param file   to write to.
     * @param append to the file rather than truncate it.
     * @param level  of the logger and its handler.
     * @return the configured logger.
     */
    public static Logger getFileLogger(final String name, final Path file, final boolean append, final LogLevel level)
    {
        return getPreconfiguredLogger(name, level, fileHandler(file, append, level));
    }

    /**
     * Get a logger which writes to both a file and {@link System#err} in the {@link LogFormatter} format.
     *
     * @param name   of the logger.
     * @param file   to write to.
     * @param append to the file rather than truncate it.
     * @param level  of the logger and its handlers.
     * @return the configured logger.
     */
    public static Logger getFileAndConsoleLogger(
        final String name, final Path file, final boolean append, final LogLevel level)
    {
        return getPreconfiguredLogger(name, level, fileHandler(file, append, level), consoleHandler(level));
    }

    static String callerName(final String className, final String methodName)
    {
        if ("<clinit>".equals(methodName) || "<init>".equals(methodName))
        {
            return className.replace('$', '.');
        }

        return className.replace('$', '.') + "." + methodName;
    }

    private static Logger getPreconfiguredLogger(final String name, final LogLevel level, final Handler... handlers)
    {
        final Logger logger = getLogger(name, level, handlers);
        logger.setUseParentHandlers(false);

        return logger;
    }

    private static Handler consoleHandler(final LogLevel level)
    {
        final ConsoleHandler handler = new ConsoleHandler();
        configure(handler, level);

        return handler;
    }

    private static Handler fileHandler(final Path file, final boolean append, final LogLevel level)
    {
        try
        {
            final FileHandler handler = new FileHandler(file.toAbsolutePath().toString().replace("%", "%%"), append);
            configure(handler, level);

            return handler;
        }
        catch (final IOException ex)
        {
            throw new UncheckedIOException("unable to open log file: " + file, ex);
        }
    }

    private static void configure(final Handler handler, final LogLevel level)
    {
        handler.setLevel(level.level());
        handler.setFormatter(new LogFormatter());

        try
        {
            handler.setEncoding(UTF_8.name());
        }
        catch (final UnsupportedEncodingException ex)
        {
            throw new IllegalStateException(ex);
        }
    }
}
