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

import io.logregator.test.CapturingHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

class LoggersTest
{
    private static final Logger STATIC_LOGGER = Loggers.getLogger();

    @TempDir
    Path tempDir;

    @Test
    void shouldNameLoggerAfterCallingClassInStaticInitialiser()
    {
        assertEquals("io.logregator.LoggersTest", STATIC_LOGGER.getName());
    }

    @Test
    void shouldNameLoggerAfterCallingMethod()
    {
        assertEquals(
            "io.logregator.LoggersTest.shouldNameLoggerAfterCallingMethod", Loggers.getLogger().getName());
    }

    @Test
    void shouldNameNestedClassesWithDots()
    {
        assertEquals("a.Outer.Inner", Loggers.callerName("a.Outer$Inner", "<clinit>"));
        assertEquals("a.Outer.Inner.run", Loggers.callerName("a.Outer$Inner", "run"));
    }

    @Test
    void shouldReplaceHandlersOnlyWhenGiven()
    {
        final CapturingHandler first = new CapturingHandler();
        final CapturingHandler second = new CapturingHandler();

        final Logger logger = Loggers.getLogger("loggers.replace", LogLevel.DEBUG, first);
        assertEquals(List.of(first), Arrays.asList(logger.getHandlers()));
        assertEquals(Level.FINE, logger.getLevel());

        Loggers.getLogger("loggers.replace", LogLevel.WARNING);
        assertEquals(List.of(first), Arrays.asList(logger.getHandlers()));
        assertEquals(Level.WARNING, logger.getLevel());

        Loggers.getLogger("loggers.replace", null, second);
        assertEquals(List.of(second), Arrays.asList(logger.getHandlers()));
        assertNull(logger.getLevel());

        logger.removeHandler(second);
    }

    @Test
    void shouldResolveEffectiveLevelFromAncestors()
    {
        final Logger parent = Loggers.getLogger("loggers.effective", LogLevel.ERROR);
        final Logger child = Logger.getLogger("loggers.effective.child");

        assertNull(child.getLevel());
        assertEquals(Level.SEVERE, Loggers.effectiveLevel(child));

        parent.setLevel(null);
    }

    @Test
    void shouldBuildConsoleLogger()
    {
        final Logger logger = Loggers.getConsoleLogger("loggers.console", LogLevel.WARNING);

        assertFalse(logger.getUseParentHandlers());
        assertEquals(1, logger.getHandlers().length);
        final Handler handler = logger.getHandlers()[0];
        assertInstanceOf(ConsoleHandler.class, handler);
        assertInstanceOf(LogFormatter.class, handler.getFormatter());
        assertEquals(Level.WARNING, handler.getLevel());
        assertEquals(Level.WARNING, logger.getLevel());
    }

    @Test
    void shouldBuildFileLoggerWhichWritesFormattedRecords() throws IOException
    {
        final Path file = tempDir.resolve("app%1.log");
        final Logger logger = Loggers.getFileLogger("loggers.file", file, false, LogLevel.INFO);

        logger.info("written ✓");
        logger.fine("filtered");
        closeHandlers(logger);

        final String content = Files.readString(file, UTF_8);
        assertThat(content, containsString("loggers.file INFO written ✓"));
        assertThat(content, not(containsString("filtered")));
    }

    @Test
    void shouldAppendToExistingFileWhenRequested() throws IOException
    {
        final Path file = tempDir.resolve("append.log");
        Files.writeString(file, "existing" + System.lineSeparator(), UTF_8);

        final Logger logger = Loggers.getFileLogger("loggers.append", file, true, LogLevel.INFO);
        logger.info("appended");
        closeHandlers(logger);

        final List<String> lines = Files.readAllLines(file, UTF_8);
        assertEquals("existing", lines.get(0));
        assertThat(lines.get(1), endsWith("loggers.append INFO appended"));
    }

    @Test
    void shouldBuildFileAndConsoleLogger()
    {
        final Logger logger = Loggers.getFileAndConsoleLogger(
            "loggers.both", tempDir.resolve("both.log"), false, LogLevel.DEBUG);

        assertEquals(2, logger.getHandlers().length);
        assertInstanceOf(FileHandler.class, logger.getHandlers()[0]);
        assertInstanceOf(ConsoleHandler.class, logger.getHandlers()[1]);

        closeHandlers(logger);
    }

    static void closeHandlers(final Logger logger)
    {
        for (final Handler handler : logger.getHandlers())
        {
            handler.close();
            logger.removeHandler(handler);
        }
    }
}
