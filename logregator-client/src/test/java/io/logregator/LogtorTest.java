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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class LogtorTest
{
    @TempDir
    Path tempDir;

    private Logtor logtor;

    @AfterEach
    void after()
    {
        if (null != logtor)
        {
            LoggersTest.closeHandlers(logtor.logger());
        }
    }

    @Test
    void shouldDefaultToConsoleAtInfo()
    {
        logtor = new Logtor();

        final Logger logger = logtor.logger();
        assertEquals(Logtor.DEFAULT_NAME, logger.getName());
        assertEquals(Level.INFO, logger.getLevel());
        assertEquals(1, logger.getHandlers().length);
        assertInstanceOf(ConsoleHandler.class, logger.getHandlers()[0]);
        assertEquals(ScopeState.INACTIVE, logtor.state());
    }

    @Test
    void shouldWriteOnlyToFileWhenFileGiven()
    {
        logtor = new Logtor(tempDir.resolve("only.log"));

        assertEquals(1, logtor.logger().getHandlers().length);
        assertInstanceOf(FileHandler.class, logtor.logger().getHandlers()[0]);
    }

    @Test
    void shouldAppendToExistingFileByDefault() throws IOException
    {
        final Path file = tempDir.resolve("append.log");
        Files.writeString(file, "previous run" + System.lineSeparator(), UTF_8);

        logtor = new Logtor(file);
        logtor.logger().info("new");
        LoggersTest.closeHandlers(logtor.logger());

        final List<String> lines = Files.readAllLines(file, UTF_8);
        assertEquals(2, lines.size());
        assertEquals("previous run", lines.get(0));
        assertTrue(lines.get(1).endsWith(Logtor.DEFAULT_NAME + " INFO new"));
    }

    @Test
    void shouldWriteToFileAndConsoleWhenBothRequested()
    {
        logtor = new Logtor(tempDir.resolve("both.log"), true, LogLevel.DEBUG, true, "build");

        final Logger logger = logtor.logger();
        assertEquals("build", logger.getName());
        assertEquals(Level.FINE, logger.getLevel());
        assertEquals(2, logger.getHandlers().length);
        assertEquals("build", logtor.sink().name());
    }

    @Test
    void shouldRejectNoDestination()
    {
        assertThrows(IllegalArgumentException.class, () -> new Logtor(null, false, null, false, null));
    }

    @Test
    void shouldApplyDefaultsForNullArguments()
    {
        logtor = new Logtor(null, false, null, null, null);

        assertEquals(Logtor.DEFAULT_NAME, logtor.logger().getName());
        assertEquals(Level.INFO, logtor.logger().getLevel());
        assertInstanceOf(ConsoleHandler.class, logtor.logger().getHandlers()[0]);
    }
}
