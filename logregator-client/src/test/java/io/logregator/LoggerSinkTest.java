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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class LoggerSinkTest
{
    private final Logger sinkLogger = Logger.getLogger("sink.test");
    private final Logger childLogger = Logger.getLogger("sink.test.child");
    private final Logger isolatedLogger = Logger.getLogger("sink.test.isolated");
    private final CapturingHandler handler = new CapturingHandler();

    @BeforeEach
    void before()
    {
        sinkLogger.setLevel(Level.INFO);
        sinkLogger.setUseParentHandlers(false);
        sinkLogger.addHandler(handler);
        isolatedLogger.setUseParentHandlers(false);
    }

    @AfterEach
    void after()
    {
        sinkLogger.removeHandler(handler);
        sinkLogger.setLevel(null);
        sinkLogger.setUseParentHandlers(true);
        isolatedLogger.setUseParentHandlers(true);
    }

    @Test
    void shouldDeliverRecordWithOriginalIdentity()
    {
        final LoggerSink sink = new LoggerSink(sinkLogger);
        final Instant timestamp = Instant.parse("2024-03-01T10:15:30Z");
        final LogEvent event = new LogEvent(
            "child.process", Level.WARNING, "disk {0} full", timestamp, 4242, 7, "worker", "C", "m", null);

        sink.handle(event);

        assertEquals(1, handler.size());
        final LogRecord record = handler.records().get(0);
        assertInstanceOf(AggregatedLogRecord.class, record);
        assertEquals("child.process", record.getLoggerName());
        assertEquals(Level.WARNING, record.getLevel());
        assertEquals("disk {0} full", record.getMessage());
        assertEquals(timestamp, record.getInstant());
        assertEquals(7, record.getLongThreadID());
        assertEquals("C", record.getSourceClassName());
        assertEquals("m", record.getSourceMethodName());
        assertEquals(4242, ((AggregatedLogRecord)record).processId());
        assertEquals("worker", ((AggregatedLogRecord)record).threadName());
    }

    @Test
    void shouldApplyLoggerLevel()
    {
        final LoggerSink sink = new LoggerSink(sinkLogger);

        assertEquals(Level.INFO, sink.effectiveLevel());
        assertFalse(sink.isLoggable(Level.FINE));
        assertTrue(sink.isLoggable(Level.SEVERE));

        sink.handle(new LogEvent("x", Level.FINE, "dropped", Instant.now(), 1, 1, "main", null, null, null));
        assertEquals(0, handler.size());
    }

    @Test
    void shouldReplayExceptionTextWhenPrinted()
    {
        final String stackTrace = "java.lang.IllegalStateException: boom\n\tat a.B.c(B.java:1)\n";
        final LoggerSink sink = new LoggerSink(sinkLogger);

        sink.handle(new LogEvent("x", Level.SEVERE, "failed", Instant.now(), 1, 1, "main", null, null, stackTrace));

        final Throwable thrown = handler.records().get(0).getThrown();
        final StringWriter writer = new StringWriter();
        thrown.printStackTrace(new PrintWriter(writer));

        assertEquals(stackTrace, writer.toString());
        assertEquals("java.lang.IllegalStateException: boom", thrown.toString());
    }

    @Test
    void shouldKnowWhichLoggersReachItDirectly()
    {
        final LoggerSink sink = new LoggerSink(sinkLogger);

        assertTrue(sink.receivesDirectly("sink.test"));
        assertTrue(sink.receivesDirectly("sink.test.child"));
        assertFalse(sink.receivesDirectly("sink.test.isolated"));
        assertFalse(sink.receivesDirectly("sink"));
        assertFalse(sink.receivesDirectly("unrelated"));
        assertFalse(sink.receivesDirectly("never.created.logger"));
        assertNotNull(childLogger);
    }

    @Test
    void shouldRejectRootLoggerAsSink()
    {
        assertThrows(IllegalArgumentException.class, () -> new LoggerSink(Logger.getLogger("")));
        assertThrows(NullPointerException.class, () -> new LoggerSink(null));
    }
}
