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

import io.logregator.exceptions.LogregatorException;
import io.logregator.test.CapturingHandler;
import io.logregator.test.CapturingPrintStream;
import io.logregator.test.InterruptAfter;
import io.logregator.test.InterruptingTestCallback;
import io.logregator.test.Tests;
import org.agrona.ErrorHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@ExtendWith(InterruptingTestCallback.class)
class LogregatorTest
{
    private final Logger root = LogManager.getLogManager().getLogger("");
    private final Logger sinkLogger = Logger.getLogger("it.sink");
    private final CapturingHandler sinkHandler = new CapturingHandler();
    private final ErrorHandler errorHandler = mock(ErrorHandler.class);
    private Level savedRootLevel;
    private List<Handler> savedRootHandlers;

    @TempDir
    File tempDir;

    @BeforeEach
    void before()
    {
        savedRootLevel = root.getLevel();
        savedRootHandlers = Arrays.asList(root.getHandlers());

        sinkLogger.setLevel(Level.INFO);
        sinkLogger.setUseParentHandlers(false);
        sinkLogger.addHandler(sinkHandler);
        sinkHandler.setFilter((record) -> record.getLoggerName().startsWith("it."));
    }

    @AfterEach
    void after()
    {
        sinkLogger.removeHandler(sinkHandler);
        sinkLogger.setLevel(null);
        sinkLogger.setUseParentHandlers(true);

        assertEquals(savedRootHandlers, Arrays.asList(root.getHandlers()));
        assertEquals(savedRootLevel, root.getLevel());
        assertTrue(ChildProcessBinding.environment().isEmpty());
    }

    @Test
    @InterruptAfter(10)
    void shouldCollectEveryRecordEmittedInProcess() throws InterruptedException
    {
        final int threadCount = 4;
        final int recordsPerThread = 50;

        try (Logregator ignore = newScope(sinkLogger).start())
        {
            final List<Thread> threads = new ArrayList<>();
            for (int t = 0; t < threadCount; t++)
            {
                final Logger logger = Logger.getLogger("it.emitter" + t);
                final Thread thread = new Thread(() ->
                {
                    for (int i = 0; i < recordsPerThread; i++)
                    {
                        logger.info("record-" + i);
                    }
                });
                threads.add(thread);
                thread.start();
            }

            for (final Thread thread : threads)
            {
                thread.join();
            }
        }

        final List<LogRecord> records = sinkHandler.records();
        assertEquals(threadCount * recordsPerThread, records.size());

        for (int t = 0; t < threadCount; t++)
        {
            final String loggerName = "it.emitter" + t;
            int expected = 0;
            for (final LogRecord record : records)
            {
                if (loggerName.equals(record.getLoggerName()))
                {
                    assertEquals("record-" + expected++, record.getMessage());
                    assertEquals(ProcessHandle.current().pid(), ((AggregatedLogRecord)record).processId());
                }
            }
            assertEquals(recordsPerThread, expected);
        }
    }

    @Test
    @InterruptAfter(10)
    void shouldDeliverThroughRootHandlersWhenSinkPropagatesToRoot()
    {
        final CapturingHandler rootHandler = new CapturingHandler();
        rootHandler.setFilter((record) -> record.getLoggerName().startsWith("it."));
        root.addHandler(rootHandler);

        final Logger propagatingSink = Logger.getLogger("it.propagating");
        propagatingSink.setLevel(Level.INFO);
        final Logger logger = Logger.getLogger("it.emitter");

        try
        {
            logger.info("before");

            try (Logregator ignore = newScope(propagatingSink).start())
            {
                logger.info("inside");
                Tests.await(() -> rootHandler.size() == 2);
            }

            logger.info("after");
        }
        finally
        {
            root.removeHandler(rootHandler);
            propagatingSink.setLevel(null);
        }

        assertEquals(List.of("before", "inside", "after"), rootHandler.messages());
        assertThat(rootHandler.records().get(1), instanceOf(AggregatedLogRecord.class));
    }

    @Test
    @InterruptAfter(10)
    void shouldOnlyDeliverRecordsAtOrAboveSinkLevel()
    {
        sinkLogger.setLevel(Level.WARNING);
        final Logger logger = Logger.getLogger("it.levels");

        try (Logregator ignore = newScope(sinkLogger).start())
        {
            logger.info("info");
            logger.warning("warning");
            logger.fine("fine");
            logger.severe("severe");
        }

        assertEquals(List.of("warning", "severe"), sinkHandler.messages());
    }

    @Test
    @InterruptAfter(10)
    void shouldProduceIdenticalOutputAfterScopeAsBefore()
    {
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        final StreamHandler console = new StreamHandler(output, new Formatter()
        {
            public String format(final LogRecord record)
            {
                return record.getLoggerName() + " " + record.getLevel() + " " + formatMessage(record) + "\n";
            }
        });
        root.addHandler(console);
        final Logger logger = Logger.getLogger("it.restore");

        try
        {
            logger.warning("same");
            console.flush();
            final byte[] before = output.toByteArray();
            output.reset();

            try (Logregator ignore = newScope(sinkLogger).start())
            {
                logger.warning("captured");
            }

            logger.warning("same");
            console.flush();

            assertArrayEquals(before, output.toByteArray());
            assertEquals(List.of("captured"), sinkHandler.messages());
        }
        finally
        {
            root.removeHandler(console);
        }
    }

    @Test
    @InterruptAfter(10)
    void shouldNotDuplicateRecordsWhichReachSinkDirectly()
    {
        final Logger child = Logger.getLogger("it.sink.child");

        try (Logregator ignore = newScope(sinkLogger).start())
        {
            child.info("once");
            sinkLogger.info("also once");
        }

        assertEquals(List.of("once", "also once"), sinkHandler.messages());
        for (final LogRecord record : sinkHandler.records())
        {
            assertFalse(record instanceof AggregatedLogRecord);
        }
    }

    @Test
    @InterruptAfter(10)
    void shouldTransitionBetweenStates()
    {
        final Logregator scope = newScope(sinkLogger);
        assertEquals(ScopeState.INACTIVE, scope.state());
        assertNull(scope.transportHandle());

        scope.start();
        assertEquals(ScopeState.ACTIVE, scope.state());
        assertTrue(scope.isStarted());
        assertTrue(scope.isReceiving());
        final File transportFile = new File(scope.transportHandle());
        assertTrue(transportFile.exists());
        assertEquals(tempDir.getAbsoluteFile(), transportFile.getParentFile());

        scope.stop();
        assertEquals(ScopeState.INACTIVE, scope.state());
        assertFalse(scope.isStarted());
        assertFalse(transportFile.exists());

        scope.stop();
        assertEquals(ScopeState.INACTIVE, scope.state());
    }

    @Test
    @InterruptAfter(10)
    void shouldDeliverToOutermostSinkWhileNested()
    {
        final Logger innerSinkLogger = Logger.getLogger("it.inner");
        final CapturingHandler innerHandler = new CapturingHandler();
        innerSinkLogger.setUseParentHandlers(false);
        innerSinkLogger.addHandler(innerHandler);
        final Logger logger = Logger.getLogger("it.nested");

        try
        {
            final Logregator outer = newScope(sinkLogger).start();
            final String handle = outer.transportHandle();

            final Logregator inner = newScope(innerSinkLogger).start();
            assertEquals(handle, inner.transportHandle());
            assertFalse(inner.isReceiving());
            assertTrue(outer.isReceiving());

            logger.info("while nested");
            inner.stop();

            assertEquals(ScopeState.ACTIVE, outer.state());
            assertTrue(new File(handle).exists());
            logger.info("after inner");
            outer.stop();

            assertEquals(List.of("while nested", "after inner"), sinkHandler.messages());
            assertEquals(0, innerHandler.size());
            assertFalse(new File(handle).exists());
        }
        finally
        {
            innerSinkLogger.removeHandler(innerHandler);
            innerSinkLogger.setUseParentHandlers(true);
        }
    }

    @Test
    @InterruptAfter(10)
    void shouldRestoreOnceWhenSameScopeReentered()
    {
        final Logregator scope = newScope(sinkLogger);

        scope.start();
        scope.start();
        assertEquals(2, scope.depth());

        scope.stop();
        assertEquals(ScopeState.ACTIVE, scope.state());
        assertNotNull(scope.transportHandle());
        assertThat(Arrays.asList(root.getHandlers()), hasItem(instanceOf(TransportHandler.class)));

        scope.stop();
        assertEquals(ScopeState.INACTIVE, scope.state());
        assertEquals(0, scope.depth());
    }

    @Test
    @InterruptAfter(10)
    void shouldTearDownWhenBodyThrows()
    {
        final Logregator scope = newScope(sinkLogger);

        assertThrows(IllegalStateException.class, () ->
        {
            try (Logregator ignore = scope.start())
            {
                Logger.getLogger("it.failure").info("before failure");
                throw new IllegalStateException("business failure");
            }
        });

        assertEquals(ScopeState.INACTIVE, scope.state());
        assertEquals(List.of("before failure"), sinkHandler.messages());
    }

    @Test
    void shouldRejectNullSink()
    {
        assertThrows(NullPointerException.class, () -> new Logregator((LogSink)null));
    }

    @Test
    @InterruptAfter(10)
    void shouldExposeHandleToChildrenOnlyWhileActive()
    {
        try (Logregator scope = newScope(sinkLogger).start())
        {
            assertEquals(
                scope.transportHandle(),
                ChildProcessBinding.environment().get(ChildProcessBinding.TRANSPORT_ENV_VAR));

            final ProcessBuilder builder = ChildProcessBinding.apply(new ProcessBuilder("true"));
            assertEquals(scope.transportHandle(), builder.environment().get(ChildProcessBinding.TRANSPORT_ENV_VAR));
        }

        final ProcessBuilder stale = new ProcessBuilder("true");
        stale.environment().put(ChildProcessBinding.TRANSPORT_ENV_VAR, "/stale");
        assertFalse(ChildProcessBinding.apply(stale).environment().containsKey(ChildProcessBinding.TRANSPORT_ENV_VAR));
    }

    @Test
    @InterruptAfter(10)
    void shouldCompleteTeardownThenRaiseWhenRootCannotBeRestored()
    {
        final Logregator scope = newScope(sinkLogger).start();
        final File transportFile = new File(scope.transportHandle());

        for (final Handler handler : root.getHandlers())
        {
            if (handler instanceof TransportHandler)
            {
                root.removeHandler(handler);
            }
        }

        final LogregatorException exception = assertThrows(LogregatorException.class, scope::stop);

        assertEquals(LogregatorException.Category.ERROR, exception.category());
        assertEquals(ScopeState.INACTIVE, scope.state());
        assertFalse(transportFile.exists());
    }

    @Test
    @InterruptAfter(10)
    void shouldRollBackFailedActivation() throws Exception
    {
        final File notADirectory = new File(tempDir, "file");
        assertTrue(notADirectory.createNewFile());

        final Logregator scope = new Logregator(
            new LoggerSink(sinkLogger), new Logregator.Context().directory(notADirectory));

        assertThrows(Exception.class, scope::start);
        assertEquals(ScopeState.INACTIVE, scope.state());
    }

    @Test
    @InterruptAfter(20)
    void shouldCountRecordsDroppedWhenSinkFallsBehind() throws InterruptedException
    {
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch blocked = new CountDownLatch(1);
        final Handler blockingHandler = new Handler()
        {
            public void publish(final LogRecord record)
            {
                blocked.countDown();
                try
                {
                    release.await();
                }
                catch (final InterruptedException ex)
                {
                    Thread.currentThread().interrupt();
                }
            }

            public void flush()
            {
            }

            public void close()
            {
            }
        };
        sinkLogger.addHandler(blockingHandler);

        final int recordCount = 500;
        final Logger logger = Logger.getLogger("it.drop");
        final Logregator scope = new Logregator(new LoggerSink(sinkLogger), context().transportBufferLength(4096));
        try
        {
            scope.start();
            logger.info("first");
            assertTrue(blocked.await(5, TimeUnit.SECONDS));

            for (int i = 0; i < recordCount; i++)
            {
                logger.info("record-" + i);
            }

            assertThat(scope.droppedRecords(), greaterThan(0L));
            final long dropped = scope.droppedRecords();

            release.countDown();
            scope.stop();

            assertEquals(recordCount + 1, sinkHandler.size() + dropped);
        }
        finally
        {
            release.countDown();
            scope.stop();
            sinkLogger.removeHandler(blockingHandler);
        }
    }

    @Test
    @InterruptAfter(10)
    void shouldReportSinkFailuresWithoutStoppingCollection()
    {
        final Handler failingHandler = new Handler()
        {
            public void publish(final LogRecord record)
            {
                if ("fail".equals(record.getMessage()))
                {
                    throw new IllegalStateException("sink failure");
                }
            }

            public void flush()
            {
            }

            public void close()
            {
            }
        };
        sinkLogger.addHandler(failingHandler);
        final Logger logger = Logger.getLogger("it.failing");

        try (Logregator ignore = newScope(sinkLogger).start())
        {
            logger.info("fail");
            logger.info("after");
        }
        finally
        {
            sinkLogger.removeHandler(failingHandler);
        }

        verify(errorHandler).onError(any(LogregatorException.class));
        assertEquals(List.of("fail", "after"), sinkHandler.messages());
    }

    @Test
    @InterruptAfter(10)
    void shouldPrintParentRecordsAtSinkLevelToConsole()
    {
        final CapturingPrintStream capturingPrintStream = new CapturingPrintStream();
        final PrintStream savedErr = System.err;
        System.setErr(capturingPrintStream.resetAndGetPrintStream());

        final Logtor logtor;
        try
        {
            logtor = new Logtor(null, false, LogLevel.INFO, true, "it.console");
            final Logger logger = Logger.getLogger("it.scenario");

            try (Logtor ignore = (Logtor)logtor.start())
            {
                logger.info("a");
                logger.fine("b");
                logger.severe("c");
            }

            LoggersTest.closeHandlers(logtor.logger());
        }
        finally
        {
            System.setErr(savedErr);
        }

        final String output = capturingPrintStream.flushAndGetContent();
        assertThat(output, containsString("it.scenario INFO [it.console] - a"));
        assertThat(output, containsString("it.scenario SEVERE [it.console] - c"));
        assertThat(output, not(containsString(" b" + System.lineSeparator())));
        assertThat(output.indexOf("INFO a"), lessThan(output.indexOf("SEVERE c")));
    }

    @Test
    void shouldValidateContextOnConclude()
    {
        assertThrows(LogregatorException.class, () -> context().transportBufferLength(1000).conclude());
        assertThrows(LogregatorException.class, () -> context().maxRecordLength(8).conclude());
        assertThrows(LogregatorException.class, () -> context().collectorDrainTimeoutNs(-1).conclude());
        assertThrows(LogregatorException.class, () -> context().directory(null).conclude());

        final Logregator.Context ctx = context().conclude();
        assertSame(ctx, ctx.conclude());
        assertEquals(InterceptionMode.REDIRECT, ctx.interceptionMode());
        assertNotNull(ctx.threadFactory());
    }

    private Logregator newScope(final Logger logger)
    {
        return new Logregator(new LoggerSink(logger), context());
    }

    private Logregator.Context context()
    {
        return new Logregator.Context()
            .directory(tempDir)
            .transportBufferLength(64 * 1024)
            .errorHandler(errorHandler);
    }
}
