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
import io.logregator.transport.LogTransport;
import org.agrona.CloseHelper;
import org.agrona.ErrorHandler;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.AgentTerminationException;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Resources shared by every active {@link Logregator} in the process: the transport, the collector thread and
 * the root logger interception.
 */
final class AggregationSession
{
    private final LogSink sink;
    private final LogTransport transport;
    private final LogCollector collector;
    private final AgentRunner runner;
    private final Thread collectorThread;
    private final RootLoggerInterceptor interceptor;
    private final ErrorHandler errorHandler;
    private final long joinTimeoutNs;

    private AggregationSession(
        final LogSink sink,
        final LogTransport transport,
        final LogCollector collector,
        final AgentRunner runner,
        final Thread collectorThread,
        final RootLoggerInterceptor interceptor,
        final Logregator.Context ctx)
    {
        this.sink = sink;
        this.transport = transport;
        this.collector = collector;
        this.runner = runner;
        this.collectorThread = collectorThread;
        this.interceptor = interceptor;
        this.errorHandler = ctx.errorHandler();
        this.joinTimeoutNs = ctx.collectorJoinTimeoutNs();
    }

    /**
     * Create the transport, start the collector, then install interception. Anything already acquired is
     * released if a later step fails.
     *
     * @param sink to deliver records to.
     * @param ctx  for configuration.
     * @return the open session.
     */
    static AggregationSession open(final LogSink sink, final Logregator.Context ctx)
    {
        final Level level = sink.effectiveLevel();
        final LogTransport transport = LogTransport.create(
            ctx.directory(), ctx.transportBufferLength(), ctx.maxRecordLength(), level);

        AgentRunner runner = null;
        Thread collectorThread = null;
        try
        {
            final LogCollector collector = new LogCollector(
                transport, sink, ctx.errorHandler(), ctx.nanoClock(), ctx.collectorDrainTimeoutNs());
            runner = new AgentRunner(
                ctx.collectorIdleStrategy(), terminationFilter(ctx.errorHandler()), null, collector);
            collectorThread = AgentRunner.startOnThread(runner, ctx.threadFactory());

            final RootLoggerInterceptor interceptor = new RootLoggerInterceptor(
                new TransportHandler(transport, level), ctx.interceptionMode());
            interceptor.install();

            return new AggregationSession(sink, transport, collector, runner, collectorThread, interceptor, ctx);
        }
        catch (final Throwable ex)
        {
            transport.close();
            CloseHelper.quietClose(runner);
            transport.delete();
            throw ex;
        }
    }

    LogSink sink()
    {
        return sink;
    }

    String handle()
    {
        return transport.handle();
    }

    long droppedRecords()
    {
        return transport.droppedRecords();
    }

    long deliveredRecords()
    {
        return collector.deliveredRecords();
    }

    /**
     * Close the transport, wait for the collector to drain and stop, restore the root logger, then delete the
     * transport file.
     *
     * @throws LogregatorException if the root logger could not be restored, after every other step completed.
     */
    void close()
    {
        transport.close();

        if (awaitCollector())
        {
            CloseHelper.close(errorHandler, runner);
        }
        else
        {
            errorHandler.onError(new LogregatorException(
                "collector did not stop within " + TimeUnit.NANOSECONDS.toMillis(joinTimeoutNs) +
                "ms, undelivered records abandoned", LogregatorException.Category.WARN));
        }

        LogregatorException restoreException = null;
        try
        {
            interceptor.restore();
        }
        catch (final LogregatorException ex)
        {
            restoreException = ex;
        }

        transport.delete();

        if (null != restoreException)
        {
            throw restoreException;
        }
    }

    private static ErrorHandler terminationFilter(final ErrorHandler errorHandler)
    {
        return (throwable) ->
        {
            // normal completion of the collector once the transport has drained
            if (!(throwable instanceof AgentTerminationException))
            {
                errorHandler.onError(throwable);
            }
        };
    }

    private boolean awaitCollector()
    {
        try
        {
            TimeUnit.NANOSECONDS.timedJoin(collectorThread, joinTimeoutNs);
        }
        catch (final InterruptedException ex)
        {
            Thread.currentThread().interrupt();
        }

        return !collectorThread.isAlive();
    }
}
