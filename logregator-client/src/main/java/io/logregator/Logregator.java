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
import io.logregator.transport.LogEventEncoder;
import org.agrona.BitUtil;
import org.agrona.ErrorHandler;
import org.agrona.SystemUtil;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.NanoClock;
import org.agrona.concurrent.SleepingIdleStrategy;
import org.agrona.concurrent.SystemNanoClock;

import java.io.File;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static org.agrona.SystemUtil.getDurationInNanos;
import static org.agrona.SystemUtil.getSizeAsInt;

/**
 * Scope within which every record emitted in this process, and in child processes started while it is active,
 * is collected and delivered to a single {@link LogSink}.
 * <pre>{@code
 * try (Logregator ignore = new Logregator(sinkLogger).start())
 * {
 *     Logger.getLogger("a").info("collected");
 *     ChildProcessBinding.start(new ProcessBuilder(command)).waitFor();
 * }
 * }</pre>
 * Scopes nest. While an outer scope is active an inner scope joins its session, so records keep going to the
 * outermost sink. The session is torn down, and the root logger restored, when the last active scope stops.
 * <p>
 * Instances may be started and stopped from any thread, transitions are serialised process wide.
 */
public class Logregator implements AutoCloseable
{
    private final LogSink sink;
    private final Context ctx;
    private ScopeState state = ScopeState.INACTIVE;
    private int depth;
    private AggregationSession session;

    /**
     * Collect records into a logger.
     *
     * @param sinkLogger to deliver collected records to.
     */
    public Logregator(final Logger sinkLogger)
    {
        this(new LoggerSink(sinkLogger));
    }

    /**
     * Collect records into a sink with the default configuration.
     *
     * @param sink to deliver collected records to.
     */
    public Logregator(final LogSink sink)
    {
        this(sink, new Context());
    }

    /**
     * Collect records into a sink.
     *
     * @param sink to deliver collected records to.
     * @param ctx  for configuration.
     */
    public Logregator(final LogSink sink, final Context ctx)
    {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.ctx = Objects.requireNonNull(ctx, "ctx must not be null").conclude();
    }

    /**
     * Activate the scope. Starting an already active scope nests it once more, it then needs one more
     * {@link #stop()} to deactivate.
     *
     * @return this for fluent use with try-with-resources.
     */
    public Logregator start()
    {
        ActiveScopes.LOCK.lock();
        try
        {
            if (ScopeState.ACTIVE == state)
            {
                ActiveScopes.enter(this);
                depth++;
                return this;
            }

            state = ScopeState.ACTIVATING;
            try
            {
                session = ActiveScopes.enter(this);
                depth = 1;
                state = ScopeState.ACTIVE;
            }
            finally
            {
                if (ScopeState.ACTIVE != state)
                {
                    state = ScopeState.INACTIVE;
                }
            }
        }
        finally
        {
            ActiveScopes.LOCK.unlock();
        }

        return this;
    }

    /**
     * Deactivate the scope. Has no effect if the scope is not active.
     *
     * @throws LogregatorException if the root logger could not be restored, the scope is inactive regardless.
     */
    public void stop()
    {
        ActiveScopes.LOCK.lock();
        try
        {
            if (ScopeState.ACTIVE != state)
            {
                return;
            }

            if (--depth > 0)
            {
                ActiveScopes.exit(this);
                return;
            }

            state = ScopeState.DEACTIVATING;
            try
            {
                ActiveScopes.exit(this);
            }
            finally
            {
                session = null;
                state = ScopeState.INACTIVE;
            }
        }
        finally
        {
            ActiveScopes.LOCK.unlock();
        }
    }

    /**
     * Same as {@link #stop()}.
     */
    public void close()
    {
        stop();
    }

    public boolean isStarted()
    {
        return ScopeState.ACTIVE == state();
    }

    public ScopeState state()
    {
        ActiveScopes.LOCK.lock();
        try
        {
            return state;
        }
        finally
        {
            ActiveScopes.LOCK.unlock();
        }
    }

    /**
     * Number of times this scope has been started without being stopped.
     *
     * @return number of nested activations of this scope.
     */
    public int depth()
    {
        ActiveScopes.LOCK.lock();
        try
        {
            return depth;
        }
        finally
        {
            ActiveScopes.LOCK.unlock();
        }
    }

    public LogSink sink()
    {
        return sink;
    }

    public Context context()
    {
        return ctx;
    }

    /**
     * Is this scope's sink the one receiving records, i.e. is it the outermost active scope.
     *
     * @return true if collected records are delivered to this scope's sink.
     */
    public boolean isReceiving()
    {
        ActiveScopes.LOCK.lock();
        try
        {
            return null != session && session.sink() == sink;
        }
        finally
        {
            ActiveScopes.LOCK.unlock();
        }
    }

    /**
     * Handle of the transport children bind to while the scope is active.
     *
     * @return handle of the transport or null if the scope is not active.
     */
    public String transportHandle()
    {
        ActiveScopes.LOCK.lock();
        try
        {
            return null == session ? null : session.handle();
        }
        finally
        {
            ActiveScopes.LOCK.unlock();
        }
    }

    /**
     * Number of records dropped by producers since the session was opened.
     *
     * @return number of records dropped or 0 if the scope is not active.
     */
    public long droppedRecords()
    {
        ActiveScopes.LOCK.lock();
        try
        {
            return null == session ? 0 : session.droppedRecords();
        }
        finally
        {
            ActiveScopes.LOCK.unlock();
        }
    }

    /**
     * Number of records delivered to the sink since the session was opened.
     *
     * @return number of records delivered or 0 if the scope is not active.
     */
    public long deliveredRecords()
    {
        ActiveScopes.LOCK.lock();
        try
        {
            return null == session ? 0 : session.deliveredRecords();
        }
        finally
        {
            ActiveScopes.LOCK.unlock();
        }
    }

    public String toString()
    {
        return getClass().getSimpleName() + "{" +
            "sink=" + sink.name() +
            ", state=" + state() +
            '}';
    }

    /**
     * Configuration options with defaults and the system properties which override them.
     */
    public static class Configuration
    {
        /**
         * Directory in which transport files are created.
         */
        public static final String DIR_PROP_NAME = "logregator.dir";

        /**
         * Default directory, {@code /dev/shm/logregator-<user>} where available, else under the temp directory.
         */
        public static final String DIR_DEFAULT;

        /**
         * Capacity of the transport ring buffer, must be a power of 2.
         */
        public static final String TRANSPORT_BUFFER_LENGTH_PROP_NAME = "logregator.transport.buffer.length";

        /**
         * Default capacity of the transport ring buffer.
         */
        public static final int TRANSPORT_BUFFER_LENGTH_DEFAULT = 1024 * 1024;

        /**
         * Maximum encoded length of a single record, longer messages are truncated.
         */
        public static final String MAX_RECORD_LENGTH_PROP_NAME = "logregator.record.max.length";

        /**
         * Default maximum encoded length of a single record.
         */
        public static final int MAX_RECORD_LENGTH_DEFAULT = 16 * 1024;

        /**
         * Time the collector keeps delivering remaining records after the transport is closed.
         */
        public static final String COLLECTOR_DRAIN_TIMEOUT_PROP_NAME = "logregator.collector.drain.timeout";

        /**
         * Default drain timeout.
         */
        public static final long COLLECTOR_DRAIN_TIMEOUT_DEFAULT_NS = TimeUnit.SECONDS.toNanos(2);

        /**
         * Time scope exit waits for the collector thread to stop before abandoning it.
         */
        public static final String COLLECTOR_JOIN_TIMEOUT_PROP_NAME = "logregator.collector.join.timeout";

        /**
         * Default join timeout.
         */
        public static final long COLLECTOR_JOIN_TIMEOUT_DEFAULT_NS = TimeUnit.SECONDS.toNanos(5);

        /**
         * Time the collector sleeps when no records are available.
         */
        public static final String COLLECTOR_IDLE_SLEEP_PROP_NAME = "logregator.collector.idle.sleep";

        /**
         * Default idle sleep.
         */
        public static final long COLLECTOR_IDLE_SLEEP_DEFAULT_NS = TimeUnit.MILLISECONDS.toNanos(1);

        /**
         * {@link InterceptionMode} name for what happens to the root handlers while records are captured.
         */
        public static final String INTERCEPTION_MODE_PROP_NAME = "logregator.interception.mode";

        /**
         * Default interception mode.
         */
        public static final InterceptionMode INTERCEPTION_MODE_DEFAULT = InterceptionMode.REDIRECT;

        /**
         * Prints errors to {@link System#err}. Warnings get a single line, anything else its stack trace.
         */
        public static final ErrorHandler DEFAULT_ERROR_HANDLER =
            (throwable) ->
            {
                synchronized (System.err)
                {
                    if (LogregatorException.isWarning(throwable))
                    {
                        System.err.println(System.currentTimeMillis() + " WARN - " + throwable.getMessage());
                    }
                    else
                    {
                        System.err.println(System.currentTimeMillis() + " Exception:");
                        throwable.printStackTrace(System.err);
                    }
                }
            };

        static
        {
            String baseDirName = null;

            if (SystemUtil.isLinux())
            {
                final File devShmDir = new File("/dev/shm");
                if (devShmDir.exists())
                {
                    baseDirName = "/dev/shm/logregator";
                }
            }

            if (null == baseDirName)
            {
                baseDirName = SystemUtil.tmpDirName() + "logregator";
            }

            DIR_DEFAULT = baseDirName + '-' + System.getProperty("user.name", "default");
        }

        public static String dir()
        {
            return System.getProperty(DIR_PROP_NAME, DIR_DEFAULT);
        }

        public static int transportBufferLength()
        {
            return getSizeAsInt(TRANSPORT_BUFFER_LENGTH_PROP_NAME, TRANSPORT_BUFFER_LENGTH_DEFAULT);
        }

        public static int maxRecordLength()
        {
            return getSizeAsInt(MAX_RECORD_LENGTH_PROP_NAME, MAX_RECORD_LENGTH_DEFAULT);
        }

        public static long collectorDrainTimeoutNs()
        {
            return getDurationInNanos(COLLECTOR_DRAIN_TIMEOUT_PROP_NAME, COLLECTOR_DRAIN_TIMEOUT_DEFAULT_NS);
        }

        public static long collectorJoinTimeoutNs()
        {
            return getDurationInNanos(COLLECTOR_JOIN_TIMEOUT_PROP_NAME, COLLECTOR_JOIN_TIMEOUT_DEFAULT_NS);
        }

        public static long collectorIdleSleepNs()
        {
            return getDurationInNanos(COLLECTOR_IDLE_SLEEP_PROP_NAME, COLLECTOR_IDLE_SLEEP_DEFAULT_NS);
        }

        /**
         * Interception mode from {@link #INTERCEPTION_MODE_PROP_NAME}.
         *
         * @return the configured interception mode.
         * @throws LogregatorException if the property is not a valid mode.
         */
        public static InterceptionMode interceptionMode()
        {
            final String value = System.getProperty(INTERCEPTION_MODE_PROP_NAME);
            if (null == value)
            {
                return INTERCEPTION_MODE_DEFAULT;
            }

            try
            {
                return InterceptionMode.valueOf(value.trim().toUpperCase());
            }
            catch (final IllegalArgumentException ex)
            {
                throw new LogregatorException(INTERCEPTION_MODE_PROP_NAME + " invalid: " + value, ex);
            }
        }
    }

    /**
     * Configuration for a {@link Logregator}. Defaults are taken from {@link Configuration} when constructed.
     */
    public static class Context
    {
        private File directory = new File(Configuration.dir());
        private int transportBufferLength = Configuration.transportBufferLength();
        private int maxRecordLength = Configuration.maxRecordLength();
        private long collectorDrainTimeoutNs = Configuration.collectorDrainTimeoutNs();
        private long collectorJoinTimeoutNs = Configuration.collectorJoinTimeoutNs();
        private InterceptionMode interceptionMode;
        private IdleStrategy collectorIdleStrategy;
        private ErrorHandler errorHandler;
        private ThreadFactory threadFactory;
        private NanoClock nanoClock;

        /**
         * Validate the configuration and fill in defaults for anything not set.
         *
         * @return this for a fluent API.
         * @throws LogregatorException if the configuration is invalid.
         */
        public Context conclude()
        {
            if (null == directory)
            {
                throw new LogregatorException("directory must be set");
            }

            if (!BitUtil.isPowerOfTwo(transportBufferLength))
            {
                throw new LogregatorException(
                    "transportBufferLength must be a positive power of 2: " + transportBufferLength);
            }

            if (maxRecordLength < LogEventEncoder.MIN_ENCODED_LENGTH)
            {
                throw new LogregatorException(
                    "maxRecordLength=" + maxRecordLength + " < minimum=" + LogEventEncoder.MIN_ENCODED_LENGTH);
            }

            if (collectorDrainTimeoutNs < 0 || collectorJoinTimeoutNs < 0)
            {
                throw new LogregatorException("collector timeouts must not be negative: drain=" +
                    collectorDrainTimeoutNs + " join=" + collectorJoinTimeoutNs);
            }

            if (null == interceptionMode)
            {
                interceptionMode = Configuration.interceptionMode();
            }

            if (null == collectorIdleStrategy)
            {
                collectorIdleStrategy = new SleepingIdleStrategy(Configuration.collectorIdleSleepNs());
            }

            if (null == errorHandler)
            {
                errorHandler = Configuration.DEFAULT_ERROR_HANDLER;
            }

            if (null == threadFactory)
            {
                threadFactory = (runnable) ->
                {
                    final Thread thread = new Thread(runnable);
                    thread.setDaemon(true);
                    return thread;
                };
            }

            if (null == nanoClock)
            {
                nanoClock = SystemNanoClock.INSTANCE;
            }

            return this;
        }

        public Context directory(final File directory)
        {
            this.directory = directory;
            return this;
        }

        public File directory()
        {
            return directory;
        }

        public Context transportBufferLength(final int transportBufferLength)
        {
            this.transportBufferLength = transportBufferLength;
            return this;
        }

        public int transportBufferLength()
        {
            return transportBufferLength;
        }

        public Context maxRecordLength(final int maxRecordLength)
        {
            this.maxRecordLength = maxRecordLength;
            return this;
        }

        public int maxRecordLength()
        {
            return maxRecordLength;
        }

        public Context collectorDrainTimeoutNs(final long collectorDrainTimeoutNs)
        {
            this.collectorDrainTimeoutNs = collectorDrainTimeoutNs;
            return this;
        }

        public long collectorDrainTimeoutNs()
        {
            return collectorDrainTimeoutNs;
        }

        public Context collectorJoinTimeoutNs(final long collectorJoinTimeoutNs)
        {
            this.collectorJoinTimeoutNs = collectorJoinTimeoutNs;
            return this;
        }

        public long collectorJoinTimeoutNs()
        {
            return collectorJoinTimeoutNs;
        }

        public Context interceptionMode(final InterceptionMode interceptionMode)
        {
            this.interceptionMode = interceptionMode;
            return this;
        }

        public InterceptionMode interceptionMode()
        {
            return interceptionMode;
        }

        public Context collectorIdleStrategy(final IdleStrategy collectorIdleStrategy)
        {
            this.collectorIdleStrategy = collectorIdleStrategy;
            return this;
        }

        public IdleStrategy collectorIdleStrategy()
        {
            return collectorIdleStrategy;
        }

        /**
         * Handler for errors which cannot be raised to the caller, such as a failing sink.
         *
         * @param errorHandler for errors which cannot be raised to the caller.
         * @return this for a fluent API.
         */
        public Context errorHandler(final ErrorHandler errorHandler)
        {
            this.errorHandler = errorHandler;
            return this;
        }

        public ErrorHandler errorHandler()
        {
            return errorHandler;
        }

        /**
         * Factory for the collector thread which should create daemon threads.
         *
         * @param threadFactory for the collector thread.
         * @return this for a fluent API.
         */
        public Context threadFactory(final ThreadFactory threadFactory)
        {
            this.threadFactory = threadFactory;
            return this;
        }

        public ThreadFactory threadFactory()
        {
            return threadFactory;
        }

        public Context nanoClock(final NanoClock nanoClock)
        {
            this.nanoClock = nanoClock;
            return this;
        }

        public NanoClock nanoClock()
        {
            return nanoClock;
        }

        public String toString()
        {
            return "Logregator.Context{" +
                "directory=" + directory +
                ", transportBufferLength=" + transportBufferLength +
                ", maxRecordLength=" + maxRecordLength +
                ", collectorDrainTimeoutNs=" + collectorDrainTimeoutNs +
                ", collectorJoinTimeoutNs=" + collectorJoinTimeoutNs +
                ", interceptionMode=" + interceptionMode +
                '}';
        }
    }
}
