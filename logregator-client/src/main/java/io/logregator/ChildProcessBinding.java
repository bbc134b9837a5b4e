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

import io.logregator.transport.LogTransport;
import org.agrona.CloseHelper;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * Passes the active transport handle to child processes and binds a child process to it.
 * <p>
 * The parent side puts the handle in the {@link #TRANSPORT_ENV_VAR} environment variable of a
 * {@link ProcessBuilder}. The child side, usually via {@link LogregatorLauncher} or the agent, reads it from
 * the {@link #TRANSPORT_PROP_NAME} system property or the environment and captures its root logger into the
 * parent's transport.
 */
public final class ChildProcessBinding
{
    /**
     * Environment variable carrying the transport handle to a child process.
     */
    public static final String TRANSPORT_ENV_VAR = "LOGREGATOR_TRANSPORT";

    /**
     * System property carrying the transport handle, takes precedence over {@link #TRANSPORT_ENV_VAR}.
     */
    public static final String TRANSPORT_PROP_NAME = "logregator.transport";

    private static volatile ChildBinding binding;

    private ChildProcessBinding()
    {
    }

    /**
     * Handle children should bind to: the active scope's transport, else the transport this process is bound
     * to so grandchildren reach the same sink.
     *
     * @return the current handle or null if there is none.
     */
    public static String currentHandle()
    {
        final String activeHandle = ActiveScopes.activeHandle();
        if (null != activeHandle)
        {
            return activeHandle;
        }

        final ChildBinding binding = ChildProcessBinding.binding;

        return null == binding ? null : binding.handle();
    }

    /**
     * Environment entries to pass to a child process.
     *
     * @return the environment entries, empty if there is no current handle.
     */
    public static Map<String, String> environment()
    {
        final String handle = currentHandle();

        return null == handle ? Collections.emptyMap() : Collections.singletonMap(TRANSPORT_ENV_VAR, handle);
    }

    /**
     * Apply the binding to the environment of a process builder, removing any inherited handle when there is
     * no current one.
     *
     * @param processBuilder to apply the binding to.
     * @return the process builder.
     */
    public static ProcessBuilder apply(final ProcessBuilder processBuilder)
    {
        final String handle = currentHandle();
        final Map<String, String> environment = processBuilder.environment();

        if (null == handle)
        {
            environment.remove(TRANSPORT_ENV_VAR);
        }
        else
        {
            environment.put(TRANSPORT_ENV_VAR, handle);
        }

        return processBuilder;
    }

    /**
     * Apply the binding and start the process.
     *
     * @param processBuilder for the child process.
     * @return the started process.
     * @throws IOException if the process could not be started.
     */
    public static Process start(final ProcessBuilder processBuilder) throws IOException
    {
        return apply(processBuilder).start();
    }

    /**
     * The handle passed to this process by its parent.
     *
     * @return the handle or null if none was passed.
     */
    public static String handleFromEnvironment()
    {
        final String handle = System.getProperty(TRANSPORT_PROP_NAME);
        if (null != handle && !handle.isEmpty())
        {
            return handle;
        }

        final String envHandle = System.getenv(TRANSPORT_ENV_VAR);

        return null == envHandle || envHandle.isEmpty() ? null : envHandle;
    }

    /**
     * Bind to the handle passed by the parent process, if any.
     *
     * @return the binding, or null if no handle was passed or binding failed.
     * @see #bind(String)
     */
    public static ChildBinding bindFromEnvironment()
    {
        final String handle = handleFromEnvironment();

        return null == handle ? null : bind(handle);
    }

    /**
     * Capture every record emitted in this process into the transport with the given handle using the configured
     * {@link InterceptionMode}.
     *
     * @param handle of the transport.
     * @return the binding to close when done, or null if binding failed.
     * @throws IllegalStateException if already bound to a different handle.
     * @see #bind(String, InterceptionMode)
     */
    public static ChildBinding bind(final String handle)
    {
        return bind(handle, null);
    }

    /**
     * Capture every record emitted in this process into the transport with the given handle. Failure to bind is
     * reported as a warning on {@link System#err} and records are then handled locally.
     *
     * @param handle           of the transport.
     * @param interceptionMode for the root handlers, null for the configured mode.
     * @return the binding to close when done, or null if binding failed.
     * @throws IllegalStateException if already bound to a different handle.
     */
    public static synchronized ChildBinding bind(final String handle, final InterceptionMode interceptionMode)
    {
        final ChildBinding existing = binding;
        if (null != existing)
        {
            if (existing.handle().equals(handle))
            {
                return existing;
            }

            throw new IllegalStateException("already bound: " + existing.handle());
        }

        LogTransport transport = null;
        final RootLoggerInterceptor interceptor;
        try
        {
            transport = LogTransport.connect(handle);
            interceptor = new RootLoggerInterceptor(
                new TransportHandler(transport, transport.minLevel()),
                null == interceptionMode ? Logregator.Configuration.interceptionMode() : interceptionMode);
            interceptor.install();
        }
        catch (final RuntimeException ex)
        {
            CloseHelper.quietClose(transport);
            System.err.println("logregator: records not aggregated, unable to bind to " + handle + ": " + ex);
            return null;
        }

        binding = new ChildBinding(transport, interceptor);

        return binding;
    }

    /**
     * Is this process bound to a parent's transport.
     *
     * @return true if bound.
     */
    public static boolean isBound()
    {
        return null != binding;
    }

    private static synchronized void unbind(final ChildBinding childBinding)
    {
        if (binding == childBinding)
        {
            binding = null;
        }
    }

    /**
     * Binding of this process to a parent's transport. Closing restores the root logger.
     */
    public static final class ChildBinding implements AutoCloseable
    {
        private final LogTransport transport;
        private final RootLoggerInterceptor interceptor;
        private boolean isClosed;

        ChildBinding(final LogTransport transport, final RootLoggerInterceptor interceptor)
        {
            this.transport = transport;
            this.interceptor = interceptor;
        }

        public String handle()
        {
            return transport.handle();
        }

        public LogTransport transport()
        {
            return transport;
        }

        /**
         * Restore the root logger and stop sending. Idempotent.
         */
        public void close()
        {
            synchronized (ChildProcessBinding.class)
            {
                if (!isClosed)
                {
                    isClosed = true;
                    try
                    {
                        interceptor.restore();
                    }
                    finally
                    {
                        transport.close();
                        unbind(this);
                    }
                }
            }
        }

        public String toString()
        {
            return "ChildBinding{" +
                "handle=" + handle() +
                ", isClosed=" + isClosed +
                '}';
        }
    }
}
