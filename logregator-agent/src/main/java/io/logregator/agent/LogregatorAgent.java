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
package io.logregator.agent;

import io.logregator.ChildProcessBinding;
import io.logregator.InterceptionMode;
import org.agrona.CloseHelper;
import org.agrona.Strings;

import java.lang.instrument.Instrumentation;
import java.util.Map;

import static io.logregator.agent.ConfigOption.*;

/**
 * A Java agent which binds the JVM it is attached to to the transport of a parent's aggregation scope before
 * {@code main} runs, so records from programs which cannot be started via
 * {@link io.logregator.LogregatorLauncher} are still collected.
 * <pre>
 * java -javaagent:logregator-agent.jar[=logregator.transport=/path/to/transport] -cp ... com.example.Main
 * </pre>
 * Without a {@link ConfigOption#TRANSPORT} option the handle is taken from the process environment.
 */
public final class LogregatorAgent
{
    private static ChildProcessBinding.ChildBinding binding;

    private LogregatorAgent()
    {
    }

    /**
     * Premain method to run before the main method of the application.
     *
     * @param agentArgs       containing configuration options, or empty to use system properties.
     * @param instrumentation which is not used.
     */
    public static void premain(final String agentArgs, final Instrumentation instrumentation)
    {
        startBinding(Strings.isEmpty(agentArgs) ? fromSystemProperties() : parseAgentArgs(agentArgs));
    }

    /**
     * Agent main method for dynamic attach.
     *
     * @param agentArgs       containing configuration options or command to stop.
     * @param instrumentation which is not used.
     */
    public static void agentmain(final String agentArgs, final Instrumentation instrumentation)
    {
        if (STOP_COMMAND.equals(agentArgs))
        {
            stopBinding();
        }
        else if (Strings.isEmpty(agentArgs) || START_COMMAND.equals(agentArgs))
        {
            startBinding(fromSystemProperties());
        }
        else
        {
            startBinding(parseAgentArgs(agentArgs));
        }
    }

    /**
     * Is the JVM bound by this agent.
     *
     * @return true if bound by this agent.
     */
    public static synchronized boolean isBound()
    {
        return null != binding;
    }

    /**
     * Restore the root logger and stop sending records to the parent.
     */
    public static synchronized void stopBinding()
    {
        CloseHelper.close(binding);
        binding = null;
    }

    static synchronized void startBinding(final Map<String, String> configOptions)
    {
        if (null != binding)
        {
            throw new IllegalStateException("agent already bound: " + binding.handle());
        }

        String handle = configOptions.get(TRANSPORT);
        if (Strings.isEmpty(handle))
        {
            handle = ChildProcessBinding.handleFromEnvironment();
        }

        if (null == handle)
        {
            return; // not started from an aggregation scope
        }

        final String mode = configOptions.get(INTERCEPTION_MODE);
        InterceptionMode interceptionMode = null;
        if (!Strings.isEmpty(mode))
        {
            try
            {
                interceptionMode = InterceptionMode.valueOf(mode.trim().toUpperCase());
            }
            catch (final IllegalArgumentException ex)
            {
                System.err.println("logregator: records not aggregated, unknown " + INTERCEPTION_MODE + ": " + mode);
                return;
            }
        }

        binding = ChildProcessBinding.bind(handle, interceptionMode);
    }
}
