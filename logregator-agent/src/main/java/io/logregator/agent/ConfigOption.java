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
import io.logregator.Logregator;
import org.agrona.Strings;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * A set of configuration options.
 */
final class ConfigOption
{
    /**
     * Handle of the transport to bind to. If not set then the environment of the process is used.
     */
    static final String TRANSPORT = ChildProcessBinding.TRANSPORT_PROP_NAME;

    /**
     * {@link io.logregator.InterceptionMode} for the root handlers of the bound process.
     */
    static final String INTERCEPTION_MODE = Logregator.Configuration.INTERCEPTION_MODE_PROP_NAME;

    static final String START_COMMAND = "start";
    static final String STOP_COMMAND = "stop";

    private static final char VALUE_SEPARATOR = '=';
    private static final char OPTION_SEPARATOR = '|';

    static Map<String, String> fromSystemProperties()
    {
        final HashMap<String, String> result = new HashMap<>();
        final Properties properties = System.getProperties();
        for (final String name : properties.stringPropertyNames())
        {
            result.put(name, properties.getProperty(name));
        }
        return result;
    }

    static Map<String, String> parseAgentArgs(final String agentArgs)
    {
        if (Strings.isEmpty(agentArgs))
        {
            throw new IllegalArgumentException("cannot parse empty value");
        }

        final Map<String, String> values = new HashMap<>();

        int optionIndex = -1;
        do
        {
            final int valueIndex = agentArgs.indexOf(VALUE_SEPARATOR, optionIndex);
            if (valueIndex <= 0)
            {
                break;
            }

            int nameIndex = -1;
            while (optionIndex < valueIndex)
            {
                nameIndex = optionIndex;
                optionIndex = agentArgs.indexOf(OPTION_SEPARATOR, optionIndex + 1);
                if (optionIndex < 0)
                {
                    break;
                }
            }

            final String optionName = agentArgs.substring(nameIndex + 1, valueIndex);
            final String value = agentArgs.substring(
                valueIndex + 1,
                optionIndex > 0 ? optionIndex : agentArgs.length());
            values.put(optionName, value);
        }
        while (optionIndex > 0);

        return values;
    }
}
