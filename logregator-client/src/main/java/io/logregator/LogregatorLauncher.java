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

import org.agrona.CloseHelper;
import org.agrona.LangUtil;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;

/**
 * Runs the main method of another class with this process bound to the transport passed by its parent.
 * <pre>
 * java -cp ... io.logregator.LogregatorLauncher com.example.Main [args...]
 * </pre>
 */
public final class LogregatorLauncher
{
    private LogregatorLauncher()
    {
    }

    /**
     * Bind, run the target main method, then unbind.
     *
     * @param args the main class name followed by its arguments.
     * @throws Exception if the main class cannot be loaded.
     */
    public static void main(final String[] args) throws Exception
    {
        if (args.length < 1)
        {
            throw new IllegalArgumentException("usage: LogregatorLauncher <main-class> [args...]");
        }

        final Method mainMethod = Class.forName(args[0]).getMethod("main", String[].class);
        final String[] mainArgs = Arrays.copyOfRange(args, 1, args.length);

        final ChildProcessBinding.ChildBinding binding = ChildProcessBinding.bindFromEnvironment();
        try
        {
            mainMethod.invoke(null, (Object)mainArgs);
        }
        catch (final InvocationTargetException ex)
        {
            LangUtil.rethrowUnchecked(ex.getCause());
        }
        finally
        {
            CloseHelper.close(binding);
        }
    }
}
