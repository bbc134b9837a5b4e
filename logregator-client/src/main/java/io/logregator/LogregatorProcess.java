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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Starts Java child processes on the current classpath which are bound to the active scope.
 */
public final class LogregatorProcess
{
    private LogregatorProcess()
    {
    }

    /**
     * Process builder which runs the main class of this classpath via {@link LogregatorLauncher}.
     *
     * @param mainClass to run.
     * @param args      to pass to the main method.
     * @return the process builder which has not had the binding applied yet.
     */
    public static ProcessBuilder builder(final Class<?> mainClass, final String... args)
    {
        final List<String> command = new ArrayList<>();
        command.add(javaBinary());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(LogregatorLauncher.class.getName());
        command.add(mainClass.getName());
        command.addAll(Arrays.asList(args));

        return new ProcessBuilder(command);
    }

    /**
     * Start a main class in a child JVM bound to the active scope.
     *
     * @param mainClass to run.
     * @param args      to pass to the main method.
     * @return the started process.
     * @throws IOException if the process could not be started.
     */
    public static Process start(final Class<?> mainClass, final String... args) throws IOException
    {
        return ChildProcessBinding.start(builder(mainClass, args));
    }

    static String javaBinary()
    {
        return System.getProperty("java.home") + File.separator + "bin" + File.separator + "java";
    }
}
