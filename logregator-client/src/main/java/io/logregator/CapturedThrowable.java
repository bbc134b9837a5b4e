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

import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * Stands in for an exception thrown in another process by replaying its rendered stack trace.
 * <p>
 * Handlers and formatters which print {@link java.util.logging.LogRecord#getThrown()} get the original text.
 */
public final class CapturedThrowable extends RuntimeException
{
    private static final long serialVersionUID = -5617410981834297032L;

    private final String stackTraceText;

    /**
     * Construct from rendered stack trace text.
     *
     * @param stackTraceText as printed by {@link Throwable#printStackTrace()} in the emitting process.
     */
    public CapturedThrowable(final String stackTraceText)
    {
        super(firstLine(stackTraceText), null, false, false);
        this.stackTraceText = stackTraceText;
    }

    /**
     * The stack trace text captured in the emitting process.
     *
     * @return the stack trace text.
     */
    public String stackTraceText()
    {
        return stackTraceText;
    }

    public void printStackTrace(final PrintStream s)
    {
        s.print(stackTraceText);
    }

    public void printStackTrace(final PrintWriter s)
    {
        s.print(stackTraceText);
    }

    public String toString()
    {
        return getMessage();
    }

    private static String firstLine(final String text)
    {
        final int index = text.indexOf('\n');
        if (-1 == index)
        {
            return text;
        }

        return index > 0 && text.charAt(index - 1) == '\r' ? text.substring(0, index - 1) : text.substring(0, index);
    }
}
