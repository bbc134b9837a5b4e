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
package io.logregator.exceptions;

/**
 * Base exception for all errors raised by log aggregation.
 */
public class LogregatorException extends RuntimeException
{
    private static final long serialVersionUID = 3315713893462245213L;

    /**
     * Category of {@link Exception}.
     */
    public enum Category
    {
        /**
         * The logging pipeline of the process may be left in a broken state.
         */
        FATAL,

        /**
         * Exception is an error. Corrective action is recommended if understood, otherwise treat as fatal.
         */
        ERROR,

        /**
         * Exception is a warning. Action has been, or will be, taken to handle the condition.
         */
        WARN
    }

    private final Category category;

    /**
     * Exception with provided message and {@link Category#ERROR}.
     *
     * @param message to detail the exception.
     */
    public LogregatorException(final String message)
    {
        super(Category.ERROR.name() + " - " + message);
        this.category = Category.ERROR;
    }

    /**
     * Exception with a detailed message and provided {@link Category}.
     *
     * @param message  providing detail on the error.
     * @param category of the exception.
     */
    public LogregatorException(final String message, final Category category)
    {
        super(category.name() + " - " + message);
        this.category = category;
    }

    /**
     * Exception with a detailed message, cause, and {@link Category#ERROR}.
     *
     * @param message providing detail on the error.
     * @param cause   of the error.
     */
    public LogregatorException(final String message, final Throwable cause)
    {
        super(Category.ERROR.name() + " - " + message, cause);
        this.category = Category.ERROR;
    }

    /**
     * Exception with a detailed message, cause, and {@link Category}.
     *
     * @param message  providing detail on the error.
     * @param cause    of the error.
     * @param category of the exception.
     */
    public LogregatorException(final String message, final Throwable cause, final Category category)
    {
        super(category.name() + " - " + message, cause);
        this.category = category;
    }

    /**
     * {@link Category} of exception for determining what follow-up action can be taken.
     *
     * @return {@link Category} of exception for determining what follow-up action can be taken.
     */
    public Category category()
    {
        return category;
    }

    /**
     * Is the {@link Throwable} a {@link LogregatorException} with {@link Category#WARN}.
     *
     * @param t throwable to check.
     * @return true if a warning otherwise false.
     */
    public static boolean isWarning(final Throwable t)
    {
        return t instanceof LogregatorException && Category.WARN == ((LogregatorException)t).category;
    }
}
