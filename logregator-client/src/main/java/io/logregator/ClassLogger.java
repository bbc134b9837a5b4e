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

import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Lazily resolved logger named after the class which declares it.
 * <pre>{@code
 * private static final ClassLogger LOG = new ClassLogger();
 * ...
 * LOG.get().info("started");
 * }</pre>
 * The logger is named {@code package.Class}, or {@code parent.SimpleName} when a parent logger is given.
 */
public final class ClassLogger implements Supplier<Logger>
{
    private static final StackWalker STACK_WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private final Class<?> owner;
    private final Logger parent;
    private volatile Logger logger;

    /**
     * Logger for the class calling this constructor.
     */
    public ClassLogger()
    {
        this(STACK_WALKER.getCallerClass(), null);
    }

    /**
     * Logger for the class calling this constructor, named beneath a parent logger.
     *
     * @param parent whose name prefixes the logger name.
     */
    public ClassLogger(final Logger parent)
    {
        this(STACK_WALKER.getCallerClass(), parent);
    }

    private ClassLogger(final Class<?> owner, final Logger parent)
    {
        this.owner = owner;
        this.parent = parent;
    }

    /**
     * Logger for a given class.
     *
     * @param owner the logger is named after.
     * @return the class logger.
     */
    public static ClassLogger of(final Class<?> owner)
    {
        return new ClassLogger(owner, null);
    }

    /**
     * Logger for a given class, named beneath a parent logger.
     *
     * @param owner  the logger is named after.
     * @param parent whose name prefixes the logger name.
     * @return the class logger.
     */
    public static ClassLogger of(final Class<?> owner, final Logger parent)
    {
        return new ClassLogger(owner, parent);
    }

    public Class<?> owner()
    {
        return owner;
    }

    public String name()
    {
        if (null == parent)
        {
            return owner.getName().replace('$', '.');
        }

        return parent.getName() + "." + owner.getSimpleName();
    }

    public Logger get()
    {
        Logger logger = this.logger;
        if (null == logger)
        {
            logger = Logger.getLogger(name());
            this.logger = logger;
        }

        return logger;
    }
}
