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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Installs a capturing handler on the root logger and restores the root logger to exactly how it was found.
 * <p>
 * Install snapshots the root level and handler list. In {@link InterceptionMode#REDIRECT} mode each snapshot
 * handler is swapped for a {@link RedeliveredRecordHandler} so it only sees records redelivered by a collector,
 * e.g. via a sink logger which propagates to the root. Restore removes the capturing handler and the wrappers,
 * re-attaches the snapshot handlers in their original order ahead of any handlers added since, and resets the
 * level.
 */
final class RootLoggerInterceptor
{
    private final Handler handler;
    private final InterceptionMode mode;
    private final List<Handler> redeliveryHandlers = new ArrayList<>();
    private Logger rootLogger;
    private Level savedLevel;
    private Handler[] savedHandlers;
    private boolean isInstalled;

    RootLoggerInterceptor(final Handler handler, final InterceptionMode mode)
    {
        this.handler = handler;
        this.mode = mode;
    }

    Handler handler()
    {
        return handler;
    }

    boolean isInstalled()
    {
        return isInstalled;
    }

    void install()
    {
        if (isInstalled)
        {
            throw new LogregatorException("interception already installed", LogregatorException.Category.ERROR);
        }

        final Logger root = LogManager.getLogManager().getLogger("");
        savedLevel = root.getLevel();
        savedHandlers = root.getHandlers();

        if (InterceptionMode.REDIRECT == mode)
        {
            for (final Handler savedHandler : savedHandlers)
            {
                final Handler redeliveryHandler = new RedeliveredRecordHandler(savedHandler);
                root.removeHandler(savedHandler);
                root.addHandler(redeliveryHandler);
                redeliveryHandlers.add(redeliveryHandler);
            }
        }

        root.addHandler(handler);

        final Level handlerLevel = handler.getLevel();
        if (null == savedLevel || handlerLevel.intValue() < savedLevel.intValue())
        {
            root.setLevel(handlerLevel);
        }

        rootLogger = root;
        isInstalled = true;
    }

    void restore()
    {
        if (!isInstalled)
        {
            throw new LogregatorException(
                "cannot restore root logger, interception was not installed", LogregatorException.Category.ERROR);
        }

        isInstalled = false;
        final Logger root = rootLogger;
        rootLogger = null;

        final List<Handler> current = new ArrayList<>(Arrays.asList(root.getHandlers()));
        final boolean wasAttached = current.remove(handler);
        current.removeAll(redeliveryHandlers);
        redeliveryHandlers.clear();

        for (final Handler currentHandler : root.getHandlers())
        {
            root.removeHandler(currentHandler);
        }

        final List<Handler> added = new ArrayList<>(current);
        added.removeAll(Arrays.asList(savedHandlers));

        for (final Handler savedHandler : savedHandlers)
        {
            root.addHandler(savedHandler);
        }

        for (final Handler addedHandler : added)
        {
            root.addHandler(addedHandler);
        }

        root.setLevel(savedLevel);

        final Logger currentRoot = LogManager.getLogManager().getLogger("");
        if (!wasAttached || currentRoot != root)
        {
            throw new LogregatorException(
                "root logger was reconfigured while records were being captured, capture handler " +
                (wasAttached ? "attached to a replaced root logger" : "was removed"),
                LogregatorException.Category.ERROR);
        }
    }

    /**
     * Passes only {@link AggregatedLogRecord}s to a root handler detached by {@link InterceptionMode#REDIRECT}.
     */
    static final class RedeliveredRecordHandler extends Handler
    {
        private final Handler delegate;

        RedeliveredRecordHandler(final Handler delegate)
        {
            this.delegate = delegate;
        }

        Handler delegate()
        {
            return delegate;
        }

        public void publish(final LogRecord record)
        {
            if (record instanceof AggregatedLogRecord)
            {
                delegate.publish(record);
            }
        }

        public void flush()
        {
            delegate.flush();
        }

        public void close()
        {
            // the delegate is re-attached on restore and stays open
        }

        public String toString()
        {
            return "RedeliveredRecordHandler{" +
                "delegate=" + delegate +
                '}';
        }
    }
}
