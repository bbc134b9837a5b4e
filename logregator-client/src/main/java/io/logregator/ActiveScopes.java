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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide stack of active {@link Logregator}s and the {@link AggregationSession} they share.
 * <p>
 * The session is opened by the first scope to enter and closed when the last scope leaves, so nested scopes
 * keep delivering to the outermost sink. Every method must be called while holding {@link #LOCK} apart from
 * {@link #activeHandle()}.
 */
final class ActiveScopes
{
    static final ReentrantLock LOCK = new ReentrantLock();

    private static final Deque<Logregator> SCOPES = new ArrayDeque<>();
    private static AggregationSession session;
    private static volatile String activeHandle;

    private ActiveScopes()
    {
    }

    static AggregationSession enter(final Logregator scope)
    {
        if (null == session)
        {
            session = AggregationSession.open(scope.sink(), scope.context());
            activeHandle = session.handle();
        }

        SCOPES.push(scope);

        return session;
    }

    static void exit(final Logregator scope)
    {
        SCOPES.removeFirstOccurrence(scope);

        if (SCOPES.isEmpty() && null != session)
        {
            final AggregationSession closingSession = session;
            session = null;
            activeHandle = null;

            closingSession.close();
        }
    }

    static int depth()
    {
        return SCOPES.size();
    }

    /**
     * Handle of the transport for the active session which children should bind to.
     *
     * @return handle of the active transport or null if no scope is active.
     */
    static String activeHandle()
    {
        return activeHandle;
    }
}
