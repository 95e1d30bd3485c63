/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package docroute.utils.async;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cancellation signal accepted by every suspending operation. Operations check it on entry and again at
 * their next suspension point; listeners registered with {@link #onCancel(Runnable)} run at most once.
 */
public class Cancellation
{
    public static final Cancellation NONE = new Cancellation()
    {
        @Override
        public void cancel()
        {
            throw new UnsupportedOperationException("Cancellation.NONE cannot be cancelled");
        }

        @Override
        public Registration onCancel(Runnable listener)
        {
            return Registration.NOOP;
        }
    };

    public interface Registration
    {
        Registration NOOP = () -> {};

        void unregister();
    }

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    protected Cancellation() {}

    public static Cancellation create()
    {
        return new Cancellation();
    }

    public void cancel()
    {
        synchronized (this)
        {
            if (cancelled)
                return;
            cancelled = true;
        }
        for (Runnable listener : listeners)
            listener.run();
        listeners.clear();
    }

    public boolean isCancelled()
    {
        return cancelled;
    }

    public void throwIfCancelled()
    {
        if (cancelled)
            throw new CancellationException("Operation was cancelled");
    }

    /**
     * Registers a listener, running it immediately if already cancelled
     */
    public Registration onCancel(Runnable listener)
    {
        synchronized (this)
        {
            if (!cancelled)
            {
                listeners.add(listener);
                return () -> listeners.remove(listener);
            }
        }
        listener.run();
        return Registration.NOOP;
    }
}
