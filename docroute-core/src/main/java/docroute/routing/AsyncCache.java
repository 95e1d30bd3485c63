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

package docroute.routing;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import javax.annotation.Nullable;

import docroute.utils.async.AsyncChain;
import docroute.utils.async.AsyncChains;
import docroute.utils.async.AsyncResults;
import docroute.utils.async.Cancellation;

/**
 * Per-key coalescing cache of asynchronously fetched values.
 *
 * At most one fetch per key is in flight; every caller arriving while it runs waits on the same result. A forced
 * refresh only starts a new fetch when the cached value is still the same instance the caller saw as obsolete, so N callers
 * that all observed the same stale value cause exactly one fetch. Failed fetches and fetches producing {@code null}
 * are not retained, so the next caller fetches again.
 */
public class AsyncCache<K, V>
{
    private static class Entry<V> extends AsyncResults.Settable<V>
    {
        private volatile V value;

        @Override
        public boolean trySuccess(V value)
        {
            if (isDone())
                return false;
            this.value = value;
            return super.trySuccess(value);
        }
    }

    private final ConcurrentHashMap<K, Entry<V>> entries = new ConcurrentHashMap<>();

    public AsyncChain<V> getAsync(K key, Function<? super K, ? extends AsyncChain<V>> fetcher, Cancellation cancellation)
    {
        return getAsync(key, null, false, fetcher, cancellation);
    }

    /**
     * @param obsoleteValue the value the caller found unusable; a forced refresh is skipped if the cache already
     *                      holds a different value. {@code null} forces a fetch unless one is already running.
     */
    public AsyncChain<V> getAsync(K key, @Nullable V obsoleteValue, boolean forceRefresh, Function<? super K, ? extends AsyncChain<V>> fetcher, Cancellation cancellation)
    {
        Objects.requireNonNull(key, "key");
        cancellation.throwIfCancelled();

        @SuppressWarnings("unchecked")
        Entry<V>[] started = new Entry[1];
        Entry<V> entry = entries.compute(key, (k, current) -> {
            if (current != null && (!current.isDone() || (current.isSuccess() && !isObsolete(current.value, obsoleteValue, forceRefresh))))
                return current;

            started[0] = new Entry<>();
            return started[0];
        });

        if (started[0] != null)
            fetch(key, started[0], fetcher);

        return AsyncChains.withCancellation(entry, cancellation);
    }

    private static <V> boolean isObsolete(V cached, @Nullable V obsoleteValue, boolean forceRefresh)
    {
        if (!forceRefresh)
            return false;
        return obsoleteValue == null || obsoleteValue == cached;
    }

    private void fetch(K key, Entry<V> entry, Function<? super K, ? extends AsyncChain<V>> fetcher)
    {
        AsyncChain<V> chain;
        try
        {
            chain = fetcher.apply(key);
        }
        catch (Throwable t)
        {
            entries.remove(key, entry);
            entry.tryFailure(t);
            return;
        }

        chain.begin((value, failure) -> {
            if (failure != null || value == null)
                entries.remove(key, entry);

            if (failure != null) entry.tryFailure(failure);
            else entry.trySuccess(value);
        });
    }

    /**
     * The cached value if a fetch for {@code key} has completed successfully, otherwise {@code null}
     */
    public @Nullable V peek(K key)
    {
        Entry<V> entry = entries.get(key);
        return entry != null && entry.isSuccess() ? entry.value : null;
    }

    public void set(K key, V value)
    {
        Entry<V> entry = new Entry<>();
        entry.setSuccess(Objects.requireNonNull(value));
        entries.put(key, entry);
    }

    public void remove(K key)
    {
        entries.remove(key);
    }

    public void clear()
    {
        entries.clear();
    }
}
