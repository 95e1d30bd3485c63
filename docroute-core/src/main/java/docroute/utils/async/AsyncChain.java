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

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * A lazily started sequence of asynchronous steps. Nothing runs until {@link #begin(BiConsumer)} is called,
 * and each chain may be begun at most once. Every suspending operation of the client returns one of these.
 */
public interface AsyncChain<V>
{
    <T> AsyncChain<T> map(Function<? super V, ? extends T> mapper);

    <T> AsyncChain<T> flatMap(Function<? super V, ? extends AsyncChain<T>> mapper);

    /**
     * When the chain has failed, attempt to recover. The mapper may return {@code null} to indicate that recovery
     * was not possible and the original failure should propagate.
     */
    AsyncChain<V> recover(Function<? super Throwable, ? extends AsyncChain<V>> mapper);

    /**
     * Observe the outcome without altering it
     */
    AsyncChain<V> addCallback(BiConsumer<? super V, Throwable> callback);

    /**
     * Causes the chain to begin, starting all work required. Must be called exactly once.
     */
    void begin(BiConsumer<? super V, Throwable> callback);

    default AsyncResult<V> beginAsResult()
    {
        return AsyncResults.forChain(this);
    }
}
