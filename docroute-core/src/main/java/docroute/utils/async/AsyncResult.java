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

/**
 * Handle for an asynchronous computation that has already started. Supports any number of listeners,
 * including listeners registered after completion. Coalesced fetches hand the same result to every waiter.
 */
public interface AsyncResult<V> extends AsyncChain<V>
{
    @Override
    AsyncResult<V> addCallback(BiConsumer<? super V, Throwable> callback);

    boolean isDone();
    boolean isSuccess();

    @Override
    default void begin(BiConsumer<? super V, Throwable> callback)
    {
        addCallback(callback);
    }

    @Override
    default AsyncResult<V> beginAsResult()
    {
        return this;
    }

    interface Settable<V> extends AsyncResult<V>
    {
        boolean trySuccess(V value);

        default void setSuccess(V value)
        {
            if (!trySuccess(value))
                throw new IllegalStateException("Result has already been set on " + this);
        }

        boolean tryFailure(Throwable throwable);

        default void setFailure(Throwable throwable)
        {
            if (!tryFailure(throwable))
                throw new IllegalStateException("Result has already been set on " + this);
        }
    }
}
