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

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import docroute.utils.Invariants;

public abstract class AsyncChains<V> implements AsyncChain<V>
{
    private static final Logger logger = LoggerFactory.getLogger(AsyncChains.class);

    @SuppressWarnings("unchecked")
    static class Immediate<V> implements AsyncChain<V>
    {
        static class FailureHolder
        {
            final Throwable cause;
            FailureHolder(Throwable cause)
            {
                this.cause = cause;
            }
        }

        final private Object value;
        private Immediate(V success) { this.value = success; }
        private Immediate(Throwable failure) { this.value = new FailureHolder(failure); }

        @Override
        public <T> AsyncChain<T> map(Function<? super V, ? extends T> mapper)
        {
            if (isFailed())
                return (AsyncChain<T>) this;
            try
            {
                return new Immediate<>(mapper.apply((V) value));
            }
            catch (Throwable t)
            {
                return new Immediate<>(t);
            }
        }

        @Override
        public <T> AsyncChain<T> flatMap(Function<? super V, ? extends AsyncChain<T>> mapper)
        {
            if (isFailed())
                return (AsyncChain<T>) this;
            try
            {
                return mapper.apply((V) value);
            }
            catch (Throwable t)
            {
                return new Immediate<>(t);
            }
        }

        @Override
        public AsyncChain<V> recover(Function<? super Throwable, ? extends AsyncChain<V>> mapper)
        {
            if (!isFailed())
                return this;

            Throwable cause = ((FailureHolder) value).cause;
            try
            {
                AsyncChain<V> recover = mapper.apply(cause);
                return recover == null ? this : recover;
            }
            catch (Throwable t)
            {
                cause.addSuppressed(t);
                return new Immediate<>(cause);
            }
        }

        private boolean isFailed()
        {
            return value != null && value.getClass() == FailureHolder.class;
        }

        @Override
        public AsyncChain<V> addCallback(BiConsumer<? super V, Throwable> callback)
        {
            return AsyncChains.<V>head(this).addCallback(callback);
        }

        @Override
        public void begin(BiConsumer<? super V, Throwable> callback)
        {
            if (isFailed()) callback.accept(null, ((FailureHolder) value).cause);
            else callback.accept((V) value, null);
        }
    }

    public abstract static class Head<V> extends AsyncChains<V> implements BiConsumer<V, Throwable>
    {
        protected Head()
        {
            super(null);
            next = this;
        }

        protected abstract void start(BiConsumer<? super V, Throwable> callback);

        @Override
        public final void begin(BiConsumer<? super V, Throwable> callback)
        {
            Invariants.checkArgument(next != null);
            next = null;
            start(callback);
        }

        void begin()
        {
            Invariants.checkArgument(next != null);
            BiConsumer<? super V, Throwable> next = this.next;
            this.next = null;
            start(next);
        }

        @Override
        public void accept(V v, Throwable throwable)
        {
            throw new UnsupportedOperationException();
        }
    }

    static abstract class Link<I, O> extends AsyncChains<O> implements BiConsumer<I, Throwable>
    {
        protected Link(Head<?> head)
        {
            super(head);
        }

        @Override
        public void begin(BiConsumer<? super O, Throwable> callback)
        {
            Invariants.checkArgument(!(callback instanceof AsyncChains.Head));
            checkNextIsHead();
            Head<?> head = (Head<?>) next;
            next = callback;
            head.begin();
        }
    }

    static class EncapsulatedMap<I, O> extends Link<I, O>
    {
        final Function<? super I, ? extends O> map;

        EncapsulatedMap(Head<?> head, Function<? super I, ? extends O> map)
        {
            super(head);
            this.map = map;
        }

        @Override
        public void accept(I i, Throwable throwable)
        {
            if (throwable != null)
            {
                next.accept(null, throwable);
                return;
            }

            O update;
            try
            {
                update = map.apply(i);
            }
            catch (Throwable t)
            {
                next.accept(null, t);
                return;
            }
            next.accept(update, null);
        }
    }

    static class EncapsulatedFlatMap<I, O> extends Link<I, O>
    {
        final Function<? super I, ? extends AsyncChain<O>> map;

        EncapsulatedFlatMap(Head<?> head, Function<? super I, ? extends AsyncChain<O>> map)
        {
            super(head);
            this.map = map;
        }

        @Override
        public void accept(I i, Throwable throwable)
        {
            if (throwable != null)
            {
                next.accept(null, throwable);
                return;
            }

            AsyncChain<O> chain;
            try
            {
                chain = map.apply(i);
            }
            catch (Throwable t)
            {
                next.accept(null, t);
                return;
            }
            chain.begin(next);
        }
    }

    static class EncapsulatedRecover<I> extends Link<I, I>
    {
        private final Function<? super Throwable, ? extends AsyncChain<I>> map;

        EncapsulatedRecover(Head<?> head, Function<? super Throwable, ? extends AsyncChain<I>> map)
        {
            super(head);
            this.map = map;
        }

        @Override
        public void accept(I i, Throwable throwable)
        {
            if (throwable == null)
            {
                next.accept(i, null);
                return;
            }

            AsyncChain<I> recover;
            try
            {
                recover = map.apply(throwable);
            }
            catch (Throwable t)
            {
                throwable.addSuppressed(t);
                next.accept(null, throwable);
                return;
            }
            if (recover == null) next.accept(null, throwable);
            else recover.begin(next);
        }
    }

    static class EncapsulatedCallback<I> extends Link<I, I>
    {
        final BiConsumer<? super I, Throwable> callback;

        EncapsulatedCallback(Head<?> head, BiConsumer<? super I, Throwable> callback)
        {
            super(head);
            this.callback = callback;
        }

        @Override
        public void accept(I i, Throwable throwable)
        {
            try
            {
                callback.accept(i, throwable);
            }
            catch (Throwable t)
            {
                logger.warn("AsyncChain callback threw an exception", t);
            }
            next.accept(i, throwable);
        }
    }

    // either the thing we start, or the thing we do in follow-up
    BiConsumer<? super V, Throwable> next;

    @SuppressWarnings({ "rawtypes", "unchecked" })
    AsyncChains(Head<?> head)
    {
        this.next = (BiConsumer) head;
    }

    @Override
    public <T> AsyncChain<T> map(Function<? super V, ? extends T> mapper)
    {
        return add(EncapsulatedMap::new, mapper);
    }

    @Override
    public <T> AsyncChain<T> flatMap(Function<? super V, ? extends AsyncChain<T>> mapper)
    {
        return add(EncapsulatedFlatMap::new, mapper);
    }

    @Override
    public AsyncChain<V> recover(Function<? super Throwable, ? extends AsyncChain<V>> mapper)
    {
        return add(EncapsulatedRecover::new, mapper);
    }

    @Override
    public AsyncChain<V> addCallback(BiConsumer<? super V, Throwable> callback)
    {
        return add(EncapsulatedCallback::new, callback);
    }

    <P, O, T extends AsyncChain<O> & BiConsumer<? super V, Throwable>> AsyncChain<O> add(BiFunction<Head<?>, P, T> factory, P param)
    {
        checkNextIsHead();
        Head<?> head = (Head<?>) next;
        T result = factory.apply(head, param);
        next = result;
        return result;
    }

    protected void checkNextIsHead()
    {
        Invariants.checkState(next != null, "Begin was called multiple times");
        Invariants.checkState(next instanceof Head<?>, "Next is not an instance of AsyncChains.Head (it is %s); was map/flatMap called on the same object multiple times?", next.getClass());
    }

    private static <V> Head<V> head(AsyncChain<V> chain)
    {
        return new Head<V>()
        {
            @Override
            protected void start(BiConsumer<? super V, Throwable> callback)
            {
                chain.begin(callback);
            }
        };
    }

    public static <V> AsyncChain<V> success(V success)
    {
        return new Immediate<>(success);
    }

    public static <V> AsyncChain<V> failure(Throwable failure)
    {
        return new Immediate<>(failure);
    }

    public static <V> AsyncChain<V> ofCallable(Executor executor, Callable<V> callable)
    {
        return new Head<V>()
        {
            @Override
            protected void start(BiConsumer<? super V, Throwable> callback)
            {
                try
                {
                    executor.execute(() -> {
                        V result;
                        try
                        {
                            result = callable.call();
                        }
                        catch (Throwable t)
                        {
                            logger.debug("AsyncChain Callable threw an Exception", t);
                            callback.accept(null, t);
                            return;
                        }
                        callback.accept(result, null);
                    });
                }
                catch (Throwable t)
                {
                    callback.accept(null, t);
                }
            }
        };
    }

    /**
     * Defers construction of the chain until it is begun, so that argument checks and cancellation checks
     * that throw surface as a failed chain
     */
    public static <V> AsyncChain<V> defer(Callable<? extends AsyncChain<V>> supplier)
    {
        return new Head<V>()
        {
            @Override
            protected void start(BiConsumer<? super V, Throwable> callback)
            {
                AsyncChain<V> chain;
                try
                {
                    chain = supplier.call();
                }
                catch (Throwable t)
                {
                    callback.accept(null, t);
                    return;
                }
                chain.begin(callback);
            }
        };
    }

    /**
     * Wraps the chain so that it fails with {@link CancellationException} if the cancellation is signalled
     * before it begins, or before the wrapped chain completes. A cancelled caller detaches from the wrapped
     * chain; work already in flight is not interrupted, but its outcome is discarded.
     */
    public static <V> AsyncChain<V> withCancellation(AsyncChain<V> chain, Cancellation cancellation)
    {
        if (cancellation == Cancellation.NONE)
            return chain;

        return new Head<V>()
        {
            @Override
            protected void start(BiConsumer<? super V, Throwable> callback)
            {
                if (cancellation.isCancelled())
                {
                    callback.accept(null, new CancellationException("Operation was cancelled"));
                    return;
                }

                AtomicBoolean completed = new AtomicBoolean();
                Cancellation.Registration registration = cancellation.onCancel(() -> {
                    if (completed.compareAndSet(false, true))
                        callback.accept(null, new CancellationException("Operation was cancelled"));
                });
                chain.begin((success, failure) -> {
                    registration.unregister();
                    if (completed.compareAndSet(false, true))
                        callback.accept(success, failure);
                });
            }
        };
    }

    public static <V> V getBlocking(AsyncChain<V> chain) throws InterruptedException, ExecutionException
    {
        class Result
        {
            final V result;
            final Throwable failure;

            Result(V result, Throwable failure)
            {
                this.result = result;
                this.failure = failure;
            }
        }

        AtomicReference<Result> callbackResult = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        chain.begin((result, failure) -> {
            callbackResult.set(new Result(result, failure));
            latch.countDown();
        });
        latch.await();

        Result result = callbackResult.get();
        if (result.failure == null) return result.result;
        else throw new ExecutionException(result.failure);
    }

    /**
     * Waits for the chain, rethrowing an unchecked failure as is and wrapping a checked one
     */
    public static <V> V getUnchecked(AsyncChain<V> chain)
    {
        try
        {
            return getBlocking(chain);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
        catch (ExecutionException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new RuntimeException(cause);
        }
    }
}
