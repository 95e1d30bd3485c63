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

package docroute.impl.mock;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;

import docroute.api.RoutingMetadataSource;
import docroute.coordinate.NotFoundException;
import docroute.primitives.PartitionKeyRange;
import docroute.routing.CollectionProperties;
import docroute.utils.async.AsyncChain;
import docroute.utils.async.AsyncChains;
import docroute.utils.async.AsyncResult;
import docroute.utils.async.AsyncResults;

/**
 * Collections and partition key ranges held in memory. Counts fetches; while held, fetches stay pending until
 * {@link #release()} and then answer with the state current at release.
 */
public class MockRoutingMetadataSource implements RoutingMetadataSource
{
    private final Map<String, CollectionProperties> collections = new ConcurrentHashMap<>();
    private final Map<String, List<PartitionKeyRange>> ranges = new ConcurrentHashMap<>();
    private final Map<String, Queue<List<PartitionKeyRange>>> followingRanges = new ConcurrentHashMap<>();
    private final Multiset<String> collectionFetches = ConcurrentHashMultiset.create();
    private final Multiset<String> rangeFetches = ConcurrentHashMultiset.create();
    private final List<Runnable> pending = new ArrayList<>();
    private boolean hold;

    public MockRoutingMetadataSource collection(CollectionProperties collection)
    {
        collections.put(collection.link(), collection);
        return this;
    }

    public MockRoutingMetadataSource dropCollection(String link)
    {
        collections.remove(link);
        return this;
    }

    public MockRoutingMetadataSource ranges(String collectionResourceId, PartitionKeyRange... partitionKeyRanges)
    {
        ranges.put(collectionResourceId, ImmutableList.copyOf(Arrays.asList(partitionKeyRanges)));
        return this;
    }

    /**
     * Ranges served from the fetch after the next one onwards
     */
    public MockRoutingMetadataSource thenRanges(String collectionResourceId, PartitionKeyRange... partitionKeyRanges)
    {
        followingRanges.computeIfAbsent(collectionResourceId, ignore -> new ConcurrentLinkedQueue<>())
                       .add(ImmutableList.copyOf(Arrays.asList(partitionKeyRanges)));
        return this;
    }

    public synchronized MockRoutingMetadataSource hold()
    {
        hold = true;
        return this;
    }

    public void release()
    {
        List<Runnable> release;
        synchronized (this)
        {
            hold = false;
            release = new ArrayList<>(pending);
            pending.clear();
        }
        release.forEach(Runnable::run);
    }

    @Override
    public AsyncChain<CollectionProperties> fetchCollection(String collectionLink)
    {
        collectionFetches.add(collectionLink);
        return answer(() -> {
            CollectionProperties collection = collections.get(collectionLink);
            if (collection == null)
                throw new NotFoundException("Collection " + collectionLink + " does not exist");
            return collection;
        });
    }

    @Override
    public AsyncChain<List<PartitionKeyRange>> fetchPartitionKeyRanges(String collectionResourceId)
    {
        rangeFetches.add(collectionResourceId);
        return answer(() -> {
            List<PartitionKeyRange> current = ranges.get(collectionResourceId);
            Queue<List<PartitionKeyRange>> following = followingRanges.get(collectionResourceId);
            List<PartitionKeyRange> next = following == null ? null : following.poll();
            if (next != null)
                ranges.put(collectionResourceId, next);
            if (current == null)
                throw new NotFoundException("Collection " + collectionResourceId + " does not exist");
            return current;
        });
    }

    private synchronized <V> AsyncChain<V> answer(Supplier<V> answer)
    {
        if (!hold)
            return AsyncChains.ofCallable(Runnable::run, answer::get);

        AsyncResult.Settable<V> result = AsyncResults.settable();
        pending.add(() -> {
            try
            {
                result.setSuccess(answer.get());
            }
            catch (RuntimeException e)
            {
                result.setFailure(e);
            }
        });
        return result;
    }

    public int collectionFetches(String collectionLink)
    {
        return collectionFetches.count(collectionLink);
    }

    public int rangeFetches(String collectionResourceId)
    {
        return rangeFetches.count(collectionResourceId);
    }
}
