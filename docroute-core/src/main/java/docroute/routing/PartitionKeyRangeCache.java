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

import java.util.Collection;
import java.util.List;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import docroute.api.RoutingMetadataSource;
import docroute.api.Trace;
import docroute.coordinate.NotFoundException;
import docroute.primitives.EpkRange;
import docroute.primitives.PartitionKeyRange;
import docroute.utils.Invariants;
import docroute.utils.async.AsyncChain;
import docroute.utils.async.AsyncChains;
import docroute.utils.async.Cancellation;

/**
 * Caches one {@link CollectionRoutingMap} per collection resource id.
 *
 * A fetch that does not yield a complete routing map, or names an unknown collection, produces {@code null} rather
 * than a partial answer; callers treat that as a stale cache and retry with a forced refresh. Refreshes replace the
 * map wholesale, so readers never observe a partially updated set of ranges.
 */
public class PartitionKeyRangeCache
{
    private static final Logger logger = LoggerFactory.getLogger(PartitionKeyRangeCache.class);

    private final RoutingMetadataSource metadataSource;
    private final AsyncCache<String, CollectionRoutingMap> routingMaps = new AsyncCache<>();

    public PartitionKeyRangeCache(RoutingMetadataSource metadataSource)
    {
        this.metadataSource = Invariants.nonNull(metadataSource, "metadataSource");
    }

    /**
     * Answers from the cached routing map only. Empty when the collection is not cached or the cached map
     * does not cover {@code range}.
     */
    public List<PartitionKeyRange> getOverlappingRanges(String collectionResourceId, EpkRange range)
    {
        Invariants.nonEmpty(collectionResourceId, "collectionResourceId");
        Invariants.nonNull(range, "range");
        CollectionRoutingMap map = routingMaps.peek(collectionResourceId);
        if (map == null)
            return ImmutableList.of();
        return map.getOverlappingRanges(range);
    }

    public AsyncChain<List<PartitionKeyRange>> tryGetOverlappingRanges(String collectionResourceId, EpkRange range, boolean forceRefresh, Trace trace, Cancellation cancellation)
    {
        Invariants.nonNull(range, "range");
        return tryGetOverlappingRanges(collectionResourceId, ImmutableList.of(range), forceRefresh, trace, cancellation);
    }

    /**
     * @return the ranges overlapping any of {@code ranges} in key order, or {@code null} if no complete routing map
     *         could be obtained for the collection
     */
    public AsyncChain<List<PartitionKeyRange>> tryGetOverlappingRanges(String collectionResourceId, Collection<EpkRange> ranges, boolean forceRefresh, Trace trace, Cancellation cancellation)
    {
        Invariants.nonEmpty(collectionResourceId, "collectionResourceId");
        Invariants.nonEmptyNoNulls(ranges, "ranges");

        CollectionRoutingMap previous = forceRefresh ? routingMaps.peek(collectionResourceId) : null;
        return lookup(collectionResourceId, previous, forceRefresh, trace, cancellation)
               .map(map -> map == null ? null : map.getOverlappingRanges(ranges));
    }

    /**
     * Forces a refresh of the routing map unless the cached map has already moved on from {@code previous}.
     * Concurrent callers naming the same previous map share one fetch.
     */
    public AsyncChain<CollectionRoutingMap> tryLookup(String collectionResourceId, @Nullable CollectionRoutingMap previous, Trace trace, Cancellation cancellation)
    {
        Invariants.nonEmpty(collectionResourceId, "collectionResourceId");
        return lookup(collectionResourceId, previous, true, trace, cancellation);
    }

    public AsyncChain<CollectionRoutingMap> tryLookup(String collectionResourceId, Trace trace, Cancellation cancellation)
    {
        Invariants.nonEmpty(collectionResourceId, "collectionResourceId");
        return lookup(collectionResourceId, null, false, trace, cancellation);
    }

    public AsyncChain<PartitionKeyRange> tryGetRangeByPartitionKeyRangeId(String collectionResourceId, String partitionKeyRangeId, Trace trace, Cancellation cancellation)
    {
        Invariants.nonEmpty(collectionResourceId, "collectionResourceId");
        Invariants.nonEmpty(partitionKeyRangeId, "partitionKeyRangeId");
        return lookup(collectionResourceId, null, false, trace, cancellation)
               .map(map -> map == null ? null : map.getRangeByPartitionKeyRangeId(partitionKeyRangeId));
    }

    private AsyncChain<CollectionRoutingMap> lookup(String collectionResourceId, @Nullable CollectionRoutingMap previous, boolean forceRefresh, Trace trace, Cancellation cancellation)
    {
        Trace child = trace.startChild("Get Routing Map", Trace.Component.ROUTING, Trace.Level.INFO);
        child.addDatum("collectionResourceId", collectionResourceId);
        child.addDatum("forceRefresh", forceRefresh);
        return routingMaps.getAsync(collectionResourceId, previous, forceRefresh, this::fetch, cancellation)
                          .recover(failure -> failure instanceof NotFoundException ? AsyncChains.success(null) : null)
                          .addCallback((success, failure) -> child.close());
    }

    private AsyncChain<CollectionRoutingMap> fetch(String collectionResourceId)
    {
        logger.debug("Fetching partition key ranges for collection {}", collectionResourceId);
        return metadataSource.fetchPartitionKeyRanges(collectionResourceId).map(ranges -> {
            CollectionRoutingMap map = CollectionRoutingMap.tryCreateCompleteRoutingMap(ranges, collectionResourceId);
            if (map == null)
                logger.debug("Partition key ranges for collection {} do not cover the key space: {}", collectionResourceId, ranges);
            return map;
        });
    }
}
