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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import docroute.primitives.EpkRange;
import docroute.primitives.PartitionKeyRange;
import docroute.utils.Invariants;

/**
 * The partition key ranges of one collection, sorted by their lower bound, exactly covering
 * {@code ["", "FF")} with no gaps and no overlaps. Immutable; a refresh builds a new map.
 */
public final class CollectionRoutingMap
{
    private final String collectionResourceId;
    private final List<PartitionKeyRange> ranges;
    private final Map<String, PartitionKeyRange> byId;
    private final Set<String> goneRangeIds;

    private CollectionRoutingMap(String collectionResourceId, List<PartitionKeyRange> ranges, Set<String> goneRangeIds)
    {
        this.collectionResourceId = collectionResourceId;
        this.ranges = ImmutableList.copyOf(ranges);
        Map<String, PartitionKeyRange> byId = new LinkedHashMap<>();
        for (PartitionKeyRange range : ranges)
            byId.put(range.id(), range);
        this.byId = ImmutableMap.copyOf(byId);
        this.goneRangeIds = ImmutableSet.copyOf(goneRangeIds);
    }

    /**
     * Builds a routing map from a possibly stale set of ranges. Ranges named as the parent of another range have
     * been replaced and are dropped. Returns {@code null} if the remaining ranges do not exactly cover the key space.
     */
    public static @Nullable CollectionRoutingMap tryCreateCompleteRoutingMap(Collection<PartitionKeyRange> ranges, String collectionResourceId)
    {
        Invariants.nonEmpty(collectionResourceId, "collectionResourceId");
        Invariants.nonNull(ranges, "ranges");

        Set<String> gone = new HashSet<>();
        for (PartitionKeyRange range : ranges)
            gone.addAll(range.parents());

        List<PartitionKeyRange> live = new ArrayList<>(ranges.size());
        for (PartitionKeyRange range : ranges)
        {
            if (!gone.contains(range.id()))
                live.add(range);
        }
        live.sort((a, b) -> a.minInclusive().compareTo(b.minInclusive()));

        if (!isComplete(live))
            return null;

        return new CollectionRoutingMap(collectionResourceId, live, gone);
    }

    private static boolean isComplete(List<PartitionKeyRange> sorted)
    {
        if (sorted.isEmpty())
            return false;

        String expectedMin = EpkRange.MINIMUM_INCLUSIVE;
        for (PartitionKeyRange range : sorted)
        {
            if (!range.minInclusive().equals(expectedMin))
                return false;
            expectedMin = range.maxExclusive();
        }
        return expectedMin.equals(EpkRange.MAXIMUM_EXCLUSIVE);
    }

    public String collectionResourceId()
    {
        return collectionResourceId;
    }

    public List<PartitionKeyRange> orderedPartitionKeyRanges()
    {
        return ranges;
    }

    public @Nullable PartitionKeyRange getRangeByPartitionKeyRangeId(String partitionKeyRangeId)
    {
        return byId.get(partitionKeyRangeId);
    }

    /**
     * True if the range was split or merged away, i.e. a current range names it as a parent
     */
    public boolean isGone(String partitionKeyRangeId)
    {
        return goneRangeIds.contains(partitionKeyRangeId);
    }

    public PartitionKeyRange getRangeByEffectivePartitionKey(String effectivePartitionKey)
    {
        Invariants.checkArgument(EpkRange.FULL.contains(effectivePartitionKey), "%s is outside the key space", effectivePartitionKey);
        return ranges.get(floorIndex(effectivePartitionKey));
    }

    public List<PartitionKeyRange> getOverlappingRanges(EpkRange range)
    {
        return getOverlappingRanges(ImmutableList.of(range));
    }

    /**
     * The ranges overlapping any of {@code queryRanges}, in key order and without duplicates
     */
    public List<PartitionKeyRange> getOverlappingRanges(Collection<EpkRange> queryRanges)
    {
        boolean[] selected = new boolean[ranges.size()];
        for (EpkRange query : queryRanges)
        {
            for (int i = floorIndex(query.min()) ; i < ranges.size() ; i++)
            {
                PartitionKeyRange candidate = ranges.get(i);
                EpkRange candidateRange = candidate.toRange();
                if (candidateRange.overlaps(query))
                    selected[i] = true;
                else if (candidate.minInclusive().compareTo(query.max()) >= 0)
                    break;
            }
        }

        ImmutableList.Builder<PartitionKeyRange> result = ImmutableList.builder();
        for (int i = 0 ; i < selected.length ; i++)
        {
            if (selected[i])
                result.add(ranges.get(i));
        }
        return result.build();
    }

    // index of the last range whose lower bound is at or before key
    private int floorIndex(String key)
    {
        int lo = 0, hi = ranges.size() - 1;
        while (lo < hi)
        {
            int mid = (lo + hi + 1) >>> 1;
            if (ranges.get(mid).minInclusive().compareTo(key) <= 0) lo = mid;
            else hi = mid - 1;
        }
        return lo;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CollectionRoutingMap that = (CollectionRoutingMap) o;
        return collectionResourceId.equals(that.collectionResourceId) && ranges.equals(that.ranges);
    }

    @Override
    public int hashCode()
    {
        return collectionResourceId.hashCode() * 31 + ranges.hashCode();
    }

    @Override
    public String toString()
    {
        return "CollectionRoutingMap{" + collectionResourceId + ": " + ranges + '}';
    }
}
