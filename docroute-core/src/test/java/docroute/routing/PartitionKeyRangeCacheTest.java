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
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import docroute.api.Trace;
import docroute.impl.mock.MockRoutingMetadataSource;
import docroute.primitives.EpkRange;
import docroute.primitives.PartitionKeyRange;
import docroute.utils.async.AsyncChains;
import docroute.utils.async.AsyncResult;
import docroute.utils.async.Cancellation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

public class PartitionKeyRangeCacheTest
{
    private static final String ORDERS = "ty4BAP2Y1yE=";

    private static final PartitionKeyRange WHOLE = new PartitionKeyRange("0", "", "FF");
    private static final PartitionKeyRange LOW = new PartitionKeyRange("1", "", "B", ImmutableList.of("0"));
    private static final PartitionKeyRange MIDDLE = new PartitionKeyRange("2", "B", "D", ImmutableList.of("0"));
    private static final PartitionKeyRange HIGH = new PartitionKeyRange("3", "D", "FF", ImmutableList.of("0"));

    private final MockRoutingMetadataSource source = new MockRoutingMetadataSource();
    private final PartitionKeyRangeCache cache = new PartitionKeyRangeCache(source);

    private List<PartitionKeyRange> overlapping(EpkRange range, boolean forceRefresh)
    {
        return AsyncChains.getUnchecked(cache.tryGetOverlappingRanges(ORDERS, range, forceRefresh, Trace.NO_OP, Cancellation.NONE));
    }

    @Test
    void splitInProgressIsReportedStaleUntilRefreshed()
    {
        // mid split: the children have started to appear but the middle one is missing
        source.ranges(ORDERS, WHOLE, LOW, HIGH);
        Assertions.assertNull(overlapping(EpkRange.of("A", "C"), false));
        assertThat(cache.getOverlappingRanges(ORDERS, EpkRange.FULL)).isEmpty();

        source.ranges(ORDERS, WHOLE, LOW, MIDDLE, HIGH);
        assertThat(overlapping(EpkRange.of("A", "C"), true)).containsExactly(LOW, MIDDLE);
        assertThat(overlapping(EpkRange.FULL, false)).containsExactly(LOW, MIDDLE, HIGH);
        Assertions.assertEquals(2, source.rangeFetches(ORDERS));

        // answered from the cached map
        assertThat(cache.getOverlappingRanges(ORDERS, EpkRange.of("A", "C"))).containsExactly(LOW, MIDDLE);
        Assertions.assertEquals(2, source.rangeFetches(ORDERS));
    }

    @Test
    void ordersSplitIsSeenAfterForcedRefresh()
    {
        PartitionKeyRange first = new PartitionKeyRange("1", "", "B");
        PartitionKeyRange second = new PartitionKeyRange("2", "B", "FF");
        PartitionKeyRange secondLow = new PartitionKeyRange("3", "B", "D", ImmutableList.of("2"));
        PartitionKeyRange secondHigh = new PartitionKeyRange("4", "D", "FF", ImmutableList.of("2"));
        EpkRange query = EpkRange.of("A", "C");

        source.ranges(ORDERS, first, second);
        assertThat(overlapping(query, false)).containsExactly(first, second);

        source.ranges(ORDERS, first, second, secondLow, secondHigh);
        assertThat(overlapping(query, false)).containsExactly(first, second);

        assertThat(overlapping(query, true)).containsExactly(first, secondLow);
        assertThat(cache.getOverlappingRanges(ORDERS, query)).extracting(PartitionKeyRange::minInclusive, PartitionKeyRange::maxExclusive)
                                                            .containsExactly(tuple("", "B"), tuple("B", "D"));
        Assertions.assertEquals(2, source.rangeFetches(ORDERS));
    }

    @Test
    void cachedMapIsReusedUntilForced()
    {
        source.ranges(ORDERS, WHOLE);
        assertThat(overlapping(EpkRange.FULL, false)).containsExactly(WHOLE);

        source.ranges(ORDERS, WHOLE, LOW, MIDDLE, HIGH);
        assertThat(overlapping(EpkRange.FULL, false)).containsExactly(WHOLE);
        Assertions.assertEquals(1, source.rangeFetches(ORDERS));

        assertThat(overlapping(EpkRange.FULL, true)).containsExactly(LOW, MIDDLE, HIGH);
        Assertions.assertEquals(2, source.rangeFetches(ORDERS));
    }

    @Test
    void concurrentForcedLookupsOfTheSameMapFetchOnce()
    {
        source.ranges(ORDERS, WHOLE);
        CollectionRoutingMap previous = AsyncChains.getUnchecked(cache.tryLookup(ORDERS, Trace.NO_OP, Cancellation.NONE));
        Assertions.assertEquals(1, source.rangeFetches(ORDERS));

        source.ranges(ORDERS, WHOLE, LOW, MIDDLE, HIGH).hold();
        List<AsyncResult<CollectionRoutingMap>> lookups = new ArrayList<>();
        for (int i = 0 ; i < 6 ; i++)
            lookups.add(cache.tryLookup(ORDERS, previous, Trace.NO_OP, Cancellation.NONE).beginAsResult());
        Assertions.assertEquals(2, source.rangeFetches(ORDERS));

        source.release();
        CollectionRoutingMap refreshed = AsyncChains.getUnchecked(lookups.get(0));
        assertThat(refreshed.orderedPartitionKeyRanges()).containsExactly(LOW, MIDDLE, HIGH);
        for (AsyncResult<CollectionRoutingMap> lookup : lookups)
            Assertions.assertSame(refreshed, AsyncChains.getUnchecked(lookup));

        // still naming the map that was replaced: no further fetch
        Assertions.assertSame(refreshed, AsyncChains.getUnchecked(cache.tryLookup(ORDERS, previous, Trace.NO_OP, Cancellation.NONE)));
        Assertions.assertEquals(2, source.rangeFetches(ORDERS));
    }

    @Test
    void unknownCollectionHasNoRoutingMap()
    {
        Assertions.assertNull(overlapping(EpkRange.FULL, false));
        Assertions.assertNull(AsyncChains.getUnchecked(cache.tryLookup(ORDERS, Trace.NO_OP, Cancellation.NONE)));
        Assertions.assertNull(AsyncChains.getUnchecked(cache.tryGetRangeByPartitionKeyRangeId(ORDERS, "0", Trace.NO_OP, Cancellation.NONE)));
    }

    @Test
    void rangeById()
    {
        source.ranges(ORDERS, WHOLE, LOW, MIDDLE, HIGH);
        Assertions.assertEquals(MIDDLE, AsyncChains.getUnchecked(cache.tryGetRangeByPartitionKeyRangeId(ORDERS, "2", Trace.NO_OP, Cancellation.NONE)));
        Assertions.assertNull(AsyncChains.getUnchecked(cache.tryGetRangeByPartitionKeyRangeId(ORDERS, "0", Trace.NO_OP, Cancellation.NONE)));
    }

    @Test
    void multipleQueryRanges()
    {
        source.ranges(ORDERS, LOW, MIDDLE, HIGH);
        List<PartitionKeyRange> ranges = AsyncChains.getUnchecked(cache.tryGetOverlappingRanges(ORDERS, ImmutableList.of(EpkRange.of("E", "F"), EpkRange.point("A")),
                                                                                                false, Trace.NO_OP, Cancellation.NONE));
        assertThat(ranges).containsExactly(LOW, HIGH);
    }
}
