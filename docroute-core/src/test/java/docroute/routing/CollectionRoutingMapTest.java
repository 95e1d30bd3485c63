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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import docroute.primitives.EpkRange;
import docroute.primitives.PartitionKeyRange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectionRoutingMapTest
{
    private static final String RID = "ty4BAP2Y1yE=";

    private static final PartitionKeyRange LOW = new PartitionKeyRange("1", "", "B");
    private static final PartitionKeyRange MIDDLE = new PartitionKeyRange("2", "B", "D");
    private static final PartitionKeyRange HIGH = new PartitionKeyRange("3", "D", "FF");

    @Test
    void completeMapIsOrdered()
    {
        CollectionRoutingMap map = CollectionRoutingMap.tryCreateCompleteRoutingMap(ImmutableList.of(HIGH, LOW, MIDDLE), RID);
        Assertions.assertNotNull(map);
        Assertions.assertEquals(RID, map.collectionResourceId());
        assertThat(map.orderedPartitionKeyRanges()).containsExactly(LOW, MIDDLE, HIGH);
        Assertions.assertSame(MIDDLE, map.getRangeByPartitionKeyRangeId("2"));
        Assertions.assertNull(map.getRangeByPartitionKeyRangeId("9"));
    }

    @Test
    void incompleteRangesYieldNoMap()
    {
        Assertions.assertNull(CollectionRoutingMap.tryCreateCompleteRoutingMap(ImmutableList.of(LOW, HIGH), RID));
        Assertions.assertNull(CollectionRoutingMap.tryCreateCompleteRoutingMap(ImmutableList.of(MIDDLE, HIGH), RID));
        Assertions.assertNull(CollectionRoutingMap.tryCreateCompleteRoutingMap(ImmutableList.of(LOW, MIDDLE), RID));
        Assertions.assertNull(CollectionRoutingMap.tryCreateCompleteRoutingMap(ImmutableList.of(), RID));
        Assertions.assertNull(CollectionRoutingMap.tryCreateCompleteRoutingMap(ImmutableList.of(LOW, new PartitionKeyRange("4", "A", "FF")), RID));
    }

    @Test
    void replacedParentsAreDropped()
    {
        PartitionKeyRange parent = new PartitionKeyRange("0", "", "FF");
        PartitionKeyRange left = new PartitionKeyRange("1", "", "B", ImmutableList.of("0"));
        PartitionKeyRange right = new PartitionKeyRange("2", "B", "FF", ImmutableList.of("0"));

        CollectionRoutingMap map = CollectionRoutingMap.tryCreateCompleteRoutingMap(ImmutableList.of(parent, left, right), RID);
        Assertions.assertNotNull(map);
        assertThat(map.orderedPartitionKeyRanges()).containsExactly(left, right);
        Assertions.assertTrue(map.isGone("0"));
        Assertions.assertFalse(map.isGone("1"));
    }

    @Test
    void lookupByEffectivePartitionKey()
    {
        CollectionRoutingMap map = CollectionRoutingMap.tryCreateCompleteRoutingMap(ImmutableList.of(LOW, MIDDLE, HIGH), RID);
        Assertions.assertSame(LOW, map.getRangeByEffectivePartitionKey(""));
        Assertions.assertSame(LOW, map.getRangeByEffectivePartitionKey("A"));
        Assertions.assertSame(MIDDLE, map.getRangeByEffectivePartitionKey("B"));
        Assertions.assertSame(MIDDLE, map.getRangeByEffectivePartitionKey("C9"));
        Assertions.assertSame(HIGH, map.getRangeByEffectivePartitionKey("E"));
        assertThatThrownBy(() -> map.getRangeByEffectivePartitionKey("FF")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overlappingRanges()
    {
        CollectionRoutingMap map = CollectionRoutingMap.tryCreateCompleteRoutingMap(ImmutableList.of(LOW, MIDDLE, HIGH), RID);
        assertThat(map.getOverlappingRanges(EpkRange.of("A", "C"))).containsExactly(LOW, MIDDLE);
        assertThat(map.getOverlappingRanges(EpkRange.of("B", "D"))).containsExactly(MIDDLE);
        assertThat(map.getOverlappingRanges(EpkRange.point("D"))).containsExactly(HIGH);
        assertThat(map.getOverlappingRanges(EpkRange.FULL)).containsExactly(LOW, MIDDLE, HIGH);
        assertThat(map.getOverlappingRanges(ImmutableList.of(EpkRange.of("E", "F"), EpkRange.of("A", "B"), EpkRange.of("D", "E"))))
            .containsExactly(LOW, HIGH);
    }
}
