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

package docroute.primitives;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EpkRangeTest
{
    @Test
    void fullRangeContainsEveryKey()
    {
        Assertions.assertTrue(EpkRange.FULL.contains(""));
        Assertions.assertTrue(EpkRange.FULL.contains("05C1D9CD"));
        Assertions.assertTrue(EpkRange.FULL.contains("3FFFFFFF"));
        Assertions.assertFalse(EpkRange.FULL.contains("FF"));
    }

    @Test
    void boundsAreHonoured()
    {
        EpkRange range = EpkRange.of("A", "C");
        Assertions.assertTrue(range.contains("A"));
        Assertions.assertTrue(range.contains("B"));
        Assertions.assertFalse(range.contains("C"));

        EpkRange open = new EpkRange("A", "C", false, true);
        Assertions.assertFalse(open.contains("A"));
        Assertions.assertTrue(open.contains("C"));
    }

    @Test
    void adjacentRangesDoNotOverlap()
    {
        Assertions.assertFalse(EpkRange.of("", "B").overlaps(EpkRange.of("B", "D")));
        Assertions.assertFalse(EpkRange.of("B", "D").overlaps(EpkRange.of("", "B")));
        Assertions.assertTrue(EpkRange.of("A", "C").overlaps(EpkRange.of("B", "D")));
        Assertions.assertTrue(EpkRange.point("B").overlaps(EpkRange.of("B", "D")));
        Assertions.assertFalse(EpkRange.point("D").overlaps(EpkRange.of("B", "D")));
    }

    @Test
    void containsRange()
    {
        Assertions.assertTrue(EpkRange.FULL.contains(EpkRange.of("A", "C")));
        Assertions.assertTrue(EpkRange.of("A", "C").contains(EpkRange.of("A", "C")));
        Assertions.assertFalse(EpkRange.of("A", "C").contains(EpkRange.of("A", "D")));
        Assertions.assertFalse(EpkRange.of("A", "C").contains(EpkRange.point("C")));
    }

    @Test
    void rejectsInvertedAndEmptyRanges()
    {
        assertThatThrownBy(() -> EpkRange.of("C", "A")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EpkRange.of("A", "A")).isInstanceOf(IllegalArgumentException.class);
        Assertions.assertTrue(EpkRange.point("A").isSingleValue());
    }

    @Test
    void sortsByLowerBound()
    {
        List<EpkRange> ranges = new ArrayList<>();
        ranges.add(EpkRange.of("D", "FF"));
        ranges.add(EpkRange.of("", "B"));
        ranges.add(EpkRange.of("B", "D"));
        Collections.sort(ranges);
        assertThat(ranges).containsExactly(EpkRange.of("", "B"), EpkRange.of("B", "D"), EpkRange.of("D", "FF"));
    }

    @Test
    void printsHalfOpen()
    {
        Assertions.assertEquals("[,FF)", EpkRange.FULL.toString());
        Assertions.assertEquals("[A,A]", EpkRange.point("A").toString());
    }
}
