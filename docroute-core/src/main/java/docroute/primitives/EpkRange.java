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

import java.util.Objects;

import docroute.utils.Invariants;

/**
 * A range over the effective partition key space, ordered by ordinal string comparison. Routing ranges are
 * always {@code [min, max)}; query ranges may carry other inclusivity, with a single key lookup being {@code [epk, epk]}.
 */
public final class EpkRange implements Comparable<EpkRange>
{
    public static final String MINIMUM_INCLUSIVE = "";
    public static final String MAXIMUM_EXCLUSIVE = "FF";

    public static final EpkRange FULL = new EpkRange(MINIMUM_INCLUSIVE, MAXIMUM_EXCLUSIVE, true, false);

    private final String min;
    private final String max;
    private final boolean minInclusive;
    private final boolean maxInclusive;

    public EpkRange(String min, String max, boolean minInclusive, boolean maxInclusive)
    {
        Invariants.nonNull(min, "min");
        Invariants.nonNull(max, "max");
        int c = min.compareTo(max);
        if (c > 0)
            throw new IllegalArgumentException(min + " > " + max);
        if (c == 0 && !(minInclusive && maxInclusive))
            throw new IllegalArgumentException("Empty range [" + min + ", " + max + ")");
        this.min = min;
        this.max = max;
        this.minInclusive = minInclusive;
        this.maxInclusive = maxInclusive;
    }

    public static EpkRange of(String minInclusive, String maxExclusive)
    {
        return new EpkRange(minInclusive, maxExclusive, true, false);
    }

    public static EpkRange point(String effectivePartitionKey)
    {
        return new EpkRange(effectivePartitionKey, effectivePartitionKey, true, true);
    }

    public String min()
    {
        return min;
    }

    public String max()
    {
        return max;
    }

    public boolean minInclusive()
    {
        return minInclusive;
    }

    public boolean maxInclusive()
    {
        return maxInclusive;
    }

    public boolean isSingleValue()
    {
        return minInclusive && maxInclusive && min.equals(max);
    }

    public boolean contains(String effectivePartitionKey)
    {
        int cmin = effectivePartitionKey.compareTo(min);
        if (cmin < 0 || (cmin == 0 && !minInclusive))
            return false;
        int cmax = effectivePartitionKey.compareTo(max);
        return cmax < 0 || (cmax == 0 && maxInclusive);
    }

    public boolean contains(EpkRange that)
    {
        int cmin = that.min.compareTo(this.min);
        if (cmin < 0 || (cmin == 0 && that.minInclusive && !this.minInclusive))
            return false;
        int cmax = that.max.compareTo(this.max);
        return cmax < 0 || (cmax == 0 && (!that.maxInclusive || this.maxInclusive));
    }

    public boolean overlaps(EpkRange that)
    {
        return startsBeforeEndOf(this, that) && startsBeforeEndOf(that, this);
    }

    private static boolean startsBeforeEndOf(EpkRange a, EpkRange b)
    {
        int c = a.min.compareTo(b.max);
        return c < 0 || (c == 0 && a.minInclusive && b.maxInclusive);
    }

    /**
     * Sorts by min then max, with an inclusive bound sorting before an exclusive one at the same point
     */
    @Override
    public int compareTo(EpkRange that)
    {
        int c = this.min.compareTo(that.min);
        if (c == 0) c = Boolean.compare(that.minInclusive, this.minInclusive);
        if (c == 0) c = this.max.compareTo(that.max);
        if (c == 0) c = Boolean.compare(this.maxInclusive, that.maxInclusive);
        return c;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EpkRange that = (EpkRange) o;
        return minInclusive == that.minInclusive && maxInclusive == that.maxInclusive
               && min.equals(that.min) && max.equals(that.max);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(min, max, minInclusive, maxInclusive);
    }

    @Override
    public String toString()
    {
        return (minInclusive ? "[" : "(") + min + ',' + max + (maxInclusive ? ']' : ')');
    }
}
