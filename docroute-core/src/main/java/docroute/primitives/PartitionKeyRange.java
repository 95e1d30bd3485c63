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

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A contiguous slice {@code [minInclusive, maxExclusive)} of the effective partition key space served by one
 * physical partition. Parents name the ranges this one was split or merged from.
 */
public final class PartitionKeyRange
{
    private final String id;
    private final String minInclusive;
    private final String maxExclusive;
    private final List<String> parents;

    public PartitionKeyRange(String id, String minInclusive, String maxExclusive)
    {
        this(id, minInclusive, maxExclusive, ImmutableList.of());
    }

    public PartitionKeyRange(String id, String minInclusive, String maxExclusive, List<String> parents)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.minInclusive = Objects.requireNonNull(minInclusive, "minInclusive");
        this.maxExclusive = Objects.requireNonNull(maxExclusive, "maxExclusive");
        if (minInclusive.compareTo(maxExclusive) >= 0)
            throw new IllegalArgumentException("Partition key range " + id + " is empty: [" + minInclusive + ", " + maxExclusive + ')');
        this.parents = ImmutableList.copyOf(parents);
    }

    public String id()
    {
        return id;
    }

    public String minInclusive()
    {
        return minInclusive;
    }

    public String maxExclusive()
    {
        return maxExclusive;
    }

    public List<String> parents()
    {
        return parents;
    }

    public EpkRange toRange()
    {
        return EpkRange.of(minInclusive, maxExclusive);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartitionKeyRange that = (PartitionKeyRange) o;
        return id.equals(that.id) && minInclusive.equals(that.minInclusive) && maxExclusive.equals(that.maxExclusive);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(id, minInclusive, maxExclusive);
    }

    @Override
    public String toString()
    {
        return "PartitionKeyRange{" + id + ": [" + minInclusive + ", " + maxExclusive + ")}";
    }
}
