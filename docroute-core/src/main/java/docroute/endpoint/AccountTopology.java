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

package docroute.endpoint;

import java.net.URI;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * The account's regional layout as reported by the account metadata source. Region lists are in the account's
 * own order; the first writable region is the current write region when only one may accept writes.
 */
public final class AccountTopology
{
    public static final class Region
    {
        public final String name;
        public final URI endpoint;

        public Region(String name, URI endpoint)
        {
            this.name = Objects.requireNonNull(name);
            this.endpoint = Objects.requireNonNull(endpoint);
        }

        public static Region of(String name, String endpoint)
        {
            return new Region(name, URI.create(endpoint));
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Region region = (Region) o;
            return name.equals(region.name) && endpoint.equals(region.endpoint);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(name, endpoint);
        }

        @Override
        public String toString()
        {
            return name + '=' + endpoint;
        }
    }

    public static final AccountTopology EMPTY = new AccountTopology(ImmutableList.of(), ImmutableList.of(), false);

    private final List<Region> writableRegions;
    private final List<Region> readableRegions;
    private final List<Region> thinClientWritableRegions;
    private final List<Region> thinClientReadableRegions;
    private final boolean enableMultipleWriteLocations;

    public AccountTopology(List<Region> writableRegions, List<Region> readableRegions, boolean enableMultipleWriteLocations)
    {
        this(writableRegions, readableRegions, ImmutableList.of(), ImmutableList.of(), enableMultipleWriteLocations);
    }

    public AccountTopology(List<Region> writableRegions, List<Region> readableRegions,
                           List<Region> thinClientWritableRegions, List<Region> thinClientReadableRegions,
                           boolean enableMultipleWriteLocations)
    {
        this.writableRegions = ImmutableList.copyOf(writableRegions);
        this.readableRegions = ImmutableList.copyOf(readableRegions);
        this.thinClientWritableRegions = ImmutableList.copyOf(thinClientWritableRegions);
        this.thinClientReadableRegions = ImmutableList.copyOf(thinClientReadableRegions);
        this.enableMultipleWriteLocations = enableMultipleWriteLocations;
    }

    public List<Region> writableRegions()
    {
        return writableRegions;
    }

    public List<Region> readableRegions()
    {
        return readableRegions;
    }

    public List<Region> thinClientWritableRegions()
    {
        return thinClientWritableRegions;
    }

    public List<Region> thinClientReadableRegions()
    {
        return thinClientReadableRegions;
    }

    public boolean enableMultipleWriteLocations()
    {
        return enableMultipleWriteLocations;
    }

    @Override
    public String toString()
    {
        return "AccountTopology{write=" + writableRegions + ", read=" + readableRegions
               + (thinClientReadableRegions.isEmpty() && thinClientWritableRegions.isEmpty() ? "" : ", thinClientWrite=" + thinClientWritableRegions + ", thinClientRead=" + thinClientReadableRegions)
               + ", multiWrite=" + enableMultipleWriteLocations + '}';
    }
}
