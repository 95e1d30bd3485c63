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

package docroute.query;

import java.util.List;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

import docroute.primitives.EpkRange;
import docroute.primitives.GeospatialType;
import docroute.primitives.PartitionKeyDefinition;

/**
 * What query planning needs to know about a container. The effective ranges are present only when the query
 * targets a single partition key.
 */
public final class ContainerQueryProperties
{
    private final String resourceId;
    private final @Nullable List<EpkRange> effectiveRangesForPartitionKey;
    private final PartitionKeyDefinition partitionKeyDefinition;
    private final @Nullable JsonObject vectorEmbeddingPolicy;
    private final GeospatialType geospatialType;

    public ContainerQueryProperties(String resourceId, @Nullable List<EpkRange> effectiveRangesForPartitionKey,
                                    PartitionKeyDefinition partitionKeyDefinition,
                                    @Nullable JsonObject vectorEmbeddingPolicy, GeospatialType geospatialType)
    {
        this.resourceId = resourceId;
        this.effectiveRangesForPartitionKey = effectiveRangesForPartitionKey == null ? null : ImmutableList.copyOf(effectiveRangesForPartitionKey);
        this.partitionKeyDefinition = partitionKeyDefinition;
        this.vectorEmbeddingPolicy = vectorEmbeddingPolicy;
        this.geospatialType = geospatialType;
    }

    public String resourceId()
    {
        return resourceId;
    }

    public @Nullable List<EpkRange> effectiveRangesForPartitionKey()
    {
        return effectiveRangesForPartitionKey;
    }

    public boolean hasLogicalPartitionKey()
    {
        return effectiveRangesForPartitionKey != null;
    }

    public PartitionKeyDefinition partitionKeyDefinition()
    {
        return partitionKeyDefinition;
    }

    public @Nullable JsonObject vectorEmbeddingPolicy()
    {
        return vectorEmbeddingPolicy;
    }

    public GeospatialType geospatialType()
    {
        return geospatialType;
    }

    @Override
    public String toString()
    {
        return "ContainerQueryProperties{" + resourceId + ", ranges=" + effectiveRangesForPartitionKey + '}';
    }
}
