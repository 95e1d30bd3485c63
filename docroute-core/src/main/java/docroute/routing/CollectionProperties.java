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

import java.util.Objects;
import javax.annotation.Nullable;

import com.google.gson.JsonObject;

import docroute.primitives.GeospatialType;
import docroute.primitives.PartitionKeyDefinition;
import docroute.utils.Invariants;

public final class CollectionProperties
{
    private final String resourceId;
    private final String link;
    private final PartitionKeyDefinition partitionKeyDefinition;
    private final @Nullable JsonObject vectorEmbeddingPolicy;
    private final GeospatialType geospatialType;

    public CollectionProperties(String resourceId, String link, PartitionKeyDefinition partitionKeyDefinition)
    {
        this(resourceId, link, partitionKeyDefinition, null, GeospatialType.GEOGRAPHY);
    }

    public CollectionProperties(String resourceId, String link, PartitionKeyDefinition partitionKeyDefinition,
                                @Nullable JsonObject vectorEmbeddingPolicy, GeospatialType geospatialType)
    {
        this.resourceId = Invariants.nonEmpty(resourceId, "resourceId");
        this.link = Invariants.nonEmpty(link, "link");
        this.partitionKeyDefinition = Invariants.nonNull(partitionKeyDefinition, "partitionKeyDefinition");
        this.vectorEmbeddingPolicy = vectorEmbeddingPolicy == null ? null : vectorEmbeddingPolicy.deepCopy();
        this.geospatialType = Invariants.nonNull(geospatialType, "geospatialType");
    }

    public String resourceId()
    {
        return resourceId;
    }

    /**
     * The name based {@code dbs/{database}/colls/{collection}} link; also the collection's full name for session tokens
     */
    public String link()
    {
        return link;
    }

    public PartitionKeyDefinition partitionKeyDefinition()
    {
        return partitionKeyDefinition;
    }

    public @Nullable JsonObject vectorEmbeddingPolicy()
    {
        return vectorEmbeddingPolicy == null ? null : vectorEmbeddingPolicy.deepCopy();
    }

    public GeospatialType geospatialType()
    {
        return geospatialType;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CollectionProperties that = (CollectionProperties) o;
        return resourceId.equals(that.resourceId) && link.equals(that.link)
               && partitionKeyDefinition.equals(that.partitionKeyDefinition)
               && Objects.equals(vectorEmbeddingPolicy, that.vectorEmbeddingPolicy)
               && geospatialType == that.geospatialType;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(resourceId, link, partitionKeyDefinition);
    }

    @Override
    public String toString()
    {
        return "Collection{" + link + " (" + resourceId + ")}";
    }
}
