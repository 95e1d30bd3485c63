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

import javax.annotation.Nullable;

import docroute.primitives.PartitionKey;

/**
 * Caller supplied options for one logical query. Immutable; {@link #withMaxItemCount(int)} derives the per-page copy.
 */
public final class QueryRequestOptions
{
    public static final int DEFAULT_MAX_ITEM_COUNT = 100;
    public static final QueryRequestOptions DEFAULT = builder().build();

    private final int maxItemCount;
    private final @Nullable PartitionKey partitionKey;
    private final boolean populateQueryMetrics;
    private final boolean enableOptimisticDirectExecution;
    private final @Nullable String regionHint;

    private QueryRequestOptions(Builder builder)
    {
        this.maxItemCount = builder.maxItemCount;
        this.partitionKey = builder.partitionKey;
        this.populateQueryMetrics = builder.populateQueryMetrics;
        this.enableOptimisticDirectExecution = builder.enableOptimisticDirectExecution;
        this.regionHint = builder.regionHint;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public int maxItemCount()
    {
        return maxItemCount;
    }

    public @Nullable PartitionKey partitionKey()
    {
        return partitionKey;
    }

    public boolean populateQueryMetrics()
    {
        return populateQueryMetrics;
    }

    public boolean enableOptimisticDirectExecution()
    {
        return enableOptimisticDirectExecution;
    }

    public @Nullable String regionHint()
    {
        return regionHint;
    }

    public QueryRequestOptions withMaxItemCount(int maxItemCount)
    {
        if (maxItemCount == this.maxItemCount)
            return this;
        return toBuilder().maxItemCount(maxItemCount).build();
    }

    public Builder toBuilder()
    {
        return new Builder().maxItemCount(maxItemCount)
                            .partitionKey(partitionKey)
                            .populateQueryMetrics(populateQueryMetrics)
                            .enableOptimisticDirectExecution(enableOptimisticDirectExecution)
                            .regionHint(regionHint);
    }

    public static final class Builder
    {
        private int maxItemCount = DEFAULT_MAX_ITEM_COUNT;
        private PartitionKey partitionKey;
        private boolean populateQueryMetrics;
        private boolean enableOptimisticDirectExecution = true;
        private String regionHint;

        private Builder() {}

        public Builder maxItemCount(int maxItemCount)
        {
            if (maxItemCount == 0 || maxItemCount < -1)
                throw new IllegalArgumentException("maxItemCount must be positive, or -1 for dynamic page sizes: " + maxItemCount);
            this.maxItemCount = maxItemCount;
            return this;
        }

        public Builder partitionKey(@Nullable PartitionKey partitionKey)
        {
            this.partitionKey = partitionKey;
            return this;
        }

        public Builder populateQueryMetrics(boolean populateQueryMetrics)
        {
            this.populateQueryMetrics = populateQueryMetrics;
            return this;
        }

        public Builder enableOptimisticDirectExecution(boolean enable)
        {
            this.enableOptimisticDirectExecution = enable;
            return this;
        }

        public Builder regionHint(@Nullable String regionHint)
        {
            this.regionHint = regionHint;
            return this;
        }

        public QueryRequestOptions build()
        {
            return new QueryRequestOptions(this);
        }
    }
}
