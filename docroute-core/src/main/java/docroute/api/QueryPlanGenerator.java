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

package docroute.api;

import javax.annotation.Nullable;

import com.google.gson.JsonObject;

import docroute.primitives.GeospatialType;
import docroute.primitives.PartitionKeyDefinition;
import docroute.query.plan.PartitionedQueryExecutionInfo;

/**
 * In-process query plan generation; avoids a gateway round trip when available
 */
public interface QueryPlanGenerator
{
    /**
     * @throws docroute.coordinate.BadRequestException if the query cannot be planned, e.g. a syntax error
     */
    PartitionedQueryExecutionInfo generate(String querySpecJson,
                                           PartitionKeyDefinition partitionKeyDefinition,
                                           @Nullable JsonObject vectorEmbeddingPolicy,
                                           Options options);

    final class Options
    {
        public final boolean requireFormattableOrderByQuery;
        public final boolean isContinuationExpected;
        public final boolean allowNonValueAggregateQuery;
        public final boolean hasLogicalPartitionKey;
        public final boolean allowDCount;
        public final boolean useSystemPrefix;
        public final boolean hybridSearchSkipOrderByRewrite;
        public final @Nullable GeospatialType geospatialType;

        public Options(boolean requireFormattableOrderByQuery, boolean isContinuationExpected,
                       boolean allowNonValueAggregateQuery, boolean hasLogicalPartitionKey, boolean allowDCount,
                       boolean useSystemPrefix, boolean hybridSearchSkipOrderByRewrite,
                       @Nullable GeospatialType geospatialType)
        {
            this.requireFormattableOrderByQuery = requireFormattableOrderByQuery;
            this.isContinuationExpected = isContinuationExpected;
            this.allowNonValueAggregateQuery = allowNonValueAggregateQuery;
            this.hasLogicalPartitionKey = hasLogicalPartitionKey;
            this.allowDCount = allowDCount;
            this.useSystemPrefix = useSystemPrefix;
            this.hybridSearchSkipOrderByRewrite = hybridSearchSkipOrderByRewrite;
            this.geospatialType = geospatialType;
        }
    }
}
