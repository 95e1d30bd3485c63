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

package docroute.query.plan;

import java.util.UUID;
import javax.annotation.Nullable;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import docroute.api.ClientConfig;
import docroute.api.QueryPlanGenerator;
import docroute.api.Trace;
import docroute.primitives.GeospatialType;
import docroute.primitives.OperationType;
import docroute.primitives.PartitionKey;
import docroute.primitives.PartitionKeyDefinition;
import docroute.primitives.ResourceType;
import docroute.query.ContainerQueryProperties;
import docroute.query.QueryClient;
import docroute.query.SqlQuerySpec;
import docroute.utils.Invariants;
import docroute.utils.async.AsyncChain;
import docroute.utils.async.Cancellation;

/**
 * Obtains query plans, either from the in-process generator or from the gateway. The gateway is told which query
 * features this client can execute; that set is fixed for the life of the process.
 */
public class QueryPlanRetriever
{
    private static final Logger logger = LoggerFactory.getLogger(QueryPlanRetriever.class);

    private QueryPlanRetriever() {}

    public static boolean bypassQueryParsing(ClientConfig config)
    {
        return config.bypassQueryParsing() || Boolean.getBoolean(ClientConfig.FORCE_BYPASS_QUERY_PARSING_PROPERTY);
    }

    public static AsyncChain<PartitionedQueryExecutionInfo> getQueryPlanWithServiceInterop(QueryClient queryClient, SqlQuerySpec querySpec,
                                                                                           ResourceType resourceType,
                                                                                           PartitionKeyDefinition partitionKeyDefinition,
                                                                                           @Nullable JsonObject vectorEmbeddingPolicy,
                                                                                           boolean hasLogicalPartitionKey,
                                                                                           GeospatialType geospatialType,
                                                                                           boolean useSystemPrefix,
                                                                                           boolean hybridSearchQueryPlanOptimizationDisabled,
                                                                                           Trace trace, Cancellation cancellation)
    {
        Invariants.nonNull(queryClient, "queryClient");
        Invariants.nonNull(querySpec, "querySpec");
        Invariants.nonNull(partitionKeyDefinition, "partitionKeyDefinition");
        cancellation.throwIfCancelled();

        QueryPlanGenerator.Options options = new QueryPlanGenerator.Options(true, false, true, hasLogicalPartitionKey, true,
                                                                            useSystemPrefix, !hybridSearchQueryPlanOptimizationDisabled,
                                                                            geospatialType);
        Trace child = trace.startChild("Service Interop Query Plan", Trace.Component.QUERY, Trace.Level.INFO);
        return queryClient.tryGetPartitionedQueryExecutionInfo(querySpec, resourceType, partitionKeyDefinition, vectorEmbeddingPolicy, options, cancellation)
                          .addCallback((plan, failure) -> {
                              if (failure != null)
                                  logger.debug("Local query plan generation failed for {}", querySpec, failure);
                              child.close();
                          });
    }

    public static AsyncChain<PartitionedQueryExecutionInfo> getQueryPlanThroughGateway(QueryClient queryClient, SqlQuerySpec querySpec,
                                                                                       String resourceLink, @Nullable PartitionKey partitionKey,
                                                                                       boolean hybridSearchQueryPlanOptimizationDisabled,
                                                                                       UUID correlatedActivityId,
                                                                                       Trace trace, Cancellation cancellation)
    {
        Invariants.nonNull(queryClient, "queryClient");
        Invariants.nonNull(querySpec, "querySpec");
        Invariants.nonNull(resourceLink, "resourceLink");
        cancellation.throwIfCancelled();

        Trace child = trace.startChild("Gateway QueryPlan", Trace.Component.QUERY, Trace.Level.INFO);
        if (!queryClient.hasLocalQueryPlanGenerator())
            child.addDatum("ServiceInterop unavailable", true);

        return queryClient.executeQueryPlanRequest(resourceLink, ResourceType.DOCUMENT, OperationType.QUERY_PLAN, querySpec, partitionKey,
                                                   QueryFeatures.supportedQueryFeatures(hybridSearchQueryPlanOptimizationDisabled),
                                                   correlatedActivityId, child, cancellation)
                          .addCallback((plan, failure) -> child.close());
    }

    /**
     * Plans in process unless query parsing is bypassed or no generator is available, in which case the gateway plans
     */
    public static AsyncChain<PartitionedQueryExecutionInfo> getQueryPlan(QueryClient queryClient, SqlQuerySpec querySpec, String resourceLink,
                                                                         ResourceType resourceType, ContainerQueryProperties container,
                                                                         @Nullable PartitionKey partitionKey, UUID correlatedActivityId,
                                                                         Trace trace, Cancellation cancellation)
    {
        Invariants.nonNull(queryClient, "queryClient");
        Invariants.nonNull(container, "container");
        boolean hybridSearchOptimizationDisabled = queryClient.config().hybridSearchQueryPlanOptimizationDisabled();
        if (!queryClient.bypassQueryParsing() && queryClient.hasLocalQueryPlanGenerator())
        {
            return getQueryPlanWithServiceInterop(queryClient, querySpec, resourceType, container.partitionKeyDefinition(),
                                                  container.vectorEmbeddingPolicy(), container.hasLogicalPartitionKey(),
                                                  container.geospatialType(), container.partitionKeyDefinition().isSystemKey(),
                                                  hybridSearchOptimizationDisabled, trace, cancellation);
        }
        return getQueryPlanThroughGateway(queryClient, querySpec, resourceLink, partitionKey, hybridSearchOptimizationDisabled,
                                          correlatedActivityId, trace, cancellation);
    }
}
