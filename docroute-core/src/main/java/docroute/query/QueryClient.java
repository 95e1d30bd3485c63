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

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import docroute.api.ClientConfig;
import docroute.api.QueryPlanGenerator;
import docroute.api.QuerySerializer;
import docroute.api.SessionContainer;
import docroute.api.Trace;
import docroute.api.Transport;
import docroute.coordinate.BadRequestException;
import docroute.coordinate.DocumentClientException;
import docroute.coordinate.PartitionKeyRangeGoneException;
import docroute.coordinate.StaleRoutingCacheException;
import docroute.coordinate.StatusCodes;
import docroute.coordinate.TransportFailure;
import docroute.endpoint.Endpoint;
import docroute.endpoint.GlobalEndpointManager;
import docroute.messages.Headers;
import docroute.messages.HttpHeaders;
import docroute.messages.RequestMessage;
import docroute.messages.ResponseMessage;
import docroute.primitives.EpkRange;
import docroute.primitives.FeedRange;
import docroute.primitives.OperationType;
import docroute.primitives.PartitionKey;
import docroute.primitives.PartitionKeyDefinition;
import docroute.primitives.PartitionKeyRange;
import docroute.primitives.ResourceLinks;
import docroute.primitives.ResourceType;
import docroute.query.plan.PartitionedQueryExecutionInfo;
import docroute.query.plan.QueryPlanRetriever;
import docroute.routing.CollectionCache;
import docroute.routing.CollectionProperties;
import docroute.routing.PartitionKeyRangeCache;
import docroute.utils.Invariants;
import docroute.utils.async.AsyncChain;
import docroute.utils.async.AsyncChains;
import docroute.utils.async.Cancellation;

/**
 * The query pipeline's view of the client: container metadata, partition routing, plan requests and page fetches.
 *
 * Every request is routed through the {@link GlobalEndpointManager}. A transport failure marks the endpoint it was
 * sent to unavailable, for reads or writes depending on the operation, and is then propagated; retrying against
 * the next endpoint is the caller's decision. Non-success responses become the matching
 * {@link DocumentClientException}.
 */
public class QueryClient
{
    private static final Logger logger = LoggerFactory.getLogger(QueryClient.class);

    private final ClientConfig config;
    private final GlobalEndpointManager endpointManager;
    private final CollectionCache collectionCache;
    private final PartitionKeyRangeCache partitionKeyRangeCache;
    private final Transport transport;
    private final QuerySerializer serializer;
    private final QueryResponseParser responseParser;
    private final @Nullable QueryPlanGenerator planGenerator;
    private final SessionContainer sessionContainer;

    public QueryClient(ClientConfig config, GlobalEndpointManager endpointManager, CollectionCache collectionCache,
                       PartitionKeyRangeCache partitionKeyRangeCache, Transport transport, QuerySerializer serializer,
                       @Nullable QueryPlanGenerator planGenerator, SessionContainer sessionContainer)
    {
        this.config = Invariants.nonNull(config, "config");
        this.endpointManager = Invariants.nonNull(endpointManager, "endpointManager");
        this.collectionCache = Invariants.nonNull(collectionCache, "collectionCache");
        this.partitionKeyRangeCache = Invariants.nonNull(partitionKeyRangeCache, "partitionKeyRangeCache");
        this.transport = Invariants.nonNull(transport, "transport");
        this.serializer = Invariants.nonNull(serializer, "serializer");
        this.responseParser = new QueryResponseParser(serializer);
        this.planGenerator = planGenerator;
        this.sessionContainer = Invariants.nonNull(sessionContainer, "sessionContainer");
    }

    public ClientConfig config()
    {
        return config;
    }

    public AsyncChain<ContainerQueryProperties> getCachedContainerQueryProperties(String containerLink, @Nullable PartitionKey partitionKey, Trace trace, Cancellation cancellation)
    {
        Invariants.nonEmpty(containerLink, "containerLink");
        return collectionCache.resolveByLink(containerLink, trace, cancellation).map(collection -> {
            PartitionKeyDefinition definition = collection.partitionKeyDefinition();
            List<EpkRange> ranges = null;
            if (partitionKey != null)
            {
                PartitionKey key = partitionKey.isNone() ? definition.noneValue() : partitionKey;
                ranges = ImmutableList.of(definition.effectivePartitionKeyRange(key));
            }
            return new ContainerQueryProperties(collection.resourceId(), ranges, definition,
                                                collection.vectorEmbeddingPolicy(), collection.geospatialType());
        });
    }

    public boolean hasLocalQueryPlanGenerator()
    {
        return planGenerator != null;
    }

    /**
     * Plans the query in process. Fails with {@link BadRequestException} when the generator rejects the query,
     * and with {@link IllegalStateException} when no generator is configured.
     */
    public AsyncChain<PartitionedQueryExecutionInfo> tryGetPartitionedQueryExecutionInfo(SqlQuerySpec querySpec, ResourceType resourceType,
                                                                                         PartitionKeyDefinition partitionKeyDefinition,
                                                                                         @Nullable JsonObject vectorEmbeddingPolicy,
                                                                                         QueryPlanGenerator.Options options,
                                                                                         Cancellation cancellation)
    {
        return AsyncChains.defer(() -> {
            cancellation.throwIfCancelled();
            if (planGenerator == null)
                throw Invariants.illegalState("No local query plan generator is configured");

            String querySpecJson = new String(serializer.serializeQuerySpec(querySpec, resourceType), StandardCharsets.UTF_8);
            try
            {
                return AsyncChains.success(planGenerator.generate(querySpecJson, partitionKeyDefinition, vectorEmbeddingPolicy, options));
            }
            catch (IllegalArgumentException e)
            {
                throw new BadRequestException(e.getMessage());
            }
        });
    }

    public AsyncChain<QueryPage> executeItemQuery(String resourceUri, ResourceType resourceType, OperationType operationType,
                                                  @Nullable FeedRange feedRange, QueryRequestOptions options,
                                                  AdditionalRequestHeaders additionalHeaders, SqlQuerySpec querySpec,
                                                  @Nullable String continuationToken, int pageSize, Trace trace, Cancellation cancellation)
    {
        Invariants.nonEmpty(resourceUri, "resourceUri");
        Invariants.nonNull(options, "options");
        Invariants.nonNull(additionalHeaders, "additionalHeaders");
        Invariants.nonNull(querySpec, "querySpec");
        cancellation.throwIfCancelled();

        QueryRequestOptions pageOptions = options.withMaxItemCount(pageSize);
        RequestMessage.Builder builder = RequestMessage.builder(resourceType, operationType, resourceUri)
                                                       .payload(serializer.serializeQuerySpec(querySpec, resourceType))
                                                       .regionHint(pageOptions.regionHint())
                                                       .header(HttpHeaders.PAGE_SIZE, Integer.toString(pageOptions.maxItemCount()))
                                                       .header(HttpHeaders.IS_CONTINUATION_EXPECTED, HttpHeaders.bool(additionalHeaders.isContinuationExpected()))
                                                       .header(HttpHeaders.CONTINUATION, continuationToken)
                                                       .header(HttpHeaders.CONTENT_TYPE, HttpHeaders.QUERY_JSON)
                                                       .header(HttpHeaders.IS_QUERY, HttpHeaders.TRUE)
                                                       .header(HttpHeaders.CORRELATED_ACTIVITY_ID, additionalHeaders.correlatedActivityId().toString())
                                                       .header(HttpHeaders.OPTIMISTIC_DIRECT_EXECUTE, HttpHeaders.bool(additionalHeaders.optimisticDirectExecute()));
        if (pageOptions.populateQueryMetrics())
            builder.header(HttpHeaders.POPULATE_QUERY_METRICS, HttpHeaders.TRUE);

        PartitionKey partitionKey = pageOptions.partitionKey();
        if (partitionKey != null && !(feedRange instanceof FeedRange.Logical))
            builder.header(HttpHeaders.PARTITION_KEY, partitionKey.toJson());

        Trace child = trace.startChild("Execute Item Query", Trace.Component.QUERY, Trace.Level.INFO);
        return routeToFeedRange(builder, resourceUri, resourceType, feedRange, child, cancellation)
               .flatMap(targetRangeId -> {
                   RequestMessage request = builder.build();
                   return send(request, child, cancellation).map(response -> toQueryPage(response, resourceType, targetRangeId, child));
               })
               .addCallback((success, failure) -> child.close());
    }

    // resolves the feed range to routing information on the builder; yields the targeted range id, if any
    private AsyncChain<String> routeToFeedRange(RequestMessage.Builder builder, String resourceUri, ResourceType resourceType,
                                                @Nullable FeedRange feedRange, Trace trace, Cancellation cancellation)
    {
        if (feedRange == null || !resourceType.isPartitioned())
            return AsyncChains.success(null);

        if (feedRange instanceof FeedRange.Logical)
        {
            builder.header(HttpHeaders.PARTITION_KEY, ((FeedRange.Logical) feedRange).partitionKey.toJson());
            return AsyncChains.success(null);
        }

        if (feedRange instanceof FeedRange.Physical)
        {
            String id = ((FeedRange.Physical) feedRange).partitionKeyRangeId;
            builder.partitionKeyRangeId(id);
            return AsyncChains.success(id);
        }

        EpkRange range = ((FeedRange.Epk) feedRange).range;
        return collectionCache.resolveByLink(resourceUri, trace, cancellation).flatMap(collection ->
               getTargetPartitionKeyRanges(resourceUri, collection.resourceId(), ImmutableList.of(range), false, trace, cancellation).map(targets -> {
                   if (targets.size() != 1)
                   {
                       // the range was served by one partition when it was handed out; it has since been split
                       throw new PartitionKeyRangeGoneException("Epk range " + range + " now spans " + targets.size() + " partitions",
                                                                StatusCodes.SUBSTATUS_PARTITION_KEY_RANGE_GONE, null, 0, Headers.EMPTY);
                   }
                   PartitionKeyRange target = targets.get(0);
                   builder.partitionKeyRangeId(target.id());
                   if (!target.toRange().equals(range))
                   {
                       builder.header(HttpHeaders.START_EPK, range.min());
                       builder.header(HttpHeaders.END_EPK, range.max());
                   }
                   return target.id();
               }));
    }

    private QueryPage toQueryPage(ResponseMessage response, ResourceType resourceType, @Nullable String targetRangeId, Trace trace)
    {
        Headers headers = response.headers();
        String metricsText = headers.queryMetricsText();
        if (metricsText != null)
            trace.addDatum("Query Metrics", Suppliers.memoize(() -> QueryMetrics.parse(metricsText)));

        if (!response.isSuccess())
            throw response.toException();

        try (Trace parse = trace.startChild("Get Query Page", Trace.Component.JSON, Trace.Level.INFO))
        {
            return responseParser.createQueryPage(headers, response.body(), resourceType, targetRangeId);
        }
    }

    public AsyncChain<PartitionedQueryExecutionInfo> executeQueryPlanRequest(String resourceUri, ResourceType resourceType, OperationType operationType,
                                                                             SqlQuerySpec querySpec, @Nullable PartitionKey partitionKey,
                                                                             String supportedQueryFeatures, UUID correlatedActivityId,
                                                                             Trace trace, Cancellation cancellation)
    {
        Invariants.nonEmpty(resourceUri, "resourceUri");
        Invariants.nonNull(querySpec, "querySpec");
        cancellation.throwIfCancelled();

        RequestMessage request = RequestMessage.builder(resourceType, operationType, resourceUri)
                                               .payload(serializer.serializeQuerySpec(querySpec, resourceType))
                                               .header(HttpHeaders.CONTENT_TYPE, HttpHeaders.QUERY_JSON)
                                               .header(HttpHeaders.IS_QUERY_PLAN_REQUEST, HttpHeaders.TRUE)
                                               .header(HttpHeaders.SUPPORTED_QUERY_FEATURES, supportedQueryFeatures)
                                               .header(HttpHeaders.QUERY_VERSION, HttpHeaders.QUERY_VERSION_1_0)
                                               .header(HttpHeaders.CORRELATED_ACTIVITY_ID, correlatedActivityId.toString())
                                               .header(HttpHeaders.PARTITION_KEY, partitionKey == null ? null : partitionKey.toJson())
                                               .useGatewayMode(true)
                                               .build();

        return send(request, trace, cancellation)
               .map(response -> serializer.deserializeQueryPlan(response.ensureSuccessStatusCode().body()));
    }

    private AsyncChain<ResponseMessage> send(RequestMessage request, Trace trace, Cancellation cancellation)
    {
        Endpoint endpoint = endpointManager.resolveServiceEndpoint(request);
        trace.addDatum("endpoint", endpoint);
        logger.trace("Sending {} to {}", request, endpoint);
        AsyncChain<ResponseMessage> response = transport.send(endpoint, request).recover(failure -> {
            if (failure instanceof TransportFailure)
            {
                Endpoint failed = ((TransportFailure) failure).endpoint();
                if (request.operationType().isWriteOperation()) endpointManager.markEndpointUnavailableForWrite(failed);
                else endpointManager.markEndpointUnavailableForRead(failed);
            }
            return null;
        });
        return AsyncChains.withCancellation(response, cancellation);
    }

    public boolean getClientDisableOptimisticDirectExecution()
    {
        return config.clientDisableOptimisticDirectExecution();
    }

    public AsyncChain<List<PartitionKeyRange>> getTargetPartitionKeyRangeByFeedRange(String resourceLink, String collectionResourceId,
                                                                                     PartitionKeyDefinition partitionKeyDefinition,
                                                                                     FeedRange feedRange, boolean forceRefresh,
                                                                                     Trace trace, Cancellation cancellation)
    {
        Invariants.nonNull(feedRange, "feedRange");
        Invariants.nonNull(partitionKeyDefinition, "partitionKeyDefinition");
        Trace child = trace.startChild("Get Overlapping Feed Ranges", Trace.Component.ROUTING, Trace.Level.INFO);
        return effectiveRanges(collectionResourceId, partitionKeyDefinition, feedRange, child, cancellation)
               .flatMap(ranges -> getTargetPartitionKeyRanges(resourceLink, collectionResourceId, ranges, forceRefresh, child, cancellation))
               .addCallback((success, failure) -> child.close());
    }

    private AsyncChain<List<EpkRange>> effectiveRanges(String collectionResourceId, PartitionKeyDefinition definition, FeedRange feedRange,
                                                       Trace trace, Cancellation cancellation)
    {
        if (feedRange instanceof FeedRange.Epk)
            return AsyncChains.success(ImmutableList.of(((FeedRange.Epk) feedRange).range));

        if (feedRange instanceof FeedRange.Logical)
        {
            PartitionKey key = ((FeedRange.Logical) feedRange).partitionKey;
            return AsyncChains.success(ImmutableList.of(definition.effectivePartitionKeyRange(key)));
        }

        String id = ((FeedRange.Physical) feedRange).partitionKeyRangeId;
        return partitionKeyRangeCache.tryGetRangeByPartitionKeyRangeId(collectionResourceId, id, trace, cancellation).map(range -> {
            if (range == null)
                throw new StaleRoutingCacheException("Partition key range " + id + " of collection " + collectionResourceId + " was not found in the routing map");
            return ImmutableList.of(range.toRange());
        });
    }

    /**
     * The partition key ranges overlapping {@code providedRanges}. If no complete routing map is available the
     * collection may have been deleted and re-created under the same name: the cached name resolution is dropped
     * and the call fails with {@link StaleRoutingCacheException}, so that the next attempt starts afresh.
     */
    public AsyncChain<List<PartitionKeyRange>> getTargetPartitionKeyRanges(String resourceLink, String collectionResourceId,
                                                                           Collection<EpkRange> providedRanges, boolean forceRefresh,
                                                                           Trace trace, Cancellation cancellation)
    {
        Invariants.nonEmpty(collectionResourceId, "collectionResourceId");
        Invariants.nonEmptyNoNulls(providedRanges, "providedRanges");

        Trace child = trace.startChild("Get Partition Key Ranges", Trace.Component.ROUTING, Trace.Level.INFO);
        return partitionKeyRangeCache.tryGetOverlappingRanges(collectionResourceId, providedRanges, forceRefresh, child, cancellation).map(ranges -> {
            if (ranges == null && resourceLink != null && ResourceLinks.isNameBased(resourceLink))
                collectionCache.refresh(resourceLink);

            if (ranges == null)
            {
                String provided = providedRanges.stream().map(Object::toString).collect(Collectors.joining(","));
                throw new StaleRoutingCacheException(Instant.now() + ": GetTargetPartitionKeyRanges(collectionResourceId:" + collectionResourceId
                                                     + ", providedRanges: " + provided + " failed due to stale cache");
            }
            return ranges;
        }).addCallback((success, failure) -> child.close());
    }

    public boolean bypassQueryParsing()
    {
        return QueryPlanRetriever.bypassQueryParsing(config);
    }

    public void clearSessionTokenCache(String collectionFullName)
    {
        sessionContainer.clearTokenByCollectionFullName(collectionFullName);
    }

    /**
     * Clears the collection's session tokens and re-resolves its name, bypassing the cache
     */
    public AsyncChain<CollectionProperties> forceRefreshCollectionCache(String collectionLink, Cancellation cancellation)
    {
        Invariants.nonEmpty(collectionLink, "collectionLink");
        clearSessionTokenCache(collectionLink);
        return collectionCache.resolveByLink(collectionLink, true, Trace.NO_OP, cancellation);
    }

    public AsyncChain<List<PartitionKeyRange>> tryGetOverlappingRanges(String collectionResourceId, EpkRange range, boolean forceRefresh, Cancellation cancellation)
    {
        return partitionKeyRangeCache.tryGetOverlappingRanges(collectionResourceId, range, forceRefresh, Trace.NO_OP, cancellation);
    }

    public PartitionKeyRangeCache partitionKeyRangeCache()
    {
        return partitionKeyRangeCache;
    }
}
