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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import docroute.api.ClientConfig;
import docroute.api.Trace;
import docroute.coordinate.DocumentClientException;
import docroute.coordinate.PartitionKeyRangeGoneException;
import docroute.coordinate.StaleRoutingCacheException;
import docroute.coordinate.StatusCodes;
import docroute.coordinate.TransportFailure;
import docroute.impl.GsonQuerySerializer;
import docroute.impl.mock.MockBackend;
import docroute.impl.mock.MockCluster;
import docroute.impl.mock.MockTransport;
import docroute.impl.mock.RecordingTrace;
import docroute.messages.Headers;
import docroute.messages.HttpHeaders;
import docroute.messages.RequestMessage;
import docroute.primitives.EpkRange;
import docroute.primitives.FeedRange;
import docroute.primitives.OperationType;
import docroute.primitives.PartitionKey;
import docroute.primitives.PartitionKeyRange;
import docroute.primitives.ResourceType;
import docroute.utils.async.AsyncChain;
import docroute.utils.async.AsyncChains;
import docroute.utils.async.Cancellation;

import static docroute.impl.mock.MockBackend.page;
import static docroute.impl.mock.MockCluster.HIGH;
import static docroute.impl.mock.MockCluster.LOW;
import static docroute.impl.mock.MockCluster.MIDDLE;
import static docroute.impl.mock.MockCluster.ORDERS_KEY;
import static docroute.impl.mock.MockCluster.ORDERS_LINK;
import static docroute.impl.mock.MockCluster.ORDERS_RID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryClientTest
{
    private static final SqlQuerySpec QUERY = new SqlQuerySpec("SELECT * FROM c WHERE c.total > @min",
                                                               ImmutableList.of(new SqlQuerySpec.Parameter("@min", new JsonPrimitive(100))));
    private static final UUID ACTIVITY = UUID.fromString("6f1f3c1e-54d4-4c43-9a43-35d1a2a3c7a9");

    private final MockCluster cluster = new MockCluster();

    private AsyncChain<QueryPage> query(FeedRange feedRange, QueryRequestOptions options, String continuation, Trace trace)
    {
        return cluster.client.executeItemQuery(ORDERS_LINK, ResourceType.DOCUMENT, OperationType.QUERY, feedRange, options,
                                               new AdditionalRequestHeaders(ACTIVITY, true, false), QUERY, continuation,
                                               options.maxItemCount(), trace, Cancellation.NONE);
    }

    private QueryPage queryPage(FeedRange feedRange, String continuation)
    {
        return AsyncChains.getUnchecked(query(feedRange, QueryRequestOptions.DEFAULT, continuation, Trace.NO_OP));
    }

    @Test
    void itemQueryCarriesQueryHeaders()
    {
        cluster.backend.pages("2", page("a"), page("b"), page("c"));
        QueryRequestOptions options = QueryRequestOptions.builder().maxItemCount(10).populateQueryMetrics(true).build();
        QueryPage page = AsyncChains.getUnchecked(query(FeedRange.ofPartitionKeyRange("2"), options, "page-1", Trace.NO_OP));

        MockTransport.Envelope sent = cluster.transport.last();
        Assertions.assertEquals("West", sent.endpoint.region());
        RequestMessage request = sent.request;
        Headers headers = request.headers();
        Assertions.assertEquals("2", request.partitionKeyRangeId());
        Assertions.assertEquals("10", headers.get(HttpHeaders.PAGE_SIZE));
        Assertions.assertEquals("page-1", headers.continuationToken());
        Assertions.assertEquals("True", headers.get(HttpHeaders.IS_CONTINUATION_EXPECTED));
        Assertions.assertEquals("True", headers.get(HttpHeaders.IS_QUERY));
        Assertions.assertEquals("False", headers.get(HttpHeaders.OPTIMISTIC_DIRECT_EXECUTE));
        Assertions.assertEquals("True", headers.get(HttpHeaders.POPULATE_QUERY_METRICS));
        Assertions.assertEquals(HttpHeaders.QUERY_JSON, headers.get(HttpHeaders.CONTENT_TYPE));
        Assertions.assertEquals(ACTIVITY.toString(), headers.get(HttpHeaders.CORRELATED_ACTIVITY_ID));
        Assertions.assertFalse(headers.contains(HttpHeaders.PARTITION_KEY));
        Assertions.assertEquals(QUERY, GsonQuerySerializer.INSTANCE.deserializeQuerySpec(request.payload()));

        assertThat(page.documents()).containsExactly(MockBackend.doc("b"));
        Assertions.assertEquals(2.5, page.requestCharge());
        Assertions.assertEquals("activity-1", page.activityId());
        Assertions.assertEquals(new ContinuationState("page-2", "2"), page.state());
        Assertions.assertTrue(page.hasMoreResults());
    }

    @Test
    void metricsHeaderIsOnlyRequestedWhenAskedFor()
    {
        cluster.backend.pages("1", page("a"));
        QueryPage page = queryPage(FeedRange.ofPartitionKeyRange("1"), null);
        Assertions.assertFalse(cluster.transport.last().request.headers().contains(HttpHeaders.POPULATE_QUERY_METRICS));
        Assertions.assertEquals(Integer.toString(QueryRequestOptions.DEFAULT_MAX_ITEM_COUNT), cluster.transport.last().request.headers().get(HttpHeaders.PAGE_SIZE));
        Assertions.assertNull(page.state());
        Assertions.assertFalse(page.hasMoreResults());
    }

    @Test
    void logicalFeedRangeIsSentAsPartitionKeyHeader()
    {
        PartitionKey customer = PartitionKey.of("c-42");
        cluster.backend.pages(customer, page("o-1", "o-2"));
        QueryPage page = queryPage(FeedRange.ofPartitionKey(customer), null);

        RequestMessage request = cluster.transport.last().request;
        Assertions.assertNull(request.partitionKeyRangeId());
        Assertions.assertEquals("[\"c-42\"]", request.headers().get(HttpHeaders.PARTITION_KEY));
        assertThat(page.documents()).containsExactly(MockBackend.doc("o-1"), MockBackend.doc("o-2"));
    }

    @Test
    void partitionKeyOptionIsSentWithoutFeedRange()
    {
        QueryRequestOptions options = QueryRequestOptions.builder().partitionKey(PartitionKey.of("c-42")).build();
        AsyncChains.getUnchecked(query(null, options, null, Trace.NO_OP));
        RequestMessage request = cluster.transport.last().request;
        Assertions.assertEquals("[\"c-42\"]", request.headers().get(HttpHeaders.PARTITION_KEY));
        Assertions.assertNull(request.partitionKeyRangeId());
    }

    @Test
    void epkSubRangeIsPinnedToItsPartitionWithBounds()
    {
        queryPage(FeedRange.ofRange(EpkRange.of("B5", "C")), null);
        RequestMessage request = cluster.transport.last().request;
        Assertions.assertEquals("2", request.partitionKeyRangeId());
        Assertions.assertEquals("B5", request.headers().get(HttpHeaders.START_EPK));
        Assertions.assertEquals("C", request.headers().get(HttpHeaders.END_EPK));
    }

    @Test
    void epkRangeOfAWholePartitionNeedsNoBounds()
    {
        queryPage(FeedRange.ofRange(MIDDLE.toRange()), null);
        RequestMessage request = cluster.transport.last().request;
        Assertions.assertEquals("2", request.partitionKeyRangeId());
        Assertions.assertFalse(request.headers().contains(HttpHeaders.START_EPK));
        Assertions.assertFalse(request.headers().contains(HttpHeaders.END_EPK));
    }

    @Test
    void epkRangeSpanningPartitionsIsGone()
    {
        assertThatThrownBy(() -> queryPage(FeedRange.ofRange(EpkRange.of("A", "C")), null))
            .isInstanceOfSatisfying(PartitionKeyRangeGoneException.class,
                                    e -> Assertions.assertEquals(StatusCodes.SUBSTATUS_PARTITION_KEY_RANGE_GONE, e.subStatusCode()));
        assertThat(cluster.transport.sent()).isEmpty();
    }

    @Test
    void failedResponsesBecomeTypedExceptions()
    {
        cluster.backend.failQueriesWith(StatusCodes.TOO_MANY_REQUESTS, 3200, "Request rate is large");
        assertThatThrownBy(() -> queryPage(FeedRange.ofPartitionKeyRange("1"), null))
            .isExactlyInstanceOf(DocumentClientException.class)
            .satisfies(e -> {
                DocumentClientException failure = (DocumentClientException) e;
                Assertions.assertEquals(StatusCodes.TOO_MANY_REQUESTS, failure.statusCode());
                Assertions.assertEquals(3200, failure.subStatusCode());
                Assertions.assertEquals("failed-activity", failure.activityId());
                Assertions.assertEquals(1.0, failure.requestCharge());
                Assertions.assertTrue(failure.isRetryable());
            })
            .hasMessage("Request rate is large");

        cluster.backend.failQueriesWith(StatusCodes.GONE, StatusCodes.SUBSTATUS_COMPLETING_SPLIT, "Completing split");
        assertThatThrownBy(() -> queryPage(FeedRange.ofPartitionKeyRange("1"), null))
            .isInstanceOf(PartitionKeyRangeGoneException.class);
    }

    @Test
    void transportFailureMarksTheEndpointUnavailableForReads()
    {
        cluster.backend.failNextQueries(1);
        assertThatThrownBy(() -> queryPage(FeedRange.ofPartitionKeyRange("1"), null)).isInstanceOf(TransportFailure.class);
        Assertions.assertEquals("West", cluster.transport.last().endpoint.region());

        queryPage(FeedRange.ofPartitionKeyRange("1"), null);
        Assertions.assertEquals("East", cluster.transport.last().endpoint.region());
    }

    @Test
    void queryMetricsAreRecordedOnTheTrace()
    {
        cluster.backend.extraHeaders(Headers.builder()
                                            .put(HttpHeaders.QUERY_METRICS, "totalExecutionTimeInMs=1.5;retrievedDocumentCount=3;outputDocumentCount=2")
                                            .build());
        RecordingTrace trace = new RecordingTrace();
        AsyncChains.getUnchecked(query(FeedRange.ofPartitionKeyRange("1"), QueryRequestOptions.DEFAULT, null, trace));

        assertThat(trace.children).contains("Execute Item Query", "Get Query Page");
        @SuppressWarnings("unchecked")
        Supplier<QueryMetrics> metrics = (Supplier<QueryMetrics>) trace.datum("Query Metrics");
        Assertions.assertNotNull(metrics);
        Assertions.assertEquals(1.5, metrics.get().totalExecutionTimeMs());
        Assertions.assertEquals(3, metrics.get().retrievedDocumentCount());
        Assertions.assertEquals(2, metrics.get().outputDocumentCount());
    }

    @Test
    void incompleteRoutingMapIsStaleAndDropsTheNameResolution()
    {
        cluster.metadata.ranges(ORDERS_RID, LOW, HIGH);
        ContainerQueryProperties container = AsyncChains.getUnchecked(cluster.client.getCachedContainerQueryProperties(ORDERS_LINK, null, Trace.NO_OP, Cancellation.NONE));
        Assertions.assertEquals(1, cluster.metadata.collectionFetches(ORDERS_LINK));

        assertThatThrownBy(() -> AsyncChains.getUnchecked(cluster.client.getTargetPartitionKeyRanges(ORDERS_LINK, container.resourceId(), ImmutableList.of(EpkRange.FULL),
                                                                                                     false, Trace.NO_OP, Cancellation.NONE)))
            .isInstanceOf(StaleRoutingCacheException.class)
            .hasMessageContaining("GetTargetPartitionKeyRanges(collectionResourceId:" + ORDERS_RID)
            .hasMessageContaining("failed due to stale cache");

        AsyncChains.getUnchecked(cluster.client.getCachedContainerQueryProperties(ORDERS_LINK, null, Trace.NO_OP, Cancellation.NONE));
        Assertions.assertEquals(2, cluster.metadata.collectionFetches(ORDERS_LINK));
    }

    @Test
    void containerPropertiesCarryPartitionKeyRanges()
    {
        ContainerQueryProperties all = AsyncChains.getUnchecked(cluster.client.getCachedContainerQueryProperties(ORDERS_LINK, null, Trace.NO_OP, Cancellation.NONE));
        Assertions.assertEquals(ORDERS_RID, all.resourceId());
        Assertions.assertNull(all.effectiveRangesForPartitionKey());
        Assertions.assertFalse(all.hasLogicalPartitionKey());

        PartitionKey customer = PartitionKey.of("c-42");
        ContainerQueryProperties scoped = AsyncChains.getUnchecked(cluster.client.getCachedContainerQueryProperties(ORDERS_LINK, customer, Trace.NO_OP, Cancellation.NONE));
        assertThat(scoped.effectiveRangesForPartitionKey()).containsExactly(ORDERS_KEY.effectivePartitionKeyRange(customer));
        Assertions.assertTrue(scoped.hasLogicalPartitionKey());

        ContainerQueryProperties none = AsyncChains.getUnchecked(cluster.client.getCachedContainerQueryProperties(ORDERS_LINK, PartitionKey.NONE, Trace.NO_OP, Cancellation.NONE));
        assertThat(none.effectiveRangesForPartitionKey()).containsExactly(ORDERS_KEY.effectivePartitionKeyRange(ORDERS_KEY.noneValue()));
    }

    @Test
    void feedRangesResolveToPartitions()
    {
        List<PartitionKeyRange> physical = AsyncChains.getUnchecked(cluster.client.getTargetPartitionKeyRangeByFeedRange(ORDERS_LINK, ORDERS_RID, ORDERS_KEY, FeedRange.ofPartitionKeyRange("2"),
                                                                                                                        false, Trace.NO_OP, Cancellation.NONE));
        assertThat(physical).containsExactly(MIDDLE);

        List<PartitionKeyRange> epk = AsyncChains.getUnchecked(cluster.client.getTargetPartitionKeyRangeByFeedRange(ORDERS_LINK, ORDERS_RID, ORDERS_KEY, FeedRange.ofRange(EpkRange.of("C", "E")),
                                                                                                                   false, Trace.NO_OP, Cancellation.NONE));
        assertThat(epk).containsExactly(MIDDLE, HIGH);

        List<PartitionKeyRange> logical = AsyncChains.getUnchecked(cluster.client.getTargetPartitionKeyRangeByFeedRange(ORDERS_LINK, ORDERS_RID, ORDERS_KEY, FeedRange.ofPartitionKey(PartitionKey.of("c-42")),
                                                                                                                       false, Trace.NO_OP, Cancellation.NONE));
        assertThat(logical).hasSize(1);

        assertThatThrownBy(() -> AsyncChains.getUnchecked(cluster.client.getTargetPartitionKeyRangeByFeedRange(ORDERS_LINK, ORDERS_RID, ORDERS_KEY, FeedRange.ofPartitionKeyRange("9"),
                                                                                                               false, Trace.NO_OP, Cancellation.NONE)))
            .isInstanceOf(StaleRoutingCacheException.class);
    }

    @Test
    void localPlanningNeedsAGenerator()
    {
        Assertions.assertFalse(cluster.client.hasLocalQueryPlanGenerator());
        assertThatThrownBy(() -> AsyncChains.getUnchecked(cluster.client.tryGetPartitionedQueryExecutionInfo(QUERY, ResourceType.DOCUMENT, ORDERS_KEY, null, null, Cancellation.NONE)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void forcedCollectionRefreshClearsSessionTokens()
    {
        List<String> cleared = new ArrayList<>();
        MockCluster withSessions = new MockCluster(ClientConfig.DEFAULT, null, cleared::add);
        AsyncChains.getUnchecked(withSessions.client.getCachedContainerQueryProperties(ORDERS_LINK, null, Trace.NO_OP, Cancellation.NONE));
        AsyncChains.getUnchecked(withSessions.client.forceRefreshCollectionCache(ORDERS_LINK, Cancellation.NONE));

        assertThat(cleared).containsExactly(ORDERS_LINK);
        Assertions.assertEquals(2, withSessions.metadata.collectionFetches(ORDERS_LINK));
    }

    @Test
    void cancelledCallerSendsNothing()
    {
        Cancellation cancellation = Cancellation.create();
        cancellation.cancel();
        assertThatThrownBy(() -> cluster.client.executeItemQuery(ORDERS_LINK, ResourceType.DOCUMENT, OperationType.QUERY, FeedRange.ofPartitionKeyRange("1"),
                                                                 QueryRequestOptions.DEFAULT, new AdditionalRequestHeaders(ACTIVITY, true, false), QUERY,
                                                                 null, 10, Trace.NO_OP, cancellation))
            .isInstanceOf(CancellationException.class);
        assertThat(cluster.transport.sent()).isEmpty();
    }
}
