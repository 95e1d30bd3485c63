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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import docroute.api.ClientConfig;
import docroute.api.QueryPlanGenerator;
import docroute.api.Trace;
import docroute.coordinate.BadRequestException;
import docroute.coordinate.StatusCodes;
import docroute.impl.mock.MockCluster;
import docroute.impl.mock.RecordingTrace;
import docroute.messages.Headers;
import docroute.messages.HttpHeaders;
import docroute.messages.ResponseMessage;
import docroute.primitives.EpkRange;
import docroute.primitives.GeospatialType;
import docroute.primitives.OperationType;
import docroute.primitives.PartitionKey;
import docroute.primitives.PartitionKeyDefinition;
import docroute.primitives.ResourceType;
import docroute.query.ContainerQueryProperties;
import docroute.query.SqlQuerySpec;
import docroute.utils.async.AsyncChains;
import docroute.utils.async.Cancellation;

import static docroute.impl.mock.MockCluster.ORDERS_LINK;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryPlanRetrieverTest
{
    private static final SqlQuerySpec QUERY = new SqlQuerySpec("SELECT TOP 10 * FROM c ORDER BY c.placedAt DESC");
    private static final UUID ACTIVITY = UUID.fromString("0b6c0c5e-7d5e-4c5a-8d36-7f5d8f3e9b21");
    private static final PartitionedQueryExecutionInfo LOCAL_PLAN = new PartitionedQueryExecutionInfo(QueryInfo.builder().top(10).build(),
                                                                                                       ImmutableList.of(EpkRange.FULL));

    static class RecordingGenerator implements QueryPlanGenerator
    {
        final List<String> querySpecs = new ArrayList<>();
        final List<Options> options = new ArrayList<>();

        @Override
        public PartitionedQueryExecutionInfo generate(String querySpecJson, PartitionKeyDefinition partitionKeyDefinition,
                                                      JsonObject vectorEmbeddingPolicy, Options options)
        {
            querySpecs.add(querySpecJson);
            this.options.add(options);
            return LOCAL_PLAN;
        }
    }

    private static ClientConfig config(boolean bypassQueryParsing, boolean hybridSearchOptimizationDisabled)
    {
        return new ClientConfig()
        {
            @Override
            public boolean bypassQueryParsing()
            {
                return bypassQueryParsing;
            }

            @Override
            public boolean hybridSearchQueryPlanOptimizationDisabled()
            {
                return hybridSearchOptimizationDisabled;
            }
        };
    }

    private static PartitionedQueryExecutionInfo plan(MockCluster cluster, PartitionKey partitionKey, Trace trace)
    {
        ContainerQueryProperties container = AsyncChains.getUnchecked(cluster.client.getCachedContainerQueryProperties(ORDERS_LINK, partitionKey, Trace.NO_OP, Cancellation.NONE));
        return AsyncChains.getUnchecked(QueryPlanRetriever.getQueryPlan(cluster.client, QUERY, ORDERS_LINK, ResourceType.DOCUMENT, container,
                                                                        partitionKey, ACTIVITY, trace, Cancellation.NONE));
    }

    @Test
    void plansLocallyWhenAGeneratorIsAvailable()
    {
        RecordingGenerator generator = new RecordingGenerator();
        MockCluster cluster = new MockCluster(config(false, false), generator);

        Assertions.assertSame(LOCAL_PLAN, plan(cluster, PartitionKey.of("c-42"), Trace.NO_OP));
        assertThat(cluster.transport.sent()).isEmpty();

        JsonObject spec = JsonParser.parseString(generator.querySpecs.get(0)).getAsJsonObject();
        Assertions.assertEquals(QUERY.queryText(), spec.get("query").getAsString());

        QueryPlanGenerator.Options options = generator.options.get(0);
        Assertions.assertTrue(options.requireFormattableOrderByQuery);
        Assertions.assertFalse(options.isContinuationExpected);
        Assertions.assertTrue(options.allowNonValueAggregateQuery);
        Assertions.assertTrue(options.hasLogicalPartitionKey);
        Assertions.assertTrue(options.allowDCount);
        Assertions.assertFalse(options.useSystemPrefix);
        Assertions.assertTrue(options.hybridSearchSkipOrderByRewrite);
        Assertions.assertEquals(GeospatialType.GEOGRAPHY, options.geospatialType);
    }

    @Test
    void localPlanningHonoursHybridSearchSetting()
    {
        RecordingGenerator generator = new RecordingGenerator();
        plan(new MockCluster(config(false, true), generator), null, Trace.NO_OP);
        Assertions.assertFalse(generator.options.get(0).hybridSearchSkipOrderByRewrite);
        Assertions.assertFalse(generator.options.get(0).hasLogicalPartitionKey);
    }

    @Test
    void rejectedQueryIsABadRequest()
    {
        QueryPlanGenerator rejecting = (querySpecJson, definition, vectorEmbeddingPolicy, options) -> {
            throw new IllegalArgumentException("Syntax error, incorrect syntax near 'FORM'");
        };
        MockCluster cluster = new MockCluster(config(false, false), rejecting);
        assertThatThrownBy(() -> plan(cluster, null, Trace.NO_OP))
            .isInstanceOf(BadRequestException.class)
            .hasMessageContaining("incorrect syntax");
    }

    @Test
    void bypassingQueryParsingUsesTheGateway()
    {
        RecordingGenerator generator = new RecordingGenerator();
        MockCluster cluster = new MockCluster(config(true, false), generator);
        plan(cluster, PartitionKey.of("c-42"), Trace.NO_OP);

        assertThat(generator.querySpecs).isEmpty();
        assertThat(cluster.transport.sent(OperationType.QUERY_PLAN)).hasSize(1);
        Headers headers = cluster.transport.last().request.headers();
        Assertions.assertEquals("[\"c-42\"]", headers.get(HttpHeaders.PARTITION_KEY));
        Assertions.assertEquals(ACTIVITY.toString(), headers.get(HttpHeaders.CORRELATED_ACTIVITY_ID));
        Assertions.assertEquals(HttpHeaders.QUERY_JSON, headers.get(HttpHeaders.CONTENT_TYPE));
    }

    @Test
    void bypassPropertyForcesTheGateway()
    {
        RecordingGenerator generator = new RecordingGenerator();
        MockCluster cluster = new MockCluster(config(false, false), generator);
        System.setProperty(ClientConfig.FORCE_BYPASS_QUERY_PARSING_PROPERTY, "true");
        try
        {
            Assertions.assertTrue(cluster.client.bypassQueryParsing());
            plan(cluster, null, Trace.NO_OP);
        }
        finally
        {
            System.clearProperty(ClientConfig.FORCE_BYPASS_QUERY_PARSING_PROPERTY);
        }
        assertThat(generator.querySpecs).isEmpty();
        assertThat(cluster.transport.sent(OperationType.QUERY_PLAN)).hasSize(1);
        Assertions.assertFalse(cluster.client.bypassQueryParsing());
    }

    @Test
    void gatewayIsToldWhichFeaturesAreSupported()
    {
        MockCluster cluster = new MockCluster(config(false, true), null);
        RecordingTrace trace = new RecordingTrace();
        PartitionedQueryExecutionInfo plan = plan(cluster, null, trace);

        assertThat(plan.queryRanges()).containsExactly(EpkRange.FULL);
        Headers headers = cluster.transport.last().request.headers();
        Assertions.assertEquals(QueryFeatures.supportedQueryFeatures(true), headers.get(HttpHeaders.SUPPORTED_QUERY_FEATURES));
        Assertions.assertFalse(headers.contains(HttpHeaders.PARTITION_KEY));
        Assertions.assertEquals(Boolean.TRUE, trace.datum("ServiceInterop unavailable"));
        assertThat(trace.children).contains("Gateway QueryPlan");
    }

    @Test
    void gatewayRejectionIsTyped()
    {
        MockCluster cluster = new MockCluster();
        cluster.transport.handler((endpoint, request) -> new ResponseMessage(StatusCodes.BAD_REQUEST, Headers.EMPTY,
                                                                             "Query contains an unsupported feature".getBytes(StandardCharsets.UTF_8)));
        assertThatThrownBy(() -> plan(cluster, null, Trace.NO_OP)).isInstanceOf(BadRequestException.class)
                                                                  .hasMessage("Query contains an unsupported feature");
    }
}
