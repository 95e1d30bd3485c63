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

package docroute.impl.mock;

import java.net.URI;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import docroute.api.ClientConfig;
import docroute.api.QueryPlanGenerator;
import docroute.api.Scheduler;
import docroute.api.SessionContainer;
import docroute.endpoint.AccountTopology;
import docroute.endpoint.AccountTopology.Region;
import docroute.endpoint.GlobalEndpointManager;
import docroute.impl.GsonQuerySerializer;
import docroute.primitives.PartitionKeyDefinition;
import docroute.primitives.PartitionKeyRange;
import docroute.query.QueryClient;
import docroute.routing.CollectionCache;
import docroute.routing.CollectionProperties;
import docroute.routing.PartitionKeyRangeCache;

/**
 * A two region account with one collection, {@value #ORDERS_LINK}, split into three partitions, wired to a
 * {@link QueryClient} through in-memory metadata, transport and backend
 */
public class MockCluster
{
    public static final URI GLOBAL = URI.create("https://shop.example.com/");
    public static final Region WEST = Region.of("West", "https://shop-west.example.com/");
    public static final Region EAST = Region.of("East", "https://shop-east.example.com/");

    public static final String ORDERS_LINK = "dbs/shop/colls/orders";
    public static final String ORDERS_RID = "ty4BAP2Y1yE=";
    public static final PartitionKeyDefinition ORDERS_KEY = PartitionKeyDefinition.hash("/customerId");

    public static final PartitionKeyRange LOW = new PartitionKeyRange("1", "", "B");
    public static final PartitionKeyRange MIDDLE = new PartitionKeyRange("2", "B", "D");
    public static final PartitionKeyRange HIGH = new PartitionKeyRange("3", "D", "FF");

    public final MockRoutingMetadataSource metadata = new MockRoutingMetadataSource();
    public final MockBackend backend = new MockBackend();
    public final MockTransport transport = new MockTransport(backend);
    public final GlobalEndpointManager endpointManager;
    public final CollectionCache collectionCache;
    public final PartitionKeyRangeCache partitionKeyRangeCache;
    public final QueryClient client;

    public MockCluster()
    {
        this(ClientConfig.DEFAULT, null);
    }

    public MockCluster(ClientConfig config, @Nullable QueryPlanGenerator planGenerator)
    {
        this(config, planGenerator, SessionContainer.NONE);
    }

    public MockCluster(ClientConfig config, @Nullable QueryPlanGenerator planGenerator, SessionContainer sessionContainer)
    {
        AccountTopology topology = new AccountTopology(ImmutableList.of(WEST), ImmutableList.of(WEST, EAST), false);
        endpointManager = new GlobalEndpointManager(GLOBAL, config, new MockAccountMetadataSource(topology), Scheduler.NEVER_RUN_SCHEDULED);
        endpointManager.initializeAccountPropertiesAndStartBackgroundRefresh(topology);

        metadata.collection(new CollectionProperties(ORDERS_RID, ORDERS_LINK, ORDERS_KEY))
                .ranges(ORDERS_RID, LOW, MIDDLE, HIGH);
        collectionCache = new CollectionCache(metadata);
        partitionKeyRangeCache = new PartitionKeyRangeCache(metadata);
        client = new QueryClient(config, endpointManager, collectionCache, partitionKeyRangeCache, transport,
                                 GsonQuerySerializer.INSTANCE, planGenerator, sessionContainer);
    }
}
