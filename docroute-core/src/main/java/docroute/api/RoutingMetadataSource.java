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

import java.util.List;

import docroute.primitives.PartitionKeyRange;
import docroute.routing.CollectionProperties;
import docroute.utils.async.AsyncChain;

/**
 * Supplies collection metadata and the partition key ranges currently serving a collection
 */
public interface RoutingMetadataSource
{
    /**
     * Fails with {@link docroute.coordinate.NotFoundException} if no collection exists at the link
     */
    AsyncChain<CollectionProperties> fetchCollection(String collectionLink);

    /**
     * Fails with {@link docroute.coordinate.NotFoundException} if the collection does not exist. The returned
     * set may be incomplete while a split or merge is in progress.
     */
    AsyncChain<List<PartitionKeyRange>> fetchPartitionKeyRanges(String collectionResourceId);
}
