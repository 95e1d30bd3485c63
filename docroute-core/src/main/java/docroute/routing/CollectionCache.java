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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import docroute.api.RoutingMetadataSource;
import docroute.api.Trace;
import docroute.primitives.ResourceLinks;
import docroute.utils.Invariants;
import docroute.utils.async.AsyncChain;
import docroute.utils.async.Cancellation;

/**
 * Resolves collection links to their properties. Name based links may be re-pointed at a different collection by a
 * delete and re-create, so callers that find a resolved resource id to be stale {@link #refresh(String)} the link.
 * An unknown collection surfaces as {@link docroute.coordinate.NotFoundException}.
 */
public class CollectionCache
{
    private static final Logger logger = LoggerFactory.getLogger(CollectionCache.class);

    private final RoutingMetadataSource metadataSource;
    private final AsyncCache<String, CollectionProperties> byLink = new AsyncCache<>();

    public CollectionCache(RoutingMetadataSource metadataSource)
    {
        this.metadataSource = Invariants.nonNull(metadataSource, "metadataSource");
    }

    public AsyncChain<CollectionProperties> resolveByLink(String link, Trace trace, Cancellation cancellation)
    {
        return resolveByLink(link, false, trace, cancellation);
    }

    public AsyncChain<CollectionProperties> resolveByLink(String link, boolean forceRefresh, Trace trace, Cancellation cancellation)
    {
        Invariants.nonEmpty(link, "link");
        String collectionLink = ResourceLinks.collectionLink(link);
        Trace child = trace.startChild("Resolve Collection", Trace.Component.ROUTING, Trace.Level.INFO);
        child.addDatum("link", collectionLink);
        CollectionProperties obsolete = forceRefresh ? byLink.peek(collectionLink) : null;
        return byLink.getAsync(collectionLink, obsolete, forceRefresh, this::fetch, cancellation)
                     .addCallback((success, failure) -> child.close());
    }

    /**
     * Drops the cached resolution of the collection the link names; the next resolution fetches again
     */
    public void refresh(String link)
    {
        Invariants.nonEmpty(link, "link");
        String collectionLink = ResourceLinks.collectionLink(link);
        logger.debug("Invalidating cached collection {}", collectionLink);
        byLink.remove(collectionLink);
    }

    private AsyncChain<CollectionProperties> fetch(String collectionLink)
    {
        logger.debug("Fetching collection {}", collectionLink);
        return metadataSource.fetchCollection(collectionLink);
    }
}
