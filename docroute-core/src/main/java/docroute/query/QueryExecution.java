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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import docroute.api.Trace;
import docroute.coordinate.PartitionKeyRangeGoneException;
import docroute.coordinate.StaleRoutingCacheException;
import docroute.coordinate.TransportFailure;
import docroute.primitives.EpkRange;
import docroute.primitives.FeedRange;
import docroute.primitives.OperationType;
import docroute.primitives.PartitionKeyRange;
import docroute.primitives.ResourceType;
import docroute.query.plan.PartitionedQueryExecutionInfo;
import docroute.query.plan.QueryPlanRetriever;
import docroute.utils.Invariants;
import docroute.utils.async.AsyncChain;
import docroute.utils.async.AsyncChains;
import docroute.utils.async.Cancellation;

/**
 * Drives one logical query: obtains its plan, resolves the partitions it touches, then reads each partition's pages
 * in key order by chaining continuation tokens. Pages are returned as the backend produced them; merging across
 * partitions is left to the operators consuming them.
 *
 * At most one page request may be outstanding. A partition that was split or merged away while being read is
 * replaced by its successors, which resume from the same continuation token. A stale routing cache during partition
 * resolution is retried once with a forced refresh. Any other failure is terminal: it is reported to the request that
 * observed it and every later request is refused, while pages already returned stand.
 */
public class QueryExecution
{
    private static final Logger logger = LoggerFactory.getLogger(QueryExecution.class);

    public enum Phase { PLAN_PENDING, PLAN_READY, PARTITIONS_RESOLVED, PAGE_REQUESTED, PAGE_READY, EXHAUSTED, FAILED }

    static final class Cursor
    {
        final PartitionKeyRange range;
        @Nullable String continuation;

        Cursor(PartitionKeyRange range, @Nullable String continuation)
        {
            this.range = range;
            this.continuation = continuation;
        }

        @Override
        public String toString()
        {
            return range.id() + (continuation == null ? "" : "@" + continuation);
        }
    }

    private final QueryClient client;
    private final String resourceLink;
    private final SqlQuerySpec querySpec;
    private final QueryRequestOptions options;
    private final UUID correlatedActivityId;
    private final Trace trace;

    private final AtomicBoolean requesting = new AtomicBoolean();
    private volatile Phase phase = Phase.PLAN_PENDING;
    // the phase to return to if an in-flight request is cancelled
    private Phase settled = Phase.PLAN_PENDING;
    private volatile Throwable failure;

    private ContainerQueryProperties container;
    private PartitionedQueryExecutionInfo plan;
    private List<EpkRange> targetRanges;
    private final Deque<Cursor> cursors = new ArrayDeque<>();

    public QueryExecution(QueryClient client, String resourceLink, SqlQuerySpec querySpec, QueryRequestOptions options, Trace trace)
    {
        this.client = Invariants.nonNull(client, "client");
        this.resourceLink = Invariants.nonEmpty(resourceLink, "resourceLink");
        this.querySpec = Invariants.nonNull(querySpec, "querySpec");
        this.options = Invariants.nonNull(options, "options");
        this.trace = Invariants.nonNull(trace, "trace");
        this.correlatedActivityId = UUID.randomUUID();
    }

    public Phase phase()
    {
        return phase;
    }

    public boolean hasMoreResults()
    {
        Phase current = phase;
        return current != Phase.EXHAUSTED && current != Phase.FAILED;
    }

    public @Nullable PartitionedQueryExecutionInfo queryPlan()
    {
        return plan;
    }

    public UUID correlatedActivityId()
    {
        return correlatedActivityId;
    }

    /**
     * Fetches the next page. Fails with {@link IllegalStateException} if a page is already being fetched, the query
     * is exhausted, or an earlier request failed.
     */
    public AsyncChain<QueryPage> nextPage(Cancellation cancellation)
    {
        return AsyncChains.defer(() -> {
            cancellation.throwIfCancelled();
            switch (phase)
            {
                case EXHAUSTED: throw Invariants.illegalState("Query %s has no more results", querySpec);
                case FAILED: throw new IllegalStateException("Query " + querySpec + " has already failed", failure);
            }
            if (!requesting.compareAndSet(false, true))
                throw Invariants.illegalState("A page of query %s is already being fetched", querySpec);

            return AsyncChains.defer(() -> prepare(cancellation)).flatMap(ignore -> {
                phase = Phase.PAGE_REQUESTED;
                return fetch(cancellation, true, true);
            }).addCallback(this::onPage);
        });
    }

    private void onPage(QueryPage page, Throwable fail)
    {
        if (fail == null)
        {
            settled = phase = cursors.isEmpty() ? Phase.EXHAUSTED : Phase.PAGE_READY;
        }
        else if (fail instanceof CancellationException)
        {
            phase = settled;
        }
        else
        {
            logger.debug("Query {} failed", querySpec, fail);
            failure = fail;
            settled = phase = Phase.FAILED;
        }
        requesting.set(false);
    }

    private AsyncChain<Void> prepare(Cancellation cancellation)
    {
        switch (phase)
        {
            case PLAN_PENDING:
                return client.getCachedContainerQueryProperties(resourceLink, options.partitionKey(), trace, cancellation)
                             .flatMap(properties -> {
                                 container = properties;
                                 return QueryPlanRetriever.getQueryPlan(client, querySpec, resourceLink, ResourceType.DOCUMENT, properties,
                                                                        options.partitionKey(), correlatedActivityId, trace, cancellation);
                             })
                             .flatMap(queryPlan -> {
                                 plan = queryPlan;
                                 settled = phase = Phase.PLAN_READY;
                                 return resolvePartitions(cancellation);
                             });
            case PLAN_READY:
                return resolvePartitions(cancellation);
            default:
                return AsyncChains.success(null);
        }
    }

    private AsyncChain<Void> resolvePartitions(Cancellation cancellation)
    {
        if (container.effectiveRangesForPartitionKey() != null) targetRanges = container.effectiveRangesForPartitionKey();
        else if (!plan.queryRanges().isEmpty()) targetRanges = plan.queryRanges();
        else targetRanges = ImmutableList.of(EpkRange.FULL);

        return targets(false, cancellation)
               .recover(fail -> {
                   if (!(fail instanceof StaleRoutingCacheException))
                       return null;
                   logger.debug("Routing cache for {} was stale; retrying with a forced refresh", resourceLink);
                   return targets(true, cancellation);
               })
               .map(ranges -> {
                   for (PartitionKeyRange range : ranges)
                       cursors.addLast(new Cursor(range, null));
                   settled = phase = Phase.PARTITIONS_RESOLVED;
                   return null;
               });
    }

    private AsyncChain<List<PartitionKeyRange>> targets(boolean forceRefresh, Cancellation cancellation)
    {
        return client.getTargetPartitionKeyRanges(resourceLink, container.resourceId(), targetRanges, forceRefresh, trace, cancellation);
    }

    private AsyncChain<QueryPage> fetch(Cancellation cancellation, boolean mayReplaceGone, boolean mayRetryTransport)
    {
        Cursor cursor = cursors.peekFirst();
        Invariants.checkState(cursor != null, "No partition left to read");

        FeedRange feedRange = options.partitionKey() != null ? FeedRange.ofPartitionKey(options.partitionKey())
                                                             : FeedRange.ofPartitionKeyRange(cursor.range.id());
        AdditionalRequestHeaders headers = new AdditionalRequestHeaders(correlatedActivityId, true,
                                                                        options.enableOptimisticDirectExecution() && !client.getClientDisableOptimisticDirectExecution());
        SqlQuerySpec backendQuery = plan.queryInfo().hasRewrittenQuery() ? new SqlQuerySpec(plan.queryInfo().rewrittenQuery(), querySpec.parameters())
                                                                         : querySpec;

        return client.executeItemQuery(resourceLink, ResourceType.DOCUMENT, OperationType.QUERY, feedRange, options, headers,
                                       backendQuery, cursor.continuation, options.maxItemCount(), trace, cancellation)
                     .map(page -> {
                         if (page.state() == null) cursors.removeFirst();
                         else cursor.continuation = page.state().token();
                         return page;
                     })
                     .recover(fail -> {
                         if (fail instanceof PartitionKeyRangeGoneException && mayReplaceGone)
                             return replaceGone(cursor, cancellation).flatMap(ignore -> fetch(cancellation, false, mayRetryTransport));
                         if (fail instanceof TransportFailure && mayRetryTransport)
                         {
                             logger.debug("Retrying page of {} after transport failure at {}", cursor, ((TransportFailure) fail).endpoint());
                             return fetch(cancellation, mayReplaceGone, false);
                         }
                         return null;
                     });
    }

    // swaps a split or merged partition for the current partitions covering its range, each resuming where it stopped
    private AsyncChain<Void> replaceGone(Cursor gone, Cancellation cancellation)
    {
        logger.debug("Partition {} of {} is gone; refreshing routing map", gone.range, resourceLink);
        return client.getTargetPartitionKeyRanges(resourceLink, container.resourceId(), ImmutableList.of(gone.range.toRange()), true, trace, cancellation)
                     .map(successors -> {
                         List<Cursor> replacements = new ArrayList<>(successors.size());
                         for (PartitionKeyRange successor : successors)
                         {
                             if (overlapsTarget(successor))
                                 replacements.add(new Cursor(successor, gone.continuation));
                         }
                         Invariants.checkState(cursors.peekFirst() == gone, "Cursor %s was replaced concurrently", gone);
                         cursors.removeFirst();
                         for (int i = replacements.size() - 1 ; i >= 0 ; i--)
                             cursors.addFirst(replacements.get(i));
                         logger.debug("Replaced partition {} with {}", gone.range.id(), replacements);
                         return null;
                     });
    }

    private boolean overlapsTarget(PartitionKeyRange range)
    {
        EpkRange epk = range.toRange();
        for (EpkRange target : targetRanges)
        {
            if (target.overlaps(epk))
                return true;
        }
        return false;
    }
}
