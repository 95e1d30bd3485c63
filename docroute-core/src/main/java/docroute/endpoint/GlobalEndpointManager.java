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

package docroute.endpoint;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import docroute.api.AccountMetadataSource;
import docroute.api.ClientConfig;
import docroute.api.Scheduler;
import docroute.endpoint.Endpoint.Role;
import docroute.messages.RequestMessage;
import docroute.primitives.OperationType;
import docroute.primitives.ResourceType;
import docroute.utils.Invariants;
import docroute.utils.ThreadPoolScheduler;
import docroute.utils.async.AsyncChain;
import docroute.utils.async.AsyncChains;
import docroute.utils.async.AsyncResult;
import docroute.utils.async.AsyncResults;
import docroute.utils.async.Cancellation;

/**
 * Decides which regional endpoint serves each request.
 *
 * The current {@link EndpointDirectory} is published through an atomic reference and replaced wholesale, both when
 * a new account topology arrives and when an endpoint is marked unavailable. Resolution never blocks and never
 * observes a partially applied refresh.
 *
 * Topology refreshes are coalesced: concurrent callers share the single in-flight fetch, and unforced refreshes
 * within {@link ClientConfig#minimumRefreshInterval()} of the last successful refresh are skipped. When endpoint
 * discovery is enabled a recurring background refresh keeps the directory current; its failures are logged and
 * the last known directory stays in place.
 */
public class GlobalEndpointManager implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(GlobalEndpointManager.class);
    private static final long NEVER = Long.MIN_VALUE;

    private final ClientConfig config;
    private final AccountMetadataSource metadataSource;
    private final Scheduler scheduler;
    private final @Nullable ThreadPoolScheduler ownedScheduler;
    private final LongSupplier nowMillis;
    private final long expiryMillis;

    private final AtomicReference<EndpointDirectory> directory;
    private final AtomicReference<AsyncResult<Void>> inflightRefresh = new AtomicReference<>();
    private volatile long lastRefreshMillis = NEVER;
    private volatile Scheduler.Scheduled backgroundRefresh;
    private volatile boolean closed;

    /**
     * Runs the background refresh on a scheduler thread of its own, stopped by {@link #close()}
     */
    public GlobalEndpointManager(URI defaultEndpoint, ClientConfig config, AccountMetadataSource metadataSource)
    {
        this(defaultEndpoint, config, metadataSource, new ThreadPoolScheduler("docroute-endpoint-refresh"), System::currentTimeMillis, true);
    }

    public GlobalEndpointManager(URI defaultEndpoint, ClientConfig config, AccountMetadataSource metadataSource, Scheduler scheduler)
    {
        this(defaultEndpoint, config, metadataSource, scheduler, System::currentTimeMillis);
    }

    public GlobalEndpointManager(URI defaultEndpoint, ClientConfig config, AccountMetadataSource metadataSource, Scheduler scheduler, LongSupplier nowMillis)
    {
        this(defaultEndpoint, config, metadataSource, scheduler, nowMillis, false);
    }

    private GlobalEndpointManager(URI defaultEndpoint, ClientConfig config, AccountMetadataSource metadataSource, Scheduler scheduler, LongSupplier nowMillis, boolean ownsScheduler)
    {
        this.config = Invariants.nonNull(config, "config");
        this.metadataSource = Invariants.nonNull(metadataSource, "metadataSource");
        this.scheduler = Invariants.nonNull(scheduler, "scheduler");
        this.ownedScheduler = ownsScheduler ? (ThreadPoolScheduler) scheduler : null;
        this.nowMillis = nowMillis;
        this.expiryMillis = config.unavailableEndpointExpiration().toMillis();
        this.directory = new AtomicReference<>(EndpointDirectory.initial(Invariants.nonNull(defaultEndpoint, "defaultEndpoint"), config.preferredRegions()));
    }

    public EndpointDirectory directory()
    {
        return directory.get();
    }

    public Endpoint resolveServiceEndpoint(RequestMessage request)
    {
        Invariants.nonNull(request, "request");
        EndpointDirectory current = directory.get();
        long now = nowMillis.getAsLong();

        boolean isWrite = request.operationType().isWriteOperation();
        if (request.useThinClient())
        {
            List<Endpoint> thinClient = isWrite ? current.thinClientWriteEndpoints : current.thinClientReadEndpoints;
            if (!thinClient.isEmpty())
            {
                // thin client writes follow the same single/multi write region rule as regular writes
                String hint = !isWrite || canUseMultipleWriteLocations(request) ? request.regionHint() : null;
                return current.select(thinClient, isWrite ? Role.THIN_CLIENT_WRITE : Role.THIN_CLIENT_READ, hint, now, expiryMillis);
            }
        }

        if (isWrite)
        {
            if (canUseMultipleWriteLocations(request))
                return current.select(current.writeEndpoints, Role.WRITE, request.regionHint(), now, expiryMillis);
            return current.select(current.accountWriteEndpoints, Role.WRITE, null, now, expiryMillis);
        }

        if (current.readEndpoints.isEmpty())
            return current.select(current.accountWriteEndpoints, Role.READ, request.regionHint(), now, expiryMillis);
        return current.select(current.readEndpoints, Role.READ, request.regionHint(), now, expiryMillis);
    }

    public void markEndpointUnavailableForRead(Endpoint endpoint)
    {
        markUnavailable(endpoint, Role.READ);
    }

    public void markEndpointUnavailableForWrite(Endpoint endpoint)
    {
        markUnavailable(endpoint, Role.WRITE);
    }

    private void markUnavailable(Endpoint endpoint, Role role)
    {
        Invariants.nonNull(endpoint, "endpoint");
        long now = nowMillis.getAsLong();
        directory.updateAndGet(current -> current.withUnavailable(endpoint, role, now, expiryMillis));
        logger.info("Marked endpoint {} unavailable for {}", endpoint, role);
    }

    public boolean canUseMultipleWriteLocations()
    {
        return config.useMultipleWriteLocations() && directory.get().topology.enableMultipleWriteLocations();
    }

    public boolean canUseMultipleWriteLocations(RequestMessage request)
    {
        return canSupportMultipleWriteLocations(request.resourceType(), request.operationType());
    }

    public boolean canSupportMultipleWriteLocations(ResourceType resourceType, OperationType operationType)
    {
        return canUseMultipleWriteLocations()
               && (resourceType == ResourceType.DOCUMENT
                   || (resourceType == ResourceType.STORED_PROCEDURE && operationType == OperationType.EXECUTE_JAVASCRIPT));
    }

    /**
     * Fetches the account topology and publishes a new directory. Concurrent callers share the in-flight fetch;
     * an unforced call made within the minimum refresh interval of the last refresh completes immediately.
     */
    public AsyncResult<Void> refreshLocation(boolean forceRefresh)
    {
        if (closed)
            return AsyncResults.success(null);

        long last = lastRefreshMillis;
        if (!forceRefresh && last != NEVER && nowMillis.getAsLong() - last < config.minimumRefreshInterval().toMillis())
        {
            logger.trace("Skipping endpoint refresh; last refresh was {}ms ago", nowMillis.getAsLong() - last);
            return AsyncResults.success(null);
        }

        while (true)
        {
            AsyncResult<Void> current = inflightRefresh.get();
            if (current != null && !current.isDone())
                return current;

            AsyncResult.Settable<Void> next = AsyncResults.settable();
            if (!inflightRefresh.compareAndSet(current, next))
                continue;

            logger.debug("Refreshing account topology (forced: {})", forceRefresh);
            AsyncChain<AccountTopology> fetch;
            try
            {
                fetch = metadataSource.fetchTopology();
            }
            catch (Throwable t)
            {
                next.tryFailure(t);
                return next;
            }
            fetch.begin((topology, failure) -> {
                if (failure != null)
                {
                    next.tryFailure(failure);
                    return;
                }
                try
                {
                    publish(topology);
                    next.trySuccess(null);
                }
                catch (Throwable t)
                {
                    next.tryFailure(t);
                }
            });
            return next;
        }
    }

    public AsyncChain<Void> refreshLocation(boolean forceRefresh, Cancellation cancellation)
    {
        cancellation.throwIfCancelled();
        return AsyncChains.withCancellation(refreshLocation(forceRefresh), cancellation);
    }

    /**
     * Publishes the directory for an already known topology and, when endpoint discovery is enabled,
     * starts the periodic refresh
     */
    public void initializeAccountPropertiesAndStartBackgroundRefresh(AccountTopology topology)
    {
        Invariants.nonNull(topology, "topology");
        publish(topology);

        if (!config.enableEndpointDiscovery() || closed)
            return;

        synchronized (this)
        {
            if (backgroundRefresh == null)
            {
                long interval = config.backgroundRefreshInterval().toMillis();
                backgroundRefresh = scheduler.recurring(this::backgroundRefresh, interval, TimeUnit.MILLISECONDS);
            }
        }
    }

    private void backgroundRefresh()
    {
        if (closed)
            return;

        refreshLocation(false).addCallback((success, failure) -> {
            if (failure != null)
                logger.warn("Background refresh of account topology failed; keeping {}", directory.get(), failure);
        });
    }

    private void publish(AccountTopology topology)
    {
        long now = nowMillis.getAsLong();
        EndpointDirectory published = directory.updateAndGet(current -> current.withTopology(topology, now, expiryMillis));
        lastRefreshMillis = now;
        logger.debug("Published {}", published);
    }

    public List<Endpoint> readEndpoints()
    {
        EndpointDirectory current = directory.get();
        return current.readEndpoints.isEmpty() ? current.accountWriteEndpoints : current.readEndpoints;
    }

    public List<Endpoint> accountReadEndpoints()
    {
        return directory.get().accountReadEndpoints;
    }

    public List<Endpoint> writeEndpoints()
    {
        return directory.get().writeEndpoints;
    }

    public List<Endpoint> thinClientReadEndpoints()
    {
        return directory.get().thinClientReadEndpoints;
    }

    public List<Endpoint> thinClientWriteEndpoints()
    {
        return directory.get().thinClientWriteEndpoints;
    }

    public int preferredLocationCount()
    {
        return config.preferredRegions().size();
    }

    public @Nullable String getLocation(URI endpoint)
    {
        return directory.get().regionOf(endpoint);
    }

    public Map<String, Endpoint> availableWriteEndpointsByLocation()
    {
        EndpointDirectory current = directory.get();
        return current.available(current.writeEndpointsByRegion, Role.WRITE, nowMillis.getAsLong(), expiryMillis);
    }

    public Map<String, Endpoint> availableReadEndpointsByLocation()
    {
        EndpointDirectory current = directory.get();
        return current.available(current.readEndpointsByRegion, Role.READ, nowMillis.getAsLong(), expiryMillis);
    }

    @Override
    public void close()
    {
        closed = true;
        Scheduler.Scheduled scheduled;
        synchronized (this)
        {
            scheduled = backgroundRefresh;
            backgroundRefresh = Scheduler.CANCELLED;
        }
        if (scheduled != null)
            scheduled.cancel();
        if (ownedScheduler != null)
            ownedScheduler.stop();
    }
}
