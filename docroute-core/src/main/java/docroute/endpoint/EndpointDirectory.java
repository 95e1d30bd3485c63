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
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;

import docroute.endpoint.Endpoint.Role;

/**
 * Immutable snapshot of the account's endpoints, ordered by preference, together with the endpoints
 * recently marked unavailable. Every change produces a new directory; readers hold whichever snapshot
 * they loaded and never observe a partial update.
 */
public final class EndpointDirectory
{
    static final class Unavailability
    {
        final Set<Role> roles;
        final long lastMarkedMillis;

        Unavailability(Set<Role> roles, long lastMarkedMillis)
        {
            this.roles = Sets.immutableEnumSet(roles);
            this.lastMarkedMillis = lastMarkedMillis;
        }

        boolean isExpired(long nowMillis, long expiryMillis)
        {
            return nowMillis - lastMarkedMillis >= expiryMillis;
        }

        @Override
        public String toString()
        {
            return roles + "@" + lastMarkedMillis;
        }
    }

    final long version;
    final AccountTopology topology;
    final Endpoint defaultEndpoint;
    final List<String> preferredRegions;

    // preference order
    final List<Endpoint> writeEndpoints;
    final List<Endpoint> readEndpoints;
    final List<Endpoint> thinClientWriteEndpoints;
    final List<Endpoint> thinClientReadEndpoints;

    // account order
    final List<Endpoint> accountWriteEndpoints;
    final List<Endpoint> accountReadEndpoints;

    final Map<String, Endpoint> writeEndpointsByRegion;
    final Map<String, Endpoint> readEndpointsByRegion;
    final Map<URI, Unavailability> unavailable;

    private EndpointDirectory(long version, AccountTopology topology, Endpoint defaultEndpoint, List<String> preferredRegions,
                              Map<URI, Unavailability> unavailable)
    {
        this.version = version;
        this.topology = topology;
        this.defaultEndpoint = defaultEndpoint;
        this.preferredRegions = ImmutableList.copyOf(preferredRegions);
        this.unavailable = ImmutableMap.copyOf(unavailable);

        Map<String, Endpoint> regular = regionalEndpoints(topology.writableRegions(), topology.readableRegions(), Role.WRITE, Role.READ);
        this.accountWriteEndpoints = select(topology.writableRegions(), regular);
        this.accountReadEndpoints = select(topology.readableRegions(), regular);
        this.writeEndpoints = byPreference(accountWriteEndpoints, preferredRegions);
        this.readEndpoints = byPreference(accountReadEndpoints, preferredRegions);

        Map<String, Endpoint> thinClient = regionalEndpoints(topology.thinClientWritableRegions(), topology.thinClientReadableRegions(), Role.THIN_CLIENT_WRITE, Role.THIN_CLIENT_READ);
        this.thinClientWriteEndpoints = byPreference(select(topology.thinClientWritableRegions(), thinClient), preferredRegions);
        this.thinClientReadEndpoints = byPreference(select(topology.thinClientReadableRegions(), thinClient), preferredRegions);

        this.writeEndpointsByRegion = byRegion(writeEndpoints);
        this.readEndpointsByRegion = byRegion(readEndpoints);
    }

    /**
     * The directory used before any topology has been observed: every request resolves to the global endpoint
     */
    public static EndpointDirectory initial(URI defaultEndpoint, List<String> preferredRegions)
    {
        return new EndpointDirectory(0, AccountTopology.EMPTY, Endpoint.global(defaultEndpoint), preferredRegions, ImmutableMap.of());
    }

    /**
     * A new directory for {@code topology} that keeps this directory's unexpired unavailability marks
     */
    EndpointDirectory withTopology(AccountTopology topology, long nowMillis, long expiryMillis)
    {
        Map<URI, Unavailability> retained = new LinkedHashMap<>();
        for (Map.Entry<URI, Unavailability> e : unavailable.entrySet())
        {
            if (!e.getValue().isExpired(nowMillis, expiryMillis))
                retained.put(e.getKey(), e.getValue());
        }
        return new EndpointDirectory(version + 1, topology, defaultEndpoint, preferredRegions, retained);
    }

    EndpointDirectory withUnavailable(Endpoint endpoint, Role role, long nowMillis, long expiryMillis)
    {
        Set<Role> roles = EnumSet.of(role);
        Unavailability existing = unavailable.get(endpoint.uri());
        if (existing != null && !existing.isExpired(nowMillis, expiryMillis))
            roles.addAll(existing.roles);

        Map<URI, Unavailability> updated = new LinkedHashMap<>(unavailable);
        updated.put(endpoint.uri(), new Unavailability(roles, nowMillis));
        return new EndpointDirectory(version + 1, topology, defaultEndpoint, preferredRegions, updated);
    }

    boolean isUnavailable(Endpoint endpoint, Role role, long nowMillis, long expiryMillis)
    {
        Unavailability entry = unavailable.get(endpoint.uri());
        if (entry == null || entry.isExpired(nowMillis, expiryMillis))
            return false;
        // a thin client endpoint shares its availability with the regular role it serves
        return entry.roles.contains(role) || entry.roles.contains(regularRole(role));
    }

    /**
     * Picks an endpoint from {@code candidates} in order: the hinted region when it is available, then the first
     * available candidate. When every candidate is unavailable the most preferred one is returned regardless.
     */
    Endpoint select(List<Endpoint> candidates, Role role, @Nullable String regionHint, long nowMillis, long expiryMillis)
    {
        if (candidates.isEmpty())
            return defaultEndpoint;

        if (regionHint != null)
        {
            for (Endpoint candidate : candidates)
            {
                if (regionHint.equalsIgnoreCase(candidate.region()) && !isUnavailable(candidate, role, nowMillis, expiryMillis))
                    return candidate;
            }
        }

        for (Endpoint candidate : candidates)
        {
            if (!isUnavailable(candidate, role, nowMillis, expiryMillis))
                return candidate;
        }
        return candidates.get(0);
    }

    Map<String, Endpoint> available(Map<String, Endpoint> byRegion, Role role, long nowMillis, long expiryMillis)
    {
        ImmutableMap.Builder<String, Endpoint> builder = ImmutableMap.builder();
        for (Map.Entry<String, Endpoint> e : byRegion.entrySet())
        {
            if (!isUnavailable(e.getValue(), role, nowMillis, expiryMillis))
                builder.put(e);
        }
        return builder.build();
    }

    @Nullable String regionOf(URI uri)
    {
        for (Endpoint endpoint : Iterables.concat(accountWriteEndpoints, accountReadEndpoints, thinClientWriteEndpoints, thinClientReadEndpoints))
        {
            if (endpoint.uri().equals(uri))
                return endpoint.region();
        }
        return null;
    }

    private static Role regularRole(Role role)
    {
        switch (role)
        {
            case THIN_CLIENT_READ: return Role.READ;
            case THIN_CLIENT_WRITE: return Role.WRITE;
            default: return role;
        }
    }

    // one endpoint per region, carrying every role the region serves
    private static Map<String, Endpoint> regionalEndpoints(List<AccountTopology.Region> writable, List<AccountTopology.Region> readable, Role writeRole, Role readRole)
    {
        Map<String, EnumSet<Role>> roles = new LinkedHashMap<>();
        Map<String, URI> uris = new LinkedHashMap<>();
        for (AccountTopology.Region region : writable)
        {
            roles.computeIfAbsent(region.name, ignore -> EnumSet.noneOf(Role.class)).add(writeRole);
            uris.putIfAbsent(region.name, region.endpoint);
        }
        for (AccountTopology.Region region : readable)
        {
            roles.computeIfAbsent(region.name, ignore -> EnumSet.noneOf(Role.class)).add(readRole);
            uris.putIfAbsent(region.name, region.endpoint);
        }

        Map<String, Endpoint> result = new LinkedHashMap<>();
        for (Map.Entry<String, EnumSet<Role>> e : roles.entrySet())
            result.put(e.getKey(), new Endpoint(uris.get(e.getKey()), e.getKey(), e.getValue()));
        return result;
    }

    private static List<Endpoint> select(List<AccountTopology.Region> regions, Map<String, Endpoint> endpoints)
    {
        ImmutableList.Builder<Endpoint> builder = ImmutableList.builder();
        for (AccountTopology.Region region : regions)
            builder.add(endpoints.get(region.name));
        return builder.build();
    }

    private static List<Endpoint> byPreference(List<Endpoint> accountOrder, List<String> preferredRegions)
    {
        if (preferredRegions.isEmpty())
            return accountOrder;

        List<Endpoint> ordered = new ArrayList<>(accountOrder.size());
        for (String preferred : preferredRegions)
        {
            for (Endpoint endpoint : accountOrder)
            {
                if (preferred.equalsIgnoreCase(endpoint.region()) && !ordered.contains(endpoint))
                    ordered.add(endpoint);
            }
        }
        for (Endpoint endpoint : accountOrder)
        {
            if (!ordered.contains(endpoint))
                ordered.add(endpoint);
        }
        return ImmutableList.copyOf(ordered);
    }

    private static Map<String, Endpoint> byRegion(Collection<Endpoint> endpoints)
    {
        Map<String, Endpoint> result = new LinkedHashMap<>();
        for (Endpoint endpoint : endpoints)
            result.putIfAbsent(endpoint.region(), endpoint);
        return ImmutableMap.copyOf(result);
    }

    public long version()
    {
        return version;
    }

    public AccountTopology topology()
    {
        return topology;
    }

    @Override
    public String toString()
    {
        return "EndpointDirectory{version=" + version + ", write=" + writeEndpoints + ", read=" + readEndpoints
               + (unavailable.isEmpty() ? "" : ", unavailable=" + unavailable) + '}';
    }
}
