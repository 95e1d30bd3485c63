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
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

import com.google.common.collect.Sets;

/**
 * A regional service address and the roles it serves. Immutable; a topology refresh replaces endpoints wholesale.
 */
public final class Endpoint
{
    public enum Role { READ, WRITE, THIN_CLIENT_READ, THIN_CLIENT_WRITE }

    private final URI uri;
    private final @Nullable String region;
    private final Set<Role> roles;

    public Endpoint(URI uri, @Nullable String region, Set<Role> roles)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.region = region;
        this.roles = Sets.immutableEnumSet(roles);
    }

    /**
     * The account's global endpoint, used before any regional topology is known
     */
    static Endpoint global(URI uri)
    {
        return new Endpoint(uri, null, EnumSet.of(Role.READ, Role.WRITE));
    }

    public URI uri()
    {
        return uri;
    }

    public @Nullable String region()
    {
        return region;
    }

    public Set<Role> roles()
    {
        return roles;
    }

    public boolean hasRole(Role role)
    {
        return roles.contains(role);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Endpoint that = (Endpoint) o;
        return uri.equals(that.uri) && Objects.equals(region, that.region) && roles.equals(that.roles);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(uri, region, roles);
    }

    @Override
    public String toString()
    {
        return (region == null ? "global" : region) + '(' + uri + ')';
    }
}
