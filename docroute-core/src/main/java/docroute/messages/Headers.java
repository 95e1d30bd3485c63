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

package docroute.messages;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable, case insensitive set of request or response headers
 */
public final class Headers
{
    private static final Logger logger = LoggerFactory.getLogger(Headers.class);

    public static final Headers EMPTY = new Headers(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    private final Map<String, String> values;

    private Headers(TreeMap<String, String> values)
    {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static Headers of(Map<String, String> values)
    {
        return builder().putAll(values).build();
    }

    public Builder toBuilder()
    {
        return builder().putAll(values);
    }

    public @Nullable String get(String name)
    {
        return values.get(name);
    }

    public boolean contains(String name)
    {
        return values.containsKey(name);
    }

    public Set<String> names()
    {
        return values.keySet();
    }

    public Map<String, String> asMap()
    {
        return values;
    }

    public @Nullable String activityId()
    {
        return get(HttpHeaders.ACTIVITY_ID);
    }

    public @Nullable String continuationToken()
    {
        return get(HttpHeaders.CONTINUATION);
    }

    public @Nullable String queryMetricsText()
    {
        return get(HttpHeaders.QUERY_METRICS);
    }

    public double requestCharge()
    {
        String charge = get(HttpHeaders.REQUEST_CHARGE);
        if (charge == null)
            return 0;
        try
        {
            return Double.parseDouble(charge);
        }
        catch (NumberFormatException e)
        {
            logger.debug("Ignoring malformed {} header: {}", HttpHeaders.REQUEST_CHARGE, charge);
            return 0;
        }
    }

    public int subStatusCode()
    {
        String subStatus = get(HttpHeaders.SUB_STATUS);
        if (subStatus == null)
            return 0;
        try
        {
            return Integer.parseInt(subStatus);
        }
        catch (NumberFormatException e)
        {
            logger.debug("Ignoring malformed {} header: {}", HttpHeaders.SUB_STATUS, subStatus);
            return 0;
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Headers) o).values);
    }

    @Override
    public int hashCode()
    {
        return values.hashCode();
    }

    @Override
    public String toString()
    {
        return values.toString();
    }

    public static final class Builder
    {
        private final TreeMap<String, String> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        private Builder() {}

        public Builder put(String name, @Nullable String value)
        {
            if (value == null) values.remove(name);
            else values.put(name, value);
            return this;
        }

        public Builder putAll(Map<String, String> values)
        {
            values.forEach(this::put);
            return this;
        }

        public Builder remove(String name)
        {
            values.remove(name);
            return this;
        }

        public Headers build()
        {
            return new Headers(new TreeMap<>(values));
        }
    }
}
