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

import java.time.Duration;
import java.util.Collections;
import java.util.List;

public interface ClientConfig
{
    String FORCE_BYPASS_QUERY_PARSING_PROPERTY = "docroute.query.force_bypass_parsing";

    ClientConfig DEFAULT = new ClientConfig() {};

    // Regions in preference order; endpoints in these regions are tried before the account's own ordering
    default List<String> preferredRegions()
    {
        return Collections.emptyList();
    }

    default boolean useMultipleWriteLocations()
    {
        return true;
    }

    // When disabled, only the initial topology is used and the background refresh is never scheduled
    default boolean enableEndpointDiscovery()
    {
        return true;
    }

    // How long an endpoint marked unavailable is skipped before it becomes eligible again
    default Duration unavailableEndpointExpiration()
    {
        return Duration.ofMinutes(5);
    }

    default Duration backgroundRefreshInterval()
    {
        return Duration.ofMinutes(5);
    }

    // Unforced refreshes within this interval of the last successful one are skipped
    default Duration minimumRefreshInterval()
    {
        return Duration.ofSeconds(30);
    }

    default boolean bypassQueryParsing()
    {
        return Boolean.getBoolean(FORCE_BYPASS_QUERY_PARSING_PROPERTY);
    }

    default boolean hybridSearchQueryPlanOptimizationDisabled()
    {
        return false;
    }

    default boolean clientDisableOptimisticDirectExecution()
    {
        return false;
    }
}
