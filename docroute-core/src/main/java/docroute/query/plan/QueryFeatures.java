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

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.collect.Sets;

/**
 * Query capabilities the client advertises when asking the gateway for a plan. The gateway rejects plans that need
 * a feature the client did not list.
 */
public enum QueryFeatures
{
    AGGREGATE("Aggregate"),
    DISTINCT("Distinct"),
    GROUP_BY("GroupBy"),
    MULTIPLE_ORDER_BY("MultipleOrderBy"),
    MULTIPLE_AGGREGATES("MultipleAggregates"),
    OFFSET_AND_LIMIT("OffsetAndLimit"),
    ORDER_BY("OrderBy"),
    TOP("Top"),
    NON_VALUE_AGGREGATE("NonValueAggregate"),
    DCOUNT("DCount"),
    NON_STREAMING_ORDER_BY("NonStreamingOrderBy"),
    COUNT_IF("CountIf"),
    HYBRID_SEARCH("HybridSearch"),
    WEIGHTED_RANK_FUSION("WeightedRankFusion"),
    HYBRID_SEARCH_SKIP_ORDER_BY_REWRITE("HybridSearchSkipOrderByRewrite");

    public static final Set<QueryFeatures> SUPPORTED = Sets.immutableEnumSet(EnumSet.allOf(QueryFeatures.class));
    public static final Set<QueryFeatures> SUPPORTED_WITH_HYBRID_SEARCH_OPTIMIZATION_DISABLED = Sets.immutableEnumSet(EnumSet.complementOf(EnumSet.of(HYBRID_SEARCH_SKIP_ORDER_BY_REWRITE)));

    private static final String SUPPORTED_STRING = toHeaderValue(SUPPORTED);
    private static final String SUPPORTED_WITH_HYBRID_SEARCH_OPTIMIZATION_DISABLED_STRING = toHeaderValue(SUPPORTED_WITH_HYBRID_SEARCH_OPTIMIZATION_DISABLED);

    public final String wireName;

    QueryFeatures(String wireName)
    {
        this.wireName = wireName;
    }

    public long bit()
    {
        return 1L << ordinal();
    }

    public static long toBitmask(Set<QueryFeatures> features)
    {
        long mask = 0;
        for (QueryFeatures feature : features)
            mask |= feature.bit();
        return mask;
    }

    /**
     * Feature names in declaration order, separated by {@code ", "}
     */
    public static String toHeaderValue(Set<QueryFeatures> features)
    {
        return features.stream()
                       .sorted()
                       .map(f -> f.wireName)
                       .collect(Collectors.joining(", "));
    }

    public static String supportedQueryFeatures(boolean hybridSearchQueryPlanOptimizationDisabled)
    {
        return hybridSearchQueryPlanOptimizationDisabled ? SUPPORTED_WITH_HYBRID_SEARCH_OPTIMIZATION_DISABLED_STRING
                                                         : SUPPORTED_STRING;
    }
}
