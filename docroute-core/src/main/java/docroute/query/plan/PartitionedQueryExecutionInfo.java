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

import java.util.List;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

import docroute.primitives.EpkRange;
import docroute.utils.Invariants;

/**
 * A query plan: how to execute the query client side, and which slices of the key space it touches.
 * Immutable once produced by either the local generator or the gateway.
 */
public final class PartitionedQueryExecutionInfo
{
    public static final int CURRENT_VERSION = 2;

    private final int version;
    private final QueryInfo queryInfo;
    private final List<EpkRange> queryRanges;
    private final @Nullable JsonObject hybridSearchQueryInfo;

    public PartitionedQueryExecutionInfo(QueryInfo queryInfo, List<EpkRange> queryRanges)
    {
        this(CURRENT_VERSION, queryInfo, queryRanges, null);
    }

    public PartitionedQueryExecutionInfo(int version, QueryInfo queryInfo, List<EpkRange> queryRanges, @Nullable JsonObject hybridSearchQueryInfo)
    {
        this.version = version;
        this.queryInfo = Invariants.nonNull(queryInfo, "queryInfo");
        this.queryRanges = ImmutableList.copyOf(queryRanges);
        this.hybridSearchQueryInfo = hybridSearchQueryInfo == null ? null : hybridSearchQueryInfo.deepCopy();
    }

    public int version()
    {
        return version;
    }

    public QueryInfo queryInfo()
    {
        return queryInfo;
    }

    public List<EpkRange> queryRanges()
    {
        return queryRanges;
    }

    public @Nullable JsonObject hybridSearchQueryInfo()
    {
        return hybridSearchQueryInfo == null ? null : hybridSearchQueryInfo.deepCopy();
    }

    @Override
    public String toString()
    {
        return "PartitionedQueryExecutionInfo{v" + version + ", " + queryInfo + ", ranges=" + queryRanges
               + (hybridSearchQueryInfo == null ? "" : ", hybridSearch=" + hybridSearchQueryInfo) + '}';
    }
}
