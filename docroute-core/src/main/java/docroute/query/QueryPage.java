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

import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import docroute.messages.Headers;
import docroute.messages.HttpHeaders;

/**
 * One page of results from one partition. A {@code null} continuation state means the partition has no more pages.
 */
public final class QueryPage
{
    /**
     * Response headers that are not carried into {@link #additionalHeaders()}
     */
    public static final Set<String> BANNED_HEADERS = ImmutableSortedSet.orderedBy(String.CASE_INSENSITIVE_ORDER)
                                                                       .add(HttpHeaders.CONTINUATION, HttpHeaders.CONTINUATION_TOKEN)
                                                                       .build();

    private final List<JsonElement> documents;
    private final double requestCharge;
    private final @Nullable String activityId;
    private final @Nullable Supplier<QueryExecutionInfo> queryExecutionInfo;
    private final @Nullable JsonObject distributionPlan;
    private final Headers additionalHeaders;
    private final @Nullable ContinuationState state;
    private final @Nullable Boolean streaming;

    public QueryPage(List<JsonElement> documents, double requestCharge, @Nullable String activityId,
                     @Nullable Supplier<QueryExecutionInfo> queryExecutionInfo, @Nullable JsonObject distributionPlan,
                     Headers additionalHeaders, @Nullable ContinuationState state, @Nullable Boolean streaming)
    {
        this.documents = ImmutableList.copyOf(documents);
        this.requestCharge = requestCharge;
        this.activityId = activityId;
        this.queryExecutionInfo = queryExecutionInfo;
        this.distributionPlan = distributionPlan;
        this.additionalHeaders = additionalHeaders;
        this.state = state;
        this.streaming = streaming;
    }

    public List<JsonElement> documents()
    {
        return documents;
    }

    public double requestCharge()
    {
        return requestCharge;
    }

    public @Nullable String activityId()
    {
        return activityId;
    }

    /**
     * Deserialized on first access; {@code null} if the response carried no execution info
     */
    public @Nullable QueryExecutionInfo queryExecutionInfo()
    {
        return queryExecutionInfo == null ? null : queryExecutionInfo.get();
    }

    public @Nullable JsonObject distributionPlan()
    {
        return distributionPlan == null ? null : distributionPlan.deepCopy();
    }

    public Headers additionalHeaders()
    {
        return additionalHeaders;
    }

    public @Nullable ContinuationState state()
    {
        return state;
    }

    public boolean hasMoreResults()
    {
        return state != null;
    }

    public @Nullable Boolean streaming()
    {
        return streaming;
    }

    @Override
    public String toString()
    {
        return "QueryPage{" + documents.size() + " documents, charge=" + requestCharge + ", activityId=" + activityId
               + ", state=" + state + '}';
    }
}
