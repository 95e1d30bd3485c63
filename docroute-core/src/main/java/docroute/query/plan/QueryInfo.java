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

/**
 * The shape of a query as seen by the client side execution pipeline
 */
public final class QueryInfo
{
    public enum DistinctType { NONE, ORDERED, UNORDERED }
    public enum SortOrder { ASCENDING, DESCENDING }

    public static final QueryInfo EMPTY = builder().build();

    private final DistinctType distinctType;
    private final @Nullable Integer top;
    private final @Nullable Integer offset;
    private final @Nullable Integer limit;
    private final List<SortOrder> orderBy;
    private final List<String> orderByExpressions;
    private final List<String> groupByExpressions;
    private final List<String> aggregates;
    private final boolean hasSelectValue;
    private final @Nullable String rewrittenQuery;
    private final boolean hasNonStreamingOrderBy;

    private QueryInfo(Builder builder)
    {
        this.distinctType = builder.distinctType;
        this.top = builder.top;
        this.offset = builder.offset;
        this.limit = builder.limit;
        this.orderBy = ImmutableList.copyOf(builder.orderBy);
        this.orderByExpressions = ImmutableList.copyOf(builder.orderByExpressions);
        this.groupByExpressions = ImmutableList.copyOf(builder.groupByExpressions);
        this.aggregates = ImmutableList.copyOf(builder.aggregates);
        this.hasSelectValue = builder.hasSelectValue;
        this.rewrittenQuery = builder.rewrittenQuery;
        this.hasNonStreamingOrderBy = builder.hasNonStreamingOrderBy;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public DistinctType distinctType() { return distinctType; }
    public @Nullable Integer top() { return top; }
    public @Nullable Integer offset() { return offset; }
    public @Nullable Integer limit() { return limit; }
    public List<SortOrder> orderBy() { return orderBy; }
    public List<String> orderByExpressions() { return orderByExpressions; }
    public List<String> groupByExpressions() { return groupByExpressions; }
    public List<String> aggregates() { return aggregates; }
    public boolean hasSelectValue() { return hasSelectValue; }
    public @Nullable String rewrittenQuery() { return rewrittenQuery; }
    public boolean hasNonStreamingOrderBy() { return hasNonStreamingOrderBy; }

    public boolean hasDistinct() { return distinctType != DistinctType.NONE; }
    public boolean hasTop() { return top != null; }
    public boolean hasOffset() { return offset != null; }
    public boolean hasLimit() { return limit != null; }
    public boolean hasOrderBy() { return !orderBy.isEmpty(); }
    public boolean hasGroupBy() { return !groupByExpressions.isEmpty(); }
    public boolean hasAggregates() { return !aggregates.isEmpty(); }
    public boolean hasRewrittenQuery() { return rewrittenQuery != null && !rewrittenQuery.isEmpty(); }

    /**
     * True if the query can be answered by concatenating per-partition pages in partition order
     */
    public boolean isPassThrough()
    {
        return !hasDistinct() && !hasTop() && !hasOffset() && !hasLimit() && !hasOrderBy() && !hasGroupBy()
               && !hasAggregates() && !hasNonStreamingOrderBy;
    }

    @Override
    public String toString()
    {
        return "QueryInfo{distinct=" + distinctType + ", top=" + top + ", offset=" + offset + ", limit=" + limit
               + ", orderBy=" + orderBy + ", groupBy=" + groupByExpressions + ", aggregates=" + aggregates
               + ", selectValue=" + hasSelectValue + ", nonStreamingOrderBy=" + hasNonStreamingOrderBy + '}';
    }

    public static final class Builder
    {
        private DistinctType distinctType = DistinctType.NONE;
        private Integer top, offset, limit;
        private List<SortOrder> orderBy = ImmutableList.of();
        private List<String> orderByExpressions = ImmutableList.of();
        private List<String> groupByExpressions = ImmutableList.of();
        private List<String> aggregates = ImmutableList.of();
        private boolean hasSelectValue;
        private String rewrittenQuery;
        private boolean hasNonStreamingOrderBy;

        private Builder() {}

        public Builder distinctType(DistinctType distinctType) { this.distinctType = distinctType; return this; }
        public Builder top(@Nullable Integer top) { this.top = top; return this; }
        public Builder offset(@Nullable Integer offset) { this.offset = offset; return this; }
        public Builder limit(@Nullable Integer limit) { this.limit = limit; return this; }
        public Builder orderBy(List<SortOrder> orderBy) { this.orderBy = orderBy; return this; }
        public Builder orderByExpressions(List<String> expressions) { this.orderByExpressions = expressions; return this; }
        public Builder groupByExpressions(List<String> expressions) { this.groupByExpressions = expressions; return this; }
        public Builder aggregates(List<String> aggregates) { this.aggregates = aggregates; return this; }
        public Builder hasSelectValue(boolean hasSelectValue) { this.hasSelectValue = hasSelectValue; return this; }
        public Builder rewrittenQuery(@Nullable String rewrittenQuery) { this.rewrittenQuery = rewrittenQuery; return this; }
        public Builder hasNonStreamingOrderBy(boolean value) { this.hasNonStreamingOrderBy = value; return this; }

        public QueryInfo build()
        {
            return new QueryInfo(this);
        }
    }
}
