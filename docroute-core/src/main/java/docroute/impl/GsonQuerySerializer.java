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

package docroute.impl;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import docroute.api.QuerySerializer;
import docroute.coordinate.ResponseContractViolation;
import docroute.primitives.EpkRange;
import docroute.primitives.ResourceType;
import docroute.query.QueryExecutionInfo;
import docroute.query.SqlQuerySpec;
import docroute.query.plan.PartitionedQueryExecutionInfo;
import docroute.query.plan.QueryInfo;

import static docroute.utils.Invariants.illegalState;

/**
 * JSON encoding of query specs, query plans and query execution info using Gson type adapters
 */
public class GsonQuerySerializer implements QuerySerializer
{
    public static final GsonQuerySerializer INSTANCE = new GsonQuerySerializer();

    public static final TypeAdapter<SqlQuerySpec> QUERY_SPEC_ADAPTER = new TypeAdapter<SqlQuerySpec>()
    {
        @Override
        public void write(JsonWriter out, SqlQuerySpec value) throws IOException
        {
            out.beginObject();
            out.name("query").value(value.queryText());
            out.name("parameters");
            out.beginArray();
            for (SqlQuerySpec.Parameter parameter : value.parameters())
            {
                out.beginObject();
                out.name("name").value(parameter.name);
                out.name("value");
                GSON.toJson(parameter.value, out);
                out.endObject();
            }
            out.endArray();
            out.endObject();
        }

        @Override
        public SqlQuerySpec read(JsonReader in) throws IOException
        {
            String query = null;
            List<SqlQuerySpec.Parameter> parameters = new ArrayList<>();
            in.beginObject();
            while (in.hasNext())
            {
                switch (in.nextName())
                {
                    case "query":
                        query = in.nextString();
                        break;
                    case "parameters":
                        in.beginArray();
                        while (in.hasNext())
                        {
                            JsonObject parameter = GSON.fromJson(in, JsonObject.class);
                            parameters.add(new SqlQuerySpec.Parameter(parameter.get("name").getAsString(), parameter.get("value")));
                        }
                        in.endArray();
                        break;
                    default:
                        in.skipValue();
                }
            }
            in.endObject();
            return new SqlQuerySpec(query, parameters);
        }
    };

    public static final TypeAdapter<EpkRange> EPK_RANGE_ADAPTER = new TypeAdapter<EpkRange>()
    {
        @Override
        public void write(JsonWriter out, EpkRange value) throws IOException
        {
            out.beginObject();
            out.name("min").value(value.min());
            out.name("max").value(value.max());
            out.name("isMinInclusive").value(value.minInclusive());
            out.name("isMaxInclusive").value(value.maxInclusive());
            out.endObject();
        }

        @Override
        public EpkRange read(JsonReader in) throws IOException
        {
            String min = null, max = null;
            boolean minInclusive = true, maxInclusive = false;
            in.beginObject();
            while (in.hasNext())
            {
                switch (in.nextName())
                {
                    case "min": min = in.nextString(); break;
                    case "max": max = in.nextString(); break;
                    case "isMinInclusive": minInclusive = in.nextBoolean(); break;
                    case "isMaxInclusive": maxInclusive = in.nextBoolean(); break;
                    default: in.skipValue();
                }
            }
            in.endObject();
            if (min == null || max == null)
                throw new JsonParseException("Query range is missing min or max");
            return new EpkRange(min, max, minInclusive, maxInclusive);
        }
    };

    public static final TypeAdapter<QueryInfo> QUERY_INFO_ADAPTER = new TypeAdapter<QueryInfo>()
    {
        @Override
        public void write(JsonWriter out, QueryInfo value) throws IOException
        {
            out.beginObject();
            out.name("distinctType").value(distinctTypeName(value.distinctType()));
            out.name("top").value(value.top());
            out.name("offset").value(value.offset());
            out.name("limit").value(value.limit());
            out.name("orderBy");
            out.beginArray();
            for (QueryInfo.SortOrder order : value.orderBy())
                out.value(order == QueryInfo.SortOrder.ASCENDING ? "Ascending" : "Descending");
            out.endArray();
            writeStrings(out, "orderByExpressions", value.orderByExpressions());
            writeStrings(out, "groupByExpressions", value.groupByExpressions());
            writeStrings(out, "aggregates", value.aggregates());
            out.name("hasSelectValue").value(value.hasSelectValue());
            out.name("rewrittenQuery").value(value.rewrittenQuery());
            out.name("hasNonStreamingOrderBy").value(value.hasNonStreamingOrderBy());
            out.endObject();
        }

        @Override
        public QueryInfo read(JsonReader in) throws IOException
        {
            QueryInfo.Builder builder = QueryInfo.builder();
            in.beginObject();
            while (in.hasNext())
            {
                String name = in.nextName();
                if (in.peek() == JsonToken.NULL)
                {
                    in.nextNull();
                    continue;
                }
                switch (name)
                {
                    case "distinctType": builder.distinctType(parseDistinctType(in.nextString())); break;
                    case "top": builder.top(in.nextInt()); break;
                    case "offset": builder.offset(in.nextInt()); break;
                    case "limit": builder.limit(in.nextInt()); break;
                    case "orderBy":
                    {
                        List<QueryInfo.SortOrder> orderBy = new ArrayList<>();
                        for (String order : readStrings(in))
                            orderBy.add("Descending".equalsIgnoreCase(order) ? QueryInfo.SortOrder.DESCENDING : QueryInfo.SortOrder.ASCENDING);
                        builder.orderBy(orderBy);
                        break;
                    }
                    case "orderByExpressions": builder.orderByExpressions(readStrings(in)); break;
                    case "groupByExpressions": builder.groupByExpressions(readStrings(in)); break;
                    case "aggregates": builder.aggregates(readStrings(in)); break;
                    case "hasSelectValue": builder.hasSelectValue(in.nextBoolean()); break;
                    case "rewrittenQuery": builder.rewrittenQuery(in.nextString()); break;
                    case "hasNonStreamingOrderBy": builder.hasNonStreamingOrderBy(in.nextBoolean()); break;
                    default: in.skipValue();
                }
            }
            in.endObject();
            return builder.build();
        }
    };

    public static final TypeAdapter<PartitionedQueryExecutionInfo> QUERY_PLAN_ADAPTER = new TypeAdapter<PartitionedQueryExecutionInfo>()
    {
        @Override
        public void write(JsonWriter out, PartitionedQueryExecutionInfo value) throws IOException
        {
            out.beginObject();
            out.name("partitionedQueryExecutionInfoVersion").value(value.version());
            out.name("queryInfo");
            QUERY_INFO_ADAPTER.write(out, value.queryInfo());
            out.name("queryRanges");
            out.beginArray();
            for (EpkRange range : value.queryRanges())
                EPK_RANGE_ADAPTER.write(out, range);
            out.endArray();
            if (value.hybridSearchQueryInfo() != null)
            {
                out.name("hybridSearchQueryInfo");
                GSON.toJson(value.hybridSearchQueryInfo(), out);
            }
            out.endObject();
        }

        @Override
        public PartitionedQueryExecutionInfo read(JsonReader in) throws IOException
        {
            int version = PartitionedQueryExecutionInfo.CURRENT_VERSION;
            QueryInfo queryInfo = QueryInfo.EMPTY;
            List<EpkRange> ranges = new ArrayList<>();
            JsonObject hybridSearchQueryInfo = null;
            in.beginObject();
            while (in.hasNext())
            {
                String name = in.nextName();
                if (in.peek() == JsonToken.NULL)
                {
                    in.nextNull();
                    continue;
                }
                switch (name)
                {
                    case "partitionedQueryExecutionInfoVersion": version = in.nextInt(); break;
                    case "queryInfo": queryInfo = QUERY_INFO_ADAPTER.read(in); break;
                    case "queryRanges":
                        in.beginArray();
                        while (in.hasNext())
                            ranges.add(EPK_RANGE_ADAPTER.read(in));
                        in.endArray();
                        break;
                    case "hybridSearchQueryInfo": hybridSearchQueryInfo = GSON.fromJson(in, JsonObject.class); break;
                    default: in.skipValue();
                }
            }
            in.endObject();
            return new PartitionedQueryExecutionInfo(version, queryInfo, ranges, hybridSearchQueryInfo);
        }
    };

    public static final TypeAdapter<QueryExecutionInfo> QUERY_EXECUTION_INFO_ADAPTER = new TypeAdapter<QueryExecutionInfo>()
    {
        @Override
        public void write(JsonWriter out, QueryExecutionInfo value) throws IOException
        {
            out.beginObject();
            out.name("reverseRidEnabled").value(value.reverseRidEnabled());
            out.name("reverseIndexScan").value(value.reverseIndexScan());
            out.endObject();
        }

        @Override
        public QueryExecutionInfo read(JsonReader in) throws IOException
        {
            boolean reverseRidEnabled = false, reverseIndexScan = false;
            in.beginObject();
            while (in.hasNext())
            {
                switch (in.nextName())
                {
                    case "reverseRidEnabled": reverseRidEnabled = in.nextBoolean(); break;
                    case "reverseIndexScan": reverseIndexScan = in.nextBoolean(); break;
                    default: in.skipValue();
                }
            }
            in.endObject();
            return new QueryExecutionInfo(reverseRidEnabled, reverseIndexScan);
        }
    };

    public static final Gson GSON = new GsonBuilder().registerTypeAdapter(SqlQuerySpec.class, QUERY_SPEC_ADAPTER)
                                                     .registerTypeAdapter(EpkRange.class, EPK_RANGE_ADAPTER)
                                                     .registerTypeAdapter(QueryInfo.class, QUERY_INFO_ADAPTER)
                                                     .registerTypeAdapter(PartitionedQueryExecutionInfo.class, QUERY_PLAN_ADAPTER)
                                                     .registerTypeAdapter(QueryExecutionInfo.class, QUERY_EXECUTION_INFO_ADAPTER)
                                                     .serializeNulls()
                                                     .create();

    @Override
    public byte[] serializeQuerySpec(SqlQuerySpec querySpec, ResourceType resourceType)
    {
        StringWriter out = new StringWriter();
        try (JsonWriter writer = new JsonWriter(out))
        {
            QUERY_SPEC_ADAPTER.write(writer, querySpec);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException(e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public PartitionedQueryExecutionInfo deserializeQueryPlan(byte[] payload)
    {
        return read(QUERY_PLAN_ADAPTER, new String(payload, StandardCharsets.UTF_8), "query plan");
    }

    @Override
    public QueryExecutionInfo deserializeQueryExecutionInfo(String json)
    {
        return read(QUERY_EXECUTION_INFO_ADAPTER, json, "query execution info");
    }

    public SqlQuerySpec deserializeQuerySpec(byte[] payload)
    {
        return read(QUERY_SPEC_ADAPTER, new String(payload, StandardCharsets.UTF_8), "query spec");
    }

    public byte[] serializeQueryPlan(PartitionedQueryExecutionInfo plan)
    {
        return GSON.toJson(plan, PartitionedQueryExecutionInfo.class).getBytes(StandardCharsets.UTF_8);
    }

    private static <T> T read(TypeAdapter<T> adapter, String json, String what)
    {
        try (JsonReader reader = new JsonReader(new StringReader(json)))
        {
            return adapter.read(reader);
        }
        catch (IOException | IllegalStateException | IllegalArgumentException | JsonParseException e)
        {
            throw new ResponseContractViolation("Could not read " + what + ": " + e.getMessage(), e);
        }
    }

    private static void writeStrings(JsonWriter out, String name, List<String> values) throws IOException
    {
        out.name(name);
        out.beginArray();
        for (String value : values)
            out.value(value);
        out.endArray();
    }

    private static List<String> readStrings(JsonReader in) throws IOException
    {
        List<String> values = new ArrayList<>();
        in.beginArray();
        while (in.hasNext())
        {
            JsonElement element = GSON.fromJson(in, JsonElement.class);
            values.add(element.isJsonPrimitive() ? element.getAsString() : element.toString());
        }
        in.endArray();
        return values;
    }

    private static String distinctTypeName(QueryInfo.DistinctType type)
    {
        switch (type)
        {
            case NONE: return "None";
            case ORDERED: return "Ordered";
            case UNORDERED: return "Unordered";
            default: throw illegalState("Unhandled distinct type %s", type);
        }
    }

    private static QueryInfo.DistinctType parseDistinctType(String name)
    {
        switch (name)
        {
            case "None": return QueryInfo.DistinctType.NONE;
            case "Ordered": return QueryInfo.DistinctType.ORDERED;
            case "Unordered": return QueryInfo.DistinctType.UNORDERED;
            default: throw new JsonParseException("Unknown distinct type " + name);
        }
    }
}
