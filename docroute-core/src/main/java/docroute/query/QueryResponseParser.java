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

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Supplier;
import javax.annotation.Nullable;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import docroute.api.QuerySerializer;
import docroute.coordinate.ResponseContractViolation;
import docroute.messages.Headers;
import docroute.messages.HttpHeaders;
import docroute.primitives.ResourceType;
import docroute.utils.Invariants;

/**
 * Turns a successful query response into a {@link QueryPage}.
 *
 * The body is a JSON object holding the results under a property named for the resource type
 * ({@code Documents}, {@code DocumentCollections}, ...). Document responses may also carry a
 * {@code _distributionPlan}, inline or base64 encoded, and a boolean {@code _streaming} flag.
 */
public class QueryResponseParser
{
    public static final String DISTRIBUTION_PLAN = "_distributionPlan";
    public static final String STREAMING = "_streaming";

    private static final TypeAdapter<JsonElement> JSON_ELEMENT = new Gson().getAdapter(JsonElement.class);

    public static final class ParsedBody
    {
        public final List<JsonElement> documents;
        public final @Nullable JsonObject distributionPlan;
        public final @Nullable Boolean streaming;

        ParsedBody(List<JsonElement> documents, @Nullable JsonObject distributionPlan, @Nullable Boolean streaming)
        {
            this.documents = documents;
            this.distributionPlan = distributionPlan;
            this.streaming = streaming;
        }
    }

    private final QuerySerializer serializer;

    public QueryResponseParser(QuerySerializer serializer)
    {
        this.serializer = Invariants.nonNull(serializer, "serializer");
    }

    /**
     * Reads exactly one JSON document, rejecting everything a lenient reader would repair: unquoted or single
     * quoted strings, trailing commas, alternative separators and content after the document.
     */
    static JsonElement readStrict(String json, String description)
    {
        try (JsonReader reader = new JsonReader(new StringReader(json)))
        {
            reader.setLenient(false);
            JsonElement element = JSON_ELEMENT.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT)
                throw new ResponseContractViolation(description + " had content after the JSON document");
            return element;
        }
        catch (IOException | JsonParseException e)
        {
            throw new ResponseContractViolation(description + " was not valid JSON", e);
        }
    }

    public static ParsedBody parseRestStream(byte[] body, ResourceType resourceType)
    {
        Invariants.nonNull(body, "body");
        String resourceName = resourceType.queryResultPropertyName();

        JsonElement root = readStrict(new String(body, StandardCharsets.UTF_8), "QueryResponse");
        if (!root.isJsonObject())
            throw new ResponseContractViolation("QueryResponse did not have property: " + resourceName);

        JsonObject object = root.getAsJsonObject();
        JsonElement results = object.get(resourceName);
        if (results == null)
            throw new ResponseContractViolation("QueryResponse did not have property: " + resourceName);
        if (!results.isJsonArray())
            throw new ResponseContractViolation("QueryResponse did not have an array of : " + resourceName);

        JsonArray array = results.getAsJsonArray();
        ImmutableList.Builder<JsonElement> documents = ImmutableList.builderWithExpectedSize(array.size());
        for (JsonElement document : array)
            documents.add(document);

        JsonObject distributionPlan = null;
        Boolean streaming = null;
        if (resourceType == ResourceType.DOCUMENT)
        {
            JsonElement plan = object.get(DISTRIBUTION_PLAN);
            if (plan != null)
                distributionPlan = DistributionPlan.of(plan).decode();

            JsonElement flag = object.get(STREAMING);
            if (flag != null)
            {
                if (!flag.isJsonPrimitive() || !flag.getAsJsonPrimitive().isBoolean())
                    throw new ResponseContractViolation("QueryResponse had _streaming property as a non boolean: " + flag);
                streaming = flag.getAsBoolean();
            }
        }

        return new ParsedBody(documents.build(), distributionPlan, streaming);
    }

    public QueryPage createQueryPage(Headers headers, byte[] body, ResourceType resourceType)
    {
        return createQueryPage(headers, body, resourceType, null);
    }

    /**
     * @param targetPartitionKeyRangeId the range the request was routed to, recorded in the continuation state when
     *                                  the response does not name one
     */
    public QueryPage createQueryPage(Headers headers, byte[] body, ResourceType resourceType, @Nullable String targetPartitionKeyRangeId)
    {
        ParsedBody parsed = parseRestStream(body, resourceType);

        ContinuationState state = null;
        String continuation = headers.continuationToken();
        if (continuation != null)
        {
            String rangeId = headers.get(HttpHeaders.PARTITION_KEY_RANGE_ID);
            state = new ContinuationState(continuation, rangeId != null ? rangeId : targetPartitionKeyRangeId);
        }

        Headers.Builder additional = Headers.builder();
        for (String name : headers.names())
        {
            if (!QueryPage.BANNED_HEADERS.contains(name))
                additional.put(name, headers.get(name));
        }

        Supplier<QueryExecutionInfo> executionInfo = null;
        String executionInfoJson = headers.get(HttpHeaders.QUERY_EXECUTION_INFO);
        if (executionInfoJson != null)
            executionInfo = Suppliers.memoize(() -> serializer.deserializeQueryExecutionInfo(executionInfoJson));

        return new QueryPage(parsed.documents, headers.requestCharge(), headers.activityId(), executionInfo,
                             parsed.distributionPlan, additional.build(), state, parsed.streaming);
    }
}
