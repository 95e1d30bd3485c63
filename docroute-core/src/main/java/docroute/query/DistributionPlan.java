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

import java.nio.charset.StandardCharsets;

import com.google.common.io.BaseEncoding;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import docroute.coordinate.ResponseContractViolation;

/**
 * The {@code _distributionPlan} of a query response, which the backend sends either inline as a JSON object or as a
 * base64 string of the UTF-8 encoded JSON. Both decode to the same canonical object.
 */
public abstract class DistributionPlan
{
    private DistributionPlan() {}

    public abstract JsonObject decode();

    public static DistributionPlan of(JsonElement element)
    {
        if (element.isJsonObject())
            return new Structured(element.getAsJsonObject());
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString())
            return new BinaryEncoded(element.getAsString());
        throw new ResponseContractViolation("QueryResponse had " + QueryResponseParser.DISTRIBUTION_PLAN + " as neither an object nor a base64 string: " + typeOf(element));
    }

    private static String typeOf(JsonElement element)
    {
        if (element.isJsonArray()) return "array";
        if (element.isJsonNull()) return "null";
        if (element.getAsJsonPrimitive().isBoolean()) return "boolean";
        return "number";
    }

    public static final class Structured extends DistributionPlan
    {
        private final JsonObject plan;

        Structured(JsonObject plan)
        {
            this.plan = plan;
        }

        @Override
        public JsonObject decode()
        {
            return plan;
        }
    }

    public static final class BinaryEncoded extends DistributionPlan
    {
        private final String base64;

        BinaryEncoded(String base64)
        {
            this.base64 = base64;
        }

        @Override
        public JsonObject decode()
        {
            byte[] bytes;
            try
            {
                bytes = BaseEncoding.base64().decode(base64);
            }
            catch (IllegalArgumentException e)
            {
                throw new ResponseContractViolation("_distributionPlan is not base64 encoded JSON", e);
            }
            JsonElement decoded = QueryResponseParser.readStrict(new String(bytes, StandardCharsets.UTF_8), QueryResponseParser.DISTRIBUTION_PLAN);
            if (!decoded.isJsonObject())
                throw new ResponseContractViolation("_distributionPlan did not decode to an object");
            return decoded.getAsJsonObject();
        }
    }
}
