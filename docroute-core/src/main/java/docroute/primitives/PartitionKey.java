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

package docroute.primitives;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * A logical partition key value: one component per partition key path. Components are strings, numbers,
 * booleans, {@code null} or {@link #UNDEFINED}.
 */
public final class PartitionKey
{
    public static final Object UNDEFINED = new Object()
    {
        @Override
        public String toString()
        {
            return "undefined";
        }
    };

    /**
     * Addresses items stored without a partition key value; resolved against a definition's none value
     */
    public static final PartitionKey NONE = new PartitionKey(Collections.emptyList());

    private final List<Object> components;

    private PartitionKey(List<Object> components)
    {
        this.components = components;
    }

    public static PartitionKey of(Object... components)
    {
        if (components.length == 0)
            throw new IllegalArgumentException("A partition key needs at least one component");
        for (Object component : components)
        {
            if (component != null && component != UNDEFINED && !(component instanceof String)
                && !(component instanceof Number) && !(component instanceof Boolean))
                throw new IllegalArgumentException("Unsupported partition key component type " + component.getClass().getName());
        }
        return new PartitionKey(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(components))));
    }

    public boolean isNone()
    {
        return this == NONE;
    }

    public List<Object> components()
    {
        return components;
    }

    /**
     * The JSON array form carried in the partition key request header; undefined components are empty objects
     */
    public String toJson()
    {
        JsonArray array = new JsonArray();
        for (Object component : components)
        {
            if (component == UNDEFINED) array.add(new JsonObject());
            else if (component == null) array.add(JsonNull.INSTANCE);
            else if (component instanceof Boolean) array.add(new JsonPrimitive((Boolean) component));
            else if (component instanceof Number) array.add(new JsonPrimitive((Number) component));
            else array.add(new JsonPrimitive((String) component));
        }
        return array.toString();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return components.equals(((PartitionKey) o).components);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(components);
    }

    @Override
    public String toString()
    {
        return isNone() ? "PartitionKey.NONE" : "PartitionKey" + components;
    }
}
