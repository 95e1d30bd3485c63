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
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;

import docroute.utils.Invariants;

/**
 * Query text and its named parameters, in declaration order
 */
public final class SqlQuerySpec
{
    public static final class Parameter
    {
        public final String name;
        public final JsonElement value;

        public Parameter(String name, JsonElement value)
        {
            this.name = Invariants.nonEmpty(name, "name");
            this.value = Invariants.nonNull(value, "value").deepCopy();
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Parameter that = (Parameter) o;
            return name.equals(that.name) && value.equals(that.value);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(name, value);
        }

        @Override
        public String toString()
        {
            return name + '=' + value;
        }
    }

    private final String queryText;
    private final List<Parameter> parameters;

    public SqlQuerySpec(String queryText)
    {
        this(queryText, ImmutableList.of());
    }

    public SqlQuerySpec(String queryText, List<Parameter> parameters)
    {
        this.queryText = Invariants.nonEmpty(queryText, "queryText");
        this.parameters = ImmutableList.copyOf(parameters);
    }

    public String queryText()
    {
        return queryText;
    }

    public List<Parameter> parameters()
    {
        return parameters;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SqlQuerySpec that = (SqlQuerySpec) o;
        return queryText.equals(that.queryText) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(queryText, parameters);
    }

    @Override
    public String toString()
    {
        return parameters.isEmpty() ? queryText : queryText + ' ' + parameters;
    }
}
