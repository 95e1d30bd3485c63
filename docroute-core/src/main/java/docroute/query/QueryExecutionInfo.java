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

/**
 * Per-page execution hints returned by the backend in the query execution info header
 */
public final class QueryExecutionInfo
{
    private final boolean reverseRidEnabled;
    private final boolean reverseIndexScan;

    public QueryExecutionInfo(boolean reverseRidEnabled, boolean reverseIndexScan)
    {
        this.reverseRidEnabled = reverseRidEnabled;
        this.reverseIndexScan = reverseIndexScan;
    }

    public boolean reverseRidEnabled()
    {
        return reverseRidEnabled;
    }

    public boolean reverseIndexScan()
    {
        return reverseIndexScan;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryExecutionInfo that = (QueryExecutionInfo) o;
        return reverseRidEnabled == that.reverseRidEnabled && reverseIndexScan == that.reverseIndexScan;
    }

    @Override
    public int hashCode()
    {
        return Boolean.hashCode(reverseRidEnabled) * 31 + Boolean.hashCode(reverseIndexScan);
    }

    @Override
    public String toString()
    {
        return "QueryExecutionInfo{reverseRidEnabled=" + reverseRidEnabled + ", reverseIndexScan=" + reverseIndexScan + '}';
    }
}
