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

import java.util.Objects;
import javax.annotation.Nullable;

import docroute.utils.Invariants;

/**
 * Where to resume reading a partition: the backend's opaque continuation token, passed back byte for byte,
 * and the partition key range that issued it
 */
public final class ContinuationState
{
    private final String token;
    private final @Nullable String partitionKeyRangeId;

    public ContinuationState(String token, @Nullable String partitionKeyRangeId)
    {
        this.token = Invariants.nonNull(token, "token");
        this.partitionKeyRangeId = partitionKeyRangeId;
    }

    public String token()
    {
        return token;
    }

    public @Nullable String partitionKeyRangeId()
    {
        return partitionKeyRangeId;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContinuationState that = (ContinuationState) o;
        return token.equals(that.token) && Objects.equals(partitionKeyRangeId, that.partitionKeyRangeId);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(token, partitionKeyRangeId);
    }

    @Override
    public String toString()
    {
        return "ContinuationState{" + partitionKeyRangeId + ": " + token + '}';
    }
}
