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

import java.util.Objects;

/**
 * The slice of a collection a request targets: an effective partition key range, a logical partition key,
 * or a physical partition key range by id
 */
public abstract class FeedRange
{
    private FeedRange() {}

    public static FeedRange ofRange(EpkRange range)
    {
        return new Epk(range);
    }

    public static FeedRange ofPartitionKey(PartitionKey key)
    {
        return new Logical(key);
    }

    public static FeedRange ofPartitionKeyRange(String partitionKeyRangeId)
    {
        return new Physical(partitionKeyRangeId);
    }

    public static final class Epk extends FeedRange
    {
        public final EpkRange range;

        Epk(EpkRange range)
        {
            this.range = Objects.requireNonNull(range);
        }

        @Override
        public String toString()
        {
            return "FeedRange.Epk" + range;
        }
    }

    public static final class Logical extends FeedRange
    {
        public final PartitionKey partitionKey;

        Logical(PartitionKey partitionKey)
        {
            this.partitionKey = Objects.requireNonNull(partitionKey);
        }

        @Override
        public String toString()
        {
            return "FeedRange.Logical(" + partitionKey + ')';
        }
    }

    public static final class Physical extends FeedRange
    {
        public final String partitionKeyRangeId;

        Physical(String partitionKeyRangeId)
        {
            this.partitionKeyRangeId = Objects.requireNonNull(partitionKeyRangeId);
        }

        @Override
        public String toString()
        {
            return "FeedRange.Physical(" + partitionKeyRangeId + ')';
        }
    }
}
