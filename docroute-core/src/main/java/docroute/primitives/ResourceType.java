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

public enum ResourceType
{
    DATABASE_ACCOUNT("DatabaseAccount", false),
    DATABASE("Database", false),
    COLLECTION("DocumentCollection", false),
    DOCUMENT("Document", true),
    CONFLICT("Conflict", true),
    PARTITION_KEY_RANGE("PartitionKeyRange", false),
    STORED_PROCEDURE("StoredProcedure", false),
    TRIGGER("Trigger", false),
    USER_DEFINED_FUNCTION("UserDefinedFunction", false);

    private final String resourceTypeString;
    private final boolean partitioned;

    ResourceType(String resourceTypeString, boolean partitioned)
    {
        this.resourceTypeString = resourceTypeString;
        this.partitioned = partitioned;
    }

    public String resourceTypeString()
    {
        return resourceTypeString;
    }

    /**
     * Whether requests for this resource are routed to a partition key range
     */
    public boolean isPartitioned()
    {
        return partitioned;
    }

    /**
     * The name of the array property that holds results in a query response body
     */
    public String queryResultPropertyName()
    {
        if (this == COLLECTION)
            return "DocumentCollections";
        return resourceTypeString + 's';
    }
}
