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

package docroute.messages;

import java.util.Objects;
import javax.annotation.Nullable;

import docroute.primitives.OperationType;
import docroute.primitives.ResourceType;

/**
 * An operation on the way to the transport: what it addresses, how it should be routed, and its payload
 */
public final class RequestMessage
{
    private static final byte[] NO_PAYLOAD = new byte[0];

    private final ResourceType resourceType;
    private final OperationType operationType;
    private final String resourceLink;
    private final Headers headers;
    private final byte[] payload;
    private final @Nullable String regionHint;
    private final @Nullable String partitionKeyRangeId;
    private final boolean useGatewayMode;
    private final boolean useThinClient;

    private RequestMessage(Builder builder)
    {
        this.resourceType = Objects.requireNonNull(builder.resourceType, "resourceType");
        this.operationType = Objects.requireNonNull(builder.operationType, "operationType");
        this.resourceLink = Objects.requireNonNull(builder.resourceLink, "resourceLink");
        this.headers = builder.headers.build();
        this.payload = builder.payload;
        this.regionHint = builder.regionHint;
        this.partitionKeyRangeId = builder.partitionKeyRangeId;
        this.useGatewayMode = builder.useGatewayMode;
        this.useThinClient = builder.useThinClient;
    }

    public static Builder builder(ResourceType resourceType, OperationType operationType, String resourceLink)
    {
        return new Builder(resourceType, operationType, resourceLink);
    }

    public ResourceType resourceType()
    {
        return resourceType;
    }

    public OperationType operationType()
    {
        return operationType;
    }

    public String resourceLink()
    {
        return resourceLink;
    }

    public Headers headers()
    {
        return headers;
    }

    public byte[] payload()
    {
        return payload;
    }

    /**
     * Region the caller would like the request served from, if available
     */
    public @Nullable String regionHint()
    {
        return regionHint;
    }

    /**
     * Physical partition the request is pinned to
     */
    public @Nullable String partitionKeyRangeId()
    {
        return partitionKeyRangeId;
    }

    public boolean useGatewayMode()
    {
        return useGatewayMode;
    }

    public boolean useThinClient()
    {
        return useThinClient;
    }

    @Override
    public String toString()
    {
        return "RequestMessage{" + operationType + ' ' + resourceType + ' ' + resourceLink
               + (partitionKeyRangeId == null ? "" : " pkrange=" + partitionKeyRangeId)
               + (regionHint == null ? "" : " region=" + regionHint) + '}';
    }

    public static final class Builder
    {
        private final ResourceType resourceType;
        private final OperationType operationType;
        private final String resourceLink;
        private final Headers.Builder headers = Headers.builder();
        private byte[] payload = NO_PAYLOAD;
        private String regionHint;
        private String partitionKeyRangeId;
        private boolean useGatewayMode;
        private boolean useThinClient;

        private Builder(ResourceType resourceType, OperationType operationType, String resourceLink)
        {
            this.resourceType = resourceType;
            this.operationType = operationType;
            this.resourceLink = resourceLink;
        }

        public Builder header(String name, @Nullable String value)
        {
            headers.put(name, value);
            return this;
        }

        public Builder payload(byte[] payload)
        {
            this.payload = Objects.requireNonNull(payload);
            return this;
        }

        public Builder regionHint(@Nullable String regionHint)
        {
            this.regionHint = regionHint;
            return this;
        }

        public Builder partitionKeyRangeId(@Nullable String partitionKeyRangeId)
        {
            this.partitionKeyRangeId = partitionKeyRangeId;
            return this;
        }

        public Builder useGatewayMode(boolean useGatewayMode)
        {
            this.useGatewayMode = useGatewayMode;
            return this;
        }

        public Builder useThinClient(boolean useThinClient)
        {
            this.useThinClient = useThinClient;
            return this;
        }

        public RequestMessage build()
        {
            return new RequestMessage(this);
        }
    }
}
