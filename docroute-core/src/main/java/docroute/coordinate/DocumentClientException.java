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

package docroute.coordinate;

import javax.annotation.Nullable;

import docroute.messages.Headers;

/**
 * A request the backend answered with a non-success status. Carries what a caller needs to choose between
 * retrying and giving up: status, substatus, activity id and the charge already incurred.
 */
public class DocumentClientException extends RuntimeException
{
    private final int statusCode;
    private final int subStatusCode;
    private final @Nullable String activityId;
    private final double requestCharge;
    private final Headers headers;

    public DocumentClientException(String message, int statusCode, int subStatusCode, @Nullable String activityId, double requestCharge)
    {
        this(message, statusCode, subStatusCode, activityId, requestCharge, Headers.EMPTY);
    }

    public DocumentClientException(String message, int statusCode, int subStatusCode, @Nullable String activityId, double requestCharge, Headers headers)
    {
        super(message);
        this.statusCode = statusCode;
        this.subStatusCode = subStatusCode;
        this.activityId = activityId;
        this.requestCharge = requestCharge;
        this.headers = headers;
    }

    /**
     * Creates the most specific exception for the status and substatus pair
     */
    public static DocumentClientException create(String message, int statusCode, int subStatusCode, @Nullable String activityId, double requestCharge, Headers headers)
    {
        switch (statusCode)
        {
            case StatusCodes.BAD_REQUEST:
                return new BadRequestException(message, activityId, requestCharge, headers);
            case StatusCodes.NOT_FOUND:
                return new NotFoundException(message, subStatusCode, activityId, requestCharge, headers);
            case StatusCodes.GONE:
                switch (subStatusCode)
                {
                    case StatusCodes.SUBSTATUS_PARTITION_KEY_RANGE_GONE:
                    case StatusCodes.SUBSTATUS_COMPLETING_SPLIT:
                    case StatusCodes.SUBSTATUS_COMPLETING_PARTITION_MIGRATION:
                        return new PartitionKeyRangeGoneException(message, subStatusCode, activityId, requestCharge, headers);
                    case StatusCodes.SUBSTATUS_NAME_CACHE_IS_STALE:
                        return new StaleRoutingCacheException(message, activityId, requestCharge, headers);
                    default:
                        return new GoneException(message, subStatusCode, activityId, requestCharge, headers);
                }
            default:
                return new DocumentClientException(message, statusCode, subStatusCode, activityId, requestCharge, headers);
        }
    }

    public int statusCode()
    {
        return statusCode;
    }

    public int subStatusCode()
    {
        return subStatusCode;
    }

    public @Nullable String activityId()
    {
        return activityId;
    }

    public double requestCharge()
    {
        return requestCharge;
    }

    public Headers headers()
    {
        return headers;
    }

    /**
     * Whether re-entering the operation (after refreshing routing state) may succeed
     */
    public boolean isRetryable()
    {
        return statusCode == StatusCodes.TOO_MANY_REQUESTS
               || statusCode == StatusCodes.REQUEST_TIMEOUT
               || statusCode == StatusCodes.SERVICE_UNAVAILABLE;
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + "{status=" + statusCode + ", substatus=" + subStatusCode
               + ", activityId=" + activityId + ", charge=" + requestCharge + ", message=" + getMessage() + '}';
    }
}
