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

public class BadRequestException extends DocumentClientException
{
    public BadRequestException(String message)
    {
        this(message, null, 0, Headers.EMPTY);
    }

    public BadRequestException(String message, @Nullable String activityId, double requestCharge, Headers headers)
    {
        super(message, StatusCodes.BAD_REQUEST, StatusCodes.SUBSTATUS_UNKNOWN, activityId, requestCharge, headers);
    }
}
