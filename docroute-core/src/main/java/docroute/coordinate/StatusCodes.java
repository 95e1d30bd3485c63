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

public class StatusCodes
{
    private StatusCodes() {}

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int REQUEST_TIMEOUT = 408;
    public static final int GONE = 410;
    public static final int TOO_MANY_REQUESTS = 429;
    public static final int SERVICE_UNAVAILABLE = 503;

    public static final int SUBSTATUS_UNKNOWN = 0;
    public static final int SUBSTATUS_NAME_CACHE_IS_STALE = 1000;
    public static final int SUBSTATUS_PARTITION_KEY_RANGE_GONE = 1002;
    public static final int SUBSTATUS_COMPLETING_SPLIT = 1007;
    public static final int SUBSTATUS_COMPLETING_PARTITION_MIGRATION = 1008;

    public static boolean isSuccess(int statusCode)
    {
        return statusCode >= 200 && statusCode < 300;
    }
}
