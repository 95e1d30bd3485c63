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

public class HttpHeaders
{
    private HttpHeaders() {}

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String ACTIVITY_ID = "x-ms-activity-id";
    public static final String REQUEST_CHARGE = "x-ms-request-charge";
    public static final String CONTINUATION = "x-ms-continuation";
    public static final String CONTINUATION_TOKEN = "x-ms-continuationtoken";
    public static final String SUB_STATUS = "x-ms-substatus";
    public static final String SESSION_TOKEN = "x-ms-session-token";
    public static final String PAGE_SIZE = "x-ms-max-item-count";
    public static final String PARTITION_KEY = "x-ms-documentdb-partitionkey";
    public static final String PARTITION_KEY_RANGE_ID = "x-ms-documentdb-partitionkeyrangeid";
    public static final String IS_QUERY = "x-ms-documentdb-isquery";
    public static final String IS_CONTINUATION_EXPECTED = "x-ms-documentdb-query-iscontinuationexpected";
    public static final String QUERY_METRICS = "x-ms-documentdb-query-metrics";
    public static final String POPULATE_QUERY_METRICS = "x-ms-documentdb-populatequerymetrics";
    public static final String IS_QUERY_PLAN_REQUEST = "x-ms-cosmos-is-query-plan-request";
    public static final String SUPPORTED_QUERY_FEATURES = "x-ms-cosmos-supported-query-features";
    public static final String QUERY_VERSION = "x-ms-cosmos-query-version";
    public static final String QUERY_EXECUTION_INFO = "x-ms-cosmos-query-execution-info";
    public static final String CORRELATED_ACTIVITY_ID = "x-ms-cosmos-correlated-activityid";
    public static final String OPTIMISTIC_DIRECT_EXECUTE = "x-ms-cosmos-query-optimisticdirectexecute";
    public static final String START_EPK = "x-ms-start-epk";
    public static final String END_EPK = "x-ms-end-epk";

    public static final String QUERY_JSON = "application/query+json";
    public static final String QUERY_VERSION_1_0 = "1.0";
    public static final String TRUE = "True";
    public static final String FALSE = "False";

    public static String bool(boolean value)
    {
        return value ? TRUE : FALSE;
    }
}
