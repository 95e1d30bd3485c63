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

import java.util.UUID;

import docroute.utils.Invariants;

public final class AdditionalRequestHeaders
{
    private final UUID correlatedActivityId;
    private final boolean isContinuationExpected;
    private final boolean optimisticDirectExecute;

    public AdditionalRequestHeaders(UUID correlatedActivityId, boolean isContinuationExpected, boolean optimisticDirectExecute)
    {
        this.correlatedActivityId = Invariants.nonNull(correlatedActivityId, "correlatedActivityId");
        this.isContinuationExpected = isContinuationExpected;
        this.optimisticDirectExecute = optimisticDirectExecute;
    }

    public UUID correlatedActivityId()
    {
        return correlatedActivityId;
    }

    public boolean isContinuationExpected()
    {
        return isContinuationExpected;
    }

    public boolean optimisticDirectExecute()
    {
        return optimisticDirectExecute;
    }

    @Override
    public String toString()
    {
        return "AdditionalRequestHeaders{" + correlatedActivityId + ", continuationExpected=" + isContinuationExpected
               + ", optimisticDirectExecute=" + optimisticDirectExecute + '}';
    }
}
