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

import java.util.Map;
import javax.annotation.Nullable;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend query metrics, parsed from the {@code key=value;key=value} text of the query metrics header.
 * Malformed entries are skipped; metrics are observational and never fail a query.
 */
public final class QueryMetrics
{
    private static final Logger logger = LoggerFactory.getLogger(QueryMetrics.class);
    private static final Splitter ENTRIES = Splitter.on(';').trimResults().omitEmptyStrings();

    public static final String TOTAL_EXECUTION_TIME_MS = "totalExecutionTimeInMs";
    public static final String RETRIEVED_DOCUMENT_COUNT = "retrievedDocumentCount";
    public static final String RETRIEVED_DOCUMENT_SIZE = "retrievedDocumentSize";
    public static final String OUTPUT_DOCUMENT_COUNT = "outputDocumentCount";
    public static final String INDEX_HIT_RATIO = "indexUtilizationRatio";

    public static final QueryMetrics EMPTY = new QueryMetrics(ImmutableMap.of());

    private final Map<String, Double> values;

    private QueryMetrics(Map<String, Double> values)
    {
        this.values = values;
    }

    public static QueryMetrics parse(@Nullable String text)
    {
        if (text == null || text.isEmpty())
            return EMPTY;

        ImmutableMap.Builder<String, Double> builder = ImmutableMap.builder();
        for (String entry : ENTRIES.split(text))
        {
            int eq = entry.indexOf('=');
            if (eq <= 0)
            {
                logger.trace("Skipping malformed query metric {}", entry);
                continue;
            }
            try
            {
                builder.put(entry.substring(0, eq).trim(), Double.parseDouble(entry.substring(eq + 1).trim()));
            }
            catch (NumberFormatException e)
            {
                logger.trace("Skipping malformed query metric {}", entry, e);
            }
        }
        return new QueryMetrics(builder.buildKeepingLast());
    }

    public Map<String, Double> values()
    {
        return values;
    }

    public double get(String name)
    {
        Double value = values.get(name);
        return value == null ? 0d : value;
    }

    public double totalExecutionTimeMs()
    {
        return get(TOTAL_EXECUTION_TIME_MS);
    }

    public long retrievedDocumentCount()
    {
        return (long) get(RETRIEVED_DOCUMENT_COUNT);
    }

    public long outputDocumentCount()
    {
        return (long) get(OUTPUT_DOCUMENT_COUNT);
    }

    @Override
    public String toString()
    {
        return "QueryMetrics" + values;
    }
}
