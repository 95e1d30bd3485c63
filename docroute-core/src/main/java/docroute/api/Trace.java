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

package docroute.api;

/**
 * Hierarchical tracing sink. Every suspending step opens a child; tracing is observational only and never
 * affects control flow.
 */
public interface Trace extends AutoCloseable
{
    enum Component { ROUTING, QUERY, JSON, TRANSPORT }
    enum Level { VERBOSE, INFO, WARNING, ERROR }

    Trace NO_OP = new Trace()
    {
        @Override
        public Trace startChild(String name, Component component, Level level)
        {
            return this;
        }

        @Override
        public void addDatum(String key, Object value)
        {
        }

        @Override
        public void close()
        {
        }
    };

    Trace startChild(String name, Component component, Level level);

    void addDatum(String key, Object value);

    @Override
    void close();
}
