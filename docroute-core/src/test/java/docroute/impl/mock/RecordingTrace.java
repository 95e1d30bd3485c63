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

package docroute.impl.mock;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.common.collect.Maps;

import docroute.api.Trace;

/**
 * Collects the name of every child opened and every datum added, across the whole tree
 */
public class RecordingTrace implements Trace
{
    public final List<String> children;
    public final List<Map.Entry<String, Object>> data;
    private volatile boolean closed;

    public RecordingTrace()
    {
        this(new CopyOnWriteArrayList<>(), new CopyOnWriteArrayList<>());
    }

    private RecordingTrace(List<String> children, List<Map.Entry<String, Object>> data)
    {
        this.children = children;
        this.data = data;
    }

    @Override
    public Trace startChild(String name, Component component, Level level)
    {
        children.add(name);
        return new RecordingTrace(children, data);
    }

    @Override
    public void addDatum(String key, Object value)
    {
        data.add(Maps.immutableEntry(key, value));
    }

    public Object datum(String key)
    {
        for (Map.Entry<String, Object> entry : data)
        {
            if (entry.getKey().equals(key))
                return entry.getValue();
        }
        return null;
    }

    public boolean isClosed()
    {
        return closed;
    }

    @Override
    public void close()
    {
        closed = true;
    }
}
