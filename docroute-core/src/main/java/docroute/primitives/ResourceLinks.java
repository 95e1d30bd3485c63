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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.io.BaseEncoding;

import java.util.List;

/**
 * Helpers for resource links of the form {@code dbs/{database}/colls/{collection}}. A link is id based when its
 * database and collection segments are resource ids, and name based otherwise. Names can be re-pointed at a new
 * collection by a delete and re-create; resource ids cannot.
 */
public class ResourceLinks
{
    private static final Splitter SEGMENTS = Splitter.on('/').omitEmptyStrings();
    private static final int DATABASE_RID_BYTES = 4;
    private static final int COLLECTION_RID_BYTES = 8;

    private ResourceLinks() {}

    public static String trim(String link)
    {
        return CharMatcher.is('/').trimFrom(link);
    }

    public static boolean isNameBased(String link)
    {
        List<String> segments = SEGMENTS.splitToList(link);
        if (segments.size() < 2 || !"dbs".equalsIgnoreCase(segments.get(0)))
            return false;

        if (!isResourceId(segments.get(1), DATABASE_RID_BYTES))
            return true;

        return segments.size() >= 4 && "colls".equalsIgnoreCase(segments.get(2))
               && !isResourceId(segments.get(3), COLLECTION_RID_BYTES);
    }

    /**
     * The {@code dbs/{database}/colls/{collection}} prefix of a link to a collection or anything below it
     */
    public static String collectionLink(String link)
    {
        List<String> segments = SEGMENTS.splitToList(link);
        if (segments.size() < 4)
            throw new IllegalArgumentException("Not a collection link: " + link);
        return String.join("/", segments.subList(0, 4));
    }

    static boolean isResourceId(String segment, int expectedBytes)
    {
        try
        {
            return BaseEncoding.base64().decode(segment.replace('-', '/')).length == expectedBytes;
        }
        catch (IllegalArgumentException e)
        {
            return false;
        }
    }
}
