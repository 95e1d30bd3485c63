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

package docroute.utils;

import java.util.Collection;
import java.util.function.Predicate;

import javax.annotation.Nullable;

public class Invariants
{
    private Invariants() {}

    public static IllegalStateException illegalState(String msg)
    {
        return new IllegalStateException(msg);
    }

    public static IllegalStateException illegalState(String fmt, Object... args)
    {
        return new IllegalStateException(String.format(fmt, args));
    }

    public static void checkState(boolean condition)
    {
        if (!condition)
            throw new IllegalStateException();
    }

    public static void checkState(boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalStateException(msg);
    }

    public static void checkState(boolean condition, String fmt, Object... args)
    {
        if (!condition)
            throw new IllegalStateException(String.format(fmt, args));
    }

    public static <T> T nonNull(T param)
    {
        if (param == null)
            throw new NullPointerException();
        return param;
    }

    public static <T> T nonNull(T param, String name)
    {
        if (param == null)
            throw new NullPointerException(name);
        return param;
    }

    public static String nonEmpty(@Nullable String param, String name)
    {
        if (param == null || param.isEmpty())
            throw new IllegalArgumentException(name + " must not be null or empty");
        return param;
    }

    /**
     * Rejects a null or empty collection, or one holding a null element
     */
    public static <C extends Collection<?>> C nonEmptyNoNulls(@Nullable C param, String name)
    {
        if (param == null || param.isEmpty())
            throw new IllegalArgumentException(name + " must not be null or empty");
        for (Object o : param)
        {
            if (o == null)
                throw new IllegalArgumentException(name + " must not contain null elements");
        }
        return param;
    }

    public static void checkArgument(boolean condition)
    {
        if (!condition)
            throw new IllegalArgumentException();
    }

    public static void checkArgument(boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalArgumentException(msg);
    }

    public static void checkArgument(boolean condition, String fmt, Object... args)
    {
        if (!condition)
            throw new IllegalArgumentException(String.format(fmt, args));
    }

    public static <T> T checkArgument(T param, boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalArgumentException(msg);
        return param;
    }

    public static <T> T checkArgument(T param, Predicate<T> condition, String msg)
    {
        if (!condition.test(param))
            throw new IllegalArgumentException(msg);
        return param;
    }
}
