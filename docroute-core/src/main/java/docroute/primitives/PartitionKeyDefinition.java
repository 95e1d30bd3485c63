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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Bytes;

import docroute.utils.Invariants;

/**
 * How items of a collection are mapped onto the effective partition key space
 */
public final class PartitionKeyDefinition
{
    public enum Kind { HASH, MULTI_HASH }

    private static final HashFunction HASH = Hashing.murmur3_128();
    private static final BaseEncoding HEX = BaseEncoding.base16().upperCase();

    private static final byte UNDEFINED_MARKER = 0x00;
    private static final byte NULL_MARKER = 0x01;
    private static final byte FALSE_MARKER = 0x02;
    private static final byte TRUE_MARKER = 0x03;
    private static final byte NUMBER_MARKER = 0x05;
    private static final byte STRING_MARKER = 0x08;
    private static final byte STRING_TERMINATOR = (byte) 0xFF;

    private final List<String> paths;
    private final Kind kind;
    private final int version;
    private final boolean systemKey;

    public PartitionKeyDefinition(List<String> paths, Kind kind, int version, boolean systemKey)
    {
        Invariants.checkArgument(!paths.isEmpty(), "A partition key definition needs at least one path");
        Invariants.checkArgument(kind == Kind.MULTI_HASH || paths.size() == 1, "Only hierarchical partition keys may have multiple paths");
        this.paths = ImmutableList.copyOf(paths);
        this.kind = Objects.requireNonNull(kind);
        this.version = version;
        this.systemKey = systemKey;
    }

    public static PartitionKeyDefinition hash(String path)
    {
        return new PartitionKeyDefinition(ImmutableList.of(path), Kind.HASH, 2, false);
    }

    public List<String> paths()
    {
        return paths;
    }

    public Kind kind()
    {
        return kind;
    }

    public int version()
    {
        return version;
    }

    public boolean isSystemKey()
    {
        return systemKey;
    }

    /**
     * The value {@link PartitionKey#NONE} stands for in this collection: an empty key for system keyed
     * collections, otherwise undefined for every path
     */
    public PartitionKey noneValue()
    {
        Object[] components = new Object[paths.size()];
        for (int i = 0 ; i < components.length ; i++)
            components[i] = systemKey ? "" : PartitionKey.UNDEFINED;
        return PartitionKey.of(components);
    }

    public String effectivePartitionKey(PartitionKey key)
    {
        if (key.isNone())
            key = noneValue();

        List<Object> components = key.components();
        Invariants.checkArgument(components.size() <= paths.size(), "Partition key %s has more components than paths %s", key, paths);
        if (kind == Kind.HASH)
            return hash(encode(components));

        StringBuilder epk = new StringBuilder();
        for (Object component : components)
            epk.append(hash(encode(Collections.singletonList(component))));
        return epk.toString();
    }

    public EpkRange effectivePartitionKeyRange(PartitionKey key)
    {
        String epk = effectivePartitionKey(key);
        if (kind == Kind.MULTI_HASH && key.components().size() < paths.size())
        {
            // a prefix of a hierarchical key spans every key sharing that prefix
            return new EpkRange(epk, epk + EpkRange.MAXIMUM_EXCLUSIVE, true, false);
        }
        return EpkRange.point(epk);
    }

    private static byte[] encode(List<Object> components)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Object component : components)
        {
            if (component == PartitionKey.UNDEFINED) out.write(UNDEFINED_MARKER);
            else if (component == null) out.write(NULL_MARKER);
            else if (component instanceof Boolean) out.write((Boolean) component ? TRUE_MARKER : FALSE_MARKER);
            else if (component instanceof Number)
            {
                out.write(NUMBER_MARKER);
                long bits = Double.doubleToLongBits(((Number) component).doubleValue());
                for (int shift = 0 ; shift < 64 ; shift += 8)
                    out.write((int) (bits >>> shift));
            }
            else
            {
                out.write(STRING_MARKER);
                byte[] utf8 = ((String) component).getBytes(StandardCharsets.UTF_8);
                out.write(utf8, 0, utf8.length);
                out.write(STRING_TERMINATOR);
            }
        }
        return out.toByteArray();
    }

    private static String hash(byte[] bytes)
    {
        byte[] hash = HASH.hashBytes(bytes).asBytes();
        Bytes.reverse(hash);
        // keeps every effective partition key below the exclusive maximum
        hash[0] &= 0x3F;
        return HEX.encode(hash);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartitionKeyDefinition that = (PartitionKeyDefinition) o;
        return version == that.version && systemKey == that.systemKey && paths.equals(that.paths) && kind == that.kind;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(paths, kind, version, systemKey);
    }

    @Override
    public String toString()
    {
        return "PartitionKeyDefinition{" + kind + paths + ", v" + version + '}';
    }
}
