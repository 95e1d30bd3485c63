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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartitionKeyDefinitionTest
{
    private static final PartitionKeyDefinition BY_CUSTOMER = PartitionKeyDefinition.hash("/customerId");
    private static final PartitionKeyDefinition BY_TENANT_AND_USER =
        new PartitionKeyDefinition(ImmutableList.of("/tenantId", "/userId"), PartitionKeyDefinition.Kind.MULTI_HASH, 2, false);

    @Test
    void effectivePartitionKeyIsStableAndInsideKeySpace()
    {
        String epk = BY_CUSTOMER.effectivePartitionKey(PartitionKey.of("c-42"));
        Assertions.assertEquals(epk, BY_CUSTOMER.effectivePartitionKey(PartitionKey.of("c-42")));
        Assertions.assertNotEquals(epk, BY_CUSTOMER.effectivePartitionKey(PartitionKey.of("c-43")));
        Assertions.assertTrue(EpkRange.FULL.contains(epk));
        assertThat(epk).hasSize(32).matches("[0-9A-F]+");
    }

    @Test
    void componentTypesHashDifferently()
    {
        String asString = BY_CUSTOMER.effectivePartitionKey(PartitionKey.of("1"));
        String asNumber = BY_CUSTOMER.effectivePartitionKey(PartitionKey.of(1));
        String asBoolean = BY_CUSTOMER.effectivePartitionKey(PartitionKey.of(true));
        assertThat(ImmutableList.of(asString, asNumber, asBoolean)).doesNotHaveDuplicates();
    }

    @Test
    void fullKeyIsAPoint()
    {
        EpkRange range = BY_CUSTOMER.effectivePartitionKeyRange(PartitionKey.of("c-42"));
        Assertions.assertTrue(range.isSingleValue());
    }

    @Test
    void hierarchicalPrefixSpansItsChildren()
    {
        EpkRange prefix = BY_TENANT_AND_USER.effectivePartitionKeyRange(PartitionKey.of("acme"));
        Assertions.assertFalse(prefix.isSingleValue());

        String full = BY_TENANT_AND_USER.effectivePartitionKey(PartitionKey.of("acme", "alice"));
        Assertions.assertTrue(prefix.contains(full));
        Assertions.assertTrue(EpkRange.FULL.contains(full));

        String other = BY_TENANT_AND_USER.effectivePartitionKey(PartitionKey.of("globex", "alice"));
        Assertions.assertFalse(prefix.contains(other));
    }

    @Test
    void hierarchicalKeyMayHoldNull()
    {
        String epk = BY_TENANT_AND_USER.effectivePartitionKey(PartitionKey.of("acme", null));
        Assertions.assertNotEquals(epk, BY_TENANT_AND_USER.effectivePartitionKey(PartitionKey.of("acme", PartitionKey.UNDEFINED)));
    }

    @Test
    void noneResolvesToUndefined()
    {
        Assertions.assertEquals(PartitionKey.of(PartitionKey.UNDEFINED), BY_CUSTOMER.noneValue());
        Assertions.assertEquals(BY_CUSTOMER.effectivePartitionKey(PartitionKey.of(PartitionKey.UNDEFINED)),
                                BY_CUSTOMER.effectivePartitionKey(PartitionKey.NONE));

        PartitionKeyDefinition system = new PartitionKeyDefinition(ImmutableList.of("/_partitionKey"), PartitionKeyDefinition.Kind.HASH, 2, true);
        Assertions.assertEquals(PartitionKey.of(""), system.noneValue());
    }

    @Test
    void tooManyComponentsIsRejected()
    {
        assertThatThrownBy(() -> BY_CUSTOMER.effectivePartitionKey(PartitionKey.of("a", "b")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void partitionKeyHeaderForm()
    {
        Assertions.assertEquals("[\"c-42\"]", PartitionKey.of("c-42").toJson());
        Assertions.assertEquals("[\"acme\",7,true,null]", PartitionKey.of("acme", 7, true, null).toJson());
        Assertions.assertEquals("[{}]", PartitionKey.of(PartitionKey.UNDEFINED).toJson());
        assertThatThrownBy(() -> PartitionKey.of(new Object())).isInstanceOf(IllegalArgumentException.class);
    }
}
