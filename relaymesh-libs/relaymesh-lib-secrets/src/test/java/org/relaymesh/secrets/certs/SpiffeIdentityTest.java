/*
 * Licensed to the RelayMesh project under one or more contributor
 * license agreements. See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * The RelayMesh project licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.relaymesh.secrets.certs;

import org.relaymesh.common.exception.ESecretValidation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;


class SpiffeIdentityTest {

    @Test
    void buildUri() {

        var uri = SpiffeIdentity.buildUri("mesh.example.org", "payments", "proxy-7f3a");

        assertEquals("spiffe://mesh.example.org/team/payments/proxy/proxy-7f3a", uri);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a/b", "user@host", "ns:name", "..", "a..b"})
    void invalidComponents(String component) {

        assertThrows(ESecretValidation.class, () -> SpiffeIdentity.buildUri("mesh.example.org", component, "w1"));
        assertThrows(ESecretValidation.class, () -> SpiffeIdentity.buildUri("mesh.example.org", "team", component));
    }

    @Test
    void nullComponent() {

        assertThrows(ESecretValidation.class, () -> SpiffeIdentity.buildUri("mesh.example.org", null, "w1"));
    }

    @Test
    void lengthLimit() {

        var maxLength = "a".repeat(SpiffeIdentity.MAX_COMPONENT_LENGTH);
        var tooLong = maxLength + "a";

        assertDoesNotThrow(() -> SpiffeIdentity.validateComponent("team", maxLength));
        assertThrows(ESecretValidation.class, () -> SpiffeIdentity.validateComponent("team", tooLong));
    }
}
