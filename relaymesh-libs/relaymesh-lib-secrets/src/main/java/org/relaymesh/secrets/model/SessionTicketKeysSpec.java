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

package org.relaymesh.secrets.model;

import org.relaymesh.common.exception.ESecretValidation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;


/**
 * TLS session ticket keys. Only accepted with an explicit {@code "type"} discriminator,
 * never inferred from an untagged payload.
 */
public final class SessionTicketKeysSpec extends SecretSpec {

    private final List<SessionTicketKey> keys;

    @JsonCreator
    public SessionTicketKeysSpec(@JsonProperty("keys") List<SessionTicketKey> keys) {
        this.keys = keys != null ? List.copyOf(keys) : List.of();
    }

    @JsonProperty("keys")
    public List<SessionTicketKey> getKeys() {
        return keys;
    }

    @Override
    public SecretType secretType() {
        return SecretType.SESSION_TICKET_KEYS;
    }

    @Override
    public void validate() {

        if (keys.isEmpty())
            throw new ESecretValidation("Session ticket keys list is empty");

        for (var key : keys) {

            if (isBlank(key.getKey()))
                throw new ESecretValidation(String.format("Session ticket key [%s] is empty", key.getName()));

            var decoded = decodeBase64(key.getKey(), "key");

            if (decoded.length != SessionTicketKey.KEY_LENGTH)
                throw new ESecretValidation(String.format(
                        "Session ticket key [%s] must be %d bytes, got %d",
                        key.getName(), SessionTicketKey.KEY_LENGTH, decoded.length));
        }
    }

    @Override
    public boolean equals(Object other) {

        if (this == other) return true;
        if (!(other instanceof SessionTicketKeysSpec)) return false;

        return Objects.equals(keys, ((SessionTicketKeysSpec) other).keys);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(keys);
    }

    @Override
    public String toString() {
        return "SessionTicketKeysSpec{keys=" + keys + "}";
    }
}
