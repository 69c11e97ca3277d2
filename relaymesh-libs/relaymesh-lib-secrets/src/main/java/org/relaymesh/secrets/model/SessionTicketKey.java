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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;


public final class SessionTicketKey {

    /** Decoded size of a TLS session ticket key **/
    public static final int KEY_LENGTH = 80;

    private final String name;
    private final String key;

    @JsonCreator
    public SessionTicketKey(
            @JsonProperty("name") String name,
            @JsonProperty("key") String key) {

        this.name = name;
        this.key = key;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    /** Base64 encoding of the raw key bytes **/
    @JsonProperty("key")
    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object other) {

        if (this == other) return true;
        if (!(other instanceof SessionTicketKey)) return false;

        var that = (SessionTicketKey) other;
        return Objects.equals(name, that.name) && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, key);
    }

    @Override
    public String toString() {
        return "SessionTicketKey{name=" + name + ", key=" + SecretSpec.REDACTED + "}";
    }
}
