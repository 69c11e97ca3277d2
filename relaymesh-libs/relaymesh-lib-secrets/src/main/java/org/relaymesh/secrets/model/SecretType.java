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
import com.fasterxml.jackson.annotation.JsonValue;


/**
 * The shape a {@link SecretSpec} must have.
 *
 * <p>Each type has a stable wire name, used as the JSON discriminator, in the
 * database {@code secret_type} column and as part of cache keys.</p>
 */
public enum SecretType {

    GENERIC_SECRET("generic_secret"),
    TLS_CERTIFICATE("tls_certificate"),
    CERTIFICATE_VALIDATION_CONTEXT("certificate_validation_context"),
    SESSION_TICKET_KEYS("session_ticket_keys");

    private final String wireName;

    SecretType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SecretType fromWireName(String wireName) {

        if (wireName != null) {
            for (var type : values()) {
                if (type.wireName.equalsIgnoreCase(wireName.trim()))
                    return type;
            }
        }

        throw new ESecretValidation(String.format("Unknown secret type: [%s]", wireName));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
