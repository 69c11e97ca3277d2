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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Base64;


/**
 * A resolved secret payload, one subclass per {@link SecretType}.
 *
 * <p>In JSON the variant is identified by the {@code "type"} property, holding the
 * wire name of the secret type. Subclasses are immutable and never include secret
 * material in {@link #toString()}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = SecretSpec.TYPE_PROPERTY)
@JsonSubTypes({
        @JsonSubTypes.Type(value = GenericSecretSpec.class, name = "generic_secret"),
        @JsonSubTypes.Type(value = TlsCertificateSpec.class, name = "tls_certificate"),
        @JsonSubTypes.Type(value = CertificateValidationContextSpec.class, name = "certificate_validation_context"),
        @JsonSubTypes.Type(value = SessionTicketKeysSpec.class, name = "session_ticket_keys")})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class SecretSpec {

    public static final String TYPE_PROPERTY = "type";

    static final String REDACTED = "[REDACTED]";
    static final String PEM_MARKER = "-----BEGIN";

    SecretSpec() {}

    public abstract SecretType secretType();

    /**
     * Check the payload has the shape required for its type.
     *
     * @throws ESecretValidation if the payload is not valid
     */
    public abstract void validate();

    static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    static byte[] decodeBase64(String value, String field) {

        try {
            return Base64.getDecoder().decode(value);
        }
        catch (IllegalArgumentException e) {
            throw new ESecretValidation(String.format("Field [%s] is not valid base64", field));
        }
    }
}
