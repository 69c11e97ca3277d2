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

import java.util.Objects;


/**
 * An opaque credential value, held as base64 text.
 */
public final class GenericSecretSpec extends SecretSpec {

    private final String secret;

    @JsonCreator
    public GenericSecretSpec(@JsonProperty("secret") String secret) {
        this.secret = secret;
    }

    @JsonProperty("secret")
    public String getSecret() {
        return secret;
    }

    @Override
    public SecretType secretType() {
        return SecretType.GENERIC_SECRET;
    }

    @Override
    public void validate() {

        if (isBlank(secret))
            throw new ESecretValidation("Generic secret value is empty");

        decodeBase64(secret, "secret");
    }

    @Override
    public boolean equals(Object other) {

        if (this == other) return true;
        if (!(other instanceof GenericSecretSpec)) return false;

        return Objects.equals(secret, ((GenericSecretSpec) other).secret);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(secret);
    }

    @Override
    public String toString() {
        return "GenericSecretSpec{secret=" + REDACTED + "}";
    }
}
