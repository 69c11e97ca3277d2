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

import org.relaymesh.secrets.model.SecretString;

import java.time.Instant;


/**
 * A freshly issued certificate with its private key. Never cached or persisted.
 */
public final class GeneratedCertificate {

    private final String certificate;
    private final SecretString privateKey;
    private final String caChain;
    private final String serialNumber;
    private final Instant expiresAt;
    private final String spiffeUri;

    public GeneratedCertificate(
            String certificate, SecretString privateKey, String caChain,
            String serialNumber, Instant expiresAt, String spiffeUri) {

        this.certificate = certificate;
        this.privateKey = privateKey;
        this.caChain = caChain;
        this.serialNumber = serialNumber;
        this.expiresAt = expiresAt;
        this.spiffeUri = spiffeUri;
    }

    public String certificate() {
        return certificate;
    }

    public SecretString privateKey() {
        return privateKey;
    }

    public String caChain() {
        return caChain;
    }

    public String serialNumber() {
        return serialNumber;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public String spiffeUri() {
        return spiffeUri;
    }

    @Override
    public String toString() {

        return "GeneratedCertificate{" +
                "serialNumber=" + serialNumber +
                ", spiffeUri=" + spiffeUri +
                ", expiresAt=" + expiresAt +
                ", privateKey=" + privateKey +
                "}";
    }
}
