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

package org.relaymesh.secrets.db;

import org.relaymesh.secrets.model.SecretType;

import java.time.Instant;


/**
 * Metadata for a secret held in the local store. The payload is not included.
 */
public final class StoredSecret {

    private final String secretId;
    private final String team;
    private final String name;
    private final SecretType secretType;
    private final int version;
    private final String keyVersion;
    private final Instant createdAt;
    private final Instant updatedAt;

    public StoredSecret(
            String secretId, String team, String name, SecretType secretType,
            int version, String keyVersion, Instant createdAt, Instant updatedAt) {

        this.secretId = secretId;
        this.team = team;
        this.name = name;
        this.secretType = secretType;
        this.version = version;
        this.keyVersion = keyVersion;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String secretId() {
        return secretId;
    }

    public String team() {
        return team;
    }

    public String name() {
        return name;
    }

    public SecretType secretType() {
        return secretType;
    }

    public int version() {
        return version;
    }

    public String keyVersion() {
        return keyVersion;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "StoredSecret{" + secretId + ", team=" + team + ", name=" + name +
                ", type=" + secretType + ", version=" + version + "}";
    }
}
