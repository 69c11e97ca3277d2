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

package org.relaymesh.secrets.cache;

import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.model.SecretType;

import java.util.Objects;


/**
 * Cache key made of backend type, reference and expected secret type.
 *
 * <p>The expected type is part of the key, so a lookup for one type is never answered
 * by an entry cached for another type under the same reference.</p>
 */
public final class CacheKey {

    private final String backendType;
    private final String reference;
    private final String secretType;

    public CacheKey(String backendType, String reference, String secretType) {
        this.backendType = Objects.requireNonNull(backendType);
        this.reference = Objects.requireNonNull(reference);
        this.secretType = Objects.requireNonNull(secretType);
    }

    public static CacheKey of(SecretBackendType backendType, String reference, SecretType secretType) {
        return new CacheKey(backendType.wireName(), reference, secretType.wireName());
    }

    public String backendType() {
        return backendType;
    }

    public String reference() {
        return reference;
    }

    public String secretType() {
        return secretType;
    }

    @Override
    public boolean equals(Object other) {

        if (this == other) return true;
        if (!(other instanceof CacheKey)) return false;

        var that = (CacheKey) other;

        return backendType.equals(that.backendType) &&
                reference.equals(that.reference) &&
                secretType.equals(that.secretType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backendType, reference, secretType);
    }

    @Override
    public String toString() {
        return backendType + ":" + reference + ":" + secretType;
    }
}
