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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;


/**
 * Wrapper for sensitive text that is never printed.
 */
public final class SecretString {

    private final String value;

    public SecretString(String value) {
        this.value = value;
    }

    public String expose() {
        return value;
    }

    public boolean isEmpty() {
        return value == null || value.isEmpty();
    }

    @Override
    public boolean equals(Object other) {

        if (this == other) return true;
        if (!(other instanceof SecretString)) return false;

        var that = (SecretString) other;

        if (value == null || that.value == null)
            return value == that.value;

        return MessageDigest.isEqual(
                value.getBytes(StandardCharsets.UTF_8),
                that.value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return SecretSpec.REDACTED;
    }
}
