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

package org.relaymesh.secrets.crypto;

import java.util.Arrays;
import java.util.Objects;


/**
 * Ciphertext (with the GCM tag appended), the nonce it was produced with and the version of the key used.
 *
 * <p>Instances are immutable, a rewritten secret gets a new record with a new nonce.</p>
 */
public final class EncryptedSecret {

    private final byte[] ciphertext;
    private final byte[] nonce;
    private final String keyVersion;

    public EncryptedSecret(byte[] ciphertext, byte[] nonce, String keyVersion) {
        this.ciphertext = ciphertext.clone();
        this.nonce = nonce.clone();
        this.keyVersion = Objects.requireNonNull(keyVersion);
    }

    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    public byte[] nonce() {
        return nonce.clone();
    }

    public String keyVersion() {
        return keyVersion;
    }

    @Override
    public boolean equals(Object other) {

        if (this == other) return true;
        if (!(other instanceof EncryptedSecret)) return false;

        var that = (EncryptedSecret) other;

        return Arrays.equals(ciphertext, that.ciphertext) &&
                Arrays.equals(nonce, that.nonce) &&
                keyVersion.equals(that.keyVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(ciphertext), Arrays.hashCode(nonce), keyVersion);
    }

    @Override
    public String toString() {
        return "EncryptedSecret{" + ciphertext.length + " bytes, keyVersion=" + keyVersion + "}";
    }
}
