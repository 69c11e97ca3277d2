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

import org.relaymesh.common.exception.EDecryption;
import org.relaymesh.common.exception.EUnexpected;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;


/**
 * AES-256-GCM envelope encryption for secrets held in the local store.
 *
 * <p>Every call to {@link #encrypt(byte[])} uses a fresh random 12 byte nonce. The 16 byte
 * authentication tag is appended to the ciphertext. All decryption failures are reported as
 * the same {@link EDecryption}, whatever the cause.</p>
 *
 * <p>Records carry the version of the key that produced them. Keys for retired versions
 * stay available for decryption until the record is re-encrypted, see {@link #reEncrypt(EncryptedSecret)}.
 * No rotation is scheduled here.</p>
 */
public class SecretEncryption {

    public static final int NONCE_LENGTH = SingleUseNonce.NONCE_LENGTH;
    public static final int TAG_LENGTH = 16;

    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final String KEY_ALGORITHM = "AES";
    private static final String DECRYPTION_FAILED = "Secret decryption failed";

    private static final Logger log = LoggerFactory.getLogger(SecretEncryption.class);

    private final String keyVersion;
    private final SecretKey activeKey;
    private final Map<String, SecretKey> keys;
    private final SecureRandom random;

    public SecretEncryption(EncryptionConfig config) {

        this.keyVersion = config.keyVersion();
        this.activeKey = new SecretKeySpec(config.key(), KEY_ALGORITHM);
        this.keys = new HashMap<>();
        this.random = new SecureRandom();

        keys.put(keyVersion, activeKey);

        for (var retired : config.retiredKeys().entrySet())
            keys.put(retired.getKey(), new SecretKeySpec(retired.getValue(), KEY_ALGORITHM));

        log.info("Secret encryption ready, key version [{}], {} retired key(s)", keyVersion, keys.size() - 1);
    }

    public String keyVersion() {
        return keyVersion;
    }

    public EncryptedSecret encrypt(byte[] plaintext) {

        var nonce = SingleUseNonce.generate(random).consume();

        try {

            var cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, activeKey, new GCMParameterSpec(TAG_LENGTH * 8, nonce));

            var ciphertext = cipher.doFinal(plaintext);

            return new EncryptedSecret(ciphertext, nonce, keyVersion);
        }
        catch (GeneralSecurityException e) {

            // AES-GCM is a required JCE algorithm, failure here is an environment problem
            throw new EUnexpected("Secret encryption failed", e);
        }
    }

    /**
     * Decrypt with the active key.
     */
    public byte[] decrypt(byte[] ciphertext, byte[] nonce) {

        return decrypt(ciphertext, nonce, activeKey);
    }

    /**
     * Decrypt with the key version recorded in the encrypted secret.
     */
    public byte[] decrypt(EncryptedSecret secret) {

        var key = keys.get(secret.keyVersion());

        if (key == null) {
            log.warn("No key available for key version [{}]", secret.keyVersion());
            throw new EDecryption(DECRYPTION_FAILED);
        }

        return decrypt(secret.ciphertext(), secret.nonce(), key);
    }

    /**
     * Decrypt a record and encrypt it again under the active key, with a new nonce.
     */
    public EncryptedSecret reEncrypt(EncryptedSecret secret) {

        var plaintext = decrypt(secret);

        try {
            return encrypt(plaintext);
        }
        finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    private byte[] decrypt(byte[] ciphertext, byte[] nonce, SecretKey key) {

        if (nonce == null || nonce.length != NONCE_LENGTH)
            throw new EDecryption(DECRYPTION_FAILED);

        if (ciphertext == null || ciphertext.length < TAG_LENGTH)
            throw new EDecryption(DECRYPTION_FAILED);

        try {

            var cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));

            return cipher.doFinal(ciphertext);
        }
        catch (GeneralSecurityException e) {

            // No cause is attached, all failures look the same to the caller
            throw new EDecryption(DECRYPTION_FAILED);
        }
    }

    @Override
    public String toString() {
        return "SecretEncryption{keyVersion=" + keyVersion + ", key=[REDACTED], retiredKeys=" + (keys.size() - 1) + "}";
    }
}
