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

import org.relaymesh.common.config.EnvConfig;
import org.relaymesh.common.exception.EConfig;
import org.relaymesh.common.exception.EDecryption;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;


class SecretEncryptionTest {

    private static byte[] randomKey() {

        var key = new byte[EncryptionConfig.KEY_LENGTH];
        new SecureRandom().nextBytes(key);

        return key;
    }

    private static SecretEncryption encryption(String version) {
        return new SecretEncryption(new EncryptionConfig(randomKey(), version));
    }

    @Test
    void roundTrip() {

        var encryption = encryption("v1");
        var plaintext = "{\"type\":\"generic_secret\",\"secret\":\"c2VjcmV0\"}".getBytes(StandardCharsets.UTF_8);

        var encrypted = encryption.encrypt(plaintext);

        assertEquals(SecretEncryption.NONCE_LENGTH, encrypted.nonce().length);
        assertEquals(plaintext.length + SecretEncryption.TAG_LENGTH, encrypted.ciphertext().length);
        assertEquals("v1", encrypted.keyVersion());

        assertArrayEquals(plaintext, encryption.decrypt(encrypted.ciphertext(), encrypted.nonce()));
        assertArrayEquals(plaintext, encryption.decrypt(encrypted));
    }

    @Test
    void roundTrip_empty() {

        var encryption = encryption("v1");
        var encrypted = encryption.encrypt(new byte[0]);

        assertEquals(SecretEncryption.TAG_LENGTH, encrypted.ciphertext().length);
        assertArrayEquals(new byte[0], encryption.decrypt(encrypted));
    }

    @Test
    void roundTrip_large() {

        var encryption = encryption("v1");
        var plaintext = new byte[4 * 1024 * 1024];
        new SecureRandom().nextBytes(plaintext);

        var encrypted = encryption.encrypt(plaintext);

        assertArrayEquals(plaintext, encryption.decrypt(encrypted));
    }

    @Test
    void nonceIsFreshEachTime() {

        var encryption = encryption("v1");
        var plaintext = "same input".getBytes(StandardCharsets.UTF_8);
        var nonces = new HashSet<String>();

        for (var i = 0; i < 1000; i++) {

            var encrypted = encryption.encrypt(plaintext);
            nonces.add(Base64.getEncoder().encodeToString(encrypted.nonce()));
        }

        assertEquals(1000, nonces.size());
    }

    @Test
    void tamperedCiphertext() {

        var encryption = encryption("v1");
        var encrypted = encryption.encrypt("payload".getBytes(StandardCharsets.UTF_8));

        var ciphertext = encrypted.ciphertext();
        ciphertext[0] ^= 0x01;

        var error = assertThrows(EDecryption.class, () -> encryption.decrypt(ciphertext, encrypted.nonce()));
        assertNull(error.getCause());
    }

    @Test
    void tamperedTag() {

        var encryption = encryption("v1");
        var encrypted = encryption.encrypt("payload".getBytes(StandardCharsets.UTF_8));

        var ciphertext = encrypted.ciphertext();
        ciphertext[ciphertext.length - 1] ^= 0x01;

        assertThrows(EDecryption.class, () -> encryption.decrypt(ciphertext, encrypted.nonce()));
    }

    @Test
    void tamperedAnyBit() {

        var encryption = encryption("v1");
        var encrypted = encryption.encrypt("abc".getBytes(StandardCharsets.UTF_8));
        var original = encrypted.ciphertext();

        // 3 payload bytes followed by the 16 byte tag
        assertEquals(3 + SecretEncryption.TAG_LENGTH, original.length);

        for (var i = 0; i < original.length * 8; i++) {

            var ciphertext = Arrays.copyOf(original, original.length);
            ciphertext[i / 8] ^= (byte) (1 << (i % 8));

            var bit = i;
            assertThrows(EDecryption.class,
                    () -> encryption.decrypt(ciphertext, encrypted.nonce()),
                    () -> "Bit " + bit + " was flipped but decryption succeeded");
        }

        assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8), encryption.decrypt(original, encrypted.nonce()));
    }

    @Test
    void wrongNonce() {

        var encryption = encryption("v1");
        var encrypted = encryption.encrypt("payload".getBytes(StandardCharsets.UTF_8));

        var nonce = encrypted.nonce();
        nonce[3] ^= 0x01;

        assertThrows(EDecryption.class, () -> encryption.decrypt(encrypted.ciphertext(), nonce));
        assertThrows(EDecryption.class, () -> encryption.decrypt(encrypted.ciphertext(), new byte[8]));
    }

    @Test
    void truncatedCiphertext() {

        var encryption = encryption("v1");

        assertThrows(EDecryption.class, () -> encryption.decrypt(new byte[SecretEncryption.TAG_LENGTH - 1], new byte[12]));
    }

    @Test
    void wrongKey() {

        var encrypted = encryption("v1").encrypt("payload".getBytes(StandardCharsets.UTF_8));
        var other = encryption("v1");

        assertThrows(EDecryption.class, () -> other.decrypt(encrypted));
    }

    @Test
    void failuresAreIndistinguishable() {

        var encryption = encryption("v1");
        var encrypted = encryption.encrypt("payload".getBytes(StandardCharsets.UTF_8));
        var ciphertext = encrypted.ciphertext();
        ciphertext[0] ^= 0x01;

        var e1 = assertThrows(EDecryption.class, () -> encryption.decrypt(ciphertext, encrypted.nonce()));
        var e2 = assertThrows(EDecryption.class, () -> encryption.decrypt(encrypted.ciphertext(), new byte[5]));
        var e3 = assertThrows(EDecryption.class, () -> encryption.decrypt(new EncryptedSecret(
                encrypted.ciphertext(), encrypted.nonce(), "unknown")));

        assertEquals(e1.getMessage(), e2.getMessage());
        assertEquals(e1.getMessage(), e3.getMessage());
    }

    @Test
    void keyLength() {

        var error = assertThrows(EConfig.class, () -> new EncryptionConfig(new byte[16], "v1"));

        assertTrue(error.getMessage().contains("32 bytes"));
        assertTrue(error.getMessage().contains("16"));
    }

    @Test
    void retiredKeys_decryptAndReEncrypt() {

        var oldKey = randomKey();
        var newKey = randomKey();

        var oldEncryption = new SecretEncryption(new EncryptionConfig(oldKey, "v1"));
        var encrypted = oldEncryption.encrypt("payload".getBytes(StandardCharsets.UTF_8));

        var rotated = new SecretEncryption(new EncryptionConfig(newKey, "v2", Map.of("v1", oldKey)));

        assertArrayEquals("payload".getBytes(StandardCharsets.UTF_8), rotated.decrypt(encrypted));

        var reEncrypted = rotated.reEncrypt(encrypted);

        assertEquals("v2", reEncrypted.keyVersion());
        assertFalse(Arrays.equals(encrypted.nonce(), reEncrypted.nonce()));
        assertArrayEquals("payload".getBytes(StandardCharsets.UTF_8), rotated.decrypt(reEncrypted));
        assertThrows(EDecryption.class, () -> oldEncryption.decrypt(reEncrypted));
    }

    @Test
    void retiredKeys_activeVersionCannotBeRetired() {

        var key = randomKey();

        assertThrows(EConfig.class, () -> new EncryptionConfig(key, "v1", Map.of("v1", randomKey())));
    }

    @Test
    void fromEnvironment() {

        var key = Base64.getEncoder().encodeToString(randomKey());
        var retired = Base64.getEncoder().encodeToString(randomKey());

        var env = new EnvConfig(Map.of(
                EncryptionConfig.ENCRYPTION_KEY_ENV, key,
                EncryptionConfig.KEY_VERSION_ENV, "2024-06",
                EncryptionConfig.RETIRED_KEYS_ENV, "2024-01:" + retired));

        var config = EncryptionConfig.fromEnvironment(env).orElseThrow();

        assertEquals("2024-06", config.keyVersion());
        assertEquals(1, config.retiredKeys().size());
        assertFalse(config.toString().contains(key));
    }

    @Test
    void fromEnvironment_notSet() {

        assertTrue(EncryptionConfig.fromEnvironment(new EnvConfig(Map.of())).isEmpty());
    }

    @Test
    void fromEnvironment_defaultVersion() {

        var key = Base64.getEncoder().encodeToString(randomKey());
        var env = new EnvConfig(Map.of(EncryptionConfig.ENCRYPTION_KEY_ENV, key));

        assertEquals(EncryptionConfig.DEFAULT_KEY_VERSION, EncryptionConfig.fromEnvironment(env).orElseThrow().keyVersion());
    }

    @Test
    void fromEnvironment_badValues() {

        var badBase64 = new EnvConfig(Map.of(EncryptionConfig.ENCRYPTION_KEY_ENV, "not*base64"));
        var shortKey = new EnvConfig(Map.of(EncryptionConfig.ENCRYPTION_KEY_ENV, Base64.getEncoder().encodeToString(new byte[31])));

        assertThrows(EConfig.class, () -> EncryptionConfig.fromEnvironment(badBase64));
        assertThrows(EConfig.class, () -> EncryptionConfig.fromEnvironment(shortKey));
    }

    @Test
    void singleUseNonce() {

        var nonce = SingleUseNonce.generate(new SecureRandom());

        assertFalse(nonce.isConsumed());
        assertEquals(SecretEncryption.NONCE_LENGTH, nonce.consume().length);
        assertTrue(nonce.isConsumed());
        assertThrows(RuntimeException.class, nonce::consume);
    }
}
