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

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;


/**
 * Key material for {@link SecretEncryption}: one active key plus optional retired keys
 * that are kept for decryption only.
 */
public final class EncryptionConfig {

    public static final String ENCRYPTION_KEY_ENV = "RELAYMESH_SECRET_ENCRYPTION_KEY";
    public static final String KEY_VERSION_ENV = "RELAYMESH_SECRET_KEY_VERSION";
    public static final String RETIRED_KEYS_ENV = "RELAYMESH_SECRET_RETIRED_KEYS";

    public static final String DEFAULT_KEY_VERSION = "default";
    public static final int KEY_LENGTH = 32;

    private final String keyVersion;
    private final byte[] key;
    private final Map<String, byte[]> retiredKeys;

    public EncryptionConfig(byte[] key, String keyVersion, Map<String, byte[]> retiredKeys) {

        checkKeyLength(key, keyVersion);

        for (var retired : retiredKeys.entrySet())
            checkKeyLength(retired.getValue(), retired.getKey());

        if (retiredKeys.containsKey(keyVersion))
            throw new EConfig(String.format("Key version [%s] is both active and retired", keyVersion));

        this.keyVersion = keyVersion;
        this.key = key.clone();
        this.retiredKeys = new HashMap<>();

        retiredKeys.forEach((version, retiredKey) -> this.retiredKeys.put(version, retiredKey.clone()));
    }

    public EncryptionConfig(byte[] key, String keyVersion) {
        this(key, keyVersion, Map.of());
    }

    /**
     * Read the key configuration, if an encryption key is set.
     *
     * @throws EConfig if a key is set but malformed
     */
    public static Optional<EncryptionConfig> fromEnvironment(EnvConfig env) {

        var encodedKey = env.first(ENCRYPTION_KEY_ENV);

        if (encodedKey.isEmpty())
            return Optional.empty();

        var key = decodeKey(encodedKey.get(), ENCRYPTION_KEY_ENV);
        var keyVersion = env.getOrDefault(KEY_VERSION_ENV, DEFAULT_KEY_VERSION);
        var retiredKeys = new HashMap<String, byte[]>();

        var retired = env.first(RETIRED_KEYS_ENV);

        if (retired.isPresent()) {

            for (var entry : retired.get().split(",")) {

                var separator = entry.indexOf(':');

                if (separator <= 0)
                    throw new EConfig(String.format("Invalid entry in %s, expected version:key", RETIRED_KEYS_ENV));

                var version = entry.substring(0, separator).trim();
                var retiredKey = decodeKey(entry.substring(separator + 1).trim(), RETIRED_KEYS_ENV);

                retiredKeys.put(version, retiredKey);
            }
        }

        return Optional.of(new EncryptionConfig(key, keyVersion, retiredKeys));
    }

    public String keyVersion() {
        return keyVersion;
    }

    byte[] key() {
        return key;
    }

    Map<String, byte[]> retiredKeys() {
        return retiredKeys;
    }

    private static byte[] decodeKey(String encodedKey, String source) {

        try {
            return Base64.getDecoder().decode(encodedKey);
        }
        catch (IllegalArgumentException e) {
            throw new EConfig(String.format("Encryption key in %s is not valid base64", source));
        }
    }

    private static void checkKeyLength(byte[] key, String keyVersion) {

        if (key == null || key.length != KEY_LENGTH) {

            var actual = key != null ? key.length : 0;

            throw new EConfig(String.format(
                    "Encryption key for version [%s] must be %d bytes, got %d bytes",
                    keyVersion, KEY_LENGTH, actual));
        }
    }

    @Override
    public String toString() {
        return "EncryptionConfig{keyVersion=" + keyVersion + ", key=[REDACTED], retiredKeys=" + retiredKeys.size() + "}";
    }
}
