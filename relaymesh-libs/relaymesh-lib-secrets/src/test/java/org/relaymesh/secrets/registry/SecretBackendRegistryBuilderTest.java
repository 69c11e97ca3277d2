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

package org.relaymesh.secrets.registry;

import org.relaymesh.common.config.EnvConfig;
import org.relaymesh.common.db.JdbcDialect;
import org.relaymesh.common.db.JdbcSetup;
import org.relaymesh.common.exception.EConfig;
import org.relaymesh.common.exception.EPluginNotAvailable;
import org.relaymesh.common.plugin.MeshPlugin;
import org.relaymesh.common.plugin.PluginManager;
import org.relaymesh.common.plugin.PluginServiceInfo;
import org.relaymesh.secrets.backend.ISecretBackend;
import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.certs.CertificateBackendType;
import org.relaymesh.secrets.certs.MockCertificateBackend;
import org.relaymesh.secrets.crypto.EncryptionConfig;
import org.relaymesh.secrets.model.GenericSecretSpec;
import org.relaymesh.secrets.model.SecretSpec;
import org.relaymesh.secrets.model.SecretType;

import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.relaymesh.secrets.config.SecretsConfigKeys.*;
import static org.junit.jupiter.api.Assertions.*;


class SecretBackendRegistryBuilderTest {

    static class RecordingBackend implements ISecretBackend {

        final SecretBackendType type;
        final Properties properties;

        RecordingBackend(SecretBackendType type, Properties properties) {
            this.type = type;
            this.properties = properties;
        }

        @Override
        public CompletionStage<SecretSpec> fetchSecret(String reference, SecretType expectedType) {
            return CompletableFuture.completedFuture(new GenericSecretSpec("c2VjcmV0"));
        }

        @Override
        public CompletionStage<Boolean> validateReference(String reference) {
            return CompletableFuture.completedFuture(true);
        }

        @Override
        public SecretBackendType backendType() {
            return type;
        }

        @Override
        public CompletionStage<Void> healthCheck() {
            return CompletableFuture.completedFuture(null);
        }
    }

    static class RecordingPlugin extends MeshPlugin {

        @Override
        public String pluginName() {
            return "RECORDING";
        }

        @Override
        public List<PluginServiceInfo> serviceInfo() {

            return List.of(new PluginServiceInfo(ISecretBackend.class, "RECORDING_SECRETS",
                    List.of("vault", "aws_secrets_manager", "gcp_secret_manager")));
        }

        @Override
        protected Object createService(String serviceName, Properties properties) {

            SecretBackendType type;

            if (properties.containsKey(VAULT_ADDRESS_PROPERTY))
                type = SecretBackendType.VAULT;
            else if (properties.containsKey(AWS_ACCOUNT_ID_PROPERTY))
                type = SecretBackendType.AWS_SECRETS_MANAGER;
            else
                type = SecretBackendType.GCP_SECRET_MANAGER;

            return new RecordingBackend(type, properties);
        }
    }

    private static PluginManager plugins() {

        var plugins = new PluginManager();
        plugins.registerPlugin(new RecordingPlugin());

        return plugins;
    }

    @Test
    void emptyEnvironment() {

        var registry = new SecretBackendRegistryBuilder(new EnvConfig(Map.of()), plugins()).build();

        assertTrue(registry.registeredBackends().isEmpty());
        assertTrue(registry.certificateBackend().isEmpty());
        assertEquals(Duration.ofSeconds(DEFAULT_CACHE_TTL_SECONDS), registry.cacheTtl());
    }

    @Test
    void cacheTtl() {

        var env = new EnvConfig(Map.of(CACHE_TTL_SECONDS_ENV, "30"));
        var registry = new SecretBackendRegistryBuilder(env, plugins()).build();

        assertEquals(Duration.ofSeconds(30), registry.cacheTtl());

        var negative = new EnvConfig(Map.of(CACHE_TTL_SECONDS_ENV, "-5"));
        assertThrows(EConfig.class, () -> new SecretBackendRegistryBuilder(negative, plugins()).build());
    }

    @Test
    void pluginBackends() {

        var env = new EnvConfig(Map.of(
                "VAULT_ADDR", "https://vault.internal:8200",
                "VAULT_TOKEN", "s.token",
                VAULT_KV_MOUNT_ENV, "kv",
                AWS_ACCOUNT_ID_ENV, "123456789012",
                "AWS_REGION", "eu-west-2",
                "GCP_PROJECT_ID", "mesh-prod"));

        var registry = new SecretBackendRegistryBuilder(env, plugins()).build();

        assertTrue(registry.hasBackend(SecretBackendType.VAULT));
        assertTrue(registry.hasBackend(SecretBackendType.AWS_SECRETS_MANAGER));
        assertTrue(registry.hasBackend(SecretBackendType.GCP_SECRET_MANAGER));
        assertFalse(registry.hasBackend(SecretBackendType.DATABASE));
    }

    @Test
    void pluginProperties() {

        var plugins = new PluginManager();
        var captured = new HashMap<String, Properties>();

        plugins.registerPlugin(new RecordingPlugin() {
            @Override
            protected Object createService(String serviceName, Properties properties) {
                var backend = (RecordingBackend) super.createService(serviceName, properties);
                captured.put(backend.type.wireName(), properties);
                return backend;
            }
        });

        var env = new EnvConfig(Map.of(
                "RELAYMESH_VAULT_ADDR", "https://vault.internal:8200",
                "VAULT_ADDR", "https://ignored:8200",
                VAULT_SECRET_PREFIX_ENV, "mesh/"));

        new SecretBackendRegistryBuilder(env, plugins).build();

        var vaultProps = captured.get("vault");

        assertEquals("https://vault.internal:8200", vaultProps.getProperty(VAULT_ADDRESS_PROPERTY));
        assertEquals("mesh/", vaultProps.getProperty(VAULT_SECRET_PREFIX_PROPERTY));
        assertNull(vaultProps.getProperty(VAULT_TOKEN_PROPERTY));
    }

    @Test
    void missingPlugin() {

        var env = new EnvConfig(Map.of(AWS_ACCOUNT_ID_ENV, "123456789012"));

        assertThrows(EPluginNotAvailable.class, () -> new SecretBackendRegistryBuilder(env, new PluginManager()).build());
    }

    @Test
    void databaseBackend() {

        var key = new byte[EncryptionConfig.KEY_LENGTH];
        new SecureRandom().nextBytes(key);

        var props = new Properties();
        props.setProperty(JdbcSetup.DIALECT_PROPERTY, "h2");
        props.setProperty(JdbcSetup.JDBC_URL_PROPERTY, "mem:" + UUID.randomUUID());

        var source = JdbcSetup.createDatasource(props);

        try {

            var env = new EnvConfig(Map.of(EncryptionConfig.ENCRYPTION_KEY_ENV, Base64.getEncoder().encodeToString(key)));

            var withoutSource = new SecretBackendRegistryBuilder(env, plugins()).build();
            assertFalse(withoutSource.hasBackend(SecretBackendType.DATABASE));

            var registry = new SecretBackendRegistryBuilder(env, plugins())
                    .withDatabase(source, JdbcDialect.H2, Runnable::run)
                    .build();

            assertTrue(registry.hasBackend(SecretBackendType.DATABASE));
        }
        finally {
            JdbcSetup.destroyDatasource(source);
        }
    }

    @Test
    void mockCertificateBackend() {

        var env = new EnvConfig(Map.of(
                CERT_BACKEND_MOCK_ENV, "true",
                SPIFFE_TRUST_DOMAIN_ENV, "mesh.example.org",
                "RELAYMESH_CERT_TTL_HOURS", "2"));

        var registry = new SecretBackendRegistryBuilder(env, plugins()).build();
        var backend = registry.certificateBackend().orElseThrow();

        assertTrue(backend instanceof MockCertificateBackend);
        assertEquals(CertificateBackendType.MOCK, backend.backendType());
        assertEquals("mesh.example.org", backend.trustDomain());
    }

    @Test
    void certificateBackend_requiresTrustDomain() {

        var env = new EnvConfig(Map.of(CERT_BACKEND_MOCK_ENV, "true"));

        assertThrows(EConfig.class, () -> new SecretBackendRegistryBuilder(env, plugins()).build());
    }

    @Test
    void pkiBackend_requiresVaultAddress() {

        var env = new EnvConfig(Map.of(
                VAULT_PKI_MOUNT_ENV, "pki_int",
                SPIFFE_TRUST_DOMAIN_ENV, "mesh.example.org"));

        assertThrows(EConfig.class, () -> new SecretBackendRegistryBuilder(env, plugins()).build());
    }
}
