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
import org.relaymesh.common.exception.EConfig;
import org.relaymesh.common.plugin.PluginManager;
import org.relaymesh.secrets.backend.ISecretBackend;
import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.cache.SecretCache;
import org.relaymesh.secrets.certs.CertificateBackendType;
import org.relaymesh.secrets.certs.CertificateTtl;
import org.relaymesh.secrets.certs.ICertificateBackend;
import org.relaymesh.secrets.certs.MockCertificateBackend;
import org.relaymesh.secrets.crypto.EncryptionConfig;
import org.relaymesh.secrets.crypto.SecretEncryption;
import org.relaymesh.secrets.db.DatabaseSecretBackend;
import org.relaymesh.secrets.db.JdbcSecretStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.Executor;

import static org.relaymesh.secrets.config.SecretsConfigKeys.*;


/**
 * Build a {@link SecretBackendRegistry} from environment configuration.
 *
 * <p>Each backend is enabled only when its required setting is present, backends that are
 * not configured are skipped. The database backend is enabled whenever an encryption key is
 * set and a data source is available. Plugin backends are created through the plugin manager,
 * using the backend type name as the protocol.</p>
 */
public class SecretBackendRegistryBuilder {

    private static final Logger log = LoggerFactory.getLogger(SecretBackendRegistryBuilder.class);

    private final EnvConfig env;
    private final PluginManager plugins;

    private DataSource dataSource;
    private JdbcDialect dialect;
    private Executor executor;
    private Clock clock;

    /**
     * Build a registry from the environment in one call.
     *
     * @param dataSource Data source for the local secret store, or null to disable the database backend
     */
    public static SecretBackendRegistry fromEnvironment(
            EnvConfig env, PluginManager plugins,
            @Nullable DataSource dataSource, JdbcDialect dialect, Executor executor) {

        var builder = new SecretBackendRegistryBuilder(env, plugins);

        if (dataSource != null)
            builder.withDatabase(dataSource, dialect, executor);

        return builder.build();
    }

    public SecretBackendRegistryBuilder(EnvConfig env, PluginManager plugins) {

        this.env = env;
        this.plugins = plugins;
        this.clock = Clock.systemUTC();
        this.executor = Runnable::run;
    }

    public SecretBackendRegistryBuilder withDatabase(DataSource dataSource, JdbcDialect dialect, Executor executor) {

        this.dataSource = dataSource;
        this.dialect = dialect;
        this.executor = executor;

        return this;
    }

    public SecretBackendRegistryBuilder withClock(Clock clock) {

        this.clock = clock;
        return this;
    }

    public SecretBackendRegistry build() {

        var ttlSeconds = env.intValue(CACHE_TTL_SECONDS_ENV, DEFAULT_CACHE_TTL_SECONDS);

        if (ttlSeconds < 0)
            throw new EConfig(String.format("Cache TTL cannot be negative: [%d]", ttlSeconds));

        var cache = new SecretCache(Duration.ofSeconds(ttlSeconds), clock);
        var registry = new SecretBackendRegistry(cache);

        log.info("Secret cache TTL is {} seconds", ttlSeconds);

        buildDatabaseBackend(registry);
        buildVaultBackend(registry);
        buildAwsBackend(registry);
        buildGcpBackend(registry);
        buildCertificateBackend(registry);

        log.info("Secret backends enabled: {}", registry.registeredBackends());

        return registry;
    }

    private void buildDatabaseBackend(SecretBackendRegistry registry) {

        var encryptionConfig = EncryptionConfig.fromEnvironment(env);

        if (encryptionConfig.isEmpty()) {
            log.debug("Database secret backend not configured ({} not set)", EncryptionConfig.ENCRYPTION_KEY_ENV);
            return;
        }

        if (dataSource == null) {
            log.debug("Database secret backend not configured (no data source)");
            return;
        }

        var encryption = new SecretEncryption(encryptionConfig.get());
        var store = new JdbcSecretStore(dataSource, dialect, encryption, clock);

        registry.register(new DatabaseSecretBackend(store, executor));
    }

    private void buildVaultBackend(SecretBackendRegistry registry) {

        if (!env.isPresent(VAULT_ADDRESS_ENV)) {
            log.debug("Vault secret backend not configured ({} not set)", String.join(" / ", VAULT_ADDRESS_ENV));
            return;
        }

        var properties = vaultProperties();
        env.copyTo(properties, VAULT_KV_MOUNT_PROPERTY, VAULT_KV_MOUNT_ENV);
        env.copyTo(properties, VAULT_SECRET_PREFIX_PROPERTY, VAULT_SECRET_PREFIX_ENV);

        registerPluginBackend(registry, SecretBackendType.VAULT, properties);
    }

    private void buildAwsBackend(SecretBackendRegistry registry) {

        if (!env.isPresent(AWS_ACCOUNT_ID_ENV)) {
            log.debug("AWS secret backend not configured ({} not set)", AWS_ACCOUNT_ID_ENV);
            return;
        }

        var properties = new Properties();
        env.copyTo(properties, AWS_ACCOUNT_ID_PROPERTY, AWS_ACCOUNT_ID_ENV);
        env.copyTo(properties, AWS_REGION_PROPERTY, AWS_REGION_ENV);
        env.copyTo(properties, AWS_SECRET_PREFIX_PROPERTY, AWS_SECRET_PREFIX_ENV);
        env.copyTo(properties, AWS_ENDPOINT_PROPERTY, AWS_ENDPOINT_ENV);

        registerPluginBackend(registry, SecretBackendType.AWS_SECRETS_MANAGER, properties);
    }

    private void buildGcpBackend(SecretBackendRegistry registry) {

        if (!env.isPresent(GCP_PROJECT_ID_ENV)) {
            log.debug("GCP secret backend not configured ({} not set)", String.join(" / ", GCP_PROJECT_ID_ENV));
            return;
        }

        var properties = new Properties();
        env.copyTo(properties, GCP_PROJECT_ID_PROPERTY, GCP_PROJECT_ID_ENV);
        env.copyTo(properties, GCP_SECRET_PREFIX_PROPERTY, GCP_SECRET_PREFIX_ENV);

        registerPluginBackend(registry, SecretBackendType.GCP_SECRET_MANAGER, properties);
    }

    private void buildCertificateBackend(SecretBackendRegistry registry) {

        var useMock = env.booleanValue(CERT_BACKEND_MOCK_ENV, false);
        var usePki = env.isPresent(VAULT_PKI_MOUNT_ENV);

        if (!useMock && !usePki) {
            log.debug("Certificate backend not configured");
            return;
        }

        var trustDomain = env.first(SPIFFE_TRUST_DOMAIN_ENV).orElseThrow(() -> new EConfig(String.format(
                "%s is required when a certificate backend is enabled", SPIFFE_TRUST_DOMAIN_ENV)));

        var ttlHours = CertificateTtl.defaultHours(env);

        ICertificateBackend backend;

        if (useMock) {

            backend = new MockCertificateBackend(trustDomain, ttlHours, clock);
        }
        else {

            var properties = vaultProperties();
            properties.setProperty(TRUST_DOMAIN_PROPERTY, trustDomain);
            properties.setProperty(CERT_TTL_HOURS_PROPERTY, Integer.toString(ttlHours));
            env.copyTo(properties, VAULT_PKI_MOUNT_PROPERTY, VAULT_PKI_MOUNT_ENV);
            env.copyTo(properties, VAULT_PKI_ROLE_PROPERTY, VAULT_PKI_ROLE_ENV);

            if (!properties.containsKey(VAULT_ADDRESS_PROPERTY))
                throw new EConfig(String.format(
                        "%s is required when %s is set", String.join(" / ", VAULT_ADDRESS_ENV), VAULT_PKI_MOUNT_ENV));

            backend = plugins.createService(ICertificateBackend.class, CertificateBackendType.VAULT_PKI.wireName(), properties);
        }

        registry.registerCertificateBackend(backend);
    }

    private Properties vaultProperties() {

        var properties = new Properties();
        env.copyTo(properties, VAULT_ADDRESS_PROPERTY, VAULT_ADDRESS_ENV);
        env.copyTo(properties, VAULT_TOKEN_PROPERTY, VAULT_TOKEN_ENV);
        env.copyTo(properties, VAULT_NAMESPACE_PROPERTY, VAULT_NAMESPACE_ENV);

        return properties;
    }

    private void registerPluginBackend(SecretBackendRegistry registry, SecretBackendType backendType, Properties properties) {

        var backend = plugins.createService(ISecretBackend.class, backendType.wireName(), properties);
        registry.register(backend);
    }
}
