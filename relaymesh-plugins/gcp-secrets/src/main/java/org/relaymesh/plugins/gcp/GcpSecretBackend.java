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

package org.relaymesh.plugins.gcp;

import org.relaymesh.common.exception.EConfig;
import org.relaymesh.common.exception.EMesh;
import org.relaymesh.common.exception.ESecretCommunication;
import org.relaymesh.common.exception.ESecretValidation;
import org.relaymesh.secrets.backend.ISecretBackend;
import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.backend.SecretPayloads;
import org.relaymesh.secrets.model.SecretSpec;
import org.relaymesh.secrets.model.SecretType;

import com.google.cloud.secretmanager.v1.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.regex.Pattern;
import java.util.zip.CRC32C;

import static org.relaymesh.secrets.config.SecretsConfigKeys.*;


/**
 * Secret backend for GCP Secret Manager.
 *
 * <p>Short references are resolved in the configured project with the configured prefix:
 * {@code name} and {@code name@latest} read the latest version, {@code name@3} and
 * {@code name@v3} read version 3, any other suffix is treated as a version alias.
 * References starting with {@code projects/} are full resource names and are used as given.</p>
 */
public class GcpSecretBackend implements ISecretBackend {

    static final String LATEST_VERSION = "latest";

    private static final String RESOURCE_PREFIX = "projects/";

    private static final Pattern SECRET_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_\\-]{1,255}$");
    private static final Pattern NUMERIC_VERSION_PATTERN = Pattern.compile("^v?(\\d+)$");
    private static final Pattern VERSION_ALIAS_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_\\-]{0,62}$");

    private static final Logger log = LoggerFactory.getLogger(GcpSecretBackend.class);

    private final SecretManagerServiceClient client;
    private final String projectId;
    private final String secretPrefix;
    private final GcpSecretErrors errors;

    public GcpSecretBackend(Properties properties) {
        this(createClient(properties), properties);
    }

    GcpSecretBackend(SecretManagerServiceClient client, Properties properties) {

        this.client = client;
        this.projectId = projectId(properties);
        this.secretPrefix = properties.getProperty(GCP_SECRET_PREFIX_PROPERTY, DEFAULT_GCP_SECRET_PREFIX);
        this.errors = new GcpSecretErrors(backendType().wireName());

        log.info("INIT [{}]: project = [{}], prefix = [{}]", backendType(), this.projectId, secretPrefix);
    }

    private static String projectId(Properties properties) {

        var projectId = properties.getProperty(GCP_PROJECT_ID_PROPERTY);

        if (projectId == null || projectId.isBlank())
            throw new EConfig(String.format("Missing required property for GCP: [%s]", GCP_PROJECT_ID_PROPERTY));

        return projectId.trim();
    }

    private static SecretManagerServiceClient createClient(Properties properties) {

        // Fail on missing config before looking for credentials
        projectId(properties);

        try {
            // Credentials come from the application default chain
            var settings = SecretManagerServiceSettings.newBuilder().build();
            return SecretManagerServiceClient.create(settings);
        }
        catch (IOException e) {

            var message = String.format("Failed to create GCP Secret Manager client: %s", e.getMessage());
            log.error(message);

            throw new EConfig(message, e);
        }
    }

    @Override
    public CompletionStage<SecretSpec> fetchSecret(String reference, SecretType expectedType) {

        String resourceName;

        try {
            resourceName = resolveReference(reference);
        }
        catch (EMesh e) {
            return CompletableFuture.failedFuture(e);
        }

        log.debug("fetchSecret [{}], resource = [{}], expected type = [{}]", reference, resourceName, expectedType);

        var request = AccessSecretVersionRequest.newBuilder()
                .setName(resourceName)
                .build();

        return GcpUtils.unaryCall(client.accessSecretVersionCallable(), request)
                .thenApply(response -> parsePayload(response, reference, expectedType))
                .handle((spec, error) -> handleResult("fetchSecret", reference, spec, error));
    }

    @Override
    public CompletionStage<Boolean> validateReference(String reference) {

        String resourceName;

        try {
            resourceName = resolveReference(reference);
        }
        catch (EMesh e) {
            return CompletableFuture.failedFuture(e);
        }

        log.debug("validateReference [{}], resource = [{}]", reference, resourceName);

        // Version metadata only, the payload is never read
        var request = GetSecretVersionRequest.newBuilder()
                .setName(resourceName)
                .build();

        return GcpUtils.unaryCall(client.getSecretVersionCallable(), request)
                .handle((version, error) -> {

                    if (error != null && errors.isNotFound(error))
                        return false;

                    var result = handleResult("validateReference", reference, version, error);
                    return result.getState() == SecretVersion.State.ENABLED;
                });
    }

    @Override
    public SecretBackendType backendType() {
        return SecretBackendType.GCP_SECRET_MANAGER;
    }

    @Override
    public CompletionStage<Void> healthCheck() {

        var request = ListSecretsRequest.newBuilder()
                .setParent(ProjectName.of(projectId).toString())
                .setPageSize(1)
                .build();

        return GcpUtils.unaryCall(client.listSecretsCallable(), request)
                .<Void>thenApply(response -> null)
                .handle((result, error) -> handleResult("healthCheck", projectId, result, error));
    }

    String resolveReference(String reference) {

        if (reference == null || reference.isBlank())
            throw new ESecretValidation("GCP secret reference cannot be empty");

        var trimmed = reference.trim();

        if (trimmed.startsWith(RESOURCE_PREFIX)) {

            if (SecretVersionName.isParsableFrom(trimmed))
                return trimmed;

            if (SecretName.isParsableFrom(trimmed))
                return trimmed + "/versions/" + LATEST_VERSION;

            throw new ESecretValidation(String.format("Invalid GCP secret resource name: [%s]", reference));
        }

        var separator = trimmed.lastIndexOf('@');
        var name = separator >= 0 ? trimmed.substring(0, separator) : trimmed;
        var version = separator >= 0 ? trimmed.substring(separator + 1) : LATEST_VERSION;

        var secretId = secretPrefix + name;

        if (!SECRET_ID_PATTERN.matcher(secretId).matches())
            throw new ESecretValidation(String.format("Invalid GCP secret name: [%s]", reference));

        var numericVersion = NUMERIC_VERSION_PATTERN.matcher(version);

        if (version.equalsIgnoreCase(LATEST_VERSION))
            version = LATEST_VERSION;
        else if (numericVersion.matches())
            version = numericVersion.group(1);
        else if (!VERSION_ALIAS_PATTERN.matcher(version).matches())
            throw new ESecretValidation(String.format("Invalid version in GCP secret reference: [%s]", reference));

        return SecretVersionName.of(projectId, secretId, version).toString();
    }

    private SecretSpec parsePayload(AccessSecretVersionResponse response, String reference, SecretType expectedType) {

        if (!response.hasPayload())
            throw new ESecretValidation(String.format("Secret payload is empty: gcp:%s", reference));

        var payload = response.getPayload();
        var data = payload.getData().toByteArray();

        if (payload.hasDataCrc32C()) {

            var checksum = new CRC32C();
            checksum.update(data);

            if (checksum.getValue() != payload.getDataCrc32C())
                throw new ESecretCommunication(String.format(
                        "Secret payload failed checksum verification: gcp:%s", reference));
        }

        return SecretPayloads.parse(data, expectedType, String.format("gcp:%s", reference));
    }

    private <T> T handleResult(String operation, String reference, T result, Throwable error) {

        if (error == null)
            return result;

        var handled = errors.handleException(operation, reference, error);

        log.warn("{} [{}] failed: {}", operation, reference, handled.getClass().getSimpleName());

        throw handled;
    }
}
