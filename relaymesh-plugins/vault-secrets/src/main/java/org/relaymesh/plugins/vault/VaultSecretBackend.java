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

package org.relaymesh.plugins.vault;

import org.relaymesh.common.exception.EMesh;
import org.relaymesh.common.exception.ESecretValidation;
import org.relaymesh.secrets.backend.ISecretBackend;
import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.backend.SecretPayloads;
import org.relaymesh.secrets.model.SecretSpec;
import org.relaymesh.secrets.model.SecretType;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.regex.Pattern;

import static org.relaymesh.secrets.backend.SecretBackendErrors.ExplicitError.SECRET_NOT_FOUND;
import static org.relaymesh.secrets.config.SecretsConfigKeys.*;


/**
 * Secret backend for the Vault KV version 2 engine.
 *
 * <p>References are paths under the configured mount, with an optional version suffix:
 * {@code path}, {@code path@latest}, {@code path@3} or {@code path@v3}.
 * The payload is the {@code data.data} object of the KV response.</p>
 */
public class VaultSecretBackend implements ISecretBackend {

    private static final Pattern PATH_PATTERN = Pattern.compile("^[A-Za-z0-9_.\\-]+(/[A-Za-z0-9_.\\-]+)*$");
    private static final Pattern VERSION_PATTERN = Pattern.compile("^v?(\\d+)$");
    private static final String LATEST_VERSION = "latest";

    // Active, standby, DR secondary and performance standby nodes can all serve reads
    private static final Set<Integer> HEALTHY_STATUS_CODES = Set.of(200, 429, 472, 473);

    private static final Logger log = LoggerFactory.getLogger(VaultSecretBackend.class);

    private final VaultClient client;
    private final String kvMount;
    private final String secretPrefix;
    private final VaultErrors errors;

    public VaultSecretBackend(Properties properties) {
        this(VaultClient.fromProperties(properties), properties);
    }

    VaultSecretBackend(VaultClient client, Properties properties) {

        this.client = client;
        this.kvMount = trimSlashes(properties.getProperty(VAULT_KV_MOUNT_PROPERTY, DEFAULT_VAULT_KV_MOUNT));
        this.secretPrefix = normalizePrefix(properties.getProperty(VAULT_SECRET_PREFIX_PROPERTY));
        this.errors = new VaultErrors(backendType().wireName());

        log.info("INIT [{}]: address = [{}], mount = [{}], prefix = [{}]",
                backendType(), client.address(), kvMount, secretPrefix);
    }

    @Override
    public CompletionStage<SecretSpec> fetchSecret(String reference, SecretType expectedType) {

        log.debug("fetchSecret [{}], expected type = [{}]", reference, expectedType);

        VaultReference vaultRef;

        try {
            vaultRef = parseReference(reference);
        }
        catch (EMesh e) {
            return CompletableFuture.failedFuture(e);
        }

        var apiPath = String.format("/v1/%s/data/%s", kvMount, vaultRef.path);

        if (vaultRef.version != null)
            apiPath += "?version=" + vaultRef.version;

        var finalPath = apiPath;

        return client.get(apiPath)
                .thenApply(response -> {

                    if (!response.isSuccess())
                        throw new VaultStatusException(finalPath, response.statusCode());

                    var payload = response.body().path("data").path("data");

                    // Deleted or destroyed versions come back with null data
                    if (!payload.isObject())
                        throw errors.explicitError("fetchSecret", reference, SECRET_NOT_FOUND);

                    return SecretPayloads.parse(payload, expectedType, sourceDescription(reference));
                })
                .handle((spec, error) -> handleResult("fetchSecret", reference, spec, error));
    }

    @Override
    public CompletionStage<Boolean> validateReference(String reference) {

        log.debug("validateReference [{}]", reference);

        VaultReference vaultRef;

        try {
            vaultRef = parseReference(reference);
        }
        catch (EMesh e) {
            return CompletableFuture.failedFuture(e);
        }

        var apiPath = String.format("/v1/%s/metadata/%s", kvMount, vaultRef.path);

        return client.get(apiPath)
                .thenApply(response -> {

                    if (response.statusCode() == 404)
                        return false;

                    if (!response.isSuccess())
                        throw new VaultStatusException(apiPath, response.statusCode());

                    var metadata = response.body().path("data");
                    var versions = metadata.path("versions");

                    if (vaultRef.version == null) {

                        var current = metadata.path("current_version");

                        // Metadata without version details, the secret exists
                        if (!current.canConvertToInt() || !versions.path(current.asText()).isObject())
                            return true;

                        return isVersionAvailable(versions.path(current.asText()));
                    }

                    return isVersionAvailable(versions.path(Integer.toString(vaultRef.version)));
                })
                .handle((exists, error) -> handleResult("validateReference", reference, exists, error));
    }

    private static boolean isVersionAvailable(JsonNode versionInfo) {

        // Soft-deleted versions carry a deletion time and read back with null data
        if (!versionInfo.isObject() || versionInfo.path("destroyed").asBoolean(false))
            return false;

        var deletionTime = versionInfo.path("deletion_time");

        return !deletionTime.isTextual() || deletionTime.textValue().isEmpty();
    }

    @Override
    public SecretBackendType backendType() {
        return SecretBackendType.VAULT;
    }

    @Override
    public CompletionStage<Void> healthCheck() {

        var healthPath = "/v1/sys/health";
        var tokenPath = "/v1/auth/token/lookup-self";

        return client.get(healthPath)
                .thenCompose(health -> {

                    if (!HEALTHY_STATUS_CODES.contains(health.statusCode()))
                        throw new VaultStatusException(healthPath, health.statusCode());

                    return client.get(tokenPath);
                })
                .thenAccept(token -> {

                    if (!token.isSuccess())
                        throw new VaultStatusException(tokenPath, token.statusCode());
                })
                .handle((result, error) -> handleResult("healthCheck", "-", result, error));
    }

    VaultReference parseReference(String reference) {

        if (reference == null || reference.isBlank())
            throw new ESecretValidation("Vault secret reference cannot be empty");

        var path = reference.trim();
        Integer version = null;

        var separator = path.lastIndexOf('@');

        if (separator >= 0) {

            var versionText = path.substring(separator + 1);
            path = path.substring(0, separator);

            if (!versionText.equalsIgnoreCase(LATEST_VERSION)) {

                var versionMatch = VERSION_PATTERN.matcher(versionText);

                if (!versionMatch.matches())
                    throw new ESecretValidation(String.format(
                            "Invalid version in Vault secret reference: [%s]", reference));

                try {
                    version = Integer.parseInt(versionMatch.group(1));
                }
                catch (NumberFormatException e) {
                    throw new ESecretValidation(String.format(
                            "Invalid version in Vault secret reference: [%s]", reference), e);
                }
            }
        }

        path = trimSlashes(path);

        if (path.isEmpty() || !PATH_PATTERN.matcher(path).matches())
            throw new ESecretValidation(String.format("Invalid Vault secret path: [%s]", reference));

        for (var segment : path.split("/"))
            if (segment.equals(".") || segment.equals(".."))
                throw new ESecretValidation(String.format(
                        "Vault secret path contains a relative segment: [%s]", reference));

        return new VaultReference(secretPrefix + path, version);
    }

    private <T> T handleResult(String operation, String reference, T result, Throwable error) {

        if (error == null)
            return result;

        var handled = errors.handleException(operation, reference, error);

        log.warn("{} [{}] failed: {}", operation, reference, handled.getClass().getSimpleName());

        throw handled;
    }

    private String sourceDescription(String reference) {
        return String.format("vault:%s/%s", kvMount, reference);
    }

    private static String normalizePrefix(@Nullable String prefix) {

        if (prefix == null)
            return "";

        var trimmed = trimSlashes(prefix.trim());

        return trimmed.isEmpty() ? "" : trimmed + "/";
    }

    private static String trimSlashes(String path) {

        var start = 0;
        var end = path.length();

        while (start < end && path.charAt(start) == '/') start++;
        while (end > start && path.charAt(end - 1) == '/') end--;

        return path.substring(start, end);
    }

    static final class VaultReference {

        final String path;
        final Integer version;

        VaultReference(String path, @Nullable Integer version) {
            this.path = path;
            this.version = version;
        }
    }
}
