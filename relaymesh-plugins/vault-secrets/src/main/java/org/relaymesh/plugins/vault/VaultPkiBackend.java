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

import org.relaymesh.common.exception.EConfig;
import org.relaymesh.common.exception.EMesh;
import org.relaymesh.common.exception.ESecretCommunication;
import org.relaymesh.secrets.certs.*;
import org.relaymesh.secrets.model.SecretJson;
import org.relaymesh.secrets.model.SecretString;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import static org.relaymesh.secrets.config.SecretsConfigKeys.*;


/**
 * Issues proxy certificates from a Vault PKI secrets engine.
 *
 * <p>Each certificate carries the workload SPIFFE URI as a URI SAN. Transient failures
 * (connection errors, timeouts, HTTP 429 and 5xx gateway errors) are retried with backoff.</p>
 */
public class VaultPkiBackend implements ICertificateBackend {

    private static final Logger log = LoggerFactory.getLogger(VaultPkiBackend.class);

    private final VaultClient client;
    private final String pkiMount;
    private final String role;
    private final String trustDomain;
    private final int defaultTtlHours;
    private final RetryConfig retryConfig;
    private final VaultErrors errors;

    public VaultPkiBackend(Properties properties) {
        this(VaultClient.fromProperties(properties), properties, RetryConfig.DEFAULT);
    }

    VaultPkiBackend(VaultClient client, Properties properties, RetryConfig retryConfig) {

        this.client = client;
        this.pkiMount = requiredProperty(properties, VAULT_PKI_MOUNT_PROPERTY);
        this.role = properties.getProperty(VAULT_PKI_ROLE_PROPERTY, DEFAULT_VAULT_PKI_ROLE);
        this.trustDomain = requiredProperty(properties, TRUST_DOMAIN_PROPERTY);
        this.defaultTtlHours = CertificateTtl.clamp(ttlProperty(properties));
        this.retryConfig = retryConfig;
        this.errors = new VaultErrors(backendType().wireName());

        log.info("INIT [{}]: address = [{}], mount = [{}], role = [{}], trust domain = [{}], default TTL = {}h",
                backendType(), client.address(), pkiMount, role, trustDomain, defaultTtlHours);
    }

    @Override
    public CompletionStage<GeneratedCertificate> generateCertificate(String team, String workloadId, @Nullable Integer ttlHours) {

        String spiffeUri;

        try {
            spiffeUri = SpiffeIdentity.buildUri(trustDomain, team, workloadId);
        }
        catch (EMesh e) {
            return CompletableFuture.failedFuture(e);
        }

        var ttl = CertificateTtl.effectiveHours(ttlHours, defaultTtlHours);
        var apiPath = String.format("/v1/%s/issue/%s", pkiMount, role);

        var request = SecretJson.mapper().createObjectNode();
        request.put("common_name", String.format("%s.%s.%s", workloadId, team, trustDomain));
        request.put("uri_sans", spiffeUri);
        request.put("ttl", ttl + "h");

        log.info("Issuing certificate for [{}], ttl = {}h", spiffeUri, ttl);

        return issueWithRetry(apiPath, request, spiffeUri, 0)
                .thenApply(response -> buildCertificate(response, spiffeUri));
    }

    @Override
    public CertificateBackendType backendType() {
        return CertificateBackendType.VAULT_PKI;
    }

    @Override
    public String trustDomain() {
        return trustDomain;
    }

    @Override
    public CompletionStage<Void> healthCheck() {

        var apiPath = String.format("/v1/%s/roles/%s", pkiMount, role);

        return client.get(apiPath)
                .thenAccept(response -> {
                    if (!response.isSuccess())
                        throw new VaultStatusException(apiPath, response.statusCode());
                })
                .exceptionally(error -> {
                    throw errors.handleException("healthCheck", pkiMount + "/" + role, error);
                });
    }

    private CompletionStage<JsonNode> issueWithRetry(String apiPath, ObjectNode request, String spiffeUri, int attempt) {

        var backoff = retryConfig.backoffForAttempt(attempt);

        CompletionStage<VaultClient.VaultResponse> response = backoff.isZero()
                ? client.post(apiPath, request)
                : CompletableFuture
                        .runAsync(() -> {}, CompletableFuture.delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS))
                        .thenCompose(x -> client.post(apiPath, request));

        return response
                .thenApply(result -> {

                    if (!result.isSuccess())
                        throw new VaultStatusException(apiPath, result.statusCode());

                    return result.body();
                })
                .<CompletionStage<JsonNode>>handle((body, error) -> {

                    if (error == null)
                        return CompletableFuture.completedFuture(body);

                    if (errors.isTransient(error) && attempt + 1 < retryConfig.maxAttempts()) {

                        log.warn("Transient error issuing certificate for [{}], attempt {} of {}: {}",
                                spiffeUri, attempt + 1, retryConfig.maxAttempts(),
                                error.getCause() != null ? error.getCause().getMessage() : error.getMessage());

                        return issueWithRetry(apiPath, request, spiffeUri, attempt + 1);
                    }

                    var handled = errors.handleException("generateCertificate", spiffeUri, error);
                    log.error("Certificate issue failed for [{}] after {} attempt(s)", spiffeUri, attempt + 1);

                    return CompletableFuture.failedFuture(handled);
                })
                .thenCompose(result -> result);
    }

    private GeneratedCertificate buildCertificate(JsonNode body, String spiffeUri) {

        var data = body.path("data");

        var certificate = requiredText(data, "certificate");
        var privateKey = requiredText(data, "private_key");
        var serialNumber = data.path("serial_number").asText("");

        var expiration = data.path("expiration");

        if (!expiration.canConvertToLong())
            throw new ESecretCommunication("Vault PKI response is missing the certificate expiration");

        var caChain = data.path("ca_chain");
        String caChainPem;

        if (caChain.isArray() && caChain.size() > 0) {

            var entries = new ArrayList<String>();
            caChain.forEach(entry -> entries.add(entry.asText()));
            caChainPem = String.join("\n", entries);
        }
        else {
            caChainPem = data.path("issuing_ca").asText("");
        }

        var expiresAt = Instant.ofEpochSecond(expiration.asLong());

        log.info("Issued certificate for [{}], serial = [{}], expires at [{}]", spiffeUri, serialNumber, expiresAt);

        return new GeneratedCertificate(
                certificate, new SecretString(privateKey), caChainPem,
                serialNumber, expiresAt, spiffeUri);
    }

    private static String requiredText(JsonNode data, String field) {

        var node = data.path(field);

        if (!node.isTextual() || node.textValue().isEmpty())
            throw new ESecretCommunication(String.format("Vault PKI response is missing [%s]", field));

        return node.textValue();
    }

    private static String requiredProperty(Properties properties, String key) {

        var value = properties.getProperty(key);

        if (value == null || value.isBlank())
            throw new EConfig(String.format("Missing required property for Vault PKI: [%s]", key));

        return value.trim();
    }

    private static int ttlProperty(Properties properties) {

        var value = properties.getProperty(CERT_TTL_HOURS_PROPERTY);

        if (value == null || value.isBlank())
            return CertificateTtl.DEFAULT_TTL_HOURS;

        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new EConfig(String.format("Invalid certificate TTL: [%s]", value), e);
        }
    }
}
