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
import org.relaymesh.common.exception.ESecretCommunication;
import org.relaymesh.secrets.model.SecretJson;
import org.relaymesh.secrets.model.SecretString;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.CompletionStage;

import static org.relaymesh.secrets.config.SecretsConfigKeys.*;


/**
 * Minimal async client for the Vault HTTP API, shared by the KV and PKI backends.
 *
 * <p>Only the token is used for authentication. The token is sent as a header and never logged.</p>
 */
public class VaultClient {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private static final String TOKEN_HEADER = "X-Vault-Token";
    private static final String NAMESPACE_HEADER = "X-Vault-Namespace";

    private static final Logger log = LoggerFactory.getLogger(VaultClient.class);

    private final URI address;
    private final SecretString token;
    private final String namespace;
    private final HttpClient http;

    public static VaultClient fromProperties(Properties properties) {

        var address = properties.getProperty(VAULT_ADDRESS_PROPERTY);
        var token = properties.getProperty(VAULT_TOKEN_PROPERTY);
        var namespace = properties.getProperty(VAULT_NAMESPACE_PROPERTY);

        if (address == null || address.isBlank())
            throw new EConfig(String.format("Missing required property for Vault: [%s]", VAULT_ADDRESS_PROPERTY));

        URI addressUri;

        try {
            addressUri = URI.create(address.trim());
        }
        catch (IllegalArgumentException e) {
            throw new EConfig(String.format("Invalid Vault address: [%s]", address), e);
        }

        if (addressUri.getScheme() == null || addressUri.getHost() == null)
            throw new EConfig(String.format("Invalid Vault address: [%s]", address));

        if (token == null || token.isBlank())
            log.warn("No Vault token configured, requests to [{}] will be unauthenticated", addressUri);

        return new VaultClient(addressUri, new SecretString(token), namespace);
    }

    public VaultClient(URI address, SecretString token, @Nullable String namespace) {

        this.address = address;
        this.token = token;
        this.namespace = namespace != null && !namespace.isBlank() ? namespace.trim() : null;

        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public URI address() {
        return address;
    }

    public CompletionStage<VaultResponse> get(String apiPath) {

        var request = requestBuilder(apiPath).GET().build();
        return send(request);
    }

    public CompletionStage<VaultResponse> post(String apiPath, JsonNode body) {

        byte[] content;

        try {
            content = SecretJson.mapper().writeValueAsBytes(body);
        }
        catch (IOException e) {
            throw new ESecretCommunication("Failed to encode Vault request body", e);
        }

        var request = requestBuilder(apiPath)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(content))
                .build();

        return send(request);
    }

    private HttpRequest.Builder requestBuilder(String apiPath) {

        var builder = HttpRequest.newBuilder()
                .uri(address.resolve(apiPath))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json");

        if (!token.isEmpty())
            builder.header(TOKEN_HEADER, token.expose());

        if (namespace != null)
            builder.header(NAMESPACE_HEADER, namespace);

        return builder;
    }

    private CompletionStage<VaultResponse> send(HttpRequest request) {

        return http.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> new VaultResponse(response.statusCode(), response.body()));
    }

    public static class VaultResponse {

        private final int statusCode;
        private final byte[] content;

        VaultResponse(int statusCode, byte[] content) {
            this.statusCode = statusCode;
            this.content = content;
        }

        public int statusCode() {
            return statusCode;
        }

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }

        public JsonNode body() {

            if (content == null || content.length == 0)
                return MissingNode.getInstance();

            try {
                var node = SecretJson.mapper().readTree(content);
                return node != null ? node : MissingNode.getInstance();
            }
            catch (IOException e) {
                throw new ESecretCommunication("Vault returned a response that is not valid JSON", e);
            }
        }
    }
}
