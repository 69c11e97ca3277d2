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

package org.relaymesh.plugins.aws;

import org.relaymesh.common.exception.EConfig;
import org.relaymesh.common.exception.EMesh;
import org.relaymesh.common.exception.ESecretValidation;
import org.relaymesh.secrets.backend.ISecretBackend;
import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.backend.SecretPayloads;
import org.relaymesh.secrets.model.SecretSpec;
import org.relaymesh.secrets.model.SecretType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerAsyncClient;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;

import javax.annotation.Nullable;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.regex.Pattern;

import static org.relaymesh.secrets.config.SecretsConfigKeys.*;


/**
 * Secret backend for AWS Secrets Manager.
 *
 * <p>Reference forms:</p>
 * <ul>
 *     <li>{@code arn:...} - a full secret ARN, read at {@code AWSCURRENT}</li>
 *     <li>{@code name} or {@code name@latest} - the configured prefix plus name, at {@code AWSCURRENT}</li>
 *     <li>{@code name@3} or {@code name@v3} - numeric versions, published as staging label {@code 3}</li>
 *     <li>{@code name@AWSPREVIOUS} - any upper case staging label</li>
 *     <li>{@code name@<version-id>} - an explicit version ID</li>
 * </ul>
 */
public class AwsSecretBackend implements ISecretBackend {

    static final String CURRENT_STAGE = "AWSCURRENT";

    private static final String ARN_PREFIX = "arn:";
    private static final String LATEST_VERSION = "latest";

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9/_+=.\\-]{1,512}$");
    private static final Pattern NUMERIC_VERSION_PATTERN = Pattern.compile("^v?(\\d+)$");
    private static final Pattern STAGE_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_]{0,255}$");
    private static final Pattern VERSION_ID_PATTERN = Pattern.compile("^[A-Za-z0-9\\-]{32,64}$");

    private static final Logger log = LoggerFactory.getLogger(AwsSecretBackend.class);

    private final SecretsManagerAsyncClient client;
    private final String accountId;
    private final String secretPrefix;
    private final AwsSecretErrors errors;

    public AwsSecretBackend(Properties properties) {
        this(buildClient(properties), properties);
    }

    AwsSecretBackend(SecretsManagerAsyncClient client, Properties properties) {

        var accountId = properties.getProperty(AWS_ACCOUNT_ID_PROPERTY);

        if (accountId == null || accountId.isBlank())
            throw new EConfig(String.format("Missing required property for AWS: [%s]", AWS_ACCOUNT_ID_PROPERTY));

        this.client = client;
        this.accountId = accountId.trim();
        this.secretPrefix = properties.getProperty(AWS_SECRET_PREFIX_PROPERTY, DEFAULT_AWS_SECRET_PREFIX);
        this.errors = new AwsSecretErrors(backendType().wireName());

        log.info("INIT [{}]: account = [{}], prefix = [{}]", backendType(), this.accountId, secretPrefix);
    }

    private static SecretsManagerAsyncClient buildClient(Properties properties) {

        var region = properties.getProperty(AWS_REGION_PROPERTY);
        var endpoint = properties.getProperty(AWS_ENDPOINT_PROPERTY);

        log.info("Using default AWS credentials chain, region = [{}], endpoint = [{}]",
                region != null ? region : "(default)",
                endpoint != null ? endpoint : "(default)");

        try {

            var clientBuilder = SecretsManagerAsyncClient.builder()
                    .credentialsProvider(DefaultCredentialsProvider.create());

            if (region != null && !region.isBlank())
                clientBuilder.region(Region.of(region.trim()));

            if (endpoint != null && !endpoint.isBlank())
                clientBuilder.endpointOverride(URI.create(endpoint.trim()));

            return clientBuilder.build();
        }
        catch (IllegalArgumentException | SdkClientException e) {

            var message = String.format("Invalid AWS Secrets Manager configuration: %s", e.getMessage());
            log.error(message);

            throw new EConfig(message, e);
        }
    }

    @Override
    public CompletionStage<SecretSpec> fetchSecret(String reference, SecretType expectedType) {

        log.debug("fetchSecret [{}], expected type = [{}]", reference, expectedType);

        AwsReference awsRef;

        try {
            awsRef = parseReference(reference);
        }
        catch (EMesh e) {
            return CompletableFuture.failedFuture(e);
        }

        var request = GetSecretValueRequest.builder().secretId(awsRef.secretId);

        if (awsRef.versionId != null)
            request.versionId(awsRef.versionId);
        else
            request.versionStage(awsRef.versionStage);

        return client.getSecretValue(request.build())
                .thenApply(response -> parsePayload(response, reference, expectedType))
                .handle((spec, error) -> handleResult("fetchSecret", reference, spec, error));
    }

    @Override
    public CompletionStage<Boolean> validateReference(String reference) {

        log.debug("validateReference [{}]", reference);

        AwsReference awsRef;

        try {
            awsRef = parseReference(reference);
        }
        catch (EMesh e) {
            return CompletableFuture.failedFuture(e);
        }

        var request = DescribeSecretRequest.builder()
                .secretId(awsRef.secretId)
                .build();

        return client.describeSecret(request)
                .handle((response, error) -> {

                    if (error != null && errors.isNotFound(error))
                        return false;

                    var described = handleResult("validateReference", reference, response, error);
                    return versionExists(described, awsRef);
                });
    }

    @Override
    public SecretBackendType backendType() {
        return SecretBackendType.AWS_SECRETS_MANAGER;
    }

    @Override
    public CompletionStage<Void> healthCheck() {

        var request = ListSecretsRequest.builder().maxResults(1).build();

        return client.listSecrets(request)
                .<Void>thenApply(response -> null)
                .handle((result, error) -> handleResult("healthCheck", "-", result, error));
    }

    AwsReference parseReference(String reference) {

        if (reference == null || reference.isBlank())
            throw new ESecretValidation("AWS secret reference cannot be empty");

        var trimmed = reference.trim();

        if (trimmed.startsWith(ARN_PREFIX))
            return new AwsReference(checkArn(trimmed), CURRENT_STAGE, null);

        var separator = trimmed.lastIndexOf('@');
        var name = separator >= 0 ? trimmed.substring(0, separator) : trimmed;
        var version = separator >= 0 ? trimmed.substring(separator + 1) : null;

        if (!NAME_PATTERN.matcher(name).matches())
            throw new ESecretValidation(String.format("Invalid AWS secret name: [%s]", reference));

        var secretId = secretPrefix + name;

        if (version == null || version.equalsIgnoreCase(LATEST_VERSION))
            return new AwsReference(secretId, CURRENT_STAGE, null);

        var numericVersion = NUMERIC_VERSION_PATTERN.matcher(version);

        if (numericVersion.matches())
            return new AwsReference(secretId, numericVersion.group(1), null);

        if (STAGE_PATTERN.matcher(version).matches())
            return new AwsReference(secretId, version, null);

        if (VERSION_ID_PATTERN.matcher(version).matches())
            return new AwsReference(secretId, null, version);

        throw new ESecretValidation(String.format("Invalid version in AWS secret reference: [%s]", reference));
    }

    private String checkArn(String arn) {

        // arn:partition:secretsmanager:region:account-id:secret:name
        var parts = arn.split(":", 7);

        if (parts.length != 7 || !"secretsmanager".equals(parts[2]) || !"secret".equals(parts[5]) || parts[6].isEmpty())
            throw new ESecretValidation(String.format("Invalid AWS secret ARN: [%s]", arn));

        if (!accountId.equals(parts[4]))
            throw new ESecretValidation(String.format(
                    "AWS secret ARN belongs to a different account: [%s]", arn));

        return arn;
    }

    private SecretSpec parsePayload(GetSecretValueResponse response, String reference, SecretType expectedType) {

        byte[] payload;

        if (response.secretString() != null)
            payload = response.secretString().getBytes(StandardCharsets.UTF_8);
        else if (response.secretBinary() != null)
            payload = response.secretBinary().asByteArray();
        else
            payload = new byte[0];

        return SecretPayloads.parse(payload, expectedType, sourceDescription(reference));
    }

    private static boolean versionExists(DescribeSecretResponse response, AwsReference awsRef) {

        // Secrets pending deletion cannot be read
        if (response.deletedDate() != null)
            return false;

        if (!response.hasVersionIdsToStages())
            return awsRef.versionStage != null && awsRef.versionStage.equals(CURRENT_STAGE);

        var versions = response.versionIdsToStages();

        if (awsRef.versionId != null)
            return versions.containsKey(awsRef.versionId);

        return versions.values().stream().anyMatch(stages -> stages.contains(awsRef.versionStage));
    }

    private <T> T handleResult(String operation, String reference, T result, Throwable error) {

        if (error == null)
            return result;

        var handled = errors.handleException(operation, reference, error);

        log.warn("{} [{}] failed: {}", operation, reference, handled.getClass().getSimpleName());

        throw handled;
    }

    private static String sourceDescription(String reference) {
        return String.format("aws:%s", reference);
    }

    static final class AwsReference {

        final String secretId;
        final String versionStage;
        final String versionId;

        AwsReference(String secretId, @Nullable String versionStage, @Nullable String versionId) {
            this.secretId = secretId;
            this.versionStage = versionStage;
            this.versionId = versionId;
        }
    }
}
