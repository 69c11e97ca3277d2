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

package org.relaymesh.secrets.config;


/**
 * Environment variable names and plugin property keys for the secrets subsystem.
 *
 * <p>Where two environment names are listed, the RelayMesh-specific name takes priority
 * over the tool's standard name.</p>
 */
public final class SecretsConfigKeys {

    private SecretsConfigKeys() {}

    // Cache

    public static final String CACHE_TTL_SECONDS_ENV = "RELAYMESH_SECRET_CACHE_TTL_SECONDS";
    public static final int DEFAULT_CACHE_TTL_SECONDS = 300;

    // Vault KV

    public static final String[] VAULT_ADDRESS_ENV = {"RELAYMESH_VAULT_ADDR", "VAULT_ADDR"};
    public static final String[] VAULT_TOKEN_ENV = {"RELAYMESH_VAULT_TOKEN", "VAULT_TOKEN"};
    public static final String[] VAULT_NAMESPACE_ENV = {"RELAYMESH_VAULT_NAMESPACE", "VAULT_NAMESPACE"};
    public static final String VAULT_KV_MOUNT_ENV = "RELAYMESH_VAULT_KV_MOUNT";
    public static final String VAULT_SECRET_PREFIX_ENV = "RELAYMESH_VAULT_SECRET_PREFIX";

    public static final String VAULT_ADDRESS_PROPERTY = "vault.address";
    public static final String VAULT_TOKEN_PROPERTY = "vault.token";
    public static final String VAULT_NAMESPACE_PROPERTY = "vault.namespace";
    public static final String VAULT_KV_MOUNT_PROPERTY = "vault.kvMount";
    public static final String VAULT_SECRET_PREFIX_PROPERTY = "vault.secretPrefix";

    public static final String DEFAULT_VAULT_KV_MOUNT = "secret";

    // Vault PKI

    public static final String VAULT_PKI_MOUNT_ENV = "RELAYMESH_VAULT_PKI_MOUNT_PATH";
    public static final String VAULT_PKI_ROLE_ENV = "RELAYMESH_VAULT_PKI_ROLE";

    public static final String VAULT_PKI_MOUNT_PROPERTY = "vault.pki.mount";
    public static final String VAULT_PKI_ROLE_PROPERTY = "vault.pki.role";

    public static final String DEFAULT_VAULT_PKI_ROLE = "relaymesh-proxy";

    // AWS Secrets Manager

    public static final String AWS_ACCOUNT_ID_ENV = "RELAYMESH_AWS_ACCOUNT_ID";
    public static final String[] AWS_REGION_ENV = {"RELAYMESH_AWS_REGION", "AWS_REGION"};
    public static final String AWS_SECRET_PREFIX_ENV = "RELAYMESH_AWS_SECRET_PREFIX";
    public static final String AWS_ENDPOINT_ENV = "RELAYMESH_AWS_ENDPOINT";

    public static final String AWS_ACCOUNT_ID_PROPERTY = "aws.accountId";
    public static final String AWS_REGION_PROPERTY = "aws.region";
    public static final String AWS_SECRET_PREFIX_PROPERTY = "aws.secretPrefix";
    public static final String AWS_ENDPOINT_PROPERTY = "aws.endpoint";

    public static final String DEFAULT_AWS_SECRET_PREFIX = "relaymesh/";

    // GCP Secret Manager

    public static final String[] GCP_PROJECT_ID_ENV = {"RELAYMESH_GCP_PROJECT_ID", "GCP_PROJECT_ID"};
    public static final String GCP_SECRET_PREFIX_ENV = "RELAYMESH_GCP_SECRET_PREFIX";

    public static final String GCP_PROJECT_ID_PROPERTY = "gcp.projectId";
    public static final String GCP_SECRET_PREFIX_PROPERTY = "gcp.secretPrefix";

    // GCP secret IDs only allow letters, digits, dashes and underscores
    public static final String DEFAULT_GCP_SECRET_PREFIX = "relaymesh-";

    // Certificates

    public static final String CERT_BACKEND_MOCK_ENV = "RELAYMESH_CERT_BACKEND_MOCK";
    public static final String SPIFFE_TRUST_DOMAIN_ENV = "RELAYMESH_SPIFFE_TRUST_DOMAIN";

    public static final String TRUST_DOMAIN_PROPERTY = "cert.trustDomain";
    public static final String CERT_TTL_HOURS_PROPERTY = "cert.ttlHours";
}
