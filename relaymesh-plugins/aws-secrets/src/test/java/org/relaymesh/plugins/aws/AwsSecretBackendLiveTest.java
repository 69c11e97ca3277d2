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

import org.relaymesh.common.config.EnvConfig;
import org.relaymesh.secrets.model.SecretType;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.relaymesh.secrets.config.SecretsConfigKeys.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;


/**
 * Runs against a real Secrets Manager account (or LocalStack, via RELAYMESH_AWS_ENDPOINT).
 * Needs RELAYMESH_AWS_ACCOUNT_ID and RELAYMESH_AWS_TEST_SECRET, a generic secret under the configured prefix.
 */
@Tag("integration")
class AwsSecretBackendLiveTest {

    private static final String TEST_SECRET_ENV = "RELAYMESH_AWS_TEST_SECRET";

    private static EnvConfig env;
    private static AwsSecretBackend backend;

    @BeforeAll
    static void setup() {

        env = EnvConfig.fromSystem();
        assumeTrue(env.isPresent(AWS_ACCOUNT_ID_ENV) && env.isPresent(TEST_SECRET_ENV));

        var properties = new Properties();
        env.copyTo(properties, AWS_ACCOUNT_ID_PROPERTY, AWS_ACCOUNT_ID_ENV);
        env.copyTo(properties, AWS_REGION_PROPERTY, AWS_REGION_ENV);
        env.copyTo(properties, AWS_SECRET_PREFIX_PROPERTY, AWS_SECRET_PREFIX_ENV);
        env.copyTo(properties, AWS_ENDPOINT_PROPERTY, AWS_ENDPOINT_ENV);

        backend = new AwsSecretBackend(properties);
    }

    @Test
    void healthCheck() {
        assertDoesNotThrow(() -> backend.healthCheck().toCompletableFuture().join());
    }

    @Test
    void fetchAndValidate() {

        var reference = env.required(TEST_SECRET_ENV);

        assertTrue(backend.validateReference(reference).toCompletableFuture().join());
        assertNotNull(backend.fetchSecret(reference, SecretType.GENERIC_SECRET).toCompletableFuture().join());
        assertFalse(backend.validateReference(reference + "-does-not-exist").toCompletableFuture().join());
    }
}
