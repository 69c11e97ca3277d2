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

package org.relaymesh.secrets.db;

import org.relaymesh.secrets.backend.ISecretBackend;
import org.relaymesh.secrets.backend.SecretBackendErrors;
import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.model.SecretSpec;
import org.relaymesh.secrets.model.SecretType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;


/**
 * Secret backend over the local encrypted store.
 *
 * <p>JDBC calls block, they run on the supplied executor.</p>
 */
public class DatabaseSecretBackend implements ISecretBackend {

    private static final Logger log = LoggerFactory.getLogger(DatabaseSecretBackend.class);

    private final JdbcSecretStore store;
    private final Executor executor;
    private final SecretBackendErrors errors;

    public DatabaseSecretBackend(JdbcSecretStore store, Executor executor) {

        this.store = store;
        this.executor = executor;
        this.errors = new DatabaseSecretErrors();

        log.info("INIT [{}]", backendType());
    }

    @Override
    public CompletionStage<SecretSpec> fetchSecret(String reference, SecretType expectedType) {

        log.debug("fetchSecret [{}], expected type = [{}]", reference, expectedType);

        return CompletableFuture
                .supplyAsync(() -> store.readSecret(reference, expectedType), executor)
                .handle((spec, error) -> handleResult("fetchSecret", reference, spec, error));
    }

    @Override
    public CompletionStage<Boolean> validateReference(String reference) {

        log.debug("validateReference [{}]", reference);

        return CompletableFuture
                .supplyAsync(() -> store.secretExists(reference), executor)
                .handle((exists, error) -> handleResult("validateReference", reference, exists, error));
    }

    @Override
    public SecretBackendType backendType() {
        return SecretBackendType.DATABASE;
    }

    @Override
    public CompletionStage<Void> healthCheck() {

        return CompletableFuture
                .runAsync(store::ping, executor)
                .handle((result, error) -> handleResult("healthCheck", "-", result, error));
    }

    private <T> T handleResult(String operation, String reference, T result, Throwable error) {

        if (error == null)
            return result;

        var handled = errors.handleException(operation, reference, error);

        log.warn("{} [{}] failed: {}", operation, reference, handled.getClass().getSimpleName());

        throw handled;
    }
}
