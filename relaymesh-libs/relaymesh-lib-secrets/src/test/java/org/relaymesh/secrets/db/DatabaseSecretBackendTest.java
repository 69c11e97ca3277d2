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

import org.relaymesh.common.db.JdbcDialect;
import org.relaymesh.common.db.JdbcSetup;
import org.relaymesh.common.exception.ESecretCommunication;
import org.relaymesh.common.exception.ESecretNotFound;
import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.crypto.EncryptionConfig;
import org.relaymesh.secrets.crypto.SecretEncryption;
import org.relaymesh.secrets.model.GenericSecretSpec;
import org.relaymesh.secrets.model.SecretType;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;


class DatabaseSecretBackendTest {

    private DataSource source;
    private ExecutorService executor;
    private JdbcSecretStore store;
    private DatabaseSecretBackend backend;

    @BeforeEach
    void setup() {

        source = JdbcSecretStoreTest.h2Source();
        executor = Executors.newFixedThreadPool(2);

        var encryption = new SecretEncryption(new EncryptionConfig(JdbcSecretStoreTest.randomKey(), "v1"));
        store = new JdbcSecretStore(source, JdbcDialect.H2, encryption);
        store.createSchema();

        backend = new DatabaseSecretBackend(store, executor);
    }

    @AfterEach
    void teardown() {

        executor.shutdownNow();
        JdbcSetup.destroyDatasource(source);
    }

    @Test
    void fetchSecret() {

        store.createSecret("payments", "db-password", new GenericSecretSpec("c2VjcmV0"));

        var spec = backend.fetchSecret("payments/db-password", SecretType.GENERIC_SECRET).toCompletableFuture().join();

        assertEquals(new GenericSecretSpec("c2VjcmV0"), spec);
        assertEquals(SecretBackendType.DATABASE, backend.backendType());
    }

    @Test
    void fetchSecret_notFound() {

        var result = backend.fetchSecret("payments/missing", SecretType.GENERIC_SECRET).toCompletableFuture();

        var error = assertThrows(CompletionException.class, result::join);
        assertTrue(error.getCause() instanceof ESecretNotFound);
    }

    @Test
    void validateReference() {

        store.createSecret("payments", "db-password", new GenericSecretSpec("c2VjcmV0"));

        assertTrue(backend.validateReference("payments/db-password").toCompletableFuture().join());
        assertFalse(backend.validateReference("payments/other").toCompletableFuture().join());
    }

    @Test
    void healthCheck() {

        assertDoesNotThrow(() -> backend.healthCheck().toCompletableFuture().join());
    }

    @Test
    void healthCheck_databaseDown() throws Exception {

        var brokenSource = mock(DataSource.class);
        when(brokenSource.getConnection()).thenThrow(new SQLTransientConnectionException("Connection refused"));

        var encryption = new SecretEncryption(new EncryptionConfig(JdbcSecretStoreTest.randomKey(), "v1"));
        var brokenStore = new JdbcSecretStore(brokenSource, JdbcDialect.H2, encryption);
        var brokenBackend = new DatabaseSecretBackend(brokenStore, executor);

        var result = brokenBackend.healthCheck().toCompletableFuture();

        var error = assertThrows(CompletionException.class, result::join);
        assertTrue(error.getCause() instanceof ESecretCommunication);
    }

    @Test
    void fetchAndValidate_databaseDown() throws Exception {

        var brokenSource = mock(DataSource.class);
        when(brokenSource.getConnection()).thenThrow(new SQLTransientConnectionException("Connection refused"));

        var encryption = new SecretEncryption(new EncryptionConfig(JdbcSecretStoreTest.randomKey(), "v1"));
        var brokenStore = new JdbcSecretStore(brokenSource, JdbcDialect.H2, encryption);
        var brokenBackend = new DatabaseSecretBackend(brokenStore, executor);

        var fetch = brokenBackend.fetchSecret("payments/db-password", SecretType.GENERIC_SECRET).toCompletableFuture();
        var fetchError = assertThrows(CompletionException.class, fetch::join);
        assertTrue(fetchError.getCause() instanceof ESecretCommunication);

        var validate = brokenBackend.validateReference("payments/db-password").toCompletableFuture();
        var validateError = assertThrows(CompletionException.class, validate::join);
        assertTrue(validateError.getCause() instanceof ESecretCommunication);
    }

    @Test
    void storeWrites_databaseDown() throws Exception {

        var brokenSource = mock(DataSource.class);
        when(brokenSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

        var encryption = new SecretEncryption(new EncryptionConfig(JdbcSecretStoreTest.randomKey(), "v1"));
        var brokenStore = new JdbcSecretStore(brokenSource, JdbcDialect.H2, encryption);

        assertThrows(ESecretCommunication.class,
                () -> brokenStore.createSecret("payments", "db-password", new GenericSecretSpec("c2VjcmV0")));
        assertThrows(ESecretCommunication.class, () -> brokenStore.deleteSecret("sec_0123"));
    }

    @Test
    void errorClassification() {

        var errors = new DatabaseSecretErrors();

        var timeout = errors.handleException("fetchSecret", "ref", new SQLTransientConnectionException("timeout"));
        var other = errors.handleException("fetchSecret", "ref", new SQLException("broken"));
        var passThrough = new ESecretNotFound("missing");

        assertTrue(timeout instanceof ESecretCommunication);
        assertTrue(timeout.getMessage().contains("did not respond in time"));
        assertTrue(other instanceof ESecretCommunication);
        assertSame(passThrough, errors.handleException("fetchSecret", "ref", new CompletionException(passThrough)));
    }
}
