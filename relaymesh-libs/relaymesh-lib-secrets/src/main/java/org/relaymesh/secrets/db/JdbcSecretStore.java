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

import org.relaymesh.common.db.JdbcBaseDal;
import org.relaymesh.common.db.JdbcDialect;
import org.relaymesh.common.db.JdbcErrorCode;
import org.relaymesh.common.db.JdbcException;
import org.relaymesh.common.exception.*;
import org.relaymesh.secrets.backend.SecretBackendErrors;
import org.relaymesh.secrets.crypto.EncryptedSecret;
import org.relaymesh.secrets.crypto.SecretEncryption;
import org.relaymesh.secrets.model.SecretJson;
import org.relaymesh.secrets.model.SecretSpec;
import org.relaymesh.secrets.model.SecretType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;


/**
 * Encrypted secret storage in a relational database.
 *
 * <p>Payloads are stored as tagged JSON, encrypted with {@link SecretEncryption}. Each write
 * produces a new ciphertext with a new nonce, existing ciphertext is never modified in place.</p>
 */
public class JdbcSecretStore extends JdbcBaseDal {

    private static final String SCHEMA_RESOURCE = "db/secrets_schema.sql";

    private static final String SELECT_COLUMNS =
            "select secret_id, team, secret_name, secret_type, configuration_encrypted, nonce, " +
            "key_version, version, created_at, updated_at from secrets ";

    private static final Logger log = LoggerFactory.getLogger(JdbcSecretStore.class);

    private final SecretEncryption encryption;
    private final SecretBackendErrors errors;
    private final Clock clock;

    public JdbcSecretStore(DataSource source, JdbcDialect dialect, SecretEncryption encryption, Clock clock) {

        super(source, dialect);

        this.encryption = encryption;
        this.errors = new DatabaseSecretErrors();
        this.clock = clock;
    }

    public JdbcSecretStore(DataSource source, JdbcDialect dialect, SecretEncryption encryption) {
        this(source, dialect, encryption, Clock.systemUTC());
    }

    public void createSchema() {

        var ddl = loadSchemaDdl();

        executeTransaction(conn -> {
            try (var stmt = conn.createStatement()) {
                stmt.execute(ddl);
            }
        }, (error, code) -> null);

        log.info("Secret store schema is ready");
    }

    public StoredSecret createSecret(String team, String name, SecretSpec spec) {

        if (name == null || name.isBlank())
            throw new ESecretValidation("Secret name is empty");

        if (name.contains("/") || (team != null && team.contains("/")))
            throw new ESecretValidation(String.format("Secret team and name cannot contain '/': [%s/%s]", team, name));

        // Bare references with this prefix are read as secret IDs
        if (name.startsWith(SecretReference.ID_PREFIX))
            throw new ESecretValidation(String.format(
                    "Secret name cannot start with '%s': [%s]", SecretReference.ID_PREFIX, name));

        spec.validate();

        var secretId = SecretReference.ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
        var encrypted = encryptSpec(spec);
        var now = clock.instant();

        var query =
                "insert into secrets (secret_id, team, secret_name, secret_type, configuration_encrypted, " +
                "nonce, key_version, version, created_at, updated_at) values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        executeTransaction(conn -> {

            try (var stmt = conn.prepareStatement(query)) {

                stmt.setString(1, secretId);
                stmt.setString(2, team);
                stmt.setString(3, name);
                stmt.setString(4, spec.secretType().wireName());
                stmt.setBytes(5, encrypted.ciphertext());
                stmt.setBytes(6, encrypted.nonce());
                stmt.setString(7, encrypted.keyVersion());
                stmt.setInt(8, 1);
                stmt.setTimestamp(9, Timestamp.from(now));
                stmt.setTimestamp(10, Timestamp.from(now));

                stmt.executeUpdate();
            }

        }, (error, code) -> writeError("createSecret", error, code, team + "/" + name));

        log.info("Created secret [{}] ({}) for team [{}]", name, secretId, team);

        return new StoredSecret(secretId, team, name, spec.secretType(), 1, encrypted.keyVersion(), now, now);
    }

    /**
     * Replace the payload of an existing secret. The secret type cannot change.
     */
    public StoredSecret updateSecret(String secretId, SecretSpec spec) {

        spec.validate();

        var encrypted = encryptSpec(spec);
        var now = clock.instant();

        var stored = wrapTransaction(conn -> {

            var existing = readRow(conn, SecretReference.parse(secretId));

            if (existing.isEmpty())
                throw new JdbcException(JdbcErrorCode.NO_DATA);

            var prior = existing.get().metadata;

            if (prior.secretType() != spec.secretType())
                throw new ESecretValidation(String.format(
                        "Secret type cannot be changed: [%s] (%s -> %s)",
                        secretId, prior.secretType(), spec.secretType()));

            var query =
                    "update secrets set configuration_encrypted = ?, nonce = ?, key_version = ?, " +
                    "version = ?, updated_at = ? where secret_id = ? and version = ?";

            try (var stmt = conn.prepareStatement(query)) {

                stmt.setBytes(1, encrypted.ciphertext());
                stmt.setBytes(2, encrypted.nonce());
                stmt.setString(3, encrypted.keyVersion());
                stmt.setInt(4, prior.version() + 1);
                stmt.setTimestamp(5, Timestamp.from(now));
                stmt.setString(6, secretId);
                stmt.setInt(7, prior.version());

                if (stmt.executeUpdate() != 1)
                    throw new JdbcException(JdbcErrorCode.NO_DATA);
            }

            return new StoredSecret(
                    secretId, prior.team(), prior.name(), prior.secretType(),
                    prior.version() + 1, encrypted.keyVersion(), prior.createdAt(), now);

        }, (error, code) -> readError("updateSecret", error, code, secretId));

        log.info("Updated secret [{}] to version {}", secretId, stored.version());

        return stored;
    }

    public void deleteSecret(String secretId) {

        executeTransaction(conn -> {

            try (var stmt = conn.prepareStatement("delete from secrets where secret_id = ?")) {

                stmt.setString(1, secretId);

                if (stmt.executeUpdate() != 1)
                    throw new JdbcException(JdbcErrorCode.NO_DATA);
            }

        }, (error, code) -> readError("deleteSecret", error, code, secretId));

        log.info("Deleted secret [{}]", secretId);
    }

    public Optional<StoredSecret> readMetadata(String reference) {

        var parsed = SecretReference.parse(reference);

        return wrapTransaction(conn -> readRow(conn, parsed).map(row -> row.metadata),
                (error, code) -> readError("readMetadata", error, code, reference));
    }

    /**
     * Read and decrypt a secret.
     *
     * @throws ESecretNotFound if the reference does not exist
     * @throws ESecretValidation if the stored type differs from the expected type
     * @throws EDecryption if the payload cannot be decrypted
     */
    public SecretSpec readSecret(String reference, SecretType expectedType) {

        var parsed = SecretReference.parse(reference);

        var row = wrapTransaction(conn -> readRow(conn, parsed), (error, code) -> readError("readSecret", error, code, reference))
                .orElseThrow(() -> new ESecretNotFound(String.format("Secret not found in database: [%s]", reference)));

        if (row.metadata.secretType() != expectedType)
            throw new ESecretValidation(String.format(
                    "Secret type mismatch: [%s] (expected %s, found %s)",
                    reference, expectedType, row.metadata.secretType()));

        var plaintext = encryption.decrypt(row.encrypted);

        try {

            var spec = SecretJson.decode(plaintext);

            if (spec.secretType() != expectedType)
                throw new ESecretValidation(String.format(
                        "Secret type mismatch: [%s] (expected %s, found %s)",
                        reference, expectedType, spec.secretType()));

            return spec;
        }
        finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    public boolean secretExists(String reference) {

        var parsed = SecretReference.parse(reference);

        return wrapTransaction(conn -> {

            try (var stmt = prepareLookup(conn, "select count(*) from secrets ", parsed);
                 var rs = stmt.executeQuery()) {

                return rs.next() && rs.getLong(1) > 0;
            }

        }, (error, code) -> readError("secretExists", error, code, reference));
    }

    /**
     * Re-encrypt a secret under the active key, keeping its payload and version.
     */
    public StoredSecret reEncryptSecret(String secretId) {

        var now = clock.instant();

        return wrapTransaction(conn -> {

            var existing = readRow(conn, SecretReference.parse(secretId));

            if (existing.isEmpty())
                throw new JdbcException(JdbcErrorCode.NO_DATA);

            var row = existing.get();
            var encrypted = encryption.reEncrypt(row.encrypted);

            var query =
                    "update secrets set configuration_encrypted = ?, nonce = ?, key_version = ?, updated_at = ? " +
                    "where secret_id = ?";

            try (var stmt = conn.prepareStatement(query)) {

                stmt.setBytes(1, encrypted.ciphertext());
                stmt.setBytes(2, encrypted.nonce());
                stmt.setString(3, encrypted.keyVersion());
                stmt.setTimestamp(4, Timestamp.from(now));
                stmt.setString(5, secretId);
                stmt.executeUpdate();
            }

            var prior = row.metadata;

            return new StoredSecret(
                    secretId, prior.team(), prior.name(), prior.secretType(),
                    prior.version(), encrypted.keyVersion(), prior.createdAt(), now);

        }, (error, code) -> readError("reEncryptSecret", error, code, secretId));
    }

    public void ping() {

        executeTransaction(conn -> {
            try (var stmt = conn.createStatement(); var rs = stmt.executeQuery(dialect.healthCheckQuery())) {
                rs.next();
            }
        }, (error, code) -> new ESecretCommunication("Database health check failed", error));
    }

    private EncryptedSecret encryptSpec(SecretSpec spec) {

        var plaintext = SecretJson.encode(spec);

        try {
            return encryption.encrypt(plaintext);
        }
        finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    private Optional<SecretRow> readRow(Connection conn, SecretReference reference) throws SQLException {

        try (var stmt = prepareLookup(conn, SELECT_COLUMNS, reference); var rs = stmt.executeQuery()) {

            if (!rs.next())
                return Optional.empty();

            var metadata = new StoredSecret(
                    rs.getString(1),
                    rs.getString(2),
                    rs.getString(3),
                    SecretType.fromWireName(rs.getString(4)),
                    rs.getInt(8),
                    rs.getString(7),
                    toInstant(rs.getTimestamp(9)),
                    toInstant(rs.getTimestamp(10)));

            var encrypted = new EncryptedSecret(rs.getBytes(5), rs.getBytes(6), rs.getString(7));

            return Optional.of(new SecretRow(metadata, encrypted));
        }
    }

    private PreparedStatement prepareLookup(Connection conn, String select, SecretReference reference) throws SQLException {

        PreparedStatement stmt;

        if (reference.isId()) {
            stmt = conn.prepareStatement(select + "where secret_id = ?");
            stmt.setString(1, reference.secretId);
        }
        else if (reference.hasTeam()) {
            stmt = conn.prepareStatement(select + "where team = ? and secret_name = ?");
            stmt.setString(1, reference.team);
            stmt.setString(2, reference.name);
        }
        else {
            stmt = conn.prepareStatement(select + "where secret_name = ? order by created_at");
            stmt.setString(1, reference.name);
            stmt.setMaxRows(1);
        }

        return stmt;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private EMesh writeError(String operation, SQLException error, JdbcErrorCode code, String reference) {

        if (code == JdbcErrorCode.INSERT_DUPLICATE)
            return errors.explicitError(operation, reference, SecretBackendErrors.ExplicitError.SECRET_ALREADY_EXISTS, error);

        return errors.handleException(operation, reference, error);
    }

    private EMesh readError(String operation, SQLException error, JdbcErrorCode code, String reference) {

        if (code == JdbcErrorCode.NO_DATA)
            return new ESecretNotFound(String.format("Secret not found in database: [%s]", reference), error);

        return errors.handleException(operation, reference, error);
    }

    private String loadSchemaDdl() {

        var classLoader = getClass().getClassLoader();

        try (var stream = classLoader.getResourceAsStream(SCHEMA_RESOURCE)) {

            if (stream == null)
                throw new EMeshInternal("Missing schema resource for the secret store: " + SCHEMA_RESOURCE);

            try (var rawReader = new InputStreamReader(stream, StandardCharsets.UTF_8); var reader = new BufferedReader(rawReader)) {
                return reader.lines().collect(Collectors.joining(System.lineSeparator()));
            }
        }
        catch (IOException e) {
            throw new EMeshInternal("Error reading schema resource for the secret store: " + SCHEMA_RESOURCE, e);
        }
    }

    private static final class SecretRow {

        private final StoredSecret metadata;
        private final EncryptedSecret encrypted;

        SecretRow(StoredSecret metadata, EncryptedSecret encrypted) {
            this.metadata = metadata;
            this.encrypted = encrypted;
        }
    }
}
