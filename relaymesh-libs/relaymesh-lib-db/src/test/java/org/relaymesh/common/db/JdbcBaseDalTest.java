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

package org.relaymesh.common.db;

import org.relaymesh.common.exception.EMeshInternal;
import org.relaymesh.common.exception.EValidation;
import org.relaymesh.common.exception.ESecretValidation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;


class JdbcBaseDalTest {

    private static class KeyValueDal extends JdbcBaseDal {

        KeyValueDal(DataSource source) {
            super(source, JdbcDialect.H2);
        }

        void createTable() {

            executeTransaction(conn -> {
                try (var stmt = conn.createStatement()) {
                    stmt.execute("create table kv (k varchar(64) primary key, v varchar(256))");
                }
            }, this::insertError);
        }

        void put(String key, String value) {

            executeTransaction(conn -> {
                try (var stmt = conn.prepareStatement("insert into kv (k, v) values (?, ?)")) {
                    stmt.setString(1, key);
                    stmt.setString(2, value);
                    stmt.executeUpdate();
                }
            }, this::insertError);
        }

        void putThenFail(String key, String value) {

            executeTransaction(conn -> {
                try (var stmt = conn.prepareStatement("insert into kv (k, v) values (?, ?)")) {
                    stmt.setString(1, key);
                    stmt.setString(2, value);
                    stmt.executeUpdate();
                }
                throw new ESecretValidation("Rejected after insert");
            }, this::insertError);
        }

        String get(String key) {

            return wrapTransaction(conn -> {
                try (var stmt = conn.prepareStatement("select v from kv where k = ?")) {
                    stmt.setString(1, key);
                    try (var rs = stmt.executeQuery()) {
                        if (!rs.next())
                            throw new JdbcException(JdbcErrorCode.NO_DATA);
                        return rs.getString(1);
                    }
                }
            }, this::readError);
        }

        String rawQuery(String sql) {

            return wrapTransaction(conn -> {
                try (var stmt = conn.createStatement(); var rs = stmt.executeQuery(sql)) {
                    rs.next();
                    return rs.getString(1);
                }
            });
        }

        private EValidation insertError(SQLException error, JdbcErrorCode code) {

            if (code == JdbcErrorCode.INSERT_DUPLICATE)
                return new ESecretValidation("Duplicate key");

            return null;
        }

        private EValidation readError(SQLException error, JdbcErrorCode code) {

            if (code == JdbcErrorCode.NO_DATA)
                return new ESecretValidation("Key not found");

            return null;
        }
    }

    private DataSource source;
    private KeyValueDal dal;

    @BeforeEach
    void setup() {

        var props = new Properties();
        props.setProperty(JdbcSetup.DIALECT_PROPERTY, "h2");
        props.setProperty(JdbcSetup.JDBC_URL_PROPERTY, "mem:" + UUID.randomUUID());
        props.setProperty("h2.DB_CLOSE_DELAY", "-1");
        props.setProperty(JdbcSetup.POOL_SIZE_PROPERTY, "2");

        source = JdbcSetup.createDatasource(props);
        dal = new KeyValueDal(source);
        dal.createTable();
    }

    @AfterEach
    void teardown() {
        JdbcSetup.destroyDatasource(source);
    }

    @Test
    void roundTrip() {

        dal.put("alpha", "one");

        assertEquals("one", dal.get("alpha"));
    }

    @Test
    void duplicateInsert_mappedByHandler() {

        dal.put("alpha", "one");

        var error = assertThrows(ESecretValidation.class, () -> dal.put("alpha", "two"));
        assertEquals("Duplicate key", error.getMessage());
        assertEquals("one", dal.get("alpha"));
    }

    @Test
    void syntheticError_mappedByHandler() {

        var error = assertThrows(ESecretValidation.class, () -> dal.get("missing"));
        assertEquals("Key not found", error.getMessage());
    }

    @Test
    void runtimeError_rollsBack() {

        assertThrows(ESecretValidation.class, () -> dal.putThenFail("beta", "two"));
        assertThrows(ESecretValidation.class, () -> dal.get("beta"));
    }

    @Test
    void unhandledError_fallsBackToInternal() {

        assertThrows(EMeshInternal.class, () -> dal.rawQuery("select v from no_such_table"));
    }
}
