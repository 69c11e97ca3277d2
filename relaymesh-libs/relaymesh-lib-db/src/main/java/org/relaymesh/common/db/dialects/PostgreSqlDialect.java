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

package org.relaymesh.common.db.dialects;

import org.relaymesh.common.db.JdbcDialect;
import org.relaymesh.common.db.JdbcErrorCode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Map;


public class PostgreSqlDialect extends Dialect {

    private static final Map<Integer, JdbcErrorCode> dialectErrorCodes = Map.ofEntries(
            Map.entry(23505, JdbcErrorCode.INSERT_DUPLICATE),
            Map.entry(23503, JdbcErrorCode.INSERT_MISSING_FK));

    private static final Logger log = LoggerFactory.getLogger(PostgreSqlDialect.class);

    PostgreSqlDialect() {}

    @Override
    public JdbcDialect dialectCode() {
        return JdbcDialect.POSTGRESQL;
    }

    @Override
    protected JdbcErrorCode mapDialectErrorCode(SQLException error) {

        // Postgres reports its codes in the SQL state, the vendor error code is always zero
        var errorCodeString = error.getSQLState();

        try {
            var errorCode = Integer.parseInt(errorCodeString);
            return dialectErrorCodes.getOrDefault(errorCode, JdbcErrorCode.UNKNOWN_ERROR_CODE);
        }
        catch (NumberFormatException e) {
            log.error("PostgreSQL error state is not an integer error code: [{}]", errorCodeString);
            return JdbcErrorCode.UNKNOWN_ERROR_CODE;
        }
    }
}
