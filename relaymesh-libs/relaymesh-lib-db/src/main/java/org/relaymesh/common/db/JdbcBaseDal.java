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

import org.relaymesh.common.db.dialects.Dialect;
import org.relaymesh.common.db.dialects.IDialect;
import org.relaymesh.common.exception.EMesh;
import org.relaymesh.common.exception.EMeshInternal;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.text.MessageFormat;


/**
 * Base class for JDBC data access, runs each unit of work in its own transaction.
 *
 * <p>SQL errors are mapped through the dialect to a {@link JdbcErrorCode} and handed
 * to an error handler, which converts them into the RelayMesh exception hierarchy.</p>
 */
public class JdbcBaseDal {

    private static final String UNHANDLED_ERROR = "Unhandled SQL Error code: {0}";

    private final DataSource source;
    private final JdbcErrorHandler errorHandler;

    protected final IDialect dialect;

    protected JdbcBaseDal(DataSource source, JdbcDialect dialect) {
        this.source = source;
        this.errorHandler = new FallbackErrorHandler();
        this.dialect = Dialect.dialectFor(dialect);
    }

    protected <TResult> TResult wrapTransaction(JdbcFunction<TResult> func) {

        return wrapTransaction(func, this.errorHandler);
    }

    protected <TResult> TResult wrapTransaction(JdbcFunction<TResult> func, JdbcErrorHandler errorHandler) {

        try (var conn = source.getConnection()) {

            conn.setAutoCommit(false);

            try {

                var result = func.apply(conn);
                conn.commit();

                return result;
            }
            catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
        catch (SQLException error) {

            var errorCode = dialect.mapErrorCode(error);
            var handled = errorHandler.handle(error, errorCode);

            if (handled != null)
                throw handled;

            throw this.errorHandler.handle(error, errorCode);
        }
    }

    protected void executeTransaction(JdbcAction func, JdbcErrorHandler errorHandler) {

        wrapTransaction(conn -> {
            func.apply(conn);
            return null;
        }, errorHandler);
    }

    @FunctionalInterface
    protected interface JdbcFunction <TResult> {

        TResult apply(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    protected interface JdbcAction {

        void apply(Connection conn) throws SQLException;
    }

    /**
     * Convert a SQL error into a RelayMesh error.
     *
     * <p>Handlers may return null for codes they do not recognise, the fallback handler is used instead.</p>
     */
    @FunctionalInterface
    protected interface JdbcErrorHandler {

        EMesh handle(SQLException error, JdbcErrorCode errorCode);
    }

    private static class FallbackErrorHandler implements JdbcErrorHandler {

        @Override
        public EMesh handle(SQLException error, JdbcErrorCode errorCode) {
            var message = MessageFormat.format(UNHANDLED_ERROR, errorCode.name());
            return new EMeshInternal(message, error);
        }
    }
}
