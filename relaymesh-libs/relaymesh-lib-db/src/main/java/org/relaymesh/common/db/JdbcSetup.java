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
import org.relaymesh.common.exception.EStartup;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Properties;


/**
 * Create and destroy pooled JDBC data sources.
 *
 * <p>Required properties are {@code dialect} (one of {@link JdbcDialect}) and {@code jdbcUrl},
 * which is the driver-specific part of the URL after the {@code jdbc:<dialect>:} prefix.
 * Properties prefixed with the lower-case dialect name are passed through to the driver,
 * e.g. {@code h2.DB_CLOSE_DELAY} becomes the data source property {@code DB_CLOSE_DELAY}.</p>
 */
public class JdbcSetup {

    public static final String DIALECT_PROPERTY = "dialect";
    public static final String JDBC_URL_PROPERTY = "jdbcUrl";
    public static final String USER_PROPERTY = "username";
    public static final String PASSWORD_PROPERTY = "password";
    public static final String POOL_SIZE_PROPERTY = "pool.size";

    public static JdbcDialect getSqlDialect(Properties properties) {

        var dialect = properties.getProperty(DIALECT_PROPERTY, null);

        if (dialect == null || dialect.isBlank())
            throw new EStartup("Missing required config property: " + DIALECT_PROPERTY);

        try {
            return Enum.valueOf(JdbcDialect.class, dialect.toUpperCase());
        }
        catch (IllegalArgumentException e) {
            throw new EStartup(String.format("Unsupported SQL dialect: [%s]", dialect));
        }
    }

    public static DataSource createDatasource(Properties properties) {

        try {
            var hikariProps = createHikariProperties(properties);

            var config = new HikariConfig(hikariProps);
            var source = new HikariDataSource(config);

            var log = LoggerFactory.getLogger(JdbcSetup.class);
            log.info("Database connection pool has {} connections", source.getMaximumPoolSize());

            return source;
        }
        catch (RuntimeException e) {

            // Missing JDBC drivers report the useful detail in the cause
            if (e.getCause() instanceof SQLException && e.getMessage() != null)
                if (!e.getMessage().contains(e.getCause().getMessage())) {

                var messageTemplate = "Could not connect to database: %s (%s)";
                var message = String.format(messageTemplate, e.getMessage(), e.getCause().getMessage());

                throw new EStartup(message, e);
            }

            var messageTemplate = "Could not connect to database: %s";
            var message = String.format(messageTemplate, e.getMessage());

            throw new EStartup(message, e);
        }
    }

    public static void destroyDatasource(DataSource source) {

        if (!(source instanceof HikariDataSource))
            throw new EMeshInternal("Datasource being destroyed was not created by JdbcSetup");

        var hikariSource = (HikariDataSource) source;
        hikariSource.close();
    }

    private static Properties createHikariProperties(Properties properties) {

        var dialect = getSqlDialect(properties);
        var jdbcUrl = String.format("jdbc:%s:%s",
                dialect.name().toLowerCase(),
                properties.getProperty(JDBC_URL_PROPERTY));

        var hikariProps = new Properties();
        hikariProps.setProperty("jdbcUrl", jdbcUrl);
        hikariProps.setProperty("poolName", "secret_store_pool");

        var user = properties.getProperty(USER_PROPERTY);
        var password = properties.getProperty(PASSWORD_PROPERTY);

        if (user != null)
            hikariProps.setProperty("username", user);

        if (password != null)
            hikariProps.setProperty("password", password);

        var dialectPrefix = dialect.name().toLowerCase() + ".";  // Trailing dot is required!

        for (var propKey : properties.stringPropertyNames()) {

            if (propKey.startsWith(dialectPrefix)) {

                var dialectProperty = propKey.substring(dialectPrefix.length());
                hikariProps.setProperty("dataSource." + dialectProperty, properties.getProperty(propKey));
            }
        }

        var poolSize = properties.getProperty(POOL_SIZE_PROPERTY);

        if (poolSize != null && !poolSize.isBlank())
            hikariProps.setProperty("maximumPoolSize", poolSize);

        return hikariProps;
    }
}
