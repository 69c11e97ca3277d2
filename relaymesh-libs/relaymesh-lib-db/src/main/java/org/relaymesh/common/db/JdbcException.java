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

import java.sql.SQLException;


/**
 * Raised inside a transaction to signal a condition detected by the DAL itself,
 * e.g. a query that returned no rows. The dialect maps it back to its error code.
 */
public class JdbcException extends SQLException {

    public static final String SYNTHETIC_ERROR = "SYNTHETIC_ERROR";

    public JdbcException(JdbcErrorCode errorCode) {
        super(errorCode.name(), SYNTHETIC_ERROR, errorCode.ordinal());
    }
}
