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

import org.relaymesh.secrets.backend.SecretBackendErrors;

import java.sql.SQLException;
import java.sql.SQLTransientException;


class DatabaseSecretErrors extends SecretBackendErrors {

    DatabaseSecretErrors() {
        super("database");
    }

    @Override
    protected ExplicitError checkKnownExceptions(Throwable e) {

        if (e instanceof SQLTransientException)
            return ExplicitError.TIMEOUT;

        if (e instanceof SQLException)
            return ExplicitError.COMMUNICATION_ERROR;

        return null;
    }
}
