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

package org.relaymesh.plugins.vault;

import org.relaymesh.secrets.backend.SecretBackendErrors;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.relaymesh.secrets.backend.SecretBackendErrors.ExplicitError.*;


class VaultErrors extends SecretBackendErrors {

    private static final List<Map.Entry<Integer, ExplicitError>> STATUS_CODE_MAPPING = List.of(
            Map.entry(400, REFERENCE_INVALID),
            Map.entry(401, ACCESS_DENIED),
            Map.entry(403, ACCESS_DENIED),
            Map.entry(404, SECRET_NOT_FOUND));

    private static final List<Map.Entry<Class<? extends Throwable>, ExplicitError>> EXCEPTION_CLASS_MAPPING = List.of(
            Map.entry(HttpTimeoutException.class, TIMEOUT),
            Map.entry(ConnectException.class, COMMUNICATION_ERROR),
            Map.entry(IOException.class, COMMUNICATION_ERROR));

    private static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    VaultErrors(String backendKey) {
        super(backendKey);
    }

    @Override
    protected ExplicitError checkKnownExceptions(Throwable e) {

        if (e instanceof VaultStatusException) {

            var statusCode = ((VaultStatusException) e).statusCode();

            for (var mapping : STATUS_CODE_MAPPING)
                if (mapping.getKey() == statusCode)
                    return mapping.getValue();

            // Anything else is an unexpected response from the service
            return COMMUNICATION_ERROR;
        }

        for (var mapping : EXCEPTION_CLASS_MAPPING)
            if (mapping.getKey().isInstance(e))
                return mapping.getValue();

        return null;
    }

    boolean isTransient(Throwable error) {

        error = unwrap(error);

        if (error instanceof VaultStatusException)
            return TRANSIENT_STATUS_CODES.contains(((VaultStatusException) error).statusCode());

        return error instanceof ConnectException || error instanceof HttpTimeoutException;
    }
}
