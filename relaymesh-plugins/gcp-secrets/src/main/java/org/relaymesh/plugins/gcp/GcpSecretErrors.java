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

package org.relaymesh.plugins.gcp;

import org.relaymesh.secrets.backend.SecretBackendErrors;

import com.google.api.gax.rpc.*;

import java.util.List;
import java.util.Map;

import static org.relaymesh.secrets.backend.SecretBackendErrors.ExplicitError.*;


public class GcpSecretErrors extends SecretBackendErrors {

    private static final List<Map.Entry<Class<? extends Exception>, ExplicitError>> EXCEPTION_CLASS_MAP = List.of(
            Map.entry(NotFoundException.class, SECRET_NOT_FOUND),
            // Disabled or destroyed versions cannot be accessed
            Map.entry(FailedPreconditionException.class, SECRET_NOT_FOUND),
            Map.entry(PermissionDeniedException.class, ACCESS_DENIED),
            Map.entry(UnauthenticatedException.class, ACCESS_DENIED),
            Map.entry(InvalidArgumentException.class, REFERENCE_INVALID),
            Map.entry(DeadlineExceededException.class, TIMEOUT),
            // Top-level error for GCP API calls over gRPC
            Map.entry(ApiException.class, COMMUNICATION_ERROR));

    public GcpSecretErrors(String backendKey) {
        super(backendKey);
    }

    @Override
    protected ExplicitError checkKnownExceptions(Throwable error) {

        for (var knownError : EXCEPTION_CLASS_MAP) {

            if (knownError.getKey().isInstance(error))
                return knownError.getValue();
        }

        return null;
    }
}
