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

package org.relaymesh.secrets.backend;

import org.relaymesh.secrets.model.SecretSpec;
import org.relaymesh.secrets.model.SecretType;

import java.util.concurrent.CompletionStage;


/**
 * A source of secrets, such as a KV store, a cloud secret manager or the local encrypted store.
 *
 * <p>Implementations classify their native errors before they leave the backend:
 * {@link org.relaymesh.common.exception.ESecretNotFound} for a missing reference,
 * {@link org.relaymesh.common.exception.ESecretAccess} for permission problems,
 * {@link org.relaymesh.common.exception.ESecretValidation} for malformed references and payloads,
 * and {@link org.relaymesh.common.exception.ESecretCommunication} for everything else.
 * Errors are delivered through the returned stage, implementations should not throw directly.</p>
 *
 * <p>Implementations must be safe for concurrent use and must never log secret values.</p>
 */
public interface ISecretBackend {

    /**
     * Resolve a backend-specific reference into a secret of the expected type.
     *
     * <p>The stage fails if the payload resolves to a different type than requested.</p>
     */
    CompletionStage<SecretSpec> fetchSecret(String reference, SecretType expectedType);

    /**
     * Check whether a reference exists, without reading its payload.
     *
     * <p>A reference that does not exist resolves to false. Other errors fail the stage.</p>
     */
    CompletionStage<Boolean> validateReference(String reference);

    SecretBackendType backendType();

    /**
     * Lightweight connectivity and permission probe.
     *
     * <p>The stage fails if the backend is not usable. Failure messages do not contain credentials.</p>
     */
    CompletionStage<Void> healthCheck();
}
