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

import org.relaymesh.common.exception.ESecretValidation;


/**
 * Parsed reference to a secret in the local store.
 *
 * <p>Three forms are accepted: a secret ID ({@code sec_...}), {@code team/name}, or a bare name.
 * A bare name matches the first secret with that name in any team.</p>
 */
final class SecretReference {

    static final String ID_PREFIX = "sec_";

    final String secretId;
    final String team;
    final String name;

    private SecretReference(String secretId, String team, String name) {
        this.secretId = secretId;
        this.team = team;
        this.name = name;
    }

    static SecretReference parse(String reference) {

        if (reference == null || reference.isBlank())
            throw new ESecretValidation("Secret reference is empty");

        if (reference.startsWith(ID_PREFIX))
            return new SecretReference(reference, null, null);

        var slash = reference.indexOf('/');

        if (slash < 0)
            return new SecretReference(null, null, reference);

        var team = reference.substring(0, slash);
        var name = reference.substring(slash + 1);

        if (team.isEmpty() || name.isEmpty())
            throw new ESecretValidation(String.format("Secret reference is not valid: [%s]", reference));

        return new SecretReference(null, team, name);
    }

    boolean isId() {
        return secretId != null;
    }

    boolean hasTeam() {
        return team != null;
    }
}
