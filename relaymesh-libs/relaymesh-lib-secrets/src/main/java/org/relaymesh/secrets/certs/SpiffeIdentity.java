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

package org.relaymesh.secrets.certs;

import org.relaymesh.common.exception.ESecretValidation;


/**
 * Builds SPIFFE URIs for proxy workloads, {@code spiffe://<trust-domain>/team/<team>/proxy/<workload>}.
 */
public final class SpiffeIdentity {

    public static final int MAX_COMPONENT_LENGTH = 128;

    private SpiffeIdentity() {}

    public static String buildUri(String trustDomain, String team, String workloadId) {

        validateComponent("team", team);
        validateComponent("workload ID", workloadId);

        return String.format("spiffe://%s/team/%s/proxy/%s", trustDomain, team, workloadId);
    }

    /**
     * Reject components that could change the meaning of the URI path.
     */
    public static void validateComponent(String name, String value) {

        if (value == null || value.isEmpty())
            throw new ESecretValidation(String.format("SPIFFE %s cannot be empty", name));

        if (value.length() > MAX_COMPONENT_LENGTH)
            throw new ESecretValidation(String.format(
                    "SPIFFE %s exceeds maximum length of %d characters", name, MAX_COMPONENT_LENGTH));

        if (value.contains("/") || value.contains("@") || value.contains(":"))
            throw new ESecretValidation(String.format(
                    "SPIFFE %s contains an invalid character: [%s]", name, value));

        if (value.contains(".."))
            throw new ESecretValidation(String.format(
                    "SPIFFE %s contains a path traversal sequence: [%s]", name, value));
    }
}
