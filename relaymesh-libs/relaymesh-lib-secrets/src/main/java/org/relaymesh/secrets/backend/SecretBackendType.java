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

import org.relaymesh.common.exception.EConfig;


/**
 * Identity of a secret backend implementation. At most one backend of each type is registered.
 */
public enum SecretBackendType {

    VAULT("vault"),
    AWS_SECRETS_MANAGER("aws_secrets_manager"),
    GCP_SECRET_MANAGER("gcp_secret_manager"),
    DATABASE("database");

    private final String wireName;

    SecretBackendType(String wireName) {
        this.wireName = wireName;
    }

    /** Stable name, also used as the plugin protocol for the backend **/
    public String wireName() {
        return wireName;
    }

    public static SecretBackendType fromWireName(String wireName) {

        if (wireName != null) {
            for (var type : values()) {
                if (type.wireName.equalsIgnoreCase(wireName.trim()))
                    return type;
            }
        }

        throw new EConfig(String.format("Unknown secret backend type: [%s]", wireName));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
