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

import org.relaymesh.common.exception.EPluginNotAvailable;
import org.relaymesh.common.plugin.MeshPlugin;
import org.relaymesh.common.plugin.PluginServiceInfo;
import org.relaymesh.secrets.backend.ISecretBackend;
import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.certs.CertificateBackendType;
import org.relaymesh.secrets.certs.ICertificateBackend;

import java.util.List;
import java.util.Properties;


public class VaultSecretsPlugin extends MeshPlugin {

    private static final String PLUGIN_NAME = "VAULT_SECRETS";
    private static final String VAULT_KV_BACKEND = "VAULT_KV_BACKEND";
    private static final String VAULT_PKI_BACKEND = "VAULT_PKI_BACKEND";

    private static final List<PluginServiceInfo> serviceInfo = List.of(
            new PluginServiceInfo(ISecretBackend.class, VAULT_KV_BACKEND, List.of(SecretBackendType.VAULT.wireName())),
            new PluginServiceInfo(ICertificateBackend.class, VAULT_PKI_BACKEND, List.of(CertificateBackendType.VAULT_PKI.wireName())));

    @Override
    public String pluginName() {
        return PLUGIN_NAME;
    }

    @Override
    public List<PluginServiceInfo> serviceInfo() {
        return serviceInfo;
    }

    @Override
    protected Object createService(String serviceName, Properties properties) {

        if (serviceName.equals(VAULT_KV_BACKEND))
            return new VaultSecretBackend(properties);

        if (serviceName.equals(VAULT_PKI_BACKEND))
            return new VaultPkiBackend(properties);

        var message = String.format("Plugin [%s] does not support the service [%s]", pluginName(), serviceName);
        throw new EPluginNotAvailable(message);
    }
}
