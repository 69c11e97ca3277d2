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

package org.relaymesh.common.plugin;

import org.relaymesh.common.exception.EPluginNotAvailable;

import java.util.Properties;


public abstract class MeshPlugin implements IMeshPlugin {

    protected abstract Object createService(String serviceName, Properties properties);

    @Override
    public final <T> T createService(Class<T> serviceClass, String protocol, Properties properties) {

        var serviceInfo = serviceInfo().stream()
                .filter(si -> psiMatch(si, serviceClass, protocol))
                .findFirst();

        if (serviceInfo.isEmpty()) {

            var message = String.format(
                    "Plugin [%s] does not support the service [%s] for protocol [%s]",
                    pluginName(), serviceClass.getSimpleName(), protocol);

            throw new EPluginNotAvailable(message);
        }

        var service = createService(serviceInfo.get().serviceName(), properties);

        return serviceClass.cast(service);
    }

    private static boolean psiMatch(PluginServiceInfo psi, Class<?> service, String protocol) {

        if (psi.serviceClass() != service)
            return false;

        for (var psiProtocol : psi.protocols()) {

            if (psiProtocol.equalsIgnoreCase(protocol))
                return true;
        }

        return false;
    }
}
