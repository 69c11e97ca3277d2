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

import javax.annotation.Nonnull;
import java.util.List;


/**
 * Describes a service provided by a RelayMesh plugin, via IMeshPlugin.
 *
 * @see IMeshPlugin
 */
public class PluginServiceInfo {

    private final Class<?> serviceClass;
    private final String serviceName;
    private final List<String> protocols;

    /**
     * Create a new service info object
     *
     * @param serviceClass The service class interface for this service
     * @param serviceName The service name for this service
     * @param protocols The list of protocols supported by this service
     */
    public PluginServiceInfo(
            @Nonnull Class<?> serviceClass,
            @Nonnull String serviceName,
            @Nonnull List<String> protocols) {

        this.serviceClass = serviceClass;
        this.serviceName = serviceName;
        this.protocols = List.copyOf(protocols);
    }

    public Class<?> serviceClass() {
        return serviceClass;
    }

    public String serviceName() {
        return serviceName;
    }

    public List<String> protocols() {
        return protocols;
    }
}
