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

import java.util.List;
import java.util.Properties;


/**
 * Interface for RelayMesh plugins, discovered with {@link java.util.ServiceLoader}.
 *
 * <p>Plugins are registered under META-INF/services. Each plugin declares the services
 * it provides and the protocols each service handles. Most plugins should extend
 * {@link MeshPlugin} rather than implementing this interface directly.</p>
 */
public interface IMeshPlugin {

    String pluginName();

    List<PluginServiceInfo> serviceInfo();

    <T> T createService(Class<T> serviceClass, String protocol, Properties properties);
}
