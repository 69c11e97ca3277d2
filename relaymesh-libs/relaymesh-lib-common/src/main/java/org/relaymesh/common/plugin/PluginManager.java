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
import org.relaymesh.common.startup.StartupLog;

import org.slf4j.event.Level;

import java.util.*;


/**
 * Discovers plugins on the class path and creates services from them.
 *
 * <p>Services are looked up by service class and protocol, for example
 * ({@code ISecretBackend}, {@code "vault"}).</p>
 */
public class PluginManager {

    private final Map<PluginKey, IMeshPlugin> plugins;

    public PluginManager() {
        plugins = new HashMap<>();
    }

    public void initPlugins() {

        StartupLog.log(this, Level.INFO, "Loading plugins...");

        var availablePlugins = ServiceLoader.load(IMeshPlugin.class).iterator();

        while (availablePlugins.hasNext()) {

            try {

                // Plugins with missing dependencies fail here, the rest still load
                var plugin = availablePlugins.next();
                registerPlugin(plugin);
            }
            catch (ServiceConfigurationError e) {

                StartupLog.log(this, Level.WARN, e.getMessage());
            }
        }
    }

    public void registerPlugin(IMeshPlugin plugin) {

        StartupLog.log(this, Level.INFO, String.format("Plugin: [%s]", plugin.pluginName()));

        for (var service : plugin.serviceInfo()) {

            var protocols = String.join(", ", service.protocols());

            StartupLog.log(this, Level.INFO, String.format(
                    " |-> %s: [%s] (protocols: %s)",
                    service.serviceClass().getSimpleName(), service.serviceName(), protocols));

            for (var protocol : service.protocols()) {

                var pluginKey = new PluginKey(service.serviceClass(), protocol.toLowerCase());
                plugins.put(pluginKey, plugin);
            }
        }
    }

    public List<String> availableProtocols(Class<?> serviceClass) {

        var protocols = new TreeSet<String>();

        for (var pluginKey : plugins.keySet()) {
            if (pluginKey.serviceClass == serviceClass)
                protocols.add(pluginKey.protocol);
        }

        return new ArrayList<>(protocols);
    }

    public boolean isServiceAvailable(Class<?> serviceClass, String protocol) {

        var pluginKey = new PluginKey(serviceClass, protocol.toLowerCase());
        return plugins.containsKey(pluginKey);
    }

    public <T> T createService(Class<T> serviceClass, String protocol, Properties properties) {

        if (protocol == null || protocol.isBlank()) {

            var message = String.format("Protocol not specified for [%s] plugin", serviceClass.getSimpleName());

            StartupLog.log(this, Level.ERROR, message);
            throw new EPluginNotAvailable(message);
        }

        var pluginKey = new PluginKey(serviceClass, protocol.toLowerCase());
        var plugin = plugins.get(pluginKey);

        if (plugin == null) {

            var message = String.format(
                    "Plugin not available for %s protocol: [%s]",
                    serviceClass.getSimpleName(), protocol);

            StartupLog.log(this, Level.ERROR, message);
            throw new EPluginNotAvailable(message);
        }

        return plugin.createService(serviceClass, protocol, properties);
    }

    private static final class PluginKey {

        private final Class<?> serviceClass;
        private final String protocol;

        PluginKey(Class<?> serviceClass, String protocol) {
            this.serviceClass = serviceClass;
            this.protocol = protocol;
        }

        @Override
        public boolean equals(Object other) {

            if (this == other) return true;
            if (other == null || getClass() != other.getClass()) return false;

            var that = (PluginKey) other;
            return serviceClass.equals(that.serviceClass) && protocol.equals(that.protocol);
        }

        @Override
        public int hashCode() {
            return Objects.hash(serviceClass, protocol);
        }
    }
}
