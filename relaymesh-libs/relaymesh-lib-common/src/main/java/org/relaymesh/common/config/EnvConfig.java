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

package org.relaymesh.common.config;

import org.relaymesh.common.exception.EConfig;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;


/**
 * Read-only view over environment-style configuration.
 *
 * <p>Production code builds this from {@link System#getenv()}, tests pass a map directly.
 * Where more than one variable name is accepted, the first name that is set and not blank wins.</p>
 */
public class EnvConfig {

    private final Map<String, String> env;

    public static EnvConfig fromSystem() {
        return new EnvConfig(System.getenv());
    }

    public EnvConfig(@Nonnull Map<String, String> env) {
        this.env = Map.copyOf(env);
    }

    public Optional<String> first(String... names) {

        for (var name : names) {

            var value = env.get(name);

            if (value != null && !value.isBlank())
                return Optional.of(value.trim());
        }

        return Optional.empty();
    }

    public boolean isPresent(String... names) {
        return first(names).isPresent();
    }

    public String getOrDefault(String name, String defaultValue) {
        return first(name).orElse(defaultValue);
    }

    public String required(String... names) {

        return first(names).orElseThrow(() -> new EConfig(String.format(
                "Missing required configuration: [%s]", String.join(" or ", names))));
    }

    public int intValue(String name, int defaultValue) {

        var value = first(name);

        if (value.isEmpty())
            return defaultValue;

        try {
            return Integer.parseInt(value.get());
        }
        catch (NumberFormatException e) {
            throw new EConfig(String.format("Configuration [%s] is not a valid integer: [%s]", name, value.get()), e);
        }
    }

    public boolean booleanValue(String name, boolean defaultValue) {

        var value = first(name);

        if (value.isEmpty())
            return defaultValue;

        switch (value.get().toLowerCase()) {

            case "true":
            case "1":
            case "yes":
                return true;

            case "false":
            case "0":
            case "no":
                return false;

            default:
                throw new EConfig(String.format("Configuration [%s] is not a valid boolean: [%s]", name, value.get()));
        }
    }

    /**
     * Copy a value into a properties object under a plugin property key, if the value is set.
     */
    public void copyTo(Properties properties, String propertyKey, String... names) {

        first(names).ifPresent(value -> properties.setProperty(propertyKey, value));
    }
}
