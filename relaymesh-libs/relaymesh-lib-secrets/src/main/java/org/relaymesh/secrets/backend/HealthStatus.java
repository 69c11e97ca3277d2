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

import java.util.Objects;


/**
 * Outcome of a single backend health probe.
 */
public final class HealthStatus {

    private static final HealthStatus HEALTHY = new HealthStatus(true, "OK");

    private final boolean healthy;
    private final String message;

    private HealthStatus(boolean healthy, String message) {
        this.healthy = healthy;
        this.message = message;
    }

    public static HealthStatus healthy() {
        return HEALTHY;
    }

    public static HealthStatus unhealthy(String message) {
        return new HealthStatus(false, message);
    }

    public boolean isHealthy() {
        return healthy;
    }

    public String message() {
        return message;
    }

    @Override
    public boolean equals(Object other) {

        if (this == other) return true;
        if (!(other instanceof HealthStatus)) return false;

        var that = (HealthStatus) other;
        return healthy == that.healthy && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(healthy, message);
    }

    @Override
    public String toString() {
        return (healthy ? "HEALTHY" : "UNHEALTHY") + " (" + message + ")";
    }
}
