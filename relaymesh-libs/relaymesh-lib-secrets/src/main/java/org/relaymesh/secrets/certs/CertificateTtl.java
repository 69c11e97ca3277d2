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

import org.relaymesh.common.config.EnvConfig;

import javax.annotation.Nullable;


/**
 * Certificate validity policy, in whole hours.
 */
public final class CertificateTtl {

    public static final String CERT_TTL_HOURS_ENV = "RELAYMESH_CERT_TTL_HOURS";

    public static final int MIN_TTL_HOURS = 4;
    public static final int MAX_TTL_HOURS = 24;
    public static final int DEFAULT_TTL_HOURS = 12;

    private CertificateTtl() {}

    public static int defaultHours(EnvConfig env) {

        return clamp(env.intValue(CERT_TTL_HOURS_ENV, DEFAULT_TTL_HOURS));
    }

    public static int effectiveHours(@Nullable Integer requested, int defaultHours) {

        return clamp(requested != null ? requested : defaultHours);
    }

    public static int clamp(int hours) {

        return Math.max(MIN_TTL_HOURS, Math.min(MAX_TTL_HOURS, hours));
    }
}
