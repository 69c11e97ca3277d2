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

import javax.annotation.Nullable;
import java.util.concurrent.CompletionStage;


/**
 * Issuer of short-lived mTLS leaf certificates for proxies.
 *
 * <p>Each call issues a new certificate, nothing is cached. The certificate carries a SPIFFE
 * URI built from the trust domain, the team and the workload ID.</p>
 */
public interface ICertificateBackend {

    /**
     * Issue a new certificate.
     *
     * @param team Team that owns the workload
     * @param workloadId Proxy or workload identifier
     * @param ttlHours Requested validity in hours, or null for the configured default.
     *                 The issued validity is always kept inside the backend's policy limits.
     */
    CompletionStage<GeneratedCertificate> generateCertificate(String team, String workloadId, @Nullable Integer ttlHours);

    CertificateBackendType backendType();

    String trustDomain();

    CompletionStage<Void> healthCheck();
}
