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

import org.relaymesh.common.exception.EUnexpected;
import org.relaymesh.secrets.model.SecretString;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;


/**
 * Deterministic certificate issuer for development and tests.
 *
 * <p>Output depends only on the trust domain, team and workload, apart from the expiry
 * which follows the clock. The PEM blocks hold placeholder content, not real keys.</p>
 */
public class MockCertificateBackend implements ICertificateBackend {

    private static final String MOCK_CA = pem("CERTIFICATE", "relaymesh-mock-ca");

    private static final Logger log = LoggerFactory.getLogger(MockCertificateBackend.class);

    private final String trustDomain;
    private final int defaultTtlHours;
    private final Clock clock;
    private final AtomicInteger issued;

    public MockCertificateBackend(String trustDomain, int defaultTtlHours, Clock clock) {

        this.trustDomain = trustDomain;
        this.defaultTtlHours = CertificateTtl.clamp(defaultTtlHours);
        this.clock = clock;
        this.issued = new AtomicInteger();

        log.info("INIT [{}], trust domain = [{}]", backendType(), trustDomain);
    }

    public MockCertificateBackend(String trustDomain) {
        this(trustDomain, CertificateTtl.DEFAULT_TTL_HOURS, Clock.systemUTC());
    }

    @Override
    public CompletionStage<GeneratedCertificate> generateCertificate(String team, String workloadId, @Nullable Integer ttlHours) {

        try {

            var spiffeUri = SpiffeIdentity.buildUri(trustDomain, team, workloadId);
            var ttl = CertificateTtl.effectiveHours(ttlHours, defaultTtlHours);
            var expiresAt = clock.instant().plus(Duration.ofHours(ttl));

            var certificate = new GeneratedCertificate(
                    pem("CERTIFICATE", spiffeUri),
                    new SecretString(pem("PRIVATE KEY", "mock-key:" + spiffeUri)),
                    MOCK_CA,
                    serialNumber(spiffeUri),
                    expiresAt,
                    spiffeUri);

            issued.incrementAndGet();

            log.info("Issued mock certificate for [{}], expires {}", spiffeUri, expiresAt);

            return CompletableFuture.completedFuture(certificate);
        }
        catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CertificateBackendType backendType() {
        return CertificateBackendType.MOCK;
    }

    @Override
    public String trustDomain() {
        return trustDomain;
    }

    @Override
    public CompletionStage<Void> healthCheck() {
        return CompletableFuture.completedFuture(null);
    }

    public int issuedCount() {
        return issued.get();
    }

    private static String serialNumber(String spiffeUri) {

        try {

            var digest = MessageDigest.getInstance("SHA-256").digest(spiffeUri.getBytes(StandardCharsets.UTF_8));
            var serial = new StringBuilder();

            for (var i = 0; i < 16; i++) {
                if (i > 0) serial.append(':');
                serial.append(String.format("%02x", digest[i]));
            }

            return serial.toString();
        }
        catch (NoSuchAlgorithmException e) {
            throw new EUnexpected(e);
        }
    }

    private static String pem(String label, String content) {

        var body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(content.getBytes(StandardCharsets.UTF_8));

        return "-----BEGIN " + label + "-----\n" + body + "\n-----END " + label + "-----\n";
    }
}
