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

package org.relaymesh.secrets.model;

import org.relaymesh.common.exception.ESecretValidation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;
import java.util.Objects;


/**
 * A certificate chain with its private key, both PEM encoded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TlsCertificateSpec extends SecretSpec {

    private final String certificateChain;
    private final String privateKey;
    private final String password;
    private final String ocspStaple;

    @JsonCreator
    public TlsCertificateSpec(
            @JsonProperty("certificate_chain") String certificateChain,
            @JsonProperty("private_key") String privateKey,
            @JsonProperty("password") @Nullable String password,
            @JsonProperty("ocsp_staple") @Nullable String ocspStaple) {

        this.certificateChain = certificateChain;
        this.privateKey = privateKey;
        this.password = password;
        this.ocspStaple = ocspStaple;
    }

    public TlsCertificateSpec(String certificateChain, String privateKey) {
        this(certificateChain, privateKey, null, null);
    }

    @JsonProperty("certificate_chain")
    public String getCertificateChain() {
        return certificateChain;
    }

    @JsonProperty("private_key")
    public String getPrivateKey() {
        return privateKey;
    }

    @JsonProperty("password")
    public String getPassword() {
        return password;
    }

    @JsonProperty("ocsp_staple")
    public String getOcspStaple() {
        return ocspStaple;
    }

    @Override
    public SecretType secretType() {
        return SecretType.TLS_CERTIFICATE;
    }

    @Override
    public void validate() {

        if (isBlank(certificateChain))
            throw new ESecretValidation("TLS certificate chain is empty");

        if (isBlank(privateKey))
            throw new ESecretValidation("TLS private key is empty");

        if (!certificateChain.contains(PEM_MARKER))
            throw new ESecretValidation("TLS certificate chain is not in PEM format");

        if (!privateKey.contains(PEM_MARKER))
            throw new ESecretValidation("TLS private key is not in PEM format");
    }

    @Override
    public boolean equals(Object other) {

        if (this == other) return true;
        if (!(other instanceof TlsCertificateSpec)) return false;

        var that = (TlsCertificateSpec) other;

        return Objects.equals(certificateChain, that.certificateChain) &&
                Objects.equals(privateKey, that.privateKey) &&
                Objects.equals(password, that.password) &&
                Objects.equals(ocspStaple, that.ocspStaple);
    }

    @Override
    public int hashCode() {
        return Objects.hash(certificateChain, privateKey, password, ocspStaple);
    }

    @Override
    public String toString() {

        return "TlsCertificateSpec{" +
                "certificateChain=" + (certificateChain != null ? certificateChain.length() + " chars" : "null") +
                ", privateKey=" + REDACTED +
                ", password=" + (password != null ? REDACTED : "null") +
                ", ocspStaple=" + (ocspStaple != null ? "present" : "null") +
                "}";
    }
}
