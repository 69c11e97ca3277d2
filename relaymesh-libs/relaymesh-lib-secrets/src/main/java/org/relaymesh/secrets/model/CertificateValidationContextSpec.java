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
import java.util.List;
import java.util.Objects;


/**
 * Trust settings used to validate peer certificates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CertificateValidationContextSpec extends SecretSpec {

    private final String trustedCa;
    private final List<String> matchSubjectAltNames;
    private final String crl;
    private final boolean onlyVerifyLeafCertCrl;

    @JsonCreator
    public CertificateValidationContextSpec(
            @JsonProperty("trusted_ca") String trustedCa,
            @JsonProperty("match_subject_alt_names") @Nullable List<String> matchSubjectAltNames,
            @JsonProperty("crl") @Nullable String crl,
            @JsonProperty("only_verify_leaf_cert_crl") boolean onlyVerifyLeafCertCrl) {

        this.trustedCa = trustedCa;
        this.matchSubjectAltNames = matchSubjectAltNames != null ? List.copyOf(matchSubjectAltNames) : List.of();
        this.crl = crl;
        this.onlyVerifyLeafCertCrl = onlyVerifyLeafCertCrl;
    }

    public CertificateValidationContextSpec(String trustedCa) {
        this(trustedCa, List.of(), null, false);
    }

    @JsonProperty("trusted_ca")
    public String getTrustedCa() {
        return trustedCa;
    }

    @JsonProperty("match_subject_alt_names")
    public List<String> getMatchSubjectAltNames() {
        return matchSubjectAltNames;
    }

    @JsonProperty("crl")
    public String getCrl() {
        return crl;
    }

    @JsonProperty("only_verify_leaf_cert_crl")
    public boolean isOnlyVerifyLeafCertCrl() {
        return onlyVerifyLeafCertCrl;
    }

    @Override
    public SecretType secretType() {
        return SecretType.CERTIFICATE_VALIDATION_CONTEXT;
    }

    @Override
    public void validate() {

        if (isBlank(trustedCa))
            throw new ESecretValidation("Trusted CA is empty");

        if (!trustedCa.contains(PEM_MARKER))
            throw new ESecretValidation("Trusted CA is not in PEM format");
    }

    @Override
    public boolean equals(Object other) {

        if (this == other) return true;
        if (!(other instanceof CertificateValidationContextSpec)) return false;

        var that = (CertificateValidationContextSpec) other;

        return onlyVerifyLeafCertCrl == that.onlyVerifyLeafCertCrl &&
                Objects.equals(trustedCa, that.trustedCa) &&
                Objects.equals(matchSubjectAltNames, that.matchSubjectAltNames) &&
                Objects.equals(crl, that.crl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trustedCa, matchSubjectAltNames, crl, onlyVerifyLeafCertCrl);
    }

    // CA material is public, but only the size is printed to keep log lines short
    @Override
    public String toString() {

        return "CertificateValidationContextSpec{" +
                "trustedCa=" + (trustedCa != null ? trustedCa.length() + " chars" : "null") +
                ", matchSubjectAltNames=" + matchSubjectAltNames +
                ", crl=" + (crl != null ? "present" : "null") +
                ", onlyVerifyLeafCertCrl=" + onlyVerifyLeafCertCrl +
                "}";
    }
}
