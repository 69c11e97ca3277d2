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

import org.relaymesh.common.exception.ESecretValidation;
import org.relaymesh.secrets.model.*;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;


/**
 * Turn raw payloads fetched from an external store into a {@link SecretSpec}.
 *
 * <p>Payloads are read in this order:</p>
 * <ol>
 *     <li>A JSON object with a {@code "type"} discriminator is decoded directly,
 *     the discriminator must match the expected type</li>
 *     <li>A JSON object without a discriminator has its fields inferred from the expected type,
 *     accepting the field aliases listed below</li>
 *     <li>Anything else is a raw payload, accepted only for generic secrets (base64 encoded)
 *     and for validation contexts holding a bare PEM CA certificate</li>
 * </ol>
 *
 * <p>Session ticket keys are only ever accepted through the discriminator path.</p>
 */
public final class SecretPayloads {

    public static final String[] SECRET_FIELDS = {"secret", "value"};
    public static final String[] CERTIFICATE_CHAIN_FIELDS = {"certificate_chain", "cert", "certificate"};
    public static final String[] PRIVATE_KEY_FIELDS = {"private_key", "key"};
    public static final String[] TRUSTED_CA_FIELDS = {"trusted_ca", "ca", "ca_cert"};

    static final String PEM_MARKER = "-----BEGIN";
    static final String PEM_CERTIFICATE_MARKER = "-----BEGIN CERTIFICATE-----";

    private SecretPayloads() {}

    /**
     * Parse a payload held as raw bytes.
     *
     * @param payload The raw payload
     * @param expectedType The secret type requested by the caller
     * @param source Description of where the payload came from, used in error messages
     */
    public static SecretSpec parse(byte[] payload, SecretType expectedType, String source) {

        if (payload == null || payload.length == 0)
            throw new ESecretValidation(String.format("Secret payload is empty: %s", source));

        var json = tryParseObject(payload);

        if (json != null)
            return parse(json, expectedType, source);
        else
            return parseRaw(payload, expectedType, source);
    }

    /**
     * Parse a payload that is already a JSON object, e.g. the data section of a KV response.
     */
    public static SecretSpec parse(JsonNode payload, SecretType expectedType, String source) {

        if (payload == null || !payload.isObject() || payload.isEmpty())
            throw new ESecretValidation(String.format("Secret payload is empty: %s", source));

        if (payload.has(SecretSpec.TYPE_PROPERTY)) {

            var spec = SecretJson.decode(payload);
            checkType(spec, expectedType, source);
            checkTaggedFields(payload, spec.secretType(), source);

            return spec;
        }

        return inferFields(payload, expectedType, source);
    }

    public static void checkType(SecretSpec spec, SecretType expectedType, String source) {

        if (spec.secretType() != expectedType) {

            var message = String.format(
                    "Secret type mismatch: %s (expected %s, found %s)",
                    source, expectedType, spec.secretType());

            throw new ESecretValidation(message);
        }
    }

    private static void checkTaggedFields(JsonNode payload, SecretType secretType, String source) {

        // Tagged payloads use the canonical field names only, no aliases
        switch (secretType) {

            case GENERIC_SECRET:
                requiredText(payload, new String[] {"secret"}, "Generic secret", source);
                break;

            case TLS_CERTIFICATE:
                requiredText(payload, new String[] {"certificate_chain"}, "TLS certificate", source);
                requiredText(payload, new String[] {"private_key"}, "TLS certificate", source);
                break;

            case CERTIFICATE_VALIDATION_CONTEXT:
                requiredText(payload, new String[] {"trusted_ca"}, "Validation context", source);
                break;

            case SESSION_TICKET_KEYS:

                if (!payload.path("keys").isArray())
                    throw new ESecretValidation(String.format(
                            "Session ticket keys must have the field [keys]: %s", source));

                for (var key : payload.get("keys"))
                    requiredText(key, new String[] {"key"}, "Session ticket key", source);

                break;

            default:
                throw new ESecretValidation(String.format("Unsupported secret type: %s", source));
        }
    }

    private static SecretSpec inferFields(JsonNode payload, SecretType expectedType, String source) {

        switch (expectedType) {

            case GENERIC_SECRET: {

                var secret = requiredText(payload, SECRET_FIELDS, "Generic secret", source);
                return new GenericSecretSpec(secret);
            }

            case TLS_CERTIFICATE: {

                var chain = requiredText(payload, CERTIFICATE_CHAIN_FIELDS, "TLS certificate", source);
                var key = requiredText(payload, PRIVATE_KEY_FIELDS, "TLS certificate", source);
                var password = optionalText(payload, "password");
                var ocspStaple = optionalText(payload, "ocsp_staple");

                return new TlsCertificateSpec(chain, key, password, ocspStaple);
            }

            case CERTIFICATE_VALIDATION_CONTEXT: {

                var trustedCa = requiredText(payload, TRUSTED_CA_FIELDS, "Validation context", source);
                var crl = optionalText(payload, "crl");
                var leafOnly = payload.path("only_verify_leaf_cert_crl").asBoolean(false);

                return new CertificateValidationContextSpec(trustedCa, null, crl, leafOnly);
            }

            case SESSION_TICKET_KEYS:
            default:

                throw new ESecretValidation(String.format(
                        "Session ticket keys require an explicit '%s' field: %s",
                        SecretSpec.TYPE_PROPERTY, source));
        }
    }

    private static SecretSpec parseRaw(byte[] payload, SecretType expectedType, String source) {

        switch (expectedType) {

            case GENERIC_SECRET:

                return new GenericSecretSpec(Base64.getEncoder().encodeToString(payload));

            case TLS_CERTIFICATE: {

                var text = new String(payload, StandardCharsets.UTF_8);

                if (text.contains(PEM_MARKER))
                    throw new ESecretValidation(String.format(
                            "TLS certificate stored as bare PEM cannot be used without its private key, " +
                            "store a JSON object with certificate_chain and private_key fields: %s", source));

                throw new ESecretValidation(String.format(
                        "TLS certificate must be a JSON object with certificate_chain and private_key fields: %s",
                        source));
            }

            case CERTIFICATE_VALIDATION_CONTEXT: {

                var text = new String(payload, StandardCharsets.UTF_8);

                if (!text.contains(PEM_CERTIFICATE_MARKER))
                    throw new ESecretValidation(String.format(
                            "Validation context must be a JSON object or a PEM CA certificate: %s", source));

                return new CertificateValidationContextSpec(text);
            }

            case SESSION_TICKET_KEYS:
            default:

                throw new ESecretValidation(String.format(
                        "Session ticket keys require an explicit '%s' field: %s",
                        SecretSpec.TYPE_PROPERTY, source));
        }
    }

    private static JsonNode tryParseObject(byte[] payload) {

        try {
            var node = SecretJson.mapper().readTree(payload);
            return node != null && node.isObject() ? node : null;
        }
        catch (IOException e) {
            return null;
        }
    }

    private static String requiredText(JsonNode payload, String[] aliases, String kind, String source) {

        for (var alias : aliases) {

            var node = payload.get(alias);

            if (node != null && node.isTextual())
                return node.textValue();
        }

        throw new ESecretValidation(String.format(
                "%s must have one of the fields [%s]: %s",
                kind, String.join(", ", aliases), source));
    }

    private static String optionalText(JsonNode payload, String field) {

        var node = payload.get(field);
        return node != null && node.isTextual() ? node.textValue() : null;
    }
}
