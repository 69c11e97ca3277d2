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
import org.relaymesh.common.exception.EUnexpected;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;


/**
 * Shared JSON mapper for secret payloads.
 */
public final class SecretJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private SecretJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static byte[] encode(SecretSpec spec) {

        try {
            return MAPPER.writeValueAsString(spec).getBytes(StandardCharsets.UTF_8);
        }
        catch (JsonProcessingException e) {
            throw new EUnexpected(e);
        }
    }

    /**
     * Decode a tagged secret payload, the {@code "type"} discriminator is required.
     */
    public static SecretSpec decode(byte[] json) {

        try {
            return MAPPER.readValue(json, SecretSpec.class);
        }
        catch (IOException e) {
            // Parser messages can quote the payload, so they are not passed on
            throw new ESecretValidation("Invalid secret payload: " + e.getClass().getSimpleName());
        }
    }

    public static SecretSpec decode(JsonNode json) {

        try {
            return MAPPER.treeToValue(json, SecretSpec.class);
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ESecretValidation("Invalid secret payload: " + e.getClass().getSimpleName());
        }
    }
}
