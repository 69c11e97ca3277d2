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

package org.relaymesh.plugins.aws;

import org.relaymesh.secrets.backend.SecretBackendErrors;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.http.HttpStatusCode;
import software.amazon.awssdk.services.secretsmanager.model.DecryptionFailureException;
import software.amazon.awssdk.services.secretsmanager.model.InvalidParameterException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

import java.util.List;
import java.util.Map;

import static org.relaymesh.secrets.backend.SecretBackendErrors.ExplicitError.*;


public class AwsSecretErrors extends SecretBackendErrors {

    // Order matters, the first matching class wins
    private static final List<Map.Entry<Class<? extends Throwable>, ExplicitError>> EXCEPTION_CLASS_MAP = List.of(
            Map.entry(ResourceNotFoundException.class, SECRET_NOT_FOUND),
            Map.entry(DecryptionFailureException.class, ACCESS_DENIED),
            Map.entry(InvalidParameterException.class, REFERENCE_INVALID),
            Map.entry(ApiCallTimeoutException.class, TIMEOUT),
            Map.entry(ApiCallAttemptTimeoutException.class, TIMEOUT),
            Map.entry(SdkClientException.class, COMMUNICATION_ERROR));

    // JSON protocol services report auth failures as 400 with an error code
    private static final List<Map.Entry<String, ExplicitError>> AWS_ERROR_CODE_MAP = List.of(
            Map.entry("AccessDeniedException", ACCESS_DENIED),
            Map.entry("UnrecognizedClientException", ACCESS_DENIED),
            Map.entry("InvalidSignatureException", ACCESS_DENIED),
            Map.entry("ExpiredTokenException", ACCESS_DENIED),
            Map.entry("ThrottlingException", COMMUNICATION_ERROR));

    private static final List<Map.Entry<Integer, ExplicitError>> HTTP_ERROR_CODE_MAP = List.of(
            Map.entry(HttpStatusCode.NOT_FOUND, SECRET_NOT_FOUND),
            Map.entry(HttpStatusCode.UNAUTHORIZED, ACCESS_DENIED),
            Map.entry(HttpStatusCode.FORBIDDEN, ACCESS_DENIED));

    public AwsSecretErrors(String backendKey) {

        super(backendKey);
    }

    @Override
    protected ExplicitError checkKnownExceptions(Throwable e) {

        for (var entry : EXCEPTION_CLASS_MAP) {

            if (entry.getKey().isInstance(e))
                return entry.getValue();
        }

        if (!(e instanceof AwsServiceException))
            return null;

        var awsError = (AwsServiceException) e;
        var details = awsError.awsErrorDetails();

        if (details != null && details.errorCode() != null) {

            for (var entry : AWS_ERROR_CODE_MAP) {

                if (entry.getKey().equals(details.errorCode()))
                    return entry.getValue();
            }
        }

        for (var entry : HTTP_ERROR_CODE_MAP) {

            if (awsError.statusCode() == entry.getKey())
                return entry.getValue();
        }

        return COMMUNICATION_ERROR;
    }
}
