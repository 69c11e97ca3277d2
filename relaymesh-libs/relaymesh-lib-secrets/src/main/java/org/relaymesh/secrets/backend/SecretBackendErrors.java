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

import org.relaymesh.common.exception.*;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

import static org.relaymesh.secrets.backend.SecretBackendErrors.ExplicitError.*;


/**
 * Classify native backend failures into the RelayMesh error taxonomy.
 *
 * <p>Each backend provides a subclass that recognises its own SDK or transport errors.
 * Messages carry the operation, the backend and the secret reference, never the payload.</p>
 */
public abstract class SecretBackendErrors {

    public enum ExplicitError {

        // Validation failures
        REFERENCE_INVALID,
        SECRET_ALREADY_EXISTS,

        // Request errors
        SECRET_NOT_FOUND,

        // Permissions
        ACCESS_DENIED,

        // Transport and service errors
        COMMUNICATION_ERROR,
        TIMEOUT,

        // Unhandled / unexpected error
        UNKNOWN_ERROR
    }

    private static final Map<ExplicitError, String> ERROR_MESSAGE_MAP = Map.ofEntries(
            Map.entry(REFERENCE_INVALID, "Secret reference is invalid: %s %s [%s]"),
            Map.entry(SECRET_NOT_FOUND, "Secret not found: %s %s [%s]"),
            Map.entry(SECRET_ALREADY_EXISTS, "Secret already exists: %s %s [%s]"),
            Map.entry(ACCESS_DENIED, "Access denied to secret: %s %s [%s]"),
            Map.entry(COMMUNICATION_ERROR, "Error communicating with the secret backend: %s %s [%s]"),
            Map.entry(TIMEOUT, "Secret backend did not respond in time: %s %s [%s]"),
            Map.entry(UNKNOWN_ERROR, "An unexpected error occurred in the secret backend: %s %s [%s]"));

    private static final Map<ExplicitError, Class<? extends EMesh>> ERROR_TYPE_MAP = Map.ofEntries(
            Map.entry(REFERENCE_INVALID, ESecretValidation.class),
            Map.entry(SECRET_NOT_FOUND, ESecretNotFound.class),
            Map.entry(SECRET_ALREADY_EXISTS, ESecretValidation.class),
            Map.entry(ACCESS_DENIED, ESecretAccess.class),
            Map.entry(COMMUNICATION_ERROR, ESecretCommunication.class),
            Map.entry(TIMEOUT, ESecretCommunication.class),
            Map.entry(UNKNOWN_ERROR, ESecretCommunication.class));

    private final String backendKey;

    protected SecretBackendErrors(String backendKey) {

        this.backendKey = backendKey;
    }

    protected abstract ExplicitError checkKnownExceptions(Throwable e);

    public EMesh handleException(String operation, String reference, Throwable error) {

        error = unwrap(error);

        // Error of type EMesh means the error is already handled
        if (error instanceof EMesh)
            return (EMesh) error;

        var knownException = checkKnownExceptions(error);

        return knownException != null
                ? explicitError(operation, reference, knownException, error)
                : explicitError(operation, reference, UNKNOWN_ERROR, error);
    }

    /**
     * Check whether an error, after classification, means the reference does not exist.
     */
    public boolean isNotFound(Throwable error) {

        error = unwrap(error);

        if (error instanceof ESecretNotFound)
            return true;

        if (error instanceof EMesh)
            return false;

        return checkKnownExceptions(error) == SECRET_NOT_FOUND;
    }

    public EMesh explicitError(String operation, String reference, ExplicitError error) {

        try {

            var messageTemplate = ERROR_MESSAGE_MAP.get(error);
            var message = String.format(messageTemplate, operation, backendKey, reference);

            var errType = EXPLICIT_CONSTRUCTOR_MAP.get(error);
            return errType.newInstance(message);
        }
        catch (
                InstantiationException |
                IllegalAccessException |
                InvocationTargetException e) {

            return new EUnexpected(e);
        }
    }

    public EMesh explicitError(String operation, String reference, ExplicitError error, Throwable cause) {

        try {

            var messageTemplate = ERROR_MESSAGE_MAP.get(error);
            var message = String.format(messageTemplate, operation, backendKey, reference);

            var errType = EXCEPTION_CONSTRUCTOR_MAP.get(error);
            return errType.newInstance(message, cause);
        }
        catch (
                InstantiationException |
                IllegalAccessException |
                InvocationTargetException e) {

            return new EUnexpected(e);
        }
    }

    protected static Throwable unwrap(Throwable error) {

        while ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null)
            error = error.getCause();

        return error;
    }

    // Look up all the exception constructors at startup, avoid weird reflection errors at runtime!

    private static final Map<ExplicitError, Constructor<? extends EMesh>> EXPLICIT_CONSTRUCTOR_MAP =
            Arrays.stream(ExplicitError.values())
            .collect(Collectors.toMap(
                    e -> e,
                    e -> explicitErrorConstructor(ERROR_TYPE_MAP.get(e))));

    private static final Map<ExplicitError, Constructor<? extends EMesh>> EXCEPTION_CONSTRUCTOR_MAP =
            Arrays.stream(ExplicitError.values())
            .collect(Collectors.toMap(
                    e -> e,
                    e -> exceptionErrorConstructor(ERROR_TYPE_MAP.get(e))));

    private static Constructor<? extends EMesh> explicitErrorConstructor(Class<? extends EMesh> errorClass) {

        try {
            return errorClass.getConstructor(String.class);
        }
        catch (NoSuchMethodException e) {
            throw new EUnexpected(e);
        }
    }

    private static Constructor<? extends EMesh> exceptionErrorConstructor(Class<? extends EMesh> errorClass) {

        try {
            return errorClass.getConstructor(String.class, Throwable.class);
        }
        catch (NoSuchMethodException e) {
            throw new EUnexpected(e);
        }
    }
}
