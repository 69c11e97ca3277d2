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

package org.relaymesh.common.exception;


/**
 * An unexpected error is raised when a code path is reached that should not be reachable.
 */
public class EUnexpected extends EMeshInternal {

    private static final String UNEXPECTED_ERROR = "Unexpected error";

    public EUnexpected(String message, Throwable cause) {
        super(message, cause);
    }

    public EUnexpected(Throwable cause) {
        super(UNEXPECTED_ERROR, cause);
    }

    public EUnexpected(String message) {
        super(message);
    }

    public EUnexpected() {
        super(UNEXPECTED_ERROR);
    }
}
