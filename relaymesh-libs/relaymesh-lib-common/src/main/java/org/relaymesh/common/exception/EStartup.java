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
 * EStartup signals a failure during the startup sequence. It should always be fatal.
 *
 * <p>Typical causes are invalid configuration, a plugin that cannot be loaded
 * or a data source that cannot be created.</p>
 */
public class EStartup extends EMeshPublic {

    private final int exitCode;

    public EStartup(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public EStartup(String message, int exitCode) {
        this(message, exitCode, null);
    }

    public EStartup(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public EStartup(String message) {
        this(message, -1);
    }

    public int getExitCode() {
        return exitCode;
    }
}
