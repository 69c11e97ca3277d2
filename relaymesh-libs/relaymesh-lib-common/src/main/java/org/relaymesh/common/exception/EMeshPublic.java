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
 * Public errors are errors that can be reported back to the caller.
 *
 * <p>Messages for public errors must never contain secret material, key material
 * or credentials. They may include secret references, backend types and error categories.</p>
 */
public abstract class EMeshPublic extends EMesh {

    public EMeshPublic(String message, Throwable cause) {
        super(message, cause);
    }

    public EMeshPublic(String message) {
        super(message);
    }
}
