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
 * Decryption of a locally stored secret failed.
 *
 * <p>The same error is raised for a tampered ciphertext, a wrong key and a wrong nonce.
 * The message never carries detail about which check failed.</p>
 */
public class EDecryption extends ESecret {

    public EDecryption(String message, Throwable cause) {
        super(message, cause);
    }

    public EDecryption(String message) {
        super(message);
    }
}
