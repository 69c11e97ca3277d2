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

package org.relaymesh.secrets.crypto;

import org.relaymesh.common.exception.EUnexpected;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicReference;


/**
 * A random GCM nonce that can be consumed exactly once.
 *
 * <p>Every encryption draws a new instance, a second call to {@link #consume()} fails.</p>
 */
final class SingleUseNonce {

    static final int NONCE_LENGTH = 12;

    private final AtomicReference<byte[]> nonce;

    private SingleUseNonce(byte[] nonce) {
        this.nonce = new AtomicReference<>(nonce);
    }

    static SingleUseNonce generate(SecureRandom random) {

        var bytes = new byte[NONCE_LENGTH];
        random.nextBytes(bytes);

        return new SingleUseNonce(bytes);
    }

    byte[] consume() {

        var bytes = nonce.getAndSet(null);

        if (bytes == null)
            throw new EUnexpected("Encryption nonce has already been used");

        return bytes;
    }

    boolean isConsumed() {
        return nonce.get() == null;
    }
}
