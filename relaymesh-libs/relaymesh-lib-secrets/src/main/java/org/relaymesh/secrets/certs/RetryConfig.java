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

package org.relaymesh.secrets.certs;

import java.time.Duration;


/**
 * Exponential backoff for certificate issuance.
 */
public final class RetryConfig {

    public static final RetryConfig DEFAULT = new RetryConfig(3, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;

    public RetryConfig(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {

        if (maxAttempts < 1)
            throw new IllegalArgumentException("Retry config needs at least one attempt");

        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.multiplier = multiplier;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before the given attempt, counting from zero. The first attempt has no delay.
     */
    public Duration backoffForAttempt(int attempt) {

        if (attempt <= 0)
            return Duration.ZERO;

        var millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        var capped = Math.min(millis, (double) maxBackoff.toMillis());

        return Duration.ofMillis((long) capped);
    }

    @Override
    public String toString() {
        return "RetryConfig{maxAttempts=" + maxAttempts +
                ", initialBackoff=" + initialBackoff +
                ", maxBackoff=" + maxBackoff +
                ", multiplier=" + multiplier + "}";
    }
}
