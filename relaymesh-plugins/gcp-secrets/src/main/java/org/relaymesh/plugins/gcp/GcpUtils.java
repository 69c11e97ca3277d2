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

package org.relaymesh.plugins.gcp;

import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutureCallback;
import com.google.api.core.ApiFutures;
import com.google.api.gax.rpc.UnaryCallable;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;


class GcpUtils {

    static <TRequest, TResponse>
    CompletionStage<TResponse> unaryCall(UnaryCallable<TRequest, TResponse> callable, TRequest request) {

        try {
            return gcpCallback(callable.futureCall(request));
        }
        catch (RuntimeException e) {
            // Some request validation happens before the call is sent
            return CompletableFuture.failedFuture(e);
        }
    }

    static <T> CompletionStage<T> gcpCallback(ApiFuture<T> gcpFuture) {

        var javaFuture = new CompletableFuture<T>();

        ApiFutures.addCallback(gcpFuture, new ApiFutureCallback<T>() {

            @Override
            public void onSuccess(T result) {
                javaFuture.complete(result);
            }

            @Override
            public void onFailure(Throwable error) {

                if (error instanceof CancellationException)
                    javaFuture.cancel(true);
                else
                    javaFuture.completeExceptionally(error);
            }

        }, Runnable::run);

        return javaFuture;
    }
}
