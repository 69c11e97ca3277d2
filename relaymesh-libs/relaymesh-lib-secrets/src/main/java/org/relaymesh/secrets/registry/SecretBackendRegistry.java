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

package org.relaymesh.secrets.registry;

import org.relaymesh.common.exception.EConfig;
import org.relaymesh.common.exception.EMeshPublic;
import org.relaymesh.secrets.backend.HealthStatus;
import org.relaymesh.secrets.backend.ISecretBackend;
import org.relaymesh.secrets.backend.SecretBackendType;
import org.relaymesh.secrets.backend.SecretPayloads;
import org.relaymesh.secrets.cache.CacheKey;
import org.relaymesh.secrets.cache.SecretCache;
import org.relaymesh.secrets.certs.ICertificateBackend;
import org.relaymesh.secrets.model.SecretSpec;
import org.relaymesh.secrets.model.SecretType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;


/**
 * Entry point for secret lookups and certificate issuance.
 *
 * <p>Holds at most one backend per {@link SecretBackendType}, plus a single certificate
 * backend slot which is kept apart from the secret backends. Secret lookups go through the
 * cache, reference validation and certificate issuance never do.</p>
 *
 * <p>Concurrent misses for the same key may each call the backend. The last result to
 * arrive is the one left in the cache.</p>
 */
public class SecretBackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(SecretBackendRegistry.class);

    private final Map<SecretBackendType, ISecretBackend> backends;
    private final AtomicReference<ICertificateBackend> certificateBackend;
    private final SecretCache cache;

    public SecretBackendRegistry(SecretCache cache) {

        this.backends = new ConcurrentHashMap<>();
        this.certificateBackend = new AtomicReference<>();
        this.cache = cache;
    }

    public SecretBackendRegistry() {
        this(new SecretCache());
    }

    /**
     * Register a backend under its own reported type, replacing any earlier backend of that type.
     */
    public void register(ISecretBackend backend) {

        var type = backend.backendType();
        var prior = backends.put(type, backend);

        if (prior != null && prior != backend)
            log.info("Replaced secret backend [{}]", type);
        else
            log.info("Registered secret backend [{}]", type);
    }

    public boolean hasBackend(SecretBackendType backendType) {
        return backends.containsKey(backendType);
    }

    public Set<SecretBackendType> registeredBackends() {

        var registered = EnumSet.noneOf(SecretBackendType.class);
        registered.addAll(backends.keySet());

        return Collections.unmodifiableSet(registered);
    }

    public CompletionStage<SecretSpec> fetchSecret(SecretBackendType backendType, String reference, SecretType expectedType) {

        var cacheKey = CacheKey.of(backendType, reference, expectedType);
        var cached = cache.get(cacheKey);

        if (cached.isPresent()) {
            log.debug("Secret cache hit [{}]", cacheKey);
            return CompletableFuture.completedFuture(cached.get());
        }

        var backend = backends.get(backendType);

        if (backend == null)
            return CompletableFuture.failedFuture(notRegistered(backendType));

        log.debug("Secret cache miss [{}]", cacheKey);

        return invokeBackend(() -> backend.fetchSecret(reference, expectedType)).thenApply(spec -> {

            var source = String.format("%s [%s]", backendType, reference);
            SecretPayloads.checkType(spec, expectedType, source);

            cache.insert(cacheKey, spec);
            return spec;
        });
    }

    /**
     * Check a reference exists. Always asks the backend, the cache is not used.
     */
    public CompletionStage<Boolean> validateReference(SecretBackendType backendType, String reference) {

        var backend = backends.get(backendType);

        if (backend == null)
            return CompletableFuture.failedFuture(notRegistered(backendType));

        return invokeBackend(() -> backend.validateReference(reference));
    }

    /**
     * Probe every registered backend. Each probe runs on its own, a failing
     * backend is reported as unhealthy and does not affect the others.
     */
    public CompletionStage<Map<SecretBackendType, HealthStatus>> healthCheckAll() {

        return healthCheckAll(null);
    }

    /**
     * Probe every registered backend, giving each probe at most the given time to respond.
     */
    public CompletionStage<Map<SecretBackendType, HealthStatus>> healthCheckAll(Duration timeout) {

        var probes = new EnumMap<SecretBackendType, CompletableFuture<HealthStatus>>(SecretBackendType.class);

        for (var backend : backends.values())
            probes.put(backend.backendType(), probe(backend, timeout));

        var allProbes = probes.values().toArray(CompletableFuture<?>[]::new);

        return CompletableFuture.allOf(allProbes).thenApply(x -> {

            var results = new EnumMap<SecretBackendType, HealthStatus>(SecretBackendType.class);
            probes.forEach((type, probe) -> results.put(type, probe.join()));

            return Collections.unmodifiableMap(results);
        });
    }

    public CompletionStage<HealthStatus> healthCheck(SecretBackendType backendType) {

        var backend = backends.get(backendType);

        if (backend == null)
            return CompletableFuture.failedFuture(notRegistered(backendType));

        return probe(backend, null);
    }

    public void registerCertificateBackend(ICertificateBackend backend) {

        var prior = certificateBackend.getAndSet(backend);

        if (prior != null)
            log.info("Replaced certificate backend [{}] with [{}]", prior.backendType(), backend.backendType());
        else
            log.info("Registered certificate backend [{}], trust domain = [{}]", backend.backendType(), backend.trustDomain());
    }

    public Optional<ICertificateBackend> certificateBackend() {
        return Optional.ofNullable(certificateBackend.get());
    }

    public void invalidateCache(SecretBackendType backendType, String reference, SecretType secretType) {
        cache.invalidate(CacheKey.of(backendType, reference, secretType));
    }

    public void invalidateReference(String reference) {
        cache.invalidateReference(reference);
    }

    public void clearCache() {
        cache.clear();
    }

    public int cacheSize() {
        return cache.size();
    }

    public Duration cacheTtl() {
        return cache.ttl();
    }

    private CompletableFuture<HealthStatus> probe(ISecretBackend backend, Duration timeout) {

        var type = backend.backendType();

        var probe = invokeBackend(backend::healthCheck)
                .thenApply(result -> HealthStatus.healthy());

        if (timeout != null)
            probe = probe.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);

        return probe.exceptionally(error -> {

            var status = HealthStatus.unhealthy(describeFailure(error, timeout));
            log.warn("Health check failed for secret backend [{}]: {}", type, status.message());

            return status;
        });
    }

    // Backends should report errors through the stage, but a direct throw is handled the same way
    private static <T> CompletableFuture<T> invokeBackend(Callable<CompletionStage<T>> call) {

        try {
            // Copy so that timeouts and other completions never touch the backend's own future
            return call.call().toCompletableFuture().thenApply(result -> result);
        }
        catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static String describeFailure(Throwable error, Duration timeout) {

        while (error instanceof CompletionException && error.getCause() != null)
            error = error.getCause();

        if (error instanceof TimeoutException)
            return String.format("Health check timed out after %d ms", timeout != null ? timeout.toMillis() : 0);

        // Public error messages never contain credentials, other errors are reported by type only
        if (error instanceof EMeshPublic)
            return error.getMessage();

        return "Health check failed: " + error.getClass().getSimpleName();
    }

    private static EConfig notRegistered(SecretBackendType backendType) {
        return new EConfig(String.format("Backend type '%s' not registered", backendType));
    }
}
