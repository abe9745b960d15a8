package com.tenant.auth.server.key;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import com.tenant.auth.server.exception.AuthException;
import com.tenant.auth.server.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SigningKeySource} caching the fetched public keys until the set expires.
 * <p>
 * Refreshes are coalesced: concurrent misses share a single in-flight fetch, and after a
 * completed fetch an unknown key id does not trigger another one within
 * {@code minRefreshInterval}. A fetched set is published in one step, so readers see either
 * the old set or the new one.
 */
@Slf4j
public class CachingSigningKeySource implements SigningKeySource {

    private final SigningKey signingKey;
    private final PublicKeyFetcher fetcher;
    private final Clock clock;
    private final Duration fetchTimeout;
    private final Duration minRefreshInterval;
    private final Executor executor;

    private final AtomicReference<PublicKeySet> current = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<PublicKeySet>> inFlight = new AtomicReference<>();
    private volatile Instant lastRefreshAt;

    public CachingSigningKeySource(SigningKey signingKey, PublicKeyFetcher fetcher, Clock clock,
                                   Duration fetchTimeout, Duration minRefreshInterval) {
        this(signingKey, fetcher, clock, fetchTimeout, minRefreshInterval, ForkJoinPool.commonPool());
    }

    public CachingSigningKeySource(SigningKey signingKey, PublicKeyFetcher fetcher, Clock clock,
                                   Duration fetchTimeout, Duration minRefreshInterval, Executor executor) {
        this.signingKey = signingKey;
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
        this.minRefreshInterval = Objects.requireNonNull(minRefreshInterval, "minRefreshInterval");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public SigningKey currentSigningKey() {
        if (signingKey == null) {
            throw new IllegalStateException("No signing key configured, this key source can only verify");
        }
        return signingKey;
    }

    @Override
    public Optional<VerificationKey> findVerificationKey(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        PublicKeySet seen = current.get();
        if (seen != null && !seen.isExpired(now)) {
            Optional<VerificationKey> key = seen.find(keyId);
            if (key.isPresent() || refreshedRecently(now)) {
                return key;
            }
        }

        PublicKeySet refreshed = await(joinOrStartFetch(seen, false));
        if (refreshed.isExpired(clock.instant())) {
            log.warn("Fetched public keys already expired at {}", refreshed.expiresAt());
            return Optional.empty();
        }
        return refreshed.find(keyId);
    }

    @Override
    public void refresh() {
        await(joinOrStartFetch(null, true));
    }

    /**
     * Refreshes when the cached set is missing or expires within {@code minRefreshInterval}.
     * Failures are logged, the cached set stays in place.
     */
    public void refreshIfNeeded() {
        PublicKeySet keys = current.get();
        if (keys == null || keys.isExpired(clock.instant().plus(minRefreshInterval))) {
            try {
                refresh();
            } catch (AuthException e) {
                log.warn("Failed to refresh public keys", e);
            }
        }
    }

    private boolean refreshedRecently(Instant now) {
        Instant last = lastRefreshAt;
        return last != null && now.isBefore(last.plus(minRefreshInterval));
    }

    /**
     * Joins the running fetch, or starts one unless a set other than {@code seen} was published
     * meanwhile. {@code force} ignores what was published.
     */
    private CompletableFuture<PublicKeySet> joinOrStartFetch(PublicKeySet seen, boolean force) {
        while (true) {
            CompletableFuture<PublicKeySet> existing = inFlight.get();
            if (existing != null) {
                return existing;
            }
            PublicKeySet latest = current.get();
            if (!force && latest != null && latest != seen) {
                return CompletableFuture.completedFuture(latest);
            }
            CompletableFuture<PublicKeySet> created = new CompletableFuture<>();
            if (inFlight.compareAndSet(null, created)) {
                latest = current.get();
                if (!force && latest != null && latest != seen) {
                    // a fetch finished between the read above and the CAS
                    created.complete(latest);
                    inFlight.compareAndSet(created, null);
                    return created;
                }
                try {
                    executor.execute(() -> runFetch(created));
                } catch (RuntimeException e) {
                    inFlight.compareAndSet(created, null);
                    throw new UpstreamUnavailableException("Could not schedule the public key fetch", e);
                }
                return created;
            }
        }
    }

    private void runFetch(CompletableFuture<PublicKeySet> target) {
        try {
            PublicKeySet fetched = fetcher.fetch();
            current.set(fetched);
            lastRefreshAt = clock.instant();
            log.info("Fetched {} public keys, valid until {}", fetched.size(), fetched.expiresAt());
            target.complete(fetched);
        } catch (RuntimeException e) {
            target.completeExceptionally(e);
        } finally {
            inFlight.compareAndSet(target, null);
        }
    }

    private PublicKeySet await(CompletableFuture<PublicKeySet> fetch) {
        try {
            return fetch.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new UpstreamUnavailableException("Timed out after " + fetchTimeout + " fetching public keys", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Interrupted while fetching public keys", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AuthException authException) {
                throw authException;
            }
            throw new UpstreamUnavailableException("Failed to fetch public keys", e.getCause());
        }
    }
}
