package org.iceforge.s3bridge.cache;

import org.iceforge.s3bridge.auth.AuthErrorKind;
import org.iceforge.s3bridge.auth.AuthException;
import org.iceforge.s3bridge.credentials.CredentialBundle;
import org.iceforge.s3bridge.credentials.CredentialSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Client-side credential cache with single-flight refresh per service id.
 *
 * <p>Each service id has its own entry and its own monitor; services never block one another.
 * When a caller finds the entry stale it either starts the refresh or joins the one already in
 * flight, so there is at most one call to the {@link CredentialSource} per service at a time and
 * every waiter observes the same bundle or the same failure.
 *
 * <p>The refresh itself runs on {@code refreshExecutor}. Callers only wait on its future, each
 * with their own timeout, so a caller giving up never cancels the refresh: its result is still
 * cached for whoever asks next.
 *
 * <p>A failed refresh discards the previous bundle. The entry stays stale and the next
 * {@link #get(String)} starts a new refresh.
 *
 * <p>{@link #reset(String)} during a refresh bumps the entry's generation instead of dropping it.
 * The running refresh still answers its own waiters but its result is not stored, and a caller
 * arriving after the reset gets a new refresh that starts only once the old one has finished.
 */
public class CredentialCache implements CacheMetrics, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CredentialCache.class);

    private final CredentialSource source;
    private final CredentialCacheOptions options;
    private final Clock clock;
    private final ExecutorService refreshExecutor;
    private final boolean ownsExecutor;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder refreshes = new LongAdder();
    private final LongAdder refreshFailures = new LongAdder();

    public CredentialCache(CredentialSource source, CredentialCacheOptions options) {
        this(source, options, Clock.systemUTC(), Executors.newCachedThreadPool(new RefreshThreadFactory()), true);
    }

    public CredentialCache(CredentialSource source, CredentialCacheOptions options,
                           Clock clock, ExecutorService refreshExecutor) {
        this(source, options, clock, refreshExecutor, false);
    }

    private CredentialCache(CredentialSource source, CredentialCacheOptions options,
                            Clock clock, ExecutorService refreshExecutor, boolean ownsExecutor) {
        this.source = Objects.requireNonNull(source);
        this.options = Objects.requireNonNull(options);
        this.clock = Objects.requireNonNull(clock);
        this.refreshExecutor = Objects.requireNonNull(refreshExecutor);
        this.ownsExecutor = ownsExecutor;
    }

    /** Per-service state. All fields are guarded by the entry's monitor. */
    private static final class Entry {
        private final String serviceId;
        private CredentialBundle bundle;
        private boolean invalidated;
        // a refresh for the current generation has completed, successfully or not
        private boolean populated;
        private long generation;
        private CompletableFuture<CredentialBundle> inFlight;
        private long inFlightGeneration;
        // dropped from the map; callers holding it must look up again
        private boolean removed;

        private Entry(String serviceId) {
            this.serviceId = serviceId;
        }
    }

    public CredentialBundle get(String serviceId) {
        return get(serviceId, options.waitTimeout());
    }

    /**
     * Returns a fresh bundle, refreshing if needed and waiting at most {@code timeout} for it.
     *
     * @throws AuthException with the refresh's error kind, or {@link AuthErrorKind#UPSTREAM_FAILURE}
     *                       when the wait times out or is interrupted
     */
    public CredentialBundle get(String serviceId, Duration timeout) {
        Objects.requireNonNull(serviceId, "serviceId");
        Objects.requireNonNull(timeout, "timeout");

        CompletableFuture<CredentialBundle> pending;
        while (true) {
            Entry entry = entries.computeIfAbsent(serviceId, Entry::new);
            synchronized (entry) {
                if (entry.removed) continue;
                CredentialBundle b = entry.bundle;
                if (b != null && !entry.invalidated && b.isFresh(clock.instant(), options.safetyMargin())) {
                    hits.increment();
                    return b;
                }
                misses.increment();
                if (entry.inFlight == null) {
                    startRefresh(entry, null);
                } else if (entry.inFlightGeneration != entry.generation) {
                    logger.debug("Queueing refresh for service={} behind one started before a reset", serviceId);
                    startRefresh(entry, entry.inFlight);
                } else {
                    logger.debug("Joining in-flight refresh for service={}", serviceId);
                }
                pending = entry.inFlight;
                break;
            }
        }
        return await(serviceId, pending, timeout);
    }

    /** Marks the bundle stale so the next {@link #get(String)} refreshes. No-op for unknown services. */
    public void invalidate(String serviceId) {
        Entry entry = entries.get(serviceId);
        if (entry == null) return;
        synchronized (entry) {
            entry.invalidated = true;
        }
        logger.info("Invalidated cached credentials for service={}", serviceId);
    }

    /**
     * Returns the service to {@link CacheState#EMPTY}. A refresh still in flight completes for its
     * current waiters but never repopulates the cache.
     */
    public void reset(String serviceId) {
        Entry entry = entries.get(serviceId);
        if (entry == null) return;
        synchronized (entry) {
            if (entry.inFlight == null) {
                entry.removed = true;
                entries.remove(serviceId, entry);
            } else {
                entry.generation++;
                entry.bundle = null;
                entry.invalidated = false;
                entry.populated = false;
            }
        }
        logger.info("Reset cached credentials for service={}", serviceId);
    }

    public CacheState state(String serviceId) {
        Entry entry = entries.get(serviceId);
        if (entry == null) return CacheState.EMPTY;
        synchronized (entry) {
            if (entry.inFlight != null) return CacheState.REFRESHING;
            if (!entry.populated) return CacheState.EMPTY;
            CredentialBundle b = entry.bundle;
            if (b != null && !entry.invalidated && b.isFresh(clock.instant(), options.safetyMargin())) {
                return CacheState.FRESH;
            }
            return CacheState.STALE;
        }
    }

    public CredentialCacheOptions options() {
        return options;
    }

    // Caller holds the entry monitor. inFlight is published before submission so that a
    // same-thread executor still sees it when the refresh completes. With a predecessor the
    // fetch is submitted only after the predecessor's future completes.
    private void startRefresh(Entry entry, CompletableFuture<CredentialBundle> predecessor) {
        CompletableFuture<CredentialBundle> future = new CompletableFuture<>();
        long generation = entry.generation;
        entry.inFlight = future;
        entry.inFlightGeneration = generation;
        refreshes.increment();
        logger.debug("Starting credential refresh for service={}", entry.serviceId);
        if (predecessor == null) {
            submit(entry, future, generation);
        } else {
            predecessor.whenComplete((b, t) -> submit(entry, future, generation));
        }
    }

    private void submit(Entry entry, CompletableFuture<CredentialBundle> future, long generation) {
        try {
            refreshExecutor.execute(() -> runRefresh(entry, future, generation));
        } catch (RejectedExecutionException e) {
            AuthException failure = new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Credential refresh rejected for service " + entry.serviceId, e);
            finish(entry, future, generation, null, failure);
        }
    }

    private void runRefresh(Entry entry, CompletableFuture<CredentialBundle> future, long generation) {
        CredentialBundle fresh = null;
        AuthException failure = null;
        try {
            fresh = fetchWithRetry(entry.serviceId);
        } catch (AuthException e) {
            failure = e;
        } catch (Throwable t) {
            logger.error("Credential refresh for service={} died unexpectedly", entry.serviceId, t);
            failure = new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Credential refresh failed for service " + entry.serviceId + ": " + t, t);
        }
        finish(entry, future, generation, fresh, failure);
    }

    private void finish(Entry entry, CompletableFuture<CredentialBundle> future, long generation,
                        CredentialBundle fresh, AuthException failure) {
        synchronized (entry) {
            if (entry.inFlight == future) {
                entry.inFlight = null;
            }
            if (entry.generation == generation) {
                entry.invalidated = false;
                entry.bundle = fresh;
                entry.populated = true;
            } else {
                logger.debug("Discarding refresh result for service={} started before a reset", entry.serviceId);
            }
        }

        if (failure != null) {
            refreshFailures.increment();
            logger.warn("Credential refresh failed for service={} kind={}: {}",
                    entry.serviceId, failure.kind(), failure.getMessage());
            future.completeExceptionally(failure);
        } else {
            if (!fresh.isFresh(fresh.issuedAt(), options.safetyMargin())) {
                logger.warn("Credentials for service={} live {}s, shorter than the {}s safety margin",
                        entry.serviceId, fresh.lifetime().getSeconds(), options.safetyMargin().getSeconds());
            }
            logger.debug("Refreshed credentials for service={} expiresAt={}", entry.serviceId, fresh.expiresAt());
            future.complete(fresh);
        }
    }

    private CredentialBundle fetchWithRetry(String serviceId) {
        int attempt = 0;
        while (true) {
            try {
                CredentialBundle b = source.fetch(serviceId);
                if (b == null) {
                    throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                            "Credential source returned nothing for service " + serviceId);
                }
                if (!serviceId.equals(b.serviceId())) {
                    throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                            "Credential source returned credentials for service " + b.serviceId()
                                    + " when asked for " + serviceId);
                }
                return b;
            } catch (RuntimeException e) {
                AuthException ae = e instanceof AuthException a ? a
                        : new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                        "Credential fetch failed for service " + serviceId + ": " + e.getMessage(), e);
                if (!ae.retryable() || attempt >= options.refreshRetries()) {
                    throw ae;
                }
                long backoffMs = options.retryBackoff().toMillis() << attempt;
                attempt++;
                logger.warn("Transient credential fetch failure for service={} (attempt {} of {}), retrying in {}ms: {}",
                        serviceId, attempt, options.refreshRetries() + 1, backoffMs, ae.getMessage());
                sleep(backoffMs, serviceId, ae);
            }
        }
    }

    private static void sleep(long millis, String serviceId, AuthException pending) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            AuthException ae = new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Interrupted while retrying credential fetch for service " + serviceId, e);
            ae.addSuppressed(pending);
            throw ae;
        }
    }

    private CredentialBundle await(String serviceId, CompletableFuture<CredentialBundle> pending, Duration timeout) {
        CredentialBundle bundle;
        try {
            bundle = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Gave up waiting {}ms for credential refresh of service={}", timeout.toMillis(), serviceId);
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Timed out after " + timeout.toMillis() + "ms waiting for credentials for service " + serviceId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Interrupted while waiting for credentials for service " + serviceId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AuthException ae) throw ae;
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Credential refresh failed for service " + serviceId, cause);
        }

        if (bundle.isExpired(clock.instant())) {
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Refreshed credentials for service " + serviceId + " expired at " + bundle.expiresAt());
        }
        return bundle;
    }

    @Override public long hits() { return hits.sum(); }
    @Override public long misses() { return misses.sum(); }
    @Override public long refreshes() { return refreshes.sum(); }
    @Override public long refreshFailures() { return refreshFailures.sum(); }

    @Override
    public void close() {
        if (ownsExecutor) {
            refreshExecutor.shutdownNow();
        }
    }

    private static final class RefreshThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "s3bridge-refresh-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
