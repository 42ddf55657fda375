// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.auth.SoulAuthenticator;
import sh.soulwire.core.market.Marketplace;

/**
 * Periodically drops expired challenges, expires listings and aborts overdue
 * trades on a single daemon thread.
 *
 * @since 0.1.0
 */
public final class ExpirySweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final SoulAuthenticator authenticator;
    private final Marketplace market;
    private final Duration interval;
    private final ScheduledExecutorService executor;

    public ExpirySweeper(final SoulAuthenticator authenticator, final Marketplace market, final Duration interval) {
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.market = Objects.requireNonNull(market, "market");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "soulwire-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        final long millis = interval.toMillis();
        executor.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Expiry sweeper running every {}", interval);
    }

    /**
     * Runs one sweep on the calling thread.
     */
    void sweep() {
        // An exception escaping a scheduled task cancels its future runs.
        try {
            authenticator.sweepExpired();
            market.sweepExpired();
        } catch (RuntimeException e) {
            log.warn("Expiry sweep failed", e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Expiry sweeper did not terminate gracefully");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            log.warn("Interrupted while shutting down expiry sweeper", e);
        }
    }
}
