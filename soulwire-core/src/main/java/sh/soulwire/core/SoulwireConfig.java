// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

import org.jspecify.annotations.Nullable;

/**
 * Node configuration.
 *
 * <p>
 * Zero, negative or null components fall back to defaults in the compact
 * constructor, so a partially filled builder or properties file always yields a
 * complete configuration.
 *
 * <pre>{@code
 * SoulwireConfig config = SoulwireConfig.builder()
 *         .port(7000)
 *         .dataDir(Path.of("/var/lib/soulwire"))
 *         .challengeTtl(Duration.ofSeconds(10))
 *         .priority(PriorityType.REPUTATION)
 *         .build();
 * }</pre>
 *
 * <p>
 * <strong>Property keys</strong> (see {@link #fromProperties(Properties)}):
 * {@code soulwire.host}, {@code soulwire.port}, {@code soulwire.io-threads},
 * {@code soulwire.max-line-length}, {@code soulwire.data-dir},
 * {@code soulwire.auth.challenge-ttl}, {@code soulwire.market.listing-ttl},
 * {@code soulwire.market.trade-deadline}, {@code soulwire.market.max-open-listings},
 * {@code soulwire.market.priority}, {@code soulwire.reputation.max-delta},
 * {@code soulwire.reputation.trade-credit}, {@code soulwire.registration.open},
 * {@code soulwire.sweep-interval}, {@code soulwire.keys-dir}. Durations use ISO-8601 ({@code PT30S}).
 *
 * @param host              bind address
 * @param port              listen port; 0 binds an ephemeral port
 * @param ioThreads         Netty worker threads
 * @param maxLineLength     longest accepted command line in bytes
 * @param dataDir           directory holding the journals
 * @param challengeTtl      lifetime of an auth challenge
 * @param listingTtl        lifetime of an OPEN listing
 * @param tradeDeadline     time both parties have to accept a trade
 * @param maxOpenListings   OPEN listings allowed per soul
 * @param priority          matching priority for resting listings
 * @param maxReputationDelta largest |delta| a single reputation event may carry
 * @param tradeCredit       delta of the endorsement each party issues on settlement
 * @param registrationOpen  whether sessions may self-register souls
 * @param sweepInterval     period of the expiry sweeper
 * @param keysDir           directory of {@code <soul-id>.key} files loaded into key
 *                          custody at startup; null leaves custody empty
 * @since 0.1.0
 */
public record SoulwireConfig(
        String host,
        int port,
        int ioThreads,
        int maxLineLength,
        Path dataDir,
        Duration challengeTtl,
        Duration listingTtl,
        Duration tradeDeadline,
        int maxOpenListings,
        PriorityType priority,
        long maxReputationDelta,
        long tradeCredit,
        @Nullable Boolean registrationOpen,
        Duration sweepInterval,
        @Nullable Path keysDir) {

    /**
     * Matching priority applied to the resting side of an order book.
     */
    public enum PriorityType {
        /** Best price first, then earliest sequence. */
        PRICE_TIME,
        /** Highest reputation score first, then price-time. */
        REPUTATION;

        static PriorityType parse(final String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "price-time", "price_time" -> PRICE_TIME;
                case "reputation" -> REPUTATION;
                default -> throw new IllegalArgumentException("Unknown market priority: " + value);
            };
        }
    }

    // Defaults
    private static final String DEFAULT_HOST = "0.0.0.0";
    private static final int DEFAULT_PORT = 6667;
    private static final int DEFAULT_IO_THREADS = 1;
    private static final int DEFAULT_MAX_LINE_LENGTH = 4096;
    private static final Path DEFAULT_DATA_DIR = Path.of("data");
    private static final Duration DEFAULT_CHALLENGE_TTL = Duration.ofSeconds(30);
    private static final Duration DEFAULT_LISTING_TTL = Duration.ofHours(1);
    private static final Duration DEFAULT_TRADE_DEADLINE = Duration.ofMinutes(5);
    private static final int DEFAULT_MAX_OPEN_LISTINGS = 16;
    private static final long DEFAULT_MAX_REPUTATION_DELTA = 100;
    private static final long DEFAULT_TRADE_CREDIT = 1;
    private static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(1);
    private static final int MIN_LINE_LENGTH = 512;

    /**
     * Compact constructor with validation and defaults.
     */
    public SoulwireConfig {
        if (host == null || host.isBlank())
            host = DEFAULT_HOST;
        if (port < 0)
            port = DEFAULT_PORT;
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;
        if (maxLineLength <= 0)
            maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        if (dataDir == null)
            dataDir = DEFAULT_DATA_DIR;
        if (challengeTtl == null)
            challengeTtl = DEFAULT_CHALLENGE_TTL;
        if (listingTtl == null)
            listingTtl = DEFAULT_LISTING_TTL;
        if (tradeDeadline == null)
            tradeDeadline = DEFAULT_TRADE_DEADLINE;
        if (maxOpenListings <= 0)
            maxOpenListings = DEFAULT_MAX_OPEN_LISTINGS;
        if (priority == null)
            priority = PriorityType.PRICE_TIME;
        if (maxReputationDelta <= 0)
            maxReputationDelta = DEFAULT_MAX_REPUTATION_DELTA;
        if (tradeCredit <= 0)
            tradeCredit = DEFAULT_TRADE_CREDIT;
        if (registrationOpen == null)
            registrationOpen = Boolean.TRUE;
        if (sweepInterval == null)
            sweepInterval = DEFAULT_SWEEP_INTERVAL;

        if (port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (maxLineLength < MIN_LINE_LENGTH) {
            throw new IllegalArgumentException(
                    "maxLineLength (" + maxLineLength + ") must be at least " + MIN_LINE_LENGTH);
        }
        requirePositive("challengeTtl", challengeTtl);
        requirePositive("listingTtl", listingTtl);
        requirePositive("tradeDeadline", tradeDeadline);
        requirePositive("sweepInterval", sweepInterval);
        if (tradeCredit > maxReputationDelta) {
            throw new IllegalArgumentException(
                    "tradeCredit (" + tradeCredit + ") must be <= maxReputationDelta (" + maxReputationDelta + ")");
        }
    }

    /**
     * Returns whether sessions may self-register souls.
     */
    public boolean isRegistrationOpen() {
        return Boolean.TRUE.equals(registrationOpen);
    }

    /**
     * Creates a configuration with all defaults.
     */
    public static SoulwireConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from properties. Missing keys take their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed, naming the key
     */
    public static SoulwireConfig fromProperties(final Properties props) {
        Objects.requireNonNull(props, "props");
        final Builder b = builder();
        final String host = props.getProperty("soulwire.host");
        if (host != null) {
            b.host(host.trim());
        }
        b.port(intProp(props, "soulwire.port", -1));
        b.ioThreads(intProp(props, "soulwire.io-threads", 0));
        b.maxLineLength(intProp(props, "soulwire.max-line-length", 0));
        final String dataDir = props.getProperty("soulwire.data-dir");
        if (dataDir != null && !dataDir.isBlank()) {
            b.dataDir(Path.of(dataDir.trim()));
        }
        b.challengeTtl(durationProp(props, "soulwire.auth.challenge-ttl"));
        b.listingTtl(durationProp(props, "soulwire.market.listing-ttl"));
        b.tradeDeadline(durationProp(props, "soulwire.market.trade-deadline"));
        b.maxOpenListings(intProp(props, "soulwire.market.max-open-listings", 0));
        final String priority = props.getProperty("soulwire.market.priority");
        if (priority != null && !priority.isBlank()) {
            b.priority(PriorityType.parse(priority));
        }
        b.maxReputationDelta(longProp(props, "soulwire.reputation.max-delta"));
        b.tradeCredit(longProp(props, "soulwire.reputation.trade-credit"));
        final String open = props.getProperty("soulwire.registration.open");
        if (open != null && !open.isBlank()) {
            b.registrationOpen(Boolean.parseBoolean(open.trim()));
        }
        b.sweepInterval(durationProp(props, "soulwire.sweep-interval"));
        final String keysDir = props.getProperty("soulwire.keys-dir");
        if (keysDir != null && !keysDir.isBlank()) {
            b.keysDir(Path.of(keysDir.trim()));
        }
        return b.build();
    }

    private static void requirePositive(final String name, final Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static int intProp(final Properties props, final String key, final int fallback) {
        final String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long longProp(final Properties props, final String key) {
        final String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static @Nullable Duration durationProp(final Properties props, final String key) {
        final String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 duration for " + key + ": " + value, e);
        }
    }

    /**
     * Builder for {@link SoulwireConfig}.
     */
    public static final class Builder {
        private String host = null;
        private int port = -1;
        private int ioThreads = 0;
        private int maxLineLength = 0;
        private Path dataDir = null;
        private Duration challengeTtl = null;
        private Duration listingTtl = null;
        private Duration tradeDeadline = null;
        private int maxOpenListings = 0;
        private PriorityType priority = null;
        private long maxReputationDelta = 0;
        private long tradeCredit = 0;
        private Boolean registrationOpen = null;
        private Duration sweepInterval = null;
        private Path keysDir = null;

        private Builder() {
        }

        /** Bind address. Default: 0.0.0.0. */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /** Listen port, 0 for ephemeral. Default: 6667. */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /** Netty worker threads. Default: 1. */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /** Longest accepted line in bytes. Default: 4096. */
        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        /** Journal directory. Default: ./data. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Auth challenge lifetime. Default: 30 seconds. */
        public Builder challengeTtl(Duration challengeTtl) {
            this.challengeTtl = challengeTtl;
            return this;
        }

        /** OPEN listing lifetime. Default: 1 hour. */
        public Builder listingTtl(Duration listingTtl) {
            this.listingTtl = listingTtl;
            return this;
        }

        /** Trade acceptance window. Default: 5 minutes. */
        public Builder tradeDeadline(Duration tradeDeadline) {
            this.tradeDeadline = tradeDeadline;
            return this;
        }

        /** OPEN listings per soul. Default: 16. */
        public Builder maxOpenListings(int maxOpenListings) {
            this.maxOpenListings = maxOpenListings;
            return this;
        }

        /** Matching priority. Default: PRICE_TIME. */
        public Builder priority(PriorityType priority) {
            this.priority = priority;
            return this;
        }

        /** Largest |delta| per reputation event. Default: 100. */
        public Builder maxReputationDelta(long maxReputationDelta) {
            this.maxReputationDelta = maxReputationDelta;
            return this;
        }

        /** Settlement endorsement delta. Default: 1. */
        public Builder tradeCredit(long tradeCredit) {
            this.tradeCredit = tradeCredit;
            return this;
        }

        /** Self-registration over the wire. Default: true. */
        public Builder registrationOpen(boolean registrationOpen) {
            this.registrationOpen = registrationOpen;
            return this;
        }

        /** Expiry sweeper period. Default: 1 second. */
        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        /** Directory of {@code <soul-id>.key} files for server-side signing. Default: none. */
        public Builder keysDir(Path keysDir) {
            this.keysDir = keysDir;
            return this;
        }

        public SoulwireConfig build() {
            return new SoulwireConfig(
                    host,
                    port,
                    ioThreads,
                    maxLineLength,
                    dataDir,
                    challengeTtl,
                    listingTtl,
                    tradeDeadline,
                    maxOpenListings,
                    priority,
                    maxReputationDelta,
                    tradeCredit,
                    registrationOpen,
                    sweepInterval,
                    keysDir);
        }
    }
}
