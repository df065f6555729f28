package com.questrail.disttest.config;

import com.questrail.disttest.error.ConfigurationException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide configuration for the rendezvous harness.
 *
 * <p>Resolved once when a harness is constructed and never re-read per test.
 * Environment overrides:</p>
 * <ul>
 *   <li>{@value #ENV_RPC_BACKEND} - {@link RpcBackend} name, default {@link RpcBackend#DEFAULT}</li>
 *   <li>{@value #ENV_TRANSPORT_KIND} - communication transport identifier, default {@value #DEFAULT_TRANSPORT_KIND}</li>
 *   <li>{@value #ENV_RENDEZVOUS_TIMEOUT_MS} - init barrier timeout in milliseconds</li>
 *   <li>{@value #ENV_JOIN_TIMEOUT_MS} - RPC join barrier timeout in milliseconds</li>
 * </ul>
 */
public record HarnessConfig(
    RpcBackend backend,
    String transportKind,
    Duration rendezvousTimeout,
    Duration joinTimeout,
    Duration pollInterval
) {
    public static final String ENV_RPC_BACKEND = "RPC_BACKEND";
    public static final String ENV_TRANSPORT_KIND = "COMM_TRANSPORT_KIND";
    public static final String ENV_RENDEZVOUS_TIMEOUT_MS = "RENDEZVOUS_TIMEOUT_MS";
    public static final String ENV_JOIN_TIMEOUT_MS = "RPC_JOIN_TIMEOUT_MS";

    public static final String DEFAULT_TRANSPORT_KIND = "file";
    public static final Duration DEFAULT_RENDEZVOUS_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(10);

    public HarnessConfig {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(transportKind, "transportKind");
        Objects.requireNonNull(rendezvousTimeout, "rendezvousTimeout");
        Objects.requireNonNull(joinTimeout, "joinTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");

        if (transportKind.isBlank()) {
            throw new ConfigurationException("transportKind must not be blank");
        }
        if (rendezvousTimeout.isNegative() || rendezvousTimeout.isZero()) {
            throw new ConfigurationException("rendezvousTimeout must be positive");
        }
        if (joinTimeout.isNegative() || joinTimeout.isZero()) {
            throw new ConfigurationException("joinTimeout must be positive");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new ConfigurationException("pollInterval must be positive");
        }
    }

    public static HarnessConfig defaults() {
        return builder().build();
    }

    public static HarnessConfig fromSystemEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Resolve configuration from an environment map. Absent keys fall back to
     * the defaults.
     *
     * @throws ConfigurationException on an unknown backend or a malformed timeout
     */
    public static HarnessConfig fromEnvironment(Map<String, String> env)
    {
        Objects.requireNonNull(env, "env");
        Builder builder = builder();

        String backend = env.get(ENV_RPC_BACKEND);
        if (backend != null) {
            builder.withBackend(RpcBackend.parse(backend));
        }
        String transportKind = env.get(ENV_TRANSPORT_KIND);
        if (transportKind != null) {
            builder.withTransportKind(transportKind.trim());
        }
        String rendezvous = env.get(ENV_RENDEZVOUS_TIMEOUT_MS);
        if (rendezvous != null) {
            builder.withRendezvousTimeout(parseMillis(ENV_RENDEZVOUS_TIMEOUT_MS, rendezvous));
        }
        String join = env.get(ENV_JOIN_TIMEOUT_MS);
        if (join != null) {
            builder.withJoinTimeout(parseMillis(ENV_JOIN_TIMEOUT_MS, join));
        }
        return builder.build();
    }

    private static Duration parseMillis(String name, String raw)
    {
        try {
            return Duration.ofMillis(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be a number of milliseconds, was '" + raw + "'", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RpcBackend backend = RpcBackend.DEFAULT;
        private String transportKind = DEFAULT_TRANSPORT_KIND;
        private Duration rendezvousTimeout = DEFAULT_RENDEZVOUS_TIMEOUT;
        private Duration joinTimeout = DEFAULT_JOIN_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;

        public Builder withBackend(RpcBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder withTransportKind(String transportKind) {
            this.transportKind = transportKind;
            return this;
        }

        public Builder withRendezvousTimeout(Duration timeout) {
            this.rendezvousTimeout = timeout;
            return this;
        }

        public Builder withJoinTimeout(Duration timeout) {
            this.joinTimeout = timeout;
            return this;
        }

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public HarnessConfig build() {
            return new HarnessConfig(backend, transportKind, rendezvousTimeout, joinTimeout, pollInterval);
        }
    }
}
