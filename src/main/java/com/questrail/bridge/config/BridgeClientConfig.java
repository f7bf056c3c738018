package com.questrail.bridge.config;

import com.questrail.bridge.internal.exec.BackoffPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for a bridge client.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>endpoint: {@code ws://localhost:3001/}</li>
 *   <li>connectTimeout: 10s</li>
 *   <li>requestTimeout: 30s</li>
 *   <li>backoff: 1000ms initial, 2x, 30000ms cap, 5 attempts</li>
 *   <li>maxFramePayloadLength: 64 KiB</li>
 * </ul>
 */
public record BridgeClientConfig(
    BridgeEndpointConfig endpoint,
    Duration connectTimeout,
    Duration requestTimeout,
    BackoffPolicy backoffPolicy,
    int maxFramePayloadLength
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_FRAME_PAYLOAD_LENGTH = 65536;

    public BridgeClientConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(backoffPolicy, "backoffPolicy");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be positive");
        }
    }

    public static BridgeClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeEndpointConfig endpoint = BridgeEndpointConfig.defaults();
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration initialBackoff = Duration.ofMillis(1000);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofMillis(30_000);
        private int maxReconnectAttempts = 5;
        private int maxFramePayloadLength = DEFAULT_MAX_FRAME_PAYLOAD_LENGTH;

        public Builder withEndpoint(BridgeEndpointConfig endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withEndpoint(String uri) {
            this.endpoint = BridgeEndpointConfig.parse(uri);
            return this;
        }

        public Builder withConnectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder withRequestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        public Builder withInitialBackoff(Duration delay) {
            this.initialBackoff = delay;
            return this;
        }

        public Builder withBackoffMultiplier(double multiplier) {
            this.backoffMultiplier = multiplier;
            return this;
        }

        public Builder withMaxBackoff(Duration delay) {
            this.maxBackoff = delay;
            return this;
        }

        public Builder withMaxReconnectAttempts(int attempts) {
            this.maxReconnectAttempts = attempts;
            return this;
        }

        public Builder withMaxFramePayloadLength(int length) {
            this.maxFramePayloadLength = length;
            return this;
        }

        public BridgeClientConfig build() {
            BackoffPolicy backoff = new BackoffPolicy(
                initialBackoff, backoffMultiplier, maxBackoff, maxReconnectAttempts);
            return new BridgeClientConfig(endpoint, connectTimeout, requestTimeout, backoff, maxFramePayloadLength);
        }
    }
}
