package com.questrail.steward.config;

import com.questrail.steward.dispatch.internal.admission.RateLimitPolicy;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the steward runtime.
 *
 * @param defaultRateLimit applied to registrations that declare no limit of their own; may be null
 */
public record StewardRuntimeConfig(
    DispatchTimingPolicy timingPolicy,
    DispatchMessages messages,
    int handlerThreads,
    InetSocketAddress bindAddress,
    String ingressPath,
    RateLimitPolicy defaultRateLimit
) {
    public StewardRuntimeConfig {
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(messages, "messages");
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(ingressPath, "ingressPath");
        if (handlerThreads < 1) {
            throw new IllegalArgumentException("handlerThreads must be >= 1");
        }
        if (!ingressPath.startsWith("/")) {
            throw new IllegalArgumentException("ingressPath must start with '/'");
        }
    }

    public Optional<RateLimitPolicy> defaultRateLimitPolicy() {
        return Optional.ofNullable(defaultRateLimit);
    }

    public static StewardRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DispatchTimingPolicy timingPolicy = DispatchTimingPolicy.defaults();
        private DispatchMessages messages = DispatchMessages.defaults();
        private int handlerThreads = 4;
        private InetSocketAddress bindAddress = new InetSocketAddress(8080);
        private String ingressPath = "/events";
        private RateLimitPolicy defaultRateLimit;

        public Builder withTimingPolicy(DispatchTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withMessages(DispatchMessages messages) {
            this.messages = messages;
            return this;
        }

        public Builder withHandlerThreads(int handlerThreads) {
            this.handlerThreads = handlerThreads;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withIngressPath(String ingressPath) {
            this.ingressPath = ingressPath;
            return this;
        }

        public Builder withDefaultRateLimit(RateLimitPolicy policy) {
            this.defaultRateLimit = policy;
            return this;
        }

        public StewardRuntimeConfig build() {
            return new StewardRuntimeConfig(timingPolicy, messages, handlerThreads,
                bindAddress, ingressPath, defaultRateLimit);
        }
    }
}
