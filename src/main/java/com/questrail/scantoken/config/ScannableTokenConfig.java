package com.questrail.scantoken.config;

import com.questrail.scantoken.api.ComponentRegistry;
import com.questrail.scantoken.api.EntropySource;
import com.questrail.scantoken.entropy.SecureRandomEntropySource;
import com.questrail.scantoken.observability.NullObservabilitySink;
import com.questrail.scantoken.observability.TokenObservabilitySink;
import com.questrail.scantoken.time.SystemWallClock;
import com.questrail.scantoken.time.WallClock;

import java.util.Objects;

/**
 * Aggregated configuration for the token codec.
 *
 * <p>{@code enforceRegistryOnValidate} selects strict validation (grammar,
 * checksum and registry) over offline validation. {@code enforceRegistryOnDetect}
 * enables the detector's optional registry tier.</p>
 */
public record ScannableTokenConfig(
    ComponentRegistry registry,
    EntropySource entropySource,
    TokenObservabilitySink observabilitySink,
    WallClock wallClock,
    boolean enforceRegistryOnValidate,
    boolean enforceRegistryOnDetect
) {
    public ScannableTokenConfig {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(entropySource, "entropySource");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ComponentRegistry registry;
        private EntropySource entropySource;
        private TokenObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private boolean enforceRegistryOnValidate = true;
        private boolean enforceRegistryOnDetect = false;

        public Builder withRegistry(ComponentRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withEntropySource(EntropySource entropySource) {
            this.entropySource = entropySource;
            return this;
        }

        public Builder withObservabilitySink(TokenObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withEnforceRegistryOnValidate(boolean enforce) {
            this.enforceRegistryOnValidate = enforce;
            return this;
        }

        public Builder withEnforceRegistryOnDetect(boolean enforce) {
            this.enforceRegistryOnDetect = enforce;
            return this;
        }

        /**
         * @throws IllegalStateException if no registry was supplied
         */
        public ScannableTokenConfig build() {
            if (registry == null) {
                throw new IllegalStateException("A component registry is required");
            }
            EntropySource source = (entropySource != null) ? entropySource : new SecureRandomEntropySource();
            return new ScannableTokenConfig(
                registry,
                source,
                observabilitySink,
                wallClock,
                enforceRegistryOnValidate,
                enforceRegistryOnDetect);
        }
    }
}
