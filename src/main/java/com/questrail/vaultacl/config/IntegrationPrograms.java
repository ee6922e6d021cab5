package com.questrail.vaultacl.config;

import com.questrail.vaultacl.api.PublicKey;

import java.util.Objects;

/**
 * Deployed program keys of the standard integrations.
 *
 * <p>Program keys differ per cluster, so they are configuration rather than
 * constants. Keys may be given as {@link PublicKey}s or in Base58.</p>
 */
public record IntegrationPrograms(
        PublicKey glamProtocol,
        PublicKey extSpl,
        PublicKey extDrift,
        PublicKey extKamino,
        PublicKey extCctp
) {
    public IntegrationPrograms {
        Objects.requireNonNull(glamProtocol, "glamProtocol");
        Objects.requireNonNull(extSpl, "extSpl");
        Objects.requireNonNull(extDrift, "extDrift");
        Objects.requireNonNull(extKamino, "extKamino");
        Objects.requireNonNull(extCctp, "extCctp");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PublicKey glamProtocol;
        private PublicKey extSpl;
        private PublicKey extDrift;
        private PublicKey extKamino;
        private PublicKey extCctp;

        public Builder withGlamProtocol(PublicKey program) {
            this.glamProtocol = program;
            return this;
        }

        public Builder withGlamProtocol(String base58) {
            return withGlamProtocol(PublicKey.fromBase58(base58));
        }

        public Builder withExtSpl(PublicKey program) {
            this.extSpl = program;
            return this;
        }

        public Builder withExtSpl(String base58) {
            return withExtSpl(PublicKey.fromBase58(base58));
        }

        public Builder withExtDrift(PublicKey program) {
            this.extDrift = program;
            return this;
        }

        public Builder withExtDrift(String base58) {
            return withExtDrift(PublicKey.fromBase58(base58));
        }

        public Builder withExtKamino(PublicKey program) {
            this.extKamino = program;
            return this;
        }

        public Builder withExtKamino(String base58) {
            return withExtKamino(PublicKey.fromBase58(base58));
        }

        public Builder withExtCctp(PublicKey program) {
            this.extCctp = program;
            return this;
        }

        public Builder withExtCctp(String base58) {
            return withExtCctp(PublicKey.fromBase58(base58));
        }

        public IntegrationPrograms build() {
            return new IntegrationPrograms(glamProtocol, extSpl, extDrift, extKamino, extCctp);
        }
    }
}
