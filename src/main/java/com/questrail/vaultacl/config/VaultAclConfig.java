package com.questrail.vaultacl.config;

import java.util.Objects;

/**
 * Aggregated configuration for the vault access-control client.
 *
 * @param programs             deployed keys of the standard integrations
 * @param preconditionRetries  how many times a mutation rejected for a
 *                             precondition mismatch is rebuilt from fresh state
 *                             and resubmitted (0 or 1)
 */
public record VaultAclConfig(
    IntegrationPrograms programs,
    int preconditionRetries
) {
    public VaultAclConfig {
        Objects.requireNonNull(programs, "programs");
        if (preconditionRetries < 0 || preconditionRetries > 1) {
            throw new IllegalArgumentException("preconditionRetries must be 0 or 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private IntegrationPrograms programs;
        private int preconditionRetries = 1;

        public Builder withPrograms(IntegrationPrograms programs) {
            this.programs = programs;
            return this;
        }

        public Builder withPreconditionRetries(int retries) {
            this.preconditionRetries = retries;
            return this;
        }

        public VaultAclConfig build() {
            return new VaultAclConfig(programs, preconditionRetries);
        }
    }
}
