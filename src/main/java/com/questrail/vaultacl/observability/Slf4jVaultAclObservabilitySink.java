package com.questrail.vaultacl.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of VaultAclObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jVaultAclObservabilitySink implements VaultAclObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jVaultAclObservabilitySink.class);

    @Override
    public void onMutationSubmitted(MutationSubmittedEvent event) {
        log.info("Mutation of {} {} (attempt {}): {}",
            event.mutation().fieldName(),
            event.outcome(),
            event.attempt(),
            event.transactionId());
    }

    @Override
    public void onTimelockTransition(TimelockTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Timelock: {} -> {} (expiresAt={})",
                event.oldPhase(),
                event.newPhase(),
                event.expiresAt());
        }
        if (log.isDebugEnabled()) {
            for (String line : event.pendingDescription()) {
                log.debug("Pending:{}", line);
            }
        }
    }

    @Override
    public void onPreconditionRetry(PreconditionRetryEvent event) {
        log.warn("Precondition mismatch on {} (attempt {}), retrying with fresh state: {}",
            event.field(),
            event.attempt(),
            event.reason());
    }

    @Override
    public void onNoChange(NoChangeEvent event) {
        log.info("No change to {} at revision {}, nothing submitted",
            event.field(),
            event.revision());
    }

    @Override
    public void onError(VaultAclErrorEvent event) {
        log.error("Vault ACL error: {}", event.message(), event.cause());
    }
}
