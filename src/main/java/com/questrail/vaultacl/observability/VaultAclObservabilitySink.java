package com.questrail.vaultacl.observability;

/**
 * Main interface for receiving access-control observability events.
 * Implementations can provide logging, metrics, or auditing.
 */
public interface VaultAclObservabilitySink {
    /**
     * Called when the ledger accepts a mutation.
     * @param event the submitted mutation
     */
    void onMutationSubmitted(MutationSubmittedEvent event);

    /**
     * Called after every accepted mutation with the timelock before and after.
     * @param event the transition details
     */
    void onTimelockTransition(TimelockTransitionEvent event);

    /**
     * Called when a mutation is rebuilt after a precondition mismatch.
     * @param event the retry details
     */
    void onPreconditionRetry(PreconditionRetryEvent event);

    /**
     * Called when an update would leave its field unchanged and nothing is submitted.
     * @param event the skipped update
     */
    void onNoChange(NoChangeEvent event);

    /**
     * Called when an operation fails.
     * @param event the error event
     */
    void onError(VaultAclErrorEvent event);
}
