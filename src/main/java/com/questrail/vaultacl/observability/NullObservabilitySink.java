package com.questrail.vaultacl.observability;

/**
 * No-op implementation of VaultAclObservabilitySink.
 */
public final class NullObservabilitySink implements VaultAclObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMutationSubmitted(MutationSubmittedEvent event) {}

    @Override
    public void onTimelockTransition(TimelockTransitionEvent event) {}

    @Override
    public void onPreconditionRetry(PreconditionRetryEvent event) {}

    @Override
    public void onNoChange(NoChangeEvent event) {}

    @Override
    public void onError(VaultAclErrorEvent event) {}
}
