package com.questrail.vaultacl.observability;

import com.questrail.vaultacl.api.TransactionId;
import com.questrail.vaultacl.timelock.Mutation;
import com.questrail.vaultacl.timelock.TimelockEngine;
import com.questrail.vaultacl.timelock.TimelockPhase;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jVaultAclObservabilitySinkTests
{
    private final Slf4jVaultAclObservabilitySink sink = new Slf4jVaultAclObservabilitySink();

    @Test
    void logsEveryEventKind() {
        Instant now = Instant.ofEpochSecond(1_700_000_000L);

        assertDoesNotThrow(() -> {
            sink.onMutationSubmitted(new MutationSubmittedEvent(now, new Mutation.CancelTimelock(3),
                    TimelockEngine.Outcome.TIMELOCK_CANCELLED, new TransactionId("tx-1"), 1));
            sink.onTimelockTransition(new TimelockTransitionEvent(now, TimelockPhase.IDLE, TimelockPhase.STAGED,
                    1_700_003_600L, List.of("  timelockDuration: 3600s → 0s")));
            sink.onPreconditionRetry(new PreconditionRetryEvent(now, "delegateAcls", 1, "stale revision"));
            sink.onNoChange(new NoChangeEvent(now, "delegateAcls", 4));
            sink.onError(new VaultAclErrorEvent(now, "boom", new IllegalStateException("boom")));
        });
    }

    @Test
    void phaseChangeIsDetected() {
        Instant now = Instant.EPOCH;

        assertTrue(new TimelockTransitionEvent(now, TimelockPhase.IDLE, TimelockPhase.STAGED, 10, List.of())
                .isPhaseChange());
        assertFalse(new TimelockTransitionEvent(now, TimelockPhase.STAGED, TimelockPhase.STAGED, 10, List.of())
                .isPhaseChange());
    }
}
