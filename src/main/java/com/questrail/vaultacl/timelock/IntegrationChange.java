package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.api.PublicKey;

import java.util.List;

/**
 * An integration present in both live and staged state whose protocols or
 * policies differ.
 *
 * @param enabledProtocols  protocol bits off now and on once applied
 * @param disabledProtocols protocol bits on now and off once applied
 */
public record IntegrationChange(PublicKey integrationProgram,
                                int enabledProtocols,
                                int disabledProtocols,
                                List<PolicyChange> policyChanges)
{
    public IntegrationChange {
        policyChanges = List.copyOf(policyChanges);
    }

    public boolean isEmpty() {
        return enabledProtocols == 0 && disabledProtocols == 0 && policyChanges.isEmpty();
    }
}
