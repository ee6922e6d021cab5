package com.questrail.vaultacl.client;

import com.questrail.vaultacl.timelock.VaultState;

/**
 * Reads the vault's current state from the ledger.
 *
 * <p>Implementations own transport, account decoding and timeouts. Each call
 * returns a fresh snapshot; callers never cache it across mutations.</p>
 */
@FunctionalInterface
public interface StateReader
{
    VaultState fetchLiveState();
}
