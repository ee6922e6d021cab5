package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.api.PublicKey;

import java.util.List;

/**
 * A delegate present in both live and staged state whose expiry or
 * permissions differ.
 */
public record DelegateChange(PublicKey pubkey,
                             long currentExpiresAt,
                             long stagedExpiresAt,
                             List<PermissionChange> permissionChanges)
{
    public DelegateChange {
        permissionChanges = List.copyOf(permissionChanges);
    }

    public boolean expiryChanged() {
        return currentExpiresAt != stagedExpiresAt;
    }
}
