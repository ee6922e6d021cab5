package com.questrail.vaultacl.registry;

import java.util.List;
import java.util.Objects;

/**
 * A validated set of permissions on one protocol, ready to grant or revoke.
 *
 * @param protocol           resolved protocol
 * @param permissionsBitmask OR of the selected permission bits
 * @param permissionNames    canonical names of the selected permissions
 */
public record PermissionSelection(ProtocolRef protocol, long permissionsBitmask, List<String> permissionNames)
{
    public PermissionSelection {
        Objects.requireNonNull(protocol, "protocol");
        permissionNames = List.copyOf(permissionNames);
    }
}
