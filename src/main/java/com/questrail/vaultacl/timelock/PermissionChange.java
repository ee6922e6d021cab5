package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.api.PublicKey;

/**
 * Permission bits gained and lost by a delegate on one protocol.
 */
public record PermissionChange(PublicKey integrationProgram,
                               int protocolBitflag,
                               long addedPermissions,
                               long removedPermissions)
{
}
