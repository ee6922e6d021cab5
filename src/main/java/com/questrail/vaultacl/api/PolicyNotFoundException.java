package com.questrail.vaultacl.api;

/**
 * A policy was read (or removed from) before any policy was ever set for the
 * protocol.
 */
public final class PolicyNotFoundException extends VaultAclException
{
    public PolicyNotFoundException(String protocolName) {
        super(protocolName + " policy not found");
    }
}
