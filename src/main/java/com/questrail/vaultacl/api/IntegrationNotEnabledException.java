package com.questrail.vaultacl.api;

/**
 * An integration-level precondition does not hold: the integration program is
 * not enabled (or already is), or a protocol bit required for a policy entry
 * is not set.
 */
public final class IntegrationNotEnabledException extends VaultAclException
{
    public IntegrationNotEnabledException(String message) {
        super(message);
    }
}
