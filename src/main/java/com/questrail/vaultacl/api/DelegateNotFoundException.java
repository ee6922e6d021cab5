package com.questrail.vaultacl.api;

/**
 * An operation required an existing delegate record and none was found.
 */
public final class DelegateNotFoundException extends VaultAclException
{
    public DelegateNotFoundException(PublicKey delegate) {
        super("Delegate not found: " + delegate);
    }
}
