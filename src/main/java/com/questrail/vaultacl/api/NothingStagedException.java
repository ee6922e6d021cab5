package com.questrail.vaultacl.api;

/**
 * {@code apply} or {@code cancel} was requested with an empty pending queue.
 */
public final class NothingStagedException extends VaultAclException
{
    public NothingStagedException(String operation) {
        super("Nothing staged: cannot " + operation + " with no pending state updates");
    }
}
