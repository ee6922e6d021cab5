package com.questrail.vaultacl.api;

/**
 * Root of every failure raised by the access-control, policy and timelock
 * engine.
 *
 * <p>All validation failures are raised <em>before</em> any remote mutation is
 * attempted. Only {@link RemoteMutationRejectedException} reports a failure at
 * the remote authority.</p>
 */
public abstract class VaultAclException extends RuntimeException
{
    protected VaultAclException(String message) {
        super(message);
    }

    protected VaultAclException(String message, Throwable cause) {
        super(message, cause);
    }
}
