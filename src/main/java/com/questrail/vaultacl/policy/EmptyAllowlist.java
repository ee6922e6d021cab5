package com.questrail.vaultacl.policy;

/**
 * What an empty allowlist means for a particular protocol.
 *
 * <p>The encoding is the same either way (a zero-length list); the meaning is
 * a property of the protocol and is declared by its policy schema.</p>
 */
public enum EmptyAllowlist
{
    /** Empty means unrestricted: every principal is permitted. */
    ALLOW_ALL,

    /** Empty means nothing has been allowed yet: every principal is refused. */
    DENY_ALL
}
