package com.questrail.vaultacl.api;

/**
 * A policy buffer could not be decoded: it is shorter than its declared
 * length field requires, or carries trailing bytes the schema does not
 * describe.
 */
public final class PolicyDecodeException extends VaultAclException
{
    public PolicyDecodeException(String message) {
        super(message);
    }

    public PolicyDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
