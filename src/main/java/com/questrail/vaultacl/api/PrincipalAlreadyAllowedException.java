package com.questrail.vaultacl.api;

/**
 * An allowlist addition was requested for a principal that is already listed.
 */
public final class PrincipalAlreadyAllowedException extends VaultAclException
{
    private final Principal principal;

    public PrincipalAlreadyAllowedException(String allowlist, Principal principal) {
        super(principal.display() + " is already in the " + allowlist + " allowlist");
        this.principal = principal;
    }

    public Principal principal() {
        return principal;
    }
}
