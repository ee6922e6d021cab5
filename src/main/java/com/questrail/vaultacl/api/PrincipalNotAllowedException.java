package com.questrail.vaultacl.api;

/**
 * An allowlist removal was requested for a principal that is not listed.
 */
public final class PrincipalNotAllowedException extends VaultAclException
{
    private final Principal principal;

    public PrincipalNotAllowedException(String allowlist, Principal principal) {
        super(principal.display() + " is not in the " + allowlist + " allowlist");
        this.principal = principal;
    }

    public Principal principal() {
        return principal;
    }
}
