package com.questrail.vaultacl.api;

import java.util.List;

/**
 * A permission name is not declared by the resolved protocol.
 */
public final class UnknownPermissionException extends VaultAclException
{
    private final String protocolName;
    private final String permissionName;

    public UnknownPermissionException(String protocolName, String permissionName, List<String> allowed) {
        super("Unknown permission \"" + permissionName + "\" for protocol " + protocolName
                + ". Allowed values are: " + String.join(", ", allowed));
        this.protocolName = protocolName;
        this.permissionName = permissionName;
    }

    public String protocolName() {
        return protocolName;
    }

    public String permissionName() {
        return permissionName;
    }
}
