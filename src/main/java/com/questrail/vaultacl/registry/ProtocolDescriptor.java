package com.questrail.vaultacl.registry;

import com.questrail.vaultacl.codec.BitmaskCodec;
import com.questrail.vaultacl.mapping.PermissionIndex;
import com.questrail.vaultacl.policy.PolicySchema;

import java.util.Objects;
import java.util.Optional;

/**
 * One protocol offered by an integration program.
 *
 * @param name         canonical display name, e.g. {@code "DriftProtocol"}
 * @param bitflag      single-bit identifier within the integration
 * @param permissions  closed, ordered list of permission names by bit
 * @param policySchema payload layout of this protocol's policy, if it has one
 */
public record ProtocolDescriptor(String name,
                                 int bitflag,
                                 PermissionIndex permissions,
                                 Optional<PolicySchema> policySchema)
{
    public ProtocolDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(permissions, "permissions");
        Objects.requireNonNull(policySchema, "policySchema");
        if (!BitmaskCodec.isSingleBit(bitflag) || bitflag > 0xFFFF) {
            throw new IllegalArgumentException(name + ": protocol bitflag must be a single u16 bit, got 0b"
                    + Integer.toBinaryString(bitflag));
        }
    }

    public static ProtocolDescriptor of(String name, int bitflag, PermissionIndex permissions) {
        return new ProtocolDescriptor(name, bitflag, permissions, Optional.empty());
    }

    public static ProtocolDescriptor of(String name, int bitflag, PermissionIndex permissions, PolicySchema schema) {
        return new ProtocolDescriptor(name, bitflag, permissions, Optional.of(schema));
    }

    /**
     * Name of the permission at bit {@code ordinal}, or {@code null} if the
     * protocol does not declare one there.
     */
    public String permissionNameAt(int ordinal) {
        return permissions.tryNameAt(ordinal).orElse(null);
    }
}
