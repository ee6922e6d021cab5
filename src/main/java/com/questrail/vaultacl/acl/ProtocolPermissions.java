package com.questrail.vaultacl.acl;

import com.questrail.vaultacl.codec.BitmaskCodec;

/**
 * Permissions a delegate holds on one protocol.
 *
 * @param protocolBitflag    single-bit protocol identifier within the integration
 * @param permissionsBitmask bit {@code i} set means permission {@code i} is granted
 */
public record ProtocolPermissions(int protocolBitflag, long permissionsBitmask)
{
    public ProtocolPermissions {
        if (!BitmaskCodec.isSingleBit(protocolBitflag) || protocolBitflag > 0xFFFF) {
            throw new IllegalArgumentException("protocolBitflag must be a single u16 bit, got 0b"
                    + Integer.toBinaryString(protocolBitflag));
        }
    }

    public ProtocolPermissions withPermissionsBitmask(long mask) {
        return new ProtocolPermissions(protocolBitflag, mask);
    }

    /**
     * Returns {@code true} when every bit of {@code permissionBits} is granted.
     */
    public boolean grants(long permissionBits) {
        return permissionBits != 0 && (permissionsBitmask & permissionBits) == permissionBits;
    }
}
