package com.questrail.vaultacl.acl;

import com.questrail.vaultacl.codec.BitmaskCodec;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Encoded policy payload attached to one protocol of an integration.
 *
 * <p>The payload is opaque here; {@link com.questrail.vaultacl.policy.PolicySchema}
 * decodes it. The array is copied on the way in and on the way out.</p>
 */
public record ProtocolPolicyEntry(int protocolBitflag, byte[] data)
{
    public ProtocolPolicyEntry {
        if (!BitmaskCodec.isSingleBit(protocolBitflag) || protocolBitflag > 0xFFFF) {
            throw new IllegalArgumentException("protocolBitflag must be a single u16 bit, got 0b"
                    + Integer.toBinaryString(protocolBitflag));
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProtocolPolicyEntry other)) return false;
        return protocolBitflag == other.protocolBitflag && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * protocolBitflag + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ProtocolPolicyEntry[protocolBitflag=0b" + Integer.toBinaryString(protocolBitflag)
                + ", data=" + HexFormat.of().formatHex(data) + "]";
    }
}
