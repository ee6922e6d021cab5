package com.questrail.vaultacl.policy;

import com.questrail.vaultacl.api.DomainAddress;
import com.questrail.vaultacl.api.MarketIndex;
import com.questrail.vaultacl.api.PublicKey;
import com.questrail.vaultacl.codec.PolicyBuffer;

/**
 * The principal record layouts used by the standard protocol policies.
 *
 * <pre>
 *   PUBLIC_KEY      [address: 32]
 *   DOMAIN_ADDRESS  [domain: u32 LE][address: 32]
 *   MARKET_INDEX    [index: u16 LE]
 * </pre>
 */
public final class PrincipalCodecs
{
    public static final PrincipalCodec<PublicKey> PUBLIC_KEY = new PublicKeyCodec();
    public static final PrincipalCodec<DomainAddress> DOMAIN_ADDRESS = new DomainAddressCodec();
    public static final PrincipalCodec<MarketIndex> MARKET_INDEX = new MarketIndexCodec();

    private PrincipalCodecs() {}

    private static final class PublicKeyCodec implements PrincipalCodec<PublicKey>
    {
        @Override public String kind() { return "pubkey"; }
        @Override public Class<PublicKey> type() { return PublicKey.class; }
        @Override public int recordSize() { return PublicKey.LENGTH; }

        @Override
        public void write(PolicyBuffer.Writer out, PublicKey principal) {
            out.key(principal);
        }

        @Override
        public PublicKey read(PolicyBuffer.Reader in) {
            return in.key("pubkey record");
        }
    }

    private static final class DomainAddressCodec implements PrincipalCodec<DomainAddress>
    {
        @Override public String kind() { return "domain+address"; }
        @Override public Class<DomainAddress> type() { return DomainAddress.class; }
        @Override public int recordSize() { return 4 + PublicKey.LENGTH; }

        @Override
        public void write(PolicyBuffer.Writer out, DomainAddress principal) {
            out.i32(principal.domain());
            out.key(principal.address());
        }

        @Override
        public DomainAddress read(PolicyBuffer.Reader in) {
            int domain = in.i32("destination domain");
            PublicKey address = in.key("destination address");
            return new DomainAddress(domain, address);
        }
    }

    private static final class MarketIndexCodec implements PrincipalCodec<MarketIndex>
    {
        @Override public String kind() { return "market index"; }
        @Override public Class<MarketIndex> type() { return MarketIndex.class; }
        @Override public int recordSize() { return 2; }

        @Override
        public void write(PolicyBuffer.Writer out, MarketIndex principal) {
            out.u16(principal.value());
        }

        @Override
        public MarketIndex read(PolicyBuffer.Reader in) {
            return new MarketIndex(in.u16("market index"));
        }
    }
}
