package com.questrail.vaultacl.api;

/**
 * No protocol is registered under the given name, or for the given
 * (integration program, protocol bitflag) pair.
 */
public final class UnknownProtocolException extends VaultAclException
{
    public UnknownProtocolException(String protocolName) {
        super("Unknown protocol: \"" + protocolName + "\"");
    }

    public UnknownProtocolException(PublicKey integrationProgram, int protocolBitflag) {
        super("Unknown protocol: bitflag 0b" + Integer.toBinaryString(protocolBitflag)
                + " on integration " + integrationProgram);
    }
}
