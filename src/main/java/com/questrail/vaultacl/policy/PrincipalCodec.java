package com.questrail.vaultacl.policy;

import com.questrail.vaultacl.api.Principal;
import com.questrail.vaultacl.codec.PolicyBuffer;

/**
 * Fixed-size record layout for one kind of allowlist principal.
 *
 * <p>Every record of a given codec occupies exactly {@link #recordSize()}
 * bytes, which is what lets a decoder validate a declared list length against
 * the bytes actually present.</p>
 *
 * @param <T> principal type
 */
public interface PrincipalCodec<T extends Principal>
{
    /** Short label used in diagnostics, e.g. {@code "pubkey"}. */
    String kind();

    Class<T> type();

    int recordSize();

    void write(PolicyBuffer.Writer out, T principal);

    T read(PolicyBuffer.Reader in);
}
