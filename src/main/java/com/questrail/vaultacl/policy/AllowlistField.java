package com.questrail.vaultacl.policy;

import com.questrail.vaultacl.api.Principal;

import java.util.Objects;

/**
 * Declares one allowlist inside a protocol policy schema.
 *
 * @param name       field name, e.g. {@code "spotMarketsAllowlist"}
 * @param codec      record layout of its principals
 * @param whenEmpty  what an empty list means for this protocol
 */
public record AllowlistField<T extends Principal>(String name,
                                                  PrincipalCodec<T> codec,
                                                  EmptyAllowlist whenEmpty)
{
    public AllowlistField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(whenEmpty, "whenEmpty");
    }

    AllowlistPolicy<T> empty() {
        return AllowlistPolicy.unrestricted(name, codec);
    }
}
