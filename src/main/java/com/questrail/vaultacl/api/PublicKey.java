package com.questrail.vaultacl.api;

import org.bitcoinj.core.Base58;

import java.util.Arrays;
import java.util.Objects;

/**
 * PublicKey
 * -----------------------------------------------------------------------------
 * An opaque 32-byte key identifying a program, a delegate, a mint, a market
 * or any other ledger account.
 *
 * <p>Instances are immutable. The canonical text form is Base58.</p>
 */
public final class PublicKey implements Principal, Comparable<PublicKey>
{
    /** Size of a key in bytes. */
    public static final int LENGTH = 32;

    private final byte[] bytes;

    private PublicKey(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a key from exactly {@value #LENGTH} bytes. The array is copied.
     *
     * @throws IllegalArgumentException if the array has the wrong length
     */
    public static PublicKey of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    "PublicKey must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new PublicKey(bytes.clone());
    }

    /**
     * Parses the Base58 text form of a key.
     *
     * @throws IllegalArgumentException if the text is not valid Base58 or does
     *         not decode to {@value #LENGTH} bytes
     */
    public static PublicKey fromBase58(String text) {
        Objects.requireNonNull(text, "text");
        return of(Base58.decode(text.trim()));
    }

    /**
     * Returns a copy of the raw key bytes.
     */
    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toBase58() {
        return Base58.encode(bytes);
    }

    @Override
    public String display() {
        return toBase58();
    }

    /**
     * Shortened form used in diff listings, e.g. {@code "9xQeWvG8..."}.
     */
    public String abbreviated() {
        String text = toBase58();
        return text.length() <= 8 ? text : text.substring(0, 8) + "...";
    }

    @Override
    public int compareTo(PublicKey other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PublicKey other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
