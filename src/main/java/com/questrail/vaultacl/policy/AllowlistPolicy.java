package com.questrail.vaultacl.policy;

import com.questrail.vaultacl.api.PolicyDecodeException;
import com.questrail.vaultacl.api.Principal;
import com.questrail.vaultacl.api.PrincipalAlreadyAllowedException;
import com.questrail.vaultacl.api.PrincipalNotAllowedException;
import com.questrail.vaultacl.codec.PolicyBuffer;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * AllowlistPolicy
 * -----------------------------------------------------------------------------
 * An ordered set of principals that an operation may target.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Membership is unique; duplicates are rejected on construction and
 *       on decode.</li>
 *   <li>Insertion order is preserved for display only. {@link #equals(Object)}
 *       compares membership, so {@code [A, B]} equals {@code [B, A]}.</li>
 *   <li>An empty list is the <em>unrestricted</em> sentinel. Whether that
 *       means "allow all" or "deny all" is declared per protocol
 *       ({@link EmptyAllowlist}); this class only reports
 *       {@link #isUnrestricted()}.</li>
 * </ul>
 *
 * <h2>Wire layout</h2>
 * <pre>
 *   [length: u32 LE][record 0]...[record length-1]
 * </pre>
 * Records are fixed-size, as defined by the {@link PrincipalCodec}.
 *
 * <h2>Mutability</h2>
 * Instances are mutable through {@link #add} and {@link #remove}, in the same
 * way a builder is. Use {@link #copy()} before editing a value that is shared.
 *
 * @param <T> principal type
 */
public final class AllowlistPolicy<T extends Principal>
{
    private final String name;
    private final PrincipalCodec<T> codec;
    private final LinkedHashSet<T> entries;

    private AllowlistPolicy(String name, PrincipalCodec<T> codec, LinkedHashSet<T> entries) {
        this.name = Objects.requireNonNull(name, "name");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.entries = entries;
    }

    /**
     * Creates an empty (unrestricted) allowlist.
     */
    public static <T extends Principal> AllowlistPolicy<T> unrestricted(String name, PrincipalCodec<T> codec) {
        return new AllowlistPolicy<>(name, codec, new LinkedHashSet<>());
    }

    /**
     * Creates an allowlist holding {@code principals} in the given order.
     *
     * @throws IllegalArgumentException if a principal appears twice
     */
    public static <T extends Principal> AllowlistPolicy<T> of(String name,
                                                              PrincipalCodec<T> codec,
                                                              Collection<? extends T> principals) {
        Objects.requireNonNull(principals, "principals");
        LinkedHashSet<T> set = new LinkedHashSet<>();
        for (T p : principals) {
            if (!set.add(Objects.requireNonNull(p, "principal"))) {
                throw new IllegalArgumentException("Duplicate principal in " + name + ": " + p.display());
            }
        }
        return new AllowlistPolicy<>(name, codec, set);
    }

    public String name() {
        return name;
    }

    public PrincipalCodec<T> codec() {
        return codec;
    }

    /**
     * Returns the principals in insertion order.
     */
    public List<T> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns {@code true} when the list is empty.
     */
    public boolean isUnrestricted() {
        return entries.isEmpty();
    }

    public boolean contains(Principal principal) {
        Objects.requireNonNull(principal, "principal");
        return entries.contains(principal);
    }

    /**
     * Returns whether {@code principal} may be targeted, given what an empty
     * list means for this protocol.
     */
    public boolean permits(Principal principal, EmptyAllowlist whenEmpty) {
        Objects.requireNonNull(whenEmpty, "whenEmpty");
        if (isUnrestricted()) {
            return whenEmpty == EmptyAllowlist.ALLOW_ALL;
        }
        return contains(principal);
    }

    /**
     * @throws PrincipalAlreadyAllowedException if already present
     */
    public void add(T principal) {
        Objects.requireNonNull(principal, "principal");
        if (!entries.add(principal)) {
            throw new PrincipalAlreadyAllowedException(name, principal);
        }
    }

    /**
     * @throws PrincipalNotAllowedException if not present
     */
    public void remove(T principal) {
        Objects.requireNonNull(principal, "principal");
        if (!entries.remove(principal)) {
            throw new PrincipalNotAllowedException(name, principal);
        }
    }

    /**
     * Type-checked {@link #add} for callers holding a principal of unknown
     * static type.
     *
     * @throws IllegalArgumentException if the principal is of the wrong kind
     */
    public void addPrincipal(Principal principal) {
        add(cast(principal));
    }

    /**
     * Type-checked {@link #remove} for callers holding a principal of unknown
     * static type.
     *
     * @throws IllegalArgumentException if the principal is of the wrong kind
     */
    public void removePrincipal(Principal principal) {
        remove(cast(principal));
    }

    /**
     * Empties the list, restoring the unrestricted sentinel.
     */
    public void clear() {
        entries.clear();
    }

    public AllowlistPolicy<T> copy() {
        return new AllowlistPolicy<>(name, codec, new LinkedHashSet<>(entries));
    }

    private T cast(Principal principal) {
        Objects.requireNonNull(principal, "principal");
        if (!codec.type().isInstance(principal)) {
            throw new IllegalArgumentException(
                    name + " holds " + codec.kind() + " entries, not "
                            + principal.getClass().getSimpleName());
        }
        return codec.type().cast(principal);
    }

    // ---------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------

    public byte[] encode() {
        PolicyBuffer.Writer out = PolicyBuffer.writer();
        encodeTo(out);
        return out.toByteArray();
    }

    public void encodeTo(PolicyBuffer.Writer out) {
        out.u32(entries.size());
        for (T p : entries) {
            codec.write(out, p);
        }
    }

    /**
     * Decodes a buffer that holds exactly one allowlist.
     *
     * @throws PolicyDecodeException if the buffer is short, has trailing bytes,
     *         or lists a principal twice
     */
    public static <T extends Principal> AllowlistPolicy<T> decode(String name,
                                                                  PrincipalCodec<T> codec,
                                                                  byte[] data) {
        PolicyBuffer.Reader in = PolicyBuffer.reader(data);
        AllowlistPolicy<T> policy = decodeFrom(name, codec, in);
        in.expectEnd(name);
        return policy;
    }

    /**
     * Decodes one allowlist at the reader's current position.
     */
    public static <T extends Principal> AllowlistPolicy<T> decodeFrom(String name,
                                                                      PrincipalCodec<T> codec,
                                                                      PolicyBuffer.Reader in) {
        long length = in.u32(name + " length");
        // Check the whole declared list up front so a corrupt length fails fast.
        in.require(length * codec.recordSize(), name + " (" + length + " " + codec.kind() + " records)");

        LinkedHashSet<T> set = new LinkedHashSet<>();
        for (long i = 0; i < length; i++) {
            T p = codec.read(in);
            if (!set.add(p)) {
                throw new PolicyDecodeException("Duplicate " + codec.kind() + " in " + name + ": " + p.display());
            }
        }
        return new AllowlistPolicy<>(name, codec, set);
    }

    // ---------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AllowlistPolicy<?> other)) return false;
        return name.equals(other.name)
                && codec.equals(other.codec)
                && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, entries);
    }

    @Override
    public String toString() {
        if (entries.isEmpty()) {
            return name + "=[]";
        }
        return entries.stream()
                .map(Principal::display)
                .collect(Collectors.joining(", ", name + "=[", "]"));
    }
}
