package com.questrail.vaultacl.registry;

import com.questrail.vaultacl.api.PublicKey;
import com.questrail.vaultacl.api.UnknownPermissionException;
import com.questrail.vaultacl.api.UnknownProtocolException;
import com.questrail.vaultacl.codec.BitmaskCodec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ProtocolPolicyRegistry
 * -----------------------------------------------------------------------------
 * Static table of integration programs, their protocols, permission names and
 * policy schemas.
 *
 * <h2>Role in the architecture</h2>
 * Every read path (rendering bitmasks as names, decoding policies) and every
 * write path (parsing user-supplied protocol and permission names, encoding
 * policies) goes through one registry instance. That is what keeps the
 * bit-to-name mapping identical in both directions.
 *
 * <h2>Lookup rules</h2>
 * <ul>
 *   <li>{@link #resolve} is by (integration program, bitflag) and is exact.</li>
 *   <li>{@link #resolveByName} ignores case; protocol names are unique across
 *       the whole registry regardless of case.</li>
 *   <li>Failures raise {@link UnknownProtocolException} or
 *       {@link UnknownPermissionException}. Nothing is coerced to a default.</li>
 * </ul>
 *
 * Instances are immutable and safe to share.
 */
public final class ProtocolPolicyRegistry
{
    private final Map<PublicKey, IntegrationDescriptor> byProgram;
    private final Map<String, ProtocolRef> byFoldedName;

    private ProtocolPolicyRegistry(Map<PublicKey, IntegrationDescriptor> byProgram,
                                   Map<String, ProtocolRef> byFoldedName) {
        this.byProgram = Collections.unmodifiableMap(byProgram);
        this.byFoldedName = Collections.unmodifiableMap(byFoldedName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<IntegrationDescriptor> integrations() {
        return byProgram.values();
    }

    public Optional<IntegrationDescriptor> integration(PublicKey program) {
        return Optional.ofNullable(byProgram.get(Objects.requireNonNull(program, "program")));
    }

    /**
     * @throws UnknownProtocolException if the pair is not registered
     */
    public ProtocolDescriptor resolve(PublicKey integrationProgram, int protocolBitflag) {
        return tryResolve(integrationProgram, protocolBitflag)
                .orElseThrow(() -> new UnknownProtocolException(integrationProgram, protocolBitflag));
    }

    public Optional<ProtocolDescriptor> tryResolve(PublicKey integrationProgram, int protocolBitflag) {
        return integration(integrationProgram).flatMap(i -> i.protocol(protocolBitflag));
    }

    /**
     * Reverse lookup used when parsing user input.
     *
     * @throws UnknownProtocolException if no protocol has this name
     */
    public ProtocolRef resolveByName(String protocolName) {
        Objects.requireNonNull(protocolName, "protocolName");
        ProtocolRef ref = byFoldedName.get(fold(protocolName));
        if (ref == null) {
            throw new UnknownProtocolException(protocolName);
        }
        return ref;
    }

    /**
     * Names of the protocols enabled in {@code protocolsBitmask}. Bits the
     * integration does not declare render as their numeric value.
     */
    public List<String> protocolNames(PublicKey integrationProgram, long protocolsBitmask) {
        Optional<IntegrationDescriptor> integration = integration(integrationProgram);
        return BitmaskCodec.names(protocolsBitmask, ordinal -> ordinal >= BitmaskCodec.Width.U16.bits()
                ? null
                : integration
                        .flatMap(i -> i.protocol(1 << ordinal))
                        .map(ProtocolDescriptor::name)
                        .orElse(null));
    }

    /**
     * Names of the permissions set in {@code permissionsBitmask} for one
     * protocol. Bits the protocol does not declare render as their numeric
     * value.
     */
    public List<String> permissionNames(PublicKey integrationProgram, int protocolBitflag, long permissionsBitmask) {
        Optional<ProtocolDescriptor> protocol = tryResolve(integrationProgram, protocolBitflag);
        return BitmaskCodec.names(permissionsBitmask, ordinal -> protocol
                .map(p -> p.permissionNameAt(ordinal))
                .orElse(null));
    }

    /**
     * Display name of one protocol, falling back to its bitflag value.
     */
    public String protocolName(PublicKey integrationProgram, int protocolBitflag) {
        return tryResolve(integrationProgram, protocolBitflag)
                .map(ProtocolDescriptor::name)
                .orElse(Integer.toString(protocolBitflag));
    }

    /**
     * Validates protocol and permission names and folds the permissions into a
     * bitmask. Nothing is returned unless every name resolves.
     *
     * @throws UnknownProtocolException   if the protocol name is unknown
     * @throws UnknownPermissionException if any permission name is unknown
     * @throws IllegalArgumentException   if no permission names are given
     */
    public PermissionSelection selectPermissions(String protocolName, Collection<String> permissionNames) {
        Objects.requireNonNull(permissionNames, "permissionNames");
        ProtocolRef ref = resolveByName(protocolName);
        if (permissionNames.isEmpty()) {
            throw new IllegalArgumentException("At least one permission is required for " + ref.name());
        }

        long mask = 0;
        List<String> canonical = new ArrayList<>(permissionNames.size());
        for (String input : permissionNames) {
            String name = ref.descriptor().permissions().tryResolve(input).orElseThrow(() ->
                    new UnknownPermissionException(ref.name(), input, ref.descriptor().permissions().allNames()));
            int ordinal = ref.descriptor().permissions().indexOf(name);
            mask |= BitmaskCodec.bit(ordinal, BitmaskCodec.Width.U64);
            if (!canonical.contains(name)) {
                canonical.add(name);
            }
        }
        return new PermissionSelection(ref, mask, canonical);
    }

    private static String fold(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Builder for {@link ProtocolPolicyRegistry}.
     */
    public static final class Builder
    {
        private final Map<PublicKey, IntegrationDescriptor> byProgram = new LinkedHashMap<>();
        private final Map<String, ProtocolRef> byFoldedName = new LinkedHashMap<>();

        private Builder() {}

        public Builder integration(IntegrationDescriptor integration) {
            Objects.requireNonNull(integration, "integration");
            if (byProgram.putIfAbsent(integration.program(), integration) != null) {
                throw new IllegalArgumentException("Integration program registered twice: " + integration.program());
            }
            for (ProtocolDescriptor p : integration.protocols()) {
                ProtocolRef prev = byFoldedName.putIfAbsent(fold(p.name()),
                        new ProtocolRef(integration.program(), p));
                if (prev != null) {
                    throw new IllegalArgumentException("Protocol name registered twice: " + p.name());
                }
            }
            return this;
        }

        public ProtocolPolicyRegistry build() {
            return new ProtocolPolicyRegistry(new LinkedHashMap<>(byProgram), new LinkedHashMap<>(byFoldedName));
        }
    }
}
