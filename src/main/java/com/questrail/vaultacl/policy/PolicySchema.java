package com.questrail.vaultacl.policy;

import com.questrail.vaultacl.api.PolicyDecodeException;
import com.questrail.vaultacl.api.Principal;
import com.questrail.vaultacl.codec.PolicyBuffer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PolicySchema
 * -----------------------------------------------------------------------------
 * Describes the payload of one protocol's policy: which allowlists it holds,
 * in what order, and which scalar fields follow them.
 *
 * <h2>Layout</h2>
 * <pre>
 *   [allowlist 0: u32 length + records]
 *   [allowlist 1: u32 length + records]
 *   ...
 *   [scalar 0][scalar 1]...            fixed widths, little-endian
 * </pre>
 *
 * A schema is static configuration. One schema instance is shared by every
 * read and write of that protocol's policy, so encode and decode always agree.
 */
public final class PolicySchema
{
    private final String name;
    private final List<AllowlistField<?>> allowlists;
    private final List<ScalarField> scalars;

    private PolicySchema(String name, List<AllowlistField<?>> allowlists, List<ScalarField> scalars) {
        this.name = name;
        this.allowlists = List.copyOf(allowlists);
        this.scalars = List.copyOf(scalars);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Policy type name, e.g. {@code "DriftProtocolPolicy"}. */
    public String name() {
        return name;
    }

    public List<AllowlistField<?>> allowlists() {
        return allowlists;
    }

    public List<ScalarField> scalars() {
        return scalars;
    }

    public Optional<AllowlistField<?>> allowlist(String fieldName) {
        Objects.requireNonNull(fieldName, "fieldName");
        return allowlists.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public Optional<ScalarField> scalar(String fieldName) {
        Objects.requireNonNull(fieldName, "fieldName");
        return scalars.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    /**
     * Smallest valid encoding: every allowlist empty plus all scalars.
     */
    public int minimumLength() {
        int len = 4 * allowlists.size();
        for (ScalarField s : scalars) {
            len += s.type().size();
        }
        return len;
    }

    /**
     * Returns a fresh policy with empty allowlists and default scalars, as used
     * when a protocol has never had a policy set.
     */
    public ProtocolPolicy newPolicy() {
        Map<String, AllowlistPolicy<?>> lists = new LinkedHashMap<>();
        for (AllowlistField<?> f : allowlists) {
            lists.put(f.name(), f.empty());
        }
        Map<String, Long> values = new LinkedHashMap<>();
        for (ScalarField s : scalars) {
            values.put(s.name(), s.defaultValue());
        }
        return new ProtocolPolicy(this, lists, values);
    }

    // ---------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------

    byte[] encode(ProtocolPolicy policy) {
        PolicyBuffer.Writer out = PolicyBuffer.writer();
        for (AllowlistField<?> f : allowlists) {
            policy.allowlist(f.name()).encodeTo(out);
        }
        for (ScalarField s : scalars) {
            long value = policy.scalar(s.name());
            switch (s.type()) {
                case U16 -> out.u16((int) value);
                case U32 -> out.u32(value);
                case U64 -> out.u64(value);
            }
        }
        return out.toByteArray();
    }

    /**
     * Decodes a complete policy payload.
     *
     * @throws PolicyDecodeException if the buffer is shorter than the schema's
     *         minimum, shorter than a declared list length requires, or longer
     *         than the schema describes
     */
    public ProtocolPolicy decode(byte[] data) {
        Objects.requireNonNull(data, "data");
        if (data.length < minimumLength()) {
            throw new PolicyDecodeException(name + " payload is " + data.length
                    + " bytes, minimum is " + minimumLength());
        }

        PolicyBuffer.Reader in = PolicyBuffer.reader(data);
        Map<String, AllowlistPolicy<?>> lists = new LinkedHashMap<>();
        for (AllowlistField<?> f : allowlists) {
            lists.put(f.name(), decodeList(f, in));
        }
        Map<String, Long> values = new LinkedHashMap<>();
        for (ScalarField s : scalars) {
            long value = switch (s.type()) {
                case U16 -> in.u16(s.name());
                case U32 -> in.u32(s.name());
                case U64 -> in.u64(s.name());
            };
            values.put(s.name(), value);
        }
        in.expectEnd(name);
        return new ProtocolPolicy(this, lists, values);
    }

    private static <T extends Principal> AllowlistPolicy<T> decodeList(AllowlistField<T> f, PolicyBuffer.Reader in) {
        return AllowlistPolicy.decodeFrom(f.name(), f.codec(), in);
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Builder for {@link PolicySchema}. Field order is declaration order.
     */
    public static final class Builder
    {
        private final String name;
        private final List<AllowlistField<?>> allowlists = new ArrayList<>();
        private final List<ScalarField> scalars = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public <T extends Principal> Builder allowlist(String fieldName,
                                                       PrincipalCodec<T> codec,
                                                       EmptyAllowlist whenEmpty) {
            requireUnique(fieldName);
            allowlists.add(new AllowlistField<>(fieldName, codec, whenEmpty));
            return this;
        }

        public Builder scalar(String fieldName, ScalarField.Type type, long defaultValue) {
            requireUnique(fieldName);
            scalars.add(new ScalarField(fieldName, type, defaultValue));
            return this;
        }

        private void requireUnique(String fieldName) {
            Objects.requireNonNull(fieldName, "fieldName");
            boolean taken = allowlists.stream().anyMatch(f -> f.name().equals(fieldName))
                    || scalars.stream().anyMatch(f -> f.name().equals(fieldName));
            if (taken) {
                throw new IllegalArgumentException("Duplicate field in " + name + ": " + fieldName);
            }
        }

        public PolicySchema build() {
            if (allowlists.isEmpty() && scalars.isEmpty()) {
                throw new IllegalStateException("Schema " + name + " declares no fields");
            }
            return new PolicySchema(name, allowlists, scalars);
        }
    }
}
