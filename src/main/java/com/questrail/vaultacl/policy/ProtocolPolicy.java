package com.questrail.vaultacl.policy;

import com.questrail.vaultacl.api.Principal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * ProtocolPolicy
 * -----------------------------------------------------------------------------
 * A decoded protocol policy payload: the allowlists and scalar parameters a
 * {@link PolicySchema} declares, held by field name.
 *
 * <p>Scalars are independent of allowlist membership; changing one never
 * touches the other. Like {@link AllowlistPolicy}, this value is edited in
 * place; {@link #copy()} gives an independent instance.</p>
 */
public final class ProtocolPolicy
{
    private final PolicySchema schema;
    private final Map<String, AllowlistPolicy<?>> allowlists;
    private final Map<String, Long> scalars;

    ProtocolPolicy(PolicySchema schema,
                   Map<String, AllowlistPolicy<?>> allowlists,
                   Map<String, Long> scalars) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.allowlists = new LinkedHashMap<>(allowlists);
        this.scalars = new LinkedHashMap<>(scalars);
    }

    public PolicySchema schema() {
        return schema;
    }

    /**
     * Returns the named allowlist.
     *
     * @throws IllegalArgumentException if the schema declares no such allowlist
     */
    public AllowlistPolicy<?> allowlist(String fieldName) {
        AllowlistPolicy<?> list = allowlists.get(Objects.requireNonNull(fieldName, "fieldName"));
        if (list == null) {
            throw new IllegalArgumentException(schema.name() + " has no allowlist named " + fieldName);
        }
        return list;
    }

    /**
     * @throws IllegalArgumentException if the schema declares no such scalar
     */
    public long scalar(String fieldName) {
        Long value = scalars.get(Objects.requireNonNull(fieldName, "fieldName"));
        if (value == null) {
            throw new IllegalArgumentException(schema.name() + " has no scalar named " + fieldName);
        }
        return value;
    }

    /**
     * @throws IllegalArgumentException if the field is unknown or the value does
     *         not fit its width
     */
    public void setScalar(String fieldName, long value) {
        ScalarField field = schema.scalar(fieldName).orElseThrow(() ->
                new IllegalArgumentException(schema.name() + " has no scalar named " + fieldName));
        scalars.put(fieldName, field.checked(value));
    }

    /**
     * Returns whether {@code principal} passes the named allowlist, using the
     * schema's declared meaning for an empty list.
     */
    public boolean permits(String fieldName, Principal principal) {
        AllowlistField<?> field = schema.allowlist(fieldName).orElseThrow(() ->
                new IllegalArgumentException(schema.name() + " has no allowlist named " + fieldName));
        return allowlist(fieldName).permits(principal, field.whenEmpty());
    }

    public byte[] encode() {
        return schema.encode(this);
    }

    public ProtocolPolicy copy() {
        Map<String, AllowlistPolicy<?>> lists = new LinkedHashMap<>();
        allowlists.forEach((k, v) -> lists.put(k, v.copy()));
        return new ProtocolPolicy(schema, lists, scalars);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProtocolPolicy other)) return false;
        return schema == other.schema
                && allowlists.equals(other.allowlists)
                && scalars.equals(other.scalars);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema.name(), allowlists, scalars);
    }

    @Override
    public String toString() {
        String lists = allowlists.values().stream()
                .map(AllowlistPolicy::toString)
                .collect(Collectors.joining(", "));
        String values = scalars.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        if (values.isEmpty()) {
            return schema.name() + "{" + lists + "}";
        }
        return schema.name() + "{" + lists + ", " + values + "}";
    }
}
