package com.questrail.vaultacl.timelock;

import java.util.Locale;
import java.util.Objects;

/**
 * StateField
 * -----------------------------------------------------------------------------
 * The vault fields whose changes go through the timelock. Values of each
 * field are carried by the matching {@link FieldValue} record.
 */
public enum StateField
{
    INTEGRATION_ACLS("integrationAcls"),
    DELEGATE_ACLS("delegateAcls"),
    ASSETS("assets"),
    BORROWABLE("borrowable"),
    TIMELOCK_DURATION("timelockDuration");

    private final String wireName;

    StateField(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Looks a field up by wire name, ignoring case.
     *
     * @throws IllegalArgumentException if no field has that name
     */
    public static StateField fromWireName(String name) {
        Objects.requireNonNull(name, "name");
        String folded = name.trim().toLowerCase(Locale.ROOT);
        for (StateField f : values()) {
            if (f.wireName.toLowerCase(Locale.ROOT).equals(folded)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown state field: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
