package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.acl.DelegateAcl;
import com.questrail.vaultacl.acl.IntegrationAcl;
import com.questrail.vaultacl.api.PublicKey;

import java.util.List;
import java.util.Objects;

/**
 * VaultState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of everything the access-control engine reads from the
 * ledger: the live field values, the timelock, and a revision counter.
 *
 * <h2>Role in the architecture</h2>
 * {@link TimelockEngine} takes a {@code VaultState} and a {@link Mutation} and
 * produces the next {@code VaultState}. Nothing holds a "current vault" in a
 * global; the snapshot is always passed explicitly.
 *
 * <h2>Revision</h2>
 * {@link #revision()} increases by one on every accepted mutation. A mutation
 * built against revision {@code r} is only valid while the ledger is still at
 * {@code r}; this is how concurrent changes are detected.
 */
public final class VaultState
{
    private final FieldValue.IntegrationAcls integrationAcls;
    private final FieldValue.DelegateAcls delegateAcls;
    private final FieldValue.Assets assets;
    private final FieldValue.Borrowable borrowable;
    private final TimelockState timelock;
    private final long revision;

    private VaultState(FieldValue.IntegrationAcls integrationAcls,
                       FieldValue.DelegateAcls delegateAcls,
                       FieldValue.Assets assets,
                       FieldValue.Borrowable borrowable,
                       TimelockState timelock,
                       long revision) {
        this.integrationAcls = integrationAcls;
        this.delegateAcls = delegateAcls;
        this.assets = assets;
        this.borrowable = borrowable;
        this.timelock = Objects.requireNonNull(timelock, "timelock");
        this.revision = revision;
    }

    /**
     * A vault with nothing enabled, no delegates and no timelock.
     */
    public static VaultState empty() {
        return of(List.of(), List.of(), List.of(), List.of(), TimelockState.idle(0), 0);
    }

    /**
     * @throws IllegalArgumentException if a list names an element twice
     */
    public static VaultState of(List<IntegrationAcl> integrationAcls,
                                List<DelegateAcl> delegateAcls,
                                List<PublicKey> assets,
                                List<PublicKey> borrowable,
                                TimelockState timelock,
                                long revision) {
        return new VaultState(
                new FieldValue.IntegrationAcls(integrationAcls),
                new FieldValue.DelegateAcls(delegateAcls),
                new FieldValue.Assets(assets),
                new FieldValue.Borrowable(borrowable),
                timelock,
                revision);
    }

    // ---------------------------------------------------------------------
    // Live values
    // ---------------------------------------------------------------------

    public List<IntegrationAcl> integrationAcls() {
        return integrationAcls.acls();
    }

    public List<DelegateAcl> delegateAcls() {
        return delegateAcls.acls();
    }

    public List<PublicKey> assets() {
        return assets.keys();
    }

    public List<PublicKey> borrowable() {
        return borrowable.keys();
    }

    public long timelockDuration() {
        return timelock.duration();
    }

    /**
     * Live value of {@code field}.
     */
    public FieldValue value(StateField field) {
        Objects.requireNonNull(field, "field");
        return switch (field) {
            case INTEGRATION_ACLS -> integrationAcls;
            case DELEGATE_ACLS -> delegateAcls;
            case ASSETS -> assets;
            case BORROWABLE -> borrowable;
            case TIMELOCK_DURATION -> new FieldValue.TimelockDuration(timelock.duration());
        };
    }

    /**
     * The value {@code field} will have once pending updates are applied:
     * the staged value if there is one, otherwise the live value.
     */
    public FieldValue proposedValue(StateField field) {
        return timelock.pending(field).orElseGet(() -> value(field));
    }

    public List<IntegrationAcl> proposedIntegrationAcls() {
        FieldValue v = proposedValue(StateField.INTEGRATION_ACLS);
        return v instanceof FieldValue.IntegrationAcls p ? p.acls() : integrationAcls();
    }

    public List<DelegateAcl> proposedDelegateAcls() {
        FieldValue v = proposedValue(StateField.DELEGATE_ACLS);
        return v instanceof FieldValue.DelegateAcls p ? p.acls() : delegateAcls();
    }

    public List<PublicKey> proposedAssets() {
        FieldValue v = proposedValue(StateField.ASSETS);
        return v instanceof FieldValue.Assets p ? p.keys() : assets();
    }

    public List<PublicKey> proposedBorrowable() {
        FieldValue v = proposedValue(StateField.BORROWABLE);
        return v instanceof FieldValue.Borrowable p ? p.keys() : borrowable();
    }

    public long proposedTimelockDuration() {
        FieldValue v = proposedValue(StateField.TIMELOCK_DURATION);
        return v instanceof FieldValue.TimelockDuration p ? p.seconds() : timelockDuration();
    }

    // ---------------------------------------------------------------------
    // Timelock
    // ---------------------------------------------------------------------

    public TimelockState timelock() {
        return timelock;
    }

    public long revision() {
        return revision;
    }

    // ---------------------------------------------------------------------
    // Derivation (used by TimelockEngine)
    // ---------------------------------------------------------------------

    /**
     * Returns a new state with one live field replaced.
     */
    public VaultState withValue(FieldValue value) {
        return Objects.requireNonNull(value, "value").applyTo(this);
    }

    public VaultState withIntegrationAcls(List<IntegrationAcl> acls) {
        return new VaultState(new FieldValue.IntegrationAcls(acls), delegateAcls, assets, borrowable, timelock, revision);
    }

    public VaultState withDelegateAcls(List<DelegateAcl> acls) {
        return new VaultState(integrationAcls, new FieldValue.DelegateAcls(acls), assets, borrowable, timelock, revision);
    }

    public VaultState withAssets(List<PublicKey> keys) {
        return new VaultState(integrationAcls, delegateAcls, new FieldValue.Assets(keys), borrowable, timelock, revision);
    }

    public VaultState withBorrowable(List<PublicKey> keys) {
        return new VaultState(integrationAcls, delegateAcls, assets, new FieldValue.Borrowable(keys), timelock, revision);
    }

    public VaultState withTimelockDuration(long seconds) {
        long checked = new FieldValue.TimelockDuration(seconds).seconds();
        return withTimelock(timelock.withDuration(checked));
    }

    public VaultState withTimelock(TimelockState newTimelock) {
        return new VaultState(integrationAcls, delegateAcls, assets, borrowable, newTimelock, revision);
    }

    public VaultState withRevision(long newRevision) {
        return new VaultState(integrationAcls, delegateAcls, assets, borrowable, timelock, newRevision);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VaultState other)) return false;
        return revision == other.revision
                && integrationAcls.equals(other.integrationAcls)
                && delegateAcls.equals(other.delegateAcls)
                && assets.equals(other.assets)
                && borrowable.equals(other.borrowable)
                && timelock.equals(other.timelock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(integrationAcls, delegateAcls, assets, borrowable, timelock, revision);
    }

    @Override
    public String toString() {
        return "VaultState[revision=" + revision
                + ", integrationAcls=" + integrationAcls()
                + ", delegateAcls=" + delegateAcls()
                + ", assets=" + assets()
                + ", borrowable=" + borrowable()
                + ", timelock=" + timelock + "]";
    }
}
