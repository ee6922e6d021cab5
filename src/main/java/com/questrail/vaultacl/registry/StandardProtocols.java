package com.questrail.vaultacl.registry;

import com.questrail.vaultacl.config.IntegrationPrograms;
import com.questrail.vaultacl.mapping.ArrayPermissionIndex;
import com.questrail.vaultacl.policy.EmptyAllowlist;
import com.questrail.vaultacl.policy.PolicySchema;
import com.questrail.vaultacl.policy.PrincipalCodecs;
import com.questrail.vaultacl.policy.ScalarField;

import java.util.List;
import java.util.Objects;

/**
 * StandardProtocols
 * -----------------------------------------------------------------------------
 * The integrations, protocols, permission names and policy schemas a vault
 * can be configured with.
 *
 * <h2>Table</h2>
 * <pre>
 * Integration   Protocol        Bit    Policy
 * GlamProtocol  SystemProgram   0b001  -
 *               StakeProgram    0b010  -
 *               JupiterSwap     0b100  JupiterSwapPolicy   (empty = all tokens)
 * ExtSpl        SplToken        0b01   TransferPolicy      (empty = deny all)
 * ExtDrift      DriftProtocol   0b01   DriftProtocolPolicy (empty = all markets)
 *               DriftVaults     0b10   DriftVaultsPolicy
 * ExtKamino     KaminoLend      0b001  KaminoLendingPolicy
 *               KaminoVaults    0b010  KaminoVaultsPolicy
 *               KaminoFarms     0b100  -
 * ExtCctp       Cctp            0b01   CctpPolicy          (empty = deny all)
 * </pre>
 *
 * Permission names are listed in bit order; changing the order changes the
 * meaning of every stored bitmask.
 */
public final class StandardProtocols
{
    // Integration names
    public static final String GLAM_PROTOCOL = "GlamProtocol";
    public static final String EXT_SPL = "ExtSpl";
    public static final String EXT_DRIFT = "ExtDrift";
    public static final String EXT_KAMINO = "ExtKamino";
    public static final String EXT_CCTP = "ExtCctp";

    // Protocol names
    public static final String SYSTEM_PROGRAM = "SystemProgram";
    public static final String STAKE_PROGRAM = "StakeProgram";
    public static final String JUPITER_SWAP = "JupiterSwap";
    public static final String SPL_TOKEN = "SplToken";
    public static final String DRIFT_PROTOCOL = "DriftProtocol";
    public static final String DRIFT_VAULTS = "DriftVaults";
    public static final String KAMINO_LEND = "KaminoLend";
    public static final String KAMINO_VAULTS = "KaminoVaults";
    public static final String KAMINO_FARMS = "KaminoFarms";
    public static final String CCTP = "Cctp";

    /** Default maximum slippage applied when a swap policy is first created. */
    public static final long DEFAULT_MAX_SLIPPAGE_BPS = 50;

    public static final PolicySchema JUPITER_SWAP_POLICY = PolicySchema.builder("JupiterSwapPolicy")
            .allowlist("swapAllowlist", PrincipalCodecs.PUBLIC_KEY, EmptyAllowlist.ALLOW_ALL)
            .scalar("maxSlippageBps", ScalarField.Type.U16, DEFAULT_MAX_SLIPPAGE_BPS)
            .build();

    public static final PolicySchema TRANSFER_POLICY = PolicySchema.builder("TransferPolicy")
            .allowlist("allowlist", PrincipalCodecs.PUBLIC_KEY, EmptyAllowlist.DENY_ALL)
            .build();

    public static final PolicySchema DRIFT_PROTOCOL_POLICY = PolicySchema.builder("DriftProtocolPolicy")
            .allowlist("spotMarketsAllowlist", PrincipalCodecs.MARKET_INDEX, EmptyAllowlist.ALLOW_ALL)
            .allowlist("perpMarketsAllowlist", PrincipalCodecs.MARKET_INDEX, EmptyAllowlist.ALLOW_ALL)
            .allowlist("borrowAllowlist", PrincipalCodecs.PUBLIC_KEY, EmptyAllowlist.ALLOW_ALL)
            .build();

    public static final PolicySchema DRIFT_VAULTS_POLICY = PolicySchema.builder("DriftVaultsPolicy")
            .allowlist("vaultsAllowlist", PrincipalCodecs.PUBLIC_KEY, EmptyAllowlist.ALLOW_ALL)
            .build();

    public static final PolicySchema KAMINO_LENDING_POLICY = PolicySchema.builder("KaminoLendingPolicy")
            .allowlist("marketsAllowlist", PrincipalCodecs.PUBLIC_KEY, EmptyAllowlist.ALLOW_ALL)
            .allowlist("borrowAllowlist", PrincipalCodecs.PUBLIC_KEY, EmptyAllowlist.ALLOW_ALL)
            .build();

    public static final PolicySchema KAMINO_VAULTS_POLICY = PolicySchema.builder("KaminoVaultsPolicy")
            .allowlist("vaultsAllowlist", PrincipalCodecs.PUBLIC_KEY, EmptyAllowlist.ALLOW_ALL)
            .build();

    public static final PolicySchema CCTP_POLICY = PolicySchema.builder("CctpPolicy")
            .allowlist("destinations", PrincipalCodecs.DOMAIN_ADDRESS, EmptyAllowlist.DENY_ALL)
            .build();

    private StandardProtocols() {}

    /**
     * Builds the registry for the given deployment.
     */
    public static ProtocolPolicyRegistry registry(IntegrationPrograms programs) {
        Objects.requireNonNull(programs, "programs");
        return ProtocolPolicyRegistry.builder()
                .integration(new IntegrationDescriptor(GLAM_PROTOCOL, programs.glamProtocol(), List.of(
                        ProtocolDescriptor.of(SYSTEM_PROGRAM, 0b001,
                                new ArrayPermissionIndex("Transfer")),
                        ProtocolDescriptor.of(STAKE_PROGRAM, 0b010,
                                new ArrayPermissionIndex("Stake", "Unstake")),
                        ProtocolDescriptor.of(JUPITER_SWAP, 0b100,
                                new ArrayPermissionIndex("SwapAny", "SwapLst", "SwapAllowlisted"),
                                JUPITER_SWAP_POLICY))))
                .integration(new IntegrationDescriptor(EXT_SPL, programs.extSpl(), List.of(
                        ProtocolDescriptor.of(SPL_TOKEN, 0b01,
                                new ArrayPermissionIndex("Transfer"),
                                TRANSFER_POLICY))))
                .integration(new IntegrationDescriptor(EXT_DRIFT, programs.extDrift(), List.of(
                        ProtocolDescriptor.of(DRIFT_PROTOCOL, 0b01,
                                new ArrayPermissionIndex(
                                        "InitUser", "UpdateUser", "DeleteUser",
                                        "Deposit", "Withdraw", "Borrow",
                                        "CreateModifyOrders", "CancelOrders",
                                        "PerpMarkets", "SpotMarkets"),
                                DRIFT_PROTOCOL_POLICY),
                        ProtocolDescriptor.of(DRIFT_VAULTS, 0b10,
                                new ArrayPermissionIndex("Deposit", "Withdraw"),
                                DRIFT_VAULTS_POLICY))))
                .integration(new IntegrationDescriptor(EXT_KAMINO, programs.extKamino(), List.of(
                        ProtocolDescriptor.of(KAMINO_LEND, 0b001,
                                new ArrayPermissionIndex("Init", "Deposit", "Withdraw", "Borrow", "Repay"),
                                KAMINO_LENDING_POLICY),
                        ProtocolDescriptor.of(KAMINO_VAULTS, 0b010,
                                new ArrayPermissionIndex("Deposit", "Withdraw"),
                                KAMINO_VAULTS_POLICY),
                        ProtocolDescriptor.of(KAMINO_FARMS, 0b100,
                                new ArrayPermissionIndex("Stake", "Unstake", "HarvestReward")))))
                .integration(new IntegrationDescriptor(EXT_CCTP, programs.extCctp(), List.of(
                        ProtocolDescriptor.of(CCTP, 0b01,
                                new ArrayPermissionIndex("Transfer"),
                                CCTP_POLICY))))
                .build();
    }
}
