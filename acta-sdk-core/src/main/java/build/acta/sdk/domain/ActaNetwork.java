/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import lombok.Getter;

/**
 * Ledger network a client talks to, together with the public defaults of that network.
 */
@Getter
public enum ActaNetwork {
    MAINNET("mainnet",
            "CAN2LSCQQGY6K2TZYZELHVNMXHMVNJBNII4RH2VTHMMJEWOTK2IFZYJF",
            "CB7SUT2VJUEIIQR4JZKSWTH3QMDY3NJWXP532BCRRSMKLH45UPN6O5AA",
            "https://soroban.stellar.org",
            "Public Global Stellar Network ; September 2015"),
    TESTNET("testnet",
            "CDK642PLEPCQH7WUBLHYYSKRJZOUIRIPY7GXQRHOETGR2JJ76UK6SWLZ",
            "CDQ6543O3WFZ6I5BVCAO3BQCOSGQECCTLIBBTOTNCGQGCDHXBS43FKX3",
            "https://soroban-testnet.stellar.org",
            "Test SDF Network ; September 2015");

    public static final String MAINNET_BASE_URL = "https://acta.build/api/mainnet";
    public static final String TESTNET_BASE_URL = "https://acta.build/api/testnet";

    private final String value;
    private final String defaultVaultContractId;
    private final String defaultIssuanceContractId;
    private final String defaultRpcUrl;
    private final String defaultNetworkPassphrase;

    ActaNetwork(String value, String defaultVaultContractId, String defaultIssuanceContractId,
                String defaultRpcUrl, String defaultNetworkPassphrase) {
        this.value = value;
        this.defaultVaultContractId = defaultVaultContractId;
        this.defaultIssuanceContractId = defaultIssuanceContractId;
        this.defaultRpcUrl = defaultRpcUrl;
        this.defaultNetworkPassphrase = defaultNetworkPassphrase;
    }

    /**
     * Infers the network from an ACTA API base url. Anything not mentioning mainnet is treated as testnet.
     */
    public static ActaNetwork fromBaseUrl(String baseUrl) {
        return baseUrl != null && baseUrl.contains(MAINNET.value) ? MAINNET : TESTNET;
    }

    @Override
    public String toString() {
        return value;
    }
}
