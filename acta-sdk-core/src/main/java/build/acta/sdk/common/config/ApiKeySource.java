/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.common.config;

import build.acta.sdk.domain.ActaNetwork;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * One candidate location of the ACTA API key.
 */
@FunctionalInterface
public interface ApiKeySource {

    String API_KEY_VARIABLE = "ACTA_API_KEY";
    String MAINNET_API_KEY_VARIABLE = "ACTA_API_KEY_MAINNET";
    String TESTNET_API_KEY_VARIABLE = "ACTA_API_KEY_TESTNET";

    Optional<String> resolve(ActaNetwork network);

    static ApiKeySource explicit(String apiKey) {
        return network -> Optional.ofNullable(apiKey);
    }

    /**
     * Reads {@value #MAINNET_API_KEY_VARIABLE} or {@value #TESTNET_API_KEY_VARIABLE} depending on the network.
     */
    static ApiKeySource networkSpecific(UnaryOperator<String> environment) {
        return network -> Optional.ofNullable(environment.apply(variableFor(network)));
    }

    /**
     * Reads {@value #API_KEY_VARIABLE}, used for both networks.
     */
    static ApiKeySource fallback(UnaryOperator<String> environment) {
        return network -> Optional.ofNullable(environment.apply(API_KEY_VARIABLE));
    }

    static String variableFor(ActaNetwork network) {
        return network == ActaNetwork.MAINNET ? MAINNET_API_KEY_VARIABLE : TESTNET_API_KEY_VARIABLE;
    }
}
