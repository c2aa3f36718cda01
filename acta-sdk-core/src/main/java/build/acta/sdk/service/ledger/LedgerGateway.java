/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service.ledger;

import build.acta.sdk.common.exception.LedgerQueryException;
import build.acta.sdk.domain.LedgerTransactionStatus;
import build.acta.sdk.domain.SignedEnvelope;

/**
 * Direct access to a ledger node, used when transactions are submitted without the ACTA API.
 */
public interface LedgerGateway {

    /**
     * Hands a signed transaction to the ledger. The answer is immediate and not final.
     *
     * @throws LedgerQueryException if the node cannot be reached or answers with an error
     */
    LedgerSubmission sendTransaction(SignedEnvelope signedEnvelope);

    /**
     * @throws LedgerQueryException if the node cannot be reached or answers with an error
     */
    LedgerTransactionStatus getTransactionStatus(String transactionHash);
}
