/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.domain;

import build.acta.sdk.api.TransactionRequestDto;

/**
 * A user level operation that ends as one ledger transaction.
 * Intents are built per call with already normalized values and a resolved contract id.
 */
public interface TransactionIntent {

    /**
     * @return backend endpoint preparing and submitting this intent
     */
    TxEndpoint endpoint();

    String contractId();

    /**
     * @return body of the prepare-mode request for this intent
     */
    TransactionRequestDto toPrepareRequest();
}
