/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import org.apache.commons.lang3.StringUtils;

/**
 * Response of an endpoint serving both transaction modes.
 * <p>
 * The same endpoint answers a prepare request with {@code xdr} and {@code network} and a submit request
 * with {@code tx_id}. The mode of a response is only ever derived from the fields present, see {@link #kind()}.
 * </p>
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(name = "TransactionResponse")
public record TransactionResponseDto(
        @JsonProperty("xdr")
        @Schema(description = "Unsigned transaction envelope (prepare mode)")
        String envelope,
        @JsonProperty("network")
        @Schema(description = "Network passphrase the envelope has to be signed for (prepare mode)")
        String networkPassphrase,
        @JsonProperty("tx_id")
        @Schema(description = "Transaction id (submit mode)")
        String transactionId) {

    @JsonIgnore
    public TransactionResponseKind kind() {
        if (StringUtils.isNotBlank(transactionId)) {
            return TransactionResponseKind.SUBMITTED;
        }
        if (StringUtils.isNotBlank(envelope) && StringUtils.isNotBlank(networkPassphrase)) {
            return TransactionResponseKind.PREPARED;
        }
        return TransactionResponseKind.UNKNOWN;
    }

    @JsonIgnore
    public boolean isPrepareResponse() {
        return kind() == TransactionResponseKind.PREPARED;
    }

    @JsonIgnore
    public boolean isSubmitResponse() {
        return kind() == TransactionResponseKind.SUBMITTED;
    }
}
