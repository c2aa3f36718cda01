/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service.ledger;

import build.acta.sdk.api.ledger.GetTransactionResultDto;
import build.acta.sdk.api.ledger.JsonRpcRequestDto;
import build.acta.sdk.api.ledger.JsonRpcResponseDto;
import build.acta.sdk.api.ledger.SendTransactionResultDto;
import build.acta.sdk.common.exception.LedgerQueryException;
import build.acta.sdk.domain.LedgerTransactionStatus;
import build.acta.sdk.domain.SignedEnvelope;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link LedgerGateway} talking JSON-RPC 2.0 to a Soroban RPC node.
 */
@Slf4j
public class SorobanRpcLedgerGateway implements LedgerGateway {

    private static final ParameterizedTypeReference<JsonRpcResponseDto<SendTransactionResultDto>> SEND_RESPONSE =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<JsonRpcResponseDto<GetTransactionResultDto>> GET_RESPONSE =
            new ParameterizedTypeReference<>() {
            };

    @Getter
    private final String rpcUrl;
    private final URI rpcUri;
    private final RestClient restClient;
    private final AtomicLong requestIds = new AtomicLong();

    public SorobanRpcLedgerGateway(RestClient.Builder restClientBuilder, String rpcUrl) {
        this.rpcUrl = rpcUrl;
        this.rpcUri = URI.create(rpcUrl);
        this.restClient = restClientBuilder.clone().build();
    }

    @Override
    public LedgerSubmission sendTransaction(SignedEnvelope signedEnvelope) {
        var result = call("sendTransaction", Map.of("transaction", signedEnvelope.envelope()), SEND_RESPONSE);
        var status = LedgerTransactionStatus.fromValue(result.status());
        log.debug("sendTransaction answered {} for {}", status, result.hash());
        return new LedgerSubmission(status, result.hash(), result.errorResultXdr());
    }

    @Override
    public LedgerTransactionStatus getTransactionStatus(String transactionHash) {
        var result = call("getTransaction", Map.of("hash", transactionHash), GET_RESPONSE);
        return LedgerTransactionStatus.fromValue(result.status());
    }

    private <T> T call(String method, Map<String, Object> params,
                       ParameterizedTypeReference<JsonRpcResponseDto<T>> responseType) {
        var request = JsonRpcRequestDto.of(requestIds.incrementAndGet(), method, params);
        log.debug("Calling {} on {}", method, rpcUrl);
        JsonRpcResponseDto<T> response;
        try {
            response = restClient.post()
                    .uri(rpcUri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw new LedgerQueryException("RPC node %s responded with %s to %s"
                                .formatted(rpcUrl, res.getStatusCode(), method));
                    })
                    .body(responseType);
        } catch (RestClientException e) {
            throw new LedgerQueryException("RPC node %s could not be reached for %s".formatted(rpcUrl, method), e);
        }
        if (response == null) {
            throw new LedgerQueryException("RPC node %s returned an empty answer to %s".formatted(rpcUrl, method));
        }
        if (response.error() != null) {
            throw new LedgerQueryException("RPC node %s rejected %s: %d %s"
                    .formatted(rpcUrl, method, response.error().code(), response.error().message()));
        }
        if (response.result() == null) {
            throw new LedgerQueryException("RPC node %s returned no result for %s".formatted(rpcUrl, method));
        }
        return response.result();
    }
}
