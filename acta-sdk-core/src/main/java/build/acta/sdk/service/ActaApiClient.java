/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service;

import build.acta.sdk.api.ConfigResponseDto;
import build.acta.sdk.api.HealthResponseDto;
import build.acta.sdk.api.RevokeCredentialRequestDto;
import build.acta.sdk.api.RevokeCredentialResponseDto;
import build.acta.sdk.api.TransactionRequestDto;
import build.acta.sdk.api.TransactionResponseDto;
import build.acta.sdk.api.VaultGetVcResponseDto;
import build.acta.sdk.api.VaultListVcIdsResponseDto;
import build.acta.sdk.api.VaultQueryRequestDto;
import build.acta.sdk.api.VaultVerifyResponseDto;
import build.acta.sdk.api.VerifyStatusRequestDto;
import build.acta.sdk.api.VerifyStatusResponseDto;
import build.acta.sdk.common.config.ApiKeyResolver;
import build.acta.sdk.common.exception.ActaApiException;
import build.acta.sdk.common.exception.ConfigurationMissingException;
import build.acta.sdk.common.exception.InvalidInputException;
import build.acta.sdk.common.exception.MissingCredentialException;
import build.acta.sdk.domain.ActaNetwork;
import build.acta.sdk.domain.TxEndpoint;
import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpRequest;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * HTTP client of the ACTA API.
 * <p>
 * The network is inferred once from the base url. The API key is resolved at construction and sent as
 * {@value #API_KEY_HEADER} header on every request. The header is part of the underlying {@link RestClient}
 * defaults, so concurrent requests always observe one consistent key.
 * </p>
 * <p>
 * Endpoints serving both transaction modes accept either a prepare request or a
 * {@link build.acta.sdk.api.SignedTransactionRequestDto}. The client sends what it is given; the server picks the branch.
 * </p>
 */
@Slf4j
public class ActaApiClient {

    public static final String API_KEY_HEADER = "X-ACTA-Key";

    private final RestClient.Builder restClientBuilder;
    @Getter
    private final String baseUrl;
    @Getter
    private final ActaNetwork network;
    private final AtomicReference<ConfigResponseDto> configCache = new AtomicReference<>();
    private volatile RestClient restClient;

    /**
     * @param restClientBuilder builder used as template, it is cloned and not modified
     * @param baseUrl           ACTA API base url, e.g. {@value ActaNetwork#TESTNET_BASE_URL}
     * @param apiKeyResolver    sources of the API key
     * @throws MissingCredentialException if no API key can be resolved
     */
    public ActaApiClient(RestClient.Builder restClientBuilder, String baseUrl, ApiKeyResolver apiKeyResolver) {
        if (StringUtils.isBlank(baseUrl)) {
            throw new InvalidInputException("ACTA API base url must not be empty");
        }
        this.baseUrl = StringUtils.removeEnd(baseUrl.trim(), "/");
        this.network = ActaNetwork.fromBaseUrl(this.baseUrl);
        var apiKey = apiKeyResolver.resolve(network);
        this.restClientBuilder = restClientBuilder.clone();
        this.restClient = buildRestClient(apiKey);
        log.info("Initialized ACTA API client for {} on {}", network, this.baseUrl);
    }

    /**
     * Client with the default key resolution: explicit key, then the process environment.
     */
    public static ActaApiClient create(String baseUrl, @Nullable String apiKey) {
        return new ActaApiClient(RestClient.builder(), baseUrl, ApiKeyResolver.defaultResolver(apiKey, System::getenv));
    }

    /**
     * Backs {@link #builder()}. Only {@code baseUrl} is mandatory.
     *
     * @param apiKey            explicit key, takes precedence over the environment
     * @param environment       environment lookup, defaults to {@code System::getenv}
     * @param restClientBuilder defaults to {@link RestClient#builder()}
     * @param apiKeyResolver    replaces the default key resolution entirely, {@code apiKey} and {@code environment} are then ignored
     */
    @Builder
    private static ActaApiClient of(String baseUrl,
                                    @Nullable String apiKey,
                                    @Nullable UnaryOperator<String> environment,
                                    @Nullable RestClient.Builder restClientBuilder,
                                    @Nullable ApiKeyResolver apiKeyResolver) {
        var resolver = apiKeyResolver != null
                ? apiKeyResolver
                : ApiKeyResolver.defaultResolver(apiKey, environment != null ? environment : System::getenv);
        return new ActaApiClient(restClientBuilder != null ? restClientBuilder : RestClient.builder(), baseUrl, resolver);
    }

    /**
     * Replaces the API key for all following requests.
     */
    public void updateApiKey(String apiKey) {
        if (StringUtils.isBlank(apiKey)) {
            throw new MissingCredentialException("API key must not be blank");
        }
        this.restClient = buildRestClient(apiKey.trim());
        log.info("Updated ACTA API key for {}", baseUrl);
    }

    private RestClient buildRestClient(String apiKey) {
        return restClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeaders(headers -> headers.set(API_KEY_HEADER, apiKey))
                .build();
    }

    public HealthResponseDto getHealth() {
        return get("/health", HealthResponseDto.class);
    }

    /**
     * Returns the network configuration of the API. The first successful answer is kept for the lifetime
     * of this client and never refreshed.
     *
     * @return rpc url, network passphrase and default contract id
     */
    public ConfigResponseDto getConfig() {
        var cached = configCache.get();
        if (cached != null) {
            return cached;
        }
        var fetched = get("/config", ConfigResponseDto.class);
        if (fetched == null) {
            throw new ConfigurationMissingException("ACTA API %s returned an empty configuration".formatted(baseUrl));
        }
        configCache.compareAndSet(null, fetched);
        return configCache.get();
    }

    /**
     * Sends a prepare or submit request to a transaction endpoint.
     */
    public TransactionResponseDto transact(TxEndpoint endpoint, TransactionRequestDto request) {
        return post(endpoint.getPath(), request, TransactionResponseDto.class);
    }

    public TransactionResponseDto vaultCreate(TransactionRequestDto request) {
        return transact(TxEndpoint.VAULT_CREATE, request);
    }

    public TransactionResponseDto vaultAuthorizeIssuer(TransactionRequestDto request) {
        return transact(TxEndpoint.VAULT_AUTHORIZE_ISSUER, request);
    }

    public TransactionResponseDto vaultRevokeIssuer(TransactionRequestDto request) {
        return transact(TxEndpoint.VAULT_REVOKE_ISSUER, request);
    }

    public TransactionResponseDto vaultRevokeVault(TransactionRequestDto request) {
        return transact(TxEndpoint.VAULT_REVOKE_VAULT, request);
    }

    public TransactionResponseDto vcIssue(TransactionRequestDto request) {
        return transact(TxEndpoint.VC_ISSUE, request);
    }

    public TransactionResponseDto vcRevoke(TransactionRequestDto request) {
        return transact(TxEndpoint.VC_REVOKE, request);
    }

    public VaultVerifyResponseDto vaultVerify(String owner, String vcId, @Nullable String contractId) {
        return post("/contracts/vault/verify-vc", new VaultQueryRequestDto(owner, vcId, contractId), VaultVerifyResponseDto.class);
    }

    public VaultListVcIdsResponseDto vaultListVcIds(String owner, @Nullable String contractId) {
        return post("/contracts/vault/list-vc-ids", new VaultQueryRequestDto(owner, null, contractId), VaultListVcIdsResponseDto.class);
    }

    public VaultGetVcResponseDto vaultGetVc(String owner, String vcId, @Nullable String contractId) {
        return post("/contracts/vault/get-vc", new VaultQueryRequestDto(owner, vcId, contractId), VaultGetVcResponseDto.class);
    }

    public VerifyStatusResponseDto verifyStatus(String vcId) {
        return post("/verify", new VerifyStatusRequestDto(vcId), VerifyStatusResponseDto.class);
    }

    /**
     * GET variant of {@link #verifyStatus(String)} kept for older deployments.
     */
    public VerifyStatusResponseDto verifyStatusGet(String vcId) {
        log.debug("GET {}/verify/{}", baseUrl, vcId);
        return restClient.get()
                .uri("/verify/{vcId}", vcId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::handleError)
                .body(VerifyStatusResponseDto.class);
    }

    /**
     * Revokes a credential through the issuance contract. The transaction is signed by the server's admin account.
     *
     * @param date ISO-8601 timestamp, the server uses the current time if absent
     */
    public RevokeCredentialResponseDto revokeCredentialServerSigned(String vcId, @Nullable String date) {
        return post("/issuance/revoke", new RevokeCredentialRequestDto(vcId, date), RevokeCredentialResponseDto.class);
    }

    private <T> T get(String path, Class<T> responseType) {
        log.debug("GET {}{}", baseUrl, path);
        return restClient.get()
                .uri(path)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::handleError)
                .body(responseType);
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        log.debug("POST {}{}", baseUrl, path);
        return restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::handleError)
                .body(responseType);
    }

    private void handleError(HttpRequest request, ClientHttpResponse response) throws IOException {
        var status = response.getStatusCode();
        var body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        if (status.value() == 401 || status.value() == 403) {
            log.error("ACTA API rejected the API key for {} with status {}. Please check the key configured for {}.",
                    request.getURI(), status, network);
        } else {
            log.debug("ACTA API request to {} failed with status {}", request.getURI(), status);
        }
        throw new ActaApiException(status,
                "ACTA API %s responded with %s".formatted(request.getURI(), status), body);
    }
}
