/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.autoconfigure;

import build.acta.sdk.common.config.ApiKeyResolver;
import build.acta.sdk.service.ActaApiClient;
import build.acta.sdk.service.CredentialService;
import build.acta.sdk.service.TransactionOrchestrator;
import build.acta.sdk.service.VaultReadService;
import build.acta.sdk.service.VaultService;
import build.acta.sdk.service.ledger.LedgerGateway;
import build.acta.sdk.service.ledger.LedgerStatusPoller;
import build.acta.sdk.service.ledger.SorobanRpcLedgerGateway;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.web.client.RestClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Provides the ACTA API client, the transaction orchestrator and the façades to the application.
 * Active as soon as {@code acta.base-url} is set. Every bean can be replaced by the application.
 */
@Slf4j
@AutoConfiguration(after = RestClientAutoConfiguration.class)
@ConditionalOnClass(RestClient.class)
@ConditionalOnProperty(prefix = "acta", name = "base-url")
@EnableConfigurationProperties(ActaProperties.class)
public class ActaAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ActaApiClient actaApiClient(ActaProperties properties,
                                       ObjectProvider<RestClient.Builder> restClientBuilder,
                                       Environment environment) {
        // the environment covers OS variables as well as system and application properties
        var apiKeyResolver = ApiKeyResolver.defaultResolver(properties.apiKey(), environment::getProperty);
        return new ActaApiClient(restClientBuilder.getIfAvailable(RestClient::builder), properties.baseUrl(), apiKeyResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerGateway actaLedgerGateway(ActaProperties properties,
                                           ActaApiClient actaApiClient,
                                           ObjectProvider<RestClient.Builder> restClientBuilder) {
        var rpcUrl = StringUtils.defaultIfBlank(properties.ledger().rpcUrl(), actaApiClient.getNetwork().getDefaultRpcUrl());
        log.info("Initializing ledger gateway for {} on {}", actaApiClient.getNetwork(), rpcUrl);
        return new SorobanRpcLedgerGateway(restClientBuilder.getIfAvailable(RestClient::builder), rpcUrl);
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerStatusPoller actaLedgerStatusPoller(LedgerGateway ledgerGateway, ActaProperties properties) {
        return new LedgerStatusPoller(ledgerGateway, properties.ledger().toPollingSettings());
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionOrchestrator actaTransactionOrchestrator(ActaApiClient actaApiClient, LedgerStatusPoller ledgerStatusPoller) {
        return new TransactionOrchestrator(actaApiClient, ledgerStatusPoller);
    }

    @Bean
    @ConditionalOnMissingBean
    public VaultService actaVaultService(ActaApiClient actaApiClient,
                                         TransactionOrchestrator orchestrator,
                                         ActaProperties properties) {
        return new VaultService(actaApiClient, orchestrator, properties.submissionMode());
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialService actaCredentialService(ActaApiClient actaApiClient,
                                                   TransactionOrchestrator orchestrator,
                                                   ActaProperties properties,
                                                   ObjectProvider<Clock> clock) {
        return new CredentialService(actaApiClient, orchestrator, properties.submissionMode(),
                clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public VaultReadService actaVaultReadService(ActaApiClient actaApiClient) {
        return new VaultReadService(actaApiClient);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class ActaHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "actaHealthIndicator")
        public ActaApiHealthIndicator actaHealthIndicator(ActaApiClient actaApiClient) {
            return new ActaApiHealthIndicator(actaApiClient);
        }
    }
}
