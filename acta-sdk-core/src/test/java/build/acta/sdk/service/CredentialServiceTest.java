package build.acta.sdk.service;

import build.acta.sdk.common.exception.InvalidInputException;
import build.acta.sdk.common.exception.MalformedDocumentException;
import build.acta.sdk.domain.ActaNetwork;
import build.acta.sdk.domain.IssueCredentialCommand;
import build.acta.sdk.domain.SubmissionMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CredentialServiceTest {

    private static final String BASE_URL = ActaNetwork.TESTNET_BASE_URL;
    private static final String PREPARED = "{\"xdr\":\"UNSIGNED\",\"network\":\"Test SDF Network ; September 2015\"}";
    private static final TransactionSigner SIGNER = (envelope, passphrase) -> "SIGNED";

    private MockRestServiceServer server;
    private CredentialService credentialService;

    @BeforeEach
    void setUp() {
        var restClientBuilder = RestClient.builder();
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        var apiClient = ActaApiClient.builder()
                .baseUrl(BASE_URL)
                .apiKey("key")
                .restClientBuilder(restClientBuilder)
                .build();
        var clock = Clock.fixed(Instant.parse("2025-03-04T05:06:07.890123Z"), ZoneOffset.UTC);
        credentialService = new CredentialService(apiClient, new TransactionOrchestrator(apiClient), SubmissionMode.BACKEND, clock);
    }

    @Test
    void issueCredential_normalizesHolderAndContext() {
        server.expect(requestTo(BASE_URL + "/contracts/vc/issue"))
                .andExpect(jsonPath("$.owner").value("G_OWNER"))
                .andExpect(jsonPath("$.holder").value("did:pkh:stellar:testnet:G_ADDR"))
                .andExpect(jsonPath("$.issuerDid").value("did:web:issuer.example"))
                .andExpect(jsonPath("$.sourcePublicKey").value("G_ISSUER"))
                .andExpect(jsonPath("$.contractId").value("C_EXPLICIT"))
                .andExpect(jsonPath("$.vcData").value(allOf(
                        containsString("\"claim\":\"x\""),
                        containsString("https://www.w3.org/ns/credentials/v2"),
                        containsString("https://www.w3.org/ns/credentials/examples/v2"))))
                .andRespond(withSuccess(PREPARED, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/contracts/vc/issue"))
                .andExpect(jsonPath("$.signedXdr").value("SIGNED"))
                .andRespond(withSuccess("{\"tx_id\":\"tx-issue\"}", MediaType.APPLICATION_JSON));

        var outcome = credentialService.issueCredential(IssueCredentialCommand.builder()
                .owner("G_OWNER")
                .vcId("vc-1")
                .vcData("{\"claim\":\"x\"}")
                .issuer("G_ISSUER")
                .holder("G_ADDR")
                .issuerDid("did:web:issuer.example")
                .contractId("C_EXPLICIT")
                .build(), SIGNER);

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.transactionId()).isEqualTo("tx-issue");
        server.verify();
    }

    @Test
    void issueCredential_withoutContractId_usesConfiguredContract() {
        server.expect(requestTo(BASE_URL + "/config"))
                .andRespond(withSuccess("{\"actaContractId\":\"C_CONFIG\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/contracts/vc/issue"))
                .andExpect(jsonPath("$.contractId").value("C_CONFIG"))
                .andExpect(jsonPath("$.issuerDid").doesNotExist())
                .andRespond(withSuccess(PREPARED, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/contracts/vc/issue"))
                .andRespond(withSuccess("{\"tx_id\":\"tx-issue\"}", MediaType.APPLICATION_JSON));

        credentialService.issueCredential(IssueCredentialCommand.builder()
                .owner("G_OWNER")
                .vcId("vc-1")
                .vcData(Map.of("claim", "x"))
                .issuer("G_ISSUER")
                .holder("did:pkh:stellar:testnet:G_ADDR")
                .build(), SIGNER);

        server.verify();
    }

    @Test
    void issueCredential_invalidVcData_failsBeforeAnyRequest() {
        var command = IssueCredentialCommand.builder()
                .owner("G_OWNER")
                .vcId("vc-1")
                .vcData("{broken")
                .issuer("G_ISSUER")
                .holder("G_ADDR")
                .contractId("C_ID")
                .build();

        assertThrows(MalformedDocumentException.class, () -> credentialService.issueCredential(command, SIGNER));
        server.verify();
    }

    @Test
    void issueCredential_missingHolder_isInvalidInput() {
        var command = IssueCredentialCommand.builder()
                .owner("G_OWNER")
                .vcId("vc-1")
                .vcData("{}")
                .issuer("G_ISSUER")
                .contractId("C_ID")
                .build();

        assertThrows(InvalidInputException.class, () -> credentialService.issueCredential(command, SIGNER));
    }

    @Test
    void revokeCredential_defaultsDateToNow() {
        server.expect(requestTo(BASE_URL + "/contracts/vc/revoke"))
                .andExpect(jsonPath("$.vcId").value("vc-1"))
                .andExpect(jsonPath("$.date").value("2025-03-04T05:06:07.890Z"))
                .andExpect(jsonPath("$.sourcePublicKey").value("G_OWNER"))
                .andRespond(withSuccess(PREPARED, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/contracts/vc/revoke"))
                .andRespond(withSuccess("{\"tx_id\":\"tx-revoke\"}", MediaType.APPLICATION_JSON));

        var outcome = credentialService.revokeCredential("G_OWNER", "vc-1", null, "C_ID", SIGNER);

        assertThat(outcome.transactionId()).isEqualTo("tx-revoke");
        server.verify();
    }

    @Test
    void revokeCredential_keepsExplicitDate() {
        server.expect(requestTo(BASE_URL + "/contracts/vc/revoke"))
                .andExpect(jsonPath("$.date").value("2024-12-31T00:00:00Z"))
                .andRespond(withSuccess(PREPARED, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/contracts/vc/revoke"))
                .andRespond(withSuccess("{\"tx_id\":\"tx-revoke\"}", MediaType.APPLICATION_JSON));

        credentialService.revokeCredential("G_OWNER", "vc-1", "2024-12-31T00:00:00Z", "C_ID", SIGNER);

        server.verify();
    }

    @Test
    void revokeCredentialServerSigned_returnsTransactionId() {
        server.expect(requestTo(BASE_URL + "/issuance/revoke"))
                .andRespond(withSuccess("{\"vc_id\":\"vc-1\",\"tx_id\":\"tx-admin\"}", MediaType.APPLICATION_JSON));

        assertThat(credentialService.revokeCredentialServerSigned("vc-1", null)).isEqualTo("tx-admin");
    }
}
