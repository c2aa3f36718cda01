package build.acta.sdk.service;

import build.acta.sdk.common.exception.InvalidInputException;
import build.acta.sdk.common.exception.MalformedDocumentException;
import build.acta.sdk.domain.ActaNetwork;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IdentifierNormalizerTest {

    private static final String CREDENTIALS_V2_CONTEXT = "https://www.w3.org/ns/credentials/v2";
    private static final String CREDENTIALS_EXAMPLES_V2_CONTEXT = "https://www.w3.org/ns/credentials/examples/v2";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void buildDid_usesStellarAndNetworkValue() {
        assertEquals("did:pkh:stellar:testnet:GABC", IdentifierNormalizer.buildDid("GABC", ActaNetwork.TESTNET));
        assertEquals("did:pkh:stellar:mainnet:GABC", IdentifierNormalizer.buildDid("GABC", ActaNetwork.MAINNET));
        assertEquals("did:pkh:other:testnet:GABC", IdentifierNormalizer.buildDid("GABC", ActaNetwork.TESTNET, "other"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  "})
    void buildDid_blankAddress_throws(String address) {
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.buildDid(address, ActaNetwork.TESTNET));
    }

    @ParameterizedTest
    @EnumSource(ActaNetwork.class)
    void normalizeDid_existingDid_isReturnedUnchanged(ActaNetwork network) {
        var did = "did:web:issuer.example.com";
        assertThat(IdentifierNormalizer.normalizeDid(did, network)).isSameAs(did);
        assertThat(IdentifierNormalizer.normalizeDid("did:pkh:stellar:mainnet:GX", network)).isEqualTo("did:pkh:stellar:mainnet:GX");
    }

    @Test
    void normalizeDid_walletAddress_isTurnedIntoDid() {
        assertThat(IdentifierNormalizer.normalizeDid("G_ADDR", ActaNetwork.TESTNET)).isEqualTo("did:pkh:stellar:testnet:G_ADDR");
    }

    @Test
    void normalizeDid_empty_throws() {
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.normalizeDid("", ActaNetwork.TESTNET));
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.normalizeDid(null, ActaNetwork.TESTNET));
    }

    @Test
    void ensureContext_missingContext_addsRequiredUris() throws Exception {
        var result = objectMapper.readTree(IdentifierNormalizer.ensureContext("{\"claim\":\"x\"}"));

        assertThat(result.get("claim").asText()).isEqualTo("x");
        assertThat(contextOf(result)).containsExactly(CREDENTIALS_V2_CONTEXT, CREDENTIALS_EXAMPLES_V2_CONTEXT);
    }

    @Test
    void ensureContext_existingArray_keepsExtrasAndOrder() throws Exception {
        var input = "{\"@context\":[\"https://example.com/ctx\",\"" + CREDENTIALS_V2_CONTEXT + "\"],\"a\":1}";

        var result = objectMapper.readTree(IdentifierNormalizer.ensureContext(input));

        assertThat(contextOf(result)).containsExactly("https://example.com/ctx", CREDENTIALS_V2_CONTEXT, CREDENTIALS_EXAMPLES_V2_CONTEXT);
        assertThat(result.get("a").asInt()).isEqualTo(1);
    }

    @Test
    void ensureContext_nonArrayContext_isReplaced() throws Exception {
        var result = objectMapper.readTree(IdentifierNormalizer.ensureContext("{\"@context\":\"https://example.com/ctx\"}"));

        assertThat(contextOf(result)).containsExactly(CREDENTIALS_V2_CONTEXT, CREDENTIALS_EXAMPLES_V2_CONTEXT);
    }

    @Test
    void ensureContext_isIdempotent() {
        var once = IdentifierNormalizer.ensureContext("{\"b\":{\"c\":[1,2.50]},\"@context\":[\"x\"]}");

        assertEquals(once, IdentifierNormalizer.ensureContext(once));
        assertThat(once).contains("2.50");
    }

    @Test
    void ensureContext_map_isCopiedNotMutated() throws Exception {
        Map<String, Object> document = new HashMap<>();
        document.put("claim", "x");
        document.put("@context", List.of("https://example.com/ctx"));

        var result = objectMapper.readTree(IdentifierNormalizer.ensureContext(document));

        assertThat(contextOf(result)).containsExactly("https://example.com/ctx", CREDENTIALS_V2_CONTEXT, CREDENTIALS_EXAMPLES_V2_CONTEXT);
        assertThat(document.get("@context")).isEqualTo(List.of("https://example.com/ctx"));
    }

    @Test
    void ensureContext_invalidJson_throwsWithParserMessage() {
        assertThatThrownBy(() -> IdentifierNormalizer.ensureContext("{not json"))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageStartingWith("Invalid JSON in vcData: ")
                .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"[1,2]", "\"text\"", "42"})
    void ensureContext_nonObjectJson_throws(String json) {
        assertThrows(MalformedDocumentException.class, () -> IdentifierNormalizer.ensureContext(json));
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"claim\":\"x\"} garbage", "{\"claim\":\"x\"} {\"other\":1}", "{\"claim\":\"x\"}]"})
    void ensureContext_trailingContent_throwsWithParserMessage(String json) {
        assertThatThrownBy(() -> IdentifierNormalizer.ensureContext(json))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageStartingWith("Invalid JSON in vcData: ")
                .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @Test
    void ensureContext_mapPassedAsObject_isMerged() throws JsonProcessingException {
        Object vcData = Map.of("claim", "x");

        var result = objectMapper.readTree(IdentifierNormalizer.ensureContext(vcData));

        assertEquals("x", result.get("claim").asText());
        assertThat(contextOf(result)).containsExactly(CREDENTIALS_V2_CONTEXT, CREDENTIALS_EXAMPLES_V2_CONTEXT);
    }

    @Test
    void ensureContext_unsupportedType_throws() {
        Object vcData = 42;
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.ensureContext(vcData));
    }

    private static List<String> contextOf(JsonNode document) {
        var context = document.get("@context");
        assertThat(context.isArray()).isTrue();
        var values = new ArrayList<String>();
        context.forEach(node -> values.add(node.asText()));
        return values;
    }
}
