/*
 * SPDX-FileCopyrightText: 2025 ACTA SDK contributors
 *
 * SPDX-License-Identifier: MIT
 */

package build.acta.sdk.service;

import build.acta.sdk.common.exception.InvalidInputException;
import build.acta.sdk.common.exception.MalformedDocumentException;
import build.acta.sdk.domain.ActaNetwork;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * Pure transformations applied to caller input before anything is sent to the backend.
 * <ul>
 *   <li>wallet addresses are promoted to {@code did:pkh} identifiers</li>
 *   <li>credential data is guaranteed to carry the required JSON-LD {@code @context} entries</li>
 * </ul>
 */
@UtilityClass
public class IdentifierNormalizer {

    public static final String DID_PREFIX = "did:";
    public static final String DEFAULT_BLOCKCHAIN = "stellar";
    public static final String CONTEXT_FIELD = "@context";
    public static final String CREDENTIALS_V2_CONTEXT = "https://www.w3.org/ns/credentials/v2";
    public static final String CREDENTIALS_EXAMPLES_V2_CONTEXT = "https://www.w3.org/ns/credentials/examples/v2";
    public static final List<String> REQUIRED_CONTEXT = List.of(CREDENTIALS_V2_CONTEXT, CREDENTIALS_EXAMPLES_V2_CONTEXT);

    // exact decimals so that re-serializing a document does not alter its numbers
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

    public static String buildDid(String address, ActaNetwork network) {
        return buildDid(address, network, DEFAULT_BLOCKCHAIN);
    }

    /**
     * @return {@code did:pkh:<blockchain>:<network>:<address>}
     * @throws InvalidInputException if the address is blank
     */
    public static String buildDid(String address, ActaNetwork network, String blockchain) {
        if (StringUtils.isBlank(address)) {
            throw new InvalidInputException("Wallet address must not be empty");
        }
        return String.format("did:pkh:%s:%s:%s", blockchain, network.getValue(), address);
    }

    /**
     * Returns values already starting with {@code did:} unchanged, otherwise treats the input as wallet address.
     *
     * @throws InvalidInputException if the input is empty
     */
    public static String normalizeDid(String didOrAddress, ActaNetwork network) {
        if (StringUtils.isEmpty(didOrAddress)) {
            throw new InvalidInputException("DID or wallet address must not be empty");
        }
        if (didOrAddress.startsWith(DID_PREFIX)) {
            return didOrAddress;
        }
        return buildDid(didOrAddress, network);
    }

    /**
     * Parses serialized credential data and makes sure the required contexts are present.
     *
     * @param vcData credential data as JSON object string
     * @return the re-serialized document
     * @throws MalformedDocumentException if the input is not a single JSON object
     */
    public static String ensureContext(String vcData) {
        if (vcData == null) {
            throw new InvalidInputException("Credential data must not be null");
        }
        JsonNode document;
        try {
            document = MAPPER.readTree(vcData);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("Invalid JSON in vcData: " + e.getOriginalMessage(), e);
        }
        if (document == null || !document.isObject()) {
            throw new MalformedDocumentException("Invalid JSON in vcData: expected a JSON object");
        }
        return mergeContext((ObjectNode) document);
    }

    /**
     * Same as {@link #ensureContext(String)} for a live document. The given map is copied and never modified.
     */
    public static String ensureContext(Map<?, ?> vcData) {
        if (vcData == null) {
            throw new InvalidInputException("Credential data must not be null");
        }
        ObjectNode copy;
        try {
            copy = MAPPER.valueToTree(vcData);
        } catch (IllegalArgumentException e) {
            throw new MalformedDocumentException("Credential data can not be represented as JSON: " + e.getMessage(), e);
        }
        return mergeContext(copy);
    }

    /**
     * Dispatches on the runtime type of the credential data, which may be a JSON string or a map.
     */
    public static String ensureContext(Object vcData) {
        if (vcData instanceof String json) {
            return ensureContext(json);
        }
        if (vcData instanceof Map<?, ?> map) {
            return ensureContext(map);
        }
        throw new InvalidInputException("Credential data must be a JSON string or a map, got "
                + (vcData == null ? "null" : vcData.getClass().getSimpleName()));
    }

    private static String mergeContext(ObjectNode document) {
        JsonNode context = document.get(CONTEXT_FIELD);
        if (context == null || !context.isArray()) {
            ArrayNode required = document.arrayNode();
            REQUIRED_CONTEXT.forEach(required::add);
            document.set(CONTEXT_FIELD, required);
        } else {
            ArrayNode existing = (ArrayNode) context;
            REQUIRED_CONTEXT.stream()
                    .filter(uri -> !containsText(existing, uri))
                    .forEach(existing::add);
        }
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("Failed to serialize credential data", e);
        }
    }

    private static boolean containsText(ArrayNode array, String value) {
        for (JsonNode element : array) {
            if (element.isTextual() && value.equals(element.textValue())) {
                return true;
            }
        }
        return false;
    }
}
