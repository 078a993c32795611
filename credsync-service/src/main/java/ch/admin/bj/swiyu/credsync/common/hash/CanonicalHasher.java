/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.hash;

import ch.admin.bj.swiyu.credsync.common.exception.JsonException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.TreeMap;

/**
 * Deterministic JSON rendering and SHA-256 digest used for credential ids and hashes.
 * <p>
 * Object keys are sorted recursively and no whitespace is emitted, so two structurally equal values
 * produce the same string regardless of the insertion order of their maps. Numbers are rendered by
 * value in plain notation without trailing zeros, {@code 1.0E7}, {@code 10000000.0} and
 * {@code 10000000} all become {@code 10000000}, as a JSON column may hand back a number in a
 * different notation than it was stored with.
 */
@UtilityClass
public class CanonicalHasher {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    public static String canonicalize(Object value) {
        try {
            JsonNode tree = CANONICAL_MAPPER.valueToTree(value);
            return CANONICAL_MAPPER.writeValueAsString(normalize(tree));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JsonException("Value cannot be rendered as canonical JSON", e);
        }
    }

    public static String sha256Hex(String content) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    public static String hash(Object value) {
        return sha256Hex(canonicalize(value));
    }

    private static JsonNode normalize(JsonNode node) {
        if (node.isObject()) {
            var sortedFields = new TreeMap<String, JsonNode>();
            node.properties().forEach(field -> sortedFields.put(field.getKey(), normalize(field.getValue())));
            ObjectNode normalized = JsonNodeFactory.instance.objectNode();
            sortedFields.forEach(normalized::set);
            return normalized;
        }
        if (node.isArray()) {
            ArrayNode normalized = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> normalized.add(normalize(element)));
            return normalized;
        }
        if (node.isNumber() && !isNonFinite(node)) {
            BigDecimal value = node.decimalValue().stripTrailingZeros();
            return DecimalNode.valueOf(value.signum() == 0 ? BigDecimal.ZERO : value);
        }
        return node;
    }

    private static boolean isNonFinite(JsonNode node) {
        return node.isFloatingPointNumber() && !node.isBigDecimal() && !Double.isFinite(node.doubleValue());
    }

    /**
     * Compares two hex digests without leaking the position of the first difference through timing.
     */
    public static boolean digestsEqual(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        return MessageDigest.isEqual(left.getBytes(StandardCharsets.UTF_8), right.getBytes(StandardCharsets.UTF_8));
    }
}
