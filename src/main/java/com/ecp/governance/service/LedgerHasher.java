package com.ecp.governance.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical JSON and SHA-256 helpers shared by the ledger and the event gate.
 * Canonical form sorts object keys at every depth, so two maps with the same
 * content hash identically regardless of insertion order.
 */
public final class LedgerHasher {

    public static final String GENESIS_HASH = "0".repeat(64);

    private LedgerHasher() {}

    public static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String canonicalize(ObjectMapper om, Object value) {
        JsonNode node = (value instanceof JsonNode j) ? j
                : om.valueToTree(value == null ? Map.of() : value);
        try {
            return om.writeValueAsString(normalize(om, node));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable", e);
        }
    }

    /**
     * Hash of a ledger entry: SHA-256 over the canonical form of
     * {timestamp, entryType, payload, previousHash}.
     */
    public static String entryHash(ObjectMapper om, long timestamp, String entryType,
                                   Map<String, Object> payload, String previousHash) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("timestamp", timestamp);
        content.put("entryType", entryType);
        content.put("payload", payload == null ? Map.of() : payload);
        content.put("previousHash", previousHash);
        return sha256Hex(canonicalize(om, content));
    }

    /** Deterministic decision id: same action, description and payload always give the same id. */
    public static String eventId(ObjectMapper om, String actionType, String description, Map<String, Object> payload) {
        String content = actionType + ":" + description + ":" + canonicalize(om, payload);
        return "evt_" + sha256Hex(content).substring(0, 16);
    }

    private static JsonNode normalize(ObjectMapper om, JsonNode node) {
        if (node == null || node.isNull()) return NullNode.getInstance();

        if (node.isObject()) {
            ObjectNode dst = om.createObjectNode();
            List<String> fields = new ArrayList<>();
            node.fieldNames().forEachRemaining(fields::add);
            Collections.sort(fields);
            for (String f : fields) {
                dst.set(f, normalize(om, node.get(f)));
            }
            return dst;
        }
        if (node.isArray()) {
            ArrayNode arr = om.createArrayNode();
            for (JsonNode it : node) arr.add(normalize(om, it));
            return arr;
        }
        return node;
    }
}
