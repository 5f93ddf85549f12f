package com.keystone.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content hash of an audit record.
 *
 * <p>SHA-256 (lower-case hex) over the key-sorted JSON object of {@code timestamp},
 * {@code event_type}, {@code actor_id}, {@code target_id}, {@code organization_id}, {@code outcome}
 * and {@code description}. Absent values hash as empty strings. The timestamp uses ISO-8601 UTC
 * ({@link java.time.Instant#toString()}).
 */
public final class AuditHasher {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private AuditHasher() {
        // utility class
    }

    public static String hash(AuditRecord record) {
        return sha256Hex(canonicalJson(record));
    }

    static String canonicalJson(AuditRecord record) {
        Map<String, String> fields = new TreeMap<>();
        fields.put("timestamp", record.timestamp().toString());
        fields.put("event_type", record.eventType().value());
        fields.put("actor_id", orEmpty(record.actor().id()));
        fields.put("target_id", orEmpty(record.target().id()));
        fields.put("organization_id", orEmpty(record.organizationId()));
        fields.put("outcome", record.outcome().value());
        fields.put("description", orEmpty(record.description()));
        try {
            return CANONICAL.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize audit hash input", e);
        }
    }

    private static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
