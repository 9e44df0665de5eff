package com.example.truingup.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
 * Canonical serialization + SHA-256 for audit records.
 *
 * Format (CHECKSUM_SCHEME v1):
 *  - record -> JSON object using the record's own JSON names (snake_case for audit types)
 *  - "timestamp" removed at every depth, the record's own checksum key removed at the top
 *  - object keys sorted lexicographically at every depth, arrays keep their order
 *  - no whitespace, BigDecimal written plain (no exponent), nulls kept
 *  - UTF-8 bytes hashed with SHA-256, lowercase hex
 *
 * Changing any of the above breaks every stored checksum: bump CHECKSUM_SCHEME instead.
 */
public final class ChecksumUtils {

    public static final String CHECKSUM_SCHEME = "SHA-256/canonical-json/v1";

    /** Fields that legitimately differ between two otherwise identical runs. */
    public static final Set<String> VOLATILE_FIELDS = Set.of("timestamp");

    /** Self-referencing digest fields, only dropped at the top level of a record. */
    public static final Set<String> DIGEST_FIELDS = Set.of("checksum", "batch_checksum");

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // Separate from the Spring-managed ObjectMapper: application properties must not reach the digest.
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private ChecksumUtils() {}

    public static String computeChecksum(Object record) {
        return HashUtils.sha256Hex(canonicalJson(record));
    }

    /** Checksum of a record previously stored as JSON text. */
    public static String computeChecksumOfJson(String json) {
        try {
            return computeChecksum(CANONICAL.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored audit JSON is not readable", e);
        }
    }

    /** Full JSON of a record (nothing stripped) in the same number and key format the digest reads. */
    public static String toJson(Object record) {
        try {
            return CANONICAL.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit record serialization failed", e);
        }
    }

    public static String canonicalJson(Object record) {
        Map<String, Object> tree = CANONICAL.convertValue(record, MAP_TYPE);
        DIGEST_FIELDS.forEach(tree::remove);
        try {
            return CANONICAL.writeValueAsString(stripVolatile(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Canonical serialization failed", e);
        }
    }

    private static Object stripVolatile(Object node) {
        if (node instanceof Map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) node).entrySet()) {
                String key = String.valueOf(e.getKey());
                if (VOLATILE_FIELDS.contains(key)) continue;
                out.put(key, stripVolatile(e.getValue()));
            }
            return out;
        }
        if (node instanceof List) {
            List<?> list = (List<?>) node;
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) out.add(stripVolatile(item));
            return out;
        }
        return node;
    }
}
