package com.example.textembedding.ingest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds record payloads from caller metadata and ingestion defaults.
 * <p>
 * Precedence: a caller value wins whenever the caller supplied the key with a
 * non-null value; defaults for {@value #TEXT}, {@value #CREATED_AT} and
 * {@value #ID} fill only what is missing.
 */
public final class PayloadMerger {

    public static final String TEXT = "text";
    public static final String CREATED_AT = "created_at";
    public static final String ID = "id";

    private PayloadMerger() {
    }

    public static Map<String, Object> merge(Map<String, Object> callerMetadata, Map<String, Object> defaults) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (callerMetadata != null) {
            callerMetadata.forEach((key, value) -> {
                if (value != null) {
                    payload.put(key, value);
                }
            });
        }
        defaults.forEach(payload::putIfAbsent);
        return payload;
    }

    public static Map<String, Object> defaults(String text, String createdAt, String id) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(TEXT, text);
        defaults.put(CREATED_AT, createdAt);
        defaults.put(ID, id);
        return defaults;
    }
}
