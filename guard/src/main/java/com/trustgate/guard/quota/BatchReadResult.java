package com.trustgate.guard.quota;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch read: one entry per processed path, keyed by the path
 * string exactly as the caller supplied it. A value is either the file's
 * content or a string starting with {@code Error:}.
 */
public record BatchReadResult(Map<String, String> entries, List<String> warnings) {

    public static final String WARNINGS_KEY = "__warnings__";

    public BatchReadResult {
        entries  = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        warnings = List.copyOf(warnings);
    }

    public boolean truncated() { return !warnings.isEmpty(); }

    /** JSON object in request order, plus {@value #WARNINGS_KEY} when anything was dropped. */
    public String toJson(ObjectMapper json) {
        Map<String, Object> out = new LinkedHashMap<>(entries);
        if (!warnings.isEmpty()) {
            out.put(WARNINGS_KEY, warnings);
        }
        try {
            return json.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Batch read result is not serializable", e);
        }
    }
}
