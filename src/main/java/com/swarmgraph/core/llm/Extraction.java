package com.swarmgraph.core.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link ResultExtractor#extract}: either the parsed payload ({@code ok}) or a
 * raw capture of the text ({@code !ok}).
 * <p>
 * The typed getters never throw; a missing or mistyped key yields the supplied default,
 * which is how report reducers fall back section by section.
 */
public record Extraction(Map<String, Object> payload, boolean ok) {

    public static final int RAW_CAPTURE_LIMIT = 500;

    public Extraction {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Extraction parsed(Map<String, Object> payload) {
        return new Extraction(payload, true);
    }

    public static Extraction failed(String rawText) {
        String raw = rawText == null ? "" : rawText;
        var capture = new LinkedHashMap<String, Object>();
        capture.put("raw", raw.length() > RAW_CAPTURE_LIMIT ? raw.substring(0, RAW_CAPTURE_LIMIT) : raw);
        return new Extraction(capture, false);
    }

    /** Extraction of a section that never produced output. */
    public static Extraction missing() {
        return failed("");
    }

    public String string(String key, String defaultValue) {
        Object value = payload.get(key);
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return defaultValue;
    }

    public boolean bool(String key, boolean defaultValue) {
        Object value = payload.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }

    public double number(String key, double defaultValue) {
        Object value = payload.get(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Whole number under {@code key}, rounded and held within {@code [min, max]}. Missing,
     * non-numeric and NaN values give {@code defaultValue}.
     */
    public int integer(String key, int defaultValue, int min, int max) {
        double value = number(key, Double.NaN);
        if (Double.isNaN(value)) {
            return defaultValue;
        }
        return (int) Math.max(min, Math.min(max, Math.round(value)));
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String key) {
        Object value = payload.get(key);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    /** Nested object under {@code key}, viewed as its own extraction with the same status. */
    public Extraction section(String key) {
        return new Extraction(map(key), ok && payload.get(key) instanceof Map<?, ?>);
    }

    public List<Object> list(String key) {
        Object value = payload.get(key);
        return value instanceof List<?> l ? Collections.unmodifiableList(l) : List.of();
    }

    public List<String> strings(String key) {
        return list(key).stream()
                .filter(v -> v != null)
                .map(String::valueOf)
                .toList();
    }

    /** Entries of the list under {@code key} that are JSON objects. */
    @SuppressWarnings("unchecked")
    public List<Extraction> objects(String key) {
        return list(key).stream()
                .filter(v -> v instanceof Map<?, ?>)
                .map(v -> Extraction.parsed((Map<String, Object>) v))
                .toList();
    }

    public String raw() {
        return ok ? "" : string("raw", "");
    }
}
