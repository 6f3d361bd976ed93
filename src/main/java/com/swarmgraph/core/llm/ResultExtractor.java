package com.swarmgraph.core.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw generated text into structured data without ever throwing.
 * <p>
 * Strips markdown code fences, parses with Jackson and, when the whole text is not
 * valid JSON, retries on the outermost {@code {...}} span. Anything still unparseable
 * comes back as {@link Extraction#failed}.
 */
@Component
public class ResultExtractor {

    private static final Logger log = LoggerFactory.getLogger(ResultExtractor.class);

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?[ \\t]*\\r?\\n?");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public ResultExtractor() {
        this.mapper = new ObjectMapper();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Extraction extract(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return Extraction.failed(rawText);
        }
        String cleaned = stripFences(rawText);

        Map<String, Object> parsed = tryParse(cleaned);
        if (parsed == null) {
            int start = cleaned.indexOf('{');
            int end = cleaned.lastIndexOf('}');
            if (start >= 0 && end > start) {
                parsed = tryParse(cleaned.substring(start, end + 1));
            }
        }
        if (parsed == null) {
            log.debug("Could not extract structured data ({} chars)", rawText.length());
            return Extraction.failed(rawText);
        }
        return Extraction.parsed(parsed);
    }

    static String stripFences(String text) {
        return FENCE.matcher(text).replaceAll("").trim();
    }

    private Map<String, Object> tryParse(String candidate) {
        try {
            JsonNode node = mapper.readTree(candidate);
            if (node == null) {
                return null;
            }
            if (node.isObject()) {
                return mapper.convertValue(node, MAP_TYPE);
            }
            if (node.isArray()) {
                var wrapped = new LinkedHashMap<String, Object>();
                wrapped.put("items", mapper.convertValue(node, LIST_TYPE));
                return wrapped;
            }
            return null;
        } catch (Exception e) {
            log.trace("Parse attempt rejected: {}", e.getMessage());
            return null;
        }
    }
}
