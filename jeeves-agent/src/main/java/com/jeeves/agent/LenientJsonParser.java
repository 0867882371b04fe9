package com.jeeves.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Extracts a JSON object from LLM output. Tries, in order: the whole text, the body of a Markdown
 * code fence, then each balanced {@code {...}} span (string literals respected) from left to right.
 */
final class LenientJsonParser {

    private static final Logger log = LoggerFactory.getLogger(LenientJsonParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    Optional<Map<String, Object>> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String trimmed = text.trim();

        Optional<Map<String, Object>> direct = tryParse(trimmed);
        if (direct.isPresent()) return direct;

        String fenced = stripCodeFence(trimmed);
        if (!fenced.equals(trimmed)) {
            Optional<Map<String, Object>> fromFence = tryParse(fenced);
            if (fromFence.isPresent()) return fromFence;
        }
        return scanForObject(trimmed);
    }

    private static Optional<Map<String, Object>> scanForObject(String text) {
        int from = text.indexOf('{');
        while (from >= 0) {
            int end = matchingBrace(text, from);
            if (end < 0) break;
            Optional<Map<String, Object>> candidate = tryParse(text.substring(from, end + 1));
            if (candidate.isPresent()) return candidate;
            from = text.indexOf('{', from + 1);
        }
        if (log.isDebugEnabled()) {
            int maxLog = 200;
            String snippet = text.length() > maxLog ? text.substring(0, maxLog) + "..." : text;
            log.debug("No JSON object found in LLM output | snippet=[{}]", snippet);
        }
        return Optional.empty();
    }

    /** Index of the brace closing the one at {@code start}, or -1 when unbalanced. */
    static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static String stripCodeFence(String text) {
        int open = text.indexOf("```");
        if (open < 0) return text;
        int bodyStart = text.indexOf('\n', open);
        if (bodyStart < 0) return text;
        int close = text.indexOf("```", bodyStart);
        if (close < 0) return text;
        return text.substring(bodyStart + 1, close).trim();
    }

    private static Optional<Map<String, Object>> tryParse(String candidate) {
        if (!candidate.startsWith("{")) return Optional.empty();
        try {
            return Optional.ofNullable(MAPPER.readValue(candidate, MAP_TYPE));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
