package com.eainde.productresearch.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a JSON object from free-form model output.
 *
 * <h3>Candidates, in order:</h3>
 * <ol>
 *   <li>a {@code ```json} fenced block</li>
 *   <li>any fenced block whose content starts with <code>{</code></li>
 *   <li>the first <code>{</code> up to its balancing <code>}</code></li>
 *   <li>the whole trimmed text when it starts with <code>{</code></li>
 * </ol>
 * The first candidate that parses to a JSON object wins. Nothing found yields an empty Optional.
 */
@Log4j2
public class JsonResponseParser {

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*(.*?)```", Pattern.DOTALL);
    private static final Pattern ANY_FENCE = Pattern.compile("```[a-zA-Z]*\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<ObjectNode> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (String candidate : candidates(text)) {
            Optional<ObjectNode> parsed = tryParse(candidate);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        log.debug("No JSON object found in response of length {}", text.length());
        return Optional.empty();
    }

    /** Parses and binds to {@code type}; binding failures count as "no JSON found". */
    public <T> Optional<T> parse(String text, Class<T> type) {
        return parse(text).flatMap(node -> {
            try {
                return Optional.of(objectMapper.treeToValue(node, type));
            } catch (Exception e) {
                log.warn("JSON object does not match {}: {}", type.getSimpleName(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    private List<String> candidates(String text) {
        List<String> candidates = new ArrayList<>();

        Matcher json = JSON_FENCE.matcher(text);
        if (json.find()) {
            candidates.add(json.group(1).trim());
        }

        Matcher any = ANY_FENCE.matcher(text);
        while (any.find()) {
            String content = any.group(1).trim();
            if (content.startsWith("{")) {
                candidates.add(content);
            }
        }

        balancedObject(text).ifPresent(candidates::add);

        String trimmed = text.trim();
        if (trimmed.startsWith("{")) {
            candidates.add(trimmed);
        }
        return candidates;
    }

    static Optional<String> balancedObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }
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
                if (depth == 0) {
                    return Optional.of(text.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<ObjectNode> tryParse(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node != null && node.isObject()) {
                return Optional.of((ObjectNode) node);
            }
        } catch (Exception e) {
            log.trace("Candidate is not valid JSON: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
