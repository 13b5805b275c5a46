package com.procureinsight.discovery.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pulls the JSON object out of free-form completion text.
 *
 * The span starting at the first {@code '{'} is found by brace scanning (string literals
 * respected). Absent or malformed JSON yields an empty object, never an error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonPayloadExtractor {

    private final ObjectMapper objectMapper;

    public ObjectNode extract(String text) {
        if (text == null) {
            return objectMapper.createObjectNode();
        }
        int start = text.indexOf('{');
        if (start < 0) {
            log.debug("No JSON object in provider response");
            return objectMapper.createObjectNode();
        }
        int end = findClosingBrace(text, start);
        if (end < 0) {
            end = text.lastIndexOf('}');
        }
        if (end <= start) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            if (node instanceof ObjectNode objectNode) {
                return objectNode;
            }
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse provider JSON: {}", e.getOriginalMessage());
        }
        return objectMapper.createObjectNode();
    }

    static int findClosingBrace(String text, int start) {
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
                    return i;
                }
            }
        }
        return -1;
    }
}
