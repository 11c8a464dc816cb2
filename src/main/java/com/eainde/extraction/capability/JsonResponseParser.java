package com.eainde.extraction.capability;

import com.eainde.extraction.exception.MalformedExtractionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Recovers JSON from a capability answer.
 *
 * <ol>
 *   <li>Strip markdown fences ({@code ```json ... ```} or {@code ``` ... ```})</li>
 *   <li>Parse with Jackson</li>
 *   <li>On failure, escape raw line breaks inside string literals and parse once more</li>
 *   <li>Otherwise throw {@link MalformedExtractionException} with a short excerpt</li>
 * </ol>
 */
@Slf4j
public class JsonResponseParser {

    static final int EXCERPT_LENGTH = 100;

    private final ObjectMapper objectMapper;

    public JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode parse(String response) {
        String clean = stripFences(response == null ? "" : response);
        JsonNode node;
        try {
            node = objectMapper.readTree(clean);
        } catch (JsonProcessingException first) {
            log.debug("Direct JSON parse failed, retrying with escaped line breaks: {}", first.getOriginalMessage());
            try {
                node = objectMapper.readTree(escapeLineBreaksInStrings(clean));
            } catch (JsonProcessingException second) {
                throw new MalformedExtractionException(excerpt(response), second);
            }
        }
        if (node == null || node.isMissingNode()) {
            throw new MalformedExtractionException(excerpt(response), null);
        }
        return node;
    }

    static String stripFences(String response) {
        String clean = response.strip();
        int jsonFence = clean.indexOf("```json");
        if (jsonFence >= 0) {
            clean = between(clean, jsonFence + "```json".length());
        } else {
            int fence = clean.indexOf("```");
            if (fence >= 0) {
                clean = between(clean, fence + 3);
            }
        }
        return clean.strip();
    }

    private static String between(String text, int start) {
        int end = text.indexOf("```", start);
        return end >= 0 ? text.substring(start, end) : text.substring(start);
    }

    /**
     * Replaces raw CR/LF/TAB characters that sit inside string literals with
     * their escape sequences. Characters between tokens are left alone.
     */
    static String escapeLineBreaksInStrings(String json) {
        StringBuilder out = new StringBuilder(json.length() + 16);
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                } else if (c == '\n') {
                    out.append("\\n");
                    continue;
                } else if (c == '\r') {
                    out.append("\\r");
                    continue;
                } else if (c == '\t') {
                    out.append("\\t");
                    continue;
                }
            } else if (c == '"') {
                inString = true;
            }
            out.append(c);
        }
        return out.toString();
    }

    private static String excerpt(String response) {
        if (response == null) return "";
        return response.length() <= EXCERPT_LENGTH ? response : response.substring(0, EXCERPT_LENGTH);
    }
}
