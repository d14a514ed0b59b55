package com.taskboard.actions;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls action descriptors out of untrusted assistant text. Never throws: text with no
 * usable JSON yields an empty list.
 *
 * Attempt order: the whole trimmed text as one JSON value, then the interior of a
 * language-tagged code fence, then every brace-balanced span in the text.
 */
public class ActionParser {

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ActionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.strictReader = this.objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public List<ActionDescriptor> parse(String content) {
        if (content == null) {
            return Collections.emptyList();
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }

        List<ActionDescriptor> direct = fromJson(readObject(trimmed));
        if (!direct.isEmpty()) {
            return direct;
        }

        String fenced = unwrapTaggedFence(trimmed);
        if (fenced != null) {
            List<ActionDescriptor> fromFence = fromJson(readObject(fenced));
            if (!fromFence.isEmpty()) {
                return fromFence;
            }
        }

        List<ActionDescriptor> results = new ArrayList<>();
        for (String span : braceSpans(trimmed)) {
            results.addAll(fromJson(readObject(span)));
        }
        return results;
    }

    private JsonNode readObject(String text) {
        try {
            JsonNode node = strictReader.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (Exception e) {
            return null;
        }
    }

    /**
     * An object with an {@code action} field is one descriptor; an object with an
     * {@code actions} array contributes one descriptor per element.
     */
    private List<ActionDescriptor> fromJson(JsonNode node) {
        if (node == null) {
            return Collections.emptyList();
        }
        JsonNode actions = node.get("actions");
        if (actions != null && actions.isArray()) {
            List<ActionDescriptor> results = new ArrayList<>();
            for (JsonNode element : actions) {
                ActionDescriptor descriptor = toDescriptor(element);
                if (descriptor != null) {
                    results.add(descriptor);
                }
            }
            return results;
        }
        ActionDescriptor descriptor = toDescriptor(node);
        return descriptor != null ? Collections.singletonList(descriptor) : Collections.emptyList();
    }

    private ActionDescriptor toDescriptor(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode actionNode = node.get("action");
        if (actionNode == null || !actionNode.isTextual()) {
            return null;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        JsonNode paramsNode = node.get("params");
        if (paramsNode != null && paramsNode.isObject()) {
            Iterable<Map.Entry<String, JsonNode>> fields = paramsNode::fields;
            for (Map.Entry<String, JsonNode> field : fields) {
                params.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
        JsonNode messageNode = node.get("message");
        String message = messageNode != null && messageNode.isTextual() ? messageNode.asText() : null;
        return ActionDescriptor.of(actionNode.asText(), params, message);
    }

    /**
     * Interior of the first fence whose opening line carries a language tag, e.g. {@code ```json}.
     */
    private String unwrapTaggedFence(String text) {
        int open = text.indexOf("```");
        while (open >= 0) {
            int lineEnd = text.indexOf('\n', open);
            if (lineEnd < 0) {
                return null;
            }
            String tag = text.substring(open + 3, lineEnd).trim();
            int close = text.indexOf("```", lineEnd + 1);
            if (close < 0) {
                return null;
            }
            if (!tag.isEmpty()) {
                return text.substring(lineEnd + 1, close).trim();
            }
            open = text.indexOf("```", close + 3);
        }
        return null;
    }

    /**
     * Top-level brace-balanced spans, left to right. Braces inside JSON string literals are
     * ignored. Scanning stops at an opening brace that never closes.
     */
    List<String> braceSpans(String text) {
        List<String> spans = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            int start = text.indexOf('{', index);
            if (start < 0) {
                break;
            }
            int end = matchingBrace(text, start);
            if (end < 0) {
                break;
            }
            spans.add(text.substring(start, end + 1));
            index = end + 1;
        }
        return spans;
    }

    private int matchingBrace(String text, int start) {
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
