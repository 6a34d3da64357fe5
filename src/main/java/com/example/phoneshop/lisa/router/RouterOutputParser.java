package com.example.phoneshop.lisa.router;

import com.example.phoneshop.lisa.model.RouterDecision;
import com.example.phoneshop.lisa.util.CodeFenceUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns raw classifier text into a {@link RouterDecision}. Extraction takes the leftmost balanced
 * {@code {...}} block after removing code fences; parsing tolerates Python
 * literals, single quotes and trailing commas; validation tries chat, retrieval, comparison in
 * that order and the first shape that fits wins.
 */
public class RouterOutputParser {

    private static final Pattern PY_NONE = Pattern.compile("\\bNone\\b");
    private static final Pattern PY_TRUE = Pattern.compile("\\bTrue\\b");
    private static final Pattern PY_FALSE = Pattern.compile("\\bFalse\\b");

    private final ObjectMapper strict = new ObjectMapper();
    private final ObjectMapper lenient = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();

    public record ParseResult(RouterDecision decision, String error) {
        static ParseResult ok(RouterDecision d) {
            return new ParseResult(d, null);
        }

        static ParseResult failed(String error) {
            return new ParseResult(null, error);
        }

        public boolean isValid() {
            return decision != null;
        }
    }

    public ParseResult parse(String raw) {
        String block = extractJsonObject(raw);
        if (block == null) {
            return ParseResult.failed("no JSON object in output");
        }
        JsonNode node;
        try {
            node = load(block);
        } catch (JsonProcessingException e) {
            return ParseResult.failed("unparseable JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            return ParseResult.failed("JSON is not an object");
        }

        List<String> errors = new ArrayList<>(3);
        RouterDecision d = asChat(node, errors);
        if (d == null) {
            d = asRetrieval(node, errors);
        }
        if (d == null) {
            d = asComparison(node, errors);
        }
        return d != null ? ParseResult.ok(d) : ParseResult.failed(String.join("; ", errors));
    }

    static String extractJsonObject(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        String t = CodeFenceUtils.stripFences(text);
        // single pass; quotes only count inside braces so prose apostrophes are ignored
        Deque<Integer> open = new ArrayDeque<>();
        int bestStart = -1;
        int bestEnd = -1;
        char quote = 0;
        boolean escaped = false;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '{') {
                open.push(i);
            } else if (c == '}' && !open.isEmpty()) {
                int start = open.pop();
                if (bestStart < 0 || start < bestStart) {
                    bestStart = start;
                    bestEnd = i;
                }
                if (open.isEmpty()) {
                    return t.substring(bestStart, bestEnd + 1);
                }
            } else if ((c == '"' || c == '\'') && !open.isEmpty()) {
                quote = c;
            }
        }
        return bestStart < 0 ? null : t.substring(bestStart, bestEnd + 1);
    }

    JsonNode load(String block) throws JsonProcessingException {
        try {
            return strict.readTree(block);
        } catch (JsonProcessingException first) {
            String t = block.strip();
            t = PY_NONE.matcher(t).replaceAll("null");
            t = PY_TRUE.matcher(t).replaceAll("true");
            t = PY_FALSE.matcher(t).replaceAll("false");
            return lenient.readTree(t);
        }
    }

    private static RouterDecision asChat(JsonNode node, List<String> errors) {
        if (!"chat".equals(node.path("router").asText(null))) {
            errors.add("chat: router must be 'chat'");
            return null;
        }
        JsonNode infor = node.get("infor");
        if (infor == null || !infor.isTextual()) {
            errors.add("chat: infor must be a string");
            return null;
        }
        return new RouterDecision.Chat(infor.asText());
    }

    private static RouterDecision asRetrieval(JsonNode node, List<String> errors) {
        if (!"retrieval".equals(node.path("router").asText(null))) {
            errors.add("retrieval: router must be 'retrieval'");
            return null;
        }
        JsonNode infor = node.get("infor");
        if (infor == null || !infor.isTextual() || infor.asText().isBlank()) {
            errors.add("retrieval: infor must be non-empty");
            return null;
        }
        return new RouterDecision.Retrieval(infor.asText());
    }

    private static RouterDecision asComparison(JsonNode node, List<String> errors) {
        if (!"comparison".equals(node.path("router").asText(null))) {
            errors.add("comparison: router must be 'comparison'");
            return null;
        }
        JsonNode products = node.get("products");
        if (products == null || !products.isArray()) {
            errors.add("comparison: products must be a list");
            return null;
        }
        LinkedHashSet<String> names = new LinkedHashSet<>();
        for (JsonNode p : products) {
            if (p.isTextual()) {
                names.add(p.asText());
            }
        }
        try {
            return new RouterDecision.Comparison(names);
        } catch (IllegalArgumentException e) {
            errors.add("comparison: " + e.getMessage());
            return null;
        }
    }
}
