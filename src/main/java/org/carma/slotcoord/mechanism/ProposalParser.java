package org.carma.slotcoord.mechanism;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carma.slotcoord.model.RawProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Pulls a slot list out of a free-text decision source reply.
 *
 * Replies are assumed unreliable. Parsing steps:
 * 1. Take the first balanced {@code {...}} substring (string literal aware)
 * 2. Strict JSON parse
 * 3. On failure, normalize once (quotes, full-width punctuation, bare keys,
 *    trailing commas, semicolons) and parse again
 * 4. Read the list under {@code slots}, then {@code channels}, then the
 *    first array-valued field
 *
 * Anything that does not survive these steps yields an unusable proposal;
 * this class never throws on reply content.
 */
public class ProposalParser {

    private static final Logger log = LoggerFactory.getLogger(ProposalParser.class);

    public static final List<String> PREFERRED_KEYS = List.of("slots", "channels");

    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");

    private final ObjectMapper mapper;

    public ProposalParser() {
        this(new ObjectMapper());
    }

    public ProposalParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parse a reply into raw slot entries.
     */
    public RawProposal parse(String response) {
        if (response == null || response.isBlank()) {
            return RawProposal.unusable("empty reply");
        }

        String candidate = extractFirstObject(response);
        if (candidate == null) {
            return RawProposal.unusable("no brace-delimited object in reply");
        }

        JsonNode node = tryParse(candidate);
        if (node == null) {
            String normalized = normalize(candidate);
            log.debug("Strict parse failed, retrying normalized: {}", normalized);
            node = tryParse(normalized);
        }
        if (node == null || !node.isObject()) {
            return RawProposal.unusable("object is not valid JSON: " + abbreviate(candidate));
        }

        JsonNode list = findSlotList(node);
        if (list == null) {
            return RawProposal.unusable("no slot list in " + abbreviate(candidate));
        }

        List<Object> entries = new ArrayList<>();
        for (JsonNode element : list) {
            if (element.isNumber()) {
                entries.add(element.numberValue());
            } else if (element.isTextual()) {
                entries.add(element.textValue());
            } else {
                entries.add(element.toString());
            }
        }
        return RawProposal.of(entries);
    }

    // ========================================================================
    // Extraction
    // ========================================================================

    /**
     * First balanced brace-delimited substring, or null if none closes.
     */
    static String extractFirstObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) return null;

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
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }

    /**
     * Repairs the usual ways generated "JSON" goes wrong.
     */
    static String normalize(String json) {
        String s = json
            .replace('“', '"').replace('”', '"')
            .replace('„', '"').replace('″', '"')
            .replace('‘', '"').replace('’', '"')
            .replace('\'', '"')
            .replace('，', ',').replace('、', ',')
            .replace('：', ':')
            .replace(";", "");
        s = quoteBareKeys(s);
        s = TRAILING_COMMA.matcher(s).replaceAll("$1");
        return s;
    }

    /**
     * Quotes identifiers used as keys after {@code {} or {@code ,}. Text
     * inside string literals is copied unchanged.
     */
    static String quoteBareKeys(String json) {
        StringBuilder out = new StringBuilder(json.length() + 16);
        boolean inString = false;
        boolean escaped = false;
        char lastToken = 0;
        int i = 0;
        while (i < json.length()) {
            char c = json.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                    lastToken = c;
                }
                i++;
                continue;
            }
            if ((lastToken == '{' || lastToken == ',') && isKeyStart(c)) {
                int end = i + 1;
                while (end < json.length() && isKeyPart(json.charAt(end))) end++;
                int next = end;
                while (next < json.length() && Character.isWhitespace(json.charAt(next))) next++;
                boolean isKey = next < json.length() && json.charAt(next) == ':';
                if (isKey) out.append('"');
                out.append(json, i, end);
                if (isKey) out.append('"');
                lastToken = json.charAt(end - 1);
                i = end;
                continue;
            }
            if (c == '"') {
                inString = true;
            }
            out.append(c);
            if (!Character.isWhitespace(c)) {
                lastToken = c;
            }
            i++;
        }
        return out.toString();
    }

    private static boolean isKeyStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isKeyPart(char c) {
        return isKeyStart(c) || (c >= '0' && c <= '9') || c == '-';
    }

    private JsonNode tryParse(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.trace("JSON parse failed: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static JsonNode findSlotList(JsonNode object) {
        for (String key : PREFERRED_KEYS) {
            JsonNode value = object.get(key);
            if (value != null && value.isArray()) {
                return value;
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value.isArray()) {
                return value;
            }
        }
        return null;
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
