package com.example.techsewa.knowledge;

import com.example.techsewa.lang.Languages;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads and writes the persisted knowledge-base format:
 * <pre>
 * [ { "id": "...", "aliases": [...], "np_aliases": [...], "en": "...", "np": "...",
 *     "auto_fix": false, "learned": false }, ... ]
 * </pre>
 * {@code aliases} holds the English phrases; any other language uses {@code <lang>_aliases}.
 * Answer fields are keyed by their bare language code.
 */
public class KnowledgeBaseCodec {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseCodec.class);

    static final String ID = "id";
    static final String ALIASES = "aliases";
    static final String ALIASES_SUFFIX = "_aliases";
    static final String AUTO_FIX = "auto_fix";
    static final String LEARNED = "learned";

    private static final Pattern LANG_CODE = Pattern.compile("^[a-z]{2,3}$");

    private final ObjectMapper mapper;

    public KnowledgeBaseCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Parse a payload.  Fails when the payload is not a JSON array; individual
     * malformed entries are logged and skipped.
     */
    public List<ProblemRecord> decode(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new KnowledgeBaseFormatException("Knowledge base is not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new KnowledgeBaseFormatException("Knowledge base must be a JSON array of records");
        }
        List<ProblemRecord> out = new ArrayList<>(root.size());
        int i = 0;
        for (JsonNode node : root) {
            try {
                out.add(decodeRecord(node));
            } catch (IllegalArgumentException e) {
                log.warn("[KB] skipping record #{}: {}", i, e.getMessage());
            }
            i++;
        }
        return out;
    }

    ProblemRecord decodeRecord(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("not an object");
        }
        ProblemRecord.ProblemRecordBuilder b = ProblemRecord.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            String name = f.getKey();
            JsonNode value = f.getValue();
            if (ALIASES.equals(name)) {
                b.alias(Languages.EN, textArray(name, value));
            } else if (name.endsWith(ALIASES_SUFFIX)) {
                String lang = name.substring(0, name.length() - ALIASES_SUFFIX.length());
                b.alias(lang, textArray(name, value));
            } else if (LANG_CODE.matcher(name).matches() && !ID.equals(name)) {
                if (!value.isTextual()) {
                    throw new IllegalArgumentException("answer '" + name + "' is not a string");
                }
                b.answer(name, value.asText());
            }
        }
        JsonNode en = node.get(Languages.EN);
        if (en == null || !en.isTextual() || en.asText().isBlank()) {
            throw new IllegalArgumentException("missing 'en' answer");
        }
        b.autoFix(node.path(AUTO_FIX).asBoolean(false));
        b.learned(node.path(LEARNED).asBoolean(false));

        ProblemRecord draft = b.build();
        if (!draft.hasAnyAlias()) {
            throw new IllegalArgumentException("record has no aliases");
        }
        JsonNode id = node.get(ID);
        String resolvedId = (id != null && id.isTextual() && !id.asText().isBlank())
                ? id.asText()
                : ProblemIds.forQuery(draft.firstAlias());
        return draft.toBuilder().id(resolvedId).build();
    }

    public String encode(List<ProblemRecord> records) {
        ArrayNode root = mapper.createArrayNode();
        for (ProblemRecord r : records) {
            root.add(encodeRecord(r));
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // ObjectNode trees always serialise; reaching here means a broken mapper.
            throw new IllegalStateException("Could not serialise knowledge base", e);
        }
    }

    ObjectNode encodeRecord(ProblemRecord r) {
        ObjectNode n = mapper.createObjectNode();
        n.put(ID, r.getId());
        r.getAliases().forEach((lang, list) -> {
            ArrayNode arr = n.putArray(Languages.EN.equals(lang) ? ALIASES : lang + ALIASES_SUFFIX);
            list.forEach(arr::add);
        });
        r.getAnswers().forEach(n::put);
        n.put(AUTO_FIX, r.isAutoFix());
        n.put(LEARNED, r.isLearned());
        return n;
    }

    private static List<String> textArray(String field, JsonNode value) {
        if (!value.isArray()) {
            throw new IllegalArgumentException("'" + field + "' is not an array");
        }
        List<String> out = new ArrayList<>(value.size());
        for (JsonNode v : value) {
            if (!v.isTextual()) {
                throw new IllegalArgumentException("'" + field + "' contains a non-string alias");
            }
            out.add(v.asText());
        }
        return out;
    }
}
