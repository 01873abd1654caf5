package com.netcourier.enrichment.service.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Turns JSON-like text produced by the generation stage into a schema-valid object.
 *
 * <p>The unit is stateless: every call either yields a {@link RecoveryResult.Valid} holding a
 * complete object or an error variant; nothing partial escapes.</p>
 */
@Component
public class JsonRecoveryUnit {

    private static final Logger log = LoggerFactory.getLogger(JsonRecoveryUnit.class);
    private static final int MAX_CANDIDATES = 5;
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private static final List<UnaryOperator<String>> REPAIRS = List.of(
            JsonRepairs::normaliseQuotes,
            JsonRepairs::removeTrailingCommas,
            JsonRepairs::insertMissingCommas,
            JsonRepairs::closeOpenStructures
    );

    private final ObjectMapper strictMapper;
    private final ObjectMapper lenientMapper;

    public JsonRecoveryUnit() {
        this.strictMapper = JsonMapper.builder().build();
        this.lenientMapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
                .build();
    }

    public RecoveryResult recover(String rawText, OutputSchema schema) {
        if (rawText == null || rawText.isBlank()) {
            return new RecoveryResult.Unparseable("generation returned no text");
        }
        List<String> candidates = JsonRepairs.candidates(JsonRepairs.stripCodeFences(rawText));
        if (candidates.isEmpty()) {
            return new RecoveryResult.Unparseable("no JSON object or array found");
        }
        RecoveryResult firstMismatch = null;
        for (String candidate : candidates.subList(0, Math.min(MAX_CANDIDATES, candidates.size()))) {
            JsonNode parsed = parseWithRepairs(candidate);
            if (parsed == null) {
                continue;
            }
            RecoveryResult result = validate(parsed, schema);
            if (result.isValid()) {
                return result;
            }
            if (firstMismatch == null) {
                firstMismatch = result;
            }
        }
        if (firstMismatch != null) {
            return firstMismatch;
        }
        return new RecoveryResult.Unparseable("no balanced JSON could be recovered");
    }

    private JsonNode parseWithRepairs(String candidate) {
        JsonNode parsed = tryParse(strictMapper, candidate);
        if (parsed != null) {
            return parsed;
        }
        parsed = tryParse(lenientMapper, candidate);
        if (parsed != null) {
            log.debug("Recovered generation output with lenient parsing");
            return parsed;
        }
        String repaired = candidate;
        for (UnaryOperator<String> repair : REPAIRS) {
            repaired = repair.apply(repaired);
            if (repaired == null) {
                return null;
            }
            parsed = tryParse(lenientMapper, repaired);
            if (parsed != null) {
                log.debug("Recovered generation output after textual repair");
                return parsed;
            }
        }
        return null;
    }

    private JsonNode tryParse(ObjectMapper mapper, String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node != null && node.isContainerNode() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private RecoveryResult validate(JsonNode parsed, OutputSchema schema) {
        JsonNode root = parsed;
        if (root.isArray()) {
            if (schema.rootArrayField() != null) {
                ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
                wrapper.set(schema.rootArrayField(), root);
                root = wrapper;
            } else if (root.size() == 1 && root.get(0).isObject()) {
                root = root.get(0);
            } else {
                return new RecoveryResult.SchemaMismatch(schema.name() + " expects an object, got an array");
            }
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldSpec spec : schema.fields()) {
            JsonNode node = findField(root, spec.name());
            if (node == null || node.isNull() || node.isMissingNode()) {
                return new RecoveryResult.SchemaMismatch("missing field '" + spec.name() + "'");
            }
            try {
                fields.put(spec.name(), coerce(spec, node));
            } catch (SchemaViolation violation) {
                return new RecoveryResult.SchemaMismatch(violation.getMessage());
            }
        }
        return new RecoveryResult.Valid(new ValidatedObject(schema.name(), fields));
    }

    private JsonNode findField(JsonNode root, String name) {
        JsonNode exact = root.get(name);
        if (exact != null) {
            return exact;
        }
        String wanted = canonicalKey(name);
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (canonicalKey(entry.getKey()).equals(wanted)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private String canonicalKey(String key) {
        return key.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]", "");
    }

    private Object coerce(FieldSpec spec, JsonNode node) throws SchemaViolation {
        return switch (spec.type()) {
            case STRING -> coerceString(spec, node);
            case STRING_ARRAY -> boundItems(spec, coerceStrings(spec, node, false));
            case STRING_SET -> boundItems(spec, coerceStrings(spec, node, true));
            case ENTITY_ARRAY -> boundItems(spec, coerceEntities(spec, node));
        };
    }

    private String coerceString(FieldSpec spec, JsonNode node) throws SchemaViolation {
        JsonNode value = node;
        if (value.isArray() && value.size() == 1) {
            value = value.get(0);
        }
        if (!value.isValueNode()) {
            throw new SchemaViolation("field '" + spec.name() + "' must be a string");
        }
        String text = value.asText().strip();
        if (text.isEmpty()) {
            throw new SchemaViolation("field '" + spec.name() + "' is blank");
        }
        if (!spec.allowedValues().isEmpty()) {
            String normalised = text.toLowerCase(Locale.ROOT);
            if (!spec.allowedValues().contains(normalised)) {
                throw new SchemaViolation("field '" + spec.name() + "' has unsupported value '" + text + "'");
            }
            return normalised;
        }
        if (spec.max() > 0) {
            String[] sentences = SENTENCE_BOUNDARY.split(text);
            if (sentences.length > spec.max()) {
                return String.join(" ", List.of(sentences).subList(0, spec.max()));
            }
        }
        return text;
    }

    private List<String> coerceStrings(FieldSpec spec, JsonNode node, boolean distinct) throws SchemaViolation {
        List<JsonNode> items = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(items::add);
        } else {
            items.add(node);
        }
        List<String> values = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode item : items) {
            JsonNode scalar = item;
            if (item.isObject() && item.size() == 1) {
                scalar = item.elements().next();
            }
            if (!scalar.isValueNode() || scalar.isNull()) {
                throw new SchemaViolation("field '" + spec.name() + "' must contain strings");
            }
            String text = scalar.asText().strip();
            if (text.isEmpty()) {
                continue;
            }
            if (distinct && !seen.add(text.toLowerCase(Locale.ROOT))) {
                continue;
            }
            values.add(text);
        }
        return values;
    }

    private List<Map<String, String>> coerceEntities(FieldSpec spec, JsonNode node) throws SchemaViolation {
        List<JsonNode> items = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(items::add);
        } else if (node.isObject()) {
            items.add(node);
        } else {
            throw new SchemaViolation("field '" + spec.name() + "' must be an array of entities");
        }
        List<Map<String, String>> entities = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.isObject()) {
                throw new SchemaViolation("field '" + spec.name() + "' must contain objects");
            }
            String name = firstText(item, "name", "text");
            String type = firstText(item, "type", "label");
            if (name == null || type == null) {
                throw new SchemaViolation("entity in '" + spec.name() + "' needs name and type");
            }
            Map<String, String> entity = Map.of("name", name, "type", type);
            if (!entities.contains(entity)) {
                entities.add(entity);
            }
        }
        return entities;
    }

    private String firstText(JsonNode item, String... keys) {
        for (String key : keys) {
            JsonNode value = findField(item, key);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return value.asText().strip();
            }
        }
        return null;
    }

    private <T> List<T> boundItems(FieldSpec spec, List<T> values) throws SchemaViolation {
        if (values.size() < spec.min()) {
            throw new SchemaViolation("field '" + spec.name() + "' needs at least " + spec.min() + " entries, got " + values.size());
        }
        if (values.size() > spec.max()) {
            return List.copyOf(values.subList(0, spec.max()));
        }
        return List.copyOf(values);
    }

    private static final class SchemaViolation extends Exception {

        SchemaViolation(String message) {
            super(message, null, false, false);
        }
    }
}
