package tech.yump.auditlog.audit;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Conceals sensitive values in JSON bodies before they reach the audit trail.
 * <p>
 * Two passes run over a parsed object body:
 * <ol>
 *     <li>for Secret resource paths, every value of the {@code data} object (or, failing that,
 *     {@code stringData}) is replaced by {@link RedactionPolicy#REDACTED};</li>
 *     <li>every string value whose key matches the sensitive-key pattern is replaced, at any depth.</li>
 * </ol>
 * A body that cannot be parsed as a JSON object is returned untouched, and so is a body
 * neither pass changed, byte for byte. A body with duplicate keys is always re-serialized,
 * keeping the last value of each key, so that earlier values never reach the record.
 */
@Slf4j
public class RedactionEngine {

    private final RedactionPolicy policy;
    private final JsonFactory jsonFactory;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    public RedactionEngine(ObjectMapper objectMapper, RedactionPolicy policy) {
        this.policy = policy;
        ObjectMapper mapper = AuditJson.withReadLimits(objectMapper, AuditJson.MAX_BODY_NESTING_DEPTH);
        this.jsonFactory = mapper.getFactory();
        // Exact decimals so that re-serialized numbers keep their written form
        this.reader = mapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .with(JsonNodeFactory.withExactBigDecimals(true));
        this.writer = mapper.writer();
    }

    public RedactionPolicy policy() {
        return policy;
    }

    /**
     * @param path request path, used to recognise Secret resources.
     * @param body raw JSON body.
     * @return the redacted body, or {@code body} itself when nothing had to change.
     * @throws AuditWriteException if a redacted body cannot be serialized again.
     */
    public byte[] redact(String path, byte[] body) {
        if (body == null || body.length == 0) {
            return body;
        }

        JsonNode tree;
        try {
            tree = reader.readTree(body);
        } catch (IOException e) {
            log.debug("Body for {} is not valid JSON, leaving it unredacted: {}", path, e.getMessage());
            return body;
        }
        if (tree == null || !tree.isObject()) {
            return body;
        }

        ObjectNode root = (ObjectNode) tree;
        boolean changed = policy.isSecretPath(path) && redactSecretData(root);
        // Both passes must run; do not short-circuit the key pass
        changed = redactSensitiveKeys(root) || changed;
        if (!changed && !hasDuplicateKeys(path, body)) {
            return body;
        }

        try {
            return writer.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new AuditWriteException("Failed to serialize redacted body for " + path, e);
        }
    }

    /**
     * The tree keeps only the last value of a repeated key, so the raw body is unsafe to return
     * when any object in it repeats a key.
     */
    private boolean hasDuplicateKeys(String path, byte[] body) {
        try (JsonParser parser = jsonFactory.createParser(body)) {
            Deque<Set<String>> objects = new ArrayDeque<>();
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                switch (token) {
                    case START_OBJECT -> objects.push(new HashSet<>());
                    case END_OBJECT -> objects.pop();
                    case FIELD_NAME -> {
                        if (!objects.peek().add(parser.currentName())) {
                            log.debug("Body for {} repeats key '{}', re-serializing it", path, parser.currentName());
                            return true;
                        }
                    }
                    default -> {
                    }
                }
            }
            return false;
        } catch (IOException e) {
            throw new AuditWriteException("Failed to re-read body for " + path, e);
        }
    }

    private boolean redactSecretData(ObjectNode root) {
        JsonNode data = root.get(RedactionPolicy.DATA_KEY);
        if (data == null || !data.isObject()) {
            data = root.get(RedactionPolicy.STRING_DATA_KEY);
        }
        if (data == null || !data.isObject()) {
            return false;
        }

        ObjectNode secretData = (ObjectNode) data;
        boolean changed = false;
        for (String name : fieldNames(secretData)) {
            if (!isRedacted(secretData.get(name))) {
                secretData.put(name, RedactionPolicy.REDACTED);
                changed = true;
            }
        }
        return changed;
    }

    private boolean redactSensitiveKeys(ObjectNode node) {
        boolean changed = false;
        for (String name : fieldNames(node)) {
            JsonNode value = node.get(name);
            if (value.isTextual()) {
                if (policy.isSensitiveKey(name) && !isRedacted(value)) {
                    node.put(name, RedactionPolicy.REDACTED);
                    changed = true;
                }
            } else if (value.isObject()) {
                changed = redactSensitiveKeys((ObjectNode) value) || changed;
            } else if (value.isArray()) {
                changed = redactArray((ArrayNode) value) || changed;
            }
        }
        return changed;
    }

    private boolean redactArray(ArrayNode array) {
        boolean changed = false;
        for (JsonNode element : array) {
            if (element.isObject()) {
                changed = redactSensitiveKeys((ObjectNode) element) || changed;
            } else if (element.isArray()) {
                changed = redactArray((ArrayNode) element) || changed;
            }
        }
        return changed;
    }

    private static boolean isRedacted(JsonNode value) {
        return value.isTextual() && RedactionPolicy.REDACTED.equals(value.textValue());
    }

    private static List<String> fieldNames(ObjectNode node) {
        List<String> names = new ArrayList<>(node.size());
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
