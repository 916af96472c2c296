package tech.yump.auditlog.audit;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Turns an {@link AuditRecord} and its already-redacted body fragments into one compact,
 * newline-terminated JSON line.
 * <p>
 * The record is serialized with its closing brace removed, the body fragments are appended
 * verbatim as JSON values, and the result is re-emitted token by token. That last pass both
 * compacts the line and rejects it if any fragment was not valid JSON.
 */
public class RecordAssembler {

    private static final byte[] REQUEST_BODY_FIELD = ",\"requestBody\":".getBytes(StandardCharsets.UTF_8);
    private static final byte[] RESPONSE_BODY_FIELD = ",\"responseBody\":".getBytes(StandardCharsets.UTF_8);

    private final ObjectMapper objectMapper;
    private final JsonFactory jsonFactory;

    public RecordAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.jsonFactory = AuditJson.withReadLimits(objectMapper, AuditJson.MAX_BODY_NESTING_DEPTH + 1).getFactory();
    }

    /**
     * @param requestBody  redacted request body, embedded when {@code level} includes {@link AuditLevel#REQUEST}.
     * @param responseBody redacted JSON response body, embedded when {@code level} includes
     *                     {@link AuditLevel#REQUEST_RESPONSE}. Callers pass null for non-JSON responses.
     * @throws AuditWriteException if the record cannot be serialized or the assembled line is not valid JSON.
     */
    public byte[] assemble(AuditRecord record, byte[] requestBody, byte[] responseBody, AuditLevel level) {
        byte[] serialized;
        try {
            serialized = objectMapper.writeValueAsBytes(record);
        } catch (IOException e) {
            throw new AuditWriteException("Failed to serialize audit record " + record.auditId(), e);
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream(serialized.length + 256);
        int open = lastIndexOf(serialized, (byte) '}');
        if (open < 0) {
            throw new AuditWriteException("Serialized audit record " + record.auditId() + " is not a JSON object");
        }
        buffer.write(serialized, 0, open);
        boolean emptyObject = isEmptyObject(serialized, open);

        if (level.includes(AuditLevel.REQUEST)) {
            emptyObject = appendFragment(buffer, REQUEST_BODY_FIELD, requestBody, emptyObject);
        }
        if (level.includes(AuditLevel.REQUEST_RESPONSE)) {
            appendFragment(buffer, RESPONSE_BODY_FIELD, responseBody, emptyObject);
        }
        buffer.write('}');

        byte[] compact = compact(buffer.toByteArray(), record.auditId());
        byte[] line = Arrays.copyOf(compact, compact.length + 1);
        line[compact.length] = '\n';
        return line;
    }

    private static boolean appendFragment(ByteArrayOutputStream buffer, byte[] field, byte[] fragment, boolean emptyObject) {
        int length = trimmedLength(fragment);
        if (length == 0) {
            return emptyObject;
        }
        // Drop the leading comma when the fragment is the first member
        int offset = emptyObject ? 1 : 0;
        buffer.write(field, offset, field.length - offset);
        buffer.write(fragment, 0, length);
        return false;
    }

    /**
     * Re-emits {@code json} without insignificant whitespace. Number literals are copied as written.
     */
    private byte[] compact(byte[] json, String auditId) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(json.length);
        try (JsonParser parser = jsonFactory.createParser(json);
             JsonGenerator generator = jsonFactory.createGenerator(out)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new AuditWriteException("Assembled audit record " + auditId + " is empty");
            }
            int depth = 0;
            do {
                depth = copyToken(parser, generator, token, depth);
                if (depth == 0) {
                    break;
                }
                token = parser.nextToken();
            } while (token != null);
            if (depth != 0 || parser.nextToken() != null) {
                throw new AuditWriteException("Assembled audit record " + auditId + " is not a single JSON value");
            }
        } catch (IOException e) {
            throw new AuditWriteException("Compact audit log json failed for record " + auditId, e);
        }
        return out.toByteArray();
    }

    private static int copyToken(JsonParser parser, JsonGenerator generator, JsonToken token, int depth) throws IOException {
        switch (token) {
            case START_OBJECT -> {
                generator.writeStartObject();
                return depth + 1;
            }
            case END_OBJECT -> {
                generator.writeEndObject();
                return depth - 1;
            }
            case START_ARRAY -> {
                generator.writeStartArray();
                return depth + 1;
            }
            case END_ARRAY -> {
                generator.writeEndArray();
                return depth - 1;
            }
            case FIELD_NAME -> generator.writeFieldName(parser.currentName());
            case VALUE_STRING -> generator.writeString(parser.getText());
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> generator.writeNumber(parser.getText());
            case VALUE_TRUE -> generator.writeBoolean(true);
            case VALUE_FALSE -> generator.writeBoolean(false);
            case VALUE_NULL -> generator.writeNull();
            default -> throw new AuditWriteException("Unexpected token " + token + " in assembled audit record");
        }
        return depth;
    }

    private static boolean isEmptyObject(byte[] serialized, int closingBrace) {
        for (int i = closingBrace - 1; i >= 0; i--) {
            if (!isWhitespace(serialized[i])) {
                return serialized[i] == '{';
            }
        }
        return false;
    }

    private static int trimmedLength(byte[] fragment) {
        if (fragment == null) {
            return 0;
        }
        int length = fragment.length;
        while (length > 0 && isWhitespace(fragment[length - 1])) {
            length--;
        }
        return length;
    }

    private static int lastIndexOf(byte[] bytes, byte b) {
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] == b) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\n' || b == '\r' || b == '\t';
    }
}
