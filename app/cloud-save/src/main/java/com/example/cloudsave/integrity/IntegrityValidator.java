/*
 * どこで: Cloud Save 整合性検証
 * 何を: セーブデータのチェックサム生成・構造検証・既定値による部分復元を行う
 * なぜ: アップロード前とダウンロード後に破損や改ざんを検出し、失われたフィールドだけを補うため
 */
package com.example.cloudsave.integrity;

import com.example.cloudsave.error.IntegrityException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.lang.Nullable;

public class IntegrityValidator {

    public static final String CHECKSUM_FIELD = "_checksum";
    public static final String CHECKSUM_MISMATCH_ERROR =
            "Data checksum mismatch - possible corruption detected";
    public static final String RECOVERY_WARNING =
            "Data recovery attempted - some data may have been restored from defaults";

    static final int MAX_INVENTORY_ITEMS = 1000;
    private static final List<String> REQUIRED_STATS =
            List.of("health", "mana", "strength", "agility", "intelligence", "defense");
    private static final List<String> TRANSIENT_FIELDS = List.of("temporaryData", "sessionData");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IntegrityValidator(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * SHA-256 hex digest of the canonical JSON form (object keys sorted). A textual node is hashed
     * as its raw text.
     */
    public String generateChecksum(JsonNode data) {
        final String serialized;
        try {
            serialized = data != null && data.isTextual()
                    ? data.textValue()
                    : objectMapper.writeValueAsString(canonicalize(data));
        } catch (JsonProcessingException ex) {
            throw new IntegrityException("failed to serialize data for checksum", ex);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHex(digest.digest(serialized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IntegrityException("SHA-256 algorithm not available", ex);
        }
    }

    public boolean verifyChecksum(JsonNode data, String expectedChecksum) {
        return expectedChecksum != null && expectedChecksum.equals(generateChecksum(data));
    }

    public StructureValidationResult validateStructure(
            JsonNode data, SaveDataSchema schema, ValidationOptions options) {
        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        final Set<String> corrupted = new LinkedHashSet<>();

        for (String field : schema.requiredFields()) {
            if (JsonPaths.find(data, field).isEmpty()) {
                errors.add("Missing required field: " + field);
                corrupted.add(field);
            }
        }

        for (Map.Entry<String, FieldKind> entry : schema.fieldKinds().entrySet()) {
            final Optional<JsonNode> value = JsonPaths.find(data, entry.getKey());
            if (value.isPresent() && !entry.getValue().matches(value.get())) {
                errors.add(String.format(
                        "Invalid type for field %s: expected %s, got %s",
                        entry.getKey(), entry.getValue().label(), FieldKind.describe(value.get())));
                corrupted.add(entry.getKey());
            }
        }

        for (Map.Entry<String, FieldConstraint> entry : schema.constraints().entrySet()) {
            final Optional<JsonNode> value = JsonPaths.find(data, entry.getKey());
            if (value.isPresent()) {
                final List<String> violations =
                        checkConstraint(entry.getKey(), value.get(), entry.getValue());
                if (!violations.isEmpty()) {
                    errors.addAll(violations);
                    corrupted.add(entry.getKey());
                }
            }
        }

        for (String deprecated : schema.deprecatedFields()) {
            if (JsonPaths.find(data, deprecated).isPresent()) {
                warnings.add("Deprecated field found: " + deprecated);
            }
        }

        if (options.deepValidation()) {
            validateDeep(data, errors, warnings, corrupted);
        }

        if (options.maxDataSize() != null) {
            final long size = serializedSize(data);
            if (size > options.maxDataSize()) {
                errors.add(String.format(
                        "Data size exceeds limit: %d > %d bytes", size, options.maxDataSize()));
            }
        }
        return new StructureValidationResult(errors, warnings, new ArrayList<>(corrupted));
    }

    public DataIntegrityResult validateDataIntegrity(
            JsonNode data,
            @Nullable String expectedChecksum,
            @Nullable SaveDataSchema schema,
            ValidationOptions options) {
        final SaveDataSchema effectiveSchema = schema == null ? SaveDataSchema.gameStateDefault() : schema;
        final String checksum = generateChecksum(data);
        final boolean checksumValid = expectedChecksum == null || expectedChecksum.equals(checksum);

        final StructureValidationResult structure = validateStructure(data, effectiveSchema, options);
        final List<String> errors = new ArrayList<>(structure.errors());
        final List<String> warnings = new ArrayList<>(structure.warnings());
        final List<String> corrupted = new ArrayList<>(structure.corruptedFields());
        if (!checksumValid) {
            errors.add(0, CHECKSUM_MISMATCH_ERROR);
            corrupted.add(CHECKSUM_FIELD);
        }
        final boolean valid = errors.isEmpty() && (!options.strictMode() || warnings.isEmpty());

        JsonNode recoveredData = null;
        if (!valid && options.enableRecovery()) {
            final RecoveryResult recovery = attemptRecovery(data, corrupted, effectiveSchema);
            warnings.addAll(recovery.warnings());
            if (recovery.recovered()) {
                recoveredData = recovery.data();
            }
        }
        return new DataIntegrityResult(
                valid, checksum, errors, warnings, corrupted, recoveredData, effectiveSchema);
    }

    /** Recovers with the defaults of the schema {@code priorResult} was validated against. */
    public RecoveryResult attemptRecovery(JsonNode corruptedData, DataIntegrityResult priorResult) {
        return attemptRecovery(corruptedData, priorResult.corruptedFields(), priorResult.schema());
    }

    /**
     * Replaces each corrupted path that has a schema default. Every other field is left untouched
     * and the input is never mutated.
     */
    public RecoveryResult attemptRecovery(
            JsonNode corruptedData, List<String> corruptedFields, SaveDataSchema schema) {
        if (!(corruptedData instanceof ObjectNode source)) {
            return new RecoveryResult(false, corruptedData, List.of(), List.of(RECOVERY_WARNING));
        }
        final ObjectNode recovered = source.deepCopy();
        final List<String> restored = new ArrayList<>();
        for (String field : corruptedFields) {
            final JsonNode fallback = schema.defaults().get(field);
            if (fallback != null) {
                JsonPaths.set(recovered, field, fallback.deepCopy());
                restored.add(field);
            }
        }
        return new RecoveryResult(!restored.isEmpty(), recovered, restored, List.of(RECOVERY_WARNING));
    }

    /**
     * Copy of a game state prepared for upload: transient sections removed, timestamp refreshed and
     * the inventory capped.
     */
    public ObjectNode sanitizeForCloud(JsonNode gameState) {
        if (!(gameState instanceof ObjectNode source)) {
            throw new IllegalArgumentException("Invalid game state: must be a non-null object");
        }
        final ObjectNode sanitized = source.deepCopy();
        sanitized.remove(TRANSIENT_FIELDS);
        sanitized.put("timestamp", clock.instant().toString());
        final JsonNode items = JsonPaths.find(sanitized, "inventory.items").orElse(null);
        if (items instanceof ArrayNode itemArray && itemArray.size() > MAX_INVENTORY_ITEMS) {
            final ArrayNode capped = JsonNodeFactory.instance.arrayNode();
            for (int i = 0; i < MAX_INVENTORY_ITEMS; i++) {
                capped.add(itemArray.get(i));
            }
            ((ObjectNode) sanitized.get("inventory")).set("items", capped);
        }
        return sanitized;
    }

    private void validateDeep(
            JsonNode data, List<String> errors, List<String> warnings, Set<String> corrupted) {
        final JsonNode items = JsonPaths.find(data, "inventory.items").orElse(null);
        if (items != null && items.isArray()) {
            for (int index = 0; index < items.size(); index++) {
                final JsonNode item = items.get(index);
                final String path = "inventory.items[" + index + "]";
                if (item == null || !item.isObject()) {
                    errors.add("Invalid item at " + path);
                    corrupted.add(path);
                    continue;
                }
                final JsonNode id = item.get("id");
                if (id == null || !id.isTextual() || id.textValue().isEmpty()) {
                    errors.add("Missing or invalid item ID at " + path);
                    corrupted.add(path + ".id");
                }
                final JsonNode quantity = item.get("quantity");
                if (quantity == null || !quantity.isNumber() || quantity.doubleValue() < 0) {
                    errors.add("Invalid item quantity at " + path);
                    corrupted.add(path + ".quantity");
                }
            }
        }

        final JsonNode flags = JsonPaths.find(data, "gameFlags").orElse(null);
        if (flags != null && flags.isObject()) {
            final Iterator<Map.Entry<String, JsonNode>> entries = flags.fields();
            while (entries.hasNext()) {
                final Map.Entry<String, JsonNode> flag = entries.next();
                final JsonNode value = flag.getValue();
                if (!value.isBoolean() && !value.isTextual() && !value.isNumber()) {
                    warnings.add("Unusual game flag value type for " + flag.getKey() + ": "
                            + FieldKind.describe(value));
                }
            }
        }

        final JsonNode stats = JsonPaths.find(data, "player.stats").orElse(null);
        if (stats != null && stats.isObject()) {
            for (String stat : REQUIRED_STATS) {
                final JsonNode value = stats.get(stat);
                if (value == null || !value.isNumber() || value.doubleValue() < 0) {
                    errors.add("Invalid or missing player stat: " + stat);
                    corrupted.add("player.stats." + stat);
                }
            }
        }
    }

    private List<String> checkConstraint(String path, JsonNode value, FieldConstraint constraint) {
        final List<String> violations = new ArrayList<>();
        if (value.isNumber()) {
            final double number = value.doubleValue();
            if (constraint.min() != null && number < constraint.min()) {
                violations.add(String.format(
                        "Field %s value %s is below minimum %s", path, value.asText(), format(constraint.min())));
            }
            if (constraint.max() != null && number > constraint.max()) {
                violations.add(String.format(
                        "Field %s value %s exceeds maximum %s", path, value.asText(), format(constraint.max())));
            }
        }
        if (constraint.maxLength() != null) {
            if (value.isArray() && value.size() > constraint.maxLength()) {
                violations.add(String.format(
                        "Field %s array length %d exceeds maximum %d", path, value.size(), constraint.maxLength()));
            } else if (value.isTextual() && value.textValue().length() > constraint.maxLength()) {
                violations.add(String.format(
                        "Field %s length %d exceeds maximum %d",
                        path, value.textValue().length(), constraint.maxLength()));
            }
        }
        return violations;
    }

    private long serializedSize(JsonNode data) {
        try {
            return objectMapper.writeValueAsBytes(data).length;
        } catch (JsonProcessingException ex) {
            throw new IntegrityException("failed to serialize data for size check", ex);
        }
    }

    // キー順を固定し、構造的に同一な入力が常に同じバイト列になるようにする
    private JsonNode canonicalize(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            final TreeMap<String, JsonNode> sorted = new TreeMap<>();
            node.fields().forEachRemaining(entry -> sorted.put(entry.getKey(), canonicalize(entry.getValue())));
            final ObjectNode canonical = JsonNodeFactory.instance.objectNode();
            sorted.forEach(canonical::set);
            return canonical;
        }
        if (node.isArray()) {
            final ArrayNode canonical = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> canonical.add(canonicalize(element)));
            return canonical;
        }
        return node;
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? Long.toString((long) bound) : Double.toString(bound);
    }

    private String toHex(byte[] bytes) {
        StringBuilder builder = new StringBuilder(bytes.length * 2);
        for (byte value : bytes) {
            builder.append(String.format("%02x", value));
        }
        return builder.toString();
    }
}
