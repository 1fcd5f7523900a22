package io.sigmatics.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.sigmatics.core.spec.ValidationResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-model JSON Schemas for runtime parameters, read from the classpath at
 * {@code schemas/models/<name>.json} and cached after first use.
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    /** Hash used in cache keys for models that ship no schema. */
    public static final String NO_SCHEMA = "no-schema";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final String resourceRoot;
    private final ClassLoader classLoader;
    private final Map<String, Optional<JsonNode>> schemas = new ConcurrentHashMap<>();

    public SchemaRegistry() {
        this("schemas/models");
    }

    /**
     * @param resourceRoot classpath directory holding {@code <name>.json} files
     */
    public SchemaRegistry(String resourceRoot) {
        this.resourceRoot = Objects.requireNonNull(resourceRoot, "resourceRoot must not be null");
        this.classLoader = SchemaRegistry.class.getClassLoader();
    }

    public Optional<JsonNode> schema(String modelName) {
        Objects.requireNonNull(modelName, "modelName must not be null");
        return schemas.computeIfAbsent(modelName, this::load);
    }

    /** Short SHA-256 of the model's schema, or {@link #NO_SCHEMA}. */
    public String schemaHash(String modelName) {
        return schema(modelName).map(CacheKeys::jsonHash).orElse(NO_SCHEMA);
    }

    /** Validates runtime parameters against the model's schema; models without one accept anything. */
    public ValidationResult validateParams(String modelName, Map<String, ?> params) {
        Optional<JsonNode> schema = schema(modelName);
        if (schema.isEmpty()) {
            return ValidationResult.ok();
        }
        JsonSchema compiled = SCHEMA_FACTORY.getSchema(schema.get());
        List<String> errors = compiled.validate(toJson(params)).stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .toList();
        return ValidationResult.of(errors);
    }

    public int size() {
        return (int) schemas.values().stream().filter(Optional::isPresent).count();
    }

    private Optional<JsonNode> load(String modelName) {
        String resource = resourceRoot + "/" + modelName + ".json";
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                LOG.debug("No schema for model: model={}, resource={}", modelName, resource);
                return Optional.empty();
            }
            return Optional.of(JSON.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read schema " + resource, e);
        }
    }

    /** Numbers and number lists map to JSON; anything else (such as elements) is rendered as text. */
    private static JsonNode toJson(Map<String, ?> params) {
        ObjectNode node = JSON.createObjectNode();
        if (params == null) {
            return node;
        }
        params.forEach((key, value) -> {
            if (value instanceof Number n) {
                node.put(key, n.longValue());
            } else if (value instanceof int[] array) {
                ArrayNode items = node.putArray(key);
                for (int v : array) {
                    items.add(v);
                }
            } else if (value instanceof Iterable<?> iterable) {
                ArrayNode items = node.putArray(key);
                for (Object v : iterable) {
                    if (v instanceof Number n) {
                        items.add(n.longValue());
                    } else {
                        items.add(String.valueOf(v));
                    }
                }
            } else if (value != null) {
                node.put(key, value.toString());
            }
        });
        return node;
    }
}
