package io.sigmatics.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.sigmatics.core.model.BackendPreference;
import io.sigmatics.core.model.ModelDescriptor;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives cache keys for compiled models. Pure: the same descriptor, schema hash and options always
 * give the same key, whatever the insertion order of the compiled parameters.
 *
 * <p>Format: {@code namespace/name@version#schemaHash:compiledHash}. The compiled hash covers
 * everything that shapes the artifact: compiled parameters, backend preference, complexity hint,
 * runtime parameter names, and the compiler's default preference and folding switch.
 */
public final class CacheKeys {

    /** Hex digits kept from each SHA-256 digest. */
    static final int HASH_LENGTH = 16;

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private CacheKeys() {}

    public static String derive(ModelDescriptor descriptor, String schemaHash) {
        return derive(descriptor, schemaHash, CompilerOptions.DEFAULT);
    }

    public static String derive(ModelDescriptor descriptor, String schemaHash, CompilerOptions options) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(schemaHash, "schemaHash must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return descriptor.namespace() + "/" + descriptor.name() + "@" + descriptor.version()
                + "#" + schemaHash + ":" + compiledHash(settings(descriptor, options));
    }

    private static Map<String, Object> settings(ModelDescriptor descriptor, CompilerOptions options) {
        List<String> runtime = new ArrayList<>(descriptor.runtime());
        Collections.sort(runtime);
        BackendPreference preference =
                descriptor.preference() != null ? descriptor.preference() : options.defaultPreference();
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("compiled", descriptor.compiled());
        settings.put("preference", preference.id());
        settings.put("complexityHint", descriptor.complexityHint());
        settings.put("runtime", runtime);
        settings.put("constantFolding", options.constantFolding());
        return settings;
    }

    /** Hash of a parameter map in canonical (key-sorted) JSON form. */
    public static String compiledHash(Map<String, Object> compiled) {
        try {
            return sha256(CANONICAL.writeValueAsString(compiled));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("compiled parameters are not serializable: " + e.getMessage(), e);
        }
    }

    /** Hash of a JSON document, independent of object key order. */
    static String jsonHash(JsonNode node) {
        try {
            Object plain = CANONICAL.treeToValue(node, Object.class);
            return sha256(CANONICAL.writeValueAsString(plain));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("document is not serializable: " + e.getMessage(), e);
        }
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
