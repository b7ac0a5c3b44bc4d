package io.cadence.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cadence.core.config.model.CadenceConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link CadenceConfig} from JSON. Values present in the file override the defaults key by
 * key, so a file only needs the settings it changes. Arrays replace the default array whole.
 */
public final class ConfigService {
    private final ObjectMapper mapper = new ObjectMapper();

    public CadenceConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return CadenceConfig.defaults();
        }
        String json = Files.readString(configPath);
        if (json.isBlank()) {
            return CadenceConfig.defaults();
        }

        JsonNode overrides;
        try {
            overrides = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IOException("Config " + configPath + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!overrides.isObject()) {
            throw new IOException("Config " + configPath + " must be a JSON object");
        }

        ObjectNode merged = mapper.valueToTree(CadenceConfig.defaults());
        overlay(merged, (ObjectNode) overrides);
        return mapper.treeToValue(merged, CadenceConfig.class);
    }

    public void save(Path configPath, CadenceConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path target = configPath.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config) + System.lineSeparator());
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    // nulls in the file keep the default
    private static void overlay(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            JsonNode current = target.get(field.getKey());
            if (current instanceof ObjectNode nested && value.isObject()) {
                overlay(nested, (ObjectNode) value);
            } else {
                target.set(field.getKey(), value);
            }
        }
    }
}
