package org.netpreserve.evidence.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the built-in defaults and merges the user's YAML file and command line overrides over them.
 */
public class ConfigLoader {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode defaults() {
        try (InputStream stream = ConfigLoader.class.getResourceAsStream("defaults.yaml")) {
            if (stream == null) throw new ConfigException("Built-in defaults.yaml is missing from the classpath");
            return mapper.readTree(stream);
        } catch (IOException e) {
            throw new ConfigException("Unable to read built-in defaults", e);
        }
    }

    /**
     * @param configFile optional user config file
     * @param overrides  optional tree of values from the command line, applied last
     */
    public EvidenceConfig load(@Nullable Path configFile, @Nullable JsonNode overrides) {
        JsonNode tree = defaults();
        if (configFile != null) {
            if (!Files.exists(configFile)) throw new ConfigException("Config file not found: " + configFile);
            try {
                JsonNode user = mapper.readTree(configFile.toFile());
                if (user != null && !user.isMissingNode() && !user.isNull()) tree = deepMerge(tree, user);
            } catch (IOException e) {
                throw new ConfigException("Unable to read " + configFile + ": " + e.getMessage(), e);
            }
        }
        if (overrides != null) tree = deepMerge(tree, overrides);
        return bind(tree);
    }

    public EvidenceConfig bind(JsonNode tree) {
        try {
            return mapper.treeToValue(tree, EvidenceConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
    }

    public String dump(EvidenceConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Unable to serialize configuration", e);
        }
    }

    public ObjectNode newOverrides() {
        return mapper.createObjectNode();
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars and arrays are replaced wholesale
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
