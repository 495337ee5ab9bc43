package com.shadowdeploy.orchestrator.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the feature-flag YAML file:
 * <pre>
 * features:
 *   sqlmesh_transformations:
 *     enabled: true
 *     dependencies: [duckdb_analytics]
 * </pre>
 * A missing or unreadable file degrades to {@link FeatureFlags#defaults}; the
 * primary engine's flag defaults to enabled when the file does not list it.
 */
public final class FeatureFlagLoader {

    private static final Logger log = LoggerFactory.getLogger(FeatureFlagLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private FeatureFlagLoader() {}

    public static FeatureFlags load(Path file, String primaryEngine) {
        if (file == null || !Files.isRegularFile(file)) {
            log.info("No feature flag file at {}; only '{}' transformations are enabled", file, primaryEngine);
            return FeatureFlags.defaults(primaryEngine);
        }
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            FeatureFlags flags = FeatureFlags.of(parse(root, primaryEngine));
            log.info("Loaded {} feature flags from {}", flags.asMap().size(), file);
            return flags;
        } catch (IOException e) {
            log.warn("Failed to load feature flags from {}: {}; falling back to defaults", file, e.getMessage());
            return FeatureFlags.defaults(primaryEngine);
        }
    }

    private static Map<String, FeatureFlags.Flag> parse(JsonNode root, String primaryEngine) {
        Map<String, FeatureFlags.Flag> flags = new LinkedHashMap<>();
        JsonNode features = root == null ? null : root.path("features");
        if (features != null && features.isObject()) {
            features.fields().forEachRemaining(entry -> {
                JsonNode node = entry.getValue();
                List<String> dependencies = new ArrayList<>();
                node.path("dependencies").forEach(d -> dependencies.add(d.asText()));
                flags.put(entry.getKey(), new FeatureFlags.Flag(node.path("enabled").asBoolean(false), dependencies));
            });
        }
        flags.putIfAbsent(FeatureFlags.engineFlag(primaryEngine), FeatureFlags.Flag.on());
        return flags;
    }
}
