package com.shadowdeploy.orchestrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the feature-flag file, injected wherever a flag is
 * consulted.
 *
 * A feature is enabled when it is listed, marked enabled, and every feature
 * it depends on is enabled too. Unknown features are disabled.
 */
public final class FeatureFlags {

    private static final Logger log = LoggerFactory.getLogger(FeatureFlags.class);

    /** Suffix of the per-engine gate, e.g. {@code sqlmesh_transformations}. */
    public static final String ENGINE_FLAG_SUFFIX = "_transformations";

    public record Flag(boolean enabled, List<String> dependencies) {
        public Flag {
            dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        }

        public static Flag on()  { return new Flag(true, List.of()); }
        public static Flag off() { return new Flag(false, List.of()); }
    }

    private final Map<String, Flag> features;

    private FeatureFlags(Map<String, Flag> features) {
        this.features = Map.copyOf(features);
    }

    public static FeatureFlags of(Map<String, Flag> features) {
        return new FeatureFlags(features);
    }

    /** Safe default used when no flag file is available: only the primary engine is on. */
    public static FeatureFlags defaults(String primaryEngine) {
        return new FeatureFlags(Map.of(engineFlag(primaryEngine), Flag.on()));
    }

    public static String engineFlag(String engine) {
        return engine + ENGINE_FLAG_SUFFIX;
    }

    public boolean isEngineEnabled(String engine) {
        return isEnabled(engineFlag(engine));
    }

    public boolean isEnabled(String feature) {
        return isEnabled(feature, new HashSet<>());
    }

    /** Copy with one flag replaced; the original is left untouched. */
    public FeatureFlags with(String feature, boolean enabled) {
        Map<String, Flag> copy = new LinkedHashMap<>(features);
        Flag current = features.get(feature);
        copy.put(feature, new Flag(enabled, current == null ? List.of() : current.dependencies()));
        return new FeatureFlags(copy);
    }

    public Map<String, Flag> asMap() {
        return features;
    }

    private boolean isEnabled(String feature, Set<String> visited) {
        if (!visited.add(feature)) {
            log.warn("Circular dependency detected for feature: {}", feature);
            return false;
        }
        try {
            Flag flag = features.get(feature);
            if (flag == null || !flag.enabled()) {
                return false;
            }
            for (String dependency : flag.dependencies()) {
                if (!isEnabled(dependency, visited)) {
                    log.warn("Feature {} disabled due to missing dependency: {}", feature, dependency);
                    return false;
                }
            }
            return true;
        } finally {
            visited.remove(feature);
        }
    }
}
