package com.shadowdeploy.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Engine table bound from {@code shadowdeploy.engines.*}.
 *
 * <pre>
 * shadowdeploy:
 *   engines:
 *     primary: dbt
 *     strict-installation-check: false
 *     interactive: false
 *     definitions:
 *       sqlmesh:
 *         enabled: true
 *         command: [python3, scripts/sqlmesh_bridge.py]
 * </pre>
 *
 * @param primary                 engine that stays enabled when no flag file exists
 * @param strictInstallationCheck run the engine's version check before handing it out
 * @param interactive             allow selection without an explicit engine name
 * @param definitions             per-engine switch and bridge executable
 */
@ConfigurationProperties(prefix = "shadowdeploy.engines")
public record EngineProperties(
        String                  primary,
        boolean                 strictInstallationCheck,
        boolean                 interactive,
        Map<String, Definition> definitions
) {
    public EngineProperties {
        primary     = primary == null || primary.isBlank() ? "dbt" : primary;
        definitions = definitions == null ? Map.of() : Map.copyOf(definitions);
    }

    public record Definition(Boolean enabled, List<String> command) {
        public Definition {
            command = command == null ? List.of() : List.copyOf(command);
        }

        /** Engines are enabled unless configured otherwise. */
        public boolean isEnabled() {
            return enabled == null || enabled;
        }
    }

    public boolean isEnabled(String engine) {
        Definition definition = definitions.get(engine);
        return definition == null || definition.isEnabled();
    }

    public List<String> command(String engine) {
        Definition definition = definitions.get(engine);
        return definition == null ? List.of() : definition.command();
    }
}
