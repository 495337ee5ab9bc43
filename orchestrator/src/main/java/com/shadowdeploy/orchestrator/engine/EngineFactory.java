package com.shadowdeploy.orchestrator.engine;

import com.shadowdeploy.orchestrator.config.EngineProperties;
import com.shadowdeploy.orchestrator.config.FeatureFlags;
import com.shadowdeploy.orchestrator.engine.EngineSelectionException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Hands out transformation engines.
 *
 * All {@link TransformationEngine} beans are collected at startup. An engine
 * is <em>available</em> when its configuration entry is enabled and its
 * {@code <engine>_transformations} feature flag is on.
 *
 * <p>Selection precedence:
 * <ol>
 *   <li>explicit engine name</li>
 *   <li>request metadata (header, query parameter, body field)</li>
 *   <li>interactive choice, when permitted; a single available engine is
 *       picked without asking</li>
 *   <li>otherwise {@link EngineSelectionException}</li>
 * </ol>
 */
@Component
public class EngineFactory {

    private static final Logger log = LoggerFactory.getLogger(EngineFactory.class);

    private final Map<String, TransformationEngine> engines = new TreeMap<>();
    private final FeatureFlags              featureFlags;
    private final EngineProperties          properties;
    private final Optional<EngineChooser>   chooser;

    public EngineFactory(List<TransformationEngine> allEngines,
                         FeatureFlags featureFlags,
                         EngineProperties properties,
                         Optional<EngineChooser> chooser) {
        this.featureFlags = featureFlags;
        this.properties   = properties;
        this.chooser      = chooser;
        for (TransformationEngine engine : allEngines) {
            engines.put(engine.name(), engine);
            log.info("Registered transformation engine '{}' (enabled={}, flag={})",
                    engine.name(), properties.isEnabled(engine.name()),
                    featureFlags.isEngineEnabled(engine.name()));
        }
    }

    // ------------------------------------------------------------------
    // Availability
    // ------------------------------------------------------------------

    /** Registered engines that are both configured and flagged on (sorted). */
    public List<String> availableEngines() {
        return engines.keySet().stream()
                .filter(properties::isEnabled)
                .filter(featureFlags::isEngineEnabled)
                .toList();
    }

    public Optional<String> describe(String engine) {
        return Optional.ofNullable(engines.get(engine)).map(TransformationEngine::description);
    }

    // ------------------------------------------------------------------
    // Selection
    // ------------------------------------------------------------------

    public TransformationEngine create(EngineSelection selection) {
        List<String> available = availableEngines();
        if (available.isEmpty()) {
            throw new EngineSelectionException(Reason.NONE_ENABLED,
                    "No transformation engines are enabled. Check feature flags.", available);
        }

        String chosen = normalize(selection.explicitEngine());
        if (chosen == null) {
            chosen = normalize(selection.requestEngine());
        }
        if (chosen == null && selection.interactive() && properties.interactive()) {
            chosen = available.size() == 1
                    ? available.get(0)
                    : normalize(chooser.map(c -> c.choose(available)).orElse(null));
        }

        if (chosen == null) {
            throw new EngineSelectionException(Reason.NOT_SPECIFIED,
                    "No transformation engine specified. Select one of: " + String.join(", ", available)
                            + " (X-Transform-Engine header, 'engine' query parameter or request field)",
                    available);
        }
        if (!available.contains(chosen)) {
            throw new EngineSelectionException(Reason.NOT_AVAILABLE,
                    "Transformation engine '" + chosen + "' is not available. Available engines: "
                            + String.join(", ", available),
                    available);
        }

        TransformationEngine engine = engines.get(chosen);
        if (properties.strictInstallationCheck() && !engine.validateInstallation()) {
            throw new EngineSelectionException(Reason.NOT_INSTALLED,
                    "Transformation engine '" + chosen + "' is not properly installed", available);
        }

        log.info("Using transformation engine: {}", chosen);
        return engine;
    }

    /**
     * Engine named by request metadata: header first, then query parameter,
     * then body field. Blank values are skipped.
     */
    public static String resolveRequestEngine(String header, String query, String body) {
        for (String candidate : new String[] {header, query, body}) {
            String normalized = normalize(candidate);
            if (normalized != null) {
                return normalized;
            }
        }
        return null;
    }

    private static String normalize(String engine) {
        return engine == null || engine.isBlank() ? null : engine.strip().toLowerCase(Locale.ROOT);
    }
}
