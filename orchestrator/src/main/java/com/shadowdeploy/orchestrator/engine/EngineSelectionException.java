package com.shadowdeploy.orchestrator.engine;

import java.util.List;

/**
 * No engine could be handed out. Raised before any deployment is created.
 */
public class EngineSelectionException extends RuntimeException {

    public enum Reason {
        NONE_ENABLED("No transformation engines enabled"),
        NOT_SPECIFIED("Transformation engine not specified"),
        NOT_AVAILABLE("Transformation engine not available"),
        NOT_INSTALLED("Transformation engine not installed");

        private final String title;

        Reason(String title) {
            this.title = title;
        }

        public String title() {
            return title;
        }
    }

    private final Reason       reason;
    private final List<String> availableEngines;

    public EngineSelectionException(Reason reason, String message, List<String> availableEngines) {
        super(message);
        this.reason           = reason;
        this.availableEngines = List.copyOf(availableEngines);
    }

    public Reason       getReason()           { return reason; }
    public List<String> getAvailableEngines() { return availableEngines; }
}
