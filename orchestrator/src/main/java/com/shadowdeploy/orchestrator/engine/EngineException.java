package com.shadowdeploy.orchestrator.engine;

/**
 * Thrown when an engine call could not produce a reply: the engine is
 * disabled, the process could not be spawned, it timed out, it exited
 * without a reply, or the reply was not a JSON envelope.
 *
 * A reply with success=false is not an exception; it comes back as an
 * {@link EngineResult}.
 */
public class EngineException extends RuntimeException {

    public enum Kind { DISABLED, SPAWN_FAILED, TIMEOUT, NON_ZERO_EXIT, PROTOCOL_ERROR }

    private final Kind   kind;
    private final String engine;
    private final String command;

    public EngineException(Kind kind, String engine, String command, String message) {
        super("[" + kind + "] " + engine + " " + command + ": " + message);
        this.kind    = kind;
        this.engine  = engine;
        this.command = command;
    }

    public EngineException(Kind kind, String engine, String command, String message, Throwable cause) {
        super("[" + kind + "] " + engine + " " + command + ": " + message, cause);
        this.kind    = kind;
        this.engine  = engine;
        this.command = command;
    }

    public Kind   getKind()    { return kind; }
    public String getEngine()  { return engine; }
    public String getCommand() { return command; }
}
