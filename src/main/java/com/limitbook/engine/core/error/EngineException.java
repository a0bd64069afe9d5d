package com.limitbook.engine.core.error;

/**
 * Base of every error the engine reports to callers. None of them is fatal to the process.
 */
public abstract class EngineException extends RuntimeException {

    protected EngineException(String message) {
        super(message);
    }

    protected EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
