package org.smileyface.pageextractor.engine;

/**
 * Unchecked failure raised by a {@link RenderEngine} implementation.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
