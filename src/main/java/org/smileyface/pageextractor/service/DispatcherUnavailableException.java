package org.smileyface.pageextractor.service;

/**
 * Raised instead of queueing a job when the dispatcher is shutting down or has died.
 */
public class DispatcherUnavailableException extends ExtractionException {

    public DispatcherUnavailableException(String message) {
        super(message);
    }
}
