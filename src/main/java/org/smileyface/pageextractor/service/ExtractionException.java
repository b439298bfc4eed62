package org.smileyface.pageextractor.service;

/**
 * Base unchecked exception for failures that leave a caller without any extraction result.
 * Advisory problems (timeouts inside a job, failed loads) are reported on the result instead.
 */
public abstract class ExtractionException extends RuntimeException {

    protected ExtractionException(String message) {
        super(message);
    }

    protected ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
