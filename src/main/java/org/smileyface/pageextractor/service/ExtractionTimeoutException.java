package org.smileyface.pageextractor.service;

import java.time.Duration;

/**
 * The caller gave up waiting: the dispatcher did not finish the job within the outer wait bound.
 */
public class ExtractionTimeoutException extends ExtractionException {

    private final String url;
    private final transient Duration waited;

    public ExtractionTimeoutException(String url, Duration waited) {
        super("extraction timed out");
        this.url = url;
        this.waited = waited;
    }

    public String getUrl() {
        return url;
    }

    public Duration getWaited() {
        return waited;
    }
}
