package org.smileyface.pageextractor.processor;

import java.time.Instant;

/**
 * Immutable snapshot of the dispatcher's status.
 */
public final class DispatcherStatus {
    private final String id;
    private final DispatcherState state;
    private final String engine;
    private final long processedCount;
    private final int queuedCount;
    private final String lastUrl;
    private final String lastError;
    private final Instant startedAt;
    private final Instant finishedAt;

    public DispatcherStatus(String id, DispatcherState state, String engine, long processedCount, int queuedCount,
                            String lastUrl, String lastError, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.state = state;
        this.engine = engine;
        this.processedCount = processedCount;
        this.queuedCount = queuedCount;
        this.lastUrl = lastUrl;
        this.lastError = lastError;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public String getId() { return id; }
    public DispatcherState getState() { return state; }
    public String getEngine() { return engine; }
    public long getProcessedCount() { return processedCount; }
    public int getQueuedCount() { return queuedCount; }
    public String getLastUrl() { return lastUrl; }
    public String getLastError() { return lastError; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
}
