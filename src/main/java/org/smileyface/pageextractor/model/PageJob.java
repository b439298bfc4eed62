package org.smileyface.pageextractor.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One extraction request travelling from a request thread to the dispatcher and back.
 *
 * <p>Only the dispatcher thread mutates {@code state} and {@code result}. Request threads keep a
 * reference to the job and read the result after {@link #awaitCompletion(Duration)} returns true;
 * the completion latch publishes the result to them.</p>
 */
public final class PageJob {

    private static final PageJob SHUTDOWN = new PageJob();

    private final String id;
    private final String url;
    private final ExtractionMode mode;
    private final CountDownLatch completion = new CountDownLatch(1);

    private volatile JobState state = JobState.PENDING;
    private volatile ExtractionResult result;
    private volatile Instant loadingStartedAt;
    private volatile Instant doneAt;

    public PageJob(String url, ExtractionMode mode) {
        this.id = "job-" + UUID.randomUUID();
        this.url = Objects.requireNonNull(url, "url");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    private PageJob() {
        this.id = "shutdown";
        this.url = "";
        this.mode = ExtractionMode.PAGE;
    }

    /**
     * The poison pill that tells the dispatcher to exit its loop.
     */
    public static PageJob shutdownSentinel() {
        return SHUTDOWN;
    }

    public boolean isShutdownSentinel() {
        return this == SHUTDOWN;
    }

    public String getId() { return id; }
    public String getUrl() { return url; }
    public ExtractionMode getMode() { return mode; }
    public JobState getState() { return state; }
    public Instant getLoadingStartedAt() { return loadingStartedAt; }
    public Instant getDoneAt() { return doneAt; }

    /**
     * The result, or null while the job is not DONE.
     */
    public ExtractionResult getResult() { return result; }

    public boolean isDone() {
        return state == JobState.DONE;
    }

    /**
     * Moves the job forward to a non-terminal state.
     *
     * @throws IllegalStateException if the move is not a forward step of the lifecycle,
     *                               or targets DONE (use {@link #complete(ExtractionResult)})
     */
    public void transitionTo(JobState next) {
        if (next == JobState.DONE) {
            throw new IllegalStateException("Job " + id + " must be completed with a result");
        }
        JobState current = state;
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move " + current + " -> " + next);
        }
        if (next == JobState.LOADING) {
            loadingStartedAt = Instant.now();
        }
        state = next;
    }

    /**
     * Writes the result, marks the job DONE and fires completion. First call wins.
     *
     * @return false when the job was already DONE; the given result is then discarded
     * @throws IllegalStateException when the job is in a state that cannot finish yet
     */
    public boolean complete(ExtractionResult extractionResult) {
        Objects.requireNonNull(extractionResult, "extractionResult");
        JobState current = state;
        if (current == JobState.DONE) {
            return false;
        }
        if (!current.canTransitionTo(JobState.DONE)) {
            throw new IllegalStateException("Job " + id + " cannot complete from " + current);
        }
        this.result = extractionResult;
        this.doneAt = Instant.now();
        this.state = JobState.DONE;
        completion.countDown();
        return true;
    }

    /**
     * Completes the job from whatever state it reached, stepping through EXTRACTING when needed so
     * the lifecycle still only moves forward. Used when running the job failed unexpectedly.
     *
     * @return false when the job was already DONE
     */
    public boolean abort(ExtractionResult extractionResult) {
        JobState current = state;
        if (current == JobState.DONE) {
            return false;
        }
        if (current == JobState.LOADING || current == JobState.SETTLING) {
            transitionTo(JobState.EXTRACTING);
        }
        return complete(extractionResult);
    }

    /**
     * Blocks until the job is DONE or the timeout elapses.
     *
     * @return true when the job completed within the timeout
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return completion.await(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        return "PageJob{id=" + id + ", url=" + url + ", mode=" + mode + ", state=" + state + '}';
    }
}
