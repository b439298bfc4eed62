package org.smileyface.pageextractor.queue;

import org.smileyface.pageextractor.model.PageJob;

/**
 * Hand-off point between request threads (producers) and the single dispatcher (consumer).
 */
public interface JobQueue {

    /**
     * Append a job. Never blocks; capacity is unbounded.
     * @param job job to run
     */
    void push(PageJob job);

    /**
     * Append the shutdown sentinel. The dispatcher exits when it pops it; anything queued behind
     * it is never processed.
     */
    void pushShutdown();

    /**
     * Remove the next job in FIFO order, waiting until one is available.
     *
     * @return next job, or the sentinel (see {@link PageJob#isShutdownSentinel()})
     * @throws InterruptedException if the waiting thread is interrupted
     */
    PageJob popBlocking() throws InterruptedException;

    /**
     * Non-blocking variant of {@link #popBlocking()}.
     * @return next job or null if none
     */
    PageJob poll();

    int size();
}
