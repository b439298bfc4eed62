package org.smileyface.pageextractor.queue;

import org.smileyface.pageextractor.model.PageJob;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-process {@link JobQueue} backed by an unbounded {@link LinkedBlockingQueue}.
 *
 * <p>The queue holds live {@link PageJob} objects whose completion latches are waited on by
 * request threads, so it cannot be moved out of process. Puts on an unbounded
 * {@code LinkedBlockingQueue} never block; {@code take()} gives the dispatcher its idle wait.</p>
 */
public class InMemoryJobQueue implements JobQueue {

    private final BlockingQueue<PageJob> queue = new LinkedBlockingQueue<>();

    @Override
    public void push(PageJob job) {
        Objects.requireNonNull(job, "job");
        queue.add(job);
    }

    @Override
    public void pushShutdown() {
        queue.add(PageJob.shutdownSentinel());
    }

    @Override
    public PageJob popBlocking() throws InterruptedException {
        return queue.take();
    }

    @Override
    public PageJob poll() {
        return queue.poll();
    }

    @Override
    public int size() {
        return queue.size();
    }
}
