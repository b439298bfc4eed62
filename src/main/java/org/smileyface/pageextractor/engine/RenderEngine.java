package org.smileyface.pageextractor.engine;

import java.util.concurrent.Executor;

/**
 * A rendering engine that must be driven from exactly one thread.
 *
 * <p>The dispatcher calls {@link #start()}, every {@link #newPage(Executor)} and {@link #close()}
 * from its own thread and never from anywhere else.</p>
 */
public interface RenderEngine extends AutoCloseable {

    /**
     * Acquire engine resources (browser process, profile, worker threads). Called once on the
     * dispatcher thread before the first page is created.
     *
     * @throws EngineException when the engine cannot be brought up
     */
    void start();

    /**
     * Create a private rendering surface for one job.
     *
     * @param callbacks executor every callback of the returned page is delivered through
     * @return a fresh page; the caller closes it when the job is done
     */
    RenderPage newPage(Executor callbacks);

    /**
     * Short name used in logs.
     */
    String name();

    /**
     * Release engine resources. Safe to call when {@link #start()} failed or never ran.
     */
    @Override
    void close();
}
