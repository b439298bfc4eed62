package org.smileyface.pageextractor.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.pageextractor.engine.RenderEngine;
import org.smileyface.pageextractor.model.ExtractionResult;
import org.smileyface.pageextractor.model.PageJob;
import org.smileyface.pageextractor.queue.JobQueue;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The only thread that touches the render engine. Pulls jobs from the {@link JobQueue} and runs each
 * one to DONE before pulling the next, so the engine sees requests one at a time in submission
 * order. Exits on the shutdown sentinel; a failing job never ends the loop.
 */
public class Dispatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final String id;
    private final JobQueue queue;
    private final RenderEngine engine;
    private final JobEventLoop loop;
    private final PageJobRunner runner;

    private final AtomicLong processedCount = new AtomicLong(0);

    private volatile DispatcherState state = DispatcherState.NEW;
    private volatile String lastUrl;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public Dispatcher(String id, JobQueue queue, RenderEngine engine, JobEventLoop loop, PageJobRunner runner) {
        this.id = Objects.requireNonNull(id, "id");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public DispatcherStatus getStatus() {
        return new DispatcherStatus(id, state, engine.name(), processedCount.get(), queue.size(), lastUrl, lastError,
                startedAt, finishedAt);
    }

    public DispatcherState getState() {
        return state;
    }

    @Override
    public void run() {
        transitionTo(DispatcherState.RUNNING, null);
        try {
            engine.start();
            for (;;) {
                PageJob job = queue.popBlocking();
                if (job.isShutdownSentinel()) {
                    transitionTo(DispatcherState.STOPPED, null);
                    return;
                }
                lastUrl = job.getUrl();
                process(job);
                processedCount.incrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transitionTo(DispatcherState.STOPPED, null);
        } catch (Throwable t) {
            lastError = t.getMessage();
            transitionTo(DispatcherState.ERROR, t);
            failQueued("Extraction failed: engine unavailable");
        } finally {
            engine.close();
            loop.close();
        }
    }

    private void process(PageJob job) throws InterruptedException {
        try {
            runner.run(job);
        } catch (InterruptedException e) {
            job.abort(ExtractionResult.failed(job.getUrl(), "Extraction interrupted"));
            throw e;
        } catch (Throwable t) {
            lastError = messageOf(t);
            log.error("Dispatcher {} job {} failed (url={})", id, job.getId(), job.getUrl(), t);
            job.abort(ExtractionResult.failed(job.getUrl(), "Extraction failed: " + lastError));
        }
        if (!job.isDone()) {
            log.warn("Dispatcher {} job {} returned without a result (url={})", id, job.getId(), job.getUrl());
            job.abort(ExtractionResult.failed(job.getUrl(), "Extraction failed: no result received"));
        }
    }

    private void failQueued(String reason) {
        PageJob job;
        int failed = 0;
        while ((job = queue.poll()) != null) {
            if (job.isShutdownSentinel()) continue;
            job.abort(ExtractionResult.failed(job.getUrl(), reason));
            failed++;
        }
        if (failed > 0) {
            log.warn("Dispatcher {} failed {} queued job(s): {}", id, failed, reason);
        }
    }

    /**
     * Centralized state transition with structured logging; terminal states log the run duration.
     */
    private void transitionTo(DispatcherState newState, Throwable error) {
        DispatcherState old = this.state;
        if (newState == DispatcherState.RUNNING) {
            if (this.startedAt == null) {
                this.startedAt = Instant.now();
            }
            this.state = DispatcherState.RUNNING;
            log.info("Dispatcher {} state {} -> {} (engine={}, startedAt={})", id, old, this.state, engine.name(), startedAt);
            return;
        }

        this.finishedAt = Instant.now();
        this.state = newState;
        long dur = startedAt != null ? durationMs(startedAt, finishedAt) : 0L;
        long count = processedCount.get();
        switch (newState) {
            case STOPPED -> log.info("Dispatcher {} state {} -> STOPPED after {} ms (processed={}, lastUrl={})",
                    id, old, dur, count, lastUrl);
            case ERROR -> log.error("Dispatcher {} state {} -> ERROR after {} ms (processed={}, lastUrl={}, error={})",
                    id, old, dur, count, lastUrl, lastError, error);
            default -> log.info("Dispatcher {} state {} -> {}", id, old, newState);
        }
    }

    private static String messageOf(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }

    private static long durationMs(Instant start, Instant end) {
        return Math.max(0, end.toEpochMilli() - start.toEpochMilli());
    }
}
