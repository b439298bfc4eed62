package org.smileyface.pageextractor.processor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.pageextractor.engine.RenderEngine;
import org.smileyface.pageextractor.pdf.PdfTextExtractor;
import org.smileyface.pageextractor.queue.JobQueue;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the single dispatcher thread and the engine it drives. Starts the thread, reports its
 * status and shuts it down cooperatively through the queue's sentinel.
 */
public class DispatcherManager {

    private static final Logger log = LogManager.getLogger();

    private final JobQueue queue;
    private final RenderEngine engine;
    private final PdfTextExtractor pdfExtractor;
    private final JobTimings timings;
    private final Duration shutdownWait;

    private final AtomicBoolean accepting = new AtomicBoolean(false);
    private ExecutorService executor;
    private Future<?> future;
    private volatile Dispatcher dispatcher;

    public DispatcherManager(JobQueue queue, RenderEngine engine, PdfTextExtractor pdfExtractor,
                             JobTimings timings, Duration shutdownWait) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.pdfExtractor = Objects.requireNonNull(pdfExtractor, "pdfExtractor");
        this.timings = Objects.requireNonNull(timings, "timings");
        this.shutdownWait = Objects.requireNonNull(shutdownWait, "shutdownWait");
    }

    public JobQueue getQueue() {
        return queue;
    }

    public synchronized void start() {
        if (future != null) {
            throw new IllegalStateException("DispatcherManager already started");
        }
        JobEventLoop loop = new JobEventLoop();
        PageJobRunner runner = new PageJobRunner(engine, loop, pdfExtractor, timings);
        String id = "dispatcher-" + UUID.randomUUID();
        dispatcher = new Dispatcher(id, queue, engine, loop, runner);
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "page-dispatcher");
            t.setDaemon(true);
            return t;
        });
        future = executor.submit(dispatcher);
        accepting.set(true);
        log.info("DispatcherManager STARTED (engine={}, loadTimeout={} ms, settleDelay={} ms)", engine.name(),
                timings.loadTimeout().toMillis(), timings.settleDelay().toMillis());
    }

    /**
     * Whether new jobs may be queued: the manager is started, not shutting down and the dispatcher
     * has not died.
     */
    public boolean isAccepting() {
        Dispatcher d = dispatcher;
        if (!accepting.get() || d == null) return false;
        DispatcherState s = d.getState();
        return s == DispatcherState.NEW || s == DispatcherState.RUNNING;
    }

    public boolean isRunning() {
        Future<?> f = future;
        return f != null && !f.isDone();
    }

    public DispatcherStatus getStatus() {
        Dispatcher d = dispatcher;
        if (d == null) {
            return new DispatcherStatus(null, DispatcherState.NEW, engine.name(), 0, queue.size(), null, null, null, null);
        }
        return d.getStatus();
    }

    /**
     * Stop accepting jobs, queue the sentinel and wait for the in-flight job to finish.
     */
    public void shutdown() {
        shutdown(shutdownWait);
    }

    /**
     * Same as {@link #shutdown()} with an explicit wait.
     *
     * @return true if the dispatcher exited within {@code wait}; otherwise it is interrupted
     */
    public synchronized boolean shutdown(Duration wait) {
        if (future == null) {
            return true;
        }
        if (accepting.getAndSet(false)) {
            log.info("DispatcherManager shutting down ({} job(s) still queued)", queue.size());
            queue.pushShutdown();
        }
        boolean clean = true;
        try {
            future.get(Math.max(0, wait.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Dispatcher did not stop within {} ms, interrupting", wait.toMillis());
            future.cancel(true);
            clean = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            clean = false;
        } catch (CancellationException e) {
            clean = false;
        } catch (ExecutionException e) {
            log.error("Dispatcher terminated abnormally", e.getCause());
            clean = false;
        }
        executor.shutdown();
        DispatcherStatus status = getStatus();
        log.info("DispatcherManager STOPPED: state={}, processed={}, queued={}", status.getState(),
                status.getProcessedCount(), status.getQueuedCount());
        return clean;
    }
}
