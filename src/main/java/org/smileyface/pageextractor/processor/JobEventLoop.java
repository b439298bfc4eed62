package org.smileyface.pageextractor.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.pageextractor.engine.RenderPage;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Event inbox of the dispatcher thread.
 *
 * <p>Engine callbacks and timer expiries arrive here from any thread and are run one at a time on
 * the dispatcher thread by {@link #runUntil}. That keeps every mutation of a job and every engine
 * call on a single thread without locking.</p>
 */
public class JobEventLoop implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobEventLoop.class);

    static final Duration IDLE_SLICE = Duration.ofMillis(25);

    private final BlockingQueue<Runnable> inbox = new LinkedBlockingQueue<>();
    private final ScheduledExecutorService timers;

    public JobEventLoop() {
        this.timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue a task for the loop thread. Safe to call from any thread.
     */
    @Override
    public void execute(Runnable task) {
        inbox.add(Objects.requireNonNull(task, "task"));
    }

    /**
     * Arm a one-shot timer whose task runs on the loop thread after {@code delay}.
     */
    public ScheduledTimer schedule(Duration delay, Runnable task) {
        Objects.requireNonNull(task, "task");
        ScheduledTimer timer = new ScheduledTimer();
        ScheduledFuture<?> future = timers.schedule(() -> execute(() -> timer.fire(task)),
                Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        timer.attach(future);
        return timer;
    }

    /**
     * Run queued tasks on the calling thread until {@code done} holds. When the inbox is empty the
     * thread either lets the page pump its engine events or waits on the inbox for a short slice.
     *
     * @param done condition checked after every task
     * @param page page of the current job, consulted for event pumping; may be null
     * @throws InterruptedException if the thread is interrupted while idle
     */
    public void runUntil(BooleanSupplier done, RenderPage page) throws InterruptedException {
        while (!done.getAsBoolean()) {
            Runnable task = next(page);
            if (task != null) {
                task.run();
            }
        }
    }

    private Runnable next(RenderPage page) throws InterruptedException {
        Runnable task = inbox.poll();
        if (task != null) {
            return task;
        }
        if (page != null && page.pumpsEvents()) {
            page.pumpEvents(IDLE_SLICE);
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while pumping engine events");
            }
            return inbox.poll();
        }
        return inbox.poll(IDLE_SLICE.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Number of tasks waiting in the inbox.
     */
    public int pending() {
        return inbox.size();
    }

    @Override
    public void close() {
        int dropped = inbox.size();
        inbox.clear();
        timers.shutdownNow();
        if (dropped > 0) {
            log.debug("Event loop closed, dropped {} stale task(s)", dropped);
        }
    }
}
