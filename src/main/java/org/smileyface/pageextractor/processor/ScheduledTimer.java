package org.smileyface.pageextractor.processor;

import java.util.concurrent.Future;

/**
 * Handle to a one-shot timer created by {@link JobEventLoop#schedule}. The expiry task runs on the
 * loop thread; a timer cancelled before its task runs never runs it, even if it already expired.
 */
public final class ScheduledTimer {

    private volatile Future<?> future;
    private volatile boolean cancelled;
    private volatile boolean fired;

    ScheduledTimer() {
    }

    void attach(Future<?> future) {
        this.future = future;
        if (cancelled) {
            future.cancel(false);
        }
    }

    void fire(Runnable task) {
        if (cancelled || fired) {
            return;
        }
        fired = true;
        task.run();
    }

    public void cancel() {
        cancelled = true;
        Future<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean hasFired() {
        return fired;
    }
}
