package org.smileyface.pageextractor.processor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.smileyface.pageextractor.engine.RenderPage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.*;

class JobEventLoopTest {

    private final JobEventLoop loop = new JobEventLoop();

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void tasksRunInPostingOrderOnCallingThread() throws Exception {
        List<String> seen = new ArrayList<>();
        AtomicReference<String> thread = new AtomicReference<>();
        AtomicBoolean done = new AtomicBoolean();

        loop.execute(() -> seen.add("a"));
        new Thread(() -> loop.execute(() -> seen.add("b"))).start();
        Thread.sleep(50);
        loop.execute(() -> {
            thread.set(Thread.currentThread().getName());
            done.set(true);
        });

        loop.runUntil(done::get, null);

        assertThat(seen).containsExactly("a", "b");
        assertThat(thread.get()).isEqualTo(Thread.currentThread().getName());
    }

    @Test
    void timerFiresOnLoopThreadAfterDelay() throws Exception {
        AtomicReference<String> thread = new AtomicReference<>();
        long start = System.nanoTime();
        ScheduledTimer timer = loop.schedule(Duration.ofMillis(150), () -> thread.set(Thread.currentThread().getName()));

        loop.runUntil(() -> thread.get() != null, null);

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(150);
        assertThat(thread.get()).isEqualTo(Thread.currentThread().getName());
        assertThat(timer.hasFired()).isTrue();
    }

    @Test
    void cancelledTimerNeverRuns_evenIfAlreadyExpired() throws Exception {
        AtomicBoolean fired = new AtomicBoolean();
        AtomicBoolean marker = new AtomicBoolean();
        ScheduledTimer timer = loop.schedule(Duration.ofMillis(10), () -> fired.set(true));

        Thread.sleep(100);
        assertThat(loop.pending()).as("expiry already posted to the inbox").isEqualTo(1);
        timer.cancel();
        loop.execute(() -> marker.set(true));

        loop.runUntil(marker::get, null);

        assertThat(fired).isFalse();
        assertThat(timer.isCancelled()).isTrue();
        assertThat(timer.hasFired()).isFalse();
    }

    @Test
    void idleLoopPumpsPageEvents() throws Exception {
        PumpingPage page = new PumpingPage();

        loop.runUntil(() -> page.pumps.get() >= 3, page);

        assertThat(page.pumps.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void interruptWhileIdle_throws() {
        AtomicBoolean never = new AtomicBoolean();
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> loop.runUntil(never::get, null))
                    .isInstanceOf(InterruptedException.class);
        } finally {
            Thread.interrupted();
        }
    }

    private static final class PumpingPage implements RenderPage {
        final AtomicInteger pumps = new AtomicInteger();

        @Override
        public boolean pumpsEvents() {
            return true;
        }

        @Override
        public void pumpEvents(Duration slice) {
            pumps.incrementAndGet();
        }

        @Override
        public void startLoad(String url, Consumer<Boolean> onLoadFinished) {
        }

        @Override
        public void extractText(Consumer<String> callback) {
        }

        @Override
        public void serializeHtml(Consumer<String> callback) {
        }

        @Override
        public String currentTitle() {
            return "";
        }

        @Override
        public String currentUrl() {
            return "";
        }

        @Override
        public void close() {
        }
    }
}
