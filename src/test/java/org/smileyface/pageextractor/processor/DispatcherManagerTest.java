package org.smileyface.pageextractor.processor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.smileyface.pageextractor.engine.ScriptedRenderEngine;
import org.smileyface.pageextractor.engine.ScriptedRenderEngine.Script;
import org.smileyface.pageextractor.model.ExtractionMode;
import org.smileyface.pageextractor.model.PageJob;
import org.smileyface.pageextractor.pdf.PdfTextExtractor;
import org.smileyface.pageextractor.queue.InMemoryJobQueue;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class DispatcherManagerTest {

    private final ScriptedRenderEngine engine = new ScriptedRenderEngine();
    private final DispatcherManager mgr = new DispatcherManager(new InMemoryJobQueue(), engine,
            new PdfTextExtractor(null, Duration.ofSeconds(5)),
            new JobTimings(Duration.ofMillis(5000), Duration.ofMillis(50)), Duration.ofSeconds(10));

    @AfterEach
    void tearDown() {
        mgr.shutdown(Duration.ofSeconds(5));
    }

    @Test
    void notAcceptingBeforeStart() {
        assertThat(mgr.isAccepting()).isFalse();
        assertThat(mgr.getStatus().getState()).isEqualTo(DispatcherState.NEW);
        assertThat(mgr.shutdown(Duration.ofMillis(10))).isTrue();
    }

    @Test
    void start_runsJobsOnDedicatedThread() throws Exception {
        engine.script("https://example.test/", Script.loads(Duration.ofMillis(10)).content("T", "x", "<p>x</p>"));
        mgr.start();
        assertThat(mgr.isAccepting()).isTrue();
        assertThat(mgr.isRunning()).isTrue();

        PageJob job = new PageJob("https://example.test/", ExtractionMode.PAGE);
        mgr.getQueue().push(job);

        assertThat(job.awaitCompletion(Duration.ofSeconds(5))).isTrue();
        assertThat(job.getResult().getTitle()).isEqualTo("T");
        assertThat(engine.getCallingThreads()).containsExactly("page-dispatcher");
    }

    @Test
    void startTwice_isRejected() {
        mgr.start();
        assertThatThrownBy(mgr::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shutdown_letsInFlightJobFinish() throws Exception {
        engine.script("https://example.test/slow", Script.loads(Duration.ofMillis(300)).content("Slow", "s", "<p>s</p>"));
        mgr.start();
        PageJob job = new PageJob("https://example.test/slow", ExtractionMode.PAGE);
        mgr.getQueue().push(job);

        assertThat(mgr.shutdown(Duration.ofSeconds(5))).isTrue();

        assertThat(job.isDone()).isTrue();
        assertThat(job.getResult().hasError()).isFalse();
        assertThat(mgr.isAccepting()).isFalse();
        assertThat(mgr.isRunning()).isFalse();
        assertThat(mgr.getStatus().getState()).isEqualTo(DispatcherState.STOPPED);
        assertThat(engine.getCloses()).isEqualTo(1);
    }

    @Test
    void shutdown_interruptsDispatcherThatDoesNotStopInTime() {
        engine.script("https://example.test/hang", Script.neverLoads());
        DispatcherManager slow = new DispatcherManager(new InMemoryJobQueue(), engine,
                new PdfTextExtractor(null, Duration.ofSeconds(5)),
                new JobTimings(Duration.ofMillis(30000), Duration.ofMillis(50)), Duration.ofSeconds(10));
        slow.start();
        PageJob job = new PageJob("https://example.test/hang", ExtractionMode.PAGE);
        slow.getQueue().push(job);

        assertThat(slow.shutdown(Duration.ofMillis(200))).isFalse();
        assertThat(slow.shutdown(Duration.ofMillis(200))).as("second call is harmless").isFalse();
        assertThat(slow.isAccepting()).isFalse();
    }
}
