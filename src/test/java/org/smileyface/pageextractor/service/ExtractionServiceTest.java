package org.smileyface.pageextractor.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.smileyface.pageextractor.engine.ScriptedRenderEngine;
import org.smileyface.pageextractor.engine.ScriptedRenderEngine.Script;
import org.smileyface.pageextractor.model.ExtractionMode;
import org.smileyface.pageextractor.model.ExtractionResult;
import org.smileyface.pageextractor.pdf.PdfDetector;
import org.smileyface.pageextractor.pdf.PdfTextExtractor;
import org.smileyface.pageextractor.processor.DispatcherManager;
import org.smileyface.pageextractor.processor.JobTimings;
import org.smileyface.pageextractor.queue.InMemoryJobQueue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ExtractionServiceTest {

    private final ScriptedRenderEngine engine = new ScriptedRenderEngine();
    private DispatcherManager mgr;

    @AfterEach
    void tearDown() {
        if (mgr != null) mgr.shutdown(Duration.ofSeconds(2));
    }

    private ExtractionService service(long loadTimeoutMs, long waitBoundMs) {
        mgr = new DispatcherManager(new InMemoryJobQueue(), engine, new PdfTextExtractor(null, Duration.ofSeconds(5)),
                new JobTimings(Duration.ofMillis(loadTimeoutMs), Duration.ofMillis(20)), Duration.ofSeconds(5));
        return new ExtractionService(mgr, new PdfDetector(false, null), Duration.ofMillis(waitBoundMs));
    }

    @Test
    void submit_returnsResultOfThatJob() {
        engine.script("https://example.test/a", Script.loads(Duration.ofMillis(10)).content("A", "alpha", "<p>alpha</p>"));
        ExtractionService svc = service(5000, 5000);
        mgr.start();

        ExtractionResult r = svc.submit("https://example.test/a");

        assertThat(r.getTitle()).isEqualTo("A");
        assertThat(r.getText()).isEqualTo("alpha");
    }

    @Test
    void submit_autoDetectsPdfBySuffix() {
        ExtractionService svc = service(5000, 5000);
        mgr.start();

        ExtractionResult r = svc.submit("/not/there/file.pdf?download=1#page=2");

        assertThat(r.getError()).hasValueSatisfying(e -> assertThat(e).startsWith("Failed to load PDF"));
        assertThat(r.getHtml()).isEmpty();
        assertThat(engine.getLoadedUrls()).isEmpty();
    }

    @Test
    void explicitPageMode_overridesSuffix() {
        engine.script("https://example.test/viewer.pdf", Script.loads(Duration.ofMillis(10)).content("Viewer", "v", "<p>v</p>"));
        ExtractionService svc = service(5000, 5000);
        mgr.start();

        ExtractionResult r = svc.submit("https://example.test/viewer.pdf", ExtractionMode.PAGE);

        assertThat(r.getTitle()).isEqualTo("Viewer");
    }

    @Test
    void notStarted_isUnavailable() {
        ExtractionService svc = service(5000, 5000);

        assertThatThrownBy(() -> svc.submit("https://example.test/"))
                .isInstanceOf(DispatcherUnavailableException.class)
                .hasMessage("extractor is shutting down");
    }

    @Test
    void afterShutdown_isUnavailable() {
        ExtractionService svc = service(5000, 5000);
        mgr.start();
        mgr.shutdown(Duration.ofSeconds(2));

        assertThatThrownBy(() -> svc.submit("https://example.test/"))
                .isInstanceOf(DispatcherUnavailableException.class);
    }

    @Test
    void outerWaitBound_throwsTimeout() {
        engine.script("https://example.test/hang", Script.neverLoads());
        ExtractionService svc = service(30000, 200);
        mgr.start();

        long start = System.nanoTime();
        assertThatThrownBy(() -> svc.submit("https://example.test/hang"))
                .isInstanceOfSatisfying(ExtractionTimeoutException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("extraction timed out");
                    assertThat(e.getUrl()).isEqualTo("https://example.test/hang");
                    assertThat(e.getWaited()).isEqualTo(Duration.ofMillis(200));
                });
        assertThat((System.nanoTime() - start) / 1_000_000).isGreaterThanOrEqualTo(200);
    }

    @Test
    void concurrentCallers_eachGetTheirOwnResult() throws Exception {
        int n = 5;
        for (int i = 0; i < n; i++) {
            engine.script("https://example.test/" + i, Script.loads(Duration.ofMillis(20)).content("T" + i, "text " + i, "<p>" + i + "</p>"));
        }
        ExtractionService svc = service(5000, 10000);
        mgr.start();

        ExecutorService callers = Executors.newFixedThreadPool(n);
        try {
            List<Future<ExtractionResult>> futures = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                String url = "https://example.test/" + i;
                futures.add(callers.submit(() -> svc.submit(url)));
            }
            for (int i = 0; i < n; i++) {
                ExtractionResult r = futures.get(i).get(10, TimeUnit.SECONDS);
                assertThat(r.getUrl()).isEqualTo("https://example.test/" + i);
                assertThat(r.getTitle()).isEqualTo("T" + i);
            }
        } finally {
            callers.shutdownNow();
        }
        assertThat(engine.getMaxOpenPages()).as("engine used by one job at a time").isEqualTo(1);
        assertThat(engine.getCallingThreads()).containsExactly("page-dispatcher");
    }
}
