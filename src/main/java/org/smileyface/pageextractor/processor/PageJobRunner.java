package org.smileyface.pageextractor.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.pageextractor.engine.RenderEngine;
import org.smileyface.pageextractor.engine.RenderPage;
import org.smileyface.pageextractor.model.ExtractionMode;
import org.smileyface.pageextractor.model.ExtractionResult;
import org.smileyface.pageextractor.model.JobState;
import org.smileyface.pageextractor.model.PageJob;
import org.smileyface.pageextractor.pdf.PdfTextExtractor;

import java.time.Instant;
import java.util.Objects;

/**
 * Drives one {@link PageJob} to DONE on the dispatcher thread.
 *
 * <p>Page jobs go PENDING -> LOADING -> SETTLING -> EXTRACTING -> DONE. Three independent sources
 * race to move them forward: the engine's load-finished callback, the settle timer and the load
 * timeout. The first transition wins; every callback checks the job state on entry and returns
 * when it arrives too late. PDF jobs skip the engine and go straight from PENDING to DONE.</p>
 */
public class PageJobRunner {

    private static final Logger log = LoggerFactory.getLogger(PageJobRunner.class);

    public static final String TIMEOUT_ERROR = "Timed out (partial content may be available)";
    public static final String LOAD_FAILED_ERROR = "Page load reported failure (content may be incomplete)";

    private final RenderEngine engine;
    private final JobEventLoop loop;
    private final PdfTextExtractor pdfExtractor;
    private final JobTimings timings;

    public PageJobRunner(RenderEngine engine, JobEventLoop loop, PdfTextExtractor pdfExtractor, JobTimings timings) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.pdfExtractor = Objects.requireNonNull(pdfExtractor, "pdfExtractor");
        this.timings = Objects.requireNonNull(timings, "timings");
    }

    /**
     * Run the job to completion. Returns only once the job is DONE (or the thread is interrupted).
     */
    public void run(PageJob job) throws InterruptedException {
        if (job.getMode() == ExtractionMode.PDF) {
            runPdf(job);
            return;
        }
        RenderPage page = engine.newPage(loop);
        PageSession session = new PageSession(job, page);
        try {
            session.start();
            loop.runUntil(job::isDone, page);
        } finally {
            session.cancelTimers();
            page.close();
        }
    }

    private void runPdf(PageJob job) {
        Instant start = Instant.now();
        ExtractionResult result = pdfExtractor.extract(job.getUrl());
        job.complete(result);
        log.info("Job {} PENDING -> DONE (pdf) after {} ms (error={})", job.getId(),
                durationMs(start, Instant.now()), result.getError().orElse(null));
    }

    private static long durationMs(Instant start, Instant end) {
        return Math.max(0, end.toEpochMilli() - start.toEpochMilli());
    }

    /**
     * Mutable per-job bookkeeping. Touched only from the loop thread.
     */
    private final class PageSession {

        private final PageJob job;
        private final RenderPage page;

        private ScheduledTimer loadTimer;
        private ScheduledTimer settleTimer;
        private boolean loadOk;
        private boolean textReceived;
        private String error;
        private String title = "";
        private String url;
        private String text = "";

        PageSession(PageJob job, RenderPage page) {
            this.job = job;
            this.page = page;
            this.url = job.getUrl();
        }

        void start() {
            job.transitionTo(JobState.LOADING);
            log.debug("Job {} PENDING -> LOADING ({}, timeout={} ms)", job.getId(), job.getUrl(),
                    timings.loadTimeout().toMillis());
            loadTimer = loop.schedule(timings.loadTimeout(), this::onLoadTimeout);
            page.startLoad(job.getUrl(), this::onLoadFinished);
        }

        private boolean awaitingLoad() {
            JobState s = job.getState();
            return s == JobState.LOADING || s == JobState.SETTLING;
        }

        void onLoadFinished(boolean ok) {
            if (!awaitingLoad()) {
                log.debug("Job {} ignoring late load-finished({})", job.getId(), ok);
                return;
            }
            if (ok) {
                loadOk = true;
            }
            if (job.getState() == JobState.LOADING) {
                job.transitionTo(JobState.SETTLING);
                log.debug("Job {} LOADING -> SETTLING (ok={})", job.getId(), ok);
            } else {
                log.debug("Job {} load finished again while settling (ok={}), restarting settle delay", job.getId(), ok);
            }
            if (settleTimer != null) {
                settleTimer.cancel();
            }
            settleTimer = loop.schedule(timings.settleDelay(), this::onSettled);
        }

        void onSettled() {
            if (job.getState() != JobState.SETTLING) {
                return;
            }
            beginExtraction(false);
        }

        void onLoadTimeout() {
            if (!awaitingLoad()) {
                return;
            }
            log.warn("Job {} timed out after {} ms in {}, extracting partial content", job.getId(),
                    timings.loadTimeout().toMillis(), job.getState());
            beginExtraction(true);
        }

        private void beginExtraction(boolean timedOut) {
            JobState from = job.getState();
            job.transitionTo(JobState.EXTRACTING);
            cancelTimers();
            log.debug("Job {} {} -> EXTRACTING", job.getId(), from);

            title = page.currentTitle();
            String current = page.currentUrl();
            if (current != null && !current.isBlank()) {
                url = current;
            }
            if (timedOut) {
                error = TIMEOUT_ERROR;
            } else if (!loadOk) {
                error = LOAD_FAILED_ERROR;
            }
            page.extractText(this::onText);
        }

        void onText(String value) {
            if (job.getState() != JobState.EXTRACTING || textReceived) {
                log.debug("Job {} ignoring late text callback", job.getId());
                return;
            }
            textReceived = true;
            text = Objects.toString(value, "");
            page.serializeHtml(this::onHtml);
        }

        void onHtml(String html) {
            if (job.getState() != JobState.EXTRACTING) {
                log.debug("Job {} ignoring late html callback", job.getId());
                return;
            }
            finish(Objects.toString(html, ""));
        }

        private void finish(String html) {
            cancelTimers();
            ExtractionResult result = new ExtractionResult(url, title, text, html, error);
            if (job.complete(result)) {
                Instant started = job.getLoadingStartedAt();
                long dur = started != null ? durationMs(started, job.getDoneAt()) : 0L;
                log.info("Job {} EXTRACTING -> DONE after {} ms (url={}, textLength={}, error={})",
                        job.getId(), dur, url, text.length(), error);
            }
        }

        void cancelTimers() {
            if (loadTimer != null) loadTimer.cancel();
            if (settleTimer != null) settleTimer.cancel();
        }
    }
}
