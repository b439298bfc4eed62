package org.smileyface.pageextractor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.pageextractor.config.ExtractorProperties;
import org.smileyface.pageextractor.model.ExtractionMode;
import org.smileyface.pageextractor.model.ExtractionResult;
import org.smileyface.pageextractor.model.PageJob;
import org.smileyface.pageextractor.pdf.PdfDetector;
import org.smileyface.pageextractor.processor.DispatcherManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;

/**
 * Blocking, thread-safe entry point for extractions. Any number of request threads may call
 * {@link #submit(String, ExtractionMode)} at once; each queues a job for the single dispatcher
 * and waits for it.
 */
@Service
public class ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final DispatcherManager dispatcherManager;
    private final PdfDetector pdfDetector;
    private final Duration waitBound;

    public ExtractionService(DispatcherManager dispatcherManager, PdfDetector pdfDetector, Duration waitBound) {
        this.dispatcherManager = Objects.requireNonNull(dispatcherManager, "dispatcherManager");
        this.pdfDetector = Objects.requireNonNull(pdfDetector, "pdfDetector");
        this.waitBound = Objects.requireNonNull(waitBound, "waitBound");
    }

    /**
     * Spring constructor: waits for the configured timeout plus the configured grace, so a job's own
     * timeout always gets the chance to fire first.
     */
    @Autowired
    public ExtractionService(DispatcherManager dispatcherManager, PdfDetector pdfDetector,
                             ExtractorProperties properties) {
        this(dispatcherManager, pdfDetector,
                Duration.ofMillis(properties.getTimeoutMs() + properties.getWaitGraceMs()));
    }

    /**
     * Extract with the mode picked by the {@link PdfDetector}.
     */
    public ExtractionResult submit(String url) {
        return submit(url, ExtractionMode.of(pdfDetector.isPdf(url)));
    }

    /**
     * Queue a job and block until the dispatcher finishes it.
     *
     * @param url  page or PDF location
     * @param mode extraction strategy
     * @return the job's result, possibly carrying an advisory error
     * @throws DispatcherUnavailableException when the dispatcher no longer accepts jobs
     * @throws ExtractionTimeoutException     when the job does not finish within the wait bound
     */
    public ExtractionResult submit(String url, ExtractionMode mode) {
        if (!dispatcherManager.isAccepting()) {
            throw new DispatcherUnavailableException("extractor is shutting down");
        }
        PageJob job = new PageJob(url, mode);
        dispatcherManager.getQueue().push(job);
        log.debug("Queued job {} for {} (mode={})", job.getId(), url, mode);

        boolean done;
        try {
            done = job.awaitCompletion(waitBound);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionTimeoutException(url, waitBound);
        }
        if (!done) {
            log.warn("Job {} for {} not finished after {} ms (state={})", job.getId(), url, waitBound.toMillis(),
                    job.getState());
            throw new ExtractionTimeoutException(url, waitBound);
        }
        return job.getResult();
    }
}
