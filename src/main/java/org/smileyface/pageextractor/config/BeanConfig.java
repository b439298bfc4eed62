package org.smileyface.pageextractor.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.pageextractor.engine.EngineSettings;
import org.smileyface.pageextractor.engine.JsoupRenderEngine;
import org.smileyface.pageextractor.engine.PlaywrightRenderEngine;
import org.smileyface.pageextractor.engine.RenderEngine;
import org.smileyface.pageextractor.pdf.PdfDetector;
import org.smileyface.pageextractor.pdf.PdfTextExtractor;
import org.smileyface.pageextractor.processor.DispatcherManager;
import org.smileyface.pageextractor.processor.JobTimings;
import org.smileyface.pageextractor.queue.InMemoryJobQueue;
import org.smileyface.pageextractor.queue.JobQueue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the engine, the job queue and the dispatcher.
 *
 * <p>The engine bean is only constructed here; the dispatcher thread starts and closes it.</p>
 */
@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    /**
     * Selects the RenderEngine implementation based on the configuration property
     * {@code extractor.engine.type}. Supported values:
     * - "playwright" (default): headless Chromium through {@link PlaywrightRenderEngine}
     * - "jsoup": static fetch and parse through {@link JsoupRenderEngine}, no scripts
     * Unknown values fall back to playwright. No destroy method: the dispatcher closes the engine
     * on its own thread.
     */
    @Bean(destroyMethod = "")
    public RenderEngine renderEngine(ExtractorProperties properties) {
        EngineSettings settings = properties.toEngineSettings();
        String kind = properties.getEngine().getType();
        if ("jsoup".equals(kind)) {
            return new JsoupRenderEngine(settings);
        }
        if (!"playwright".equals(kind)) {
            log.warn("Unknown extractor.engine.type '{}', using playwright", kind);
        }
        return new PlaywrightRenderEngine(settings);
    }

    @Bean
    public JobQueue jobQueue() {
        return new InMemoryJobQueue();
    }

    @Bean
    public PdfTextExtractor pdfTextExtractor(ExtractorProperties properties) {
        return new PdfTextExtractor(properties.getUserAgent(), properties.timeout());
    }

    @Bean
    public PdfDetector pdfDetector(ExtractorProperties properties) {
        return new PdfDetector(properties.isDetectPdfByContentType(), properties.getUserAgent());
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public DispatcherManager dispatcherManager(JobQueue jobQueue, RenderEngine renderEngine,
                                               PdfTextExtractor pdfTextExtractor, ExtractorProperties properties) {
        JobTimings timings = new JobTimings(properties.timeout(), properties.settleDelay());
        Duration shutdownWait = Duration.ofMillis(properties.getTimeoutMs() + properties.getWaitGraceMs());
        return new DispatcherManager(jobQueue, renderEngine, pdfTextExtractor, timings, shutdownWait);
    }
}
