package org.smileyface.pageextractor.pdf;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.pageextractor.util.UrlUtils;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Decides whether a URL should be extracted as a PDF.
 *
 * <p>A {@code .pdf} suffix is the fast path. When content-type probing is on, other http(s) URLs
 * get a HEAD request and count as PDF when the server answers {@code application/pdf}.</p>
 */
public class PdfDetector {

    private static final Logger log = LoggerFactory.getLogger(PdfDetector.class);

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    private final boolean probeContentType;
    private final String userAgent;

    public PdfDetector(boolean probeContentType, String userAgent) {
        this.probeContentType = probeContentType;
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? null : userAgent;
    }

    public boolean isPdf(String url) {
        if (UrlUtils.hasPdfSuffix(url)) {
            return true;
        }
        if (!probeContentType || !UrlUtils.isHttp(url)) {
            return false;
        }
        return probe(url);
    }

    private boolean probe(String url) {
        try {
            Connection conn = Jsoup.connect(url)
                    .method(Connection.Method.HEAD)
                    .timeout((int) PROBE_TIMEOUT.toMillis())
                    .followRedirects(true)
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true);
            if (userAgent != null) {
                conn.userAgent(userAgent);
            }
            String contentType = conn.execute().contentType();
            return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("application/pdf");
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Content-type probe of {} failed: {}", url, e.getMessage());
            return false;
        }
    }
}
