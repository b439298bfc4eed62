package org.smileyface.pageextractor.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.pageextractor.model.ExtractionResult;
import org.smileyface.pageextractor.util.UrlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracts the text of a PDF given as an http/https/ftp URL, a {@code file:} URL or a local path.
 *
 * <p>Never throws: fetch and parse failures come back as an error on the result with empty text,
 * so one broken document cannot take the dispatcher down.</p>
 */
public class PdfTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    static final String PAGE_SEPARATOR = "\n\n";

    private final String userAgent;
    private final Duration timeout;

    public PdfTextExtractor(String userAgent, Duration timeout) {
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? null : userAgent;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Extract every page's text, pages joined by a blank line; the title is the source's base name.
     *
     * @param source URL or path of the PDF
     * @return result whose html is always empty
     */
    public ExtractionResult extract(String source) {
        byte[] bytes;
        try {
            bytes = read(source);
        } catch (PdfLoadException e) {
            log.warn("PDF {} could not be loaded: {}", source, e.getMessage());
            return ExtractionResult.failed(source, e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.warn("PDF {} could not be fetched: {}", source, e.toString());
            return ExtractionResult.failed(source, messageOf(e));
        }

        try (PDDocument document = Loader.loadPDF(bytes)) {
            String text = extractPages(document);
            log.debug("PDF {} extracted: pages={}, textLength={}", source, document.getNumberOfPages(), text.length());
            return new ExtractionResult(source, UrlUtils.baseName(source), text, "", null);
        } catch (IOException e) {
            log.warn("PDF {} could not be parsed: {}", source, e.getMessage());
            return ExtractionResult.failed(source, "Failed to load PDF: " + messageOf(e));
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Unexpected error extracting PDF {}", source, e);
            return ExtractionResult.failed(source, messageOf(e));
        }
    }

    private String extractPages(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setLineSeparator("\n");
        int pages = document.getNumberOfPages();
        List<String> parts = new ArrayList<>(pages);
        for (int i = 1; i <= pages; i++) {
            stripper.setStartPage(i);
            stripper.setEndPage(i);
            parts.add(stripper.getText(document).stripTrailing());
        }
        return String.join(PAGE_SEPARATOR, parts);
    }

    private byte[] read(String source) throws IOException {
        if (source == null || source.isBlank()) {
            throw new PdfLoadException("Failed to load PDF: no source given");
        }
        String scheme = UrlUtils.schemeOf(source);
        if ("http".equals(scheme) || "https".equals(scheme)) {
            return fetchHttp(source);
        }
        if ("ftp".equals(scheme)) {
            return fetchFtp(source);
        }
        Path path = "file".equals(scheme) ? Path.of(URI.create(source.trim()).getPath()) : Path.of(source);
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new PdfLoadException("Failed to load PDF: " + messageOf(e));
        }
    }

    private byte[] fetchHttp(String url) throws IOException {
        Connection conn = Jsoup.connect(url)
                .timeout((int) Math.max(0, timeout.toMillis()))
                .followRedirects(true)
                .ignoreContentType(true)
                .maxBodySize(0);
        if (userAgent != null) {
            conn.userAgent(userAgent);
        }
        return conn.execute().bodyAsBytes();
    }

    private byte[] fetchFtp(String url) throws IOException {
        URLConnection conn = URI.create(url).toURL().openConnection();
        int ms = (int) Math.max(0, timeout.toMillis());
        conn.setConnectTimeout(ms);
        conn.setReadTimeout(ms);
        try (InputStream in = conn.getInputStream()) {
            return in.readAllBytes();
        }
    }

    private static String messageOf(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }

    /**
     * A local source that cannot be read; reported the same way as an unparseable document.
     */
    private static final class PdfLoadException extends IOException {
        PdfLoadException(String message) {
            super(message);
        }
    }
}
