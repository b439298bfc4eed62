package org.smileyface.pageextractor.pdf;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.assertj.core.api.Assertions.*;

class PdfDetectorTest {

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) server.stop(0);
    }

    private String startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/download", ex -> {
            ex.getResponseHeaders().add("Content-Type", "application/pdf");
            ex.sendResponseHeaders(200, -1);
            ex.close();
        });
        server.createContext("/page", ex -> {
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(200, -1);
            ex.close();
        });
        server.start();
        return "http://localhost:" + server.getAddress().getPort();
    }

    @Test
    void suffixDecidesWithoutNetwork() {
        PdfDetector detector = new PdfDetector(false, null);
        assertThat(detector.isPdf("https://example.com/a.pdf?dl=1")).isTrue();
        assertThat(detector.isPdf("https://example.com/a.html")).isFalse();
        assertThat(detector.isPdf("/tmp/report.PDF")).isTrue();
    }

    @Test
    void contentTypeProbe_detectsPdfWithoutSuffix() throws Exception {
        String base = startServer();
        PdfDetector detector = new PdfDetector(true, "TestBot/1.0");

        assertThat(detector.isPdf(base + "/download")).isTrue();
        assertThat(detector.isPdf(base + "/page")).isFalse();
    }

    @Test
    void probeDisabled_ignoresContentType() throws Exception {
        String base = startServer();
        assertThat(new PdfDetector(false, null).isPdf(base + "/download")).isFalse();
    }

    @Test
    void unreachableHost_isNotPdf() {
        assertThat(new PdfDetector(true, null).isPdf("http://127.0.0.1:1/doc")).isFalse();
    }
}
