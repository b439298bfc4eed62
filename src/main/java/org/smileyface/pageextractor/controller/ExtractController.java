package org.smileyface.pageextractor.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.pageextractor.model.ExtractionMode;
import org.smileyface.pageextractor.model.ExtractionResult;
import org.smileyface.pageextractor.pdf.PdfDetector;
import org.smileyface.pageextractor.service.ExtractionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
class ExtractController {

    private static final Logger log = LoggerFactory.getLogger(ExtractController.class);

    private final ExtractionService extractionService;
    private final PdfDetector pdfDetector;

    ExtractController(ExtractionService extractionService, PdfDetector pdfDetector) {
        this.extractionService = extractionService;
        this.pdfDetector = pdfDetector;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    /**
     * Blocks until the job is done. Timeouts and shutdown are mapped by {@link GlobalExceptionHandler}.
     */
    @PostMapping("/extract")
    public ResponseEntity<?> extract(@RequestBody ExtractRequest request) {
        String url = request.url() == null ? "" : request.url().trim();
        if (url.isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("url is required"));
        }
        boolean pdf = request.pdf() != null ? request.pdf() : pdfDetector.isPdf(url);

        log.info("Extract request: {} (pdf={})", url, pdf);
        ExtractionResult result = extractionService.submit(url, ExtractionMode.of(pdf));
        if (result == null) {
            return ResponseEntity.internalServerError().body(ErrorResponse.of("extraction failed"));
        }
        return ResponseEntity.ok(ExtractResponse.from(result));
    }
}
