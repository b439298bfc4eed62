package org.smileyface.pageextractor.model;

/**
 * Extraction strategy for a job.
 */
public enum ExtractionMode {
    /** Render the page in the engine and scrape text and HTML. */
    PAGE,

    /** Fetch the document and extract its text with the PDF extractor. */
    PDF;

    public static ExtractionMode of(boolean pdf) {
        return pdf ? PDF : PAGE;
    }
}
