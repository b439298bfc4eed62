package org.smileyface.pageextractor.controller;

import org.smileyface.pageextractor.model.ExtractionResult;

/**
 * Success body of {@code POST /extract}; {@code error} is the empty string when there is none.
 */
public record ExtractResponse(String url, String title, String text, String html, String error) {

    public static ExtractResponse from(ExtractionResult result) {
        return new ExtractResponse(result.getUrl(), result.getTitle(), result.getText(), result.getHtml(),
                result.getError().orElse(""));
    }
}
