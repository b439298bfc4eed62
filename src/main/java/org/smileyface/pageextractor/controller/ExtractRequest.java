package org.smileyface.pageextractor.controller;

/**
 * Body of {@code POST /extract}. {@code pdf} left null means "decide from the URL".
 */
public record ExtractRequest(String url, Boolean pdf) {
}
