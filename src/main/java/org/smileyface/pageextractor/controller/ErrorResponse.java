package org.smileyface.pageextractor.controller;

/**
 * Error body shared by every endpoint: {@code {"error": "..."}}.
 */
public record ErrorResponse(String error) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error);
    }
}
