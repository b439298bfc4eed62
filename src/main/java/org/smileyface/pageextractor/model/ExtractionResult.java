package org.smileyface.pageextractor.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of one extraction.
 *
 * <p>The error is advisory: a result may carry an error and still hold partial
 * title/text/html (e.g. a page that timed out while loading). Text may be empty
 * even without an error when the page simply has none.</p>
 */
public final class ExtractionResult {

    private final String url;
    private final String title;
    private final String text;
    private final String html;
    private final String error;

    public ExtractionResult(String url, String title, String text, String html, String error) {
        this.url = Objects.toString(url, "");
        this.title = Objects.toString(title, "");
        this.text = Objects.toString(text, "");
        this.html = Objects.toString(html, "");
        this.error = (error == null || error.isBlank()) ? null : error;
    }

    /**
     * Result with no content, only an error annotation.
     */
    public static ExtractionResult failed(String url, String error) {
        return new ExtractionResult(url, "", "", "", error);
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getText() { return text; }
    public String getHtml() { return html; }
    public Optional<String> getError() { return Optional.ofNullable(error); }

    public boolean hasError() {
        return error != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionResult that)) return false;
        return url.equals(that.url) && title.equals(that.title) && text.equals(that.text)
                && html.equals(that.html) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, title, text, html, error);
    }

    @Override
    public String toString() {
        return "ExtractionResult{url='" + url + "', title='" + title + "', textLength=" + text.length()
                + ", htmlLength=" + html.length() + ", error=" + error + '}';
    }
}
