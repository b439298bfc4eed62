package org.smileyface.pageextractor.engine;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * One logical page inside a {@link RenderEngine}, owned by a single job.
 *
 * <p>All callbacks are asynchronous: they are delivered through the executor the page was created
 * with, never from inside the call that requested them, and exactly once per request.</p>
 */
public interface RenderPage extends AutoCloseable {

    /**
     * Start navigating to {@code url}. {@code onLoadFinished} receives true on success and false when
     * the engine reports a failed load. A script-driven redirect starts another load and may report
     * again.
     */
    void startLoad(String url, Consumer<Boolean> onLoadFinished);

    /**
     * Request the page's plain text.
     */
    void extractText(Consumer<String> callback);

    /**
     * Request the serialized DOM.
     */
    void serializeHtml(Consumer<String> callback);

    /** Current document title, empty before anything has loaded. */
    String currentTitle();

    /** Current (possibly redirected) URL. */
    String currentUrl();

    /**
     * Whether the engine only delivers its events while being called, in which case the dispatcher
     * idles through {@link #pumpEvents(Duration)} instead of a plain wait.
     */
    default boolean pumpsEvents() {
        return false;
    }

    /**
     * Let the engine process its own events for up to {@code slice}.
     */
    default void pumpEvents(Duration slice) {
    }

    @Override
    void close();
}
