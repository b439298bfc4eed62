package org.smileyface.pageextractor.engine;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Static engine: fetches the document with Jsoup on a background thread and parses it. Scripts
 * never run, so pages that build their content client-side come back mostly empty; the settle
 * delay still applies so both engines behave the same towards the dispatcher.
 */
public class JsoupRenderEngine implements RenderEngine {

    private static final Logger log = LoggerFactory.getLogger(JsoupRenderEngine.class);

    static final String DEFAULT_USER_AGENT = "SmileyfacePageExtractor/0.1";

    private final EngineSettings settings;
    private ExecutorService fetchExecutor;

    public JsoupRenderEngine(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public void start() {
        if (fetchExecutor != null) {
            return;
        }
        fetchExecutor = Executors.newCachedThreadPool(new FetchThreadFactory());
        if (settings.javascriptEnabled()) {
            log.info("jsoup engine started; page scripts are not executed by this engine");
        } else {
            log.info("jsoup engine started");
        }
    }

    @Override
    public RenderPage newPage(Executor callbacks) {
        if (fetchExecutor == null) {
            throw new EngineException("jsoup engine not started");
        }
        return new JsoupPage(Objects.requireNonNull(callbacks, "callbacks"));
    }

    @Override
    public String name() {
        return "jsoup";
    }

    @Override
    public void close() {
        if (fetchExecutor != null) {
            fetchExecutor.shutdownNow();
            fetchExecutor = null;
            log.info("jsoup engine closed");
        }
    }

    private final class JsoupPage implements RenderPage {

        private final Executor callbacks;
        private volatile Document document;
        private volatile String url = "";
        private volatile Future<?> fetch;
        private volatile boolean closed;

        JsoupPage(Executor callbacks) {
            this.callbacks = callbacks;
        }

        @Override
        public void startLoad(String target, Consumer<Boolean> onLoadFinished) {
            this.url = target;
            this.fetch = fetchExecutor.submit(() -> {
                boolean ok = load(target);
                if (!closed) {
                    callbacks.execute(() -> onLoadFinished.accept(ok));
                }
            });
        }

        private boolean load(String target) {
            try {
                Connection conn = Jsoup.connect(target)
                        .userAgent(Objects.toString(settings.userAgent(), DEFAULT_USER_AGENT))
                        .timeout((int) Math.max(0, settings.navigationTimeout().toMillis()))
                        .followRedirects(true)
                        .ignoreHttpErrors(true);
                Connection.Response res = conn.execute();
                Document doc = res.parse();
                this.url = res.url().toExternalForm();
                this.document = doc;
                return true;
            } catch (Exception e) {
                log.debug("Failed to fetch {}: {}", target, e.getMessage());
                return false;
            }
        }

        @Override
        public void extractText(Consumer<String> callback) {
            Document doc = document;
            String text = (doc == null || doc.body() == null) ? "" : doc.body().text();
            callbacks.execute(() -> callback.accept(text));
        }

        @Override
        public void serializeHtml(Consumer<String> callback) {
            Document doc = document;
            String html = doc == null ? "" : doc.outerHtml();
            callbacks.execute(() -> callback.accept(html));
        }

        @Override
        public String currentTitle() {
            Document doc = document;
            return doc == null ? "" : doc.title();
        }

        @Override
        public String currentUrl() {
            return url;
        }

        @Override
        public void close() {
            closed = true;
            Future<?> f = fetch;
            if (f != null) {
                f.cancel(true);
            }
            document = null;
        }
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "jsoup-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
