package org.smileyface.pageextractor.engine;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Headless Chromium through Playwright.
 *
 * <p>Playwright objects are bound to the thread that created them and deliver their events only
 * while that thread is inside a Playwright call, so this engine must be started, used and closed
 * on the dispatcher thread, and its pages idle through {@link Page#waitForTimeout(double)}.</p>
 */
public class PlaywrightRenderEngine implements RenderEngine {

    private static final Logger log = LogManager.getLogger(PlaywrightRenderEngine.class);

    private static final String PLAIN_TEXT_SCRIPT = "() => document.body ? document.body.innerText : ''";
    private static final List<String> CHROMIUM_ARGS = List.of("--disable-gpu", "--disable-software-rasterizer");

    private final EngineSettings settings;

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;

    public PlaywrightRenderEngine(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public void start() {
        if (context != null) {
            return;
        }
        try {
            playwright = Playwright.create();
            BrowserType chromium = playwright.chromium();
            List<String> args = new ArrayList<>(CHROMIUM_ARGS);
            if (!settings.pluginsEnabled()) {
                args.add("--disable-plugins");
            }
            if (settings.persistentCookies()) {
                context = chromium.launchPersistentContext(Paths.get(settings.storagePath()),
                        new BrowserType.LaunchPersistentContextOptions()
                                .setHeadless(settings.headless())
                                .setArgs(args)
                                .setUserAgent(settings.userAgent())
                                .setJavaScriptEnabled(settings.javascriptEnabled()));
            } else {
                browser = chromium.launch(new BrowserType.LaunchOptions()
                        .setHeadless(settings.headless())
                        .setArgs(args));
                context = browser.newContext(new Browser.NewContextOptions()
                        .setUserAgent(settings.userAgent())
                        .setJavaScriptEnabled(settings.javascriptEnabled()));
            }
            if (!settings.autoLoadImages()) {
                context.route("**/*", route -> {
                    if ("image".equals(route.request().resourceType())) {
                        route.abort();
                    } else {
                        route.resume();
                    }
                });
            }
            log.info("Playwright chromium engine started (headless={}, javascript={}, images={}, cookies={})",
                    settings.headless(), settings.javascriptEnabled(), settings.autoLoadImages(),
                    settings.persistentCookies() ? CookiePolicy.FORCE_PERSISTENT : CookiePolicy.NO_PERSISTENT);
        } catch (PlaywrightException e) {
            close();
            throw new EngineException("Unable to start Playwright chromium engine: " + e.getMessage(), e);
        }
    }

    @Override
    public RenderPage newPage(Executor callbacks) {
        if (context == null) {
            throw new EngineException("Playwright engine not started");
        }
        Page page = context.newPage();
        double timeoutMs = settings.navigationTimeout().toMillis();
        page.setDefaultTimeout(timeoutMs);
        page.setDefaultNavigationTimeout(timeoutMs);
        return new PlaywrightPage(page, Objects.requireNonNull(callbacks, "callbacks"));
    }

    @Override
    public String name() {
        return "playwright-chromium";
    }

    @Override
    public void close() {
        closeQuietly(context, "context");
        closeQuietly(browser, "browser");
        closeQuietly(playwright, "playwright");
        context = null;
        browser = null;
        playwright = null;
    }

    private static void closeQuietly(AutoCloseable closeable, String what) {
        if (closeable == null) return;
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Failed to close Playwright {}: {}", what, e.getMessage());
        }
    }

    private final class PlaywrightPage implements RenderPage {

        private final Page page;
        private final Executor callbacks;
        private boolean closed;

        PlaywrightPage(Page page, Executor callbacks) {
            this.page = page;
            this.callbacks = callbacks;
        }

        @Override
        public void startLoad(String url, Consumer<Boolean> onLoadFinished) {
            page.onLoad(p -> {
                if (!closed) {
                    callbacks.execute(() -> onLoadFinished.accept(true));
                }
            });
            try {
                page.navigate(url, new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.COMMIT)
                        .setTimeout(settings.navigationTimeout().toMillis()));
            } catch (TimeoutError e) {
                // the job's own load timer reports this
                log.debug("Navigation to {} not committed in time", url);
            } catch (PlaywrightException e) {
                log.debug("Navigation to {} failed: {}", url, e.getMessage());
                callbacks.execute(() -> onLoadFinished.accept(false));
            }
        }

        @Override
        public void extractText(Consumer<String> callback) {
            String text;
            try {
                Object value = page.evaluate(PLAIN_TEXT_SCRIPT);
                text = value == null ? "" : value.toString();
            } catch (PlaywrightException e) {
                log.warn("Text extraction failed for {}: {}", currentUrl(), e.getMessage());
                text = "";
            }
            String result = text;
            callbacks.execute(() -> callback.accept(result));
        }

        @Override
        public void serializeHtml(Consumer<String> callback) {
            String html;
            try {
                html = page.content();
            } catch (PlaywrightException e) {
                log.warn("HTML serialization failed for {}: {}", currentUrl(), e.getMessage());
                html = "";
            }
            String result = html;
            callbacks.execute(() -> callback.accept(result));
        }

        @Override
        public String currentTitle() {
            try {
                return page.title();
            } catch (PlaywrightException e) {
                return "";
            }
        }

        @Override
        public String currentUrl() {
            return page.url();
        }

        @Override
        public boolean pumpsEvents() {
            return true;
        }

        @Override
        public void pumpEvents(Duration slice) {
            if (closed) return;
            try {
                page.waitForTimeout(slice.toMillis());
            } catch (PlaywrightException e) {
                log.debug("Event pump interrupted: {}", e.getMessage());
            }
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            try {
                page.close();
            } catch (PlaywrightException e) {
                log.warn("Failed to close page {}: {}", currentUrl(), e.getMessage());
            }
        }
    }
}
