package org.smileyface.pageextractor.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.pageextractor.engine.CookiePolicy;
import org.smileyface.pageextractor.engine.EngineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.time.Duration;

/**
 * Configuration properties for the extraction service.
 */
@ConfigurationProperties(prefix = "extractor")
public class ExtractorProperties {

    private static final Logger log = LogManager.getLogger(ExtractorProperties.class);

    static final String DEFAULTS_RESOURCE = "PageExtractorConfig.json";

    /** Per-job load timeout in milliseconds; partial content is scraped once it elapses. */
    private long timeoutMs = 30000;

    /** Delay after load finished before scraping, lets page scripts render. */
    private long settleDelayMs = 2000;

    /** Added to the timeout to form the caller-side wait bound. */
    private long waitGraceMs = 10000;

    /** Optional user agent for page loads and PDF downloads. */
    private String userAgent;

    /** Bearer token required by every endpoint except /health; blank disables auth. */
    private String apiKey = "";

    private boolean javascriptEnabled = true;

    private boolean autoLoadImages = false;

    private boolean pluginsEnabled = false;

    /** Keep cookies across restarts; only effective together with {@link #storagePath}. */
    private boolean persistCookies = false;

    /** Browser profile directory used when cookies persist. */
    private String storagePath;

    /** Send a HEAD request to detect PDFs whose URL lacks a .pdf suffix. */
    private boolean detectPdfByContentType = false;

    private Engine engine = new Engine();

    /**
     * Loads default values from classpath resource PageExtractorConfig.json if available.
     * Spring will still bind/override values from application properties as usual.
     */
    public ExtractorProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                ObjectMapper mapper = new ObjectMapper()
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                PageExtractorConfig cfg = mapper.readValue(in, PageExtractorConfig.class);
                if (cfg.timeoutMs != null && cfg.timeoutMs > 0) this.timeoutMs = cfg.timeoutMs;
                if (cfg.settleDelayMs != null && cfg.settleDelayMs >= 0) this.settleDelayMs = cfg.settleDelayMs;
                if (cfg.waitGraceMs != null && cfg.waitGraceMs >= 0) this.waitGraceMs = cfg.waitGraceMs;
                if (cfg.userAgent != null && !cfg.userAgent.isBlank()) this.userAgent = cfg.userAgent;
                if (cfg.engineType != null && !cfg.engineType.isBlank()) this.engine.setType(cfg.engineType);
            }
        } catch (Exception e) {
            // keep built-in defaults, do not fail startup over the optional defaults file
            log.error("Failed to load default extractor configuration from classpath resource {}", DEFAULTS_RESOURCE, e);
        }
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : 30000;
    }

    public long getSettleDelayMs() {
        return settleDelayMs;
    }

    public void setSettleDelayMs(long settleDelayMs) {
        this.settleDelayMs = Math.max(0, settleDelayMs);
    }

    public long getWaitGraceMs() {
        return waitGraceMs;
    }

    public void setWaitGraceMs(long waitGraceMs) {
        this.waitGraceMs = Math.max(0, waitGraceMs);
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? null : userAgent;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isJavascriptEnabled() {
        return javascriptEnabled;
    }

    public void setJavascriptEnabled(boolean javascriptEnabled) {
        this.javascriptEnabled = javascriptEnabled;
    }

    public boolean isAutoLoadImages() {
        return autoLoadImages;
    }

    public void setAutoLoadImages(boolean autoLoadImages) {
        this.autoLoadImages = autoLoadImages;
    }

    public boolean isPluginsEnabled() {
        return pluginsEnabled;
    }

    public void setPluginsEnabled(boolean pluginsEnabled) {
        this.pluginsEnabled = pluginsEnabled;
    }

    public boolean isPersistCookies() {
        return persistCookies;
    }

    public void setPersistCookies(boolean persistCookies) {
        this.persistCookies = persistCookies;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = (storagePath == null || storagePath.isBlank()) ? null : storagePath;
    }

    public boolean isDetectPdfByContentType() {
        return detectPdfByContentType;
    }

    public void setDetectPdfByContentType(boolean detectPdfByContentType) {
        this.detectPdfByContentType = detectPdfByContentType;
    }

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine != null ? engine : new Engine();
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }

    public Duration settleDelay() {
        return Duration.ofMillis(settleDelayMs);
    }

    /**
     * Engine-wide settings derived from these properties. Cookies persist only when both
     * {@code persist-cookies} and {@code storage-path} are set.
     */
    public EngineSettings toEngineSettings() {
        CookiePolicy cookies = (persistCookies && storagePath != null)
                ? CookiePolicy.FORCE_PERSISTENT
                : CookiePolicy.NO_PERSISTENT;
        return new EngineSettings(userAgent, javascriptEnabled, autoLoadImages, pluginsEnabled, cookies,
                storagePath, engine.isHeadless(), timeout());
    }

    public static class Engine {

        /** "playwright" (default) or "jsoup". */
        private String type = "playwright";

        private boolean headless = true;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = (type == null || type.isBlank()) ? "playwright" : type.trim().toLowerCase();
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }
    }

    // --------- Nested config DTO for JSON mapping ---------
    public static class PageExtractorConfig {
        public Long timeoutMs;
        public Long settleDelayMs;
        public Long waitGraceMs;
        public String userAgent;
        public String engineType;
    }
}
