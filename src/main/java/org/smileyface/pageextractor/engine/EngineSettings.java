package org.smileyface.pageextractor.engine;

import java.time.Duration;

/**
 * Engine-wide configuration, read once when the engine starts.
 *
 * @param userAgent          user agent override, or null for the engine default
 * @param javascriptEnabled  whether page scripts run
 * @param autoLoadImages     whether images are fetched
 * @param pluginsEnabled     whether browser plugins are allowed
 * @param cookiePolicy       cookie persistence
 * @param storagePath        profile directory used with {@link CookiePolicy#FORCE_PERSISTENT}
 * @param headless           run the browser without a display
 * @param navigationTimeout  upper bound for a single navigation or fetch
 */
public record EngineSettings(String userAgent,
                             boolean javascriptEnabled,
                             boolean autoLoadImages,
                             boolean pluginsEnabled,
                             CookiePolicy cookiePolicy,
                             String storagePath,
                             boolean headless,
                             Duration navigationTimeout) {

    public static EngineSettings defaults() {
        return new EngineSettings(null, true, false, false, CookiePolicy.NO_PERSISTENT, null, true,
                Duration.ofMillis(30000));
    }

    public boolean persistentCookies() {
        return cookiePolicy == CookiePolicy.FORCE_PERSISTENT && storagePath != null && !storagePath.isBlank();
    }
}
