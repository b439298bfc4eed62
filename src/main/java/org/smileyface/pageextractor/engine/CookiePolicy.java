package org.smileyface.pageextractor.engine;

/**
 * How the engine's browsing profile treats cookies.
 */
public enum CookiePolicy {
    /** Cookies live only as long as the engine. */
    NO_PERSISTENT,

    /** Cookies are written to the profile's storage path and survive restarts. */
    FORCE_PERSISTENT
}
