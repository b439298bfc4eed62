package org.smileyface.pageextractor.processor;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-job time bounds.
 *
 * @param loadTimeout time allowed from load start to extraction, partial content is scraped after it
 * @param settleDelay grace window after load finished so page scripts can finish rendering
 */
public record JobTimings(Duration loadTimeout, Duration settleDelay) {

    public static final Duration DEFAULT_LOAD_TIMEOUT = Duration.ofMillis(30000);
    public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofMillis(2000);

    public JobTimings {
        Objects.requireNonNull(loadTimeout, "loadTimeout");
        Objects.requireNonNull(settleDelay, "settleDelay");
        if (loadTimeout.isNegative() || loadTimeout.isZero()) {
            throw new IllegalArgumentException("loadTimeout must be positive");
        }
        if (settleDelay.isNegative()) {
            throw new IllegalArgumentException("settleDelay must not be negative");
        }
    }

    public static JobTimings defaults() {
        return new JobTimings(DEFAULT_LOAD_TIMEOUT, DEFAULT_SETTLE_DELAY);
    }
}
