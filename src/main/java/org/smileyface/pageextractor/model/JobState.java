package org.smileyface.pageextractor.model;

/**
 * Lifecycle state of a {@link PageJob}. States only move forward.
 */
public enum JobState {
    /** Queued, not yet picked up by the dispatcher. */
    PENDING,

    /** Load requested from the engine, waiting for the load-finished signal. */
    LOADING,

    /** Load finished; waiting out the settle delay so page scripts can run. */
    SETTLING,

    /** Text (and HTML for pages) being pulled out of the engine. */
    EXTRACTING,

    /** Result written and completion signalled. Terminal. */
    DONE;

    /**
     * Whether a job in this state may move to {@code next}.
     * PDF jobs skip straight from PENDING to DONE; a load timeout skips SETTLING.
     */
    public boolean canTransitionTo(JobState next) {
        if (next == null) return false;
        return switch (this) {
            case PENDING -> next == LOADING || next == DONE;
            case LOADING -> next == SETTLING || next == EXTRACTING;
            case SETTLING -> next == EXTRACTING;
            case EXTRACTING -> next == DONE;
            case DONE -> false;
        };
    }
}
