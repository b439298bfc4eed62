package org.smileyface.pageextractor.processor;

/**
 * Lifecycle state of the {@link Dispatcher}.
 */
public enum DispatcherState {
    NEW,
    RUNNING,
    STOPPED,
    ERROR
}
