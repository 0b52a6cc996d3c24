package com.kidzout.crawler.model.enums;

/**
 * Lifecycle of a single crawl run.
 */
public enum RunState {
    IDLE,
    LOADING,
    DISPATCHING,
    COLLECTING,
    ENRICHING,
    PERSISTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
