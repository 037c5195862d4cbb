package com.siteintel.scrape.model;

public enum RunStatus {
    COMPLETED,
    ABORTED,
    FAILED
}
