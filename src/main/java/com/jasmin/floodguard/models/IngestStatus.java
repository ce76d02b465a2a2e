package com.jasmin.floodguard.models;

public enum IngestStatus {
    ACCEPTED,
    /** Missing source key or timestamp. */
    DROPPED_INVALID,
    /** Timestamp ahead of the local clock. */
    DROPPED_FUTURE,
    /** Pending buffer full. */
    DROPPED_BACKPRESSURE
}
