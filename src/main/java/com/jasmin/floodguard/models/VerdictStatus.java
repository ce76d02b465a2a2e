package com.jasmin.floodguard.models;

public enum VerdictStatus {
    /** First time this entry's evaluation is acted upon. */
    FRESH,
    /** The source was already handled for this or a later evaluation, or is on the block list. */
    ALREADY_HANDLED
}
