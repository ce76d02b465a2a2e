package com.jasmin.floodguard.models;

/**
 * Mitigation actions in increasing order of severity.
 */
public enum MitigationAction {
    NONE,
    RATE_LIMIT,
    CHALLENGE,
    BLOCK
}
