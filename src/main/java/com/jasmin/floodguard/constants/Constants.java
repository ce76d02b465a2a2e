package com.jasmin.floodguard.constants;

public class Constants {
    public static final String PER_SOURCE_RATE_EXCEEDED = "PER_SOURCE_RATE_EXCEEDED";
    public static final String LOW_ENTROPY_TRAFFIC = "LOW_ENTROPY_TRAFFIC";
    public static final String REPEATED_RATE_LIMIT = "REPEATED_RATE_LIMIT";
    public static final String KNOWN_BLOCKED_SOURCE = "KNOWN_BLOCKED_SOURCE";
    public static final String DDOS_ATTACK = "DDOS_ATTACK";
}
