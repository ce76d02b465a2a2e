package com.jasmin.floodguard.models;

public enum AnomalyLevel {
    LOW,
    MEDIUM,
    HIGH
}
