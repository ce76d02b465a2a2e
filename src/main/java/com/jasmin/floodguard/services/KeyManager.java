package com.jasmin.floodguard.services;

public class KeyManager {
    public static final String ALERT_CHANNEL = "flood-guard:alerts";

    public static String getBlockKey(String prefix, String sourceKey) {
        return prefix + ":block:" + sourceKey;
    }

    public static String getBlockIndexKey(String prefix) {
        return prefix + ":blocked";
    }
}
