package com.chicu.rebalancer.bridge.model;

import java.util.Locale;

public enum BridgeTxStatus {
    PENDING,
    COMPLETED,
    FAILED;

    /** Всё, что агрегатор пишет помимо COMPLETED/FAILED, считаем ожиданием. */
    public static BridgeTxStatus parse(String raw) {
        if (raw == null) return PENDING;
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "COMPLETED" -> COMPLETED;
            case "FAILED" -> FAILED;
            default -> PENDING;
        };
    }
}
