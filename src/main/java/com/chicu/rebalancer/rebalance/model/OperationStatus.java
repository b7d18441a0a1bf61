package com.chicu.rebalancer.rebalance.model;

import java.util.EnumSet;
import java.util.Set;

public enum OperationStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public static final Set<OperationStatus> UNFINISHED = EnumSet.of(PENDING, IN_PROGRESS);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
