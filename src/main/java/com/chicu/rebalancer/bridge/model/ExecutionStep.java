package com.chicu.rebalancer.bridge.model;

/** Транзакции обходного маршрута в порядке отправки. Прямой маршрут состоит из одного BRIDGE. */
public enum ExecutionStep {
    SOURCE_SWAP("source swap"),
    BRIDGE("bridge"),
    DESTINATION_SWAP("destination swap");

    private final String label;

    ExecutionStep(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
