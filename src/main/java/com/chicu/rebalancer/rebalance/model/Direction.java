package com.chicu.rebalancer.rebalance.model;

import com.chicu.rebalancer.chain.ChainSide;

public enum Direction {
    CHAIN_A_TO_CHAIN_B(ChainSide.CHAIN_A),
    CHAIN_B_TO_CHAIN_A(ChainSide.CHAIN_B);

    private final ChainSide source;

    Direction(ChainSide source) {
        this.source = source;
    }

    public ChainSide source() {
        return source;
    }

    public ChainSide destination() {
        return source.other();
    }

    public static Direction from(ChainSide source) {
        return source == ChainSide.CHAIN_A ? CHAIN_A_TO_CHAIN_B : CHAIN_B_TO_CHAIN_A;
    }
}
