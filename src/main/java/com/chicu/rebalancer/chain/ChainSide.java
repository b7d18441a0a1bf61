package com.chicu.rebalancer.chain;

/** Одна из двух обслуживаемых сетей. */
public enum ChainSide {
    CHAIN_A,
    CHAIN_B;

    public ChainSide other() {
        return this == CHAIN_A ? CHAIN_B : CHAIN_A;
    }
}
