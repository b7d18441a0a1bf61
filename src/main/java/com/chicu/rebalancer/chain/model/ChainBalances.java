package com.chicu.rebalancer.chain.model;

import com.chicu.rebalancer.chain.ChainSide;
import lombok.Value;

import java.math.BigInteger;

/** Балансы отслеживаемого токена на обеих сетях, в минимальных единицах. */
@Value
public class ChainBalances {
    BigInteger chainA;
    BigInteger chainB;

    public BigInteger get(ChainSide side) {
        return side == ChainSide.CHAIN_A ? chainA : chainB;
    }
}
