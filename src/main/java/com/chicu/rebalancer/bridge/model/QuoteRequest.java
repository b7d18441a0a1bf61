package com.chicu.rebalancer.bridge.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;

@Value
@Builder
public class QuoteRequest {
    long fromChainId;
    long toChainId;
    String fromTokenAddress;
    String toTokenAddress;
    BigInteger fromAmount;
    String userAddress;
    BigDecimal slippage;

    public boolean isSameChain() {
        return fromChainId == toChainId;
    }
}
