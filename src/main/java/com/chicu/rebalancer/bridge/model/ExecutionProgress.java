package com.chicu.rebalancer.bridge.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Что из обходного маршрута уже отправлено в сеть.
 * Суммы берутся из котировки шага и задают вход следующего шага.
 */
@Value
@Builder
public class ExecutionProgress {
    String sourceSwapTxHash;
    BigInteger sourceSwapAmountOut;
    String bridgeTxHash;
    BigInteger bridgeAmountOut;
    String destinationSwapTxHash;

    public static final ExecutionProgress NONE = ExecutionProgress.builder().build();
}
