package com.chicu.rebalancer.rebalance.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Что и куда переводить. Балансы и пороги в USD нужны только для уведомления и аудита.
 */
@Value
@Builder
public class RebalancePlan {
    Direction direction;
    String tokenAddress;
    int tokenDecimals;
    /** В минимальных единицах исходного токена, всегда > 0 */
    BigInteger amount;
    BigDecimal amountUsd;

    BigInteger sourceBalance;
    BigInteger destinationBalance;

    BigDecimal balanceUsdA;
    BigDecimal balanceUsdB;
    BigDecimal thresholdUsdA;
    BigDecimal thresholdUsdB;
}
