package com.chicu.rebalancer.bridge.model;

import com.chicu.rebalancer.rebalance.model.Direction;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class BridgeRequest {
    Direction direction;
    /** Токен на исходной сети */
    String fromTokenAddress;
    /** Токен на сети назначения */
    String toTokenAddress;
    /** Сумма в минимальных единицах исходного токена */
    BigInteger amount;
}
