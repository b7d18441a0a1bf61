package com.chicu.rebalancer.bridge.model;

import lombok.Value;

/**
 * Результат оркестрации. {@code txHash} всегда хеш транзакции моста.
 * {@code settled = true}: перевод уже подтверждён на сети назначения, мониторинг не нужен.
 */
@Value
public class BridgeExecution {
    String txHash;
    RoutePath path;
    boolean settled;
}
