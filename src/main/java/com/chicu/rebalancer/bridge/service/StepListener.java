package com.chicu.rebalancer.bridge.service;

import com.chicu.rebalancer.bridge.model.ExecutionStep;

import java.math.BigInteger;

/**
 * Вызывается сразу после отправки каждой транзакции, до ожидания квитанции.
 * Если вызов бросает исключение, оркестрация останавливается.
 */
@FunctionalInterface
public interface StepListener {

    void onSubmitted(ExecutionStep step, String txHash, BigInteger expectedAmountOut);
}
