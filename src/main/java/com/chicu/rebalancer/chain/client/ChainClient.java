package com.chicu.rebalancer.chain.client;

import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.chain.model.TransactionRequest;

import java.math.BigInteger;

public interface ChainClient {

    /** Адрес, от имени которого подписываются транзакции. */
    String senderAddress();

    /**
     * Баланс кошелька в минимальных единицах токена.
     * Для нативного адреса-заглушки — нативный баланс.
     */
    BigInteger getBalance(ChainSide chain, String tokenAddress, String walletAddress);

    /** Текущий allowance; для нативного актива — 2^256-1. */
    BigInteger getAllowance(ChainSide chain, String tokenAddress, String owner, String spender);

    /** Отправляет approve и возвращает хеш, не дожидаясь подтверждения. */
    String approve(ChainSide chain, String tokenAddress, String spender, BigInteger amount);

    BigInteger estimateGas(ChainSide chain, TransactionRequest tx);

    String sendTransaction(ChainSide chain, TransactionRequest tx);

    /**
     * Ждёт receipt и нужное число подтверждений.
     *
     * @return true, если транзакция выполнилась успешно
     */
    boolean waitForReceipt(ChainSide chain, String txHash, int confirmations);
}
