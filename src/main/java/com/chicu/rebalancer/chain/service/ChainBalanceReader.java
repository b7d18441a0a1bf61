package com.chicu.rebalancer.chain.service;

import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.chain.client.ChainClient;
import com.chicu.rebalancer.chain.model.ChainBalances;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.exception.ChainReadException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Чтение балансов кошельков на обеих сетях.
 * Ошибка любого чтения даёт {@link ChainReadException}, тик прерывается.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChainBalanceReader {

    private static final AtomicLong THREAD_SEQ = new AtomicLong();

    private final ChainClient chainClient;
    private final RebalancerProperties props;

    private final ExecutorService readers = Executors.newFixedThreadPool(2, r -> {
        Thread t = new Thread(r);
        t.setName("balance-reader-" + THREAD_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @PreDestroy
    void shutdown() {
        readers.shutdownNow();
    }

    /** Баланс отслеживаемого токена на стороне {@code side}. */
    public BigInteger readBalance(ChainSide side) {
        RebalancerProperties.Chain chain = props.chain(side);
        BigInteger balance = chainClient.getBalance(side, chain.getTokenAddress(), chain.getWalletAddress());
        if (balance == null || balance.signum() < 0) {
            throw new ChainReadException("Malformed balance " + balance + " on " + chain.displayName());
        }
        return balance;
    }

    /** Нативный баланс (газ) кошелька на стороне {@code side}. */
    public BigInteger readNativeBalance(ChainSide side) {
        RebalancerProperties.Chain chain = props.chain(side);
        BigInteger balance = chainClient.getBalance(side, RebalancerProperties.NATIVE_ASSET, chain.getWalletAddress());
        if (balance == null || balance.signum() < 0) {
            throw new ChainReadException("Malformed native balance " + balance + " on " + chain.displayName());
        }
        return balance;
    }

    /** Обе сети читаются параллельно, ждём оба результата. */
    public ChainBalances readAll() {
        CompletableFuture<BigInteger> a = CompletableFuture.supplyAsync(() -> readBalance(ChainSide.CHAIN_A), readers);
        CompletableFuture<BigInteger> b = CompletableFuture.supplyAsync(() -> readBalance(ChainSide.CHAIN_B), readers);
        try {
            CompletableFuture.allOf(a, b).join();
            ChainBalances balances = new ChainBalances(a.join(), b.join());
            log.debug("Балансы: A={} B={}", balances.getChainA(), balances.getChainB());
            return balances;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ChainReadException cre) throw cre;
            throw new ChainReadException("Balance read failed: " + cause.getMessage(), cause);
        }
    }
}
