package com.chicu.rebalancer.bridge.service;

import com.chicu.rebalancer.bridge.client.BridgeAggregatorClient;
import com.chicu.rebalancer.bridge.model.BridgeTxStatus;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.exception.MonitorTimeoutException;
import com.chicu.rebalancer.exception.QuoteUnavailableException;
import com.chicu.rebalancer.exception.RebalanceException;
import com.chicu.rebalancer.rebalance.model.Direction;
import com.chicu.rebalancer.util.retry.BackoffPolicy;
import com.chicu.rebalancer.util.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Random;

/**
 * Опрашивает bridge-status, пока обе стороны не завершатся или одна не упадёт.
 * Паузы между опросами по {@link BackoffPolicy}, спит в потоке вызывающего.
 */
@Slf4j
@Service
public class TransactionMonitor {

    private final BridgeAggregatorClient aggregator;
    private final RebalancerProperties props;
    private final Sleeper sleeper;
    private final Random random;

    @Autowired
    public TransactionMonitor(BridgeAggregatorClient aggregator, RebalancerProperties props) {
        this(aggregator, props, Sleeper.THREAD, new Random());
    }

    public TransactionMonitor(BridgeAggregatorClient aggregator, RebalancerProperties props,
                              Sleeper sleeper, Random random) {
        this.aggregator = aggregator;
        this.props = props;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * @return {@link BridgeTxStatus#COMPLETED} или {@link BridgeTxStatus#FAILED}
     * @throws MonitorTimeoutException если попытки кончились, а статус всё ещё PENDING
     */
    public BridgeTxStatus await(String txHash, Direction direction) {
        BackoffPolicy policy = props.getMonitor().toBackoffPolicy();
        long fromChainId = props.chain(direction.source()).getChainId();
        long toChainId = props.chain(direction.destination()).getChainId();

        log.info("⏳ Мониторинг {} ({}), до {} попыток", txHash, direction, policy.getMaxAttempts());

        for (int attempt = 0; attempt < policy.getMaxAttempts(); attempt++) {
            BridgeTxStatus status = poll(txHash, fromChainId, toChainId, attempt);
            if (status != BridgeTxStatus.PENDING) {
                log.info("Мониторинг {}: {} на попытке {}", txHash, status, attempt + 1);
                return status;
            }
            if (attempt + 1 < policy.getMaxAttempts()) {
                Duration delay = policy.delayFor(attempt, random);
                log.debug("Мониторинг {}: PENDING, следующий опрос через {} мс", txHash, delay.toMillis());
                sleep(delay, txHash);
            }
        }
        throw new MonitorTimeoutException(txHash, policy.getMaxAttempts());
    }

    private BridgeTxStatus poll(String txHash, long fromChainId, long toChainId, int attempt) {
        try {
            return aggregator.bridgeStatus(txHash, fromChainId, toChainId).overall();
        } catch (QuoteUnavailableException e) {
            // чтение идемпотентно: сбой опроса считаем попыткой со статусом PENDING
            log.warn("Мониторинг {}: опрос {} не удался: {}", txHash, attempt + 1, e.getMessage());
            return BridgeTxStatus.PENDING;
        }
    }

    private void sleep(Duration delay, String txHash) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RebalanceException("Interrupted while monitoring " + txHash, e);
        }
    }
}
