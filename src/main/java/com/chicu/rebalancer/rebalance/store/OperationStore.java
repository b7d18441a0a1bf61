package com.chicu.rebalancer.rebalance.store;

import com.chicu.rebalancer.bridge.model.ExecutionStep;
import com.chicu.rebalancer.exception.PersistenceException;
import com.chicu.rebalancer.rebalance.model.RebalanceOperation;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Единственный владелец записей {@link RebalanceOperation}.
 * Все методы бросают {@link PersistenceException} при ошибке хранилища или недопустимом переходе.
 */
public interface OperationStore {

    /**
     * Сохраняет новую операцию в статусе PENDING.
     * Отказывает, если уже есть незавершённая (PENDING / IN_PROGRESS).
     */
    RebalanceOperation insert(RebalanceOperation operation);

    /** Самая старая незавершённая операция по created_at. */
    Optional<RebalanceOperation> findOldestUnfinished();

    /** Последняя операция в любом статусе. */
    Optional<RebalanceOperation> findLatest();

    RebalanceOperation markInProgress(String id);

    /**
     * Фиксирует отправленную транзакцию шага и ожидаемый выход по котировке.
     * Хеш шага пишется один раз и больше не меняется; шаг BRIDGE заполняет bridge_txhash.
     */
    RebalanceOperation recordStep(String id, ExecutionStep step, String txHash, BigInteger expectedAmountOut);

    RebalanceOperation markCompleted(String id, String txHash);

    RebalanceOperation markFailed(String id, String errorMessage);
}
