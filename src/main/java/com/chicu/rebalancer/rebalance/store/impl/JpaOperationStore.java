package com.chicu.rebalancer.rebalance.store.impl;

import com.chicu.rebalancer.bridge.model.ExecutionStep;
import com.chicu.rebalancer.exception.PersistenceException;
import com.chicu.rebalancer.rebalance.model.OperationStatus;
import com.chicu.rebalancer.rebalance.model.RebalanceOperation;
import com.chicu.rebalancer.rebalance.repository.RebalanceOperationRepository;
import com.chicu.rebalancer.rebalance.store.OperationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Транзакции открываются внутри {@link #guarded}, поэтому ошибки начала, flush и commit
 * тоже превращаются в {@link PersistenceException}.
 */
@Slf4j
@Service
public class JpaOperationStore implements OperationStore {

    private static final int ERROR_MESSAGE_LIMIT = 2000;

    private final RebalanceOperationRepository repo;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public JpaOperationStore(RebalanceOperationRepository repo, PlatformTransactionManager transactionManager) {
        this.repo = repo;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
    }

    @Override
    public RebalanceOperation insert(RebalanceOperation operation) {
        if (operation.getAmountToBridge() == null || operation.getAmountToBridge().signum() <= 0) {
            throw new PersistenceException("Refusing to store operation with non-positive amount " + operation.getAmountToBridge());
        }
        return guarded("insert", writeTx, () -> {
            if (repo.existsByStatusIn(OperationStatus.UNFINISHED)) {
                throw new PersistenceException("Another rebalance operation is still unfinished");
            }
            if (operation.getId() == null) {
                operation.setId(UUID.randomUUID().toString());
            } else if (repo.existsById(operation.getId())) {
                throw new PersistenceException("Operation id " + operation.getId() + " is already used");
            }
            operation.setStatus(OperationStatus.PENDING);
            operation.setBridgeTxHash(null);
            operation.setBridgeAmountOut(null);
            operation.setSourceSwapTxHash(null);
            operation.setSourceSwapAmountOut(null);
            operation.setDestSwapTxHash(null);
            operation.setErrorMessage(null);
            operation.setCompletedAt(null);
            if (operation.getCreatedAt() == null) {
                operation.setCreatedAt(Instant.now());
            }
            RebalanceOperation saved = repo.saveAndFlush(operation);
            log.info("💾 Создана операция {}: {} amount={}", saved.getId(), saved.getDirection(), saved.getAmountToBridge());
            return saved;
        });
    }

    @Override
    public Optional<RebalanceOperation> findOldestUnfinished() {
        return guarded("findOldestUnfinished", readTx,
                () -> repo.findFirstByStatusInOrderByCreatedAtAsc(OperationStatus.UNFINISHED));
    }

    @Override
    public Optional<RebalanceOperation> findLatest() {
        return guarded("findLatest", readTx, repo::findFirstByOrderByCreatedAtDesc);
    }

    @Override
    public RebalanceOperation markInProgress(String id) {
        return guarded("markInProgress", writeTx, () -> {
            RebalanceOperation op = load(id, OperationStatus.UNFINISHED);
            op.setStatus(OperationStatus.IN_PROGRESS);
            return repo.saveAndFlush(op);
        });
    }

    @Override
    public RebalanceOperation recordStep(String id, ExecutionStep step, String txHash, BigInteger expectedAmountOut) {
        if (txHash == null || txHash.isBlank()) {
            throw new PersistenceException("Operation " + id + ": empty " + step.label() + " tx hash");
        }
        return guarded("recordStep", writeTx, () -> {
            RebalanceOperation op = load(id, EnumSet.of(OperationStatus.IN_PROGRESS));
            switch (step) {
                case SOURCE_SWAP -> {
                    op.setSourceSwapTxHash(writeOnce(op, step, op.getSourceSwapTxHash(), txHash));
                    if (op.getSourceSwapAmountOut() == null) op.setSourceSwapAmountOut(expectedAmountOut);
                }
                case BRIDGE -> {
                    op.setBridgeTxHash(writeOnce(op, step, op.getBridgeTxHash(), txHash));
                    if (op.getBridgeAmountOut() == null) op.setBridgeAmountOut(expectedAmountOut);
                }
                case DESTINATION_SWAP -> {
                    if (op.getBridgeTxHash() == null) {
                        throw new PersistenceException("Operation " + id + " has no bridge tx before the destination swap");
                    }
                    op.setDestSwapTxHash(writeOnce(op, step, op.getDestSwapTxHash(), txHash));
                }
            }
            log.info("🧾 Операция {}: {} {}", id, step.label(), txHash);
            return repo.saveAndFlush(op);
        });
    }

    @Override
    public RebalanceOperation markCompleted(String id, String txHash) {
        return guarded("markCompleted", writeTx, () -> {
            RebalanceOperation op = load(id, EnumSet.of(OperationStatus.IN_PROGRESS));
            if (txHash == null || txHash.isBlank()) {
                if (op.getBridgeTxHash() == null) {
                    throw new PersistenceException("Operation " + id + " has no bridge tx hash");
                }
            } else {
                op.setBridgeTxHash(writeOnce(op, ExecutionStep.BRIDGE, op.getBridgeTxHash(), txHash));
            }
            op.setStatus(OperationStatus.COMPLETED);
            op.setCompletedAt(Instant.now());
            log.info("✅ Операция {} завершена, tx={}", id, op.getBridgeTxHash());
            return repo.saveAndFlush(op);
        });
    }

    @Override
    public RebalanceOperation markFailed(String id, String errorMessage) {
        return guarded("markFailed", writeTx, () -> {
            RebalanceOperation op = load(id, OperationStatus.UNFINISHED);
            op.setStatus(OperationStatus.FAILED);
            op.setErrorMessage(truncate(errorMessage == null || errorMessage.isBlank() ? "unknown error" : errorMessage));
            op.setCompletedAt(Instant.now());
            log.warn("❌ Операция {} помечена FAILED: {}", id, op.getErrorMessage());
            return repo.saveAndFlush(op);
        });
    }

    // ===================== helpers =====================

    private RebalanceOperation load(String id, Set<OperationStatus> allowed) {
        RebalanceOperation op = repo.findById(id)
                .orElseThrow(() -> new PersistenceException("Rebalance operation " + id + " not found"));
        if (!allowed.contains(op.getStatus())) {
            throw new PersistenceException("Operation " + id + " is " + op.getStatus() + ", expected one of " + allowed);
        }
        return op;
    }

    private static String writeOnce(RebalanceOperation op, ExecutionStep step, String current, String txHash) {
        if (current == null || current.equalsIgnoreCase(txHash)) {
            return current == null ? txHash : current;
        }
        throw new PersistenceException("Operation " + op.getId() + " already has " + step.label() + " tx " + current
                + ", refusing to replace it with " + txHash);
    }

    private static String truncate(String s) {
        return s.length() <= ERROR_MESSAGE_LIMIT ? s : s.substring(0, ERROR_MESSAGE_LIMIT);
    }

    private static <T> T guarded(String what, TransactionTemplate template, Supplier<T> action) {
        try {
            return template.execute(status -> action.get());
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceException("Operation store " + what + " failed: " + e.getMessage(), e);
        }
    }
}
