package com.chicu.rebalancer.rebalance.store.impl;

import com.chicu.rebalancer.exception.PersistenceException;
import com.chicu.rebalancer.rebalance.model.Direction;
import com.chicu.rebalancer.rebalance.model.OperationStatus;
import com.chicu.rebalancer.rebalance.model.RebalanceOperation;
import com.chicu.rebalancer.rebalance.repository.RebalanceOperationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/** Ошибки самого менеджера транзакций, которые не видны внутри репозитория. */
@DisplayName("JpaOperationStore transaction failure Tests")
class JpaOperationStoreTransactionFailureTest {

    private RebalanceOperationRepository repo;
    private PlatformTransactionManager txManager;
    private JpaOperationStore store;

    @BeforeEach
    void setUp() {
        repo = mock(RebalanceOperationRepository.class);
        txManager = mock(PlatformTransactionManager.class);
        store = new JpaOperationStore(repo, txManager);
    }

    @Test
    @DisplayName("Unavailable connection on read becomes PersistenceException")
    void testBeginFailure() {
        when(txManager.getTransaction(any())).thenThrow(new CannotCreateTransactionException("Connection refused"));

        PersistenceException e = assertThrows(PersistenceException.class, () -> store.findOldestUnfinished());

        assertTrue(e.getMessage().contains("findOldestUnfinished"));
        assertInstanceOf(CannotCreateTransactionException.class, e.getCause());
        verifyNoInteractions(repo);
    }

    @Test
    @DisplayName("Commit failure on markFailed becomes PersistenceException")
    void testCommitFailure() {
        TransactionStatus status = new SimpleTransactionStatus();
        when(txManager.getTransaction(any())).thenReturn(status);
        doThrow(new TransactionSystemException("Could not commit JPA transaction")).when(txManager).commit(status);
        when(repo.findById("op-1")).thenReturn(Optional.of(inProgress()));
        when(repo.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        PersistenceException e = assertThrows(PersistenceException.class, () -> store.markFailed("op-1", "boom"));

        assertTrue(e.getMessage().contains("markFailed"));
        assertInstanceOf(TransactionSystemException.class, e.getCause());
    }

    @Test
    @DisplayName("Constraint violation on flush becomes PersistenceException and rolls back")
    void testFlushFailure() {
        TransactionStatus status = new SimpleTransactionStatus();
        when(txManager.getTransaction(any())).thenReturn(status);
        when(repo.findById("op-1")).thenReturn(Optional.of(inProgress()));
        when(repo.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("value too long"));

        assertThrows(PersistenceException.class, () -> store.markCompleted("op-1", "0xabc"));

        verify(txManager).rollback(status);
        verify(txManager, never()).commit(any());
    }

    private static RebalanceOperation inProgress() {
        return RebalanceOperation.builder()
                .id("op-1")
                .direction(Direction.CHAIN_A_TO_CHAIN_B)
                .tokenAddress("0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa")
                .tokenDecimals(18)
                .amountToBridge(BigInteger.TEN)
                .status(OperationStatus.IN_PROGRESS)
                .createdAt(Instant.now())
                .build();
    }
}
