package com.chicu.rebalancer.rebalance.repository;

import com.chicu.rebalancer.rebalance.model.OperationStatus;
import com.chicu.rebalancer.rebalance.model.RebalanceOperation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

@Repository
public interface RebalanceOperationRepository extends JpaRepository<RebalanceOperation, String> {

    // --- самая старая незавершённая операция (для resume) ---
    Optional<RebalanceOperation> findFirstByStatusInOrderByCreatedAtAsc(Collection<OperationStatus> statuses);

    boolean existsByStatusIn(Collection<OperationStatus> statuses);

    // --- для /status ---
    Optional<RebalanceOperation> findFirstByOrderByCreatedAtDesc();
}
