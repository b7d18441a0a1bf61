package com.chicu.rebalancer.rebalance.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Одна попытка перевода между сетями.
 * После создания меняются только status, хеши шагов с их суммами, errorMessage и completedAt.
 * Хеши пишутся один раз. bridgeTxHash всегда хеш транзакции моста, свопы обходного маршрута
 * лежат в своих колонках.
 */
@Entity
@Table(name = "rebalance_operations",
        indexes = @Index(name = "idx_rebalance_operations_status_created", columnList = "status, created_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalanceOperation {

    @Id
    @Column(length = 36, updatable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private Direction direction;

    @Column(name = "token_address", nullable = false, updatable = false, length = 64)
    private String tokenAddress;

    @Column(name = "token_decimals", nullable = false, updatable = false)
    private int tokenDecimals;

    @Column(name = "amount_to_bridge", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amountToBridge;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OperationStatus status;

    @Column(name = "bridge_txhash", length = 80)
    private String bridgeTxHash;

    @Column(name = "bridge_amount_out", precision = 78, scale = 0)
    private BigInteger bridgeAmountOut;

    @Column(name = "source_swap_txhash", length = 80)
    private String sourceSwapTxHash;

    @Column(name = "source_swap_amount_out", precision = 78, scale = 0)
    private BigInteger sourceSwapAmountOut;

    @Column(name = "dest_swap_txhash", length = 80)
    private String destSwapTxHash;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // снимок на момент планирования, только для аудита
    @Column(name = "source_chain_balance", updatable = false, precision = 78, scale = 0)
    private BigInteger sourceChainBalance;

    @Column(name = "dest_chain_balance", updatable = false, precision = 78, scale = 0)
    private BigInteger destChainBalance;
}
