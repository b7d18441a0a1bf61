package com.chicu.rebalancer.rebalance.service;

import com.chicu.rebalancer.bot.notify.Notifier;
import com.chicu.rebalancer.bridge.model.BridgeExecution;
import com.chicu.rebalancer.bridge.model.BridgeRequest;
import com.chicu.rebalancer.bridge.model.ExecutionProgress;
import com.chicu.rebalancer.bridge.model.BridgeTxStatus;
import com.chicu.rebalancer.bridge.service.BridgeOrchestrator;
import com.chicu.rebalancer.bridge.service.StepListener;
import com.chicu.rebalancer.bridge.service.TransactionMonitor;
import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.chain.model.ChainBalances;
import com.chicu.rebalancer.chain.service.ChainBalanceReader;
import com.chicu.rebalancer.chain.util.NativeTokens;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.exception.BridgeFailedException;
import com.chicu.rebalancer.exception.InsufficientGasException;
import com.chicu.rebalancer.rebalance.model.RebalanceOperation;
import com.chicu.rebalancer.rebalance.model.RebalancePlan;
import com.chicu.rebalancer.rebalance.model.TickOutcome;
import com.chicu.rebalancer.rebalance.store.OperationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Один тик ребалансировки.
 * <p>
 * Сначала ищется незавершённая операция: если есть, она доводится до конца и тик на этом
 * заканчивается. Уже отправленные транзакции при этом не повторяются. Иначе балансы → проверка газа → расчёт → запись PENDING → уведомление →
 * оркестрация → мониторинг → COMPLETED.
 * <p>
 * Ошибка планирования: уведомление и проброс, в БД ничего не пишется.
 * Ошибка исполнения: операция уходит в FAILED с текстом ошибки, уведомление и проброс.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RebalanceEngine {

    private final ChainBalanceReader balanceReader;
    private final ImbalanceCalculator calculator;
    private final OperationStore operationStore;
    private final BridgeOrchestrator orchestrator;
    private final TransactionMonitor monitor;
    private final Notifier notifier;
    private final RebalancerProperties props;

    private final AtomicBoolean busy = new AtomicBoolean(false);

    public TickOutcome checkAndRebalance() {
        if (!busy.compareAndSet(false, true)) {
            log.info("Ребалансировка уже идёт, тик пропущен");
            return TickOutcome.SKIPPED;
        }
        try {
            notifier.sendInfo("Checking balances...");

            Optional<RebalanceOperation> unfinished = findUnfinished();
            if (unfinished.isPresent()) {
                resume(unfinished.get());
                return TickOutcome.RESUMED;
            }

            Optional<RebalancePlan> plan = plan();
            if (plan.isEmpty()) {
                log.info("Ребалансировка не нужна");
                notifier.sendInfo("No rebalancing needed at this time");
                return TickOutcome.NOTHING_TO_DO;
            }

            RebalanceOperation operation = insert(plan.get());
            notifier.sendInfo(startMessage(plan.get()));
            execute(operation);
            return TickOutcome.COMPLETED;
        } finally {
            busy.set(false);
        }
    }

    public boolean isBusy() {
        return busy.get();
    }

    /* ===================== planning ===================== */

    private Optional<RebalancePlan> plan() {
        try {
            ChainBalances balances = balanceReader.readAll();
            notifier.sendInfo(balancesMessage(balances));
            checkGas();
            return calculator.calculate(balances);
        } catch (RuntimeException e) {
            log.error("❌ Ошибка планирования: {}", e.getMessage());
            notifier.sendError(e);
            throw e;
        }
    }

    private void checkGas() {
        BigInteger min = props.getMinGasBalance().movePointRight(NativeTokens.NATIVE_DECIMALS).toBigInteger();
        BigInteger gasA = balanceReader.readNativeBalance(ChainSide.CHAIN_A);
        BigInteger gasB = balanceReader.readNativeBalance(ChainSide.CHAIN_B);
        if (gasA.compareTo(min) < 0 || gasB.compareTo(min) < 0) {
            throw new InsufficientGasException("Insufficient gas balance (minimum " + props.getMinGasBalance().toPlainString() + "):\n"
                    + props.getChainA().displayName() + ": " + units(gasA, NativeTokens.NATIVE_DECIMALS) + "\n"
                    + props.getChainB().displayName() + ": " + units(gasB, NativeTokens.NATIVE_DECIMALS));
        }
    }

    private Optional<RebalanceOperation> findUnfinished() {
        try {
            return operationStore.findOldestUnfinished();
        } catch (RuntimeException e) {
            log.error("❌ Не удалось прочитать незавершённые операции: {}", e.getMessage());
            notifier.sendError(e);
            throw e;
        }
    }

    private RebalanceOperation insert(RebalancePlan plan) {
        try {
            return operationStore.insert(toOperation(plan));
        } catch (RuntimeException e) {
            log.error("❌ Не удалось сохранить операцию: {}", e.getMessage());
            notifier.sendError(e);
            throw e;
        }
    }

    private RebalanceOperation toOperation(RebalancePlan plan) {
        return RebalanceOperation.builder()
                .direction(plan.getDirection())
                .tokenAddress(plan.getTokenAddress())
                .tokenDecimals(plan.getTokenDecimals())
                .amountToBridge(plan.getAmount())
                .sourceChainBalance(plan.getSourceBalance())
                .destChainBalance(plan.getDestinationBalance())
                .build();
    }

    /* ===================== execution ===================== */

    private void resume(RebalanceOperation op) {
        log.info("♻️ Возобновляю операцию {} ({}), tx={}", op.getId(), op.getStatus(), op.getBridgeTxHash());
        notifier.sendInfo("Resuming previous operation " + op.getId());

        if (op.getSourceSwapTxHash() != null) {
            // обходной маршрут: доделываем с первого неотправленного шага
            try {
                finish(op, orchestrator.resume(bridgeRequest(op), progress(op), stepRecorder(op)));
            } catch (RuntimeException e) {
                fail(op, e);
                throw e;
            }
            return;
        }
        if (op.getBridgeTxHash() == null) {
            execute(op);
            return;
        }
        try {
            awaitSettlement(op, op.getBridgeTxHash());
            complete(op, op.getBridgeTxHash());
        } catch (RuntimeException e) {
            fail(op, e);
            throw e;
        }
    }

    private void execute(RebalanceOperation op) {
        try {
            operationStore.markInProgress(op.getId());
            finish(op, orchestrator.execute(bridgeRequest(op), stepRecorder(op)));
        } catch (RuntimeException e) {
            fail(op, e);
            throw e;
        }
    }

    private void finish(RebalanceOperation op, BridgeExecution execution) {
        if (!execution.isSettled()) {
            awaitSettlement(op, execution.getTxHash());
        }
        complete(op, execution.getTxHash());
    }

    /** Хеш каждого шага пишется сразу после отправки: после рестарта ничего не уйдёт повторно. */
    private StepListener stepRecorder(RebalanceOperation op) {
        return (step, txHash, expectedAmountOut) -> {
            operationStore.recordStep(op.getId(), step, txHash, expectedAmountOut);
            notifier.sendInfo(StringUtils.capitalize(step.label()) + " transaction submitted: " + txHash);
        };
    }

    private BridgeRequest bridgeRequest(RebalanceOperation op) {
        return BridgeRequest.builder()
                .direction(op.getDirection())
                .fromTokenAddress(op.getTokenAddress())
                .toTokenAddress(props.chain(op.getDirection().destination()).getTokenAddress())
                .amount(op.getAmountToBridge())
                .build();
    }

    private static ExecutionProgress progress(RebalanceOperation op) {
        return ExecutionProgress.builder()
                .sourceSwapTxHash(op.getSourceSwapTxHash())
                .sourceSwapAmountOut(op.getSourceSwapAmountOut())
                .bridgeTxHash(op.getBridgeTxHash())
                .bridgeAmountOut(op.getBridgeAmountOut())
                .destinationSwapTxHash(op.getDestSwapTxHash())
                .build();
    }

    private void awaitSettlement(RebalanceOperation op, String txHash) {
        BridgeTxStatus status = monitor.await(txHash, op.getDirection());
        if (status == BridgeTxStatus.FAILED) {
            throw new BridgeFailedException("Bridge transaction " + txHash + " failed");
        }
        notifier.sendInfo("Bridge transaction " + txHash + " completed");
    }

    private void complete(RebalanceOperation op, String txHash) {
        operationStore.markCompleted(op.getId(), txHash);
        log.info("✅ Операция {} завершена", op.getId());
        notifier.sendInfo("Rebalancing operation completed successfully");
    }

    private void fail(RebalanceOperation op, RuntimeException error) {
        String message = Notifier.describe(error);
        log.error("❌ Операция {} упала: {}", op.getId(), message);
        try {
            operationStore.markFailed(op.getId(), message);
        } catch (RuntimeException storeError) {
            log.error("Не удалось пометить операцию {} как FAILED: {}", op.getId(), storeError.getMessage());
            error.addSuppressed(storeError);
        }
        notifier.sendError("Rebalancing failed: " + message);
    }

    /* ===================== messages ===================== */

    private String balancesMessage(ChainBalances balances) {
        StringBuilder sb = new StringBuilder("Current Balances:");
        for (ChainSide side : ChainSide.values()) {
            RebalancerProperties.Chain c = props.chain(side);
            String symbol = symbol(c);
            sb.append('\n').append(c.displayName()).append(" (").append(c.getWalletAddress()).append("): ")
                    .append(units(balances.get(side), c.getTokenDecimals())).append(' ').append(symbol)
                    .append("\nThreshold: ").append(c.getThreshold().stripTrailingZeros().toPlainString()).append(' ').append(symbol);
        }
        return sb.toString();
    }

    private String startMessage(RebalancePlan plan) {
        RebalancerProperties.Chain source = props.chain(plan.getDirection().source());
        RebalancerProperties.Chain a = props.getChainA();
        RebalancerProperties.Chain b = props.getChainB();
        return "Starting rebalance operation:\n"
                + "Direction: " + plan.getDirection() + "\n"
                + "Amount: " + units(plan.getAmount(), plan.getTokenDecimals()) + " " + symbol(source)
                + " (~" + usd(plan.getAmountUsd()) + " USD)\n"
                + "Current " + a.displayName() + " Balance: " + usd(plan.getBalanceUsdA()) + " USD\n"
                + "Current " + b.displayName() + " Balance: " + usd(plan.getBalanceUsdB()) + " USD\n"
                + a.displayName() + " Threshold: " + usd(plan.getThresholdUsdA()) + " USD\n"
                + b.displayName() + " Threshold: " + usd(plan.getThresholdUsdB()) + " USD";
    }

    private static String symbol(RebalancerProperties.Chain c) {
        return c.getTokenSymbol() == null ? "" : c.getTokenSymbol();
    }

    private static String units(BigInteger raw, int decimals) {
        return new BigDecimal(raw).movePointLeft(decimals).stripTrailingZeros().toPlainString();
    }

    private static String usd(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
