package com.chicu.rebalancer.bridge.service;

import com.chicu.rebalancer.bridge.client.BridgeAggregatorClient;
import com.chicu.rebalancer.bridge.model.ApprovalData;
import com.chicu.rebalancer.bridge.model.BridgeExecution;
import com.chicu.rebalancer.bridge.model.BridgeRequest;
import com.chicu.rebalancer.bridge.model.BridgeTxStatus;
import com.chicu.rebalancer.bridge.model.BuildTxResult;
import com.chicu.rebalancer.bridge.model.ExecutionProgress;
import com.chicu.rebalancer.bridge.model.ExecutionStep;
import com.chicu.rebalancer.bridge.model.QuoteRequest;
import com.chicu.rebalancer.bridge.model.Route;
import com.chicu.rebalancer.bridge.model.RoutePath;
import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.chain.client.ChainClient;
import com.chicu.rebalancer.chain.model.TransactionRequest;
import com.chicu.rebalancer.chain.util.NativeTokens;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.exception.ApprovalException;
import com.chicu.rebalancer.exception.BridgeFailedException;
import com.chicu.rebalancer.exception.QuoteUnavailableException;
import com.chicu.rebalancer.exception.RebalanceException;
import com.chicu.rebalancer.exception.SubmissionException;
import com.chicu.rebalancer.rebalance.model.Direction;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Проводит перевод через агрегатор.
 * <p>
 * Прямой маршрут: quote → build-tx → approve (если allowance мало) → повторный quote →
 * оценка газа с запасом → отправка. Хеш возвращается сразу, подтверждение ждёт монитор.
 * <p>
 * Если прямого маршрута нет: своп в нативный актив на исходной сети, мост, своп обратно
 * на сети назначения. Каждый шаг подтверждается до начала следующего, а его хеш уходит
 * в {@link StepListener} сразу после отправки, так что после рестарта {@link #resume}
 * продолжает с первого неотправленного шага.
 * Откатов нет: в тексте ошибки перечислены шаги, уже попавшие в блокчейн.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BridgeOrchestrator {

    private final BridgeAggregatorClient aggregator;
    private final ChainClient chainClient;
    private final TransactionMonitor monitor;
    private final RebalancerProperties props;

    public BridgeExecution execute(BridgeRequest request, StepListener listener) {
        Direction direction = request.getDirection();
        ChainSide source = direction.source();

        QuoteRequest quote = quoteRequest(direction, request.getFromTokenAddress(),
                request.getToTokenAddress(), request.getAmount());

        List<Route> routes = aggregator.quote(quote);
        if (routes.isEmpty()) {
            log.warn("🔀 Прямого маршрута {} нет, идём через нативный актив", direction);
            return swapBridgeSwap(request, ExecutionProgress.NONE, listener);
        }

        Route route = routes.get(0);
        BuildTxResult built = aggregator.buildTx(route);
        ensureApproval(source, request.getFromTokenAddress(), built.getApprovalData());

        // после approve котировка могла устареть
        List<Route> fresh = aggregator.quote(quote);
        if (fresh.isEmpty()) {
            throw new QuoteUnavailableException("No bridge route for " + direction + " after approval");
        }
        route = fresh.get(0);
        built = aggregator.buildTx(route);

        TransactionRequest tx = withGasMargin(source, built.toTransactionRequest());
        String hash = chainClient.sendTransaction(source, tx);
        log.info("🌉 Бридж отправлен: {} ({}), gasLimit={}", hash, direction, tx.getGasLimit());
        listener.onSubmitted(ExecutionStep.BRIDGE, hash, route.getToAmount());
        return new BridgeExecution(hash, RoutePath.DIRECT, false);
    }

    /**
     * Продолжает обходной маршрут, у которого часть шагов уже отправлена.
     * Отправленные шаги только подтверждаются, повторно ничего не отправляется.
     */
    public BridgeExecution resume(BridgeRequest request, ExecutionProgress progress, StepListener listener) {
        if (progress.getSourceSwapTxHash() == null) {
            throw new IllegalArgumentException("Nothing to resume: source swap was never submitted");
        }
        if (progress.getSourceSwapAmountOut() == null
                || (progress.getBridgeTxHash() != null && progress.getBridgeAmountOut() == null)) {
            throw new BridgeFailedException("Cannot resume " + request.getDirection()
                    + ": expected amount of a landed step is unknown");
        }
        log.info("♻️ Продолжаю обходной маршрут {}: swap={} bridge={} swap={}", request.getDirection(),
                progress.getSourceSwapTxHash(), progress.getBridgeTxHash(), progress.getDestinationSwapTxHash());
        return swapBridgeSwap(request, progress, listener);
    }

    /* ===================== swap → bridge → swap ===================== */

    private BridgeExecution swapBridgeSwap(BridgeRequest request, ExecutionProgress progress, StepListener listener) {
        Direction direction = request.getDirection();
        ChainSide source = direction.source();
        ChainSide destination = direction.destination();
        String sourceNative = props.chain(source).getIntermediateAssetAddress();
        String destinationNative = props.chain(destination).getIntermediateAssetAddress();
        List<String> landed = new ArrayList<>();

        Submitted swapOut = progress.getSourceSwapTxHash() != null
                ? confirmLanded(landed, source, ExecutionStep.SOURCE_SWAP,
                        progress.getSourceSwapTxHash(), progress.getSourceSwapAmountOut())
                : submitStep(landed, source, ExecutionStep.SOURCE_SWAP,
                        quoteRequest(source, source, request.getFromTokenAddress(), sourceNative, request.getAmount()),
                        request.getFromTokenAddress(), listener);
        landed.add(ExecutionStep.SOURCE_SWAP.label() + " " + swapOut.getTxHash());

        Submitted bridge = progress.getBridgeTxHash() != null
                ? confirmLanded(landed, source, ExecutionStep.BRIDGE,
                        progress.getBridgeTxHash(), progress.getBridgeAmountOut())
                : submitStep(landed, source, ExecutionStep.BRIDGE,
                        quoteRequest(direction, sourceNative, destinationNative, swapOut.getAmountOut()),
                        sourceNative, listener);
        landed.add(ExecutionStep.BRIDGE.label() + " " + bridge.getTxHash());

        Submitted swapIn;
        if (progress.getDestinationSwapTxHash() != null) {
            // своп на сети назначения отправляется только после завершения моста
            swapIn = confirmLanded(landed, destination, ExecutionStep.DESTINATION_SWAP,
                    progress.getDestinationSwapTxHash(), null);
        } else {
            BridgeTxStatus status = step(landed, "bridge settlement", () -> monitor.await(bridge.getTxHash(), direction));
            if (status == BridgeTxStatus.FAILED) {
                throw new BridgeFailedException("Bridge " + bridge.getTxHash() + " failed; already landed: " + landed);
            }
            swapIn = submitStep(landed, destination, ExecutionStep.DESTINATION_SWAP,
                    quoteRequest(destination, destination, destinationNative, request.getToTokenAddress(), bridge.getAmountOut()),
                    destinationNative, listener);
        }

        log.info("✅ Обходной маршрут {} завершён: swap={} bridge={} swap={}",
                direction, swapOut.getTxHash(), bridge.getTxHash(), swapIn.getTxHash());
        return new BridgeExecution(bridge.getTxHash(), RoutePath.SWAP_BRIDGE_SWAP, true);
    }

    /** Первый шаг ошибку пробрасывает как есть, последующие дописывают, что уже ушло в сеть. */
    private static <T> T step(List<String> landed, String name, StepAction<T> action) {
        try {
            return action.run();
        } catch (RebalanceException e) {
            if (landed.isEmpty()) throw e;
            throw new BridgeFailedException("Step '" + name + "' failed: " + e.getMessage()
                    + "; already landed: " + landed, e);
        }
    }

    @FunctionalInterface
    private interface StepAction<T> {
        T run();
    }

    @Value
    private static class Submitted {
        String txHash;
        BigInteger amountOut;
    }

    private Submitted submitStep(List<String> landed, ChainSide chain, ExecutionStep step, QuoteRequest quote,
                                 String fromToken, StepListener listener) {
        return step(landed, step.label(), () -> submitConfirmed(chain, step, quote, fromToken, listener));
    }

    private Submitted confirmLanded(List<String> landed, ChainSide chain, ExecutionStep step,
                                    String txHash, BigInteger amountOut) {
        log.info("{} {} уже отправлен, проверяю квитанцию", step.label(), txHash);
        step(landed, step.label(), () -> {
            confirm(chain, step, txHash);
            return txHash;
        });
        return new Submitted(txHash, amountOut);
    }

    private Submitted submitConfirmed(ChainSide chain, ExecutionStep step, QuoteRequest quote,
                                      String fromToken, StepListener listener) {
        String what = step.label() + " on " + name(chain);
        Route route = firstRoute(quote, what);
        BuildTxResult built = aggregator.buildTx(route);
        if (ensureApproval(chain, fromToken, built.getApprovalData())) {
            // после approve котировка могла устареть
            route = firstRoute(quote, what);
            built = aggregator.buildTx(route);
        }
        TransactionRequest tx = withGasMargin(chain, built.toTransactionRequest());
        String hash = chainClient.sendTransaction(chain, tx);
        log.info("➡️ {}: {} на {}", step.label(), hash, name(chain));
        listener.onSubmitted(step, hash, route.getToAmount());
        confirm(chain, step, hash);
        return new Submitted(hash, route.getToAmount());
    }

    private void confirm(ChainSide chain, ExecutionStep step, String txHash) {
        if (!chainClient.waitForReceipt(chain, txHash, props.getReceiptConfirmations())) {
            throw new SubmissionException(step.label() + " transaction " + txHash + " reverted on " + name(chain));
        }
    }

    private Route firstRoute(QuoteRequest quote, String what) {
        List<Route> routes = aggregator.quote(quote);
        if (routes.isEmpty()) {
            throw new QuoteUnavailableException("No routes available for " + what);
        }
        return routes.get(0);
    }

    /* ===================== approvals & gas ===================== */

    /** @return true, если был отправлен approve */
    private boolean ensureApproval(ChainSide chain, String token, ApprovalData approval) {
        if (approval == null || NativeTokens.isNative(token)) {
            return false;
        }
        String owner = chainClient.senderAddress();
        BigInteger allowance = chainClient.getAllowance(chain, token, owner, approval.getSpender());
        log.info("Allowance {} → {}: {}, нужно {}", token, approval.getSpender(), allowance, approval.getAmount());
        if (allowance.compareTo(approval.getAmount()) >= 0) {
            return false;
        }

        String approvalHash = chainClient.approve(chain, token, approval.getSpender(), approval.getAmount());
        log.info("🔑 Approve {} отправлен, ждём подтверждения", approvalHash);
        if (!chainClient.waitForReceipt(chain, approvalHash, props.getReceiptConfirmations())) {
            throw new ApprovalException("Approval transaction " + approvalHash + " reverted on " + name(chain));
        }
        return true;
    }

    private TransactionRequest withGasMargin(ChainSide chain, TransactionRequest tx) {
        BigInteger estimate = chainClient.estimateGas(chain, tx);
        BigInteger limit = estimate
                .multiply(BigInteger.valueOf(100L + props.getGasLimitMarginPercent()))
                .divide(BigInteger.valueOf(100));
        log.debug("Газ на {}: оценка {}, лимит {}", name(chain), estimate, limit);
        return tx.toBuilder().gasLimit(limit).build();
    }

    /* ===================== helpers ===================== */

    private QuoteRequest quoteRequest(Direction direction, String fromToken, String toToken, BigInteger amount) {
        return quoteRequest(direction.source(), direction.destination(), fromToken, toToken, amount);
    }

    private QuoteRequest quoteRequest(ChainSide from, ChainSide to, String fromToken, String toToken, BigInteger amount) {
        return QuoteRequest.builder()
                .fromChainId(props.chain(from).getChainId())
                .toChainId(props.chain(to).getChainId())
                .fromTokenAddress(fromToken)
                .toTokenAddress(toToken)
                .fromAmount(amount)
                .userAddress(chainClient.senderAddress())
                .build();
    }

    private String name(ChainSide chain) {
        return props.chain(chain).displayName();
    }
}
