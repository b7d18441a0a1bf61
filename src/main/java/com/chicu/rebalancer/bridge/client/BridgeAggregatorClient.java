package com.chicu.rebalancer.bridge.client;

import com.chicu.rebalancer.bridge.model.BridgeStatusReport;
import com.chicu.rebalancer.bridge.model.BuildTxResult;
import com.chicu.rebalancer.bridge.model.QuoteRequest;
import com.chicu.rebalancer.bridge.model.Route;
import com.chicu.rebalancer.exception.QuoteUnavailableException;

import java.util.List;

/**
 * HTTP-клиент агрегатора мостов.
 * Неуспешный, битый или недоступный ответ: {@link QuoteUnavailableException}.
 */
public interface BridgeAggregatorClient {

    /** Маршруты, лучший первым. Пустой список — маршрута нет, это не ошибка. */
    List<Route> quote(QuoteRequest request);

    BuildTxResult buildTx(Route route);

    BridgeStatusReport bridgeStatus(String txHash, long fromChainId, long toChainId);
}
