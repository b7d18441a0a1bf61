package com.chicu.rebalancer.exception;

/** Исчерпан лимит опросов статуса бриджа. Не путать с {@link BridgeFailedException}. */
public class MonitorTimeoutException extends RebalanceException {

    public MonitorTimeoutException(String txHash, int attempts) {
        super("Transaction monitoring timed out for " + txHash + " after " + attempts + " attempts");
    }
}
