package com.chicu.rebalancer.exception;

/** Агрегатор сообщил, что одна из сторон перевода упала. */
public class BridgeFailedException extends RebalanceException {

    public BridgeFailedException(String message) {
        super(message);
    }

    public BridgeFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
