package com.chicu.rebalancer.exception;

public class InsufficientGasException extends RebalanceException {

    public InsufficientGasException(String message) {
        super(message);
    }
}
