package com.chicu.rebalancer.exception;

/** Не удалось выдать или подтвердить allowance. */
public class ApprovalException extends RebalanceException {

    public ApprovalException(String message) {
        super(message);
    }

    public ApprovalException(String message, Throwable cause) {
        super(message, cause);
    }
}
