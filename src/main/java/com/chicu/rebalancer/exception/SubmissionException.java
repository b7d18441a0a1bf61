package com.chicu.rebalancer.exception;

/** Ошибка оценки газа или отправки транзакции. */
public class SubmissionException extends RebalanceException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
