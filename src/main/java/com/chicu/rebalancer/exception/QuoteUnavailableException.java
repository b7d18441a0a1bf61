package com.chicu.rebalancer.exception;

/** Агрегатор не вернул пригодный маршрут или ответ не прошёл валидацию. */
public class QuoteUnavailableException extends RebalanceException {

    public QuoteUnavailableException(String message) {
        super(message);
    }

    public QuoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
