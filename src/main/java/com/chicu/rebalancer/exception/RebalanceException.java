package com.chicu.rebalancer.exception;

/**
 * Базовое исключение ребалансировщика.
 * Сообщение должно быть пригодно для отправки оператору в Telegram как есть.
 */
public class RebalanceException extends RuntimeException {

    public RebalanceException(String message) {
        super(message);
    }

    public RebalanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
