package com.chicu.rebalancer.exception;

/** Ошибка хранилища операций или недопустимый переход статуса. */
public class PersistenceException extends RebalanceException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
