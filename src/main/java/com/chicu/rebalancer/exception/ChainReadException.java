package com.chicu.rebalancer.exception;

/** Ошибка RPC или некорректный ответ контракта при чтении из сети. */
public class ChainReadException extends RebalanceException {

    public ChainReadException(String message) {
        super(message);
    }

    public ChainReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
