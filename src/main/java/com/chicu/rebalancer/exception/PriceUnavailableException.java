package com.chicu.rebalancer.exception;

/** Цена токена неизвестна (оракул вернул 0). */
public class PriceUnavailableException extends RebalanceException {

    public PriceUnavailableException(String tokenAddress) {
        super("Price unavailable for token " + tokenAddress);
    }
}
