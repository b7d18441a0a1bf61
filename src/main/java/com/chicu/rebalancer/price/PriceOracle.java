package com.chicu.rebalancer.price;

import java.math.BigDecimal;

public interface PriceOracle {

    /**
     * Цена одной целой единицы токена в USD.
     * {@link BigDecimal#ZERO} означает «цена неизвестна», делить на неё нельзя.
     */
    BigDecimal getPrice(String tokenAddress);
}
