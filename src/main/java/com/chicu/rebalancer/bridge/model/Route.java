package com.chicu.rebalancer.bridge.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.math.BigInteger;

/**
 * Маршрут из ответа quote. Исходный JSON храним целиком:
 * build-tx принимает его обратно без изменений.
 */
@Value
public class Route {
    JsonNode raw;
    BigInteger toAmount;
}
