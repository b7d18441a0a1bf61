package com.chicu.rebalancer.bridge.client;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@ConfigurationProperties(prefix = "bridge.api")
@Data
public class BridgeApiProperties {
    private String baseUrl = "https://api.socket.tech/v2";
    private String apiKey;
    /** Слиппедж для межсетевого маршрута, % */
    private BigDecimal bridgeSlippage = BigDecimal.ONE;
    /** Слиппедж для свопа внутри одной сети, % */
    private BigDecimal swapSlippage = new BigDecimal("0.5");
}
