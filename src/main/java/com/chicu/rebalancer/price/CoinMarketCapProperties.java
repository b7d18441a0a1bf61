package com.chicu.rebalancer.price;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "coinmarketcap.api")
@Data
public class CoinMarketCapProperties {
    private String baseUrl = "https://pro-api.coinmarketcap.com";
    private String apiKey;
    /** Явные символы для адресов, которые CMC не находит (нативные заглушки) */
    private Map<String, String> symbolOverrides = new HashMap<>();
}
