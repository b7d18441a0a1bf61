package com.chicu.rebalancer.price.impl;

import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.price.CoinMarketCapProperties;
import com.chicu.rebalancer.price.PriceOracle;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Цена через CoinMarketCap Pro API: адрес → символ (info), символ → цена (quotes/latest).
 * Символ берётся из coinmarketcap.api.symbol-overrides, затем из price-symbol сети
 * с этим токеном, и только потом ищется по адресу.
 * Любая ошибка = 0. Оператора уведомляет вызывающий, получив нулевую цену.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoinMarketCapPriceOracle implements PriceOracle {

    private final RestTemplate rest;
    private final ObjectMapper objectMapper;
    private final CoinMarketCapProperties props;
    private final RebalancerProperties rebalancerProps;

    private final ConcurrentMap<String, String> symbolCache = new ConcurrentHashMap<>();

    @Override
    public BigDecimal getPrice(String tokenAddress) {
        try {
            String symbol = resolveSymbol(tokenAddress);
            String body = get("/v2/cryptocurrency/quotes/latest?symbol=" + enc(symbol));
            JsonNode tokenData = parseJson(body).path("data").path(symbol);
            JsonNode first = tokenData.isArray() ? tokenData.path(0) : tokenData;
            JsonNode price = first.path("quote").path("USD").path("price");
            if (first.isMissingNode() || !price.isNumber()) {
                throw new IllegalStateException("Token " + symbol + " not found in CoinMarketCap data");
            }
            BigDecimal usd = price.decimalValue();
            log.debug("CMC price {} ({}) = {}", symbol, tokenAddress, usd);
            return usd.signum() > 0 ? usd : BigDecimal.ZERO;
        } catch (Exception e) {
            log.error("Error fetching price for token address {}: {}", tokenAddress, e.getMessage());
            return BigDecimal.ZERO;
        }
    }

    /* ========== helpers ========== */

    private String resolveSymbol(String tokenAddress) {
        String key = tokenAddress.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> o : props.getSymbolOverrides().entrySet()) {
            if (o.getKey().equalsIgnoreCase(key)) return o.getValue();
        }
        for (ChainSide side : ChainSide.values()) {
            RebalancerProperties.Chain chain = rebalancerProps.chain(side);
            if (key.equalsIgnoreCase(chain.getTokenAddress())
                    && chain.getPriceSymbol() != null && !chain.getPriceSymbol().isBlank()) {
                return chain.getPriceSymbol().trim();
            }
        }
        return symbolCache.computeIfAbsent(key, this::fetchSymbol);
    }

    private String fetchSymbol(String address) {
        JsonNode data = parseJson(get("/v2/cryptocurrency/info?address=" + enc(address))).path("data");
        Iterator<JsonNode> it = data.elements();
        if (!it.hasNext()) {
            throw new IllegalStateException("No CoinMarketCap listing for address " + address);
        }
        String symbol = it.next().path("symbol").asText("");
        if (symbol.isBlank()) {
            throw new IllegalStateException("CoinMarketCap listing for " + address + " has no symbol");
        }
        return symbol;
    }

    private String get(String pathAndQuery) {
        String url = baseUrl() + pathAndQuery;
        return rest.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), String.class).getBody();
    }

    private HttpHeaders headers() {
        HttpHeaders h = new HttpHeaders();
        h.set("X-CMC_PRO_API_KEY", props.getApiKey() == null ? "" : props.getApiKey());
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        return h;
    }

    private String baseUrl() {
        String b = props.getBaseUrl();
        if (b == null || b.isBlank()) b = "https://pro-api.coinmarketcap.com";
        return b.replaceAll("/+$", "");
    }

    private JsonNode parseJson(String body) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (Exception e) {
            throw new IllegalStateException("JSON parse error: " + e.getMessage(), e);
        }
    }

    private static String enc(String v) {
        return URLEncoder.encode(v, StandardCharsets.UTF_8);
    }
}
