package com.chicu.rebalancer.price.impl;

import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.price.CoinMarketCapProperties;
import com.chicu.rebalancer.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("CoinMarketCapPriceOracle Tests")
class CoinMarketCapPriceOracleTest {

    private static final String BASE = "https://pro-api.coinmarketcap.com";
    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";

    private MockRestServiceServer server;
    private CoinMarketCapProperties props;
    private RebalancerProperties rebalancerProps;
    private CoinMarketCapPriceOracle oracle;

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        props = new CoinMarketCapProperties();
        props.setApiKey("cmc-key");
        rebalancerProps = TestProperties.rebalancer();
        oracle = new CoinMarketCapPriceOracle(rest, new ObjectMapper(), props, rebalancerProps);
    }

    @Test
    @DisplayName("Resolves the symbol by address once, then reads the USD quote")
    void testPriceBySymbolLookup() {
        server.expect(requestTo(BASE + "/v2/cryptocurrency/info?address=" + USDC))
                .andExpect(header("X-CMC_PRO_API_KEY", "cmc-key"))
                .andRespond(withSuccess("{\"data\":{\"3408\":{\"id\":3408,\"symbol\":\"USDC\"}}}", MediaType.APPLICATION_JSON));
        server.expect(ExpectedCount.times(2), requestTo(BASE + "/v2/cryptocurrency/quotes/latest?symbol=USDC"))
                .andRespond(withSuccess("{\"data\":{\"USDC\":[{\"id\":3408,\"quote\":{\"USD\":{\"price\":0.9998}}}]}}",
                        MediaType.APPLICATION_JSON));

        assertEquals(0, new BigDecimal("0.9998").compareTo(oracle.getPrice(USDC)));
        // символ закэширован: второй раз info не запрашивается
        assertEquals(0, new BigDecimal("0.9998").compareTo(oracle.getPrice(USDC.toUpperCase().replace("0X", "0x"))));

        server.verify();
    }

    @Test
    @DisplayName("Configured symbol override skips the address lookup")
    void testSymbolOverride() {
        props.getSymbolOverrides().put("0xEeeeeEeeeEeEeeEeEeEeeEEEeeeeEeeeeeeeEEeE", "ETH");
        server.expect(requestTo(BASE + "/v2/cryptocurrency/quotes/latest?symbol=ETH"))
                .andRespond(withSuccess("{\"data\":{\"ETH\":[{\"quote\":{\"USD\":{\"price\":3150.25}}}]}}",
                        MediaType.APPLICATION_JSON));

        BigDecimal price = oracle.getPrice("0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee");

        assertEquals(0, new BigDecimal("3150.25").compareTo(price));
        server.verify();
    }

    @Test
    @DisplayName("Chain price symbol is used for that chain's token without an address lookup")
    void testChainPriceSymbol() {
        rebalancerProps.getChainA().setPriceSymbol(" TKA ");
        server.expect(ExpectedCount.once(), requestTo(BASE + "/v2/cryptocurrency/quotes/latest?symbol=TKA"))
                .andRespond(withSuccess("{\"data\":{\"TKA\":[{\"quote\":{\"USD\":{\"price\":1.25}}}]}}",
                        MediaType.APPLICATION_JSON));

        BigDecimal price = oracle.getPrice(TestProperties.TOKEN_A.toUpperCase().replace("0X", "0x"));

        assertEquals(0, new BigDecimal("1.25").compareTo(price));
        server.verify();
    }

    @Test
    @DisplayName("Explicit override wins over the chain price symbol")
    void testOverrideBeatsChainPriceSymbol() {
        rebalancerProps.getChainA().setPriceSymbol("TKA");
        props.getSymbolOverrides().put(TestProperties.TOKEN_A, "WTKA");
        server.expect(requestTo(BASE + "/v2/cryptocurrency/quotes/latest?symbol=WTKA"))
                .andRespond(withSuccess("{\"data\":{\"WTKA\":[{\"quote\":{\"USD\":{\"price\":2}}}]}}",
                        MediaType.APPLICATION_JSON));

        assertEquals(0, new BigDecimal("2").compareTo(oracle.getPrice(TestProperties.TOKEN_A)));
        server.verify();
    }

    @Test
    @DisplayName("Any error returns zero")
    void testErrorReturnsZero() {
        server.expect(requestTo(BASE + "/v2/cryptocurrency/info?address=" + USDC)).andRespond(withServerError());

        assertEquals(BigDecimal.ZERO, oracle.getPrice(USDC));
        server.verify();
    }

    @Test
    @DisplayName("Symbol missing from quote data returns zero")
    void testSymbolMissingFromQuotes() {
        props.getSymbolOverrides().put(USDC, "USDC");
        server.expect(requestTo(BASE + "/v2/cryptocurrency/quotes/latest?symbol=USDC"))
                .andRespond(withSuccess("{\"data\":{}}", MediaType.APPLICATION_JSON));

        assertEquals(BigDecimal.ZERO, oracle.getPrice(USDC));
    }
}
