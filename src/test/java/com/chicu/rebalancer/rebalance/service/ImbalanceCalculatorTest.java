package com.chicu.rebalancer.rebalance.service;

import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.chain.model.ChainBalances;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.exception.PriceUnavailableException;
import com.chicu.rebalancer.price.PriceOracle;
import com.chicu.rebalancer.rebalance.model.Direction;
import com.chicu.rebalancer.rebalance.model.RebalancePlan;
import com.chicu.rebalancer.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

import static com.chicu.rebalancer.support.TestProperties.TOKEN_A;
import static com.chicu.rebalancer.support.TestProperties.TOKEN_B;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ImbalanceCalculator Tests")
class ImbalanceCalculatorTest {

    private PriceOracle priceOracle;
    private RebalancerProperties props;
    private ImbalanceCalculator calculator;

    @BeforeEach
    void setUp() {
        priceOracle = mock(PriceOracle.class);
        props = TestProperties.rebalancer();
        calculator = new ImbalanceCalculator(priceOracle, props);
        prices("1", "1");
    }

    @Test
    @DisplayName("A 500 / B 100 USD with thresholds 200 / 200 moves 100 USD from A to B")
    void testSurplusMovesFromRicherChain() {
        Optional<RebalancePlan> plan = calculator.calculate(balances("500", "100"));

        assertTrue(plan.isPresent());
        assertEquals(Direction.CHAIN_A_TO_CHAIN_B, plan.get().getDirection());
        assertEquals(tokens("100"), plan.get().getAmount());
        assertEquals(0, new BigDecimal("100").compareTo(plan.get().getAmountUsd()));
        assertEquals(TOKEN_A, plan.get().getTokenAddress());
        assertEquals(tokens("500"), plan.get().getSourceBalance());
        assertEquals(tokens("100"), plan.get().getDestinationBalance());
    }

    @Test
    @DisplayName("Both chains above their thresholds gives no plan")
    void testBothAboveThreshold() {
        assertTrue(calculator.calculate(balances("250", "250")).isEmpty());
    }

    @Test
    @DisplayName("A chain exactly at its threshold is not above it")
    void testExactlyAtThreshold() {
        Optional<RebalancePlan> plan = calculator.calculate(balances("200", "300"));

        assertTrue(plan.isPresent());
        // пороги равны, B богаче
        assertEquals(Direction.CHAIN_B_TO_CHAIN_A, plan.get().getDirection());
        assertEquals(tokens("50"), plan.get().getAmount());
        assertEquals(TOKEN_B, plan.get().getTokenAddress());
    }

    @Test
    @DisplayName("Both chains below thresholds gives a non-positive amount and no plan")
    void testNoSurplus() {
        assertTrue(calculator.calculate(balances("100", "100")).isEmpty());
    }

    @Test
    @DisplayName("Donor is the chain with the larger threshold in USD")
    void testDonorByThreshold() {
        props.getChainA().setThreshold(new BigDecimal("100"));
        props.getChainB().setThreshold(new BigDecimal("300"));

        Optional<RebalancePlan> plan = calculator.calculate(balances("1000", "250"));

        assertTrue(plan.isPresent());
        assertEquals(Direction.CHAIN_B_TO_CHAIN_A, plan.get().getDirection());
        assertEquals(tokens("425"), plan.get().getAmount());
    }

    @Test
    @DisplayName("Thresholds are valued in USD with each chain's own price")
    void testThresholdsValuedAtPrice() {
        // одинаковый порог в токенах, но токен B вдвое дороже: 200 и 400 USD
        prices("1", "2");
        Optional<RebalancePlan> plan = calculator.calculate(balances("100", "350"));

        assertTrue(plan.isPresent());
        assertEquals(0, new BigDecimal("400").compareTo(plan.get().getThresholdUsdB()));
        assertEquals(Direction.CHAIN_B_TO_CHAIN_A, plan.get().getDirection());
        // (100 + 700 - 200 - 400) / 2 = 100 USD = 50 токенов B
        assertEquals(tokens("50"), plan.get().getAmount());
    }

    @Test
    @DisplayName("Amount uses source decimals and price and is rounded down")
    void testDecimalsAndRounding() {
        props.getChainA().setTokenDecimals(0);
        props.getChainB().setTokenDecimals(0);
        props.getChainA().setThreshold(new BigDecimal("100"));
        props.getChainB().setThreshold(new BigDecimal("100"));
        prices("3", "3");

        // A = 603 USD, B = 30 USD, пороги 300 / 300: излишек 33, переводим 16.5 USD = 5.5 токена
        Optional<RebalancePlan> plan = calculator.calculate(new ChainBalances(BigInteger.valueOf(201), BigInteger.TEN));

        assertTrue(plan.isPresent());
        assertEquals(Direction.CHAIN_A_TO_CHAIN_B, plan.get().getDirection());
        assertEquals(BigInteger.valueOf(5), plan.get().getAmount());
    }

    @Test
    @DisplayName("Different decimals per chain are normalised before comparison")
    void testMixedDecimals() {
        props.getChainA().setTokenDecimals(6);
        prices("1", "2");
        props.getChainB().setThreshold(new BigDecimal("100"));

        // A = 500 USD (6 decimals), B = 50 * 2 = 100 USD; пороги 200 и 200 USD, A богаче
        ChainBalances balances = new ChainBalances(new BigInteger("500000000"), tokens("50"));
        Optional<RebalancePlan> plan = calculator.calculate(balances);

        assertTrue(plan.isPresent());
        assertEquals(Direction.CHAIN_A_TO_CHAIN_B, plan.get().getDirection());
        assertEquals(6, plan.get().getTokenDecimals());
        assertEquals(new BigInteger("100000000"), plan.get().getAmount());
    }

    @Test
    @DisplayName("Zero price aborts planning")
    void testPriceUnavailable() {
        when(priceOracle.getPrice(TOKEN_B)).thenReturn(BigDecimal.ZERO);

        PriceUnavailableException e = assertThrows(PriceUnavailableException.class,
                () -> calculator.calculate(balances("500", "100")));
        assertTrue(e.getMessage().contains(TOKEN_B));
    }

    @Test
    @DisplayName("Tie-breaks: richer chain donates, full tie defaults to chain B")
    void testDonorTieBreaks() {
        BigDecimal t = new BigDecimal("200");
        assertEquals(ChainSide.CHAIN_A, ImbalanceCalculator.donor(t, t, new BigDecimal("500"), new BigDecimal("100")));
        assertEquals(ChainSide.CHAIN_B, ImbalanceCalculator.donor(t, t, new BigDecimal("100"), new BigDecimal("500")));
        assertEquals(ChainSide.CHAIN_B, ImbalanceCalculator.donor(t, t, BigDecimal.TEN, BigDecimal.TEN));
        assertEquals(ChainSide.CHAIN_A, ImbalanceCalculator.donor(new BigDecimal("300"), t, BigDecimal.ONE, BigDecimal.TEN));
    }

    private void prices(String a, String b) {
        when(priceOracle.getPrice(TOKEN_A)).thenReturn(new BigDecimal(a));
        when(priceOracle.getPrice(TOKEN_B)).thenReturn(new BigDecimal(b));
    }

    private static ChainBalances balances(String a, String b) {
        return new ChainBalances(tokens(a), tokens(b));
    }

    private static BigInteger tokens(String whole) {
        return new BigDecimal(whole).movePointRight(18).toBigIntegerExact();
    }
}
