package com.chicu.rebalancer.config;

import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.support.TestProperties;
import com.chicu.rebalancer.util.retry.BackoffPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RebalancerProperties Tests")
class RebalancerPropertiesTest {

    @Test
    @DisplayName("Valid configuration passes validation")
    void testValid() {
        RebalancerProperties props = TestProperties.rebalancer();
        assertDoesNotThrow(props::validate);
        assertSame(props.getChainB(), props.chain(ChainSide.CHAIN_B));
    }

    @Test
    @DisplayName("Wallet address must be 0x followed by 40 hex characters")
    void testInvalidWallet() {
        RebalancerProperties props = TestProperties.rebalancer();
        props.getChainA().setWalletAddress("0x1234");

        IllegalStateException e = assertThrows(IllegalStateException.class, props::validate);
        assertTrue(e.getMessage().contains("chain-a.wallet-address"));
    }

    @Test
    @DisplayName("Private key and token addresses must start with 0x")
    void testInvalidPrefixes() {
        RebalancerProperties noKey = TestProperties.rebalancer();
        noKey.setPrivateKey("abc");
        assertThrows(IllegalStateException.class, noKey::validate);

        RebalancerProperties badToken = TestProperties.rebalancer();
        badToken.getChainB().setTokenAddress("usdc");
        assertThrows(IllegalStateException.class, badToken::validate);
    }

    @Test
    @DisplayName("Numeric limits are enforced")
    void testNumericLimits() {
        RebalancerProperties fastPoll = TestProperties.rebalancer();
        fastPoll.setPollIntervalMs(500);
        assertThrows(IllegalStateException.class, fastPoll::validate);

        RebalancerProperties negativeThreshold = TestProperties.rebalancer();
        negativeThreshold.getChainA().setThreshold(new BigDecimal("-1"));
        assertThrows(IllegalStateException.class, negativeThreshold::validate);

        RebalancerProperties decimals = TestProperties.rebalancer();
        decimals.getChainB().setTokenDecimals(40);
        assertThrows(IllegalStateException.class, decimals::validate);

        RebalancerProperties sameChain = TestProperties.rebalancer();
        sameChain.getChainB().setChainId(sameChain.getChainA().getChainId());
        assertThrows(IllegalStateException.class, sameChain::validate);
    }

    @Test
    @DisplayName("Monitor defaults map to the documented backoff policy")
    void testMonitorDefaults() {
        BackoffPolicy policy = new RebalancerProperties.Monitor().toBackoffPolicy();

        assertEquals(Duration.ofSeconds(10), policy.getBaseDelay());
        assertEquals(1.1, policy.getMultiplier());
        assertEquals(Duration.ofSeconds(30), policy.getMaxDelay());
        assertEquals(Duration.ofSeconds(2), policy.getJitter());
        assertEquals(60, policy.getMaxAttempts());
    }

    @Test
    @DisplayName("Invalid monitor settings fail validation")
    void testInvalidMonitor() {
        RebalancerProperties props = TestProperties.rebalancer();
        props.getMonitor().setMultiplier(0.9);

        assertThrows(IllegalStateException.class, props::validate);
    }

    @Test
    @DisplayName("Display name falls back to the chain id")
    void testDisplayName() {
        RebalancerProperties.Chain chain = new RebalancerProperties.Chain();
        chain.setChainId(137);
        assertEquals("chain 137", chain.displayName());
    }
}
