package com.chicu.rebalancer.chain.service;

import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.chain.client.ChainClient;
import com.chicu.rebalancer.chain.model.ChainBalances;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.exception.ChainReadException;
import com.chicu.rebalancer.support.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.chicu.rebalancer.support.TestProperties.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ChainBalanceReader Tests")
class ChainBalanceReaderTest {

    private ChainClient chainClient;
    private ChainBalanceReader reader;

    @BeforeEach
    void setUp() {
        chainClient = mock(ChainClient.class);
        reader = new ChainBalanceReader(chainClient, TestProperties.rebalancer());
    }

    @AfterEach
    void tearDown() {
        reader.shutdown();
    }

    @Test
    @DisplayName("Both chains are read with their own token and wallet")
    void testReadAll() {
        when(chainClient.getBalance(ChainSide.CHAIN_A, TOKEN_A, WALLET_A)).thenReturn(BigInteger.valueOf(500));
        when(chainClient.getBalance(ChainSide.CHAIN_B, TOKEN_B, WALLET_B)).thenReturn(BigInteger.valueOf(100));

        ChainBalances balances = reader.readAll();

        assertEquals(BigInteger.valueOf(500), balances.getChainA());
        assertEquals(BigInteger.valueOf(100), balances.getChainB());
    }

    @Test
    @DisplayName("A failed read on either chain aborts with ChainReadException")
    void testReadFailure() {
        when(chainClient.getBalance(ChainSide.CHAIN_A, TOKEN_A, WALLET_A)).thenReturn(BigInteger.ONE);
        when(chainClient.getBalance(ChainSide.CHAIN_B, TOKEN_B, WALLET_B))
                .thenThrow(new ChainReadException("eth_call reverted on Mantle"));

        ChainReadException e = assertThrows(ChainReadException.class, () -> reader.readAll());
        assertEquals("eth_call reverted on Mantle", e.getMessage());
    }

    @Test
    @DisplayName("Unexpected errors are wrapped")
    void testUnexpectedFailureWrapped() {
        when(chainClient.getBalance(ChainSide.CHAIN_A, TOKEN_A, WALLET_A)).thenThrow(new IllegalStateException("boom"));
        when(chainClient.getBalance(ChainSide.CHAIN_B, TOKEN_B, WALLET_B)).thenReturn(BigInteger.ONE);

        ChainReadException e = assertThrows(ChainReadException.class, () -> reader.readAll());
        assertTrue(e.getMessage().contains("boom"));
    }

    @Test
    @DisplayName("Negative or missing balance is malformed")
    void testMalformedBalance() {
        when(chainClient.getBalance(ChainSide.CHAIN_A, TOKEN_A, WALLET_A)).thenReturn(BigInteger.valueOf(-1));

        assertThrows(ChainReadException.class, () -> reader.readBalance(ChainSide.CHAIN_A));
    }

    @Test
    @DisplayName("Native balance goes through the native sentinel")
    void testNativeBalance() {
        when(chainClient.getBalance(ChainSide.CHAIN_B, RebalancerProperties.NATIVE_ASSET, WALLET_B))
                .thenReturn(BigInteger.TEN);

        assertEquals(BigInteger.TEN, reader.readNativeBalance(ChainSide.CHAIN_B));
    }
}
