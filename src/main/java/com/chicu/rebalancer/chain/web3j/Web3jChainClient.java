package com.chicu.rebalancer.chain.web3j;

import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.chain.client.ChainClient;
import com.chicu.rebalancer.chain.model.TransactionRequest;
import com.chicu.rebalancer.chain.util.Erc20;
import com.chicu.rebalancer.chain.util.NativeTokens;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.exception.ApprovalException;
import com.chicu.rebalancer.exception.ChainReadException;
import com.chicu.rebalancer.exception.SubmissionException;
import com.chicu.rebalancer.util.retry.Retry;
import com.chicu.rebalancer.util.retry.Sleeper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Function;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class Web3jChainClient implements ChainClient {

    private static final BigInteger MAX_UINT256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    private static final int RECEIPT_RETRIES = 3;
    private static final Duration RECEIPT_RETRY_DELAY = Duration.ofSeconds(5);

    private final RebalancerProperties props;

    @Value("${rebalancer.receipt.poll-ms:3000}")
    private long receiptPollMs;

    @Value("${rebalancer.receipt.poll-attempts:200}")
    private int receiptPollAttempts;

    private final Map<ChainSide, Web3j> clients = new EnumMap<>(ChainSide.class);
    private final Map<ChainSide, RawTransactionManager> signers = new EnumMap<>(ChainSide.class);
    private Credentials credentials;

    @PostConstruct
    void init() {
        log.info("Initializing chain clients...");
        credentials = Credentials.create(props.getPrivateKey());
        for (ChainSide side : ChainSide.values()) {
            RebalancerProperties.Chain chain = props.chain(side);
            Web3j web3j = Web3j.build(new HttpService(chain.getRpcUrl()));
            clients.put(side, web3j);
            signers.put(side, new RawTransactionManager(web3j, credentials, chain.getChainId()));
        }
        log.info("Chain clients ready, sender={}", credentials.getAddress());
    }

    @PreDestroy
    void shutdown() {
        clients.values().forEach(Web3j::shutdown);
    }

    @Override
    public String senderAddress() {
        return credentials.getAddress();
    }

    @Override
    public BigInteger getBalance(ChainSide chain, String tokenAddress, String walletAddress) {
        try {
            if (NativeTokens.isNative(tokenAddress)) {
                var resp = web3j(chain).ethGetBalance(walletAddress, DefaultBlockParameterName.LATEST).send();
                if (resp.hasError()) {
                    throw new ChainReadException("eth_getBalance failed on " + name(chain) + ": " + resp.getError().getMessage());
                }
                return resp.getBalance();
            }
            return callUint(chain, tokenAddress, Erc20.balanceOf(walletAddress));
        } catch (ChainReadException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error checking token balance on {}: {}", name(chain), e.getMessage());
            throw new ChainReadException("Failed to read balance of " + tokenAddress + " on " + name(chain)
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public BigInteger getAllowance(ChainSide chain, String tokenAddress, String owner, String spender) {
        if (NativeTokens.isNative(tokenAddress)) {
            return MAX_UINT256;
        }
        try {
            return callUint(chain, tokenAddress, Erc20.allowance(owner, spender));
        } catch (ChainReadException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error checking allowance on {}: {}", name(chain), e.getMessage());
            throw new ChainReadException("Failed to read allowance of " + tokenAddress + " on " + name(chain)
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String approve(ChainSide chain, String tokenAddress, String spender, BigInteger amount) {
        if (NativeTokens.isNative(tokenAddress)) {
            throw new ApprovalException("Cannot approve native token");
        }
        TransactionRequest tx = TransactionRequest.builder()
                .to(tokenAddress)
                .data(Erc20.encode(Erc20.approve(spender, amount)))
                .value(BigInteger.ZERO)
                .build();
        try {
            return sendTransaction(chain, tx);
        } catch (SubmissionException e) {
            throw new ApprovalException("Approval of " + tokenAddress + " for " + spender + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public BigInteger estimateGas(ChainSide chain, TransactionRequest tx) {
        try {
            Transaction call = Transaction.createFunctionCallTransaction(
                    senderAddress(), null, null, null, tx.getTo(), valueOf(tx), tx.getData());
            EthEstimateGas resp = web3j(chain).ethEstimateGas(call).send();
            if (resp.hasError()) {
                throw new SubmissionException("Gas estimation failed on " + name(chain) + ": " + resp.getError().getMessage());
            }
            return resp.getAmountUsed();
        } catch (SubmissionException e) {
            throw e;
        } catch (Exception e) {
            throw new SubmissionException("Gas estimation failed on " + name(chain) + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String sendTransaction(ChainSide chain, TransactionRequest tx) {
        try {
            BigInteger gasLimit = tx.getGasLimit() != null ? tx.getGasLimit() : estimateGas(chain, tx);
            BigInteger gasPrice = web3j(chain).ethGasPrice().send().getGasPrice();
            EthSendTransaction resp = signers.get(chain)
                    .sendTransaction(gasPrice, gasLimit, tx.getTo(), tx.getData() == null ? "" : tx.getData(), valueOf(tx));
            if (resp.hasError()) {
                throw new SubmissionException("Send failed on " + name(chain) + ": " + resp.getError().getMessage());
            }
            log.info("Sent tx {} on {} (to={}, gasLimit={})", resp.getTransactionHash(), name(chain), tx.getTo(), gasLimit);
            return resp.getTransactionHash();
        } catch (SubmissionException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error sending transaction on {}: {}", name(chain), e.getMessage());
            throw new SubmissionException("Send failed on " + name(chain) + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean waitForReceipt(ChainSide chain, String txHash, int confirmations) {
        Web3j web3j = web3j(chain);
        try {
            TransactionReceipt receipt = Retry.call("receipt " + txHash,
                    () -> new PollingTransactionReceiptProcessor(web3j, receiptPollMs, receiptPollAttempts)
                            .waitForTransactionReceipt(txHash),
                    RECEIPT_RETRIES, RECEIPT_RETRY_DELAY, Sleeper.THREAD);
            awaitConfirmations(web3j, txHash, receipt.getBlockNumber(), confirmations);
            return receipt.isStatusOK();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainReadException("Interrupted while waiting for " + txHash, e);
        } catch (ChainReadException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error waiting for transaction {}: {}", txHash, e.getMessage());
            throw new ChainReadException("Failed to get receipt for " + txHash + " on " + name(chain) + ": " + e.getMessage(), e);
        }
    }

    /** Ждёт, пока над блоком транзакции наберётся {@code confirmations} блоков, иначе ChainReadException. */
    void awaitConfirmations(Web3j web3j, String txHash, BigInteger minedBlock, int confirmations)
            throws IOException, InterruptedException {
        BigInteger target = minedBlock.add(BigInteger.valueOf(confirmations - 1L));
        BigInteger head = null;
        for (int i = 0; i < receiptPollAttempts; i++) {
            head = web3j.ethBlockNumber().send().getBlockNumber();
            if (head.compareTo(target) >= 0) {
                return;
            }
            Thread.sleep(receiptPollMs);
        }
        throw new ChainReadException("Transaction " + txHash + " did not reach " + confirmations
                + " confirmations: mined in block " + minedBlock + ", head " + head);
    }

    /* ========== helpers ========== */

    private BigInteger callUint(ChainSide chain, String contract, Function function) throws Exception {
        String data = Erc20.encode(function);
        EthCall resp = web3j(chain)
                .ethCall(Transaction.createEthCallTransaction(senderAddress(), contract, data), DefaultBlockParameterName.LATEST)
                .send();
        if (resp.hasError()) {
            throw new ChainReadException(function.getName() + " failed on " + name(chain) + ": " + resp.getError().getMessage());
        }
        if (resp.isReverted()) {
            throw new ChainReadException(function.getName() + " reverted on " + name(chain) + ": " + resp.getRevertReason());
        }
        try {
            return Erc20.decodeUint(function, resp.getValue());
        } catch (IllegalArgumentException e) {
            throw new ChainReadException(e.getMessage(), e);
        }
    }

    private Web3j web3j(ChainSide chain) {
        Web3j web3j = clients.get(chain);
        if (web3j == null) {
            throw new IllegalStateException("Chain client is not initialized for " + chain);
        }
        return web3j;
    }

    private String name(ChainSide chain) {
        return props.chain(chain).displayName();
    }

    private static BigInteger valueOf(TransactionRequest tx) {
        return tx.getValue() == null ? BigInteger.ZERO : tx.getValue();
    }
}
