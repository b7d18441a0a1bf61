package com.chicu.rebalancer.config;

import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.util.retry.BackoffPolicy;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Настройки ребалансировщика: сети, кошелёк, пороги, интервалы.
 * Читаются из application.yml, секреты берутся из переменных окружения.
 */
@Component
@ConfigurationProperties(prefix = "rebalancer")
@Data
public class RebalancerProperties {

    public static final String NATIVE_ASSET = "0xEeeeeEeeeEeEeeEeEeEeeEEEeeeeEeeeeeeeEEeE";

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    /** Приватный ключ кошелька (один на обе сети), 0x… */
    private String privateKey;

    /** Пауза между проверками, мс */
    private long pollIntervalMs = 60_000L;

    /** Пауза после упавшей проверки, мс */
    private long errorDelayMs = 30_000L;

    /** Запускать цикл сразу после старта приложения */
    private boolean autostart = true;

    /** Минимальный нативный баланс (в целых монетах) на каждой сети для оплаты газа */
    private BigDecimal minGasBalance = new BigDecimal("0.001");

    /** Запас к оценке газа, проценты */
    private int gasLimitMarginPercent = 20;

    /** Сколько подтверждений ждать для промежуточных транзакций */
    private int receiptConfirmations = 1;

    private Chain chainA = new Chain();
    private Chain chainB = new Chain();

    private Monitor monitor = new Monitor();

    public Chain chain(ChainSide side) {
        return side == ChainSide.CHAIN_A ? chainA : chainB;
    }

    @PostConstruct
    public void validate() {
        if (privateKey == null || !privateKey.startsWith("0x")) {
            throw new IllegalStateException("rebalancer.private-key must start with 0x");
        }
        if (pollIntervalMs < 1000) {
            throw new IllegalStateException("rebalancer.poll-interval-ms must be at least 1000ms");
        }
        if (errorDelayMs < 0) {
            throw new IllegalStateException("rebalancer.error-delay-ms must be >= 0");
        }
        if (gasLimitMarginPercent < 0) {
            throw new IllegalStateException("rebalancer.gas-limit-margin-percent must be >= 0");
        }
        if (receiptConfirmations < 1) {
            throw new IllegalStateException("rebalancer.receipt-confirmations must be >= 1");
        }
        chainA.validate("chain-a");
        chainB.validate("chain-b");
        if (chainA.getChainId() == chainB.getChainId()) {
            throw new IllegalStateException("chain-a and chain-b must have different chain ids");
        }
        monitor.toBackoffPolicy();
    }

    @Data
    public static class Chain {
        /** Человеческое имя сети для уведомлений */
        private String name;
        private long chainId;
        private String rpcUrl;
        /** Адрес кошелька, чей баланс держим у порога */
        private String walletAddress;
        private String tokenAddress;
        private int tokenDecimals = 18;
        private String tokenSymbol;
        /** Порог в единицах токена; в USD пересчитывается по текущей цене */
        private BigDecimal threshold = BigDecimal.ZERO;
        /** Символ для CoinMarketCap, если поиск по адресу не работает (нативные активы) */
        private String priceSymbol;
        /** Нативный актив этой сети в нотации агрегатора, через него идёт обходной маршрут */
        private String intermediateAssetAddress = NATIVE_ASSET;

        void validate(String key) {
            String p = "rebalancer." + key;
            if (rpcUrl == null || rpcUrl.isBlank()) {
                throw new IllegalStateException(p + ".rpc-url is required");
            }
            if (walletAddress == null || !EVM_ADDRESS.matcher(walletAddress).matches()) {
                throw new IllegalStateException("Invalid " + p + ".wallet-address format");
            }
            if (tokenAddress == null || !tokenAddress.startsWith("0x")) {
                throw new IllegalStateException("Invalid " + p + ".token-address");
            }
            if (intermediateAssetAddress == null || !intermediateAssetAddress.startsWith("0x")) {
                throw new IllegalStateException("Invalid " + p + ".intermediate-asset-address");
            }
            if (tokenDecimals < 0 || tokenDecimals > 36) {
                throw new IllegalStateException(p + ".token-decimals must be within 0..36");
            }
            if (threshold == null || threshold.signum() < 0) {
                throw new IllegalStateException(p + ".threshold must be >= 0");
            }
            if (chainId <= 0) {
                throw new IllegalStateException(p + ".chain-id must be positive");
            }
        }

        public String displayName() {
            return name == null || name.isBlank() ? "chain " + chainId : name;
        }
    }

    /** Опрос статуса бриджа: 10s * 1.1^n, не больше 30s, плюс до 2s джиттера, 60 попыток. */
    @Data
    public static class Monitor {
        private long baseDelayMs = 10_000L;
        private double multiplier = 1.1;
        private long maxDelayMs = 30_000L;
        private long jitterMs = 2_000L;
        private int maxAttempts = 60;

        public BackoffPolicy toBackoffPolicy() {
            try {
                return BackoffPolicy.builder()
                        .baseDelay(Duration.ofMillis(baseDelayMs))
                        .multiplier(multiplier)
                        .maxDelay(Duration.ofMillis(maxDelayMs))
                        .jitter(Duration.ofMillis(jitterMs))
                        .maxAttempts(maxAttempts)
                        .build();
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid rebalancer.monitor settings: " + e.getMessage(), e);
            }
        }
    }
}
