package com.chicu.rebalancer.rebalance.service;

import com.chicu.rebalancer.chain.ChainSide;
import com.chicu.rebalancer.chain.model.ChainBalances;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.exception.PriceUnavailableException;
import com.chicu.rebalancer.price.PriceOracle;
import com.chicu.rebalancer.rebalance.model.Direction;
import com.chicu.rebalancer.rebalance.model.RebalancePlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Считает, нужен ли перевод, в какую сторону и сколько.
 * <p>
 * Балансы и пороги приводятся к USD по текущей цене. Если обе сети выше своих порогов,
 * перевода нет. Иначе переводится половина общего излишка над порогами; донор — сеть
 * с большим порогом в USD.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImbalanceCalculator {

    private final PriceOracle priceOracle;
    private final RebalancerProperties props;

    public Optional<RebalancePlan> calculate(ChainBalances balances) {
        RebalancerProperties.Chain a = props.getChainA();
        RebalancerProperties.Chain b = props.getChainB();

        BigDecimal priceA = price(a);
        BigDecimal priceB = price(b);

        BigDecimal balanceUsdA = units(balances.getChainA(), a.getTokenDecimals()).multiply(priceA);
        BigDecimal balanceUsdB = units(balances.getChainB(), b.getTokenDecimals()).multiply(priceB);
        BigDecimal thresholdUsdA = a.getThreshold().multiply(priceA);
        BigDecimal thresholdUsdB = b.getThreshold().multiply(priceB);

        log.info("💵 {}: {} USD (порог {}), {}: {} USD (порог {})",
                a.displayName(), balanceUsdA.toPlainString(), thresholdUsdA.toPlainString(),
                b.displayName(), balanceUsdB.toPlainString(), thresholdUsdB.toPlainString());

        if (balanceUsdA.compareTo(thresholdUsdA) > 0 && balanceUsdB.compareTo(thresholdUsdB) > 0) {
            log.info("Обе сети выше порога, перевод не нужен");
            return Optional.empty();
        }

        BigDecimal surplusUsd = balanceUsdA.add(balanceUsdB).subtract(thresholdUsdA).subtract(thresholdUsdB);
        BigDecimal moveUsd = surplusUsd.divide(BigDecimal.valueOf(2));

        ChainSide donor = donor(thresholdUsdA, thresholdUsdB, balanceUsdA, balanceUsdB);
        RebalancerProperties.Chain source = props.chain(donor);
        BigDecimal sourcePrice = donor == ChainSide.CHAIN_A ? priceA : priceB;

        // USD → минимальные единицы, округление вниз
        BigInteger amount = moveUsd.movePointRight(source.getTokenDecimals())
                .divide(sourcePrice, 0, RoundingMode.DOWN)
                .toBigInteger();

        if (amount.signum() <= 0) {
            log.warn("⚠️ Сумма перевода {} не положительна (излишек {} USD), пропускаем", amount, surplusUsd.toPlainString());
            return Optional.empty();
        }

        Direction direction = Direction.from(donor);
        log.info("📐 План: {} {} ({} USD)", direction, amount, moveUsd.toPlainString());

        return Optional.of(RebalancePlan.builder()
                .direction(direction)
                .tokenAddress(source.getTokenAddress())
                .tokenDecimals(source.getTokenDecimals())
                .amount(amount)
                .amountUsd(moveUsd)
                .sourceBalance(balances.get(donor))
                .destinationBalance(balances.get(donor.other()))
                .balanceUsdA(balanceUsdA)
                .balanceUsdB(balanceUsdB)
                .thresholdUsdA(thresholdUsdA)
                .thresholdUsdB(thresholdUsdB)
                .build());
    }

    /**
     * Больший порог в USD отдаёт. При равных порогах отдаёт более богатая сеть,
     * при полном равенстве — chain B.
     */
    static ChainSide donor(BigDecimal thresholdUsdA, BigDecimal thresholdUsdB,
                           BigDecimal balanceUsdA, BigDecimal balanceUsdB) {
        int byThreshold = thresholdUsdA.compareTo(thresholdUsdB);
        if (byThreshold != 0) {
            return byThreshold > 0 ? ChainSide.CHAIN_A : ChainSide.CHAIN_B;
        }
        return balanceUsdA.compareTo(balanceUsdB) > 0 ? ChainSide.CHAIN_A : ChainSide.CHAIN_B;
    }

    private BigDecimal price(RebalancerProperties.Chain chain) {
        BigDecimal price = priceOracle.getPrice(chain.getTokenAddress());
        if (price == null || price.signum() <= 0) {
            throw new PriceUnavailableException(chain.getTokenAddress());
        }
        return price;
    }

    private static BigDecimal units(BigInteger raw, int decimals) {
        return new BigDecimal(raw).movePointLeft(decimals);
    }
}
