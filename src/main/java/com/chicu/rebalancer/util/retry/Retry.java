package com.chicu.rebalancer.util.retry;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Ограниченный повтор для идемпотентных чтений (ожидание receipt и т.п.).
 * Отправку транзакций через это НЕ прогоняем: повтор = двойной перевод.
 */
@Slf4j
public final class Retry {

    private Retry() {}

    public static <T> T call(String what, Callable<T> action, int attempts, Duration delay, Sleeper sleeper)
            throws Exception {
        if (attempts < 1) throw new IllegalArgumentException("attempts must be >= 1");
        Exception last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                last = e;
                if (attempt < attempts) {
                    log.warn("{} failed (attempt {}/{}): {}", what, attempt, attempts, e.getMessage());
                    sleeper.sleep(delay);
                }
            }
        }
        throw last;
    }
}
