package com.chicu.rebalancer.util.retry;

import java.time.Duration;

/**
 * Пауза между попытками. В проде {@link Thread#sleep}, в тестах подменяется фейковыми часами.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
